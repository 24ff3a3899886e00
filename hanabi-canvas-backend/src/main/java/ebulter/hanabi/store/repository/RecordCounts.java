package ebulter.hanabi.store.repository;

/**
 * Holds the latest counts pushed by the {@link RecordStore}, for readers such as HUD widgets
 */
public class RecordCounts implements RecordCountSink {
    private int artworkCount;
    private int activeRequestCount;

    @Override
    public void setArtworkCount(int artworkCount) {
        this.artworkCount = artworkCount;
    }

    @Override
    public void setActiveRequestCount(int activeRequestCount) {
        this.activeRequestCount = activeRequestCount;
    }

    public int getArtworkCount() {
        return artworkCount;
    }

    public int getActiveRequestCount() {
        return activeRequestCount;
    }
}
