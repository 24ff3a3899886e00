package ebulter.hanabi.store.repository;

/**
 * Write-only targets for the counts derived from the record store.
 * The store pushes fresh values after every mutation.
 */
public interface RecordCountSink {
    void setArtworkCount(int artworkCount);

    void setActiveRequestCount(int activeRequestCount);
}
