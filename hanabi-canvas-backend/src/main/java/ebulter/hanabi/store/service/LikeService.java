package ebulter.hanabi.store.service;

import ebulter.hanabi.store.event.ChangeNotifier;
import ebulter.hanabi.store.repository.RecordStore;

/**
 * Like operations used by the gallery and slideshow screens.
 * Delegates to the {@link RecordStore} and raises the optional "artwork liked" notifier.
 */
public class LikeService {
    private final RecordStore recordStore;
    private final ChangeNotifier artworkLiked;

    public LikeService(RecordStore recordStore) {
        this(recordStore, null);
    }

    public LikeService(RecordStore recordStore, ChangeNotifier artworkLiked) {
        this.recordStore = recordStore;
        this.artworkLiked = artworkLiked;
    }

    /**
     * Toggles the like state of an artwork. Null or empty ids are ignored.
     */
    public void toggleLike(String artworkId) {
        if (artworkId == null || artworkId.isEmpty()) {
            return;
        }

        recordStore.toggleLike(artworkId);

        if (artworkLiked != null) {
            artworkLiked.raise();
        }
    }

    public boolean hasLiked(String artworkId) {
        if (artworkId == null || artworkId.isEmpty()) {
            return false;
        }
        return recordStore.hasLiked(artworkId);
    }
}
