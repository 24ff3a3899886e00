package ebulter.hanabi.store.repository;

import ebulter.hanabi.store.config.ChallengeConfig;
import ebulter.hanabi.store.event.ChangeNotifier;
import ebulter.hanabi.store.model.Artwork;
import ebulter.hanabi.store.model.ChallengeRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory store for artworks and challenge requests.
 * <p>
 * Every mutation marks the active requests cache dirty, pushes the current counts
 * to the {@link RecordCountSink} and raises the data changed notifier once.
 * Lookups by id use a linear scan, so with duplicate ids the first match wins.
 * Not thread-safe: all calls are expected from a single thread.
 */
public class RecordStore {
    private static final Logger logger = LoggerFactory.getLogger(RecordStore.class);

    private final RecordCountSink countSink;
    private final ChangeNotifier dataChanged;

    private final List<Artwork> artworks = new ArrayList<>();
    private final List<ChallengeRequest> requests = new ArrayList<>();

    // Read-only views handed out to callers, backed by the live lists
    private final List<Artwork> artworksView = Collections.unmodifiableList(artworks);
    private final List<ChallengeRequest> requestsView = Collections.unmodifiableList(requests);

    // Replaced, never modified, on rebuild so lists held by callers stay stable
    private List<ChallengeRequest> activeRequestsCache = List.of();

    private boolean activeRequestsCacheDirty = true;

    public RecordStore(RecordCountSink countSink, ChangeNotifier dataChanged) {
        this(null, countSink, dataChanged);
    }

    /**
     * Creates the store and loads the predefined requests of the given config, if any.
     * The initial load updates the counts but does not raise the data changed notifier.
     */
    public RecordStore(ChallengeConfig challengeConfig, RecordCountSink countSink, ChangeNotifier dataChanged) {
        this.countSink = Objects.requireNonNull(countSink, "countSink");
        this.dataChanged = Objects.requireNonNull(dataChanged, "dataChanged");
        loadPredefinedRequests(challengeConfig);
    }

    // Artworks

    public void addArtwork(Artwork artwork) {
        artworks.add(Objects.requireNonNull(artwork, "artwork"));
        logger.debug("Added artwork {}, {} artworks stored", artwork.getId(), artworks.size());
        raiseDataChanged();
    }

    /**
     * Removes the first artwork with the given id. Returns true if one was removed.
     */
    public boolean removeArtwork(String id) {
        int index = indexOfArtwork(id);
        if (index < 0) {
            return false;
        }

        artworks.remove(index);
        logger.debug("Removed artwork {}", id);
        raiseDataChanged();
        return true;
    }

    public Optional<Artwork> getArtwork(String id) {
        int index = indexOfArtwork(id);
        return index < 0 ? Optional.empty() : Optional.of(artworks.get(index));
    }

    /**
     * Read-only view of all artworks in insertion order. The view reflects later mutations.
     */
    public List<Artwork> getAllArtworks() {
        return artworksView;
    }

    public int getArtworkCount() {
        return artworks.size();
    }

    // Likes

    public void toggleLike(String artworkId) {
        int index = indexOfArtwork(artworkId);
        if (index < 0) {
            logger.warn("ToggleLike: artwork '{}' not found", artworkId);
            return;
        }

        artworks.set(index, artworks.get(index).withLikeToggled());
        raiseDataChanged();
    }

    /**
     * Returns the like state of the artwork, or false when there is no artwork with that id
     */
    public boolean hasLiked(String artworkId) {
        int index = indexOfArtwork(artworkId);
        return index >= 0 && artworks.get(index).isLiked();
    }

    // Requests

    /**
     * Returns the uncompleted requests as a read-only snapshot. The snapshot is rebuilt only
     * after a mutation; between mutations the same instance is returned on every call.
     */
    public List<ChallengeRequest> getActiveRequests() {
        if (activeRequestsCacheDirty) {
            rebuildActiveRequestsCache();
        }
        return activeRequestsCache;
    }

    /**
     * Marks the first request with the given id as completed. Returns true if it was found.
     */
    public boolean completeRequest(String id) {
        for (int i = 0; i < requests.size(); i++) {
            if (Objects.equals(requests.get(i).getId(), id)) {
                requests.set(i, requests.get(i).withCompleted());
                logger.debug("Completed request {}", id);
                raiseDataChanged();
                return true;
            }
        }
        return false;
    }

    public List<ChallengeRequest> getAllRequests() {
        return requestsView;
    }

    public int getRequestCount() {
        return requests.size();
    }

    // Bulk operations

    /**
     * Replaces all artworks, a null collection clears them. Used by import.
     */
    public void setAllArtworks(Collection<Artwork> newArtworks) {
        List<Artwork> replacement = copyOf(newArtworks, "artwork");
        artworks.clear();
        artworks.addAll(replacement);
        logger.debug("Replaced artworks, {} artworks stored", artworks.size());
        raiseDataChanged();
    }

    /**
     * Replaces all requests, a null collection clears them. Used by import.
     */
    public void setAllRequests(Collection<ChallengeRequest> newRequests) {
        List<ChallengeRequest> replacement = copyOf(newRequests, "request");
        requests.clear();
        requests.addAll(replacement);
        logger.debug("Replaced requests, {} requests stored", requests.size());
        raiseDataChanged();
    }

    // Private methods

    private void loadPredefinedRequests(ChallengeConfig challengeConfig) {
        if (challengeConfig == null || challengeConfig.getPredefinedRequests() == null) {
            return;
        }

        for (ChallengeRequest request : challengeConfig.getPredefinedRequests()) {
            if (request != null) {
                requests.add(request);
            }
        }
        logger.info("Loaded {} predefined requests", requests.size());

        activeRequestsCacheDirty = true;
        updateCounts();
    }

    private void raiseDataChanged() {
        activeRequestsCacheDirty = true;
        updateCounts();
        dataChanged.raise();
    }

    private void updateCounts() {
        countSink.setArtworkCount(artworks.size());

        int activeCount = 0;
        for (ChallengeRequest request : requests) {
            if (!request.isCompleted()) {
                activeCount++;
            }
        }
        countSink.setActiveRequestCount(activeCount);
    }

    private void rebuildActiveRequestsCache() {
        List<ChallengeRequest> active = new ArrayList<>();
        for (ChallengeRequest request : requests) {
            if (!request.isCompleted()) {
                active.add(request);
            }
        }
        activeRequestsCache = List.copyOf(active);
        activeRequestsCacheDirty = false;
        logger.debug("Rebuilt active requests cache with {} requests", activeRequestsCache.size());
    }

    private int indexOfArtwork(String id) {
        for (int i = 0; i < artworks.size(); i++) {
            if (Objects.equals(artworks.get(i).getId(), id)) {
                return i;
            }
        }
        return -1;
    }

    // Validates the whole input before the live list is touched
    private static <T> List<T> copyOf(Collection<T> source, String kind) {
        List<T> copy = new ArrayList<>();
        if (source != null) {
            for (T item : source) {
                copy.add(Objects.requireNonNull(item, () -> "null " + kind + " in bulk replace"));
            }
        }
        return copy;
    }
}
