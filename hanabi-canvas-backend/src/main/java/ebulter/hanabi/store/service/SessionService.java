package ebulter.hanabi.store.service;

import ebulter.hanabi.store.model.Artwork;
import ebulter.hanabi.store.model.ChallengeRequest;
import ebulter.hanabi.store.persistence.JsonPersistence;
import ebulter.hanabi.store.repository.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

/**
 * Saves the store's collections to the data directory and restores them on the next start.
 * Each collection lives in its own file so a missing or corrupt file only affects that collection.
 */
public class SessionService {
    private static final Logger logger = LoggerFactory.getLogger(SessionService.class);
    public static final String ARTWORKS_FILE = "artworks.json";
    public static final String REQUESTS_FILE = "requests.json";

    private final RecordStore recordStore;
    private final Path dataDirectory;

    public SessionService(RecordStore recordStore, Path dataDirectory) {
        this.recordStore = recordStore;
        this.dataDirectory = dataDirectory;
    }

    /**
     * Writes both collections. Returns true only if both files were written.
     */
    public boolean saveSession() {
        boolean artworksSaved = JsonPersistence.saveToFile(
                JsonPersistence.exportAllArtworks(recordStore.getAllArtworks()), getArtworksFile());
        boolean requestsSaved = JsonPersistence.saveToFile(
                JsonPersistence.exportAllRequests(recordStore.getAllRequests()), getRequestsFile());

        if (artworksSaved && requestsSaved) {
            logger.info("Saved session to {}: {} artworks, {} requests",
                    dataDirectory, recordStore.getArtworkCount(), recordStore.getRequestCount());
        } else {
            logger.warn("Session only partially saved to {} (artworks={}, requests={})",
                    dataDirectory, artworksSaved, requestsSaved);
        }
        return artworksSaved && requestsSaved;
    }

    /**
     * Restores every collection that has a save file. Collections without a file keep
     * their current contents, e.g. the predefined requests on a first start.
     */
    public void loadSession() {
        String artworksJson = JsonPersistence.loadFromFile(getArtworksFile());
        if (artworksJson != null) {
            List<Artwork> artworks = JsonPersistence.importArtworks(artworksJson);
            recordStore.setAllArtworks(artworks);
            logger.info("Restored {} artworks from {}", artworks.size(), getArtworksFile());
        }

        String requestsJson = JsonPersistence.loadFromFile(getRequestsFile());
        if (requestsJson != null) {
            List<ChallengeRequest> requests = JsonPersistence.importRequests(requestsJson);
            recordStore.setAllRequests(requests);
            logger.info("Restored {} requests from {}", requests.size(), getRequestsFile());
        }
    }

    public Path getArtworksFile() {
        return dataDirectory.resolve(ARTWORKS_FILE);
    }

    public Path getRequestsFile() {
        return dataDirectory.resolve(REQUESTS_FILE);
    }
}
