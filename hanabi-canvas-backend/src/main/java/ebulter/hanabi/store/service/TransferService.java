package ebulter.hanabi.store.service;

import ebulter.hanabi.store.model.Artwork;
import ebulter.hanabi.store.model.TransferResult;
import ebulter.hanabi.store.persistence.JsonPersistence;
import ebulter.hanabi.store.repository.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Export and import of the artwork gallery as JSON text, as offered on the settings screen
 */
public class TransferService {
    private static final Logger logger = LoggerFactory.getLogger(TransferService.class);

    private final RecordStore recordStore;

    public TransferService(RecordStore recordStore) {
        this.recordStore = recordStore;
    }

    public TransferResult exportArtworks() {
        String json = JsonPersistence.exportAllArtworks(recordStore.getAllArtworks());
        int count = recordStore.getArtworkCount();
        logger.info("Exported {} artworks", count);
        return new TransferResult(true, count, "Exported " + count + " artworks", json);
    }

    /**
     * Replaces all artworks with the ones in the given JSON.
     * If nothing valid can be read the store is left untouched.
     */
    public TransferResult importArtworks(String json) {
        if (json == null || json.isBlank()) {
            return new TransferResult(false, 0, "Paste JSON data first");
        }

        List<Artwork> imported = JsonPersistence.importArtworks(json);
        if (imported.isEmpty()) {
            logger.warn("Import rejected, no valid artwork data found");
            return new TransferResult(false, 0, "Import failed: no valid artwork data found");
        }

        recordStore.setAllArtworks(imported);
        logger.info("Imported {} artworks", imported.size());
        return new TransferResult(true, imported.size(), "Imported " + imported.size() + " artworks");
    }
}
