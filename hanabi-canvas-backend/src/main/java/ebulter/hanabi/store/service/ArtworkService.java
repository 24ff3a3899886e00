package ebulter.hanabi.store.service;

import ebulter.hanabi.store.model.Artwork;
import ebulter.hanabi.store.model.ChallengeRequest;
import ebulter.hanabi.store.model.PixelEntry;
import ebulter.hanabi.store.repository.RecordStore;
import ebulter.hanabi.store.util.SystemTimeProvider;
import ebulter.hanabi.store.util.TimeProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Saves finished drawings as artworks, for Free Mode and Challenge Mode
 */
public class ArtworkService {
    private static final Logger logger = LoggerFactory.getLogger(ArtworkService.class);
    static final String DEFAULT_CHALLENGE_ARTWORK_NAME = "Challenge Artwork";

    private final RecordStore recordStore;
    private final TimeProvider timeProvider;
    private final Supplier<String> idGenerator;

    public ArtworkService(RecordStore recordStore) {
        this(recordStore, new SystemTimeProvider());
    }

    public ArtworkService(RecordStore recordStore, TimeProvider timeProvider) {
        this(recordStore, timeProvider, () -> UUID.randomUUID().toString());
    }

    public ArtworkService(RecordStore recordStore, TimeProvider timeProvider, Supplier<String> idGenerator) {
        this.recordStore = recordStore;
        this.timeProvider = timeProvider;
        this.idGenerator = idGenerator;
    }

    /**
     * Saves a Free Mode drawing as "Artwork N". An empty drawing is not saved.
     */
    public Optional<Artwork> saveArtwork(List<PixelEntry> pixels, int width, int height) {
        if (pixels == null || pixels.isEmpty()) {
            logger.debug("Nothing painted, artwork not saved");
            return Optional.empty();
        }

        String name = "Artwork " + (recordStore.getArtworkCount() + 1);
        Artwork artwork = createArtwork(name, pixels, width, height);
        recordStore.addArtwork(artwork);
        logger.info("Saved artwork {} ({}) with {} pixels", artwork.getId(), name, pixels.size());
        return Optional.of(artwork);
    }

    /**
     * Saves a Challenge Mode drawing named after the request prompt, then marks the request completed.
     * An empty drawing is not saved and leaves the request active.
     */
    public Optional<Artwork> saveChallengeArtwork(ChallengeRequest request, List<PixelEntry> pixels,
                                                  int width, int height) {
        if (pixels == null || pixels.isEmpty()) {
            logger.debug("Nothing painted, challenge artwork not saved");
            return Optional.empty();
        }

        String name = request != null && request.getPrompt() != null
                ? request.getPrompt() : DEFAULT_CHALLENGE_ARTWORK_NAME;
        Artwork artwork = createArtwork(name, pixels, width, height);
        recordStore.addArtwork(artwork);

        if (request != null && request.getId() != null) {
            boolean completed = recordStore.completeRequest(request.getId());
            logger.info("Saved challenge artwork {} for request {}, completed={}",
                    artwork.getId(), request.getId(), completed);
        }
        return Optional.of(artwork);
    }

    private Artwork createArtwork(String name, List<PixelEntry> pixels, int width, int height) {
        return new Artwork(idGenerator.get(), name, pixels, width, height, timeProvider.currentEpochSeconds());
    }
}
