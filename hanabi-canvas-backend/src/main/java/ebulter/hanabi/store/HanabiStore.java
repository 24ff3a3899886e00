package ebulter.hanabi.store;

import ebulter.hanabi.store.config.ChallengeConfig;
import ebulter.hanabi.store.config.ChallengeConfigLoader;
import ebulter.hanabi.store.config.StoreSettings;
import ebulter.hanabi.store.event.ChangeNotifier;
import ebulter.hanabi.store.repository.RecordCounts;
import ebulter.hanabi.store.repository.RecordStore;
import ebulter.hanabi.store.service.ArtworkService;
import ebulter.hanabi.store.service.LikeService;
import ebulter.hanabi.store.service.SessionService;
import ebulter.hanabi.store.service.TransferService;
import ebulter.hanabi.store.util.SystemTimeProvider;
import ebulter.hanabi.store.util.TimeProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the record store and its services together and restores the last saved session
 */
public class HanabiStore {
    private static final Logger logger = LoggerFactory.getLogger(HanabiStore.class);

    private final ChangeNotifier dataChanged = new ChangeNotifier("onDataChanged");
    private final ChangeNotifier artworkLiked = new ChangeNotifier("onArtworkLiked");
    private final RecordCounts recordCounts = new RecordCounts();

    private final ChallengeConfig challengeConfig;
    private final RecordStore recordStore;
    private final LikeService likeService;
    private final ArtworkService artworkService;
    private final TransferService transferService;
    private final SessionService sessionService;

    public HanabiStore() {
        this(StoreSettings.fromEnvironment(), new SystemTimeProvider());
    }

    public HanabiStore(StoreSettings settings, TimeProvider timeProvider) {
        this(settings, new ChallengeConfigLoader().load(settings.getChallengeConfigFile()), timeProvider);
    }

    public HanabiStore(StoreSettings settings, ChallengeConfig challengeConfig, TimeProvider timeProvider) {
        this.challengeConfig = challengeConfig;
        this.recordStore = new RecordStore(challengeConfig, recordCounts, dataChanged);
        this.likeService = new LikeService(recordStore, artworkLiked);
        this.artworkService = new ArtworkService(recordStore, timeProvider);
        this.transferService = new TransferService(recordStore);
        this.sessionService = new SessionService(recordStore, settings.getDataDirectory());

        sessionService.loadSession();
        logger.info("Record store ready: {} artworks, {} active requests",
                recordCounts.getArtworkCount(), recordCounts.getActiveRequestCount());
    }

    public boolean saveSession() {
        return sessionService.saveSession();
    }

    public ChallengeConfig getChallengeConfig() {
        return challengeConfig;
    }

    public RecordStore getRecordStore() {
        return recordStore;
    }

    public RecordCounts getRecordCounts() {
        return recordCounts;
    }

    public ChangeNotifier getDataChanged() {
        return dataChanged;
    }

    public ChangeNotifier getArtworkLiked() {
        return artworkLiked;
    }

    public LikeService getLikeService() {
        return likeService;
    }

    public ArtworkService getArtworkService() {
        return artworkService;
    }

    public TransferService getTransferService() {
        return transferService;
    }

    public SessionService getSessionService() {
        return sessionService;
    }

    public static void main(String[] args) {
        HanabiStore store = new HanabiStore();
        store.getRecordStore().getActiveRequests()
                .forEach(request -> logger.info("Active request {}: {}", request.getId(), request.getPrompt()));
        if (!store.saveSession()) {
            logger.error("Could not save session to {}", StoreSettings.fromEnvironment().getDataDirectory());
            System.exit(1);
        }
    }
}
