package ebulter.hanabi.store;

import ebulter.hanabi.store.config.ChallengeConfig;
import ebulter.hanabi.store.config.StoreSettings;
import ebulter.hanabi.store.event.DataChangedListener;
import ebulter.hanabi.store.model.ChallengeRequest;
import ebulter.hanabi.store.model.PixelColor;
import ebulter.hanabi.store.model.PixelEntry;
import ebulter.hanabi.store.util.MockTimeProvider;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class HanabiStoreTest {

    @TempDir
    Path dataDirectory;

    @Mock
    DataChangedListener dataChangedListener;

    private static final List<PixelEntry> PIXELS = List.of(new PixelEntry(0, 0, new PixelColor(10, 20, 30, 255)));

    private HanabiStore newStore(ChallengeConfig config) {
        return new HanabiStore(new StoreSettings(dataDirectory, null), config, new MockTimeProvider(42_000L));
    }

    @Test
    public void firstStart_ShouldExposePredefinedRequestsAndCounts() {
        HanabiStore store = newStore(new ChallengeConfig(List.of(
                new ChallengeRequest("r1", "Draw a rocket", List.of()),
                new ChallengeRequest("r2", "Draw a moon", List.of()))));

        assertEquals(2, store.getRecordStore().getActiveRequests().size());
        assertEquals(2, store.getRecordCounts().getActiveRequestCount());
        assertEquals(0, store.getRecordCounts().getArtworkCount());
    }

    @Test
    public void savedSession_ShouldBeRestoredOnNextStart() {
        // Arrange
        HanabiStore first = newStore(new ChallengeConfig(List.of(new ChallengeRequest("r1", "Draw a rocket", List.of()))));
        first.getArtworkService().saveArtwork(PIXELS, 8, 8);
        String challengeArtworkId = first.getArtworkService()
                .saveChallengeArtwork(first.getRecordStore().getActiveRequests().get(0), PIXELS, 8, 8)
                .orElseThrow().getId();
        first.getLikeService().toggleLike(challengeArtworkId);
        assertTrue(first.saveSession());

        // Act
        HanabiStore second = newStore(new ChallengeConfig(List.of(new ChallengeRequest("r1", "Draw a rocket", List.of()))));

        // Assert
        assertEquals(2, second.getRecordStore().getArtworkCount());
        assertEquals(2, second.getRecordCounts().getArtworkCount());
        assertTrue(second.getLikeService().hasLiked(challengeArtworkId));
        assertTrue(second.getRecordStore().getActiveRequests().isEmpty());
        assertEquals(0, second.getRecordCounts().getActiveRequestCount());
        assertEquals(42L, second.getRecordStore().getAllArtworks().get(0).getCreatedTimestamp());
    }

    @Test
    public void likeService_ShouldRaiseBothNotifiers() {
        HanabiStore store = newStore(null);
        DataChangedListener likedListener = mock(DataChangedListener.class);
        store.getArtworkService().saveArtwork(PIXELS, 8, 8);
        String id = store.getRecordStore().getAllArtworks().get(0).getId();
        store.getDataChanged().register(dataChangedListener);
        store.getArtworkLiked().register(likedListener);

        store.getLikeService().toggleLike(id);

        verify(dataChangedListener).onDataChanged();
        verify(likedListener).onDataChanged();
    }

    @Test
    public void settingsConstructor_ShouldLoadBundledChallengeConfig() {
        HanabiStore store = new HanabiStore(new StoreSettings(dataDirectory, null), new MockTimeProvider());

        assertNotNull(store.getChallengeConfig());
        assertEquals(5, store.getRecordStore().getActiveRequests().size());
    }
}
