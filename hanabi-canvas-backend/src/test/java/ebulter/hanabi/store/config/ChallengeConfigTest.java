package ebulter.hanabi.store.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ChallengeConfigTest {

    @Test
    public void defaults_ShouldMatchBundledValues() {
        ChallengeConfig config = new ChallengeConfig();

        assertNull(config.getPredefinedRequests());
        assertEquals(3, config.getMaxActiveRequests());
        assertEquals(60f, config.getDefaultTimeLimit());
        assertEquals(4, config.getDefaultColorLimit());
    }

    @Test
    public void getMaxActiveRequests_OutOfRange_ShouldBeClamped() {
        ChallengeConfig config = new ChallengeConfig();

        config.setMaxActiveRequests(0);
        assertEquals(ChallengeConfig.MIN_MAX_ACTIVE_REQUESTS, config.getMaxActiveRequests());

        config.setMaxActiveRequests(11);
        assertEquals(ChallengeConfig.MAX_MAX_ACTIVE_REQUESTS, config.getMaxActiveRequests());

        config.setMaxActiveRequests(7);
        assertEquals(7, config.getMaxActiveRequests());
    }

    @Test
    public void getDefaultTimeLimit_BelowMinimum_ShouldBeClamped() {
        ChallengeConfig config = new ChallengeConfig();

        config.setDefaultTimeLimit(2.5f);
        assertEquals(ChallengeConfig.MIN_TIME_LIMIT, config.getDefaultTimeLimit());

        config.setDefaultTimeLimit(90f);
        assertEquals(90f, config.getDefaultTimeLimit());
    }

    @Test
    public void getDefaultColorLimit_BelowMinimum_ShouldBeClamped() {
        ChallengeConfig config = new ChallengeConfig();

        config.setDefaultColorLimit(-3);
        assertEquals(ChallengeConfig.MIN_COLOR_LIMIT, config.getDefaultColorLimit());

        config.setDefaultColorLimit(16);
        assertEquals(16, config.getDefaultColorLimit());
    }
}
