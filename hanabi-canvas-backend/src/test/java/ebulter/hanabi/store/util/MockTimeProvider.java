package ebulter.hanabi.store.util;

/**
 * Mock TimeProvider for unit tests, the clock only moves when told to
 */
public class MockTimeProvider implements TimeProvider {
    private long currentTime;

    public MockTimeProvider() {
        this(0);
    }

    public MockTimeProvider(long initialTime) {
        this.currentTime = initialTime;
    }

    @Override
    public long currentTimeMillis() {
        return currentTime;
    }

    /**
     * Advance time by the specified amount
     * @param millis time to advance in milliseconds
     */
    public void advanceTime(long millis) {
        currentTime += millis;
    }

    public void setCurrentTime(long time) {
        this.currentTime = time;
    }
}
