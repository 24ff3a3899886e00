package ebulter.hanabi.store.util;

/**
 * Source of the current time, so artwork timestamps can be controlled in tests
 */
public interface TimeProvider {
    /**
     * Returns the current time in milliseconds
     */
    long currentTimeMillis();

    /**
     * Returns the current Unix time in seconds, the unit used for artwork timestamps
     */
    default long currentEpochSeconds() {
        return currentTimeMillis() / 1000L;
    }
}
