package ebulter.hanabi.store.util;

/**
 * TimeProvider backed by the system clock
 */
public class SystemTimeProvider implements TimeProvider {
    @Override
    public long currentTimeMillis() {
        return System.currentTimeMillis();
    }
}
