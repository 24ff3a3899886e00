package ebulter.hanabi.store.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Synchronous notification channel. Listeners are invoked in registration order,
 * inline on the caller's thread, before {@link #raise()} returns.
 * An exception thrown by a listener propagates to the caller of {@link #raise()}.
 */
public class ChangeNotifier {
    private static final Logger logger = LoggerFactory.getLogger(ChangeNotifier.class);

    private final String name;
    private final List<DataChangedListener> listeners = new ArrayList<>();

    public ChangeNotifier(String name) {
        this.name = name;
    }

    public void register(DataChangedListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Removes the first registration of the given listener. Returns false if it was not registered.
     */
    public boolean unregister(DataChangedListener listener) {
        return listeners.remove(listener);
    }

    public void raise() {
        logger.debug("Raising {} to {} listeners", name, listeners.size());
        // Snapshot so a listener can unregister itself while being notified
        for (DataChangedListener listener : List.copyOf(listeners)) {
            listener.onDataChanged();
        }
    }

    public int getListenerCount() {
        return listeners.size();
    }

    public String getName() {
        return name;
    }
}
