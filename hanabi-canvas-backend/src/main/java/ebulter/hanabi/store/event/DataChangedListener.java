package ebulter.hanabi.store.event;

/**
 * Callback invoked after the record data changed. Carries no payload,
 * listeners re-read whatever they need from the store.
 */
@FunctionalInterface
public interface DataChangedListener {
    void onDataChanged();
}
