package taskboard.coordinator.core;

/**
 * Callback invoked synchronously after every persisted transition, before
 * the coordinator call returns. Implementations own their delivery
 * guarantees; the transition is already durable when they run.
 */
@FunctionalInterface
public interface TransitionListener {

    void onTransition(TransitionEvent event);

    /** Listener that ignores every event */
    static TransitionListener noop() {
        return event -> {
        };
    }
}
