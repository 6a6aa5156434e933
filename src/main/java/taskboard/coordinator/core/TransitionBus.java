package taskboard.coordinator.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans transitions out to registered listeners. A failing listener is
 * logged and skipped; it cannot undo a persisted transition.
 */
public final class TransitionBus implements TransitionListener {

    private static final Logger log = LoggerFactory.getLogger(TransitionBus.class);

    private final CopyOnWriteArrayList<TransitionListener> listeners = new CopyOnWriteArrayList<>();

    public TransitionBus subscribe(TransitionListener listener) {
        listeners.add(listener);
        return this;
    }

    public void unsubscribe(TransitionListener listener) {
        listeners.remove(listener);
    }

    public List<TransitionListener> listeners() {
        return List.copyOf(listeners);
    }

    @Override
    public void onTransition(TransitionEvent event) {
        for (TransitionListener listener : listeners) {
            try {
                listener.onTransition(event);
            } catch (RuntimeException e) {
                log.warn("Transition listener failed for task {} ({} -> {})",
                        event.taskId(), event.oldStatus(), event.newStatus(), e);
            }
        }
    }
}
