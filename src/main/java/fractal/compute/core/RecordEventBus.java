package fractal.compute.core;

import fractal.compute.model.RecordStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process notification sink for record status changes.
 * Notifications are published after the changing transaction has committed;
 * a failing listener never affects the caller or the other listeners.
 */
public final class RecordEventBus {

    private static final Logger log = LoggerFactory.getLogger(RecordEventBus.class);

    @FunctionalInterface
    public interface Listener {
        void onStatusChanged(long recordId, RecordStatus status);
    }

    private final CopyOnWriteArrayList<Listener> listeners = new CopyOnWriteArrayList<>();

    public void subscribe(Listener listener) {
        listeners.add(listener);
    }

    public void unsubscribe(Listener listener) {
        listeners.remove(listener);
    }

    public void notifyStatus(long recordId, RecordStatus status) {
        for (Listener listener : listeners) {
            try {
                listener.onStatusChanged(recordId, status);
            } catch (RuntimeException e) {
                log.warn("Record event listener failed for record {} ({})", recordId, status, e);
            }
        }
    }
}
