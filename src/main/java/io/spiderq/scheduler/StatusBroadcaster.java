package io.spiderq.scheduler;

import io.spiderq.model.QueueSnapshot;
import io.spiderq.model.WorkerEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans status out to registered listeners. A failing listener is logged and skipped so it can never stall the
 * scheduler.
 */
public final class StatusBroadcaster implements StatusChannel {
    private static final Logger log = LoggerFactory.getLogger(StatusBroadcaster.class);

    private final List<StatusChannel> listeners = new CopyOnWriteArrayList<>();
    private volatile QueueSnapshot latest;

    public void addListener(StatusChannel listener) {
        listeners.add(listener);
    }

    public void removeListener(StatusChannel listener) {
        listeners.remove(listener);
    }

    public QueueSnapshot latest() {
        return latest;
    }

    @Override
    public void publish(QueueSnapshot snapshot) {
        latest = snapshot;
        for (StatusChannel listener : listeners) {
            try {
                listener.publish(snapshot);
            } catch (RuntimeException e) {
                log.warn("Status listener failed on snapshot: {}", e.getMessage(), e);
            }
        }
    }

    @Override
    public void workerEvent(long taskId, WorkerEvent event) {
        for (StatusChannel listener : listeners) {
            try {
                listener.workerEvent(taskId, event);
            } catch (RuntimeException e) {
                log.warn("Status listener failed on {} event of task {}: {}",
                        event.type().wireValue(), taskId, e.getMessage(), e);
            }
        }
    }

    @Override
    public void credentialInvalid(long taskId, String message) {
        for (StatusChannel listener : listeners) {
            try {
                listener.credentialInvalid(taskId, message);
            } catch (RuntimeException e) {
                log.warn("Status listener failed on credential notice of task {}: {}", taskId, e.getMessage(), e);
            }
        }
    }
}
