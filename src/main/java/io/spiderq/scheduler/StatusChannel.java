package io.spiderq.scheduler;

import io.spiderq.model.QueueSnapshot;
import io.spiderq.model.WorkerEvent;

/**
 * Where the scheduler announces state. Delivery is best effort; a listener only cares about the latest snapshot.
 */
@FunctionalInterface
public interface StatusChannel {
    void publish(QueueSnapshot snapshot);

    /**
     * Every event of the running task, after it has been persisted.
     */
    default void workerEvent(long taskId, WorkerEvent event) {
    }

    /**
     * The credential of {@code taskId} failed re-validation after the worker reported an account anomaly.
     */
    default void credentialInvalid(long taskId, String message) {
    }

    static StatusChannel noop() {
        return snapshot -> {
        };
    }
}
