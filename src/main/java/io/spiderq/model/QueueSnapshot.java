package io.spiderq.model;

/**
 * Payload of the status channel: scheduler state, the entry being executed and queue counts.
 */
public record QueueSnapshot(
        SchedulerStatus status,
        QueueItem currentItem,
        QueueStats stats
) {
}
