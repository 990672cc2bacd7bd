package io.spiderq.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonRawValue;

public record QueueItem(
        long id,
        @JsonRawValue String taskConfig,
        int priority,
        QueueItemStatus status,
        long createdAtMs,
        Long startedAtMs,
        Long completedAtMs,
        Long taskId,
        String errorMessage
) {
    @JsonIgnore
    public JobDescription job() {
        return JobDescription.fromJson(taskConfig);
    }

    public QueueItem withStatus(QueueItemStatus next, Long boundTaskId) {
        return new QueueItem(id, taskConfig, priority, next, createdAtMs, startedAtMs, completedAtMs, boundTaskId, errorMessage);
    }
}
