package io.spiderq.model;

import com.fasterxml.jackson.annotation.JsonRawValue;

public record LogEntry(
        long id,
        long taskId,
        String type,
        String level,
        String message,
        long timestampMs,
        @JsonRawValue String metadata
) {
}
