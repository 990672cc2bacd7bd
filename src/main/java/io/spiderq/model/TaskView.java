package io.spiderq.model;

import com.fasterxml.jackson.annotation.JsonRawValue;

public record TaskView(
        long id,
        String taskType,
        @JsonRawValue String params,
        TaskStatus status,
        long startedAtMs,
        Long completedAtMs,
        String errorMessage,
        int resultCount,
        @JsonRawValue String config
) {
}
