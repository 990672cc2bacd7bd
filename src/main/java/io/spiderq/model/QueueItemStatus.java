package io.spiderq.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum QueueItemStatus {
    PENDING("pending"),
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String dbValue;

    QueueItemStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    @JsonValue
    public String dbValue() {
        return dbValue;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public static QueueItemStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Queue status cannot be empty");
        }
        for (QueueItemStatus value : values()) {
            if (value.dbValue.equalsIgnoreCase(raw.trim()) || value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown queue status: " + raw);
    }
}
