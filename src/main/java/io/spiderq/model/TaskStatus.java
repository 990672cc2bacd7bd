package io.spiderq.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TaskStatus {
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed"),
    STOPPED("stopped"),
    WARNING("warning");

    private final String dbValue;

    TaskStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    @JsonValue
    public String dbValue() {
        return dbValue;
    }

    public boolean isTerminal() {
        return this != RUNNING;
    }

    /**
     * Whether a queue entry whose task ended in this status counts as completed.
     */
    public boolean isSuccessful() {
        return this == COMPLETED || this == WARNING;
    }

    public static TaskStatus fromDb(String raw) {
        for (TaskStatus value : values()) {
            if (value.dbValue.equalsIgnoreCase(raw) || value.name().equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown task status: " + raw);
    }
}
