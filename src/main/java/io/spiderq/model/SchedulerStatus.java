package io.spiderq.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SchedulerStatus {
    IDLE("idle"),
    RUNNING("running"),
    PAUSED("paused");

    private final String wireValue;

    SchedulerStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }
}
