package io.spiderq.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum WorkerEventType {
    LOG("log"),
    PROGRESS("progress"),
    MEDIA("media"),
    DONE("done"),
    ERROR("error"),
    VALIDATION_RESULT("validation_result"),
    /** Synthetic: emitted by the bridge once the process is gone. Never accepted from the wire. */
    EXIT("exit");

    private final String wireValue;

    WorkerEventType(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public static Optional<WorkerEventType> fromWire(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        for (WorkerEventType value : values()) {
            if (value != EXIT && value.wireValue.equals(raw)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
