package io.spiderq.worker;

import io.spiderq.SpiderqException;

public final class WorkerSpawnException extends SpiderqException {
    public WorkerSpawnException(String message, Throwable cause) {
        super(message, cause);
    }
}
