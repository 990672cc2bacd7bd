package io.spiderq.worker;

import io.spiderq.SpiderqException;

public final class WorkerBusyException extends SpiderqException {
    public WorkerBusyException(String message) {
        super(message);
    }
}
