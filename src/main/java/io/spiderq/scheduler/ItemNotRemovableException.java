package io.spiderq.scheduler;

import io.spiderq.SpiderqException;

public final class ItemNotRemovableException extends SpiderqException {
    public ItemNotRemovableException(String message) {
        super(message);
    }
}
