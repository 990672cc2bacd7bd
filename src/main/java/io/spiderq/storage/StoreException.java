package io.spiderq.storage;

import io.spiderq.SpiderqException;

/**
 * Storage I/O failure. Fatal for mutations; read paths that back passive display may degrade instead.
 */
public final class StoreException extends SpiderqException {
    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
