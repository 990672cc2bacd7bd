package io.spiderq;

/**
 * Base of the engine's failures. Unchecked, like the rest of the runtime's error surface.
 */
public class SpiderqException extends RuntimeException {
    public SpiderqException(String message) {
        super(message);
    }

    public SpiderqException(String message, Throwable cause) {
        super(message, cause);
    }
}
