package io.subrelay.runtime;

/**
 * Request shape or agent reference rejected before anything is spawned.
 */
public final class RequestValidationException extends IllegalArgumentException {
    public RequestValidationException(String message) {
        super(message);
    }
}
