package com.eainde.monitor.error;

/**
 * Answered with 404. Also used when a feature is unavailable, so callers cannot
 * tell a disabled feature from a missing resource.
 */
public class ResourceDoesNotExistException extends RuntimeException {

    public ResourceDoesNotExistException(String message) {
        super(message);
    }
}
