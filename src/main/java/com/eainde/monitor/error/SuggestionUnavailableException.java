package com.eainde.monitor.error;

/**
 * The model provider failed or returned no usable answer.
 */
public class SuggestionUnavailableException extends RuntimeException {

    public SuggestionUnavailableException(String message) {
        super(message);
    }

    public SuggestionUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
