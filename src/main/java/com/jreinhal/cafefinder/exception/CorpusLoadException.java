package com.jreinhal.cafefinder.exception;

/**
 * A corpus source exists but could not be read or parsed.
 */
public class CorpusLoadException extends RuntimeException {

    public CorpusLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
