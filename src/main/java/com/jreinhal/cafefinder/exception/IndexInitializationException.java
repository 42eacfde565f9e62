package com.jreinhal.cafefinder.exception;

public class IndexInitializationException extends RuntimeException {

    public IndexInitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
