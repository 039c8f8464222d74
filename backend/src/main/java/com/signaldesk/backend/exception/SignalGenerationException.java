package com.signaldesk.backend.exception;

public class SignalGenerationException extends RuntimeException {
    public SignalGenerationException(String message) {
        super(message);
    }

    public SignalGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
