package com.github.dimitryivaniuta.subscription.reliability.exception;

/**
 * Non-retryable handling error: something is inconsistent (transport, quarantine capacity) and
 * retrying the same call blindly would not help. Never converted into a quarantine record.
 */
public class EventHandlingException extends RuntimeException {

    private final String source;

    public EventHandlingException(String source, String message) {
        super(message + " Source: " + source);
        this.source = source;
    }

    public EventHandlingException(String source, String message, Throwable cause) {
        super(message + " Source: " + source, cause);
        this.source = source;
    }

    /**
     * Topic or record position the error is about.
     */
    public String getSource() {
        return source;
    }
}
