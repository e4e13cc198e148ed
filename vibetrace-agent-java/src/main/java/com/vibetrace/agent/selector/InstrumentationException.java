package com.vibetrace.agent.selector;

/**
 * A class could not be prepared for tracing: its source is missing, ambiguous, unreadable or
 * does not parse.
 */
public class InstrumentationException extends RuntimeException {

    public InstrumentationException(String message) {
        super(message);
    }

    public InstrumentationException(String message, Throwable cause) {
        super(message, cause);
    }
}
