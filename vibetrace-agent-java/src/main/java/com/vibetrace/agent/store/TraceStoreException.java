package com.vibetrace.agent.store;

/**
 * Raised when the trace store cannot be read or written.
 */
public class TraceStoreException extends RuntimeException {
    public TraceStoreException(String message) { super(message); }
    public TraceStoreException(String message, Throwable cause) { super(message, cause); }
}
