package com.vibetrace.agent.store;

/**
 * A stored {@code call} row. {@code durationMs} stays null while the call is in flight.
 */
public record CallRecord(
    long id,
    long functionId,
    Long parentCallId,
    double timestamp,
    Double durationMs,
    long threadId,
    boolean coroutine,
    CallKind kind,
    String className,
    String returnValue,
    String exceptionType,
    String exceptionMessage,
    String traceback
) {

    public boolean isRoot() {
        return parentCallId == null;
    }

    public boolean isCompleted() {
        return durationMs != null;
    }
}
