package com.vibetrace.agent.store;

/**
 * Completion data written by the single update of a {@code call} row.
 * A call either returned (exception fields null) or raised (return value null).
 */
public record CallOutcome(
    double durationMs,
    String returnValue,
    String exceptionType,
    String exceptionMessage,
    String traceback
) {

    public static CallOutcome returned(double durationMs, String returnValue) {
        return new CallOutcome(durationMs, returnValue, null, null, null);
    }

    public static CallOutcome raised(double durationMs, String exceptionType,
                                     String exceptionMessage, String traceback) {
        return new CallOutcome(durationMs, null, exceptionType, exceptionMessage, traceback);
    }

    public boolean isException() {
        return exceptionType != null;
    }
}
