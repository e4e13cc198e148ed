package com.vibetrace.agent;

import java.lang.reflect.Executable;

/**
 * One frame of a thread's call stack: the in-flight invocation between entry and exit.
 *
 * Public so that woven advice in application classes can carry it from entry to exit.
 */
public final class ActiveCall {

    private final CallRecorder recorder;
    private final Executable executable;
    private final Long callId;
    private final Long parentCallId;
    private final long startNanos;

    ActiveCall(CallRecorder recorder, Executable executable, Long callId, Long parentCallId, long startNanos) {
        this.recorder = recorder;
        this.executable = executable;
        this.callId = callId;
        this.parentCallId = parentCallId;
        this.startNanos = startNanos;
    }

    public CallRecorder recorder() { return recorder; }

    /** The traced method or constructor. */
    public Executable executable() { return executable; }

    /** Id of the stored call row, or null when the row could not be written. */
    public Long callId() { return callId; }

    public Long parentCallId() { return parentCallId; }

    long startNanos() { return startNanos; }

    public boolean recorded() { return callId != null; }
}
