package com.vibetrace.agent.store;

/**
 * Everything known about a call before its body runs.
 *
 * @param parentCallId null for a root call
 * @param timestamp    start time in epoch seconds
 * @param className    null for plain functions
 */
public record CallStart(
    long functionId,
    Long parentCallId,
    double timestamp,
    long threadId,
    boolean coroutine,
    CallKind kind,
    String className
) {}
