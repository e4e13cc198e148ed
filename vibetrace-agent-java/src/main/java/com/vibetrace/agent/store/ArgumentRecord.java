package com.vibetrace.agent.store;

/** A stored {@code argument} row. */
public record ArgumentRecord(long id, long callId, String name, String value) {}
