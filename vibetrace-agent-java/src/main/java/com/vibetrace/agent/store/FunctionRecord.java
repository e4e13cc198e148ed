package com.vibetrace.agent.store;

/** A stored {@code function} row. */
public record FunctionRecord(long id, FunctionDefinition definition) {}
