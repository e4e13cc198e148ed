package com.vibetrace.agent.store;

/**
 * Identity and metadata of a traced method, as written to the {@code function} table.
 * The first four components form the deduplication key.
 */
public record FunctionDefinition(
    String module,
    String qualname,
    String filename,
    int lineno,
    String signature,
    String annotations,
    String defaults,
    String closureVars,
    String sourceCode
) {}
