package com.vibetrace.agent.store;

import java.util.List;
import java.util.Map;

/**
 * Persistent record of the Functions, Calls and Arguments of one traced run.
 *
 * All operations throw {@link TraceStoreException} on storage failure. Implementations must be
 * safe for concurrent use by many recording threads.
 */
public interface TraceStore extends AutoCloseable {

    // -----------------------------------------------------------------------
    // Writes
    // -----------------------------------------------------------------------

    /**
     * Returns the id of the function with the same (module, qualname, filename, lineno) key,
     * inserting {@code definition} first if no such row exists. Atomic per key.
     */
    long findOrCreateFunction(FunctionDefinition definition);

    /** Inserts an in-flight call row and returns its id. */
    long insertCall(CallStart start);

    /** Inserts the bound arguments of a call, in iteration order. */
    void insertArguments(long callId, Map<String, String> arguments);

    /**
     * Records the outcome of a call.
     *
     * @throws TraceStoreException if the call does not exist or was already completed
     */
    void completeCall(long callId, CallOutcome outcome);

    // -----------------------------------------------------------------------
    // Reads
    // -----------------------------------------------------------------------

    List<FunctionRecord> listFunctions();

    List<CallRecord> listCalls();

    List<ArgumentRecord> listArguments();

    List<CallWithFunction> listCallsWithFunctions();

    List<ArgumentWithCall> listArgumentsWithCalls();

    /** Calls whose exception type is set. */
    List<CallRecord> listFailedCalls();

    /** Direct children of a call, ordered by timestamp. */
    List<CallRecord> childrenOf(long callId);

    @Override
    void close();
}
