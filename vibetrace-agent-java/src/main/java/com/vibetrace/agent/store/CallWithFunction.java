package com.vibetrace.agent.store;

/** A call joined with the function it invoked. */
public record CallWithFunction(CallRecord call, FunctionRecord function) {}
