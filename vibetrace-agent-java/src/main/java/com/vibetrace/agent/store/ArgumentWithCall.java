package com.vibetrace.agent.store;

/** An argument joined with the call it was bound to. */
public record ArgumentWithCall(ArgumentRecord argument, CallRecord call) {}
