package com.vibetrace.agent.store;

/**
 * How a traced method was invoked, stored in the {@code method_type} column.
 */
public enum CallKind {
    FUNCTION("function"),
    INSTANCE_METHOD("instancemethod"),
    CLASS_METHOD("classmethod"),
    STATIC_METHOD("staticmethod");

    private final String storedName;

    CallKind(String storedName) {
        this.storedName = storedName;
    }

    public String storedName() {
        return storedName;
    }

    public static CallKind fromStoredName(String storedName) {
        for (CallKind kind : values()) {
            if (kind.storedName.equals(storedName)) return kind;
        }
        throw new IllegalArgumentException("Unknown method_type: " + storedName);
    }
}
