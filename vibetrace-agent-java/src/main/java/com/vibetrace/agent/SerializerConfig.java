package com.vibetrace.agent;

/**
 * Configuration for ValueSerializer, sourced from the agent arguments.
 */
public class SerializerConfig {

    /** Stored values (arguments and return values) are cut to this many characters. */
    public static final int MAX_VALUE_LENGTH = 1000;

    /** Maximum nesting of arrays, collections and maps. Deeper values become a type placeholder. */
    public final int depthLimit;

    /** Maximum elements serialized per array, collection or map. */
    public final int maxCollectionElements;

    public SerializerConfig(int depthLimit, int maxCollectionElements) {
        this.depthLimit = depthLimit;
        this.maxCollectionElements = maxCollectionElements;
    }

    public static SerializerConfig defaults() {
        return new SerializerConfig(4, 100);
    }
}
