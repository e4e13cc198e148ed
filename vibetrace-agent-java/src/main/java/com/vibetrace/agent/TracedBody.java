package com.vibetrace.agent;

/**
 * The body of an explicitly wrapped call.
 *
 * @param <T> result type
 * @param <E> the checked exception the body may throw
 */
@FunctionalInterface
public interface TracedBody<T, E extends Throwable> {
    T call() throws E;
}
