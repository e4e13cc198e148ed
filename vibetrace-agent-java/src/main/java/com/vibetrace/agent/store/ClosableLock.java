package com.vibetrace.agent.store;

import java.util.concurrent.locks.Lock;

/**
 * A {@link Lock} usable in try-with-resources.
 */
public class ClosableLock {

    private final Lock underlying;

    public ClosableLock(Lock underlying) {
        this.underlying = underlying;
    }

    public Held lock() {
        return new Held();
    }

    public final class Held implements AutoCloseable {

        private Held() {
            underlying.lock();
        }

        @Override
        public void close() {
            underlying.unlock();
        }
    }
}
