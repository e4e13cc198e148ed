package com.vibetrace.agent;

import com.vibetrace.agent.store.TraceStore;

import java.nio.file.Path;

/**
 * Closes the trace store on JVM shutdown so the database is left checkpointed and complete.
 * Registered via Runtime.getRuntime().addShutdownHook().
 */
public class ShutdownHook implements Runnable {

    private final TraceStore store;
    private final Path databaseFile;

    public ShutdownHook(TraceStore store, Path databaseFile) {
        this.store = store;
        this.databaseFile = databaseFile;
    }

    @Override
    public void run() {
        CallRecorder.uninstall();
        try {
            store.close();
            System.err.println("[vibetrace] trace written: " + databaseFile);
        } catch (RuntimeException e) {
            System.err.println("[vibetrace] ERROR closing trace store " + databaseFile + ": " + e.getMessage());
        }
    }
}
