package com.vibetrace.agent.store;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Provisions trace stores. Each traced run gets its own timestamped database file so that
 * runs can be compared side by side.
 */
public final class TraceStores {

    private static final DateTimeFormatter RUN_NAME = DateTimeFormatter.ofPattern("'run_'yyyyMMdd_HHmmss'.db'");

    private TraceStores() {}

    /** Opens (creating if needed) the store at an explicit path. */
    public static SqliteTraceStore open(Path databaseFile) {
        return new SqliteTraceStore(databaseFile);
    }

    /** Creates a fresh {@code run_yyyyMMdd_HHmmss.db} store inside {@code directory}. */
    public static SqliteTraceStore openRun(Path directory) {
        return open(runFile(directory, LocalDateTime.now()));
    }

    public static Path runFile(Path directory, LocalDateTime startedAt) {
        return directory.resolve(RUN_NAME.format(startedAt));
    }
}
