package com.vibetrace.agent.store;

import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link TraceStore} backed by a single SQLite database file.
 *
 * One JDBC connection is shared by all recording threads and guarded by a lock, so every
 * statement (and the read-then-insert of a function) runs atomically. The busy timeout keeps
 * a locked or unavailable database from stalling the traced program.
 */
public class SqliteTraceStore implements TraceStore {

    static final int BUSY_TIMEOUT_MILLIS = 2000;

    private static final String[] SCHEMA = {
        "CREATE TABLE IF NOT EXISTS function ("
            + " id           INTEGER PRIMARY KEY AUTOINCREMENT,"
            + " module       TEXT    NOT NULL,"
            + " qualname     TEXT    NOT NULL,"
            + " filename     TEXT    NOT NULL,"
            + " lineno       INTEGER NOT NULL,"
            + " signature    TEXT    NOT NULL,"
            + " annotations  TEXT,"
            + " defaults     TEXT,"
            + " closure_vars TEXT,"
            + " source_code  TEXT,"
            + " UNIQUE (module, qualname, filename, lineno))",
        "CREATE TABLE IF NOT EXISTS call ("
            + " id                INTEGER PRIMARY KEY AUTOINCREMENT,"
            + " function_id       INTEGER NOT NULL REFERENCES function (id),"
            + " parent_call_id    INTEGER REFERENCES call (id),"
            + " timestamp         REAL    NOT NULL,"
            + " duration_ms       REAL,"
            + " thread_id         INTEGER NOT NULL,"
            + " is_coroutine      INTEGER NOT NULL,"
            + " method_type       TEXT    NOT NULL,"
            + " class_name        TEXT,"
            + " return_value      TEXT,"
            + " exception_type    TEXT,"
            + " exception_message TEXT,"
            + " tb                TEXT)",
        "CREATE TABLE IF NOT EXISTS argument ("
            + " id      INTEGER PRIMARY KEY AUTOINCREMENT,"
            + " call_id INTEGER NOT NULL REFERENCES call (id),"
            + " name    TEXT    NOT NULL,"
            + " value   TEXT    NOT NULL)",
        "CREATE INDEX IF NOT EXISTS idx_call_parent ON call (parent_call_id)",
        "CREATE INDEX IF NOT EXISTS idx_argument_call ON argument (call_id)"
    };

    private static final String FUNCTION_COLUMNS =
        "f.id, f.module, f.qualname, f.filename, f.lineno, f.signature, "
            + "f.annotations, f.defaults, f.closure_vars, f.source_code";

    private static final String CALL_COLUMNS =
        "c.id, c.function_id, c.parent_call_id, c.timestamp, c.duration_ms, c.thread_id, "
            + "c.is_coroutine, c.method_type, c.class_name, c.return_value, "
            + "c.exception_type, c.exception_message, c.tb";
    private static final int CALL_COLUMN_COUNT = 13;

    private static final String ARGUMENT_COLUMNS = "a.id, a.call_id, a.name, a.value";

    private final Path databaseFile;
    private final Connection connection;
    private final ClosableLock lock = new ClosableLock(new ReentrantLock());
    private volatile boolean closed;

    public SqliteTraceStore(Path databaseFile) {
        this.databaseFile = databaseFile.toAbsolutePath();
        try {
            Path parent = this.databaseFile.getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (IOException e) {
            throw new TraceStoreException("Could not create directory for " + this.databaseFile, e);
        }

        SQLiteConfig config = new SQLiteConfig();
        config.setBusyTimeout(BUSY_TIMEOUT_MILLIS);
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.enforceForeignKeys(true);
        try {
            this.connection = config.createConnection("jdbc:sqlite:" + this.databaseFile);
            try (Statement statement = connection.createStatement()) {
                for (String ddl : SCHEMA) {
                    statement.execute(ddl);
                }
            }
        } catch (SQLException e) {
            throw new TraceStoreException("Could not open trace store " + this.databaseFile, e);
        }
    }

    public Path databaseFile() {
        return databaseFile;
    }

    // -----------------------------------------------------------------------
    // Writes
    // -----------------------------------------------------------------------

    @Override
    public long findOrCreateFunction(FunctionDefinition d) {
        try (ClosableLock.Held ignored = lock.lock()) {
            ensureOpen();
            try (PreparedStatement insert = connection.prepareStatement(
                    "INSERT OR IGNORE INTO function (module, qualname, filename, lineno, signature, "
                        + "annotations, defaults, closure_vars, source_code) "
                        + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
                insert.setString(1, d.module());
                insert.setString(2, d.qualname());
                insert.setString(3, d.filename());
                insert.setInt(4, d.lineno());
                insert.setString(5, d.signature());
                insert.setString(6, d.annotations());
                insert.setString(7, d.defaults());
                insert.setString(8, d.closureVars());
                insert.setString(9, d.sourceCode());
                insert.executeUpdate();
            }
            try (PreparedStatement select = connection.prepareStatement(
                    "SELECT id FROM function WHERE module = ? AND qualname = ? AND filename = ? AND lineno = ?")) {
                select.setString(1, d.module());
                select.setString(2, d.qualname());
                select.setString(3, d.filename());
                select.setInt(4, d.lineno());
                try (ResultSet rs = select.executeQuery()) {
                    if (!rs.next()) {
                        throw new TraceStoreException("Function row vanished after insert: " + d.qualname());
                    }
                    return rs.getLong(1);
                }
            }
        } catch (SQLException e) {
            throw new TraceStoreException("Could not register function " + d.qualname(), e);
        }
    }

    @Override
    public long insertCall(CallStart start) {
        try (ClosableLock.Held ignored = lock.lock()) {
            ensureOpen();
            try (PreparedStatement insert = connection.prepareStatement(
                    "INSERT INTO call (function_id, parent_call_id, timestamp, thread_id, is_coroutine, "
                        + "method_type, class_name) VALUES (?, ?, ?, ?, ?, ?, ?)")) {
                insert.setLong(1, start.functionId());
                setNullableLong(insert, 2, start.parentCallId());
                insert.setDouble(3, start.timestamp());
                insert.setLong(4, start.threadId());
                insert.setInt(5, start.coroutine() ? 1 : 0);
                insert.setString(6, start.kind().storedName());
                insert.setString(7, start.className());
                insert.executeUpdate();
            }
            return lastInsertId();
        } catch (SQLException e) {
            throw new TraceStoreException("Could not insert call of function " + start.functionId(), e);
        }
    }

    @Override
    public void insertArguments(long callId, Map<String, String> arguments) {
        if (arguments.isEmpty()) return;
        try (ClosableLock.Held ignored = lock.lock()) {
            ensureOpen();
            connection.setAutoCommit(false);
            try (PreparedStatement insert = connection.prepareStatement(
                    "INSERT INTO argument (call_id, name, value) VALUES (?, ?, ?)")) {
                for (Map.Entry<String, String> argument : arguments.entrySet()) {
                    insert.setLong(1, callId);
                    insert.setString(2, argument.getKey());
                    insert.setString(3, argument.getValue());
                    insert.addBatch();
                }
                insert.executeBatch();
                connection.commit();
            } catch (SQLException e) {
                connection.rollback();
                throw e;
            } finally {
                connection.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new TraceStoreException("Could not insert arguments of call " + callId, e);
        }
    }

    @Override
    public void completeCall(long callId, CallOutcome outcome) {
        int updated;
        try (ClosableLock.Held ignored = lock.lock()) {
            ensureOpen();
            try (PreparedStatement update = connection.prepareStatement(
                    "UPDATE call SET duration_ms = ?, return_value = ?, exception_type = ?, "
                        + "exception_message = ?, tb = ? WHERE id = ? AND duration_ms IS NULL")) {
                update.setDouble(1, outcome.durationMs());
                update.setString(2, outcome.returnValue());
                update.setString(3, outcome.exceptionType());
                update.setString(4, outcome.exceptionMessage());
                update.setString(5, outcome.traceback());
                update.setLong(6, callId);
                updated = update.executeUpdate();
            }
        } catch (SQLException e) {
            throw new TraceStoreException("Could not complete call " + callId, e);
        }
        if (updated == 0) {
            throw new TraceStoreException("Call " + callId + " does not exist or was already completed");
        }
    }

    // -----------------------------------------------------------------------
    // Reads
    // -----------------------------------------------------------------------

    @Override
    public List<FunctionRecord> listFunctions() {
        return query("SELECT " + FUNCTION_COLUMNS + " FROM function f ORDER BY f.id",
            rs -> readFunction(rs, 1));
    }

    @Override
    public List<CallRecord> listCalls() {
        return query("SELECT " + CALL_COLUMNS + " FROM call c ORDER BY c.id",
            rs -> readCall(rs, 1));
    }

    @Override
    public List<ArgumentRecord> listArguments() {
        return query("SELECT " + ARGUMENT_COLUMNS + " FROM argument a ORDER BY a.id",
            rs -> readArgument(rs, 1));
    }

    @Override
    public List<CallWithFunction> listCallsWithFunctions() {
        return query("SELECT " + CALL_COLUMNS + ", " + FUNCTION_COLUMNS
                + " FROM call c JOIN function f ON f.id = c.function_id ORDER BY c.id",
            rs -> new CallWithFunction(readCall(rs, 1), readFunction(rs, 1 + CALL_COLUMN_COUNT)));
    }

    @Override
    public List<ArgumentWithCall> listArgumentsWithCalls() {
        return query("SELECT " + ARGUMENT_COLUMNS + ", " + CALL_COLUMNS
                + " FROM argument a JOIN call c ON c.id = a.call_id ORDER BY a.id",
            rs -> new ArgumentWithCall(readArgument(rs, 1), readCall(rs, 5)));
    }

    @Override
    public List<CallRecord> listFailedCalls() {
        return query("SELECT " + CALL_COLUMNS + " FROM call c WHERE c.exception_type IS NOT NULL ORDER BY c.id",
            rs -> readCall(rs, 1));
    }

    @Override
    public List<CallRecord> childrenOf(long callId) {
        return query("SELECT " + CALL_COLUMNS + " FROM call c WHERE c.parent_call_id = " + callId
                + " ORDER BY c.timestamp, c.id",
            rs -> readCall(rs, 1));
    }

    @Override
    public void close() {
        try (ClosableLock.Held ignored = lock.lock()) {
            if (closed) return;
            closed = true;
            connection.close();
        } catch (SQLException e) {
            throw new TraceStoreException("Could not close trace store " + databaseFile, e);
        }
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    private interface RowReader<T> {
        T read(ResultSet rs) throws SQLException;
    }

    private <T> List<T> query(String sql, RowReader<T> reader) {
        try (ClosableLock.Held ignored = lock.lock()) {
            ensureOpen();
            List<T> rows = new ArrayList<>();
            try (Statement statement = connection.createStatement();
                 ResultSet rs = statement.executeQuery(sql)) {
                while (rs.next()) {
                    rows.add(reader.read(rs));
                }
            }
            return rows;
        } catch (SQLException e) {
            throw new TraceStoreException("Could not read trace store " + databaseFile, e);
        }
    }

    private long lastInsertId() throws SQLException {
        try (Statement statement = connection.createStatement();
             ResultSet rs = statement.executeQuery("SELECT last_insert_rowid()")) {
            rs.next();
            return rs.getLong(1);
        }
    }

    private void ensureOpen() {
        if (closed) throw new TraceStoreException("Trace store is closed: " + databaseFile);
    }

    private static FunctionRecord readFunction(ResultSet rs, int i) throws SQLException {
        return new FunctionRecord(
            rs.getLong(i),
            new FunctionDefinition(
                rs.getString(i + 1),
                rs.getString(i + 2),
                rs.getString(i + 3),
                rs.getInt(i + 4),
                rs.getString(i + 5),
                rs.getString(i + 6),
                rs.getString(i + 7),
                rs.getString(i + 8),
                rs.getString(i + 9)));
    }

    private static CallRecord readCall(ResultSet rs, int i) throws SQLException {
        return new CallRecord(
            rs.getLong(i),
            rs.getLong(i + 1),
            nullableLong(rs, i + 2),
            rs.getDouble(i + 3),
            nullableDouble(rs, i + 4),
            rs.getLong(i + 5),
            rs.getInt(i + 6) != 0,
            CallKind.fromStoredName(rs.getString(i + 7)),
            rs.getString(i + 8),
            rs.getString(i + 9),
            rs.getString(i + 10),
            rs.getString(i + 11),
            rs.getString(i + 12));
    }

    private static ArgumentRecord readArgument(ResultSet rs, int i) throws SQLException {
        return new ArgumentRecord(rs.getLong(i), rs.getLong(i + 1), rs.getString(i + 2), rs.getString(i + 3));
    }

    private static Long nullableLong(ResultSet rs, int i) throws SQLException {
        long value = rs.getLong(i);
        return rs.wasNull() ? null : value;
    }

    private static Double nullableDouble(ResultSet rs, int i) throws SQLException {
        double value = rs.getDouble(i);
        return rs.wasNull() ? null : value;
    }

    private static void setNullableLong(PreparedStatement statement, int i, Long value) throws SQLException {
        if (value == null) {
            statement.setNull(i, Types.INTEGER);
        } else {
            statement.setLong(i, value);
        }
    }
}
