package hunter.engine;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;
import org.sqlite.SQLiteOpenMode;

/**
 * {@link WorkflowHistory} on a SQLite file. The history tables are insert-only;
 * the expiry column of {@code attempt_leases} is the one value that is updated.
 * Appends run inside {@code BEGIN IMMEDIATE} so the conflict check and the
 * insert see the same snapshot, also across processes sharing the file.
 */
public final class SqliteWorkflowHistory implements WorkflowHistory {
    private static final Logger log = LoggerFactory.getLogger(SqliteWorkflowHistory.class);

    private static final int DEFAULT_BUSY_RETRIES = 8;
    private static final long DEFAULT_RETRY_BACKOFF_MS = 40L;
    private static final int SQLITE_BUSY_TIMEOUT_MS = 5_000;

    private static final String RECORD_COLUMNS = """
            run_id,
            seq,
            step_name,
            attempt,
            status,
            input_json,
            output_json,
            error_kind,
            error_message,
            started_at_ms,
            ended_at_ms
            """;

    private static final String RUN_COLUMNS = """
            run_id,
            workflow_name,
            account_id,
            observed_at_ms,
            signal_json,
            created_at_ms
            """;

    private final DataSource dataSource;
    private final int busyRetries;
    private final long retryBackoffMs;

    public SqliteWorkflowHistory(Path dbPath) {
        this("jdbc:sqlite:" + dbPath.toAbsolutePath(), DEFAULT_BUSY_RETRIES, DEFAULT_RETRY_BACKOFF_MS);
    }

    public SqliteWorkflowHistory(String jdbcUrl, int busyRetries, long retryBackoffMs) {
        this.dataSource = createDataSource(Objects.requireNonNull(jdbcUrl, "jdbcUrl"));
        this.busyRetries = busyRetries;
        this.retryBackoffMs = retryBackoffMs;
    }

    @Override
    public void initialize() throws SQLException {
        executeWithBusyRetry(() -> {
            try (Connection connection = openConnection(); Statement statement = connection.createStatement()) {
                statement.execute("""
                        CREATE TABLE IF NOT EXISTS workflow_runs (
                            run_id TEXT NOT NULL PRIMARY KEY,
                            workflow_name TEXT NOT NULL,
                            account_id TEXT NOT NULL,
                            observed_at_ms INTEGER NOT NULL,
                            signal_json TEXT NOT NULL,
                            created_at_ms INTEGER NOT NULL
                        ) WITHOUT ROWID
                        """);
                statement.execute("""
                        CREATE INDEX IF NOT EXISTS idx_workflow_runs_account
                        ON workflow_runs (account_id, created_at_ms)
                        """);
                statement.execute("""
                        CREATE TABLE IF NOT EXISTS step_records (
                            run_id TEXT NOT NULL,
                            seq INTEGER NOT NULL,
                            step_name TEXT NOT NULL,
                            attempt INTEGER NOT NULL,
                            status TEXT NOT NULL,
                            input_json TEXT,
                            output_json TEXT,
                            error_kind TEXT,
                            error_message TEXT,
                            started_at_ms INTEGER NOT NULL,
                            ended_at_ms INTEGER NOT NULL,
                            PRIMARY KEY (run_id, seq)
                        ) WITHOUT ROWID
                        """);
                statement.execute("""
                        CREATE INDEX IF NOT EXISTS idx_step_records_step
                        ON step_records (run_id, step_name, seq)
                        """);
                statement.execute("""
                        CREATE TABLE IF NOT EXISTS run_cancellations (
                            run_id TEXT NOT NULL PRIMARY KEY,
                            reason TEXT,
                            requested_at_ms INTEGER NOT NULL
                        ) WITHOUT ROWID
                        """);
                statement.execute("""
                        CREATE TABLE IF NOT EXISTS attempt_leases (
                            run_id TEXT NOT NULL,
                            step_name TEXT NOT NULL,
                            attempt INTEGER NOT NULL,
                            owner TEXT NOT NULL,
                            expires_at_ms INTEGER NOT NULL,
                            PRIMARY KEY (run_id, step_name, attempt)
                        ) WITHOUT ROWID
                        """);
            }
            return null;
        });
    }

    @Override
    public void createRun(WorkflowRunHeader header) throws SQLException {
        Objects.requireNonNull(header, "header");
        executeWithBusyRetry(() -> {
            try (Connection connection = openConnection()) {
                beginImmediate(connection);
                try {
                    if (selectRun(connection, header.runId()) != null) {
                        throw new IllegalArgumentException("Run already exists: " + header.runId());
                    }
                    try (PreparedStatement statement = connection.prepareStatement("""
                            INSERT INTO workflow_runs (
                                run_id,
                                workflow_name,
                                account_id,
                                observed_at_ms,
                                signal_json,
                                created_at_ms
                            ) VALUES (?, ?, ?, ?, ?, ?)
                            """)) {
                        statement.setString(1, header.runId());
                        statement.setString(2, header.workflowName());
                        statement.setString(3, header.accountId());
                        statement.setLong(4, header.observedAtMs());
                        statement.setString(5, header.signalJson());
                        statement.setLong(6, header.createdAtMs());
                        statement.executeUpdate();
                    }
                    commit(connection);
                } catch (SQLException | RuntimeException e) {
                    rollback(connection, e);
                    throw e;
                }
            }
            return null;
        });
    }

    @Override
    public Optional<WorkflowRunHeader> findRun(String runId) throws SQLException {
        return executeWithBusyRetry(() -> {
            try (Connection connection = openConnection()) {
                return Optional.ofNullable(selectRun(connection, runId));
            }
        });
    }

    @Override
    public List<WorkflowRunHeader> listRuns() throws SQLException {
        return executeWithBusyRetry(() -> {
            try (Connection connection = openConnection();
                 PreparedStatement statement = connection.prepareStatement(
                         "SELECT " + RUN_COLUMNS + " FROM workflow_runs ORDER BY created_at_ms, run_id")) {
                return mapRuns(statement);
            }
        });
    }

    @Override
    public List<WorkflowRunHeader> listRunsForAccount(String accountId) throws SQLException {
        return executeWithBusyRetry(() -> {
            try (Connection connection = openConnection();
                 PreparedStatement statement = connection.prepareStatement(
                         "SELECT " + RUN_COLUMNS + """
                                  FROM workflow_runs
                                 WHERE account_id = ?
                                 ORDER BY created_at_ms, run_id
                                """)) {
                statement.setString(1, accountId);
                return mapRuns(statement);
            }
        });
    }

    @Override
    public AppendResult append(StepRecord record, AttemptLease lease) throws SQLException {
        Objects.requireNonNull(record, "record");
        AppendRules.checkLease(record, lease);
        return executeWithBusyRetry(() -> {
            try (Connection connection = openConnection()) {
                beginImmediate(connection);
                try {
                    if (selectRun(connection, record.runId()) == null) {
                        commit(connection);
                        return AppendResult.conflict(record, "unknown run " + record.runId());
                    }
                    List<StepRecord> stepRecords = selectStepRecords(connection, record.runId(), record.stepName());
                    String conflict = AppendRules.conflictReason(stepRecords, record);
                    if (conflict != null) {
                        commit(connection);
                        log.debug("Append rejected. runId={}, step={}, reason={}",
                                record.runId(), record.stepName(), conflict);
                        return AppendResult.conflict(record, conflict);
                    }
                    StepRecord stored = record.withSequence(nextSequence(connection, record.runId()));
                    insertRecord(connection, stored);
                    if (lease != null) {
                        insertLease(connection, lease);
                    }
                    commit(connection);
                    return AppendResult.appended(stored);
                } catch (SQLException | RuntimeException e) {
                    rollback(connection, e);
                    throw e;
                }
            }
        });
    }

    @Override
    public List<StepRecord> load(String runId) throws SQLException {
        return executeWithBusyRetry(() -> {
            try (Connection connection = openConnection()) {
                return selectRecords(connection, runId);
            }
        });
    }

    @Override
    public boolean requestCancel(String runId, String reason) throws SQLException {
        return executeWithBusyRetry(() -> {
            try (Connection connection = openConnection()) {
                beginImmediate(connection);
                try {
                    if (selectRun(connection, runId) == null) {
                        throw new IllegalArgumentException("Unknown run: " + runId);
                    }
                    int changed;
                    try (PreparedStatement statement = connection.prepareStatement("""
                            INSERT INTO run_cancellations (run_id, reason, requested_at_ms)
                            VALUES (?, ?, ?)
                            ON CONFLICT(run_id) DO NOTHING
                            """)) {
                        statement.setString(1, runId);
                        statement.setString(2, reason);
                        statement.setLong(3, System.currentTimeMillis());
                        changed = statement.executeUpdate();
                    }
                    commit(connection);
                    return changed == 1;
                } catch (SQLException | RuntimeException e) {
                    rollback(connection, e);
                    throw e;
                }
            }
        });
    }

    @Override
    public Optional<RunHistory> loadRun(String runId) throws SQLException {
        return executeWithBusyRetry(() -> {
            try (Connection connection = openConnection()) {
                begin(connection);
                try {
                    WorkflowRunHeader header = selectRun(connection, runId);
                    if (header == null) {
                        commit(connection);
                        return Optional.<RunHistory>empty();
                    }
                    List<StepRecord> records = selectRecords(connection, runId);
                    Cancellation cancellation = selectCancellation(connection, runId);
                    commit(connection);
                    return Optional.of(new RunHistory(header, records, cancellation));
                } catch (SQLException | RuntimeException e) {
                    rollback(connection, e);
                    throw e;
                }
            }
        });
    }

    @Override
    public Optional<AttemptLease> findLease(String runId, String stepName, int attempt) throws SQLException {
        return executeWithBusyRetry(() -> {
            try (Connection connection = openConnection();
                 PreparedStatement statement = connection.prepareStatement("""
                         SELECT owner, expires_at_ms
                         FROM attempt_leases
                         WHERE run_id = ?
                           AND step_name = ?
                           AND attempt = ?
                         """)) {
                statement.setString(1, runId);
                statement.setString(2, stepName);
                statement.setInt(3, attempt);
                try (ResultSet rs = statement.executeQuery()) {
                    if (!rs.next()) {
                        return Optional.<AttemptLease>empty();
                    }
                    return Optional.of(new AttemptLease(runId, stepName, attempt,
                            rs.getString("owner"), rs.getLong("expires_at_ms")));
                }
            }
        });
    }

    @Override
    public boolean renewLease(AttemptLease renewed) throws SQLException {
        Objects.requireNonNull(renewed, "renewed");
        return executeWithBusyRetry(() -> {
            try (Connection connection = openConnection();
                 PreparedStatement statement = connection.prepareStatement("""
                         UPDATE attempt_leases
                         SET expires_at_ms = MAX(expires_at_ms, ?)
                         WHERE run_id = ?
                           AND step_name = ?
                           AND attempt = ?
                           AND owner = ?
                         """)) {
                statement.setLong(1, renewed.expiresAtMs());
                statement.setString(2, renewed.runId());
                statement.setString(3, renewed.stepName());
                statement.setInt(4, renewed.attempt());
                statement.setString(5, renewed.owner());
                return statement.executeUpdate() == 1;
            }
        });
    }

    private WorkflowRunHeader selectRun(Connection connection, String runId) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
                "SELECT " + RUN_COLUMNS + " FROM workflow_runs WHERE run_id = ?")) {
            statement.setString(1, runId);
            List<WorkflowRunHeader> runs = mapRuns(statement);
            return runs.isEmpty() ? null : runs.get(0);
        }
    }

    private List<WorkflowRunHeader> mapRuns(PreparedStatement statement) throws SQLException {
        List<WorkflowRunHeader> runs = new ArrayList<>();
        try (ResultSet rs = statement.executeQuery()) {
            while (rs.next()) {
                runs.add(new WorkflowRunHeader(
                        rs.getString("run_id"),
                        rs.getString("workflow_name"),
                        rs.getString("account_id"),
                        rs.getLong("observed_at_ms"),
                        rs.getString("signal_json"),
                        rs.getLong("created_at_ms")));
            }
        }
        return runs;
    }

    private List<StepRecord> selectRecords(Connection connection, String runId) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
                "SELECT " + RECORD_COLUMNS + " FROM step_records WHERE run_id = ? ORDER BY seq")) {
            statement.setString(1, runId);
            return mapRecords(statement);
        }
    }

    private List<StepRecord> selectStepRecords(Connection connection, String runId, String stepName)
            throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
                "SELECT " + RECORD_COLUMNS + """
                         FROM step_records
                        WHERE run_id = ?
                          AND step_name = ?
                        ORDER BY seq
                        """)) {
            statement.setString(1, runId);
            statement.setString(2, stepName);
            return mapRecords(statement);
        }
    }

    private long nextSequence(Connection connection, String runId) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
                "SELECT COALESCE(MAX(seq), 0) FROM step_records WHERE run_id = ?")) {
            statement.setString(1, runId);
            try (ResultSet rs = statement.executeQuery()) {
                rs.next();
                return rs.getLong(1) + 1;
            }
        }
    }

    private void insertRecord(Connection connection, StepRecord record) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
                "INSERT INTO step_records (" + RECORD_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
            statement.setString(1, record.runId());
            statement.setLong(2, record.sequence());
            statement.setString(3, record.stepName());
            statement.setInt(4, record.attempt());
            statement.setString(5, record.status().name());
            statement.setString(6, record.inputJson());
            statement.setString(7, record.outputJson());
            statement.setString(8, record.errorKind() == null ? null : record.errorKind().name());
            statement.setString(9, record.errorMessage());
            statement.setLong(10, record.startedAtMs());
            statement.setLong(11, record.endedAtMs());
            statement.executeUpdate();
        }
    }

    private void insertLease(Connection connection, AttemptLease lease) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("""
                INSERT INTO attempt_leases (run_id, step_name, attempt, owner, expires_at_ms)
                VALUES (?, ?, ?, ?, ?)
                """)) {
            statement.setString(1, lease.runId());
            statement.setString(2, lease.stepName());
            statement.setInt(3, lease.attempt());
            statement.setString(4, lease.owner());
            statement.setLong(5, lease.expiresAtMs());
            statement.executeUpdate();
        }
    }

    private Cancellation selectCancellation(Connection connection, String runId) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("""
                SELECT run_id, reason, requested_at_ms
                FROM run_cancellations
                WHERE run_id = ?
                """)) {
            statement.setString(1, runId);
            try (ResultSet rs = statement.executeQuery()) {
                if (!rs.next()) {
                    return null;
                }
                return new Cancellation(rs.getString("run_id"), rs.getString("reason"),
                        rs.getLong("requested_at_ms"));
            }
        }
    }

    private List<StepRecord> mapRecords(PreparedStatement statement) throws SQLException {
        List<StepRecord> records = new ArrayList<>();
        try (ResultSet rs = statement.executeQuery()) {
            while (rs.next()) {
                String errorKind = rs.getString("error_kind");
                records.add(new StepRecord(
                        rs.getString("run_id"),
                        rs.getLong("seq"),
                        rs.getString("step_name"),
                        rs.getInt("attempt"),
                        StepStatus.valueOf(rs.getString("status")),
                        rs.getString("input_json"),
                        rs.getString("output_json"),
                        errorKind == null ? null : ErrorKind.valueOf(errorKind),
                        rs.getString("error_message"),
                        rs.getLong("started_at_ms"),
                        rs.getLong("ended_at_ms")));
            }
        }
        return records;
    }

    private Connection openConnection() throws SQLException {
        return dataSource.getConnection();
    }

    private static void begin(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute("BEGIN");
        }
    }

    private static void beginImmediate(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute("BEGIN IMMEDIATE");
        }
    }

    private static void commit(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute("COMMIT");
        }
    }

    private static void rollback(Connection connection, Exception cause) {
        try (Statement statement = connection.createStatement()) {
            statement.execute("ROLLBACK");
        } catch (SQLException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
        }
    }

    private <T> T executeWithBusyRetry(SqlSupplier<T> supplier) throws SQLException {
        SQLException last = null;
        for (int attempt = 0; attempt <= busyRetries; attempt++) {
            try {
                return supplier.get();
            } catch (SQLException e) {
                if (!isBusy(e) || attempt == busyRetries) {
                    throw e;
                }
                last = e;
                log.debug("SQLite busy, retrying. attempt={}", attempt + 1);
                sleep(retryBackoffMs * (attempt + 1));
            }
        }
        throw last;
    }

    private boolean isBusy(SQLException e) {
        if (e instanceof SQLiteException sqliteException) {
            SQLiteErrorCode resultCode = sqliteException.getResultCode();
            if (resultCode == SQLiteErrorCode.SQLITE_BUSY || resultCode == SQLiteErrorCode.SQLITE_LOCKED) {
                return true;
            }
        }
        String message = e.getMessage();
        return e.getErrorCode() == 5
                || (message != null
                && (message.contains("SQLITE_BUSY")
                || message.contains("SQLITE_LOCKED")
                || message.contains("database is locked")));
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while retrying SQLite busy operation", interrupted);
        }
    }

    @FunctionalInterface
    private interface SqlSupplier<T> {
        T get() throws SQLException;
    }

    private static DataSource createDataSource(String jdbcUrl) {
        SQLiteConfig config = new SQLiteConfig();
        config.setOpenMode(SQLiteOpenMode.FULLMUTEX);
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        config.setBusyTimeout(SQLITE_BUSY_TIMEOUT_MS);

        SQLiteDataSource sqliteDataSource = new SQLiteDataSource(config);
        sqliteDataSource.setUrl(jdbcUrl);
        return sqliteDataSource;
    }
}
