package hunter.opportunity;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLNonTransientException;
import java.sql.Statement;
import java.time.Clock;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Posts briefs to a channel through an idempotency ledger.
 *
 * <p>The first call for a key inserts the rendered message and logs the post;
 * later calls for the same key read the stored row back, so a retried or
 * replayed delivery posts nothing new and returns the original receipt.
 */
public final class LedgerDeliveryService implements DeliveryService {
    private static final Logger log = LoggerFactory.getLogger(LedgerDeliveryService.class);
    private static final int BUSY_RETRIES = 8;
    private static final long RETRY_BACKOFF_MS = 35L;

    private final String jdbcUrl;
    private final BriefFormatter formatter;
    private final Clock clock;

    public LedgerDeliveryService(Path dbPath, BriefFormatter formatter) {
        this(dbPath, formatter, Clock.systemUTC());
    }

    public LedgerDeliveryService(Path dbPath, BriefFormatter formatter, Clock clock) {
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        this.formatter = Objects.requireNonNull(formatter, "formatter");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void initialize() throws SQLException {
        withBusyRetry(() -> {
            try (Connection connection = openConnection(); Statement statement = connection.createStatement()) {
                statement.execute("""
                        CREATE TABLE IF NOT EXISTS delivery_ledger (
                            idempotency_key TEXT PRIMARY KEY,
                            delivery_id TEXT NOT NULL,
                            destination TEXT NOT NULL,
                            account_id TEXT NOT NULL,
                            company_name TEXT NOT NULL,
                            message_json TEXT NOT NULL,
                            delivered_at_ms INTEGER NOT NULL
                        )
                        """);
            }
            return null;
        });
    }

    @Override
    public DeliveryReceipt deliver(OpportunityBrief brief, String destination, String idempotencyKey)
            throws OpportunityServiceException {
        Objects.requireNonNull(brief, "brief");
        if (destination == null || destination.isBlank()) {
            throw new IllegalArgumentException("destination must not be blank");
        }
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("idempotencyKey must not be blank");
        }
        String message = formatter.channelMessage(brief, destination);
        String deliveryId = "MSG-" + shortHash(idempotencyKey);
        long now = clock.millis();
        try {
            return withBusyRetry(() -> {
                try (Connection connection = openConnection()) {
                    int inserted;
                    try (PreparedStatement insert = connection.prepareStatement("""
                            INSERT INTO delivery_ledger (
                                idempotency_key, delivery_id, destination, account_id,
                                company_name, message_json, delivered_at_ms
                            ) VALUES (?, ?, ?, ?, ?, ?, ?)
                            ON CONFLICT(idempotency_key) DO NOTHING
                            """)) {
                        insert.setString(1, idempotencyKey);
                        insert.setString(2, deliveryId);
                        insert.setString(3, destination);
                        insert.setString(4, brief.accountId());
                        insert.setString(5, brief.companyName());
                        insert.setString(6, message);
                        insert.setLong(7, now);
                        inserted = insert.executeUpdate();
                    }
                    DeliveryReceipt receipt = selectReceipt(connection, idempotencyKey);
                    if (inserted == 1) {
                        log.info("Opportunity brief posted. channel={}, company={}, deliveryId={}",
                                destination, brief.companyName(), receipt.deliveryId());
                    } else {
                        log.info("Opportunity brief already posted, returning original receipt. deliveryId={}",
                                receipt.deliveryId());
                    }
                    return receipt;
                }
            });
        } catch (SQLException e) {
            throw new OpportunityServiceException("Delivery ledger unavailable: " + e.getMessage(),
                    !(e instanceof SQLNonTransientException), e);
        }
    }

    /** Number of distinct posts made, whatever the number of calls. */
    public int postCount() throws SQLException {
        return withBusyRetry(() -> {
            try (Connection connection = openConnection();
                 Statement statement = connection.createStatement();
                 ResultSet rs = statement.executeQuery("SELECT COUNT(*) FROM delivery_ledger")) {
                rs.next();
                return rs.getInt(1);
            }
        });
    }

    private DeliveryReceipt selectReceipt(Connection connection, String idempotencyKey) throws SQLException {
        try (PreparedStatement select = connection.prepareStatement("""
                SELECT delivery_id, destination, company_name, delivered_at_ms
                FROM delivery_ledger
                WHERE idempotency_key = ?
                """)) {
            select.setString(1, idempotencyKey);
            try (ResultSet rs = select.executeQuery()) {
                if (!rs.next()) {
                    throw new SQLException("Delivery ledger row missing for key " + idempotencyKey);
                }
                return new DeliveryReceipt(
                        rs.getString("delivery_id"),
                        rs.getString("destination"),
                        rs.getString("company_name"),
                        rs.getLong("delivered_at_ms"));
            }
        }
    }

    private static String shortHash(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder builder = new StringBuilder();
            for (int i = 0; i < 6; i++) {
                builder.append(String.format("%02x", bytes[i]));
            }
            return builder.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private Connection openConnection() throws SQLException {
        Connection connection = DriverManager.getConnection(jdbcUrl);
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA journal_mode=WAL");
            statement.execute("PRAGMA synchronous=NORMAL");
            statement.execute("PRAGMA busy_timeout=5000");
        } catch (SQLException e) {
            try {
                connection.close();
            } catch (SQLException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
        return connection;
    }

    private <T> T withBusyRetry(SqlSupplier<T> supplier) throws SQLException {
        for (int attempt = 0; ; attempt++) {
            try {
                return supplier.run();
            } catch (SQLException e) {
                if (!isBusy(e) || attempt == BUSY_RETRIES) {
                    throw e;
                }
                sleep(RETRY_BACKOFF_MS * (attempt + 1));
            }
        }
    }

    private static boolean isBusy(SQLException e) {
        String message = e.getMessage();
        return e.getErrorCode() == 5
                || (message != null
                && (message.contains("SQLITE_BUSY") || message.contains("database is locked")));
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while retrying SQLite operation", interrupted);
        }
    }

    @FunctionalInterface
    private interface SqlSupplier<T> {
        T run() throws SQLException;
    }
}
