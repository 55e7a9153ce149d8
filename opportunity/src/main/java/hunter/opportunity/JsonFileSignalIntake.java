package hunter.opportunity;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import hunter.engine.Signal;
import hunter.engine.SignalEvent;
import hunter.engine.SignalIntake;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads account signals from a JSON export: an array of accounts with
 * {@code account_id}, firmographics, {@code intent_score} and
 * {@code intent_signals}. Accounts flagged {@code processed} are skipped, and
 * an observation (account, latest event time) is returned only once while it
 * stays in the file. The file is never written.
 */
public final class JsonFileSignalIntake implements SignalIntake {
    private static final Logger log = LoggerFactory.getLogger(JsonFileSignalIntake.class);

    private final Path file;
    private final ObjectMapper mapper;
    private Set<String> emitted = new HashSet<>();

    public JsonFileSignalIntake(Path file, ObjectMapper mapper) {
        this.file = Objects.requireNonNull(file, "file");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public synchronized List<Signal> poll() throws IOException {
        if (!Files.exists(file)) {
            log.warn("Signal file not found, nothing to poll. path={}", file.toAbsolutePath());
            return List.of();
        }
        JsonNode root = mapper.readTree(file.toFile());
        if (root == null || !root.isArray()) {
            throw new IOException("Expected a JSON array of accounts in " + file);
        }

        List<Signal> signals = new ArrayList<>();
        Set<String> present = new HashSet<>();
        int skipped = 0;
        for (JsonNode account : root) {
            if (account.path("processed").asBoolean(false)) {
                continue;
            }
            Signal signal;
            try {
                signal = toSignal(account);
            } catch (IllegalArgumentException e) {
                skipped++;
                log.warn("Skipping malformed account entry in {}: {}", file.getFileName(), e.getMessage());
                continue;
            }
            String observation = signal.accountId() + "@" + signal.lastSeenMs();
            if (present.add(observation) && !emitted.contains(observation)) {
                signals.add(signal);
            }
        }
        emitted = present;
        log.debug("Polled signal file. path={}, accounts={}, new={}, skipped={}",
                file, root.size(), signals.size(), skipped);
        return signals;
    }

    static Signal toSignal(JsonNode account) {
        String accountId = account.path("account_id").asText(null);
        if (accountId == null || accountId.isBlank()) {
            throw new IllegalArgumentException("account_id is missing");
        }
        JsonNode score = account.path("intent_score");
        if (!score.canConvertToInt()) {
            throw new IllegalArgumentException("intent_score is missing or not an integer for " + accountId);
        }

        Map<String, String> attributes = new LinkedHashMap<>();
        putText(attributes, account, Signal.COMPANY_NAME);
        putText(attributes, account, Signal.INDUSTRY);
        putText(attributes, account, Signal.EMPLOYEE_COUNT);
        putText(attributes, account, Signal.REVENUE);

        List<SignalEvent> events = new ArrayList<>();
        long firstSeen = Long.MAX_VALUE;
        long lastSeen = Long.MIN_VALUE;
        for (JsonNode event : account.path("intent_signals")) {
            long occurredAt = parseTimestamp(event.path("timestamp"), accountId);
            events.add(new SignalEvent(event.path("type").asText("unknown"),
                    event.path("user_title").asText(null), occurredAt));
            firstSeen = Math.min(firstSeen, occurredAt);
            lastSeen = Math.max(lastSeen, occurredAt);
        }
        if (events.isEmpty()) {
            firstSeen = 0L;
            lastSeen = 0L;
        }
        return new Signal(accountId, attributes, events, score.asInt(), firstSeen, lastSeen);
    }

    private static void putText(Map<String, String> attributes, JsonNode account, String field) {
        JsonNode value = account.get(field);
        if (value != null && !value.isNull()) {
            attributes.put(field, value.asText());
        }
    }

    private static long parseTimestamp(JsonNode value, String accountId) {
        if (value.isNumber()) {
            return value.asLong();
        }
        String text = value.asText("");
        try {
            return Instant.parse(text).toEpochMilli();
        } catch (DateTimeParseException ignored) {
            // Exports without a zone are UTC.
        }
        try {
            return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC).toEpochMilli();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Bad signal timestamp '" + text + "' for " + accountId, e);
        }
    }
}
