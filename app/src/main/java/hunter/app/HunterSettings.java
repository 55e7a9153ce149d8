package hunter.app;

import hunter.engine.CrashConfig;
import hunter.engine.CrashPhase;
import hunter.engine.RetryPolicy;
import hunter.engine.SchedulerConfig;
import hunter.opportunity.OpportunitySettings;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Runtime configuration. Values come from {@code hunter.properties} on the
 * classpath, then {@code HUNTER_*} environment variables, then command-line
 * options; a later source wins.
 */
public final class HunterSettings {
    public static final Set<String> KEYS = Set.of(
            "db", "history", "data", "intent-threshold", "poll-interval-seconds", "channel",
            "max-concurrency", "tick-interval-ms", "analysis-timeout-seconds", "delivery-timeout-seconds",
            "max-attempts", "initial-backoff-ms", "analysis-max-backoff-ms", "delivery-max-backoff-ms",
            "backoff-multiplier", "crash-step", "crash-phase");

    private static final String RESOURCE = "hunter.properties";
    private static final Pattern STEP_PATTERN = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9._:-]{0,63}$");
    private static final Pattern CHANNEL_PATTERN = Pattern.compile("^#?[a-z0-9][a-z0-9._-]{0,79}$");
    private static final Set<String> ALLOWED_DB_EXTENSIONS = Set.of(".db", ".sqlite", ".sqlite3");

    private final Map<String, String> values;

    private HunterSettings(Map<String, String> values) {
        this.values = Map.copyOf(values);
    }

    public static HunterSettings load(Map<String, String> cliOptions) {
        return resolve(loadDefaults(), System.getenv(), cliOptions);
    }

    static HunterSettings resolve(Properties defaults, Map<String, String> env, Map<String, String> cliOptions) {
        Map<String, String> merged = new HashMap<>();
        for (String key : defaults.stringPropertyNames()) {
            if (KEYS.contains(key)) {
                merged.put(key, defaults.getProperty(key).trim());
            }
        }
        for (String key : KEYS) {
            String fromEnv = env.get(envName(key));
            if (fromEnv != null && !fromEnv.isBlank()) {
                merged.put(key, fromEnv.trim());
            }
        }
        for (Map.Entry<String, String> option : cliOptions.entrySet()) {
            if (KEYS.contains(option.getKey())) {
                merged.put(option.getKey(), option.getValue());
            }
        }
        return new HunterSettings(merged);
    }

    static Properties loadDefaults() {
        Properties properties = new Properties();
        try (InputStream in = HunterSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
        return properties;
    }

    static String envName(String key) {
        return "HUNTER_" + key.replace('-', '_').replace('.', '_').toUpperCase(Locale.ROOT);
    }

    public Path dbPath() {
        return resolveSafeDbPath(text("db", "hunter.db"));
    }

    public boolean inMemoryHistory() {
        String kind = text("history", "sqlite").toLowerCase(Locale.ROOT);
        return switch (kind) {
            case "sqlite" -> false;
            case "memory" -> true;
            default -> throw new IllegalArgumentException("history must be sqlite or memory, not " + kind);
        };
    }

    public Path dataPath() {
        String raw = text("data", "data/mock_hockeystack_data.json");
        try {
            return Path.of(raw);
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("Invalid data path format", e);
        }
    }

    public int intentThreshold() {
        return integer("intent-threshold", OpportunitySettings.DEFAULT_INTENT_THRESHOLD, 0, 100);
    }

    public Duration pollInterval() {
        return Duration.ofSeconds(integer("poll-interval-seconds", 30, 1, 86_400));
    }

    public String channel() {
        String channel = text("channel", OpportunitySettings.DEFAULT_CHANNEL);
        if (!CHANNEL_PATTERN.matcher(channel).matches()) {
            throw new IllegalArgumentException("Invalid format for channel");
        }
        return channel;
    }

    public int maxConcurrency() {
        return integer("max-concurrency", 4, 1, 64);
    }

    public Duration tickInterval() {
        return Duration.ofMillis(integer("tick-interval-ms", 250, 10, 60_000));
    }

    public Duration analysisTimeout() {
        return Duration.ofSeconds(integer("analysis-timeout-seconds", 300, 1, 3_600));
    }

    public Duration deliveryTimeout() {
        return Duration.ofSeconds(integer("delivery-timeout-seconds", 120, 1, 3_600));
    }

    public RetryPolicy analysisRetry() {
        return retryPolicy(integer("analysis-max-backoff-ms", 10_000, 0, 3_600_000));
    }

    public RetryPolicy deliveryRetry() {
        return retryPolicy(integer("delivery-max-backoff-ms", 5_000, 0, 3_600_000));
    }

    public CrashConfig crashConfig() {
        CrashPhase phase = CrashPhase.fromValue(text("crash-phase", CrashPhase.NONE.value()));
        String step = values.get("crash-step");
        if (step != null && !step.isBlank() && !STEP_PATTERN.matcher(step).matches()) {
            throw new IllegalArgumentException("Invalid format for crash-step");
        }
        return new CrashConfig(step == null || step.isBlank() ? null : step, phase);
    }

    public OpportunitySettings toOpportunitySettings() {
        SchedulerConfig scheduler = SchedulerConfig.defaults()
                .withMaxConcurrency(maxConcurrency())
                .withTickInterval(tickInterval())
                .withCrashConfig(crashConfig());
        return new OpportunitySettings(intentThreshold(), channel(), analysisRetry(), analysisTimeout(),
                deliveryRetry(), deliveryTimeout(), scheduler);
    }

    private RetryPolicy retryPolicy(int maxBackoffMs) {
        int initialBackoffMs = integer("initial-backoff-ms", 1_000, 0, 3_600_000);
        if (maxBackoffMs < initialBackoffMs) {
            throw new IllegalArgumentException("max backoff " + maxBackoffMs
                    + "ms is below initial-backoff-ms " + initialBackoffMs);
        }
        return new RetryPolicy(
                integer("max-attempts", 3, 1, 20),
                Duration.ofMillis(initialBackoffMs),
                decimal("backoff-multiplier", 2.0, 1.2, 10.0),
                Duration.ofMillis(maxBackoffMs),
                RetryPolicy.DEFAULT_RETRYABLE,
                0.2);
    }

    private String text(String key, String fallback) {
        String value = values.get(key);
        return value == null || value.isBlank() ? fallback : value;
    }

    private int integer(String key, int fallback, int min, int max) {
        String raw = values.get(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        int value;
        try {
            value = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, got '" + raw + "'", e);
        }
        if (value < min || value > max) {
            throw new IllegalArgumentException(key + " must be within " + min + ".." + max + ", got " + value);
        }
        return value;
    }

    private double decimal(String key, double fallback, double min, double max) {
        String raw = values.get(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        double value;
        try {
            value = Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number, got '" + raw + "'", e);
        }
        if (value < min || value > max) {
            throw new IllegalArgumentException(key + " must be within " + min + ".." + max + ", got " + value);
        }
        return value;
    }

    static Path resolveSafeDbPath(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            throw new IllegalArgumentException("db path must not be blank");
        }
        if (rawPath.length() > 255) {
            throw new IllegalArgumentException("db path exceeds max length");
        }
        if (App.containsControlChars(rawPath)) {
            throw new IllegalArgumentException("db path contains invalid characters");
        }

        Path baseDir = Path.of(System.getProperty("user.dir")).toAbsolutePath().normalize();
        Path candidate;
        try {
            candidate = Path.of(rawPath);
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("Invalid db path format", e);
        }

        Path resolved = candidate.isAbsolute()
                ? candidate.toAbsolutePath().normalize()
                : baseDir.resolve(candidate).normalize();

        String lowerName = resolved.getFileName().toString().toLowerCase(Locale.ROOT);
        boolean extensionAllowed = ALLOWED_DB_EXTENSIONS.stream().anyMatch(lowerName::endsWith);
        if (!extensionAllowed) {
            throw new IllegalArgumentException("db file must use .db, .sqlite, or .sqlite3 extension");
        }

        try {
            Path realBase = baseDir.toRealPath();
            Path parent = resolved.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path realParent = parent == null ? realBase : parent.toRealPath();
            if (!realParent.startsWith(realBase)) {
                throw new IllegalArgumentException("db path traversal is not allowed");
            }
        } catch (IOException e) {
            throw new IllegalArgumentException("Unable to prepare db directory", e);
        }
        return resolved;
    }
}
