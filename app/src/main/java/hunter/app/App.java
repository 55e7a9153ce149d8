package hunter.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import hunter.engine.AsyncObservabilitySink;
import hunter.engine.InMemoryWorkflowHistory;
import hunter.engine.IntakePoller;
import hunter.engine.IntakeResult;
import hunter.engine.JsonCodec;
import hunter.engine.LoggingObservabilitySink;
import hunter.engine.SqliteWorkflowHistory;
import hunter.engine.WorkflowHistory;
import hunter.engine.WorkflowRunView;
import hunter.opportunity.BriefFormatter;
import hunter.opportunity.JsonFileSignalIntake;
import hunter.opportunity.LedgerDeliveryService;
import hunter.opportunity.OpportunityPipeline;
import hunter.opportunity.OpportunitySettings;
import hunter.opportunity.PlaybookAnalysisService;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    private static final Pattern RUN_ID_PATTERN = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9_-]{1,127}$");
    private static final Set<String> FLAGS = Set.of("once", "status", "health-check", "help");
    private static final Set<String> MODE_OPTIONS = Set.of("cancel");
    private static final Duration ONCE_TIMEOUT = Duration.ofMinutes(30);

    private App() {
    }

    public static void main(String[] args) throws Exception {
        Map<String, String> argMap = parseArgs(args);
        if (argMap.containsKey("help")) {
            printUsage();
            return;
        }

        HunterSettings settings = HunterSettings.load(argMap);
        Path dbPath = settings.dbPath();
        OpportunitySettings opportunitySettings = settings.toOpportunitySettings();

        System.out.println("Database        : " + dbPath.getFileName());
        System.out.println("History         : " + (settings.inMemoryHistory() ? "memory" : "sqlite"));
        System.out.println("Signal file     : " + settings.dataPath());
        System.out.println("Intent threshold: " + opportunitySettings.intentThreshold());
        System.out.println("Channel         : " + opportunitySettings.channel());

        try {
            int exitCode = run(argMap, settings, dbPath, opportunitySettings);
            if (exitCode != 0) {
                System.exit(exitCode);
            }
        } catch (SQLException sqlException) {
            String state = sqlException.getSQLState() == null ? "n/a" : sqlException.getSQLState();
            System.err.printf(
                    "Database error (SQLState=%s, code=%d).%n",
                    state,
                    sqlException.getErrorCode());
            throw sqlException;
        }
    }

    private static int run(Map<String, String> argMap,
                           HunterSettings settings,
                           Path dbPath,
                           OpportunitySettings opportunitySettings) throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        JsonCodec jsonCodec = new JsonCodec(mapper);
        BriefFormatter formatter = new BriefFormatter(mapper);

        WorkflowHistory history = settings.inMemoryHistory()
                ? new InMemoryWorkflowHistory()
                : new SqliteWorkflowHistory(dbPath);
        LedgerDeliveryService delivery = new LedgerDeliveryService(dbPath, formatter);

        if (argMap.containsKey("health-check")) {
            return healthCheck(history, delivery, settings.dataPath());
        }

        history.initialize();
        delivery.initialize();

        try (AsyncObservabilitySink sink = new AsyncObservabilitySink(new LoggingObservabilitySink());
             OpportunityPipeline pipeline = new OpportunityPipeline(history, new PlaybookAnalysisService(formatter),
                     delivery, sink, opportunitySettings, jsonCodec, Clock.systemUTC())) {

            if (argMap.containsKey("status")) {
                printStatus(pipeline.runs());
                return 0;
            }
            if (argMap.containsKey("cancel")) {
                String runId = validateValue("cancel", argMap.get("cancel"), RUN_ID_PATTERN, 128);
                if (pipeline.run(runId).isEmpty()) {
                    System.err.println("Unknown run: " + runId);
                    return 2;
                }
                boolean recorded = pipeline.cancel(runId, "cancelled from command line");
                System.out.println(recorded ? "Cancellation recorded for " + runId
                        : "Cancellation was already requested for " + runId);
                return 0;
            }

            IntakePoller poller = pipeline.poller(new JsonFileSignalIntake(settings.dataPath(), mapper));
            pipeline.start();
            if (argMap.containsKey("once")) {
                return runOnce(pipeline, poller);
            }
            runContinuously(poller, settings.pollInterval());
            return 0;
        }
    }

    private static int runOnce(OpportunityPipeline pipeline, IntakePoller poller) throws Exception {
        List<IntakeResult> results = poller.pollOnce();
        for (IntakeResult result : results) {
            System.out.printf("%-18s %-24s %s%n", result.outcome(), result.accountId(),
                    result.runId() == null ? result.reason() : result.runId());
        }
        if (!pipeline.awaitIdle(ONCE_TIMEOUT)) {
            System.err.println("Runs still active after " + ONCE_TIMEOUT.toMinutes() + " minutes; they resume on next start.");
            return 1;
        }
        printStatus(pipeline.runs());
        return 0;
    }

    private static void runContinuously(IntakePoller poller, Duration pollInterval) throws InterruptedException {
        CountDownLatch stopped = new CountDownLatch(1);
        ScheduledExecutorService polling = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "signal-poller");
            thread.setDaemon(true);
            return thread;
        });
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested");
            stopped.countDown();
        }, "hunter-shutdown"));

        polling.scheduleWithFixedDelay(poller, 0L, pollInterval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Polling for signals every {}s. Press Ctrl+C to stop.", pollInterval.toSeconds());
        try {
            stopped.await();
        } finally {
            polling.shutdownNow();
        }
    }

    private static int healthCheck(WorkflowHistory history, LedgerDeliveryService delivery, Path dataPath) {
        boolean healthy = true;
        try {
            history.initialize();
            history.listRuns();
            System.out.println("history         : OK");
        } catch (SQLException e) {
            healthy = false;
            System.out.println("history         : FAILED (" + e.getMessage() + ")");
        }
        try {
            delivery.initialize();
            System.out.println("delivery ledger : OK (" + delivery.postCount() + " posts)");
        } catch (SQLException e) {
            healthy = false;
            System.out.println("delivery ledger : FAILED (" + e.getMessage() + ")");
        }
        if (Files.isReadable(dataPath)) {
            System.out.println("signal file     : OK");
        } else {
            healthy = false;
            System.out.println("signal file     : MISSING (" + dataPath + ")");
        }
        System.out.println(healthy ? "Health check passed." : "Health check failed.");
        return healthy ? 0 : 1;
    }

    private static void printStatus(List<WorkflowRunView> runs) {
        if (runs.isEmpty()) {
            System.out.println("No workflow runs recorded.");
            return;
        }
        System.out.printf("%-40s %-16s %-10s %-5s %s%n", "RUN", "ACCOUNT", "STATE", "STEP", "UPDATED");
        for (WorkflowRunView run : runs) {
            System.out.printf("%-40s %-16s %-10s %-5d %s%n", run.runId(), run.accountId(), run.state(),
                    run.stepCursor(), Instant.ofEpochMilli(run.updatedAtMs()));
        }
    }

    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> parsed = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("-h".equals(arg)) {
                parsed.put("help", "true");
                continue;
            }
            if (!arg.startsWith("--")) {
                throw new IllegalArgumentException("Unexpected argument: " + arg);
            }
            String key = arg.substring(2);
            if (parsed.containsKey(key)) {
                throw new IllegalArgumentException("Duplicate argument provided: " + arg);
            }
            if (FLAGS.contains(key)) {
                parsed.put(key, "true");
                continue;
            }
            if (!HunterSettings.KEYS.contains(key) && !MODE_OPTIONS.contains(key)) {
                throw new IllegalArgumentException("Unsupported argument: " + arg);
            }
            if (i + 1 >= args.length) {
                throw new IllegalArgumentException("Missing value for argument: " + arg);
            }

            String value = args[++i];
            if (value.length() > 512) {
                throw new IllegalArgumentException("Argument too long for " + arg);
            }
            if (containsControlChars(value)) {
                throw new IllegalArgumentException("Invalid control characters in " + arg);
            }
            parsed.put(key, value.trim());
        }
        return parsed;
    }

    static String validateValue(String fieldName, String value, Pattern pattern, int maxLength) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        if (value.length() > maxLength) {
            throw new IllegalArgumentException(fieldName + " exceeds max length " + maxLength);
        }
        if (!pattern.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid format for " + fieldName);
        }
        return value;
    }

    static boolean containsControlChars(String value) {
        for (int i = 0; i < value.length(); i++) {
            if (Character.isISOControl(value.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    private static void printUsage() {
        System.out.println("Usage:");
        System.out.println("  mvn -q -pl app exec:java -Dexec.args=\"[options]\"");
        System.out.println();
        System.out.println("Modes (default: poll continuously):");
        System.out.println("  --once                        Poll once, wait for started runs, print status");
        System.out.println("  --status                      Print every recorded run and exit");
        System.out.println("  --cancel <run-id>             Request cancellation of a run");
        System.out.println("  --health-check                Check history, ledger and signal file");
        System.out.println();
        System.out.println("Options (also hunter.properties or HUNTER_<KEY> environment variables):");
        System.out.println("  --db <sqlite.db>              SQLite path (default: hunter.db)");
        System.out.println("  --history <sqlite|memory>     Where run history is kept");
        System.out.println("  --data <file.json>            Account signal export to poll");
        System.out.println("  --intent-threshold <0-100>    Minimum intent score (default: 75)");
        System.out.println("  --poll-interval-seconds <n>   Seconds between polls (default: 30)");
        System.out.println("  --channel <#name>             Delivery channel (default: #gtm-opportunities)");
        System.out.println("  --max-concurrency <n>         Step attempts in flight at once (default: 4)");
        System.out.println("  --tick-interval-ms <n>        Scheduler tick (default: 250)");
        System.out.println("  --analysis-timeout-seconds <n>, --delivery-timeout-seconds <n>");
        System.out.println("  --max-attempts <n>, --initial-backoff-ms <n>, --backoff-multiplier <x>");
        System.out.println("  --analysis-max-backoff-ms <n>, --delivery-max-backoff-ms <n>");
        System.out.println("  --crash-step <step-id>        Optional step to crash at");
        System.out.println("  --crash-phase <phase>         none | before-execute | after-execute-before-commit | after-commit");
    }
}
