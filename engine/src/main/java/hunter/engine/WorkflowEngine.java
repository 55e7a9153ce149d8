package hunter.engine;

import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deterministic state machine of one workflow definition.
 *
 * <p>{@link #decide(RunHistory)} is a pure function of the run history: the
 * same records always produce the same {@link Decision}, which is what makes
 * recovery by replay possible. Time only enters through the timestamps already
 * stored in the records.
 */
public final class WorkflowEngine<K extends Enum<K> & StepKind> {
    private static final Logger log = LoggerFactory.getLogger(WorkflowEngine.class);

    private final WorkflowDefinition<K> definition;
    private final WorkflowHistory history;
    private final JsonCodec jsonCodec;
    private final Clock clock;

    public WorkflowEngine(WorkflowDefinition<K> definition, WorkflowHistory history, JsonCodec jsonCodec) {
        this(definition, history, jsonCodec, Clock.systemUTC());
    }

    public WorkflowEngine(WorkflowDefinition<K> definition, WorkflowHistory history, JsonCodec jsonCodec,
                          Clock clock) {
        this.definition = Objects.requireNonNull(definition, "definition");
        this.history = Objects.requireNonNull(history, "history");
        this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public WorkflowDefinition<K> definition() {
        return definition;
    }

    /**
     * Loads the history of {@code runId} and decides what happens next.
     *
     * @throws NoSuchElementException if the run does not exist
     */
    public Decision advance(String runId) throws SQLException {
        return decide(loadRun(runId));
    }

    public Decision decide(RunHistory run) {
        WorkflowRunHeader header = run.header();
        if (!definition.name().equals(header.workflowName())) {
            throw new IllegalStateException("Run " + header.runId() + " belongs to workflow "
                    + header.workflowName() + ", not " + definition.name());
        }

        Map<String, StepProgress> progress = fold(run.records());
        String input = header.signalJson();
        for (StepDefinition<K> step : definition.steps()) {
            StepProgress stepProgress = progress.get(step.stepName());
            if (stepProgress != null && stepProgress.succeeded != null) {
                input = stepProgress.succeeded.outputJson();
                continue;
            }
            if (stepProgress != null && stepProgress.last.status() == StepStatus.SCHEDULED) {
                return new Decision.AwaitInFlight(step.stepName(), stepProgress.last.attempt());
            }
            if (run.cancelRequested()) {
                String reason = run.cancellation().reason();
                return new Decision.Abandon(reason == null || reason.isBlank() ? "cancelled" : reason);
            }
            if (stepProgress == null) {
                return new Decision.ExecuteStep(step.stepName(), 1, input);
            }
            return afterFailure(header.runId(), step, stepProgress.last, input);
        }
        return new Decision.Complete(input);
    }

    public WorkflowRunView view(RunHistory run) {
        Decision decision = decide(run);
        Map<String, StepProgress> progress = fold(run.records());
        int cursor = 0;
        for (StepDefinition<K> step : definition.steps()) {
            StepProgress stepProgress = progress.get(step.stepName());
            if (stepProgress == null || stepProgress.succeeded == null) {
                break;
            }
            cursor++;
        }
        long updatedAt = run.header().createdAtMs();
        for (StepRecord record : run.records()) {
            updatedAt = Math.max(updatedAt, Math.max(record.startedAtMs(), record.endedAtMs()));
        }
        if (run.cancellation() != null) {
            updatedAt = Math.max(updatedAt, run.cancellation().requestedAtMs());
        }
        return new WorkflowRunView(run.runId(), run.header().accountId(), RunState.of(decision), cursor,
                decision, run.header().createdAtMs(), updatedAt);
    }

    public Optional<WorkflowRunView> view(String runId) throws SQLException {
        Optional<RunHistory> run = history.loadRun(runId);
        if (run.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(view(run.get()));
    }

    public List<WorkflowRunView> listRuns() throws SQLException {
        List<WorkflowRunView> views = new ArrayList<>();
        for (WorkflowRunHeader header : history.listRuns()) {
            if (definition.name().equals(header.workflowName())) {
                view(header.runId()).ifPresent(views::add);
            }
        }
        return views;
    }

    public List<WorkflowRunView> runsForAccount(String accountId) throws SQLException {
        List<WorkflowRunView> views = new ArrayList<>();
        for (WorkflowRunHeader header : history.listRunsForAccount(accountId)) {
            if (definition.name().equals(header.workflowName())) {
                view(header.runId()).ifPresent(views::add);
            }
        }
        return views;
    }

    public Optional<WorkflowRunView> findActiveRun(String accountId) throws SQLException {
        return runsForAccount(accountId).stream()
                .filter(run -> !run.isTerminal())
                .findFirst();
    }

    /** Finds the run, active or not, that was started for this exact observation. */
    public Optional<WorkflowRunHeader> findObservedRun(String accountId, long observedAtMs) throws SQLException {
        return history.listRunsForAccount(accountId).stream()
                .filter(header -> definition.name().equals(header.workflowName()))
                .filter(header -> header.observedAtMs() == observedAtMs)
                .findFirst();
    }

    /**
     * Creates a run for {@code signal}. Intake rules (threshold, coalescing)
     * are applied by {@link SignalIntakeService}, not here.
     */
    public WorkflowRunHeader startRun(Signal signal) throws SQLException {
        Objects.requireNonNull(signal, "signal");
        long now = clock.millis();
        WorkflowRunHeader header = new WorkflowRunHeader(
                newRunId(signal.accountId()),
                definition.name(),
                signal.accountId(),
                signal.lastSeenMs(),
                jsonCodec.toJson(signal),
                now);
        history.createRun(header);
        log.info("Workflow run created. runId={}, accountId={}, intentScore={}",
                header.runId(), signal.accountId(), signal.intentScore());
        return header;
    }

    /**
     * Requests cancellation. It takes effect at the next decision point; an
     * attempt already in flight runs to completion or timeout first.
     */
    public boolean cancel(String runId, String reason) throws SQLException {
        boolean recorded = history.requestCancel(runId, reason);
        if (recorded) {
            log.info("Cancellation requested. runId={}, reason={}", runId, reason);
        }
        return recorded;
    }

    private RunHistory loadRun(String runId) throws SQLException {
        return history.loadRun(runId)
                .orElseThrow(() -> new NoSuchElementException("Unknown run: " + runId));
    }

    private Decision afterFailure(String runId, StepDefinition<K> step, StepRecord failed, String input) {
        ErrorKind kind = failed.errorKind() == null ? ErrorKind.PERMANENT : failed.errorKind();
        RetryPolicy policy = step.retryPolicy();
        String message = failed.errorMessage() == null ? kind.name() : failed.errorMessage();

        if (!policy.isRetryable(kind)) {
            return new Decision.Fail(step.stepName(), kind,
                    "non-retryable " + kind.name().toLowerCase(Locale.ROOT) + " error: " + message,
                    failed.attempt());
        }
        if (failed.attempt() >= policy.maxAttempts()) {
            return new Decision.Fail(step.stepName(), kind,
                    "retries exhausted after " + failed.attempt() + " attempts: " + message,
                    failed.attempt());
        }
        long delay = policy.delayMs(failed.attempt(), jitterSeed(runId, step.stepName(), failed.attempt()));
        return new Decision.AwaitRetry(step.stepName(), failed.attempt() + 1, input, delay,
                failed.endedAtMs() + delay);
    }

    private static long jitterSeed(String runId, String stepName, int attempt) {
        return ((long) runId.hashCode() << 32) ^ (stepName.hashCode() * 31L + attempt);
    }

    private static Map<String, StepProgress> fold(List<StepRecord> records) {
        Map<String, StepProgress> progress = new HashMap<>();
        for (StepRecord record : records) {
            StepProgress stepProgress = progress.computeIfAbsent(record.stepName(), ignored -> new StepProgress());
            stepProgress.last = record;
            if (record.status() == StepStatus.SUCCEEDED) {
                stepProgress.succeeded = record;
            }
        }
        return progress;
    }

    private String newRunId(String accountId) {
        String safeAccount = accountId.replaceAll("[^A-Za-z0-9_-]", "_");
        return definition.name() + "-" + safeAccount + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private static final class StepProgress {
        private StepRecord last;
        private StepRecord succeeded;
    }
}
