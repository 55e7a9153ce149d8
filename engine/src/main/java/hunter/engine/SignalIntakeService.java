package hunter.engine;

import java.sql.SQLException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns signals into runs.
 *
 * <p>Below-threshold signals and signals without events are rejected. A signal
 * whose observation already produced a run is ignored, and a signal for an
 * account with an active run is folded into that run. {@link #onSignal(Signal)} is serialized so two signals
 * for the same account cannot both start a run in this process.
 */
public final class SignalIntakeService {
    private static final Logger log = LoggerFactory.getLogger(SignalIntakeService.class);

    private final WorkflowEngine<?> engine;
    private final int intentThreshold;
    private final Consumer<String> runStarted;

    public SignalIntakeService(WorkflowEngine<?> engine, int intentThreshold, Consumer<String> runStarted) {
        if (intentThreshold < 0 || intentThreshold > 100) {
            throw new IllegalArgumentException("intentThreshold must be within 0..100: " + intentThreshold);
        }
        this.engine = Objects.requireNonNull(engine, "engine");
        this.intentThreshold = intentThreshold;
        this.runStarted = Objects.requireNonNull(runStarted, "runStarted");
    }

    public int intentThreshold() {
        return intentThreshold;
    }

    public synchronized IntakeResult onSignal(Signal signal) throws SQLException {
        Objects.requireNonNull(signal, "signal");
        String accountId = signal.accountId();
        if (signal.intentScore() < intentThreshold) {
            log.debug("Signal below threshold. accountId={}, intentScore={}, threshold={}",
                    accountId, signal.intentScore(), intentThreshold);
            return IntakeResult.rejected(accountId,
                    "intent score " + signal.intentScore() + " below threshold " + intentThreshold);
        }
        if (signal.observedMetrics().isEmpty()) {
            // Without events there is no observation time to deduplicate on.
            log.debug("Signal without intent events. accountId={}", accountId);
            return IntakeResult.rejected(accountId, "no intent events observed");
        }

        Optional<WorkflowRunHeader> observed = engine.findObservedRun(accountId, signal.lastSeenMs());
        if (observed.isPresent()) {
            log.debug("Observation already handled. accountId={}, runId={}", accountId, observed.get().runId());
            return IntakeResult.alreadyProcessed(accountId, observed.get().runId());
        }

        Optional<WorkflowRunView> active = engine.findActiveRun(accountId);
        if (active.isPresent()) {
            log.info("Signal coalesced into active run. accountId={}, runId={}", accountId, active.get().runId());
            return IntakeResult.coalesced(accountId, active.get().runId());
        }

        WorkflowRunHeader header = engine.startRun(signal);
        runStarted.accept(header.runId());
        return IntakeResult.started(accountId, header.runId());
    }
}
