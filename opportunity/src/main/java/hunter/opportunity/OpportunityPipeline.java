package hunter.opportunity;

import hunter.engine.ActivityExecutor;
import hunter.engine.DefaultErrorClassifier;
import hunter.engine.IntakePoller;
import hunter.engine.IntakeResult;
import hunter.engine.JsonCodec;
import hunter.engine.ObservabilitySink;
import hunter.engine.Scheduler;
import hunter.engine.Signal;
import hunter.engine.SignalIntake;
import hunter.engine.SignalIntakeService;
import hunter.engine.WorkflowEngine;
import hunter.engine.WorkflowHistory;
import hunter.engine.WorkflowRunView;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the opportunity workflow onto an engine, an activity executor and a
 * scheduler over one history. {@link #start()} resumes whatever the history
 * still has in flight before new signals are accepted.
 */
public final class OpportunityPipeline implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(OpportunityPipeline.class);

    private final WorkflowEngine<OpportunityStep> engine;
    private final ActivityExecutor<OpportunityStep> activityExecutor;
    private final Scheduler<OpportunityStep> scheduler;
    private final SignalIntakeService intakeService;

    public OpportunityPipeline(WorkflowHistory history,
                               AnalysisService analysis,
                               DeliveryService delivery,
                               ObservabilitySink sink,
                               OpportunitySettings settings,
                               JsonCodec jsonCodec,
                               Clock clock) {
        Objects.requireNonNull(history, "history");
        Objects.requireNonNull(settings, "settings");
        this.engine = new WorkflowEngine<>(OpportunityWorkflow.definition(settings), history, jsonCodec, clock);
        this.activityExecutor = new ActivityExecutor<>(OpportunityStep.class,
                OpportunityWorkflow.activities(analysis, delivery, settings.channel()),
                new DefaultErrorClassifier(), jsonCodec);
        this.scheduler = new Scheduler<>(engine, history, activityExecutor, sink, jsonCodec,
                settings.schedulerConfig(), clock);
        this.intakeService = new SignalIntakeService(engine, settings.intentThreshold(), scheduler::submit);
    }

    /** Resumes unfinished runs and starts dispatching. */
    public int start() throws SQLException {
        int resumed = scheduler.recover();
        scheduler.start();
        log.info("Opportunity pipeline started. resumedRuns={}", resumed);
        return resumed;
    }

    public IntakeResult onSignal(Signal signal) throws SQLException {
        return intakeService.onSignal(signal);
    }

    public IntakePoller poller(SignalIntake intake) {
        return new IntakePoller(intake, intakeService);
    }

    public boolean cancel(String runId, String reason) throws SQLException {
        return scheduler.cancel(runId, reason);
    }

    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        return scheduler.awaitIdle(timeout);
    }

    public List<WorkflowRunView> runs() throws SQLException {
        return engine.listRuns();
    }

    public Optional<WorkflowRunView> run(String runId) throws SQLException {
        return engine.view(runId);
    }

    public WorkflowEngine<OpportunityStep> engine() {
        return engine;
    }

    @Override
    public void close() {
        scheduler.close();
        activityExecutor.close();
    }
}
