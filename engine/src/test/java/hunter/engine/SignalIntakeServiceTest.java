package hunter.engine;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SignalIntakeServiceTest {
    private InMemoryWorkflowHistory history;
    private WorkflowEngine<TestStep> engine;
    private final List<String> started = new ArrayList<>();
    private SignalIntakeService intakeService;

    @BeforeEach
    void setUp() {
        history = new InMemoryWorkflowHistory();
        WorkflowDefinition<TestStep> definition = WorkflowDefinition.builder("test-flow", TestStep.class)
                .step(TestStep.FETCH, RetryPolicy.noRetry(), Duration.ofSeconds(1))
                .step(TestStep.PUBLISH, RetryPolicy.noRetry(), Duration.ofSeconds(1))
                .build();
        engine = new WorkflowEngine<>(definition, history, new JsonCodec());
        intakeService = new SignalIntakeService(engine, 50, started::add);
    }

    @Test
    void qualifyingSignalStartsRun() throws Exception {
        IntakeResult result = intakeService.onSignal(signal("acme", 85, 1_000L));

        Assertions.assertEquals(IntakeResult.Outcome.STARTED, result.outcome());
        Assertions.assertEquals(List.of(result.runId()), started);
        Assertions.assertEquals(1, history.listRuns().size());
    }

    @Test
    void belowThresholdIsRejected() throws Exception {
        IntakeResult result = intakeService.onSignal(signal("acme", 49, 1_000L));

        Assertions.assertEquals(IntakeResult.Outcome.REJECTED, result.outcome());
        Assertions.assertTrue(started.isEmpty());
        Assertions.assertTrue(history.listRuns().isEmpty());
    }

    @Test
    void signalWithoutEventsIsRejectedAndLaterEventsStillStartARun() throws Exception {
        Signal silent = new Signal("acme", Map.of(), List.of(), 85, 0L, 0L);

        IntakeResult first = intakeService.onSignal(silent);
        IntakeResult again = intakeService.onSignal(silent);
        IntakeResult withEvent = intakeService.onSignal(signal("acme", 85, 2_000L));

        Assertions.assertEquals(IntakeResult.Outcome.REJECTED, first.outcome());
        Assertions.assertEquals(IntakeResult.Outcome.REJECTED, again.outcome());
        Assertions.assertEquals(IntakeResult.Outcome.STARTED, withEvent.outcome());
        Assertions.assertEquals(1, history.listRuns().size());
    }

    @Test
    void thresholdIsInclusive() throws Exception {
        Assertions.assertTrue(intakeService.onSignal(signal("acme", 50, 1_000L)).started());
    }

    @Test
    void newSignalForActiveRunIsCoalesced() throws Exception {
        IntakeResult first = intakeService.onSignal(signal("acme", 85, 1_000L));

        IntakeResult second = intakeService.onSignal(signal("acme", 90, 2_000L));

        Assertions.assertEquals(IntakeResult.Outcome.COALESCED, second.outcome());
        Assertions.assertEquals(first.runId(), second.runId());
        Assertions.assertEquals(1, history.listRunsForAccount("acme").size());
    }

    @Test
    void sameObservationIsNotProcessedTwice() throws Exception {
        IntakeResult first = intakeService.onSignal(signal("acme", 85, 1_000L));
        completeRun(first.runId());

        IntakeResult repeat = intakeService.onSignal(signal("acme", 85, 1_000L));
        IntakeResult fresh = intakeService.onSignal(signal("acme", 85, 3_000L));

        Assertions.assertEquals(IntakeResult.Outcome.ALREADY_PROCESSED, repeat.outcome());
        Assertions.assertEquals(first.runId(), repeat.runId());
        Assertions.assertEquals(IntakeResult.Outcome.STARTED, fresh.outcome());
        Assertions.assertEquals(2, started.size());
    }

    @Test
    void pollerFeedsEverySignalThroughIntake() throws Exception {
        SignalIntake source = () -> List.of(signal("acme", 85, 1_000L), signal("globex", 10, 1_000L),
                signal("acme", 88, 1_500L));
        IntakePoller poller = new IntakePoller(source, intakeService);

        List<IntakeResult> results = poller.pollOnce();

        Assertions.assertEquals(List.of(IntakeResult.Outcome.STARTED, IntakeResult.Outcome.REJECTED,
                IntakeResult.Outcome.COALESCED), results.stream().map(IntakeResult::outcome).toList());
    }

    @Test
    void rejectsThresholdOutsideScoreRange() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new SignalIntakeService(engine, 101, started::add));
    }

    private void completeRun(String runId) throws Exception {
        for (String step : List.of("fetch", "publish")) {
            StepRecord scheduled = history.append(StepRecord.scheduled(runId, step, 1, "{}", 1L)).record();
            history.append(scheduled.succeeded("{}", 2L));
        }
        Assertions.assertEquals(RunState.COMPLETED, engine.view(runId).orElseThrow().state());
    }

    private static Signal signal(String accountId, int score, long lastSeenMs) {
        return new Signal(accountId, Map.of(), List.of(new SignalEvent("demo_request", "CTO", lastSeenMs)),
                score, 0L, lastSeenMs);
    }
}
