package hunter.opportunity;

import com.fasterxml.jackson.databind.ObjectMapper;
import hunter.engine.Decision;
import hunter.engine.InMemoryWorkflowHistory;
import hunter.engine.IntakeResult;
import hunter.engine.JsonCodec;
import hunter.engine.ObservabilitySink;
import hunter.engine.RetryPolicy;
import hunter.engine.RunState;
import hunter.engine.SchedulerConfig;
import hunter.engine.Signal;
import hunter.engine.SignalEvent;
import hunter.engine.SqliteWorkflowHistory;
import hunter.engine.StepRecord;
import hunter.engine.StepStatus;
import hunter.engine.WorkflowHistory;
import hunter.engine.WorkflowRunView;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class OpportunityPipelineTest {
    private static final Duration WAIT = Duration.ofSeconds(20);

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private final JsonCodec jsonCodec = new JsonCodec(mapper);
    private final TerminationSink sink = new TerminationSink();
    private final OpportunitySettings settings = OpportunitySettings.defaults()
            .withIntentThreshold(50)
            .withRetries(RetryPolicy.of(3, Duration.ofMillis(10), Duration.ofMillis(50)),
                    RetryPolicy.of(3, Duration.ofMillis(10), Duration.ofMillis(50)))
            .withSchedulerConfig(SchedulerConfig.defaults().withTickInterval(Duration.ofMillis(10)));

    private LedgerDeliveryService delivery;
    private PlaybookAnalysisService playbook;
    private OpportunityPipeline pipeline;

    @BeforeEach
    void setUp() throws Exception {
        BriefFormatter formatter = new BriefFormatter(mapper);
        delivery = new LedgerDeliveryService(tempDir.resolve("ledger.db"), formatter);
        delivery.initialize();
        playbook = new PlaybookAnalysisService(formatter);
    }

    @AfterEach
    void tearDown() {
        if (pipeline != null) {
            pipeline.close();
        }
    }

    @Test
    void qualifyingSignalEndsWithDeliveredBrief() throws Exception {
        InMemoryWorkflowHistory history = new InMemoryWorkflowHistory();
        pipeline = pipeline(history, playbook);
        pipeline.start();

        IntakeResult result = pipeline.onSignal(signal("acme", 85, 1_000L));

        Assertions.assertEquals(IntakeResult.Outcome.STARTED, result.outcome());
        Assertions.assertTrue(pipeline.awaitIdle(WAIT));
        WorkflowRunView run = pipeline.run(result.runId()).orElseThrow();
        Assertions.assertEquals(RunState.COMPLETED, run.state());
        Assertions.assertEquals(2, history.load(result.runId()).stream()
                .filter(record -> record.status() == StepStatus.SUCCEEDED)
                .count());
        Decision.Complete complete = Assertions.assertInstanceOf(Decision.Complete.class, run.nextDecision());
        DeliveryReceipt receipt = jsonCodec.fromJson(complete.resultJson(), DeliveryReceipt.class);
        Assertions.assertEquals("#gtm-opportunities", receipt.destination());
        Assertions.assertEquals(1, delivery.postCount());
    }

    @Test
    void belowThresholdSignalStartsNothing() throws Exception {
        InMemoryWorkflowHistory history = new InMemoryWorkflowHistory();
        pipeline = pipeline(history, playbook);
        pipeline.start();

        IntakeResult result = pipeline.onSignal(signal("acme", 30, 1_000L));

        Assertions.assertEquals(IntakeResult.Outcome.REJECTED, result.outcome());
        Assertions.assertTrue(pipeline.runs().isEmpty());
    }

    @Test
    void permanentAnalysisErrorFailsAfterOneAttempt() throws Exception {
        InMemoryWorkflowHistory history = new InMemoryWorkflowHistory();
        AtomicInteger calls = new AtomicInteger();
        pipeline = pipeline(history, account -> {
            calls.incrementAndGet();
            throw new OpportunityServiceException("account is blocklisted", false);
        });
        pipeline.start();

        String runId = pipeline.onSignal(signal("acme", 85, 1_000L)).runId();

        Assertions.assertTrue(pipeline.awaitIdle(WAIT));
        Assertions.assertEquals(1, calls.get());
        WorkflowRunView run = pipeline.run(runId).orElseThrow();
        Assertions.assertEquals(RunState.FAILED, run.state());
        Decision.Fail fail = Assertions.assertInstanceOf(Decision.Fail.class, run.nextDecision());
        Assertions.assertEquals(1, fail.attempts());
        Assertions.assertTrue(fail.reason().contains("account is blocklisted"), fail.reason());
        List<StepRecord> records = history.load(runId);
        Assertions.assertEquals(StepStatus.FAILED, records.get(records.size() - 1).status());
        Assertions.assertEquals(0, delivery.postCount());
        Assertions.assertInstanceOf(Decision.Fail.class, sink.decisions.get(0));
    }

    @Test
    void duplicateSignalIsCoalescedIntoActiveRun() throws Exception {
        InMemoryWorkflowHistory history = new InMemoryWorkflowHistory();
        pipeline = pipeline(history, playbook);

        IntakeResult first = pipeline.onSignal(signal("acme", 85, 1_000L));
        IntakeResult second = pipeline.onSignal(signal("acme", 95, 2_000L));
        pipeline.start();

        Assertions.assertEquals(IntakeResult.Outcome.COALESCED, second.outcome());
        Assertions.assertEquals(first.runId(), second.runId());
        Assertions.assertTrue(pipeline.awaitIdle(WAIT));
        Assertions.assertEquals(1, pipeline.runs().size());
        Assertions.assertEquals(1, delivery.postCount());
    }

    @Test
    void restartAfterCrashDuringDeliveryDoesNotPostTwice() throws Exception {
        Path historyDb = tempDir.resolve("history.db");
        WorkflowHistory history = new SqliteWorkflowHistory(historyDb);
        history.initialize();
        String runId;
        try (OpportunityPipeline crashed = pipeline(history, playbook)) {
            runId = crashed.onSignal(signal("acme", 85, 1_000L)).runId();
            // Analysis recorded, delivery posted but its outcome never recorded.
            OpportunityBrief brief = playbook.analyze(AccountContext.from(signal("acme", 85, 1_000L)));
            StepRecord analysis = history.append(StepRecord.scheduled(runId, "analyze-account", 1,
                    "{}", 1L)).record();
            history.append(analysis.succeeded(jsonCodec.toJson(brief), 2L));
            history.append(StepRecord.scheduled(runId, "deliver-brief", 1, jsonCodec.toJson(brief), 3L));
            delivery.deliver(brief, settings.channel(), runId);
        }

        WorkflowHistory reopened = new SqliteWorkflowHistory(historyDb);
        reopened.initialize();
        pipeline = pipeline(reopened, playbook);
        Assertions.assertEquals(1, pipeline.start());

        Assertions.assertTrue(pipeline.awaitIdle(WAIT));
        Assertions.assertEquals(RunState.COMPLETED, pipeline.run(runId).orElseThrow().state());
        Assertions.assertEquals(1, delivery.postCount());
        List<StepStatus> deliveryStatuses = reopened.load(runId).stream()
                .filter(record -> record.stepName().equals("deliver-brief"))
                .map(StepRecord::status)
                .toList();
        Assertions.assertEquals(List.of(StepStatus.SCHEDULED, StepStatus.TIMED_OUT,
                StepStatus.SCHEDULED, StepStatus.SUCCEEDED), deliveryStatuses);
    }

    @Test
    void cancelledRunIsAbandonedBeforeDelivery() throws Exception {
        InMemoryWorkflowHistory history = new InMemoryWorkflowHistory();
        CountDownLatch analyzing = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        pipeline = pipeline(history, account -> {
            analyzing.countDown();
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new OpportunityServiceException("interrupted", true, e);
            }
            return playbook.analyze(account);
        });
        pipeline.start();

        String runId = pipeline.onSignal(signal("acme", 85, 1_000L)).runId();
        Assertions.assertTrue(analyzing.await(10, TimeUnit.SECONDS));
        Assertions.assertTrue(pipeline.cancel(runId, "account churned"));
        release.countDown();

        Assertions.assertTrue(pipeline.awaitIdle(WAIT));
        Assertions.assertEquals(RunState.ABANDONED, pipeline.run(runId).orElseThrow().state());
        Assertions.assertEquals(0, delivery.postCount());
    }

    private OpportunityPipeline pipeline(WorkflowHistory history, AnalysisService analysis) {
        return new OpportunityPipeline(history, analysis, delivery, sink, settings, jsonCodec, Clock.systemUTC());
    }

    private static Signal signal(String accountId, int score, long lastSeenMs) {
        return new Signal(accountId,
                Map.of(Signal.COMPANY_NAME, "Acme Corp", Signal.INDUSTRY, "SaaS", Signal.EMPLOYEE_COUNT, "250"),
                List.of(new SignalEvent("pricing_page_visit", "VP Engineering", lastSeenMs)),
                score, lastSeenMs, lastSeenMs);
    }

    private static final class TerminationSink implements ObservabilitySink {
        private final List<Decision> decisions = new CopyOnWriteArrayList<>();

        @Override
        public void recordAppended(StepRecord record) {
        }

        @Override
        public void runTerminated(WorkflowRunView run, Decision decision) {
            decisions.add(decision);
        }
    }
}
