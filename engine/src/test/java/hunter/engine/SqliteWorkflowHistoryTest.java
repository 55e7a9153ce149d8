package hunter.engine;

import java.nio.file.Path;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SqliteWorkflowHistoryTest extends WorkflowHistoryContract {
    @TempDir
    Path tempDir;

    @Override
    protected WorkflowHistory newHistory() {
        return new SqliteWorkflowHistory(tempDir.resolve("history.db"));
    }

    @Test
    void historySurvivesReopen() throws Exception {
        history.createRun(header("run-1", "acme"));
        StepRecord scheduled = history.append(StepRecord.scheduled("run-1", "fetch", 1, "{\"in\":1}", 10L)).record();
        history.append(scheduled.succeeded("{\"out\":1}", 20L));
        history.requestCancel("run-1", "operator");

        WorkflowHistory reopened = new SqliteWorkflowHistory(tempDir.resolve("history.db"));
        reopened.initialize();
        RunHistory run = reopened.loadRun("run-1").orElseThrow();

        Assertions.assertEquals(header("run-1", "acme"), run.header());
        Assertions.assertEquals(history.load("run-1"), run.records());
        Assertions.assertEquals("{\"out\":1}", run.records().get(1).outputJson());
        Assertions.assertTrue(run.cancelRequested());
    }

    @Test
    void leaseIsSharedBetweenHandlesOnTheSameFile() throws Exception {
        history.createRun(header("run-1", "acme"));
        StepRecord scheduled = StepRecord.scheduled("run-1", "fetch", 1, "{}", 10L);
        history.append(scheduled, AttemptLease.forAttempt(scheduled, "worker-a", 100L));

        WorkflowHistory other = new SqliteWorkflowHistory(tempDir.resolve("history.db"));
        other.initialize();

        Assertions.assertEquals("worker-a", other.findLease("run-1", "fetch", 1).orElseThrow().owner());
        Assertions.assertFalse(other.renewLease(new AttemptLease("run-1", "fetch", 1, "worker-b", 900L)));
        Assertions.assertTrue(other.append(StepRecord.scheduled("run-1", "fetch", 2, "{}", 20L)).isConflict());
    }

    @Test
    void initializeIsIdempotent() throws Exception {
        history.createRun(header("run-1", "acme"));

        history.initialize();

        Assertions.assertTrue(history.findRun("run-1").isPresent());
    }
}
