package hunter.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

/**
 * Writes transitions to the log. Failed runs are logged with the
 * {@link #ALERT} marker so they can be routed to an operator-facing appender.
 */
public final class LoggingObservabilitySink implements ObservabilitySink {
    public static final Marker ALERT = MarkerFactory.getMarker("ALERT");

    private static final Logger log = LoggerFactory.getLogger(LoggingObservabilitySink.class);

    @Override
    public void recordAppended(StepRecord record) {
        switch (record.status()) {
            case SCHEDULED -> log.info("Step started. runId={}, step={}, attempt={}",
                    record.runId(), record.stepName(), record.attempt());
            case SUCCEEDED -> log.info("Step succeeded. runId={}, step={}, attempt={}, durationMs={}",
                    record.runId(), record.stepName(), record.attempt(), durationMs(record));
            case FAILED, TIMED_OUT -> log.warn(
                    "Step {}. runId={}, step={}, attempt={}, errorKind={}, error={}",
                    record.status() == StepStatus.FAILED ? "failed" : "timed out",
                    record.runId(), record.stepName(), record.attempt(), record.errorKind(),
                    record.errorMessage());
        }
    }

    @Override
    public void runTerminated(WorkflowRunView run, Decision decision) {
        if (decision instanceof Decision.Fail fail) {
            log.error(ALERT, "Opportunity brief NOT delivered. runId={}, accountId={}, step={}, errorKind={}, "
                            + "attempts={}, reason={}",
                    run.runId(), run.accountId(), fail.stepName(), fail.errorKind(), fail.attempts(),
                    fail.reason());
        } else if (decision instanceof Decision.Abandon abandon) {
            log.warn("Workflow run abandoned. runId={}, accountId={}, reason={}",
                    run.runId(), run.accountId(), abandon.reason());
        } else {
            log.info("Workflow run completed. runId={}, accountId={}, elapsedMs={}",
                    run.runId(), run.accountId(), run.updatedAtMs() - run.createdAtMs());
        }
    }

    private static long durationMs(StepRecord record) {
        return Math.max(0L, record.endedAtMs() - record.startedAtMs());
    }
}
