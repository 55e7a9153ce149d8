package hunter.engine;

import java.util.Objects;

public record StepRecord(
        String runId,
        long sequence,
        String stepName,
        int attempt,
        StepStatus status,
        String inputJson,
        String outputJson,
        ErrorKind errorKind,
        String errorMessage,
        long startedAtMs,
        long endedAtMs) {

    public StepRecord {
        Objects.requireNonNull(runId, "runId");
        Objects.requireNonNull(stepName, "stepName");
        Objects.requireNonNull(status, "status");
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1 but was " + attempt);
        }
    }

    public static StepRecord scheduled(String runId, String stepName, int attempt, String inputJson, long nowMs) {
        return new StepRecord(runId, 0L, stepName, attempt, StepStatus.SCHEDULED,
                inputJson, null, null, null, nowMs, 0L);
    }

    public StepRecord succeeded(String outputJson, long nowMs) {
        return outcome(StepStatus.SUCCEEDED, outputJson, null, null, nowMs);
    }

    public StepRecord failed(ErrorKind kind, String message, long nowMs) {
        return outcome(StepStatus.FAILED, null, Objects.requireNonNull(kind, "kind"), message, nowMs);
    }

    public StepRecord timedOut(String message, long nowMs) {
        return outcome(StepStatus.TIMED_OUT, null, ErrorKind.TIMEOUT, message, nowMs);
    }

    public StepRecord withSequence(long assigned) {
        return new StepRecord(runId, assigned, stepName, attempt, status, inputJson, outputJson,
                errorKind, errorMessage, startedAtMs, endedAtMs);
    }

    public boolean isOutcome() {
        return status.isOutcome();
    }

    private StepRecord outcome(StepStatus outcome, String output, ErrorKind kind, String message, long nowMs) {
        if (status != StepStatus.SCHEDULED) {
            throw new IllegalStateException("Outcome can only follow a scheduled record, not " + status);
        }
        return new StepRecord(runId, 0L, stepName, attempt, outcome, inputJson, output,
                kind, message, startedAtMs, nowMs);
    }
}
