package hunter.engine;

import java.util.Objects;

public record AttemptLease(String runId, String stepName, int attempt, String owner, long expiresAtMs) {
    public AttemptLease {
        Objects.requireNonNull(runId, "runId");
        Objects.requireNonNull(stepName, "stepName");
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("lease owner must not be blank");
        }
    }

    public static AttemptLease forAttempt(StepRecord scheduled, String owner, long expiresAtMs) {
        return new AttemptLease(scheduled.runId(), scheduled.stepName(), scheduled.attempt(), owner, expiresAtMs);
    }

    public AttemptLease extendedTo(long value) {
        return new AttemptLease(runId, stepName, attempt, owner, value);
    }

    public boolean isStale(long nowMs) {
        return nowMs >= expiresAtMs;
    }

    public boolean covers(StepRecord record) {
        return runId.equals(record.runId()) && stepName.equals(record.stepName()) && attempt == record.attempt();
    }
}
