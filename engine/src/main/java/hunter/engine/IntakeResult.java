package hunter.engine;

import java.util.Objects;

public record IntakeResult(Outcome outcome, String accountId, String runId, String reason) {

    public enum Outcome {
        STARTED,
        COALESCED,
        REJECTED,
        ALREADY_PROCESSED
    }

    public IntakeResult {
        Objects.requireNonNull(outcome, "outcome");
        Objects.requireNonNull(accountId, "accountId");
    }

    public static IntakeResult started(String accountId, String runId) {
        return new IntakeResult(Outcome.STARTED, accountId, runId, null);
    }

    public static IntakeResult coalesced(String accountId, String existingRunId) {
        return new IntakeResult(Outcome.COALESCED, accountId, existingRunId, "run already active");
    }

    public static IntakeResult rejected(String accountId, String reason) {
        return new IntakeResult(Outcome.REJECTED, accountId, null, reason);
    }

    public static IntakeResult alreadyProcessed(String accountId, String runId) {
        return new IntakeResult(Outcome.ALREADY_PROCESSED, accountId, runId, "observation already handled");
    }

    public boolean started() {
        return outcome == Outcome.STARTED;
    }
}
