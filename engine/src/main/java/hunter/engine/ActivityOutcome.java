package hunter.engine;

import java.time.Duration;

public sealed interface ActivityOutcome
        permits ActivityOutcome.Succeeded, ActivityOutcome.Failed, ActivityOutcome.TimedOut {

    /** The record that closes {@code scheduled} with this outcome. */
    StepRecord toRecord(StepRecord scheduled, long nowMs);

    record Succeeded(String outputJson) implements ActivityOutcome {
        @Override
        public StepRecord toRecord(StepRecord scheduled, long nowMs) {
            return scheduled.succeeded(outputJson, nowMs);
        }
    }

    record Failed(ErrorKind errorKind, String message) implements ActivityOutcome {
        @Override
        public StepRecord toRecord(StepRecord scheduled, long nowMs) {
            return scheduled.failed(errorKind, message, nowMs);
        }
    }

    record TimedOut(Duration timeout) implements ActivityOutcome {
        @Override
        public StepRecord toRecord(StepRecord scheduled, long nowMs) {
            return scheduled.timedOut("no result within " + timeout.toMillis() + " ms", nowMs);
        }
    }
}
