package hunter.engine;

/**
 * What the engine wants to happen next for a run.
 */
public sealed interface Decision
        permits Decision.ExecuteStep, Decision.AwaitRetry, Decision.AwaitInFlight,
        Decision.Complete, Decision.Fail, Decision.Abandon {

    default boolean isTerminal() {
        return false;
    }

    record ExecuteStep(String stepName, int attempt, String inputJson) implements Decision {
    }

    /** Retry {@code stepName} as attempt {@code nextAttempt} once {@code dueAtMs} has passed. */
    record AwaitRetry(String stepName, int nextAttempt, String inputJson, long delayMs, long dueAtMs)
            implements Decision {

        public ExecuteStep toExecute() {
            return new ExecuteStep(stepName, nextAttempt, inputJson);
        }
    }

    /** An attempt has been scheduled and has no recorded outcome yet. */
    record AwaitInFlight(String stepName, int attempt) implements Decision {
    }

    record Complete(String resultJson) implements Decision {
        @Override
        public boolean isTerminal() {
            return true;
        }
    }

    record Fail(String stepName, ErrorKind errorKind, String reason, int attempts) implements Decision {
        @Override
        public boolean isTerminal() {
            return true;
        }
    }

    record Abandon(String reason) implements Decision {
        @Override
        public boolean isTerminal() {
            return true;
        }
    }
}
