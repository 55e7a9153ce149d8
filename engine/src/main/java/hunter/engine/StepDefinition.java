package hunter.engine;

import java.time.Duration;
import java.util.Objects;

public record StepDefinition<K extends Enum<K> & StepKind>(K kind, RetryPolicy retryPolicy, Duration timeout) {
    public StepDefinition {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(retryPolicy, "retryPolicy");
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive for " + kind.stepName());
        }
    }

    public String stepName() {
        return kind.stepName();
    }
}
