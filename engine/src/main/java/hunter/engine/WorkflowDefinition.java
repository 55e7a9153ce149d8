package hunter.engine;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A named, ordered list of steps. The first step receives the signal snapshot,
 * every later step receives the output of the step before it, and the output of
 * the last step is the result of the run.
 */
public final class WorkflowDefinition<K extends Enum<K> & StepKind> {
    private final String name;
    private final Class<K> kindType;
    private final List<StepDefinition<K>> steps;

    private WorkflowDefinition(String name, Class<K> kindType, List<StepDefinition<K>> steps) {
        this.name = name;
        this.kindType = kindType;
        this.steps = List.copyOf(steps);
    }

    public static <K extends Enum<K> & StepKind> Builder<K> builder(String name, Class<K> kindType) {
        return new Builder<>(name, kindType);
    }

    public String name() {
        return name;
    }

    public Class<K> kindType() {
        return kindType;
    }

    public List<StepDefinition<K>> steps() {
        return steps;
    }

    public Optional<StepDefinition<K>> step(String stepName) {
        return steps.stream().filter(step -> step.stepName().equals(stepName)).findFirst();
    }

    public static final class Builder<K extends Enum<K> & StepKind> {
        private final String name;
        private final Class<K> kindType;
        private final List<StepDefinition<K>> steps = new ArrayList<>();

        private Builder(String name, Class<K> kindType) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Workflow name must not be blank");
            }
            this.name = name.trim();
            this.kindType = Objects.requireNonNull(kindType, "kindType");
        }

        public Builder<K> step(K kind, RetryPolicy retryPolicy, Duration timeout) {
            steps.add(new StepDefinition<>(kind, retryPolicy, timeout));
            return this;
        }

        public WorkflowDefinition<K> build() {
            if (steps.isEmpty()) {
                throw new IllegalStateException("Workflow " + name + " has no steps");
            }
            Set<String> names = new HashSet<>();
            for (StepDefinition<K> step : steps) {
                if (!names.add(step.stepName())) {
                    throw new IllegalStateException("Duplicate step " + step.stepName() + " in workflow " + name);
                }
            }
            return new WorkflowDefinition<>(name, kindType, steps);
        }
    }
}
