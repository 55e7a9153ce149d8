package hunter.engine;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simulated process crash for recovery demos: halts the JVM with exit code 137
 * when the configured step reaches the configured phase.
 */
public record CrashConfig(String stepName, CrashPhase phase) {
    public static final CrashConfig NONE = new CrashConfig(null, CrashPhase.NONE);

    private static final Logger log = LoggerFactory.getLogger(CrashConfig.class);

    public CrashConfig {
        Objects.requireNonNull(phase, "phase");
    }

    public boolean shouldCrash(String currentStep, CrashPhase currentPhase) {
        if (phase == CrashPhase.NONE || currentPhase != phase) {
            return false;
        }
        return stepName == null || stepName.isBlank() || stepName.equals(currentStep);
    }

    void maybeCrash(String runId, String currentStep, int attempt, CrashPhase currentPhase) {
        if (shouldCrash(currentStep, currentPhase)) {
            log.error("Simulated crash. phase={}, runId={}, step={}, attempt={}",
                    currentPhase.value(), runId, currentStep, attempt);
            Runtime.getRuntime().halt(137);
        }
    }
}
