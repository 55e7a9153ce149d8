package hunter.engine;

import java.util.Arrays;
import java.util.Locale;

public enum CrashPhase {
    NONE("none"),
    /** The scheduled record is durable, the activity has not been called. */
    BEFORE_EXECUTE("before-execute"),
    /** The activity returned, its outcome is not recorded yet. */
    AFTER_EXECUTE_BEFORE_COMMIT("after-execute-before-commit"),
    /** The outcome is recorded, the next decision has not been taken. */
    AFTER_COMMIT("after-commit");

    private final String value;

    CrashPhase(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static CrashPhase fromValue(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(phase -> phase.value.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported crash phase: " + value));
    }
}
