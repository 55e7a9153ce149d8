package hunter.engine;

import java.util.Objects;

public record ActivityContext(String runId, String stepName, int attempt, String inputJson, JsonCodec jsonCodec) {
    public ActivityContext {
        Objects.requireNonNull(runId, "runId");
        Objects.requireNonNull(stepName, "stepName");
        Objects.requireNonNull(jsonCodec, "jsonCodec");
    }

    /**
     * @throws IllegalArgumentException if the input does not map onto {@code type}
     */
    public <T> T input(Class<T> type) {
        return jsonCodec.fromJson(inputJson, type);
    }

    /** Key that stays the same across attempts of this step in this run. */
    public String idempotencyKey() {
        return runId;
    }
}
