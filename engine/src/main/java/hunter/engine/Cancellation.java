package hunter.engine;

public record Cancellation(String runId, String reason, long requestedAtMs) {
}
