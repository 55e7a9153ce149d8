package hunter.engine;

public record SignalEvent(String type, String actor, long occurredAtMs) {
}
