package hunter.engine;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public record Signal(
        String accountId,
        Map<String, String> attributes,
        List<SignalEvent> observedMetrics,
        int intentScore,
        long firstSeenMs,
        long lastSeenMs) {

    public static final String COMPANY_NAME = "company_name";
    public static final String INDUSTRY = "industry";
    public static final String EMPLOYEE_COUNT = "employee_count";
    public static final String REVENUE = "revenue";

    public Signal {
        if (accountId == null || accountId.isBlank()) {
            throw new IllegalArgumentException("Signal accountId must not be blank");
        }
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
        observedMetrics = observedMetrics == null
                ? List.of()
                : observedMetrics.stream()
                        .sorted(Comparator.comparingLong(SignalEvent::occurredAtMs))
                        .toList();
        if (lastSeenMs < firstSeenMs) {
            throw new IllegalArgumentException("lastSeenMs precedes firstSeenMs for " + accountId);
        }
    }

    public String attribute(String key) {
        return attributes.get(Objects.requireNonNull(key, "key"));
    }
}
