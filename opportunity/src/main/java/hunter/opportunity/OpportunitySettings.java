package hunter.opportunity;

import hunter.engine.RetryPolicy;
import hunter.engine.SchedulerConfig;
import java.time.Duration;
import java.util.Objects;

/** Tunables of the opportunity workflow. */
public record OpportunitySettings(
        int intentThreshold,
        String channel,
        RetryPolicy analysisRetry,
        Duration analysisTimeout,
        RetryPolicy deliveryRetry,
        Duration deliveryTimeout,
        SchedulerConfig schedulerConfig) {

    public static final int DEFAULT_INTENT_THRESHOLD = 75;
    public static final String DEFAULT_CHANNEL = "#gtm-opportunities";

    public OpportunitySettings {
        Objects.requireNonNull(analysisRetry, "analysisRetry");
        Objects.requireNonNull(analysisTimeout, "analysisTimeout");
        Objects.requireNonNull(deliveryRetry, "deliveryRetry");
        Objects.requireNonNull(deliveryTimeout, "deliveryTimeout");
        Objects.requireNonNull(schedulerConfig, "schedulerConfig");
        if (channel == null || channel.isBlank()) {
            throw new IllegalArgumentException("channel must not be blank");
        }
    }

    public static OpportunitySettings defaults() {
        return new OpportunitySettings(
                DEFAULT_INTENT_THRESHOLD,
                DEFAULT_CHANNEL,
                RetryPolicy.of(3, Duration.ofSeconds(1), Duration.ofSeconds(10)),
                Duration.ofMinutes(5),
                RetryPolicy.of(3, Duration.ofSeconds(1), Duration.ofSeconds(5)),
                Duration.ofMinutes(2),
                SchedulerConfig.defaults());
    }

    public OpportunitySettings withIntentThreshold(int value) {
        return new OpportunitySettings(value, channel, analysisRetry, analysisTimeout, deliveryRetry,
                deliveryTimeout, schedulerConfig);
    }

    public OpportunitySettings withRetries(RetryPolicy analysis, RetryPolicy delivery) {
        return new OpportunitySettings(intentThreshold, channel, analysis, analysisTimeout, delivery,
                deliveryTimeout, schedulerConfig);
    }

    public OpportunitySettings withSchedulerConfig(SchedulerConfig value) {
        return new OpportunitySettings(intentThreshold, channel, analysisRetry, analysisTimeout, deliveryRetry,
                deliveryTimeout, value);
    }
}
