package hunter.engine;

import java.time.Duration;
import java.util.Objects;
import java.util.UUID;

public record SchedulerConfig(int maxConcurrency, Duration tickInterval, Duration storageRetryDelay,
                              CrashConfig crashConfig, String workerId, Duration leaseDuration) {

    public static final Duration DEFAULT_LEASE_DURATION = Duration.ofSeconds(15);

    public SchedulerConfig {
        Objects.requireNonNull(tickInterval, "tickInterval");
        Objects.requireNonNull(storageRetryDelay, "storageRetryDelay");
        Objects.requireNonNull(crashConfig, "crashConfig");
        Objects.requireNonNull(leaseDuration, "leaseDuration");
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be >= 1");
        }
        if (tickInterval.isZero() || tickInterval.isNegative()) {
            throw new IllegalArgumentException("tickInterval must be positive");
        }
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId must not be blank");
        }
        if (leaseDuration.toMillis() < 3L) {
            throw new IllegalArgumentException("leaseDuration must be at least 3ms");
        }
    }

    public static SchedulerConfig defaults() {
        return new SchedulerConfig(4, Duration.ofMillis(250), Duration.ofSeconds(1), CrashConfig.NONE,
                "worker-" + UUID.randomUUID(), DEFAULT_LEASE_DURATION);
    }

    public Duration leaseRenewInterval() {
        return leaseDuration.dividedBy(3);
    }

    public SchedulerConfig withMaxConcurrency(int value) {
        return new SchedulerConfig(value, tickInterval, storageRetryDelay, crashConfig, workerId, leaseDuration);
    }

    public SchedulerConfig withTickInterval(Duration value) {
        return new SchedulerConfig(maxConcurrency, value, storageRetryDelay, crashConfig, workerId, leaseDuration);
    }

    public SchedulerConfig withCrashConfig(CrashConfig value) {
        return new SchedulerConfig(maxConcurrency, tickInterval, storageRetryDelay, value, workerId, leaseDuration);
    }

    public SchedulerConfig withWorkerId(String value) {
        return new SchedulerConfig(maxConcurrency, tickInterval, storageRetryDelay, crashConfig, value, leaseDuration);
    }

    public SchedulerConfig withLeaseDuration(Duration value) {
        return new SchedulerConfig(maxConcurrency, tickInterval, storageRetryDelay, crashConfig, workerId, value);
    }
}
