package hunter.engine;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Retry policy of one step type.
 *
 * <p>The delay after failed attempt {@code n} is
 * {@code min(initialBackoff * backoffMultiplier^(n-1) + jitter, maxBackoff)} where
 * the jitter lies in {@code [0, base * jitterRatio)} and is derived from a seed,
 * never from a random source, so replaying the same history gives the same delay.
 * The multiplier must be at least {@code 1 + jitterRatio}, which keeps successive
 * delays non-decreasing.
 */
public record RetryPolicy(
        int maxAttempts,
        Duration initialBackoff,
        double backoffMultiplier,
        Duration maxBackoff,
        Set<ErrorKind> retryableErrorKinds,
        double jitterRatio) {

    public static final Set<ErrorKind> DEFAULT_RETRYABLE = Set.of(ErrorKind.TRANSIENT, ErrorKind.TIMEOUT);

    public RetryPolicy {
        Objects.requireNonNull(initialBackoff, "initialBackoff");
        Objects.requireNonNull(maxBackoff, "maxBackoff");
        Objects.requireNonNull(retryableErrorKinds, "retryableErrorKinds");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (initialBackoff.isNegative() || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("backoff must satisfy 0 <= initialBackoff <= maxBackoff");
        }
        if (jitterRatio < 0.0 || jitterRatio >= 1.0) {
            throw new IllegalArgumentException("jitterRatio must be in [0, 1)");
        }
        if (backoffMultiplier < 1.0 + jitterRatio) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1 + jitterRatio");
        }
        retryableErrorKinds = retryableErrorKinds.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(retryableErrorKinds));
    }

    public static RetryPolicy of(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {
        return new RetryPolicy(maxAttempts, initialBackoff, 2.0, maxBackoff, DEFAULT_RETRYABLE, 0.2);
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, 1.0, Duration.ZERO, Set.of(), 0.0);
    }

    public boolean isRetryable(ErrorKind kind) {
        return retryableErrorKinds.contains(kind);
    }

    /** Backoff before retrying failed attempt {@code attempt}, without jitter. */
    public long baseDelayMs(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1");
        }
        double delay = initialBackoff.toMillis() * Math.pow(backoffMultiplier, attempt - 1);
        return (long) Math.min(delay, (double) maxBackoff.toMillis());
    }

    /**
     * Backoff before retrying failed attempt {@code attempt}, including the
     * jitter picked by {@code seed}.
     */
    public long delayMs(int attempt, long seed) {
        long base = baseDelayMs(attempt);
        long jitter = (long) (base * jitterRatio * unitInterval(seed));
        return Math.min(base + jitter, maxBackoff.toMillis());
    }

    private static double unitInterval(long seed) {
        long mixed = seed * 0x9E3779B97F4A7C15L;
        mixed ^= mixed >>> 31;
        return (mixed >>> 11) * 0x1.0p-53;
    }
}
