package taskboard.coordinator.lock;

import java.time.Duration;

/**
 * Exponential backoff between lock acquisition attempts.
 */
public record BackoffPolicy(Duration initialDelay, Duration maxDelay, double multiplier) {

    public BackoffPolicy {
        if (initialDelay.isNegative() || initialDelay.isZero()) {
            throw new IllegalArgumentException("initialDelay must be positive");
        }
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must not be below initialDelay");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1");
        }
    }

    public static BackoffPolicy defaults() {
        return new BackoffPolicy(Duration.ofMillis(10), Duration.ofMillis(250), 2.0);
    }

    /** Delay before the given retry (1-based) */
    public long delayMillis(int retry) {
        double delay = initialDelay.toMillis() * Math.pow(multiplier, Math.max(0, retry - 1));
        return (long) Math.min(delay, maxDelay.toMillis());
    }
}
