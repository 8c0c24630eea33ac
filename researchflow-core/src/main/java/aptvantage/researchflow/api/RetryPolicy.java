package aptvantage.researchflow.api;

import io.github.resilience4j.core.IntervalFunction;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Bounded automatic retry for agent invocations. The delay before attempt {@code k + 1} is
 * {@code baseDelay * 2^(k - 1)}, randomized by {@code randomizationFactor}.
 */
public class RetryPolicy {

    private int maxAttempts = 3;
    private Duration baseDelay = Duration.of(1, ChronoUnit.SECONDS);
    private double randomizationFactor = 0.5;

    public static RetryPolicy defaults() {
        return new RetryPolicy();
    }

    public RetryPolicy maxAttempts(int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1 but was [%s]".formatted(maxAttempts));
        }
        this.maxAttempts = maxAttempts;
        return this;
    }

    public RetryPolicy baseDelay(Duration baseDelay) {
        checkNull(baseDelay, "baseDelay");
        if (baseDelay.isNegative() || baseDelay.isZero()) {
            throw new IllegalArgumentException("baseDelay must be positive but was [%s]".formatted(baseDelay));
        }
        this.baseDelay = baseDelay;
        return this;
    }

    public RetryPolicy randomizationFactor(double randomizationFactor) {
        if (randomizationFactor < 0 || randomizationFactor >= 1) {
            throw new IllegalArgumentException(
                    "randomizationFactor must be in [0, 1) but was [%s]".formatted(randomizationFactor));
        }
        this.randomizationFactor = randomizationFactor;
        return this;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public Duration baseDelay() {
        return baseDelay;
    }

    public double randomizationFactor() {
        return randomizationFactor;
    }

    public boolean hasAttemptsAfter(int failedAttempt) {
        return failedAttempt < maxAttempts;
    }

    /**
     * Delay to wait after the given (1-based) attempt failed.
     */
    public Duration delayAfter(int failedAttempt) {
        IntervalFunction intervals = randomizationFactor == 0
                ? IntervalFunction.ofExponentialBackoff(baseDelay, 2.0)
                : IntervalFunction.ofExponentialRandomBackoff(baseDelay, 2.0, randomizationFactor);
        return Duration.ofMillis(intervals.apply(failedAttempt));
    }

    private static void checkNull(Object value, String name) {
        if (value == null) {
            throw new IllegalArgumentException("%s must not be null".formatted(name));
        }
    }
}
