package io.memorybank.fs;

import java.time.Duration;

/**
 * Bounded exponential backoff for transient file failures.
 */
public record RetryPolicy(
    /** Total attempts including the first one */
    int maxAttempts,
    
    /** Delay before the second attempt */
    Duration baseDelay,
    
    /** Upper bound for any single delay */
    Duration maxDelay,
    
    /** Multiplier applied per attempt */
    double backoffFactor
) {
    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be non-negative");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay");
        }
        if (backoffFactor < 1.0) {
            throw new IllegalArgumentException("backoffFactor must be >= 1.0, got " + backoffFactor);
        }
    }
    
    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofMillis(100), Duration.ofSeconds(5), 2.0);
    }
    
    /**
     * Fails on the first error.
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 1.0);
    }
    
    public RetryPolicy withMaxAttempts(int maxAttempts) {
        return new RetryPolicy(maxAttempts, baseDelay, maxDelay, backoffFactor);
    }
    
    public RetryPolicy withDelays(Duration baseDelay, Duration maxDelay) {
        return new RetryPolicy(maxAttempts, baseDelay, maxDelay, backoffFactor);
    }
    
    /**
     * Returns the delay to wait after the given failed attempt (1-based).
     */
    public Duration delayForAttempt(int attempt) {
        double millis = baseDelay.toMillis() * Math.pow(backoffFactor, Math.max(0, attempt - 1));
        long capped = (long) Math.min(millis, maxDelay.toMillis());
        return Duration.ofMillis(capped);
    }
}
