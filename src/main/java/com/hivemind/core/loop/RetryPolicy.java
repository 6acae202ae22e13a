package com.hivemind.core.loop;

import com.hivemind.config.HivemindProperties;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with additive jitter for whole-run retries.
 * <p>
 * The base delay after failed attempt {@code n} is {@code initialBackoff * 2^(n-1)},
 * capped at {@code maxBackoff}; a random jitter of up to {@code jitterRatio} of the
 * base is added on top, so the delay is never below the base.
 */
public class RetryPolicy {

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final double jitterRatio;
    private final DoubleSupplier random;

    public RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff, double jitterRatio) {
        this(maxAttempts, initialBackoff, maxBackoff, jitterRatio, () -> ThreadLocalRandom.current().nextDouble());
    }

    RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff, double jitterRatio,
                DoubleSupplier random) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.maxBackoff = maxBackoff;
        this.jitterRatio = Math.max(0, jitterRatio);
        this.random = random;
    }

    public static RetryPolicy from(HivemindProperties.Loop loop) {
        return new RetryPolicy(loop.getMaxAttempts(), loop.getInitialBackoff(),
                loop.getMaxBackoff(), loop.getJitterRatio());
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * Whether another attempt should follow failed attempt {@code attempt} (1-based).
     */
    public boolean shouldRetry(int attempt, RunFailure failure) {
        return failure.isRetryable() && attempt < maxAttempts;
    }

    /**
     * Delay to wait after failed attempt {@code attempt} (1-based).
     */
    public Duration backoff(int attempt) {
        long initial = initialBackoff.toMillis();
        long cap = maxBackoff.toMillis();
        int shift = Math.min(attempt - 1, 30);
        long base = Math.min(initial << shift, cap);
        if (base < 0) base = cap;
        long jitter = (long) (base * jitterRatio * random.getAsDouble());
        return Duration.ofMillis(base + jitter);
    }
}
