package io.herald4j.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with jitter for transient publish failures.
 *
 * <p>attempt starts from 1 (the first failed run). With the defaults: 10s, 20s, 40s, 80s... capped at 10 minutes,
 * plus up to 20% jitter, still capped.
 */
public final class RetryPolicy {

    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double jitterRatio;
    private final DoubleSupplier random;

    public RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay, double jitterRatio) {
        this(maxAttempts, baseDelay, maxDelay, jitterRatio, () -> ThreadLocalRandom.current().nextDouble());
    }

    public RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay, double jitterRatio, DoubleSupplier random) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        this.baseDelay = Objects.requireNonNull(baseDelay, "baseDelay must not be null");
        this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        if (baseDelay.isNegative() || baseDelay.isZero()) {
            throw new IllegalArgumentException("baseDelay must be a positive duration");
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must not be shorter than baseDelay");
        }
        if (jitterRatio < 0 || jitterRatio > 1) {
            throw new IllegalArgumentException("jitterRatio must be within [0, 1]");
        }
        this.maxAttempts = maxAttempts;
        this.jitterRatio = jitterRatio;
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(5, Duration.ofSeconds(10), Duration.ofMinutes(10), 0.2);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * True once {@code attempt} runs have been used up.
     */
    public boolean isExhausted(int attempt) {
        return attempt >= maxAttempts;
    }

    /**
     * Backoff without jitter.
     */
    public Duration backoff(int attempt) {
        int exp = Math.max(0, attempt - 1);
        exp = Math.min(exp, 30); // avoid overflow
        long ms;
        try {
            ms = Math.multiplyExact(baseDelay.toMillis(), 1L << exp);
        } catch (ArithmeticException overflow) {
            ms = Long.MAX_VALUE;
        }
        return Duration.ofMillis(Math.min(ms, maxDelay.toMillis()));
    }

    /**
     * Backoff plus jitter in {@code [0, jitterRatio * backoff]}, never above {@code maxDelay}.
     */
    public Duration delay(int attempt) {
        long base = backoff(attempt).toMillis();
        long jitter = (long) (base * jitterRatio * random.getAsDouble());
        return Duration.ofMillis(Math.min(base + jitter, maxDelay.toMillis()));
    }

    public Instant nextAttemptAt(Instant failedAt, int attempt) {
        Objects.requireNonNull(failedAt, "failedAt must not be null");
        return failedAt.plus(delay(attempt));
    }
}
