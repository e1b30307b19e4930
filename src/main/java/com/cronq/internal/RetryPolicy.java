package com.cronq.internal;

import com.cronq.config.CronQProperties;

import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * Max-attempts and backoff for jobs without a recurring schedule.
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, double backoffMultiplier, Duration maxBackoff) {

    public RetryPolicy {
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must be >= 0");
        }
        if (initialBackoff == null || initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff must be >= 0");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
        }
        if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be >= initialBackoff");
        }
    }

    public static RetryPolicy from(CronQProperties.Jobs jobs) {
        return new RetryPolicy(jobs.getMaxAttempts(), jobs.getInitialBackoff(), jobs.getBackoffMultiplier(),
                jobs.getMaxBackoff());
    }

    /**
     * Applies the non-default settings of a {@code @Job} annotation.
     */
    public RetryPolicy withOverrides(com.cronq.annotation.Job annotation) {
        if (annotation == null) {
            return this;
        }
        int attempts = annotation.maxAttempts() >= 0 ? annotation.maxAttempts() : maxAttempts;
        Duration backoff = annotation.initialBackoffMs() >= 0 ? Duration.ofMillis(annotation.initialBackoffMs())
                : initialBackoff;
        double multiplier = annotation.backoffMultiplier() >= 1.0 ? annotation.backoffMultiplier()
                : backoffMultiplier;
        return new RetryPolicy(attempts, backoff, multiplier,
                maxBackoff.compareTo(backoff) < 0 ? backoff : maxBackoff);
    }

    /**
     * @param attempts the attempt count including the attempt that just failed
     */
    public boolean allowsRetry(int attempts) {
        return attempts < maxAttempts;
    }

    public OffsetDateTime nextRetryAt(int attempts, OffsetDateTime now) {
        double factor = Math.pow(backoffMultiplier, Math.max(0, attempts - 1));
        double delayMs = initialBackoff.toMillis() * factor;
        long cappedMs = delayMs >= maxBackoff.toMillis() ? maxBackoff.toMillis() : (long) delayMs;
        return now.plus(Duration.ofMillis(cappedMs));
    }
}
