package com.cronq.annotation;

import java.lang.annotation.*;

/**
 * Marks a {@link com.cronq.JobWorker} and configures how its jobs are retried
 * and, optionally, bootstrapped as a recurring job.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Job {

    /**
     * The type of job this worker handles.
     */
    String value();

    /**
     * A 5-field cron expression. When set, one recurring row of this type is
     * created on startup if none exists yet; it is rescheduled in place after
     * every attempt, successful or not.
     */
    String cron() default "";

    /**
     * Attempts after which a non-recurring job is marked FAILED. A negative value
     * means the global {@code cronq.jobs.max-attempts}. Recurring jobs ignore it.
     */
    int maxAttempts() default -1;

    /**
     * Delay before the first retry of a failed non-recurring job. A negative value
     * means the global {@code cronq.jobs.initial-backoff}.
     */
    long initialBackoffMs() default -1;

    /**
     * The multiplier used for exponential backoff between retries. A value below
     * 1 means the global {@code cronq.jobs.backoff-multiplier}.
     */
    double backoffMultiplier() default -1.0;
}
