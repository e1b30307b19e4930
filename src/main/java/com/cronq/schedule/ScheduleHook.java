package com.cronq.schedule;

import com.cronq.JobSnapshot;

import java.util.Optional;

/**
 * Payload-defined scheduling logic for jobs enqueued with
 * {@link ScheduleExpression#dynamic(String)}.
 */
@FunctionalInterface
public interface ScheduleHook {

    /**
     * Returns the cron expression for the next run, or an empty result to stop
     * recurring. The snapshot already carries the incremented attempt count of the
     * attempt that just finished.
     */
    Optional<String> resolveSchedule(JobSnapshot job);
}
