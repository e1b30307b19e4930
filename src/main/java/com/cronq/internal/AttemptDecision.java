package com.cronq.internal;

import com.cronq.JobSnapshot;

/**
 * What to do with a job row after an attempt, and the state to persist.
 *
 * @param action what happens to the row
 * @param job    the row after the attempt: incremented attempts, new last error and,
 *               for {@link Action#RESCHEDULE} and {@link Action#RETRY_LATER}, the
 *               next run time
 */
public record AttemptDecision(Action action, JobSnapshot job) {

    public enum Action {
        /**
         * Recurring job: same row, new {@code run_at} from its schedule.
         */
        RESCHEDULE,
        /**
         * Failed one-shot job with attempts left: same row, backoff {@code run_at}.
         */
        RETRY_LATER,
        DELETE,
        PERMANENTLY_FAILED
    }
}
