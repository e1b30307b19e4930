package com.cronq.internal;

import com.cronq.JobSnapshot;
import com.cronq.schedule.ScheduleExpression;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * Decides a job's next state after an attempt.
 * <p>
 * Every attempt increments {@code attempts} and sets {@code last_error} from the
 * outcome. A job whose schedule yields a cron expression for this cycle is
 * rescheduled in place whatever the outcome, with no max-attempts limit. Otherwise
 * a success deletes the row and a failure is retried with backoff until the
 * retry policy's max attempts is reached.
 * <p>
 * Dynamic schedules are resolved against the post-increment snapshot. A hook
 * that returns no schedule ends the job: the row is deleted whatever the
 * outcome. A resolution failure only ends recurrence for this cycle, the job then
 * follows the one-shot policy and is resolved again on its next attempt. The
 * failure is logged by the resolver and never written into {@code last_error}.
 */
@Component
public class RecurrenceDecider {

    private final DynamicScheduleResolver dynamicScheduleResolver;

    public RecurrenceDecider(DynamicScheduleResolver dynamicScheduleResolver) {
        this.dynamicScheduleResolver = dynamicScheduleResolver;
    }

    public AttemptDecision decide(JobSnapshot job, AttemptOutcome outcome, OffsetDateTime now,
            RetryPolicy retryPolicy) {
        Objects.requireNonNull(job, "job must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
        Objects.requireNonNull(now, "now must not be null");
        Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");

        JobSnapshot attempted = job.withAttempt(job.attempts() + 1, outcome.errorMessage());

        ScheduleResolution recurrence = effectiveRecurrence(attempted);
        if (recurrence instanceof ScheduleResolution.Resolved resolved) {
            return new AttemptDecision(AttemptDecision.Action.RESCHEDULE,
                    attempted.withRunAt(resolved.cron().next(now)));
        }

        if (outcome.isSuccess() || recurrence instanceof ScheduleResolution.Stopped) {
            return new AttemptDecision(AttemptDecision.Action.DELETE, attempted);
        }
        if (retryPolicy.allowsRetry(attempted.attempts())) {
            return new AttemptDecision(AttemptDecision.Action.RETRY_LATER,
                    attempted.withRunAt(retryPolicy.nextRetryAt(attempted.attempts(), now)));
        }
        return new AttemptDecision(AttemptDecision.Action.PERMANENTLY_FAILED, attempted);
    }

    /**
     * The recurrence governing this cycle, or {@code null} for a job without a
     * schedule.
     */
    private ScheduleResolution effectiveRecurrence(JobSnapshot attempted) {
        ScheduleExpression schedule = attempted.schedule();
        if (schedule instanceof ScheduleExpression.Static staticSchedule) {
            return ScheduleResolution.resolved(staticSchedule.cron());
        }
        if (schedule instanceof ScheduleExpression.Dynamic dynamicSchedule) {
            return dynamicScheduleResolver.resolve(dynamicSchedule.hookName(), attempted);
        }
        return null;
    }
}
