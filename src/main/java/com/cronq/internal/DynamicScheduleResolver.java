package com.cronq.internal;

import com.cronq.JobSnapshot;
import com.cronq.schedule.CronSchedule;
import com.cronq.schedule.InvalidScheduleException;
import com.cronq.schedule.ScheduleHook;
import com.cronq.schedule.ScheduleHookProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Asks a job's payload for its next cron expression. Never throws: every failure
 * is reported as {@link ScheduleResolution.Unavailable}.
 */
@Component
public class DynamicScheduleResolver {

    private static final Logger log = LoggerFactory.getLogger(DynamicScheduleResolver.class);

    private final JobTypeRegistry jobTypeRegistry;

    public DynamicScheduleResolver(JobTypeRegistry jobTypeRegistry) {
        this.jobTypeRegistry = jobTypeRegistry;
    }

    public ScheduleResolution resolve(String hookName, JobSnapshot job) {
        Optional<JobTypeRegistry.RegisteredJob> registration = jobTypeRegistry.find(job.type());
        if (registration.isEmpty()) {
            return unavailable(job, hookName, ScheduleResolution.Reason.UNKNOWN_JOB_TYPE,
                    "no JobWorker registered for type '" + job.type() + "'");
        }

        Object payload;
        try {
            payload = registration.get().readPayload(job.payload());
        } catch (PayloadDeserializationException e) {
            return unavailable(job, hookName, ScheduleResolution.Reason.DESERIALIZATION_FAILED, e.getMessage());
        }

        if (!(payload instanceof ScheduleHookProvider provider)) {
            return unavailable(job, hookName, ScheduleResolution.Reason.NOT_A_HOOK_PROVIDER,
                    "payload " + (payload == null ? "null" : payload.getClass().getName())
                            + " does not implement ScheduleHookProvider");
        }

        Optional<String> resolved;
        try {
            Optional<ScheduleHook> hook = provider.findScheduleHook(hookName);
            if (hook == null || hook.isEmpty()) {
                return unavailable(job, hookName, ScheduleResolution.Reason.HOOK_NOT_FOUND,
                        "payload " + payload.getClass().getName() + " has no schedule hook '" + hookName + "'");
            }
            resolved = hook.get().resolveSchedule(job);
        } catch (RuntimeException e) {
            return unavailable(job, hookName, ScheduleResolution.Reason.HOOK_FAILED,
                    e.getClass().getName() + ": " + e.getMessage());
        }

        if (resolved == null || resolved.isEmpty() || resolved.get().isBlank()) {
            log.debug("Schedule hook '{}' of job {} returned no schedule; recurrence stops", hookName, job.id());
            return ScheduleResolution.stopped();
        }

        try {
            CronSchedule cron = CronSchedule.parse(resolved.get());
            log.debug("Schedule hook '{}' of job {} resolved to '{}'", hookName, job.id(), cron.expression());
            return ScheduleResolution.resolved(cron);
        } catch (InvalidScheduleException e) {
            return unavailable(job, hookName, ScheduleResolution.Reason.INVALID_SCHEDULE, e.getMessage());
        }
    }

    private ScheduleResolution unavailable(JobSnapshot job, String hookName, ScheduleResolution.Reason reason,
            String detail) {
        log.warn("Could not resolve schedule hook '{}' for job {} of type {} ({}): {}",
                hookName, job.id(), job.type(), reason, detail);
        return ScheduleResolution.unavailable(reason, detail);
    }
}
