package com.cronq;

import com.cronq.schedule.ScheduleHook;
import com.cronq.schedule.ScheduleHookProvider;

import java.util.Optional;

/**
 * Payload whose {@code cronMethod} hook alternates between February 1st (even
 * attempts) and January 1st (odd attempts) and stops after ten attempts.
 */
public class CronMethodPayload implements ScheduleHookProvider {

    public static final String HOOK = "cronMethod";
    public static final String EVEN_ATTEMPTS_CRON = "0 0 1 2 *";
    public static final String ODD_ATTEMPTS_CRON = "0 0 1 1 *";

    private String message;

    public CronMethodPayload() {
    }

    public CronMethodPayload(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    @Override
    public Optional<ScheduleHook> findScheduleHook(String hookName) {
        return HOOK.equals(hookName) ? Optional.of(this::cronMethod) : Optional.empty();
    }

    private Optional<String> cronMethod(JobSnapshot job) {
        if (job.attempts() > 10) {
            return Optional.empty();
        }
        return Optional.of(job.attempts() % 2 == 0 ? EVEN_ATTEMPTS_CRON : ODD_ATTEMPTS_CRON);
    }
}
