package com.cronq.schedule;

import java.util.Optional;

/**
 * Capability implemented by payload classes that drive their own recurrence.
 * The payload is deserialized from the job row and asked for the hook named by
 * the job's dynamic schedule.
 *
 * <pre>{@code
 * public class ReportPayload implements ScheduleHookProvider {
 *     public Optional<ScheduleHook> findScheduleHook(String hookName) {
 *         return "nextReport".equals(hookName) ? Optional.of(this::nextReport) : Optional.empty();
 *     }
 * }
 * }</pre>
 */
public interface ScheduleHookProvider {

    Optional<ScheduleHook> findScheduleHook(String hookName);
}
