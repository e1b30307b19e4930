package com.cronq.internal;

import com.cronq.schedule.CronSchedule;

/**
 * Result of asking a payload for its next schedule.
 */
public sealed interface ScheduleResolution
        permits ScheduleResolution.Resolved, ScheduleResolution.Stopped, ScheduleResolution.Unavailable {

    enum Reason {
        UNKNOWN_JOB_TYPE,
        DESERIALIZATION_FAILED,
        NOT_A_HOOK_PROVIDER,
        HOOK_NOT_FOUND,
        HOOK_FAILED,
        INVALID_SCHEDULE
    }

    static ScheduleResolution resolved(CronSchedule cron) {
        return new Resolved(cron);
    }

    static ScheduleResolution stopped() {
        return Stopped.INSTANCE;
    }

    static ScheduleResolution unavailable(Reason reason, String detail) {
        return new Unavailable(reason, detail);
    }

    record Resolved(CronSchedule cron) implements ScheduleResolution {
    }

    final class Stopped implements ScheduleResolution {

        private static final Stopped INSTANCE = new Stopped();

        private Stopped() {
        }

        @Override
        public String toString() {
            return "Stopped";
        }
    }

    record Unavailable(Reason reason, String detail) implements ScheduleResolution {
    }
}
