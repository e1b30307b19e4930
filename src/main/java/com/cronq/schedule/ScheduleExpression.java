package com.cronq.schedule;

import java.util.regex.Pattern;

/**
 * Recurrence reference data attached to a job when it is enqueued. It never
 * changes for the lifetime of the row.
 *
 * <ul>
 * <li>{@link None} - ordinary one-shot job, subject to retry/expiry.</li>
 * <li>{@link Static} - a validated 5-field cron expression.</li>
 * <li>{@link Dynamic} - a hook name resolved against the payload after every
 * attempt, see {@link ScheduleHookProvider}.</li>
 * </ul>
 */
public sealed interface ScheduleExpression
        permits ScheduleExpression.None, ScheduleExpression.Static, ScheduleExpression.Dynamic {

    String DYNAMIC_PREFIX = "dynamic:";

    static ScheduleExpression none() {
        return None.INSTANCE;
    }

    /**
     * Validates the cron text immediately.
     *
     * @throws InvalidScheduleException if the text is not a valid 5-field expression
     */
    static Static cron(String expression) {
        return new Static(CronSchedule.parse(expression));
    }

    static Dynamic dynamic(String hookName) {
        return new Dynamic(hookName);
    }

    /**
     * Reads the stored column form produced by {@link #toColumnValue()}.
     */
    static ScheduleExpression parse(String columnValue) {
        if (columnValue == null || columnValue.isBlank()) {
            return none();
        }
        String trimmed = columnValue.trim();
        if (trimmed.startsWith(DYNAMIC_PREFIX)) {
            return dynamic(trimmed.substring(DYNAMIC_PREFIX.length()));
        }
        return cron(trimmed);
    }

    /**
     * Stored form, or {@code null} for {@link None}.
     */
    String toColumnValue();

    default boolean isRecurring() {
        return !(this instanceof None);
    }

    final class None implements ScheduleExpression {

        private static final None INSTANCE = new None();

        private None() {
        }

        @Override
        public String toColumnValue() {
            return null;
        }

        @Override
        public String toString() {
            return "none";
        }
    }

    record Static(CronSchedule cron) implements ScheduleExpression {

        public Static {
            if (cron == null) {
                throw new InvalidScheduleException("Cron schedule must not be null");
            }
        }

        public String expression() {
            return cron.expression();
        }

        @Override
        public String toColumnValue() {
            return cron.expression();
        }

        @Override
        public String toString() {
            return cron.expression();
        }
    }

    record Dynamic(String hookName) implements ScheduleExpression {

        private static final Pattern HOOK_NAME = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$.\\-]{0,254}");

        public Dynamic {
            if (hookName == null || hookName.isBlank()) {
                throw new InvalidScheduleException("Dynamic schedule hook name must not be blank");
            }
            hookName = hookName.trim();
            if (!HOOK_NAME.matcher(hookName).matches()) {
                throw new InvalidScheduleException("Unsupported dynamic schedule hook name: " + hookName);
            }
        }

        @Override
        public String toColumnValue() {
            return DYNAMIC_PREFIX + hookName;
        }

        @Override
        public String toString() {
            return DYNAMIC_PREFIX + hookName;
        }
    }
}
