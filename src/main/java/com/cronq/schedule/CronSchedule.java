package com.cronq.schedule;

import org.springframework.scheduling.support.CronExpression;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A validated 5-field cron expression (minute, hour, day-of-month, month,
 * day-of-week) evaluated at minute granularity in UTC.
 * <p>
 * Field syntax is the one of Spring's {@link CronExpression}: {@code *}, literals,
 * ranges, lists, steps, month and weekday names. When both day-of-month and
 * day-of-week are restricted (neither starts with {@code *}), a day matches if
 * it matches either field, as in Unix cron. Instances are immutable and safe to
 * share between threads.
 */
public final class CronSchedule {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int FIELD_COUNT = 5;
    // Keeps the stored schedule within a btree index entry.
    static final int MAX_LENGTH = 1024;
    private static final int DAY_OF_MONTH = 2;
    private static final int DAY_OF_WEEK = 4;
    // Far enough back that a valid expression always has a fire time within the search window.
    private static final OffsetDateTime VALIDATION_REFERENCE = OffsetDateTime.of(2000, 1, 1, 0, 0, 0, 0,
            ZoneOffset.UTC);

    private final String expression;
    // Evaluated together, the earliest fire time wins.
    private final List<CronExpression> alternatives;

    private CronSchedule(String expression, List<CronExpression> alternatives) {
        this.expression = expression;
        this.alternatives = alternatives;
    }

    /**
     * Parses and validates a 5-field cron expression.
     *
     * @throws InvalidScheduleException if the text is blank or too long, does not
     *                                  have exactly five fields, contains an
     *                                  out-of-range value or can never fire
     */
    public static CronSchedule parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidScheduleException("Cron expression must not be blank");
        }
        String normalized = WHITESPACE.matcher(expression.trim()).replaceAll(" ");
        if (normalized.length() > MAX_LENGTH) {
            throw new InvalidScheduleException("Cron expression must not be longer than " + MAX_LENGTH
                    + " characters");
        }
        if (normalized.startsWith("@")) {
            throw new InvalidScheduleException("Cron macros are not supported: '" + normalized + "'");
        }
        String[] fields = normalized.split(" ");
        if (fields.length != FIELD_COUNT) {
            throw new InvalidScheduleException("Cron expression '" + normalized + "' must have " + FIELD_COUNT
                    + " fields (minute hour day-of-month month day-of-week) but has " + fields.length);
        }

        List<CronExpression> alternatives = new ArrayList<>();
        for (String variant : dayVariants(fields)) {
            try {
                // CronExpression carries a leading seconds field; fire on the minute.
                alternatives.add(CronExpression.parse("0 " + variant.toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new InvalidScheduleException("Invalid cron expression '" + normalized + "': " + e.getMessage(),
                        e);
            }
        }
        CronSchedule schedule = new CronSchedule(normalized, List.copyOf(alternatives));
        if (schedule.nextOrNull(VALIDATION_REFERENCE) == null) {
            throw new InvalidScheduleException("Cron expression '" + normalized + "' never fires");
        }
        return schedule;
    }

    /**
     * Returns the first matching minute strictly after {@code after}. The result is
     * in UTC with zero seconds and nanos.
     */
    public OffsetDateTime next(OffsetDateTime after) {
        Objects.requireNonNull(after, "after must not be null");
        OffsetDateTime reference = after.withOffsetSameInstant(ZoneOffset.UTC);
        OffsetDateTime next = nextOrNull(reference);
        if (next == null) {
            throw new IllegalStateException("Cron expression '" + expression + "' has no fire time after " + after);
        }
        return next.truncatedTo(ChronoUnit.MINUTES);
    }

    private OffsetDateTime nextOrNull(OffsetDateTime reference) {
        OffsetDateTime earliest = null;
        for (CronExpression alternative : alternatives) {
            OffsetDateTime candidate = alternative.next(reference);
            if (candidate != null && (earliest == null || candidate.isBefore(earliest))) {
                earliest = candidate;
            }
        }
        return earliest;
    }

    /**
     * One expression, or two when both day fields are restricted: one keeping
     * only the day-of-month, one keeping only the day-of-week.
     */
    private static List<String> dayVariants(String[] fields) {
        if (!isRestricted(fields[DAY_OF_MONTH]) || !isRestricted(fields[DAY_OF_WEEK])) {
            return List.of(String.join(" ", fields));
        }
        String[] domOnly = fields.clone();
        domOnly[DAY_OF_WEEK] = "*";
        String[] dowOnly = fields.clone();
        dowOnly[DAY_OF_MONTH] = "*";
        return List.of(String.join(" ", domOnly), String.join(" ", dowOnly));
    }

    private static boolean isRestricted(String field) {
        return !field.startsWith("*") && !field.equals("?");
    }

    public String expression() {
        return expression;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CronSchedule other)) {
            return false;
        }
        return expression.equals(other.expression);
    }

    @Override
    public int hashCode() {
        return expression.hashCode();
    }

    @Override
    public String toString() {
        return expression;
    }
}
