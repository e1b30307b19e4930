package com.cronq.schedule;

/**
 * Thrown when a schedule cannot be attached to a job: malformed cron text, a cron
 * expression that never fires, or a blank dynamic hook name.
 */
public class InvalidScheduleException extends IllegalArgumentException {

    public InvalidScheduleException(String message) {
        super(message);
    }

    public InvalidScheduleException(String message, Throwable cause) {
        super(message, cause);
    }
}
