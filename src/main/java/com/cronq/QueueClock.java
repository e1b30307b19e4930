package com.cronq;

import java.time.OffsetDateTime;

/**
 * The single source of "now" for the queue. All scheduling arithmetic uses it
 * instead of the local system clock so that every node agrees on due times.
 * Register a bean of this type to replace the default.
 */
@FunctionalInterface
public interface QueueClock {

    /**
     * Current time, normalised to UTC.
     */
    OffsetDateTime now();
}
