package com.cronq.internal;

import com.cronq.QueueClock;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Reads the database server time, the same clock the due-job query compares
 * {@code run_at} against.
 */
public class DatabaseQueueClock implements QueueClock {

    private final JdbcTemplate jdbcTemplate;

    public DatabaseQueueClock(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public OffsetDateTime now() {
        OffsetDateTime now = jdbcTemplate.queryForObject("SELECT CURRENT_TIMESTAMP", OffsetDateTime.class);
        if (now == null) {
            throw new IllegalStateException("Database returned no CURRENT_TIMESTAMP");
        }
        return now.withOffsetSameInstant(ZoneOffset.UTC);
    }
}
