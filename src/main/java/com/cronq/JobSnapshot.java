package com.cronq;

import com.cronq.schedule.ScheduleExpression;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Immutable view of a job row. This is what the recurrence decision works on and
 * what dynamic schedule hooks receive.
 */
public record JobSnapshot(
        UUID id,
        String type,
        JsonNode payload,
        ScheduleExpression schedule,
        OffsetDateTime runAt,
        int attempts,
        String lastError,
        OffsetDateTime createdAt) {

    public JobSnapshot {
        if (schedule == null) {
            schedule = ScheduleExpression.none();
        }
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts must be >= 0");
        }
    }

    public static JobSnapshot of(Job job) {
        return new JobSnapshot(job.getId(), job.getType(), job.getPayload(), job.getSchedule(), job.getRunAt(),
                job.getAttempts(), job.getLastError(), job.getCreatedAt());
    }

    public JobSnapshot withAttempt(int attempts, String lastError) {
        return new JobSnapshot(id, type, payload, schedule, runAt, attempts, lastError, createdAt);
    }

    public JobSnapshot withRunAt(OffsetDateTime runAt) {
        return new JobSnapshot(id, type, payload, schedule, runAt, attempts, lastError, createdAt);
    }
}
