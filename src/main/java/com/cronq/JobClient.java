package com.cronq;

import com.cronq.internal.DynamicScheduleResolver;
import com.cronq.internal.ScheduleResolution;
import com.cronq.schedule.InvalidScheduleException;
import com.cronq.schedule.ScheduleExpression;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

@Service
public class JobClient {

    private static final Logger log = LoggerFactory.getLogger(JobClient.class);

    private final JobRepository jobRepository;
    private final ObjectMapper objectMapper;
    private final QueueClock queueClock;
    private final DynamicScheduleResolver dynamicScheduleResolver;

    public JobClient(JobRepository jobRepository, @Qualifier("cronqObjectMapper") ObjectMapper objectMapper,
            QueueClock queueClock, DynamicScheduleResolver dynamicScheduleResolver) {
        this.jobRepository = jobRepository;
        this.objectMapper = objectMapper;
        this.queueClock = queueClock;
        this.dynamicScheduleResolver = dynamicScheduleResolver;
    }

    /**
     * Enqueue a one-shot job that is due immediately.
     */
    public UUID enqueue(String type, Object payload) {
        return enqueue(type, payload, ScheduleExpression.none()).getId();
    }

    /**
     * Enqueue a one-shot job to run at the provided instant.
     */
    public UUID enqueueAt(String type, Object payload, Instant runAt) {
        if (runAt == null) {
            throw new IllegalArgumentException("runAt must not be null");
        }
        return enqueueAt(type, payload, OffsetDateTime.ofInstant(runAt, ZoneOffset.UTC));
    }

    /**
     * Enqueue a one-shot job to run at the provided date-time.
     */
    public UUID enqueueAt(String type, Object payload, OffsetDateTime runAt) {
        if (runAt == null) {
            throw new IllegalArgumentException("runAt must not be null");
        }
        return insert(normalizeRequiredType(type), payload, ScheduleExpression.none(), runAt).getId();
    }

    /**
     * Enqueue a job recurring on a 5-field cron expression. The first run is the
     * next matching minute after the queue clock's current time.
     *
     * @throws InvalidScheduleException if the expression is malformed; nothing is
     *                                  stored in that case
     */
    public Job enqueue(String type, Object payload, String cron) {
        return enqueue(type, payload, ScheduleExpression.cron(cron));
    }

    /**
     * Enqueue a job with any kind of schedule.
     * <p>
     * A dynamic schedule is resolved once against the new job to find its first
     * run. If the payload cannot be read or declines to schedule, the job is still
     * stored and becomes due immediately.
     */
    public Job enqueue(String type, Object payload, ScheduleExpression schedule) {
        return insert(normalizeRequiredType(type), payload, schedule, null);
    }

    private Job insert(String type, Object payload, ScheduleExpression schedule, OffsetDateTime explicitRunAt) {
        ScheduleExpression effectiveSchedule = schedule == null ? ScheduleExpression.none() : schedule;
        JsonNode jsonNode = payload != null ? objectMapper.valueToTree(payload) : null;
        OffsetDateTime now = queueClock.now();
        UUID jobId = UUID.randomUUID();

        OffsetDateTime runAt = explicitRunAt != null
                ? explicitRunAt
                : initialRunAt(new JobSnapshot(jobId, type, jsonNode, effectiveSchedule, now, 0, null, now), now);

        Job job = new Job(jobId, type, jsonNode, effectiveSchedule, now, runAt);
        Job saved = jobRepository.save(job);
        log.debug("Enqueued job {} of type {} with schedule '{}', first run at {}", jobId, type, effectiveSchedule,
                runAt);
        return saved;
    }

    private OffsetDateTime initialRunAt(JobSnapshot job, OffsetDateTime now) {
        ScheduleExpression schedule = job.schedule();
        if (schedule instanceof ScheduleExpression.Static staticSchedule) {
            return staticSchedule.cron().next(now);
        }
        if (schedule instanceof ScheduleExpression.Dynamic dynamicSchedule) {
            ScheduleResolution resolution = dynamicScheduleResolver.resolve(dynamicSchedule.hookName(), job);
            if (resolution instanceof ScheduleResolution.Resolved resolved) {
                return resolved.cron().next(now);
            }
        }
        return now;
    }

    private String normalizeRequiredType(String type) {
        if (type == null) {
            throw new IllegalArgumentException("Job type must not be null");
        }
        String trimmed = type.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Job type must not be blank");
        }
        return trimmed;
    }
}
