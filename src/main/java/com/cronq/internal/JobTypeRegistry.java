package com.cronq.internal;

import com.cronq.JobWorker;
import com.cronq.config.CronQProperties;
import com.cronq.schedule.CronSchedule;
import com.cronq.schedule.InvalidScheduleException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import jakarta.annotation.PostConstruct;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.annotation.AnnotationUtils;
import org.springframework.stereotype.Component;
import org.springframework.util.ClassUtils;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registered {@link JobWorker} beans by job type, together with the payload
 * reader, retry policy and optional bootstrap cron derived from each worker.
 */
@Component
public class JobTypeRegistry {

    private final List<JobWorker<?>> workers;
    private final ObjectMapper objectMapper;
    private final RetryPolicy defaultRetryPolicy;
    private volatile Map<String, RegisteredJob> jobsByType = Map.of();

    public JobTypeRegistry(
            List<JobWorker<?>> workers,
            @Qualifier("cronqObjectMapper") ObjectMapper objectMapper,
            CronQProperties properties) {
        this.workers = workers;
        this.objectMapper = objectMapper;
        this.defaultRetryPolicy = RetryPolicy.from(properties.getJobs());
    }

    @PostConstruct
    public void init() {
        Map<String, RegisteredJob> registrations = new LinkedHashMap<>();

        for (JobWorker<?> worker : workers) {
            String source = "JobWorker " + ClassUtils.getUserClass(worker).getName();
            String jobType = normalizeRequiredType(worker.getJobType(), source);
            com.cronq.annotation.Job annotation = AnnotationUtils.findAnnotation(ClassUtils.getUserClass(worker),
                    com.cronq.annotation.Job.class);

            RegisteredJob registration = new RegisteredJob(
                    jobType,
                    worker,
                    payloadReaderFor(worker.getPayloadClass()),
                    defaultRetryPolicy.withOverrides(annotation),
                    bootstrapCron(annotation, jobType));
            RegisteredJob existing = registrations.putIfAbsent(jobType, registration);
            if (existing != null) {
                throw new IllegalStateException(
                        "Duplicate job type '" + jobType + "' detected while registering " + source
                                + ". Each job type must be unique.");
            }
        }

        jobsByType = Map.copyOf(registrations);
    }

    public Optional<RegisteredJob> find(String jobType) {
        return Optional.ofNullable(jobsByType.get(jobType));
    }

    public Map<String, RegisteredJob> all() {
        return jobsByType;
    }

    private PayloadReader payloadReaderFor(Class<?> payloadClass) {
        if (payloadClass == Void.class) {
            return rawPayload -> null;
        }
        ObjectReader reader = objectMapper.readerFor(payloadClass);
        return rawPayload -> {
            if (rawPayload == null || rawPayload.isNull()) {
                return null;
            }
            return reader.readValue(rawPayload);
        };
    }

    private CronSchedule bootstrapCron(com.cronq.annotation.Job annotation, String jobType) {
        if (annotation == null || annotation.cron().isBlank()) {
            return null;
        }
        try {
            return CronSchedule.parse(annotation.cron());
        } catch (InvalidScheduleException e) {
            throw new IllegalStateException(
                    "Invalid cron expression '" + annotation.cron() + "' for job type '" + jobType + "'", e);
        }
    }

    private String normalizeRequiredType(String type, String source) {
        if (type == null) {
            throw new IllegalStateException("Job type must not be null for " + source);
        }
        String trimmed = type.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalStateException("Job type must not be blank for " + source);
        }
        return trimmed;
    }

    @FunctionalInterface
    public interface PayloadReader {
        Object read(JsonNode rawPayload) throws IOException;
    }

    public record RegisteredJob(
            String type,
            JobWorker<?> worker,
            PayloadReader payloadReader,
            RetryPolicy retryPolicy,
            CronSchedule bootstrapCron) {

        public Object readPayload(JsonNode rawPayload) throws PayloadDeserializationException {
            try {
                return payloadReader.read(rawPayload);
            } catch (IOException | RuntimeException e) {
                throw new PayloadDeserializationException(
                        "Cannot read payload of job type '" + type + "': " + e.getMessage(), e);
            }
        }
    }
}
