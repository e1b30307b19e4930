package com.cronq.internal;

import com.cronq.JobRepository;
import com.cronq.QueueClock;
import com.cronq.config.CronQProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * Deletes permanently failed one-shot jobs after the configured retention.
 * Succeeded jobs are deleted as soon as they finish and recurring jobs never fail
 * permanently, so nothing else accumulates.
 */
@Component
@ConditionalOnProperty(prefix = "cronq.background-job-server", name = "enabled", havingValue = "true", matchIfMissing = true)
public class JobCleaner {

    private static final Logger log = LoggerFactory.getLogger(JobCleaner.class);
    private final JobRepository jobRepository;
    private final QueueClock queueClock;
    private final CronQProperties properties;

    public JobCleaner(JobRepository jobRepository, QueueClock queueClock, CronQProperties properties) {
        this.jobRepository = jobRepository;
        this.queueClock = queueClock;
        this.properties = properties;
    }

    // Run cleaner every hour
    @Scheduled(fixedDelay = 3600000)
    public void cleanup() {
        Duration retention = properties.getBackgroundJobServer().getDeleteFailedJobsAfter();
        if (retention == null || retention.isZero() || retention.isNegative()) {
            return;
        }
        log.info("Running CronQ failed job cleanup...");

        try {
            OffsetDateTime threshold = queueClock.now().minus(retention);
            int deleted = jobRepository.deleteByFailedAtBefore(threshold);
            if (deleted > 0) {
                log.info("Permanently deleted {} failed jobs older than {}", deleted, retention);
            }
        } catch (Exception e) {
            log.error("Failed to clean up failed jobs: {}", e.getMessage());
        }
    }
}
