package com.cronq.internal;

import com.cronq.Job;
import com.cronq.JobClient;
import com.cronq.JobRepository;
import com.cronq.schedule.ScheduleExpression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Bootstraps recurring jobs defined via {@code @Job(cron = "...")} on startup.
 * Creates the single recurring row of a type unless one is already active; that
 * row is then rescheduled in place forever.
 */
@Component
public class RecurringJobInitializer implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(RecurringJobInitializer.class);

    private final JobRepository jobRepository;
    private final JobTypeRegistry jobTypeRegistry;
    private final JobClient jobClient;
    private volatile boolean running = false;

    public RecurringJobInitializer(JobRepository jobRepository, JobTypeRegistry jobTypeRegistry, JobClient jobClient) {
        this.jobRepository = jobRepository;
        this.jobTypeRegistry = jobTypeRegistry;
        this.jobClient = jobClient;
    }

    @Override
    public void start() {
        log.info("Checking for recurring jobs to bootstrap...");
        for (JobTypeRegistry.RegisteredJob registration : jobTypeRegistry.all().values()) {
            if (registration.bootstrapCron() != null) {
                bootstrapRecurringJob(registration.type(), new ScheduleExpression.Static(registration.bootstrapCron()));
            }
        }
        this.running = true;
    }

    private void bootstrapRecurringJob(String type, ScheduleExpression.Static schedule) {
        try {
            if (jobRepository.existsByTypeAndScheduleAndFailedAtIsNull(type, schedule)) {
                log.debug("Recurring job {} already has an active row for cron '{}'", type, schedule.expression());
                return;
            }
            Job job = jobClient.enqueue(type, null, schedule);
            log.info("Bootstrapped recurring job {} with cron '{}'. First execution scheduled at {}",
                    type, schedule.expression(), job.getRunAt());
        } catch (Exception e) {
            log.error("Failed to bootstrap recurring job {} with cron '{}'", type, schedule.expression(), e);
        }
    }

    @Override
    public void stop() {
        this.running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE; // Start last
    }
}
