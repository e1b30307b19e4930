package com.cronq.internal;

import com.cronq.Job;
import com.cronq.JobRepository;
import com.cronq.JobSnapshot;
import com.cronq.JobWorker;
import com.cronq.QueueClock;
import com.cronq.config.CronQProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Claims due jobs, runs them within the configured time budget and applies the
 * {@link RecurrenceDecider}'s decision while the row is still locked by this node.
 */
@Component
@ConditionalOnProperty(prefix = "cronq.background-job-server", name = "enabled", havingValue = "true", matchIfMissing = true)
public class JobPoller {

    private static final Logger log = LoggerFactory.getLogger(JobPoller.class);

    private final JobRepository jobRepository;
    private final JobTypeRegistry jobTypeRegistry;
    private final RecurrenceDecider recurrenceDecider;
    private final QueueClock queueClock;
    private final TransactionTemplate transactionTemplate;
    private final ObjectProvider<CronQMetrics> metricsProvider;
    private final int workerCount;
    private final Duration maxRunTime;
    private final ThreadPoolExecutor processingExecutor;
    private final ThreadPoolExecutor pollingExecutor;
    private final ExecutorService attemptExecutor;

    private final String nodeId = "node-" + UUID.randomUUID();
    private Map<String, AtomicBoolean> pollInProgress = Map.of();

    public JobPoller(
            JobRepository jobRepository,
            JobTypeRegistry jobTypeRegistry,
            RecurrenceDecider recurrenceDecider,
            QueueClock queueClock,
            TransactionTemplate transactionTemplate,
            CronQProperties properties,
            ObjectProvider<CronQMetrics> metricsProvider) {
        this.jobRepository = jobRepository;
        this.jobTypeRegistry = jobTypeRegistry;
        this.recurrenceDecider = recurrenceDecider;
        this.queueClock = queueClock;
        this.transactionTemplate = transactionTemplate;
        this.metricsProvider = metricsProvider;
        this.workerCount = Math.max(1, properties.getBackgroundJobServer().getWorkerCount());
        this.maxRunTime = properties.getBackgroundJobServer().getMaxRunTime();
        if (maxRunTime == null || maxRunTime.isNegative() || maxRunTime.isZero()) {
            throw new IllegalArgumentException("cronq.background-job-server.max-run-time must be positive");
        }

        int processingQueueCapacity = Math.max(32, workerCount * 8);
        this.processingExecutor = new ThreadPoolExecutor(
                workerCount,
                workerCount,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(processingQueueCapacity),
                new CustomizableThreadFactory("cronq-worker-"),
                new ThreadPoolExecutor.CallerRunsPolicy());

        int pollThreads = Math.min(4, Math.max(1, workerCount / 2));
        this.pollingExecutor = new ThreadPoolExecutor(
                pollThreads,
                pollThreads,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(Math.max(32, workerCount * 4)),
                new CustomizableThreadFactory("cronq-poll-"),
                new ThreadPoolExecutor.CallerRunsPolicy());

        // Attempts run apart from the worker thread so the worker can give up on them.
        this.attemptExecutor = Executors.newCachedThreadPool(new CustomizableThreadFactory("cronq-attempt-"));
    }

    @PostConstruct
    public void init() {
        Map<String, AtomicBoolean> pollState = new HashMap<>();
        for (String jobType : jobTypeRegistry.all().keySet()) {
            pollState.put(jobType, new AtomicBoolean(false));
        }
        this.pollInProgress = Map.copyOf(pollState);

        log.info("Job Poller initialized on {} with {} registered jobs: {}", nodeId, pollInProgress.size(),
                pollInProgress.keySet());
    }

    @Scheduled(fixedDelayString = "${cronq.background-job-server.poll-interval-in-seconds:15}000")
    public void poll() {
        for (Map.Entry<String, AtomicBoolean> entry : pollInProgress.entrySet()) {
            String jobType = entry.getKey();
            AtomicBoolean inProgress = entry.getValue();
            if (!inProgress.compareAndSet(false, true)) {
                continue;
            }

            try {
                pollingExecutor.execute(() -> {
                    try {
                        pollForType(jobType);
                    } catch (Exception e) {
                        log.error("Polling for job type {} failed", jobType, e);
                    } finally {
                        inProgress.set(false);
                    }
                });
            } catch (RejectedExecutionException saturatedPollingQueue) {
                inProgress.set(false);
                log.debug("Skipping poll dispatch for type {} because polling queue is saturated", jobType);
            }
        }
    }

    void pollForType(String jobType) {
        JobTypeRegistry.RegisteredJob registration = jobTypeRegistry.find(jobType).orElse(null);
        if (registration == null) {
            return;
        }

        int availableSlots = availableProcessingSlots();
        if (availableSlots <= 0) {
            return;
        }

        List<Job> jobs = transactionTemplate.execute(status -> {
            OffsetDateTime lockTime = queueClock.now();
            int batchSize = Math.min(workerCount, availableSlots);
            List<Job> nextJobs = jobRepository.findNextJobsForUpdate(jobType, lockTime, lockTime.minus(maxRunTime),
                    PageRequest.of(0, batchSize));
            if (nextJobs.isEmpty()) {
                return List.<Job>of();
            }
            for (Job j : nextJobs) {
                if (j.getLockedBy() != null) {
                    log.warn("Reclaiming job {} of type {} locked by {} since {}", j.getId(), jobType, j.getLockedBy(),
                            j.getLockedAt());
                }
                j.setProcessingStartedAt(lockTime);
                j.setLockedAt(lockTime);
                j.setLockedBy(nodeId);
                j.setUpdatedAt(lockTime);
            }
            jobRepository.saveAll(nextJobs);
            return nextJobs;
        });

        if (jobs == null || jobs.isEmpty()) {
            return;
        }

        for (Job job : jobs) {
            JobSnapshot snapshot = JobSnapshot.of(job);
            processingExecutor.execute(() -> processJob(snapshot, registration));
        }
    }

    private int availableProcessingSlots() {
        int inFlight = processingExecutor.getActiveCount() + processingExecutor.getQueue().size();
        return workerCount - inFlight;
    }

    void processJob(JobSnapshot job, JobTypeRegistry.RegisteredJob registration) {
        log.debug("Locked job {} of type {} for attempt {}", job.id(), job.type(), job.attempts() + 1);
        try {
            AttemptOutcome outcome = runAttempt(job, registration);
            OffsetDateTime finishedAt = queueClock.now();
            AttemptDecision decision = recurrenceDecider.decide(job, outcome, finishedAt, registration.retryPolicy());
            applyDecision(job, decision, finishedAt);
        } catch (Exception e) {
            log.error("Failed to record attempt of job {} of type {}; the row is reclaimed once its lock by {} "
                    + "is older than {}", job.id(), job.type(), nodeId, maxRunTime, e);
        }
    }

    private AttemptOutcome runAttempt(JobSnapshot job, JobTypeRegistry.RegisteredJob registration) {
        Object payload;
        try {
            payload = registration.readPayload(job.payload());
        } catch (PayloadDeserializationException e) {
            log.error("Failed to deserialize payload of job {} of type {}", job.id(), job.type(), e);
            invokeOnErrorSafely(registration, job.id(), null, e);
            return AttemptOutcome.deserializationError(e);
        }

        Future<?> attempt = attemptExecutor.submit(() -> {
            invokeWorker(registration.worker(), job.id(), payload);
            return null;
        });
        try {
            attempt.get(maxRunTime.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            attempt.cancel(true);
            log.error("Job {} of type {} exceeded max run time {}", job.id(), job.type(), maxRunTime);
            invokeOnErrorSafely(registration, job.id(), payload, e);
            return AttemptOutcome.timeout(maxRunTime);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Failed to process job {} of type {}", job.id(), job.type(), cause);
            invokeOnErrorSafely(registration, job.id(), payload,
                    cause instanceof Exception exception ? exception : new RuntimeException(cause));
            return AttemptOutcome.failure(cause);
        } catch (InterruptedException e) {
            attempt.cancel(true);
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for job {} of type {}", job.id(), job.type());
            return AttemptOutcome.failure(e);
        }

        invokeOnSuccessSafely(registration, job.id(), payload);
        log.debug("Successfully completed attempt of job {} of type {}", job.id(), job.type());
        return AttemptOutcome.success();
    }

    private void applyDecision(JobSnapshot claimed, AttemptDecision decision, OffsetDateTime now) {
        JobSnapshot next = decision.job();
        Integer updated = transactionTemplate.execute(status -> switch (decision.action()) {
            case RESCHEDULE, RETRY_LATER -> jobRepository.markPending(
                    claimed.id(),
                    claimed.attempts(),
                    next.attempts(),
                    next.lastError(),
                    next.runAt(),
                    now,
                    nodeId);
            case PERMANENTLY_FAILED -> jobRepository.markFailedTerminal(
                    claimed.id(),
                    claimed.attempts(),
                    next.attempts(),
                    next.lastError(),
                    now,
                    nodeId);
            case DELETE -> jobRepository.deleteClaimed(claimed.id(), claimed.attempts(), nodeId);
        });

        if (toAffectedRows(updated) == 0) {
            log.warn("Job {} of type {} was no longer locked by {}; dropped {} decision",
                    claimed.id(), claimed.type(), nodeId, decision.action());
            return;
        }

        CronQMetrics metrics = metricsProvider.getIfAvailable();
        if (metrics != null) {
            metrics.recordDecision(decision.action());
        }

        switch (decision.action()) {
            case RESCHEDULE -> log.debug("Rescheduled recurring job {} of type {} to {} (attempts={})",
                    claimed.id(), claimed.type(), next.runAt(), next.attempts());
            case RETRY_LATER -> log.debug("Job {} of type {} will retry at {} (attempts={})",
                    claimed.id(), claimed.type(), next.runAt(), next.attempts());
            case PERMANENTLY_FAILED -> log.warn("Job {} of type {} failed permanently after {} attempts",
                    claimed.id(), claimed.type(), next.attempts());
            case DELETE -> log.debug("Deleted completed job {} of type {}", claimed.id(), claimed.type());
        }
    }

    private void invokeWorker(JobWorker<?> worker, UUID jobId, Object payload) throws Exception {
        @SuppressWarnings("unchecked")
        JobWorker<Object> castWorker = (JobWorker<Object>) worker;
        castWorker.process(jobId, payload);
    }

    private void invokeOnErrorSafely(JobTypeRegistry.RegisteredJob registration, UUID jobId, Object payload,
            Exception error) {
        try {
            @SuppressWarnings("unchecked")
            JobWorker<Object> castWorker = (JobWorker<Object>) registration.worker();
            castWorker.onError(jobId, payload, error);
        } catch (Exception onErrorFailure) {
            log.error("onError callback failed for job {} of type {}", jobId, registration.type(), onErrorFailure);
        }
    }

    private void invokeOnSuccessSafely(JobTypeRegistry.RegisteredJob registration, UUID jobId, Object payload) {
        try {
            @SuppressWarnings("unchecked")
            JobWorker<Object> castWorker = (JobWorker<Object>) registration.worker();
            castWorker.onSuccess(jobId, payload);
        } catch (Exception onSuccessFailure) {
            log.error("onSuccess callback failed for job {} of type {}", jobId, registration.type(),
                    onSuccessFailure);
        }
    }

    private int toAffectedRows(Integer updatedRows) {
        return updatedRows == null ? 0 : updatedRows;
    }

    String getNodeId() {
        return nodeId;
    }

    @PreDestroy
    void shutdownExecutor() {
        pollingExecutor.shutdown();
        processingExecutor.shutdown();
        attemptExecutor.shutdownNow();
    }
}
