package com.cronq;

import com.cronq.schedule.InvalidScheduleException;
import com.cronq.schedule.ScheduleExpression;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.domain.PageRequest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest(classes = { TestApplication.class, CronQIntegrationTest.TestConfig.class }, properties = {
        "cronq.background-job-server.poll-interval-in-seconds=1",
        "cronq.background-job-server.max-run-time=10s" })
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class CronQIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("testdb")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void registerPgProperties(DynamicPropertyRegistry registry) {
        registry.add("testcontainers.postgresql.host", postgres::getHost);
        registry.add("testcontainers.postgresql.port", postgres::getFirstMappedPort);
        registry.add("testcontainers.postgresql.database", postgres::getDatabaseName);
        registry.add("testcontainers.postgresql.username", postgres::getUsername);
        registry.add("testcontainers.postgresql.password", postgres::getPassword);
    }

    @Autowired
    JobClient jobClient;

    @Autowired
    JobRepository jobRepository;

    @Autowired
    JdbcTemplate jdbcTemplate;

    @Autowired
    PlatformTransactionManager transactionManager;

    static final ConcurrentLinkedQueue<UUID> processedJobIds = new ConcurrentLinkedQueue<>();

    @Configuration
    static class TestConfig {

        @Bean
        JobWorker<CronMethodPayload> cronMethodWorker() {
            return new CronMethodWorker();
        }

        @Bean
        JobWorker<CronMethodPayload> succeedingWorker() {
            return new JobWorker<CronMethodPayload>() {
                @Override
                public String getJobType() {
                    return "SUCCEEDING_JOB";
                }

                @Override
                public void process(UUID jobId, CronMethodPayload payload) {
                    processedJobIds.add(jobId);
                }

                @Override
                public Class<CronMethodPayload> getPayloadClass() {
                    return CronMethodPayload.class;
                }
            };
        }

        @Bean
        JobWorker<CronMethodPayload> failingWorker() {
            return new JobWorker<CronMethodPayload>() {
                @Override
                public String getJobType() {
                    return "FAILING_JOB";
                }

                @Override
                public void process(UUID jobId, CronMethodPayload payload) {
                    throw new RuntimeException("Fail!");
                }

                @Override
                public Class<CronMethodPayload> getPayloadClass() {
                    return CronMethodPayload.class;
                }
            };
        }
    }

    @BeforeEach
    void cleanUp() {
        jdbcTemplate.update("DELETE FROM cronq_jobs");
        processedJobIds.clear();
    }

    private void makeDue(UUID jobId) {
        jdbcTemplate.update("UPDATE cronq_jobs SET run_at = CURRENT_TIMESTAMP - INTERVAL '1 second' WHERE id = ?",
                jobId);
    }

    private Job reload(UUID jobId) {
        return jobRepository.findById(jobId).orElseThrow();
    }

    private void awaitAttempts(UUID jobId, int attempts) {
        await().atMost(Duration.ofSeconds(20))
                .until(() -> jobRepository.findById(jobId).map(Job::getAttempts).orElse(-1) >= attempts
                        && jobRepository.findById(jobId).map(Job::getLockedBy).orElse("locked") == null);
    }

    @Test
    void shouldRescheduleStaticRecurringJobInPlaceAfterSuccess() {
        Job enqueued = jobClient.enqueue("SUCCEEDING_JOB", new CronMethodPayload("tick"), "* * * * *");
        assertEquals(0, enqueued.getRunAt().getSecond());
        makeDue(enqueued.getId());

        awaitAttempts(enqueued.getId(), 1);

        Job job = reload(enqueued.getId());
        assertEquals(1, job.getAttempts());
        assertNull(job.getLastError());
        assertNull(job.getFailedAt());
        assertNull(job.getProcessingStartedAt());
        assertEquals(enqueued.getCreatedAt().toInstant(), job.getCreatedAt().toInstant());
        assertEquals(ScheduleExpression.cron("* * * * *"), job.getSchedule());
        assertTrue(job.getRunAt().isAfter(OffsetDateTime.now().minusMinutes(1)));
        assertEquals(0, job.getRunAt().getSecond());
        assertEquals(1L, jobRepository.count());
        assertTrue(processedJobIds.contains(enqueued.getId()));
    }

    @Test
    void shouldRescheduleStaticRecurringJobAfterFailureAndRecordError() {
        Job enqueued = jobClient.enqueue("FAILING_JOB", new CronMethodPayload("tick"), "0 0 1 1 *");
        makeDue(enqueued.getId());

        awaitAttempts(enqueued.getId(), 1);

        Job job = reload(enqueued.getId());
        assertEquals(1, job.getAttempts());
        assertTrue(job.getLastError().contains("Fail!"));
        assertNull(job.getFailedAt());
        assertEquals(1, job.getRunAt().getDayOfMonth());
        assertEquals(1, job.getRunAt().getMonthValue());
    }

    @Test
    void shouldReclaimRecurringJobLeftLockedByCrashedNode() {
        Job enqueued = jobClient.enqueue("SUCCEEDING_JOB", new CronMethodPayload("tick"), "* * * * *");
        jdbcTemplate.update("""
                UPDATE cronq_jobs
                SET run_at = CURRENT_TIMESTAMP - INTERVAL '1 hour',
                    processing_started_at = CURRENT_TIMESTAMP - INTERVAL '1 hour',
                    locked_at = CURRENT_TIMESTAMP - INTERVAL '1 hour',
                    locked_by = 'node-crashed'
                WHERE id = ?
                """, enqueued.getId());

        awaitAttempts(enqueued.getId(), 1);

        Job job = reload(enqueued.getId());
        assertNull(job.getProcessingStartedAt());
        assertTrue(job.getRunAt().isAfter(OffsetDateTime.now().minusMinutes(1)));
        assertTrue(processedJobIds.contains(enqueued.getId()));
    }

    @Test
    void shouldClaimDueRowsByRunAtThenCreatedAt() {
        // no worker is registered for this type, so the poller leaves the rows alone
        UUID later = UUID.randomUUID();
        UUID earlierCreatedSecond = UUID.randomUUID();
        UUID earlierCreatedFirst = UUID.randomUUID();
        UUID notDue = UUID.randomUUID();
        String insert = """
                INSERT INTO cronq_jobs (id, type, run_at, created_at)
                VALUES (?, 'UNCLAIMED_JOB', CURRENT_TIMESTAMP + CAST(? AS INTERVAL),
                        CURRENT_TIMESTAMP + CAST(? AS INTERVAL))
                """;
        jdbcTemplate.update(insert, later, "-1 minute", "-3 hours");
        jdbcTemplate.update(insert, earlierCreatedSecond, "-1 hour", "-1 hour");
        jdbcTemplate.update(insert, earlierCreatedFirst, "-1 hour", "-2 hours");
        jdbcTemplate.update(insert, notDue, "1 hour", "-4 hours");

        OffsetDateTime now = OffsetDateTime.now();
        List<UUID> claimed = new TransactionTemplate(transactionManager).execute(status -> jobRepository
                .findNextJobsForUpdate("UNCLAIMED_JOB", now, now.minusHours(4), PageRequest.of(0, 10))
                .stream()
                .map(Job::getId)
                .collect(Collectors.toList()));

        assertEquals(List.of(earlierCreatedFirst, earlierCreatedSecond, later), claimed);
    }

    @Test
    void shouldDeleteOneShotJobAfterSuccess() {
        UUID jobId = jobClient.enqueue("SUCCEEDING_JOB", new CronMethodPayload("once"));

        await().atMost(Duration.ofSeconds(20)).until(() -> !jobRepository.existsById(jobId));

        assertTrue(processedJobIds.contains(jobId));
    }

    @Test
    void shouldRetryFailedOneShotJobWithBackoff() {
        UUID jobId = jobClient.enqueue("FAILING_JOB", new CronMethodPayload("once"));

        awaitAttempts(jobId, 1);

        Job job = reload(jobId);
        assertTrue(job.getLastError().contains("Fail!"));
        assertNull(job.getFailedAt());
        assertEquals("PENDING", job.getStatus());
        assertTrue(job.getRunAt().isAfter(job.getCreatedAt()));
    }

    @Test
    void shouldFollowDynamicScheduleAcrossAttempts() {
        Job enqueued = jobClient.enqueue(CronMethodWorker.TYPE, new CronMethodPayload("dynamic"),
                ScheduleExpression.dynamic(CronMethodPayload.HOOK));
        assertEquals(2, enqueued.getRunAt().getMonthValue());
        makeDue(enqueued.getId());

        awaitAttempts(enqueued.getId(), 1);

        Job job = reload(enqueued.getId());
        assertEquals(1, job.getAttempts());
        assertEquals(1, job.getRunAt().getMonthValue());
        assertEquals(1, job.getRunAt().getDayOfMonth());
    }

    @Test
    void shouldStoreLongCronExpression() {
        String expression = String.join(" ", listOf(0, 59), listOf(0, 23), listOf(1, 31), listOf(1, 12),
                listOf(0, 6));

        Job enqueued = jobClient.enqueue("FAILING_JOB", new CronMethodPayload("long"), expression);

        assertEquals(ScheduleExpression.cron(expression), reload(enqueued.getId()).getSchedule());
    }

    private static String listOf(int from, int to) {
        return IntStream.rangeClosed(from, to).mapToObj(Integer::toString).collect(Collectors.joining(","));
    }

    @Test
    void shouldNotStoreJobWithInvalidCron() {
        assertThrows(InvalidScheduleException.class,
                () -> jobClient.enqueue("SUCCEEDING_JOB", new CronMethodPayload("x"), "no valid cron"));

        assertEquals(0L, jobRepository.count());
        assertFalse(processedJobIds.iterator().hasNext());
    }
}
