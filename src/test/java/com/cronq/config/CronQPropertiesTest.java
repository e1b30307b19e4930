package com.cronq.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CronQPropertiesTest {

    @Configuration
    @EnableConfigurationProperties(CronQProperties.class)
    static class Config {
    }

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(Config.class);

    @Test
    void shouldMapDefaultCronqProperties() {
        contextRunner.run(context -> {
            CronQProperties properties = context.getBean(CronQProperties.class);
            assertEquals(15, properties.getBackgroundJobServer().getPollIntervalInSeconds());
            assertTrue(properties.getBackgroundJobServer().getWorkerCount() >= 1);
            assertTrue(properties.getBackgroundJobServer().isEnabled());
            assertEquals(Duration.ofHours(4), properties.getBackgroundJobServer().getMaxRunTime());
            assertEquals(Duration.ofHours(72), properties.getBackgroundJobServer().getDeleteFailedJobsAfter());
            assertEquals(25, properties.getJobs().getMaxAttempts());
            assertEquals(Duration.ofSeconds(5), properties.getJobs().getInitialBackoff());
            assertEquals(CronQProperties.Clock.Source.DATABASE, properties.getClock().getSource());
            assertFalse(properties.getDatabase().isSkipCreate());
            assertTrue(properties.getDatabase().isFailOnMigrationError());
        });
    }

    @Test
    void shouldMapCustomCronqProperties() {
        contextRunner
                .withPropertyValues(
                        "cronq.background-job-server.poll-interval-in-seconds=1",
                        "cronq.background-job-server.worker-count=5",
                        "cronq.background-job-server.max-run-time=30s",
                        "cronq.background-job-server.delete-failed-jobs-after=7d",
                        "cronq.jobs.max-attempts=3",
                        "cronq.jobs.initial-backoff=250ms",
                        "cronq.jobs.backoff-multiplier=1.5",
                        "cronq.clock.source=system",
                        "cronq.database.table-prefix=app_",
                        "cronq.database.skip-create=true")
                .run(context -> {
                    CronQProperties properties = context.getBean(CronQProperties.class);
                    assertEquals(1, properties.getBackgroundJobServer().getPollIntervalInSeconds());
                    assertEquals(5, properties.getBackgroundJobServer().getWorkerCount());
                    assertEquals(Duration.ofSeconds(30), properties.getBackgroundJobServer().getMaxRunTime());
                    assertEquals(Duration.ofDays(7), properties.getBackgroundJobServer().getDeleteFailedJobsAfter());
                    assertEquals(3, properties.getJobs().getMaxAttempts());
                    assertEquals(Duration.ofMillis(250), properties.getJobs().getInitialBackoff());
                    assertEquals(1.5, properties.getJobs().getBackoffMultiplier());
                    assertEquals(CronQProperties.Clock.Source.SYSTEM, properties.getClock().getSource());
                    assertEquals("app_", properties.getDatabase().getTablePrefix());
                    assertTrue(properties.getDatabase().isSkipCreate());
                });
    }
}
