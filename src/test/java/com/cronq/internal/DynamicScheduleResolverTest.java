package com.cronq.internal;

import com.cronq.CronMethodPayload;
import com.cronq.CronMethodWorker;
import com.cronq.JobSnapshot;
import com.cronq.JobWorker;
import com.cronq.config.CronQProperties;
import com.cronq.schedule.CronSchedule;
import com.cronq.schedule.ScheduleExpression;
import com.cronq.schedule.ScheduleHook;
import com.cronq.schedule.ScheduleHookProvider;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class DynamicScheduleResolverTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(2024, 3, 10, 2, 0, 0, 0, ZoneOffset.UTC);

    public static class ScriptedHookPayload implements ScheduleHookProvider {

        private String cron;
        private boolean fail;

        public ScriptedHookPayload() {
        }

        ScriptedHookPayload(String cron, boolean fail) {
            this.cron = cron;
            this.fail = fail;
        }

        public String getCron() {
            return cron;
        }

        public void setCron(String cron) {
            this.cron = cron;
        }

        public boolean isFail() {
            return fail;
        }

        public void setFail(boolean fail) {
            this.fail = fail;
        }

        @Override
        public Optional<ScheduleHook> findScheduleHook(String hookName) {
            if (!"next".equals(hookName)) {
                return Optional.empty();
            }
            return Optional.of(job -> {
                if (fail) {
                    throw new IllegalStateException("hook exploded");
                }
                return Optional.ofNullable(cron);
            });
        }
    }

    @com.cronq.annotation.Job("SCRIPTED_HOOK_JOB")
    static class ScriptedHookWorker implements JobWorker<ScriptedHookPayload> {
        @Override
        public void process(UUID jobId, ScriptedHookPayload payload) {
            // no-op
        }
    }

    @com.cronq.annotation.Job("TEXT_JOB")
    static class TextWorker implements JobWorker<String> {
        @Override
        public void process(UUID jobId, String payload) {
            // no-op
        }
    }

    private final ObjectMapper objectMapper = new ObjectMapper();
    private DynamicScheduleResolver resolver;

    @BeforeEach
    void setUp() {
        JobTypeRegistry registry = new JobTypeRegistry(
                List.of(new CronMethodWorker(), new ScriptedHookWorker(), new TextWorker()),
                objectMapper, new CronQProperties());
        registry.init();
        resolver = new DynamicScheduleResolver(registry);
    }

    private JobSnapshot job(String type, Object payload, String hook, int attempts) {
        JsonNode json = payload == null ? null : objectMapper.valueToTree(payload);
        return new JobSnapshot(UUID.randomUUID(), type, json, ScheduleExpression.dynamic(hook), NOW, attempts, null,
                NOW);
    }

    private ScheduleResolution resolveScripted(String cron, boolean fail) {
        return resolver.resolve("next", job("SCRIPTED_HOOK_JOB", new ScriptedHookPayload(cron, fail), "next", 0));
    }

    @Test
    void shouldResolveCronFromHookUsingJobAttempts() {
        ScheduleResolution even = resolver.resolve(CronMethodPayload.HOOK,
                job(CronMethodWorker.TYPE, new CronMethodPayload("hi"), CronMethodPayload.HOOK, 2));
        ScheduleResolution odd = resolver.resolve(CronMethodPayload.HOOK,
                job(CronMethodWorker.TYPE, new CronMethodPayload("hi"), CronMethodPayload.HOOK, 3));

        assertThat(even).isEqualTo(ScheduleResolution.resolved(CronSchedule.parse(CronMethodPayload.EVEN_ATTEMPTS_CRON)));
        assertThat(odd).isEqualTo(ScheduleResolution.resolved(CronSchedule.parse(CronMethodPayload.ODD_ATTEMPTS_CRON)));
    }

    @Test
    void shouldStopWhenHookReturnsNoSchedule() {
        ScheduleResolution resolution = resolver.resolve(CronMethodPayload.HOOK,
                job(CronMethodWorker.TYPE, new CronMethodPayload("hi"), CronMethodPayload.HOOK, 11));

        assertThat(resolution).isSameAs(ScheduleResolution.stopped());
        assertThat(resolveScripted(null, false)).isSameAs(ScheduleResolution.stopped());
        assertThat(resolveScripted("  ", false)).isSameAs(ScheduleResolution.stopped());
    }

    @Test
    void shouldReportUnknownJobType() {
        ScheduleResolution resolution = resolver.resolve("next", job("NOT_REGISTERED", null, "next", 0));

        assertThat(resolution).isInstanceOfSatisfying(ScheduleResolution.Unavailable.class,
                unavailable -> assertThat(unavailable.reason()).isEqualTo(ScheduleResolution.Reason.UNKNOWN_JOB_TYPE));
    }

    @Test
    void shouldReportPayloadThatCannotBeRead() {
        ScheduleResolution resolution = resolver.resolve(CronMethodPayload.HOOK,
                job(CronMethodWorker.TYPE, Map.of("unknownField", 1), CronMethodPayload.HOOK, 0));

        assertThat(resolution).isInstanceOfSatisfying(ScheduleResolution.Unavailable.class,
                unavailable -> assertThat(unavailable.reason())
                        .isEqualTo(ScheduleResolution.Reason.DESERIALIZATION_FAILED));
    }

    @Test
    void shouldReportPayloadThatIsNotAHookProvider() {
        ScheduleResolution text = resolver.resolve("next", job("TEXT_JOB", "plain text", "next", 0));
        ScheduleResolution missing = resolver.resolve(CronMethodPayload.HOOK,
                job(CronMethodWorker.TYPE, null, CronMethodPayload.HOOK, 0));

        assertThat(text).isInstanceOfSatisfying(ScheduleResolution.Unavailable.class,
                unavailable -> assertThat(unavailable.reason())
                        .isEqualTo(ScheduleResolution.Reason.NOT_A_HOOK_PROVIDER));
        assertThat(missing).isInstanceOfSatisfying(ScheduleResolution.Unavailable.class,
                unavailable -> assertThat(unavailable.reason())
                        .isEqualTo(ScheduleResolution.Reason.NOT_A_HOOK_PROVIDER));
    }

    @Test
    void shouldReportUnknownHookName() {
        ScheduleResolution resolution = resolver.resolve("otherHook",
                job(CronMethodWorker.TYPE, new CronMethodPayload("hi"), "otherHook", 0));

        assertThat(resolution).isInstanceOfSatisfying(ScheduleResolution.Unavailable.class,
                unavailable -> assertThat(unavailable.reason()).isEqualTo(ScheduleResolution.Reason.HOOK_NOT_FOUND));
    }

    @Test
    void shouldReportHookThatThrows() {
        assertThat(resolveScripted("* * * * *", true)).isInstanceOfSatisfying(ScheduleResolution.Unavailable.class,
                unavailable -> {
                    assertThat(unavailable.reason()).isEqualTo(ScheduleResolution.Reason.HOOK_FAILED);
                    assertThat(unavailable.detail()).contains("hook exploded");
                });
    }

    @Test
    void shouldReportHookReturningInvalidCron() {
        assertThat(resolveScripted("no valid cron", false)).isInstanceOfSatisfying(
                ScheduleResolution.Unavailable.class,
                unavailable -> assertThat(unavailable.reason()).isEqualTo(ScheduleResolution.Reason.INVALID_SCHEDULE));
    }
}
