package io.cronwarden.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.cronwarden.JobResult;
import io.cronwarden.ScheduledJob;
import io.cronwarden.Scheduler;
import io.cronwarden.core.JobDefinition;
import io.cronwarden.core.JobRegistry;
import io.cronwarden.core.ScheduleKind;
import io.cronwarden.internal.memory.InMemoryExecutionStore;
import io.cronwarden.internal.mongo.MongoExecutionStore;
import io.cronwarden.quality.QualityAuditJob;
import io.cronwarden.store.ExecutionStore;
import io.cronwarden.trigger.MarketGatedJob;
import io.cronwarden.trigger.MarketSessionGate;
import io.cronwarden.trigger.ThresholdTriggerJob;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class CronwardenAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(CronwardenConfig.class))
            .withBean(MongoTemplate.class, () -> mock(MongoTemplate.class))
            .withBean(ObjectMapper.class, ObjectMapper::new)
            .withBean(ScheduledJob.class, DemoJob::new)
            .withPropertyValues(
                    "cronwarden.enabled=true",
                    "cronwarden.auto-startup=false"
            );

    @Test
    void shouldAutoConfigureSchedulerBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(Scheduler.class);
            assertThat(context).hasSingleBean(CronwardenLifecycle.class);
            assertThat(context).hasSingleBean(CronwardenProperties.class);
            assertThat(context).hasSingleBean(JobRegistry.class);
            assertThat(context).doesNotHaveBean("cronwardenIndexesInitializer");
            assertThat(context.getBean(ExecutionStore.class)).isInstanceOf(MongoExecutionStore.class);
            assertThat(context.getBean(CronwardenLifecycle.class).isAutoStartup()).isFalse();

            JobRegistry registry = context.getBean(JobRegistry.class);
            assertThat(registry.all()).extracting(JobDefinition::id).containsExactly("demo", "email-digest");
        });
    }

    @Test
    void shouldBuildJobsFromProperties() {
        contextRunner
                .withPropertyValues(
                        "cronwarden.default-job-timeout=2m",
                        "cronwarden.jobs[0].id=congress-collector",
                        "cronwarden.jobs[0].name=Congress Trades Collector",
                        "cronwarden.jobs[0].schedule=*/15 * * * *",
                        "cronwarden.jobs[0].target=http://localhost:8080/collect/congress",
                        "cronwarden.jobs[0].params.limit=50",
                        "cronwarden.jobs[1].id=intraday-signals",
                        "cronwarden.jobs[1].schedule=5 minutes",
                        "cronwarden.jobs[1].schedule-kind=INTERVAL",
                        "cronwarden.jobs[1].market-hours-only=true",
                        "cronwarden.jobs[1].target=http://localhost:8080/signals",
                        "cronwarden.quality.tiers.fast.enabled=true",
                        "cronwarden.quality.tiers.fast.checks[0].id=completeness",
                        "cronwarden.quality.tiers.fast.checks[0].target=http://localhost:8080/quality/completeness",
                        "cronwarden.threshold-triggers[0].id=portfolio-rebalance",
                        "cronwarden.threshold-triggers[0].threshold=500",
                        "cronwarden.threshold-triggers[0].target=http://localhost:8080/portfolio/rebalance",
                        "cronwarden.digest.enabled=false"
                )
                .run(context -> {
                    JobRegistry registry = context.getBean(JobRegistry.class);
                    assertThat(registry.all()).extracting(JobDefinition::id).containsExactly(
                            "demo", "congress-collector", "intraday-signals", "data-quality-tier1", "portfolio-rebalance");

                    JobDefinition collector = registry.getRequired("congress-collector");
                    assertThat(collector.displayName()).isEqualTo("Congress Trades Collector");
                    assertThat(collector.timeout()).isEqualTo(Duration.ofMinutes(2));

                    JobDefinition signals = registry.getRequired("intraday-signals");
                    assertThat(signals.scheduleKind()).isEqualTo(ScheduleKind.INTERVAL);
                    assertThat(signals.schedule().source()).isEqualTo("*/5 * * * *");
                    assertThat(signals.job()).isInstanceOf(MarketGatedJob.class);

                    assertThat(registry.getRequired("data-quality-tier1").job()).isInstanceOf(QualityAuditJob.class);
                    assertThat(registry.getRequired("portfolio-rebalance").job()).isInstanceOf(ThresholdTriggerJob.class);
                });
    }

    @Test
    void shouldBindMarketSession() {
        contextRunner
                .withPropertyValues(
                        "cronwarden.market-session.zone=Europe/London",
                        "cronwarden.market-session.open=08:00",
                        "cronwarden.market-session.close=16:30",
                        "cronwarden.market-session.days=MONDAY,WEDNESDAY"
                )
                .run(context -> {
                    MarketSessionGate gate = context.getBean(MarketSessionGate.class);
                    assertThat(gate.zone()).isEqualTo(ZoneId.of("Europe/London"));
                    assertThat(gate.open()).isEqualTo(LocalTime.of(8, 0));
                    assertThat(gate.close()).isEqualTo(LocalTime.of(16, 30));
                    assertThat(gate.tradingDays()).containsExactlyInAnyOrder(DayOfWeek.MONDAY, DayOfWeek.WEDNESDAY);
                });
    }

    @Test
    void shouldBackOffForUserDefinedStore() {
        contextRunner
                .withBean(ExecutionStore.class, InMemoryExecutionStore::new)
                .run(context -> assertThat(context.getBean(ExecutionStore.class))
                        .isInstanceOf(InMemoryExecutionStore.class));
    }

    @Test
    void shouldFailOnDuplicateJobIds() {
        contextRunner
                .withPropertyValues(
                        "cronwarden.jobs[0].id=demo",
                        "cronwarden.jobs[0].schedule=* * * * *",
                        "cronwarden.jobs[0].target=http://localhost:8080/demo"
                )
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void shouldFailOnInvalidSchedule() {
        contextRunner
                .withPropertyValues(
                        "cronwarden.jobs[0].id=broken",
                        "cronwarden.jobs[0].schedule=61 * * * *",
                        "cronwarden.jobs[0].target=http://localhost:8080/broken"
                )
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void shouldFailOnIntervalThatDoesNotDivideEvenly() {
        contextRunner
                .withPropertyValues(
                        "cronwarden.jobs[0].id=uneven",
                        "cronwarden.jobs[0].schedule=7 minutes",
                        "cronwarden.jobs[0].schedule-kind=INTERVAL",
                        "cronwarden.jobs[0].target=http://localhost:8080/uneven"
                )
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void shouldBindMisfireGrace() {
        contextRunner
                .withPropertyValues("cronwarden.misfire-grace=90s")
                .run(context -> {
                    assertThat(context.getBean(CronwardenProperties.class).getMisfireGrace())
                            .isEqualTo(Duration.ofSeconds(90));
                    assertThat(context).hasSingleBean(Scheduler.class);
                });
    }

    @Test
    void shouldNotConfigureWhenDisabled() {
        contextRunner
                .withPropertyValues("cronwarden.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(Scheduler.class);
                    assertThat(context).doesNotHaveBean(CronwardenLifecycle.class);
                });
    }

    static class DemoJob implements ScheduledJob {
        @Override
        public String id() {
            return "demo";
        }

        @Override
        public String schedule() {
            return "0 * * * *";
        }

        @Override
        public JobResult run() {
            return JobResult.ok("noop");
        }
    }
}
