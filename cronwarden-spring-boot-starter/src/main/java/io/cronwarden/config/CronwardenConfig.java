package io.cronwarden.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.cronwarden.ScheduledJob;
import io.cronwarden.Scheduler;
import io.cronwarden.alert.AlertSink;
import io.cronwarden.alert.DigestNotifier;
import io.cronwarden.alert.DigestQueue;
import io.cronwarden.alert.LoggingAlertSink;
import io.cronwarden.alert.LoggingDigestNotifier;
import io.cronwarden.core.JobDefinition;
import io.cronwarden.core.JobRegistry;
import io.cronwarden.internal.DefaultScheduler;
import io.cronwarden.internal.mongo.MongoExecutionStore;
import io.cronwarden.internal.mongo.MongoQualityResultStore;
import io.cronwarden.internal.mongo.MongoThresholdBaselineStore;
import io.cronwarden.quality.TieredCheckAggregator;
import io.cronwarden.remote.ActionInvoker;
import io.cronwarden.remote.HttpActionInvoker;
import io.cronwarden.store.ExecutionStore;
import io.cronwarden.store.QualityResultStore;
import io.cronwarden.store.ThresholdBaselineStore;
import io.cronwarden.trigger.MarketSessionGate;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.mongo.MongoClientSettingsBuilderCustomizer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Spring Boot auto-configuration entrypoint for cronwarden components.
 */
@AutoConfiguration
@ConditionalOnClass({Scheduler.class, MongoTemplate.class})
@EnableConfigurationProperties(CronwardenProperties.class)
@ConditionalOnProperty(prefix = "cronwarden", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CronwardenConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock cronwardenClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public ExecutionStore executionStore(MongoTemplate mongoTemplate) {
        return new MongoExecutionStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public QualityResultStore qualityResultStore(MongoTemplate mongoTemplate) {
        return new MongoQualityResultStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public ThresholdBaselineStore thresholdBaselineStore(MongoTemplate mongoTemplate) {
        return new MongoThresholdBaselineStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    protected CronwardenMongoIndexConfig cronwardenMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new CronwardenMongoIndexConfig(mongoTemplate);
    }

    /**
     * Bounds every store round trip so a slow database cannot stall the dispatcher.
     */
    @Bean
    public MongoClientSettingsBuilderCustomizer cronwardenStoreTimeouts(CronwardenProperties props) {
        long millis = props.getStoreTimeout().toMillis();
        return builder -> builder
                .applyToSocketSettings(socket -> socket
                        .connectTimeout((int) millis, TimeUnit.MILLISECONDS)
                        .readTimeout((int) millis, TimeUnit.MILLISECONDS))
                .applyToClusterSettings(cluster -> cluster.serverSelectionTimeout(millis, TimeUnit.MILLISECONDS));
    }

    @Bean
    @ConditionalOnMissingBean
    public AlertSink alertSink() {
        return new LoggingAlertSink();
    }

    @Bean
    @ConditionalOnMissingBean
    public DigestQueue digestQueue() {
        return new DigestQueue();
    }

    @Bean
    @ConditionalOnMissingBean
    public DigestNotifier digestNotifier() {
        return new LoggingDigestNotifier();
    }

    @Bean
    @ConditionalOnMissingBean
    public ActionInvoker actionInvoker(ObjectMapper objectMapper) {
        return new HttpActionInvoker(objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public MarketSessionGate marketSessionGate(CronwardenProperties props) {
        CronwardenProperties.MarketSession session = props.getMarketSession();
        return new MarketSessionGate(ZoneId.of(session.getZone()), session.getDays(), session.getOpen(), session.getClose());
    }

    @Bean
    @ConditionalOnMissingBean
    public TieredCheckAggregator tieredCheckAggregator(QualityResultStore store,
                                                       AlertSink alertSink,
                                                       DigestQueue digestQueue,
                                                       DigestNotifier notifier,
                                                       Clock clock) {
        return new TieredCheckAggregator(store, alertSink, digestQueue, notifier, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public ConfiguredJobFactory configuredJobFactory(CronwardenProperties props,
                                                     ActionInvoker invoker,
                                                     ObjectMapper objectMapper,
                                                     MarketSessionGate gate,
                                                     Clock clock,
                                                     TieredCheckAggregator aggregator,
                                                     ExecutionStore executionStore,
                                                     ThresholdBaselineStore baselineStore,
                                                     DigestQueue digestQueue,
                                                     DigestNotifier digestNotifier) {
        return new ConfiguredJobFactory(props, invoker, objectMapper, gate, clock, aggregator,
                executionStore, baselineStore, digestQueue, digestNotifier);
    }

    /**
     * Application {@link ScheduledJob} beans first, then the jobs described under {@code cronwarden.*}.
     */
    @Bean
    @ConditionalOnMissingBean
    public JobRegistry jobRegistry(CronwardenProperties props,
                                   ObjectProvider<ScheduledJob> jobBeans,
                                   ConfiguredJobFactory factory) {
        AtomicReference<JobRegistry> built = new AtomicReference<>();
        List<ScheduledJob> jobs = new ArrayList<>(jobBeans.orderedStream().toList());
        jobs.addAll(factory.build(() -> {
            JobRegistry registry = built.get();
            return registry == null ? List.<JobDefinition>of() : registry.all();
        }));
        JobRegistry registry = new JobRegistry(jobs, props.getDefaultJobTimeout(), props.getDefaultAlertThreshold());
        built.set(registry);
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public Scheduler scheduler(CronwardenProperties props,
                               JobRegistry registry,
                               ExecutionStore store,
                               AlertSink alertSink,
                               Clock clock) {
        return new DefaultScheduler(registry, store, alertSink, clock, ZoneId.of(props.getZone()),
                props.getShutdownGracePeriod(), props.getMisfireGrace());
    }

    @Bean
    @ConditionalOnMissingBean
    public CronwardenLifecycle cronwardenLifecycle(Scheduler scheduler, CronwardenProperties props) {
        return new CronwardenLifecycle(scheduler, props.isAutoStartup());
    }

    @Bean
    @ConditionalOnProperty(prefix = "cronwarden", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton cronwardenIndexesInitializer(CronwardenMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}
