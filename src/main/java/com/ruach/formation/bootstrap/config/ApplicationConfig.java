package com.ruach.formation.bootstrap.config;

import java.time.Clock;
import java.util.List;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.kafka.core.KafkaTemplate;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ruach.formation.adapters.codec.FormationEventCodec;
import com.ruach.formation.adapters.out.kafka.KafkaNotificationPublisher;
import com.ruach.formation.adapters.out.memory.InMemoryDeduplicationStore;
import com.ruach.formation.adapters.out.memory.InMemoryFormationEventStore;
import com.ruach.formation.adapters.out.postgres.PostgresFormationEventStore;
import com.ruach.formation.adapters.out.redis.RedisDeduplicationStore;
import com.ruach.formation.application.guard.DeduplicationService;
import com.ruach.formation.application.guard.FormationDataCache;
import com.ruach.formation.application.guard.RetryExecutor;
import com.ruach.formation.application.guard.RetryOptions;
import com.ruach.formation.application.port.out.DeduplicationStore;
import com.ruach.formation.application.port.out.FormationEventStore;
import com.ruach.formation.application.port.out.FormationNotificationPublisher;
import com.ruach.formation.application.service.AxiomUnlockResult;
import com.ruach.formation.application.service.AxiomUnlockService;
import com.ruach.formation.application.service.FormationEventFactory;
import com.ruach.formation.application.service.FormationJourneyService;
import com.ruach.formation.application.service.FormationStateReducer;
import com.ruach.formation.application.service.PhaseProgressionPolicy;
import com.ruach.formation.application.service.ReadinessAnalyzer;
import com.ruach.formation.application.service.ReadinessRecommender;
import com.ruach.formation.application.service.ReadinessThresholds;
import com.ruach.formation.application.service.ReflectionSubmissionService;
import com.ruach.formation.application.service.SubmissionResult;
import com.ruach.formation.domain.catalog.AxiomCatalog;
import com.ruach.formation.domain.catalog.CheckpointCatalog;
import com.ruach.formation.domain.catalog.PhaseCatalog;

import io.micrometer.core.instrument.MeterRegistry;

/**
 * Application-level bean configuration.
 * <p>
 * Wires application services with adapter implementations via constructor
 * injection. The application layer stays free of Spring annotations; every
 * service is created here.
 * </p>
 */
@Configuration
public class ApplicationConfig {

    /**
     * Jackson ObjectMapper configured for production use.
     * - Java 8 Time support (Instant, Duration)
     * - ISO-8601 strings instead of numeric timestamps
     * - Lenient deserialization (ignore unknown properties)
     */
    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.enable(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_AS_NULL);
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // ─────────────────── Catalogs ───────────────────

    @Bean
    public PhaseCatalog phaseCatalog() {
        return PhaseCatalog.defaults();
    }

    @Bean
    public CheckpointCatalog checkpointCatalog() {
        return CheckpointCatalog.defaults();
    }

    @Bean
    public AxiomCatalog axiomCatalog() {
        return AxiomCatalog.defaults();
    }

    // ─────────────────── Outbound adapters ───────────────────

    @Bean
    @ConditionalOnProperty(name = "formation.event-store", havingValue = "postgres", matchIfMissing = true)
    public FormationEventStore postgresFormationEventStore(JdbcTemplate jdbcTemplate, FormationEventCodec codec) {
        return new PostgresFormationEventStore(jdbcTemplate, codec);
    }

    @Bean
    @ConditionalOnProperty(name = "formation.event-store", havingValue = "memory")
    public FormationEventStore inMemoryFormationEventStore() {
        return new InMemoryFormationEventStore();
    }

    @Bean
    @ConditionalOnProperty(name = "formation.dedup.store", havingValue = "redis")
    public DeduplicationStore<SubmissionResult> redisDeduplicationStore(StringRedisTemplate redisTemplate,
            ObjectMapper objectMapper, FormationProperties properties) {
        return new RedisDeduplicationStore(redisTemplate, objectMapper, properties.getDedup().getRedisPrefix());
    }

    @Bean
    @ConditionalOnProperty(name = "formation.dedup.store", havingValue = "memory", matchIfMissing = true)
    public DeduplicationStore<SubmissionResult> inMemoryDeduplicationStore() {
        return new InMemoryDeduplicationStore<>();
    }

    @Bean
    public FormationNotificationPublisher formationNotificationPublisher(
            KafkaTemplate<String, String> kafkaTemplate,
            StringRedisTemplate redisTemplate,
            ObjectMapper objectMapper,
            FormationProperties properties,
            MeterRegistry meterRegistry) {
        return new KafkaNotificationPublisher(kafkaTemplate, redisTemplate, objectMapper, properties,
                meterRegistry);
    }

    // ─────────────────── Guard ───────────────────

    @Bean
    public DeduplicationService<SubmissionResult> submissionDeduplicationService(
            DeduplicationStore<SubmissionResult> store, Clock clock, FormationProperties properties) {
        FormationProperties.Dedup dedup = properties.getDedup();
        return new DeduplicationService<>(store, clock,
                Math.max(dedup.getRetentionMs(), dedup.getCooldownMs()),
                dedup.getInFlightTimeoutMs());
    }

    @Bean
    public FormationDataCache<List<AxiomUnlockResult>> axiomStatusCache(Clock clock,
            FormationProperties properties) {
        return new FormationDataCache<>(clock, properties.getCache().getMaximumSize());
    }

    @Bean
    public RetryExecutor eventStoreRetryExecutor() {
        return new RetryExecutor("formation-event-store");
    }

    /**
     * Validation and state errors are deterministic; only infrastructure
     * failures are worth another attempt.
     */
    @Bean
    public RetryOptions eventStoreRetryOptions(FormationProperties properties) {
        FormationProperties.Retry retry = properties.getRetry();
        return new RetryOptions(retry.getMaxAttempts(), retry.getInitialDelayMs(), retry.getBackoffMultiplier(),
                List.of(IllegalArgumentException.class, IllegalStateException.class));
    }

    // ─────────────────── Application services ───────────────────

    @Bean
    public FormationStateReducer formationStateReducer() {
        return new FormationStateReducer();
    }

    @Bean
    public FormationEventFactory formationEventFactory(Clock clock) {
        return new FormationEventFactory(clock);
    }

    @Bean
    public AxiomUnlockService axiomUnlockService(AxiomCatalog axiomCatalog) {
        return new AxiomUnlockService(axiomCatalog);
    }

    @Bean
    public PhaseProgressionPolicy phaseProgressionPolicy(PhaseCatalog phaseCatalog) {
        return new PhaseProgressionPolicy(phaseCatalog);
    }

    @Bean
    public ReadinessThresholds readinessThresholds(FormationProperties properties) {
        FormationProperties.Readiness r = properties.getReadiness();
        return ReadinessThresholds.builder()
                .stalledAfterDays(r.getStalledAfterDays())
                .disengagedAfterDays(r.getDisengagedAfterDays())
                .missingReflectionGraceHours(r.getMissingReflectionGraceHours())
                .speedRunDwellRatio(r.getSpeedRunDwellRatio())
                .maxCheckpointsPerDay(r.getMaxCheckpointsPerDay())
                .surfaceWordCeiling(r.getSurfaceWordCeiling())
                .surfaceShare(r.getSurfaceShare())
                .surfaceMinimumReflections(r.getSurfaceMinimumReflections())
                .depthDeveloping(r.getDepthDevelopingReflections(), r.getDepthDevelopingWords())
                .depthMaturing(r.getDepthMaturingReflections(), r.getDepthMaturingWords())
                .depthEstablished(r.getDepthEstablishedReflections(), r.getDepthEstablishedWords())
                .canonLevels(r.getCanonDeveloping(), r.getCanonMaturing(), r.getCanonEstablished())
                .build();
    }

    @Bean
    public ReadinessAnalyzer readinessAnalyzer(ReadinessThresholds thresholds, PhaseCatalog phaseCatalog,
            CheckpointCatalog checkpointCatalog) {
        return new ReadinessAnalyzer(thresholds, phaseCatalog, checkpointCatalog);
    }

    @Bean
    public ReadinessRecommender readinessRecommender() {
        return new ReadinessRecommender();
    }

    /**
     * FormationJourneyService implements both the activity and the query
     * inbound ports.
     */
    @Bean
    public FormationJourneyService formationJourneyService(
            FormationEventStore eventStore,
            FormationStateReducer reducer,
            FormationEventFactory eventFactory,
            CheckpointCatalog checkpointCatalog,
            AxiomUnlockService axiomUnlockService,
            ReadinessAnalyzer readinessAnalyzer,
            ReadinessRecommender readinessRecommender,
            PhaseProgressionPolicy phaseProgressionPolicy,
            FormationNotificationPublisher notificationPublisher,
            FormationDataCache<List<AxiomUnlockResult>> axiomStatusCache,
            FormationProperties properties,
            Clock clock) {
        return new FormationJourneyService(eventStore, reducer, eventFactory, checkpointCatalog,
                axiomUnlockService, readinessAnalyzer, readinessRecommender, phaseProgressionPolicy,
                notificationPublisher, axiomStatusCache, properties.getCache().getAxiomStatusTtlMs(), clock);
    }

    @Bean
    public ReflectionSubmissionService reflectionSubmissionService(
            FormationEventStore eventStore,
            FormationStateReducer reducer,
            FormationEventFactory eventFactory,
            CheckpointCatalog checkpointCatalog,
            AxiomUnlockService axiomUnlockService,
            DeduplicationService<SubmissionResult> deduplicationService,
            RetryExecutor retryExecutor,
            RetryOptions retryOptions,
            FormationNotificationPublisher notificationPublisher,
            FormationProperties properties,
            Clock clock) {
        return new ReflectionSubmissionService(eventStore, reducer, eventFactory, checkpointCatalog,
                axiomUnlockService, deduplicationService, retryExecutor, retryOptions, notificationPublisher,
                clock, properties.getReflection().getMinWords(), properties.getDedup().getCooldownMs());
    }
}
