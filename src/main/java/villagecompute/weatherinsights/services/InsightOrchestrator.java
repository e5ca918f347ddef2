/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherinsights.services;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;

import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import io.smallrye.faulttolerance.api.CircuitBreakerMaintenance;
import io.smallrye.faulttolerance.api.CircuitBreakerState;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.weatherinsights.api.types.Audience;
import villagecompute.weatherinsights.api.types.BatchInsightEntryType;
import villagecompute.weatherinsights.api.types.DataQualityReportType;
import villagecompute.weatherinsights.api.types.InsightBundleType;
import villagecompute.weatherinsights.api.types.InsightStatus;
import villagecompute.weatherinsights.api.types.KnowledgeBaseStatsType;
import villagecompute.weatherinsights.api.types.KnowledgePassageType;
import villagecompute.weatherinsights.api.types.LocationType;
import villagecompute.weatherinsights.api.types.PipelineFailureType;
import villagecompute.weatherinsights.api.types.PipelineStage;
import villagecompute.weatherinsights.api.types.RecommendationType;
import villagecompute.weatherinsights.api.types.RiskSignalType;
import villagecompute.weatherinsights.api.types.SystemStatusType;
import villagecompute.weatherinsights.api.types.WeatherObservationType;
import villagecompute.weatherinsights.api.types.WeatherSnapshotType;
import villagecompute.weatherinsights.exceptions.InvalidLocationException;
import villagecompute.weatherinsights.exceptions.ValidationException;
import villagecompute.weatherinsights.integration.ai.InsightTextGenerator;
import villagecompute.weatherinsights.integration.weather.OpenWeatherClient;
import villagecompute.weatherinsights.observability.LoggingConfig;
import villagecompute.weatherinsights.observability.PipelineMetrics;

/**
 * Runs the insight pipeline for one location, or for a batch of locations in parallel.
 *
 * <h2>Pipeline States</h2>
 *
 * <pre>
 * FETCHING -> VALIDATING -> ANALYZING -> SYNTHESIZING -> COMPLETE
 *     \            \            \              \
 *      +------------+------------+--------------+--> DEGRADED
 * </pre>
 *
 * <p>
 * A stage that fails (provider unavailable after retry, timeout, unexpected error) moves the run to {@code DEGRADED}.
 * The bundle keeps everything earlier stages produced and leaves later fields null. An unresolvable location is the one
 * failure that is not degraded around: it is rethrown as {@link InvalidLocationException}.
 *
 * <h2>Concurrency</h2>
 * <ul>
 * <li>Stages of one run are sequential.</li>
 * <li>Knowledge retrieval for independent signals of one run runs in parallel, each with its own timeout.</li>
 * <li>Batch locations run on a bounded pool ({@code insights.pipeline.batch-concurrency}); extra locations queue.
 * Results are collected by index and each location can be cancelled on its own.</li>
 * </ul>
 */
@ApplicationScoped
public class InsightOrchestrator {

    private static final Logger LOG = Logger.getLogger(InsightOrchestrator.class);

    static final String OPERATIONAL = "operational";
    static final String DEGRADED = "degraded";
    static final String ERROR = "error";

    private final WeatherObservationFetcher fetcher;
    private final DataQualityValidator validator;
    private final RiskForecastAnalyzer analyzer;
    private final KnowledgeRetriever retriever;
    private final RecommendationSynthesizer synthesizer;
    private final ProviderCallExecutor executor;
    private final PipelineMetrics metrics;
    private final Tracer tracer;
    private final CircuitBreakerMaintenance circuitBreakers;

    @ConfigProperty(
            name = "insights.pipeline.retrieval-timeout",
            defaultValue = "10s")
    Duration retrievalTimeout;

    @ConfigProperty(
            name = "insights.pipeline.batch-concurrency",
            defaultValue = "5")
    int batchConcurrency;

    @ConfigProperty(
            name = "insights.pipeline.max-batch-size",
            defaultValue = "25")
    int maxBatchSize;

    private ExecutorService batchPool;
    private ExecutorService retrievalPool;

    @Inject
    public InsightOrchestrator(WeatherObservationFetcher fetcher, DataQualityValidator validator,
            RiskForecastAnalyzer analyzer, KnowledgeRetriever retriever, RecommendationSynthesizer synthesizer,
            ProviderCallExecutor executor, PipelineMetrics metrics, Tracer tracer,
            CircuitBreakerMaintenance circuitBreakers) {
        this.fetcher = fetcher;
        this.validator = validator;
        this.analyzer = analyzer;
        this.retriever = retriever;
        this.synthesizer = synthesizer;
        this.executor = executor;
        this.metrics = metrics;
        this.tracer = tracer;
        this.circuitBreakers = circuitBreakers;
    }

    @PostConstruct
    void start() {
        batchPool = Executors.newFixedThreadPool(Math.max(1, batchConcurrency),
                daemonThreads("insight-batch-"));
        retrievalPool = Executors.newFixedThreadPool(Math.max(1, batchConcurrency) * 2,
                daemonThreads("insight-retrieval-"));
        LOG.infof("Insight orchestrator started: batchConcurrency=%d, maxBatchSize=%d", batchConcurrency, maxBatchSize);
    }

    @PreDestroy
    void shutdown() {
        batchPool.shutdownNow();
        retrievalPool.shutdownNow();
    }

    /**
     * Produces insights for one location.
     *
     * @param location
     *            location name
     * @param audience
     *            audience wire value or alias, null for the general public
     * @param latitude
     *            optional latitude; must be given together with longitude
     * @param longitude
     *            optional longitude
     * @return complete or degraded bundle
     * @throws ValidationException
     *             if the request is malformed
     * @throws InvalidLocationException
     *             if the location cannot be resolved
     */
    public InsightBundleType getWeatherInsights(String location, String audience, Double latitude, Double longitude) {
        if (location == null || location.isBlank()) {
            throw new ValidationException("location must not be blank");
        }
        if ((latitude == null) != (longitude == null)) {
            throw new ValidationException("latitude and longitude must be given together");
        }
        return run(new LocationType(location.trim(), latitude, longitude), parseAudience(audience));
    }

    /**
     * Produces insights for several locations; each location succeeds or fails on its own.
     *
     * @return one entry per location, in request order
     * @throws ValidationException
     *             if the batch is empty, too large, or the audience is unknown
     */
    public List<BatchInsightEntryType> getBatchWeatherInsights(List<String> locations, String audience) {
        return submitBatch(locations, audience).results();
    }

    /**
     * Starts a batch and returns a handle for collecting results or cancelling single locations.
     */
    public BatchHandle submitBatch(List<String> locations, String audience) {
        if (locations == null || locations.isEmpty()) {
            throw new ValidationException("locations must not be empty");
        }
        if (locations.size() > maxBatchSize) {
            throw new ValidationException(
                    "batch of " + locations.size() + " locations exceeds the limit of " + maxBatchSize);
        }
        Audience target = parseAudience(audience);

        List<String> names = new ArrayList<>();
        List<Future<InsightBundleType>> futures = new ArrayList<>();
        for (String name : locations) {
            String trimmed = name == null ? "" : name.trim();
            names.add(trimmed);
            futures.add(batchPool.submit(() -> {
                if (trimmed.isEmpty()) {
                    throw new ValidationException("location must not be blank");
                }
                return run(LocationType.named(trimmed), target);
            }));
        }
        LOG.infof("Submitted batch: locations=%d, audience=%s", names.size(), target.value());
        return new BatchHandle(names, futures);
    }

    /**
     * Reports provider and knowledge base health.
     */
    public SystemStatusType getSystemStatus() {
        KnowledgeBaseStatsType stats = retriever.stats();
        String weather = fetcher.checkAvailability() ? OPERATIONAL : ERROR;
        String generation = generationStatus();
        boolean healthy = OPERATIONAL.equals(weather) && OPERATIONAL.equals(generation) && stats.totalDocuments() > 0;
        return new SystemStatusType(healthy ? OPERATIONAL : DEGRADED, stats, weather, generation, Instant.now());
    }

    private String generationStatus() {
        try {
            CircuitBreakerState state = circuitBreakers.currentState(InsightTextGenerator.CIRCUIT_BREAKER_NAME);
            return state == CircuitBreakerState.OPEN ? ERROR : OPERATIONAL;
        } catch (IllegalArgumentException e) {
            LOG.debugf("Circuit breaker %s not registered yet: %s", InsightTextGenerator.CIRCUIT_BREAKER_NAME,
                    e.getMessage());
            return OPERATIONAL;
        }
    }

    /**
     * Runs the pipeline for one location.
     */
    InsightBundleType run(LocationType location, Audience audience) {
        Span span = tracer.spanBuilder("insights.pipeline").setAttribute("insights.location", location.name())
                .setAttribute("insights.audience", audience.value()).startSpan();
        RunState state = new RunState(location, audience);

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setRequestId(UUID.randomUUID().toString());
            LoggingConfig.setLocation(location.name());
            LoggingConfig.setAudience(audience.value());
            LOG.infof("Starting insight pipeline for %s (%s)", location.name(), audience.value());

            while (!state.stage.isTerminal()) {
                LoggingConfig.setStage(state.stage.value());
                Timer.Sample sample = metrics.startStage();
                PipelineStage current = state.stage;
                try {
                    step(state);
                } catch (InvalidLocationException e) {
                    throw e;
                } catch (RuntimeException e) {
                    LOG.errorf(e, "Unexpected failure while %s", current.value());
                    state.degrade("Internal error while " + current.value());
                } finally {
                    metrics.stopStage(sample, current.value());
                }
            }

            InsightBundleType bundle = state.toBundle();
            metrics.recordRun(bundle.status().value());
            span.setAttribute("insights.outcome", bundle.status().value());
            if (bundle.isDegraded()) {
                span.setAttribute("insights.failed_stage", bundle.failure().stage().value());
                LOG.warnf("Insight pipeline degraded at %s: %s", bundle.failure().stage().value(),
                        bundle.failure().cause());
            } else {
                LOG.infof("Insight pipeline complete: signals=%d, recommendations=%d", state.signals.size(),
                        bundle.recommendations().size());
            }
            return bundle;
        } catch (InvalidLocationException e) {
            metrics.recordRun("invalid_location");
            span.setAttribute("insights.outcome", "invalid_location");
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "invalid location");
            LOG.infof("Location could not be resolved: %s", e.getMessage());
            throw e;
        } finally {
            span.end();
            LoggingConfig.clearMDC();
        }
    }

    private void step(RunState state) {
        switch (state.stage) {
            case FETCHING -> {
                CallOutcome<WeatherObservationType> outcome = executor.execute(OpenWeatherClient.PROVIDER,
                        () -> fetcher.fetch(state.requested));
                if (!outcome.succeeded()) {
                    if (outcome.fatal() && outcome.failure() instanceof InvalidLocationException invalid) {
                        throw invalid;
                    }
                    state.degrade("Weather data provider unavailable");
                    return;
                }
                state.observation = outcome.value();
                state.advance();
            }
            case VALIDATING -> {
                state.quality = validator.validate(state.observation.current(), state.observation.forecast());
                state.advance();
            }
            case ANALYZING -> {
                state.signals = analyzer.analyze(state.observation.current(), state.observation.forecast(),
                        state.quality);
                state.trends = analyzer.trends(state.observation.forecast());
                state.advance();
            }
            case SYNTHESIZING -> {
                state.passages = retrieveAll(state.signals, state.audience);
                RecommendationSynthesizer.SynthesisResult result = synthesizer.synthesize(state.signals,
                        state.passages, state.audience, state.observation.current());
                if (!result.available()) {
                    state.degrade(result.failureCause());
                    return;
                }
                state.recommendations = RecommendationOrdering.sort(result.recommendations());
                state.summary = result.summary();
                state.advance();
            }
            case COMPLETE, DEGRADED -> throw new IllegalStateException("Run already finished: " + state.stage.value());
        }
    }

    /**
     * Retrieves passages for every signal in parallel. A retrieval that fails or times out contributes no passages.
     */
    private Map<RiskSignalType, List<KnowledgePassageType>> retrieveAll(List<RiskSignalType> signals,
            Audience audience) {
        Map<String, Object> context = MDC.getMap();
        List<Future<List<KnowledgePassageType>>> futures = new ArrayList<>();
        for (RiskSignalType signal : signals) {
            futures.add(retrievalPool.submit(() -> {
                context.forEach(MDC::put);
                try {
                    return retriever.retrieve(signal, audience);
                } finally {
                    context.keySet().forEach(MDC::remove);
                }
            }));
        }

        Map<RiskSignalType, List<KnowledgePassageType>> passages = new LinkedHashMap<>();
        for (int i = 0; i < signals.size(); i++) {
            Future<List<KnowledgePassageType>> future = futures.get(i);
            try {
                passages.put(signals.get(i), future.get(retrievalTimeout.toMillis(), TimeUnit.MILLISECONDS));
            } catch (TimeoutException e) {
                future.cancel(true);
                LOG.warnf("Knowledge retrieval timed out for %s signal", signals.get(i).kind().value());
                metrics.recordEmptyRetrieval();
                passages.put(signals.get(i), List.of());
            } catch (ExecutionException e) {
                LOG.warnf(e.getCause(), "Knowledge retrieval failed for %s signal", signals.get(i).kind().value());
                passages.put(signals.get(i), List.of());
            } catch (InterruptedException e) {
                futures.forEach(f -> f.cancel(true));
                Thread.currentThread().interrupt();
                throw new CancellationException("Insight run cancelled during retrieval");
            }
        }
        return passages;
    }

    private static Audience parseAudience(String audience) {
        return Audience.fromValue(audience).orElseThrow(() -> new ValidationException("Unknown audience '" + audience
                + "', expected one of general_public, farmers, officials"));
    }

    /**
     * Mutable state of one run. Owned by the thread executing the run and discarded once the bundle is built.
     */
    private static final class RunState {
        final LocationType requested;
        final Audience audience;
        PipelineStage stage = PipelineStage.FETCHING;
        PipelineFailureType failure;
        WeatherObservationType observation;
        DataQualityReportType quality;
        List<RiskSignalType> signals = List.of();
        List<String> trends;
        Map<RiskSignalType, List<KnowledgePassageType>> passages;
        List<RecommendationType> recommendations;
        String summary;

        RunState(LocationType requested, Audience audience) {
            this.requested = requested;
            this.audience = audience;
        }

        void advance() {
            stage = stage.next();
        }

        void degrade(String cause) {
            failure = new PipelineFailureType(stage, cause);
            stage = PipelineStage.DEGRADED;
        }

        InsightBundleType toBundle() {
            LocationType location = observation != null ? observation.location() : requested;
            WeatherSnapshotType current = observation != null ? observation.current() : null;
            boolean analyzed = quality != null && trends != null;

            List<String> riskAlerts = null;
            List<String> contacts = null;
            if (analyzed) {
                riskAlerts = signals.stream().map(RiskSignalType::toAlert).toList();
                contacts = InsightReportBuilder.contactSuggestions(signals);
            }

            List<KnowledgePassageType> knowledge = null;
            if (passages != null) {
                Map<String, KnowledgePassageType> byText = new LinkedHashMap<>();
                passages.values().forEach(list -> list.forEach(p -> byText.putIfAbsent(p.text(), p)));
                knowledge = new ArrayList<>(byText.values());
            }

            String prioritySummary = null;
            List<String> checklist = null;
            if (recommendations != null) {
                prioritySummary = InsightReportBuilder.prioritySummary(recommendations);
                checklist = InsightReportBuilder.actionChecklist(recommendations);
            }

            InsightStatus status = stage == PipelineStage.COMPLETE ? InsightStatus.COMPLETE : InsightStatus.DEGRADED;
            return new InsightBundleType(location, current, quality, riskAlerts, trends, recommendations, summary,
                    prioritySummary, checklist, contacts, knowledge, audience, status, failure, Instant.now());
        }
    }

    /**
     * Handle on a running batch.
     */
    public static final class BatchHandle {

        private final List<String> locations;
        private final List<Future<InsightBundleType>> futures;

        BatchHandle(List<String> locations, List<Future<InsightBundleType>> futures) {
            this.locations = List.copyOf(locations);
            this.futures = List.copyOf(futures);
        }

        public int size() {
            return locations.size();
        }

        /**
         * Cancels one location; siblings are unaffected.
         *
         * @return true if the location was cancelled before it finished
         */
        public boolean cancel(int index) {
            return futures.get(index).cancel(true);
        }

        /**
         * Waits for every location and returns one entry per location, in request order. Never throws for a single
         * location's failure.
         */
        public List<BatchInsightEntryType> results() {
            List<BatchInsightEntryType> entries = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                String location = locations.get(i);
                try {
                    entries.add(BatchInsightEntryType.success(location, futures.get(i).get()));
                } catch (CancellationException e) {
                    entries.add(BatchInsightEntryType.failure(location,
                            new PipelineFailureType(PipelineStage.DEGRADED, "Cancelled")));
                } catch (ExecutionException e) {
                    entries.add(BatchInsightEntryType.failure(location, failureOf(location, e.getCause())));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    futures.subList(i, futures.size()).forEach(f -> f.cancel(true));
                    for (int j = i; j < futures.size(); j++) {
                        entries.add(BatchInsightEntryType.failure(locations.get(j),
                                new PipelineFailureType(PipelineStage.DEGRADED, "Cancelled")));
                    }
                    break;
                }
            }
            return entries;
        }

        private static PipelineFailureType failureOf(String location, Throwable cause) {
            if (cause instanceof InvalidLocationException) {
                return new PipelineFailureType(PipelineStage.FETCHING, "Location could not be resolved: " + location);
            }
            if (cause instanceof ValidationException) {
                return new PipelineFailureType(PipelineStage.FETCHING, cause.getMessage());
            }
            if (cause instanceof CancellationException) {
                return new PipelineFailureType(PipelineStage.DEGRADED, "Cancelled");
            }
            LOG.errorf(cause, "Batch entry for %s failed", location);
            return new PipelineFailureType(PipelineStage.DEGRADED, "Internal error");
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
