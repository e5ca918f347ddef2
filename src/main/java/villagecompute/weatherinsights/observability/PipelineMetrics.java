package villagecompute.weatherinsights.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Micrometer meters for the insight pipeline.
 *
 * <p>
 * <b>Metrics Catalog:</b>
 * <ul>
 * <li><b>Counters:</b> {@code insights.pipeline.runs{outcome}} - Finished runs by outcome (complete, degraded,
 * invalid_location)</li>
 * <li><b>Timers:</b> {@code insights.stage.duration{stage}} - Wall time per pipeline stage</li>
 * <li><b>Counters:</b> {@code insights.provider.calls{provider,status}} - Provider call attempts (success, retry,
 * failure)</li>
 * <li><b>Counters:</b> {@code insights.retrieval.empty} - Retrievals that returned no passages</li>
 * <li><b>Counters:</b> {@code insights.synthesis.fallbacks{reason}} - Fallback recommendations and summaries</li>
 * </ul>
 *
 * <p>
 * Exported in Prometheus format at {@code /q/metrics}.
 */
@ApplicationScoped
public class PipelineMetrics {

    private final MeterRegistry registry;

    @Inject
    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRun(String outcome) {
        Counter.builder("insights.pipeline.runs").description("Insight pipeline runs by outcome")
                .tags("outcome", outcome).register(registry).increment();
    }

    public Timer.Sample startStage() {
        return Timer.start(registry);
    }

    public void stopStage(Timer.Sample sample, String stage) {
        sample.stop(Timer.builder("insights.stage.duration").description("Pipeline stage duration").tags("stage", stage)
                .register(registry));
    }

    public void recordProviderCall(String provider, String status) {
        Counter.builder("insights.provider.calls").description("External provider call attempts")
                .tags("provider", provider, "status", status).register(registry).increment();
    }

    public void recordEmptyRetrieval() {
        Counter.builder("insights.retrieval.empty").description("Knowledge retrievals with no passages")
                .register(registry).increment();
    }

    public void recordSynthesisFallback(String reason) {
        Counter.builder("insights.synthesis.fallbacks").description("Deterministic fallbacks used during synthesis")
                .tags("reason", reason).register(registry).increment();
    }
}
