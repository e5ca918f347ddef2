package villagecompute.weatherinsights.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.jboss.logging.MDC;

/**
 * Standard MDC field names and helpers for enriching pipeline logs with request context.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} - OpenTelemetry trace identifier for distributed tracing</li>
 * <li>{@code span_id} - Current span identifier within the trace</li>
 * <li>{@code request_id} - Pipeline run identifier, one per location per request</li>
 * <li>{@code location} - Location name being analyzed</li>
 * <li>{@code audience} - Requested audience wire value</li>
 * <li>{@code pipeline_stage} - Current pipeline stage (fetching, validating, ...)</li>
 * </ul>
 *
 * <p>
 * <b>Usage in the orchestrator:</b>
 *
 * <pre>
 * LoggingConfig.enrichWithTraceContext();
 * LoggingConfig.setRequestId(runId);
 * LoggingConfig.setLocation(location.name());
 * LoggingConfig.setStage(PipelineStage.FETCHING.value());
 * </pre>
 *
 * <p>
 * <b>Thread Safety:</b> All methods operate on {@link MDC}, which uses ThreadLocal storage. Batch workers run each
 * location on a pool thread, so every run must call {@link #clearMDC()} when it finishes.
 */
public final class LoggingConfig {

    public static final String MDC_TRACE_ID = "trace_id";

    public static final String MDC_SPAN_ID = "span_id";

    /**
     * Pipeline run identifier (UUID string). Links every log line of one location's run, including retrieval calls
     * made on other threads.
     */
    public static final String MDC_REQUEST_ID = "request_id";

    public static final String MDC_LOCATION = "location";

    public static final String MDC_AUDIENCE = "audience";

    /**
     * Current pipeline stage wire value. Updated on every state transition.
     */
    public static final String MDC_PIPELINE_STAGE = "pipeline_stage";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Enriches MDC with trace_id and span_id from the current OpenTelemetry span. If no span is active the fields are
     * set to empty strings to keep the log structure consistent.
     */
    public static void enrichWithTraceContext() {
        SpanContext spanContext = Span.current().getSpanContext();

        if (spanContext.isValid()) {
            MDC.put(MDC_TRACE_ID, spanContext.getTraceId());
            MDC.put(MDC_SPAN_ID, spanContext.getSpanId());
        } else {
            MDC.put(MDC_TRACE_ID, "");
            MDC.put(MDC_SPAN_ID, "");
        }
    }

    public static void setRequestId(String requestId) {
        if (requestId != null) {
            MDC.put(MDC_REQUEST_ID, requestId);
        }
    }

    public static void setLocation(String location) {
        if (location != null) {
            MDC.put(MDC_LOCATION, location);
        }
    }

    public static void setAudience(String audience) {
        if (audience != null) {
            MDC.put(MDC_AUDIENCE, audience);
        }
    }

    public static void setStage(String stage) {
        if (stage != null) {
            MDC.put(MDC_PIPELINE_STAGE, stage);
        }
    }

    /**
     * Clears all pipeline MDC fields. Must be called at the end of every run to prevent context leaking into the next
     * run served by the same pool thread.
     */
    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_REQUEST_ID);
        MDC.remove(MDC_LOCATION);
        MDC.remove(MDC_AUDIENCE);
        MDC.remove(MDC_PIPELINE_STAGE);
    }
}
