/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.weatherinsights.integration.ai;

import org.eclipse.microprofile.faulttolerance.CircuitBreaker;
import org.eclipse.microprofile.faulttolerance.Fallback;
import org.eclipse.microprofile.faulttolerance.Timeout;
import org.jboss.logging.Logger;

import dev.langchain4j.model.chat.ChatModel;

import io.smallrye.faulttolerance.api.CircuitBreakerName;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import villagecompute.weatherinsights.exceptions.ProviderUnavailableException;
import villagecompute.weatherinsights.observability.PipelineMetrics;

/**
 * Gateway to the text-generation provider used for recommendations and summaries.
 *
 * <p>
 * Every failure of the underlying {@link ChatModel}, including an open circuit, surfaces as
 * {@link ProviderUnavailableException}; callers never see provider-specific exception types. Retries are not done here:
 * the pipeline's provider call executor owns retry.
 *
 * <p>
 * <b>Circuit Breaker:</b> Opens when all of the last 6 calls failed, half-open after 30s, closes after 2 successes.
 * Batch runs share the breaker, so a dead provider fails fast for the remaining locations.
 *
 * <p>
 * <b>Timeout:</b> 45s per call, overridable through
 * {@code villagecompute.weatherinsights.integration.ai.InsightTextGenerator/generate/Timeout/value}.
 */
@ApplicationScoped
public class InsightTextGenerator {

    private static final Logger LOG = Logger.getLogger(InsightTextGenerator.class);

    public static final String PROVIDER = "anthropic";

    public static final String CIRCUIT_BREAKER_NAME = "insights-generation-circuit-breaker";

    private final ChatModel chatModel;
    private final PipelineMetrics metrics;

    @Inject
    public InsightTextGenerator(ChatModel chatModel, PipelineMetrics metrics) {
        this.chatModel = chatModel;
        this.metrics = metrics;
    }

    /**
     * Sends a prompt and returns the raw completion text.
     *
     * @param prompt
     *            full prompt including output contract
     * @return completion text, never null
     * @throws ProviderUnavailableException
     *             if the provider fails, returns nothing, times out, or the circuit is open
     */
    @CircuitBreaker(
            requestVolumeThreshold = 6,
            failureRatio = 1.0,
            delay = 30000,
            successThreshold = 2)
    @CircuitBreakerName(CIRCUIT_BREAKER_NAME)
    @Fallback(
            fallbackMethod = "generateFallback")
    @Timeout(45000)
    public String generate(String prompt) {
        LOG.debugf("Sending generation request: promptChars=%d", prompt.length());
        String response;
        try {
            response = chatModel.chat(prompt);
        } catch (RuntimeException e) {
            metrics.recordProviderCall(PROVIDER, "failure");
            LOG.errorf(e, "Generation request failed");
            throw new ProviderUnavailableException(PROVIDER, "Generation request failed", e);
        }
        if (response == null || response.isBlank()) {
            metrics.recordProviderCall(PROVIDER, "failure");
            throw new ProviderUnavailableException(PROVIDER, "Generation returned an empty response");
        }
        metrics.recordProviderCall(PROVIDER, "success");
        LOG.debugf("Generation response received: responseChars=%d", response.length());
        return response;
    }

    /**
     * Fallback when the circuit is open or the provider failed. Always throws so the pipeline degrades instead of
     * receiving invented text.
     */
    public String generateFallback(String prompt) {
        LOG.warn("Circuit breaker OPEN or generation provider unavailable");
        throw new ProviderUnavailableException(PROVIDER, "Generation provider unavailable");
    }

    /**
     * Strips a surrounding Markdown code fence ({@code ```json ... ```}) from a completion.
     */
    public static String stripMarkdown(String response) {
        String json = response.trim();
        if (json.startsWith("```json")) {
            json = json.substring(7);
        } else if (json.startsWith("```")) {
            json = json.substring(3);
        }
        if (json.endsWith("```")) {
            json = json.substring(0, json.length() - 3);
        }
        return json.trim();
    }
}
