/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.weatherinsights.config;

import java.time.Duration;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2.AllMiniLmL6V2EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;

import io.quarkus.runtime.Startup;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Configuration class for the LangChain4j models behind recommendation synthesis and knowledge retrieval.
 *
 * <p>
 * Produces three beans:
 * <ul>
 * <li><b>ChatModel</b>: Anthropic Claude, used for recommendation and summary generation</li>
 * <li><b>EmbeddingModel</b>: in-process all-MiniLM-L6-v2 (384 dimensions), used to index and query the knowledge
 * base</li>
 * <li><b>EmbeddingStore</b>: in-memory similarity index seeded at startup by {@code KnowledgeBaseLoader}</li>
 * </ul>
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code quarkus.langchain4j.anthropic.api-key} - Anthropic API key (from ANTHROPIC_API_KEY env var)</li>
 * <li>{@code ai.model.insights.name} - model name (default: claude-3-5-haiku-20241022)</li>
 * <li>{@code ai.model.temperature} - Sampling temperature (default: 0.3)</li>
 * <li>{@code ai.model.max-tokens} - Max output tokens (default: 2048)</li>
 * <li>{@code ai.model.timeout-seconds} - Request timeout (default: 40)</li>
 * <li>{@code ai.model.max-retries} - Client-side retry attempts (default: 0, the pipeline owns retries)</li>
 * </ul>
 *
 * @see villagecompute.weatherinsights.integration.ai.InsightTextGenerator
 * @see villagecompute.weatherinsights.services.KnowledgeRetriever
 */
@ApplicationScoped
@Startup
public class AiConfig {

    private static final Logger LOG = Logger.getLogger(AiConfig.class);

    @ConfigProperty(
            name = "quarkus.langchain4j.anthropic.api-key",
            defaultValue = "")
    String apiKey;

    @ConfigProperty(
            name = "ai.model.insights.name",
            defaultValue = "claude-3-5-haiku-20241022")
    String modelName;

    @ConfigProperty(
            name = "ai.model.temperature",
            defaultValue = "0.3")
    double temperature;

    @ConfigProperty(
            name = "ai.model.max-tokens",
            defaultValue = "2048")
    int maxTokens;

    @ConfigProperty(
            name = "ai.model.timeout-seconds",
            defaultValue = "40")
    int timeoutSeconds;

    @ConfigProperty(
            name = "ai.model.max-retries",
            defaultValue = "0")
    int maxRetries;

    /**
     * Fails startup when the Anthropic API key is missing.
     *
     * @throws AiConfigurationException
     *             if the Anthropic API key is not configured
     */
    @PostConstruct
    public void validateConfiguration() {
        if (apiKey == null || apiKey.trim().isEmpty()) {
            String errorMessage = "ANTHROPIC_API_KEY environment variable is not configured. "
                    + "Recommendation synthesis requires a valid Anthropic API key. "
                    + "Please set the ANTHROPIC_API_KEY environment variable and restart the application.";
            LOG.fatal(errorMessage);
            throw new AiConfigurationException(errorMessage);
        }
        if (timeoutSeconds <= 0) {
            throw new AiConfigurationException("ai.model.timeout-seconds must be positive, got " + timeoutSeconds);
        }
        LOG.infof("LangChain4j configured with insights model: %s", modelName);
    }

    @Produces
    @ApplicationScoped
    public ChatModel createInsightsModel() {
        LOG.infof("Creating insights ChatModel: model=%s, temperature=%.2f, maxTokens=%d, timeout=%ds, maxRetries=%d",
                modelName, temperature, maxTokens, timeoutSeconds, maxRetries);

        return AnthropicChatModel.builder().apiKey(apiKey).modelName(modelName).temperature(temperature)
                .maxTokens(maxTokens).timeout(Duration.ofSeconds(timeoutSeconds)).maxRetries(maxRetries)
                .logRequests(false).logResponses(false).build();
    }

    /**
     * Produces the in-process sentence embedding model. Loads the bundled ONNX model on first use; no network access.
     */
    @Produces
    @ApplicationScoped
    public EmbeddingModel createEmbeddingModel() {
        LOG.info("Creating all-MiniLM-L6-v2 EmbeddingModel (384 dimensions)");
        return new AllMiniLmL6V2EmbeddingModel();
    }

    @Produces
    @ApplicationScoped
    public EmbeddingStore<TextSegment> createKnowledgeStore() {
        return new InMemoryEmbeddingStore<>();
    }

    /**
     * Exception thrown when AI configuration is invalid or incomplete.
     */
    public static class AiConfigurationException extends RuntimeException {

        public AiConfigurationException(String message) {
            super(message);
        }

        public AiConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
