/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.weatherinsights.config;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import villagecompute.weatherinsights.config.AiConfig.AiConfigurationException;

/**
 * Unit tests for {@link AiConfig} validation logic.
 *
 * <p>
 * Lightweight unit tests that don't require a Quarkus context.
 */
class AiConfigTest {

    private static AiConfig config(String apiKey) {
        AiConfig config = new AiConfig();
        config.apiKey = apiKey;
        config.modelName = "claude-3-5-haiku-20241022";
        config.temperature = 0.3;
        config.maxTokens = 2048;
        config.timeoutSeconds = 40;
        config.maxRetries = 0;
        return config;
    }

    @Test
    void testValidationSucceedsWithValidApiKey() {
        AiConfig config = config("sk-ant-test-12345678");

        assertDoesNotThrow(config::validateConfiguration, "Validation should succeed with a valid API key");
    }

    @Test
    void testValidationFailsWithNullApiKey() {
        AiConfig config = config(null);

        assertThrows(AiConfigurationException.class, config::validateConfiguration,
                "Validation should fail when API key is null");
    }

    @Test
    void testValidationFailsWithWhitespaceApiKey() {
        AiConfig config = config("   ");

        assertThrows(AiConfigurationException.class, config::validateConfiguration,
                "Validation should fail when API key contains only whitespace");
    }

    @Test
    void testValidationFailsWithNonPositiveTimeout() {
        AiConfig config = config("sk-ant-test-12345678");
        config.timeoutSeconds = 0;

        assertThrows(AiConfigurationException.class, config::validateConfiguration);
    }

    @Test
    void testCreateKnowledgeStore() {
        assertNotNull(config("sk-ant-test-12345678").createKnowledgeStore());
    }
}
