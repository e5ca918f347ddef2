/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherinsights.api.rest;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.everyItem;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import dev.langchain4j.model.chat.ChatModel;
import io.quarkus.test.InjectMock;
import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import villagecompute.weatherinsights.testing.OpenWeatherTestResource;

/**
 * Integration tests for {@link WeatherInsightsResource} running the full pipeline in Quarkus.
 *
 * <p>
 * OpenWeather is served by WireMock, the text-generation model is mocked, and retrieval runs against the knowledge
 * base seeded at startup with the bundled embedding model.
 */
@QuarkusTest
@QuarkusTestResource(OpenWeatherTestResource.class)
class WeatherInsightsApiTest {

    private static final String SUMMARY_PROMPT_PREFIX = "Write one short paragraph";

    private static final String PROPOSAL = """
            [
              {"title": "Secure livestock and equipment", "action": "Move livestock and loose equipment under cover",
               "reason": "Storm and heavy rain expected", "priority": "high", "timing": "immediate",
               "resources_needed": ["Rope", "Tarpaulin"]}
            ]""";

    private static final String SUMMARY = "Secure livestock and equipment under cover before the storm and heavy "
            + "rain arrive.";

    @InjectMock
    ChatModel chatModel;

    @BeforeEach
    void setUp() {
        when(chatModel.chat(anyString())).thenAnswer(invocation -> {
            String prompt = invocation.getArgument(0);
            return prompt.startsWith(SUMMARY_PROMPT_PREFIX) ? SUMMARY : PROPOSAL;
        });
    }

    @Test
    void testGetStatus() {
        given().when().get("/api/insights/status").then().statusCode(200)
                .body("workflow", equalTo("operational")).body("weather_provider", equalTo("operational"))
                .body("generation_provider", equalTo("operational"))
                .body("knowledge_base_stats.total_documents", equalTo(14))
                .body("knowledge_base_stats.vector_dimension", equalTo(384));
    }

    @Test
    void testPostInsights_stormForFarmers() {
        given().contentType(ContentType.JSON).body("{\"location\": \"Manila\", \"audience\": \"Farmers\"}").when()
                .post("/api/insights").then().statusCode(200).body("status", equalTo("complete"))
                .body("failure", nullValue()).body("audience", equalTo("farmers"))
                .body("location.name", equalTo("Manila")).body("risk_alerts", hasItem(startsWith("storm (")))
                .body("recommendations", not(empty()))
                .body("recommendations.target_audience", everyItem(equalTo("farmers")))
                .body("relevant_knowledge", not(empty()));

        verify(chatModel, atLeastOnce()).chat(anyString());
    }

    @Test
    void testGetInsights_unknownLocationIs404() {
        given().queryParam("location", "Atlantis").when().get("/api/insights").then().statusCode(404)
                .body("error", equalTo("Location could not be resolved: Atlantis"));

        verify(chatModel, never()).chat(anyString());
    }

    @Test
    void testGetInsights_rejectedApiKeyDegradesAtFetching() {
        given().queryParam("location", "Keyless").when().get("/api/insights").then().statusCode(200)
                .body("status", equalTo("degraded")).body("failure.stage", equalTo("fetching"))
                .body("failure.error", equalTo("Weather data provider unavailable"));

        verify(chatModel, never()).chat(anyString());
    }
}
