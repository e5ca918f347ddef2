/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherinsights.api.rest;

import java.util.List;

import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import villagecompute.weatherinsights.api.types.BatchInsightEntryType;
import villagecompute.weatherinsights.api.types.BatchInsightRequestType;
import villagecompute.weatherinsights.api.types.InsightBundleType;
import villagecompute.weatherinsights.api.types.InsightRequestType;
import villagecompute.weatherinsights.api.types.PipelineStage;
import villagecompute.weatherinsights.api.types.SystemStatusType;
import villagecompute.weatherinsights.exceptions.InvalidLocationException;
import villagecompute.weatherinsights.exceptions.ValidationException;
import villagecompute.weatherinsights.services.InsightOrchestrator;

/**
 * REST endpoint for weather insights.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>{@code POST /api/insights} – insights for one location</li>
 * <li>{@code GET /api/insights} – same, from query parameters</li>
 * <li>{@code POST /api/insights/batch} – insights for several locations, one entry per location</li>
 * <li>{@code GET /api/insights/status} – provider and knowledge base health</li>
 * </ul>
 *
 * <p>
 * <b>Degraded results:</b> a provider outage does not fail the request. The bundle is returned with 200,
 * {@code status: "degraded"} and a {@code failure} naming the stage that failed.
 *
 * <p>
 * <b>Errors:</b>
 *
 * <pre>
 * { "stage": "fetching", "error": "Location could not be resolved: Atlantis" }
 * </pre>
 */
@Path("/api/insights")
@Produces(MediaType.APPLICATION_JSON)
@Tag(
        name = "Insights",
        description = "Weather risk insights and recommendations")
public class WeatherInsightsResource {

    private static final Logger LOG = Logger.getLogger(WeatherInsightsResource.class);

    static final String REQUEST_STAGE = "request";

    @Inject
    InsightOrchestrator orchestrator;

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(
            summary = "Get weather insights",
            description = "Fetch weather for a location, assess risks and synthesize audience-specific recommendations")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Complete or degraded insight bundle",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = InsightBundleType.class))),
                    @APIResponse(
                            responseCode = "400",
                            description = "Invalid request",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON)),
                    @APIResponse(
                            responseCode = "404",
                            description = "Location could not be resolved",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON)),
                    @APIResponse(
                            responseCode = "500",
                            description = "Unexpected failure",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON))})
    public Response postInsights(@Valid InsightRequestType request) {
        if (request == null) {
            return error(Response.Status.BAD_REQUEST, REQUEST_STAGE, "Request body is required");
        }
        return insights(request.location(), request.audience(), request.latitude(), request.longitude());
    }

    @GET
    @Operation(
            summary = "Get weather insights",
            description = "Query-parameter form of POST /api/insights")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Complete or degraded insight bundle",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = InsightBundleType.class))),
                    @APIResponse(
                            responseCode = "400",
                            description = "Invalid request"),
                    @APIResponse(
                            responseCode = "404",
                            description = "Location could not be resolved")})
    public Response getInsights(@Parameter(
            description = "Location name",
            required = true) @QueryParam("location") String location,
            @Parameter(
                    description = "general_public, farmers or officials") @QueryParam("audience") String audience,
            @QueryParam("lat") Double latitude, @QueryParam("lon") Double longitude) {
        return insights(location, audience, latitude, longitude);
    }

    @POST
    @Path("/batch")
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(
            summary = "Get weather insights for several locations",
            description = "Each location succeeds or fails independently; entries keep request order")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "One entry per location",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = BatchInsightEntryType.class))),
                    @APIResponse(
                            responseCode = "400",
                            description = "Empty batch, batch too large or unknown audience")})
    public Response postBatch(@Valid BatchInsightRequestType request) {
        if (request == null) {
            return error(Response.Status.BAD_REQUEST, REQUEST_STAGE, "Request body is required");
        }
        try {
            List<BatchInsightEntryType> entries = orchestrator.getBatchWeatherInsights(request.locations(),
                    request.audience());
            long failed = entries.stream().filter(e -> !e.succeeded()).count();
            LOG.infof("Batch insights complete: locations=%d, failed=%d", entries.size(), failed);
            return Response.ok(entries).build();
        } catch (ValidationException e) {
            return error(Response.Status.BAD_REQUEST, REQUEST_STAGE, e.getMessage());
        } catch (Exception e) {
            LOG.errorf(e, "Unexpected error producing batch insights");
            return error(Response.Status.INTERNAL_SERVER_ERROR, PipelineStage.DEGRADED.value(),
                    "Failed to produce insights");
        }
    }

    @GET
    @Path("/status")
    @Operation(
            summary = "Get system status",
            description = "Weather and generation provider health plus knowledge base statistics")
    @APIResponse(
            responseCode = "200",
            description = "Current status",
            content = @Content(
                    mediaType = MediaType.APPLICATION_JSON,
                    schema = @Schema(
                            implementation = SystemStatusType.class)))
    public Response getStatus() {
        return Response.ok(orchestrator.getSystemStatus()).build();
    }

    private Response insights(String location, String audience, Double latitude, Double longitude) {
        try {
            return Response.ok(orchestrator.getWeatherInsights(location, audience, latitude, longitude)).build();
        } catch (ValidationException e) {
            return error(Response.Status.BAD_REQUEST, REQUEST_STAGE, e.getMessage());
        } catch (InvalidLocationException e) {
            return error(Response.Status.NOT_FOUND, PipelineStage.FETCHING.value(),
                    "Location could not be resolved: " + location);
        } catch (Exception e) {
            LOG.errorf(e, "Unexpected error producing insights for %s", location);
            return error(Response.Status.INTERNAL_SERVER_ERROR, PipelineStage.DEGRADED.value(),
                    "Failed to produce insights");
        }
    }

    private static Response error(Response.Status status, String stage, String message) {
        return Response.status(status).entity(new ErrorResponse(stage, message)).build();
    }

    /**
     * Error body for API errors.
     */
    public record ErrorResponse(String stage, String error) {
    }
}
