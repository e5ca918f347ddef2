/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherinsights.services;

import java.time.Duration;
import java.util.function.Supplier;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.faulttolerance.exceptions.TimeoutException;
import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.weatherinsights.exceptions.InvalidLocationException;
import villagecompute.weatherinsights.exceptions.ProviderUnavailableException;
import villagecompute.weatherinsights.observability.PipelineMetrics;

/**
 * Runs external provider calls with one retry with backoff.
 *
 * <h2>Call States</h2>
 *
 * <pre>
 * PENDING -> ATTEMPTING -> SUCCEEDED
 *                       -> BACKING_OFF -> ATTEMPTING (retryable failure, attempts left)
 *                       -> FAILED (fatal failure, or attempts exhausted)
 * </pre>
 *
 * <p>
 * Failures are returned as a {@link CallOutcome}, never thrown, so stage code can keep whatever it already produced.
 * {@link InvalidLocationException} is fatal: it is not retried and the outcome is flagged fatal. Timeouts and every
 * other runtime failure are retryable and reported as {@link ProviderUnavailableException}.
 *
 * <p>
 * Per-attempt timeouts are enforced by SmallRye Fault Tolerance {@code @Timeout} on the provider gateways
 * ({@code WeatherObservationFetcher.fetch}, {@code InsightTextGenerator.generate}); a call interrupted by an expired
 * timeout surfaces here as {@link TimeoutException} and counts as one failed attempt. An interrupted calling thread
 * (batch cancellation) ends the call without a retry.
 */
@ApplicationScoped
public class ProviderCallExecutor {

    private static final Logger LOG = Logger.getLogger(ProviderCallExecutor.class);

    /**
     * States of a single provider call.
     */
    public enum CallState {
        PENDING, ATTEMPTING, BACKING_OFF, SUCCEEDED, FAILED
    }

    private final PipelineMetrics metrics;

    @ConfigProperty(
            name = "insights.pipeline.retry-backoff",
            defaultValue = "500ms")
    Duration retryBackoff;

    @ConfigProperty(
            name = "insights.pipeline.max-attempts",
            defaultValue = "2")
    int maxAttempts;

    @Inject
    public ProviderCallExecutor(PipelineMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * Executes a provider call.
     *
     * @param provider
     *            provider name for logs and metrics
     * @param call
     *            the call; may throw any runtime exception
     * @return terminal outcome, never null
     */
    public <T> CallOutcome<T> execute(String provider, Supplier<T> call) {
        CallState state = CallState.PENDING;
        int attempts = 0;
        RuntimeException lastFailure = null;

        while (true) {
            switch (state) {
                case PENDING -> state = CallState.ATTEMPTING;
                case ATTEMPTING -> {
                    attempts++;
                    try {
                        T value = call.get();
                        metrics.recordProviderCall(provider, attempts > 1 ? "retry_success" : "success");
                        return CallOutcome.success(value, attempts);
                    } catch (InvalidLocationException e) {
                        metrics.recordProviderCall(provider, "rejected");
                        LOG.debugf("Provider %s rejected the request: %s", provider, e.getMessage());
                        return CallOutcome.failure(e, attempts, true);
                    } catch (RuntimeException e) {
                        if (Thread.currentThread().isInterrupted()) {
                            metrics.recordProviderCall(provider, "cancelled");
                            return CallOutcome.failure(new ProviderUnavailableException(provider,
                                    "Call to " + provider + " cancelled", e), attempts, false);
                        }
                        lastFailure = e instanceof TimeoutException
                                ? new ProviderUnavailableException(provider, "Call to " + provider + " timed out", e)
                                : e;
                        metrics.recordProviderCall(provider, e instanceof TimeoutException ? "timeout" : "failure");
                        if (attempts < maxAttempts) {
                            LOG.warnf("Provider %s attempt %d failed (%s), retrying in %dms", provider, attempts,
                                    e.getMessage(), retryBackoff.toMillis());
                            state = CallState.BACKING_OFF;
                        } else {
                            LOG.errorf(e, "Provider %s failed after %d attempts", provider, attempts);
                            state = CallState.FAILED;
                        }
                    }
                }
                case BACKING_OFF -> {
                    try {
                        Thread.sleep(retryBackoff.toMillis());
                        state = CallState.ATTEMPTING;
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return CallOutcome.failure(new ProviderUnavailableException(provider,
                                "Call to " + provider + " cancelled during backoff", e), attempts, false);
                    }
                }
                case SUCCEEDED, FAILED -> {
                    return CallOutcome.failure(asUnavailable(provider, lastFailure), attempts, false);
                }
            }
        }
    }

    private static ProviderUnavailableException asUnavailable(String provider, RuntimeException failure) {
        if (failure instanceof ProviderUnavailableException unavailable) {
            return unavailable;
        }
        return new ProviderUnavailableException(provider, "Call to " + provider + " failed", failure);
    }
}
