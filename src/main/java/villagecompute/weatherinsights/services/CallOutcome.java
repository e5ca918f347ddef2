/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherinsights.services;

/**
 * Terminal result of a provider call made through {@link ProviderCallExecutor}.
 *
 * @param state
 *            {@code SUCCEEDED} or {@code FAILED}
 * @param value
 *            call result, null unless succeeded
 * @param failure
 *            last failure, null if succeeded
 * @param attempts
 *            number of attempts made
 * @param fatal
 *            true when the failure must not be retried or degraded around (e.g., an unresolvable location)
 */
public record CallOutcome<T>(ProviderCallExecutor.CallState state, T value, RuntimeException failure, int attempts,
        boolean fatal) {

    public static <T> CallOutcome<T> success(T value, int attempts) {
        return new CallOutcome<>(ProviderCallExecutor.CallState.SUCCEEDED, value, null, attempts, false);
    }

    public static <T> CallOutcome<T> failure(RuntimeException failure, int attempts, boolean fatal) {
        return new CallOutcome<>(ProviderCallExecutor.CallState.FAILED, null, failure, attempts, fatal);
    }

    public boolean succeeded() {
        return state == ProviderCallExecutor.CallState.SUCCEEDED;
    }
}
