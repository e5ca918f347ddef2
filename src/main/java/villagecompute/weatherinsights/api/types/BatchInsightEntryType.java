/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherinsights.api.types;

/**
 * Result of one location in a batch: exactly one of {@code bundle} and {@code error} is set.
 */
public record BatchInsightEntryType(String location, InsightBundleType bundle, PipelineFailureType error) {

    public static BatchInsightEntryType success(String location, InsightBundleType bundle) {
        return new BatchInsightEntryType(location, bundle, null);
    }

    public static BatchInsightEntryType failure(String location, PipelineFailureType error) {
        return new BatchInsightEntryType(location, null, error);
    }

    public boolean succeeded() {
        return bundle != null;
    }
}
