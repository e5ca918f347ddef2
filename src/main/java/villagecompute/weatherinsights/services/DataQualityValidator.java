/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherinsights.services;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import villagecompute.weatherinsights.api.types.DataQualityReportType;
import villagecompute.weatherinsights.api.types.WeatherSnapshotType;

/**
 * Scores completeness and plausibility of a current snapshot plus its forecast series.
 *
 * <h2>Scoring</h2>
 * <ul>
 * <li>Every reading (the current snapshot and each series step) is checked for the expected fields: the seven numeric
 * fields of {@link PlausibleRange} that are not optional, plus {@code condition_code} and {@code timestamp}.</li>
 * <li>A field passes when it is present and plausible. Missing, malformed and implausible values are checked but do not
 * pass, so {@code quality_score = passed / checked}.</li>
 * <li>Rainfall fields are checked only when reported.</li>
 * <li>Every adjacent pair of series steps adds an ordering check: timestamps must be strictly increasing.</li>
 * </ul>
 *
 * <p>
 * Never throws: null inputs count as all-missing readings and the report is always produced. Pure function, no I/O.
 */
@ApplicationScoped
public class DataQualityValidator {

    private static final Logger LOG = Logger.getLogger(DataQualityValidator.class);

    static final String CONDITION_CODE = "condition_code";
    static final String TIMESTAMP = "timestamp";

    private static final int MIN_CONDITION_CODE = 200;
    private static final int MAX_CONDITION_CODE = 804;

    /**
     * Validates current conditions and forecast series.
     *
     * @param snapshot
     *            current conditions, may be null
     * @param series
     *            forecast steps in provider order, may be null or empty
     * @return quality report with score in [0, 1] and anomalies in detection order
     */
    public DataQualityReportType validate(WeatherSnapshotType snapshot, List<WeatherSnapshotType> series) {
        Tally tally = new Tally();

        checkReading(snapshot, "current", tally);

        List<WeatherSnapshotType> steps = series == null ? List.of() : series;
        if (steps.isEmpty()) {
            tally.anomalies.add("forecast series is empty");
        }
        for (int i = 0; i < steps.size(); i++) {
            checkReading(steps.get(i), "forecast step " + i, tally);
        }
        checkOrdering(steps, tally);

        for (Map.Entry<String, Integer> missing : tally.missingCounts.entrySet()) {
            tally.anomalies.add(String.format("%s missing in %d of %d readings", missing.getKey(), missing.getValue(),
                    tally.readings));
        }

        double score = tally.checked == 0 ? 0.0 : (double) tally.passed / tally.checked;
        score = Math.max(0.0, Math.min(1.0, Math.round(score * 1000.0) / 1000.0));

        LOG.debugf("Data quality: score=%.3f, checked=%d, passed=%d, anomalies=%d", score, tally.checked, tally.passed,
                tally.anomalies.size());
        return new DataQualityReportType(score, tally.anomalies);
    }

    private void checkReading(WeatherSnapshotType reading, String where, Tally tally) {
        WeatherSnapshotType snapshot = reading == null ? WeatherSnapshotType.empty() : reading;
        tally.readings++;

        Set<String> malformed = new HashSet<>();
        for (String raw : snapshot.malformedFields()) {
            int separator = raw.indexOf('=');
            String field = separator > 0 ? raw.substring(0, separator) : raw;
            String value = separator > 0 ? raw.substring(separator + 1) : "";
            malformed.add(field);
            tally.anomalies.add(String.format("%s has non-numeric value '%s' (%s)", field, value, where));
        }

        for (PlausibleRange range : PlausibleRange.values()) {
            Double value = range.read(snapshot);
            if (value == null) {
                if (malformed.contains(range.field())) {
                    tally.checked++;
                } else if (!range.isOptional()) {
                    tally.checked++;
                    tally.missing(range.field());
                }
                continue;
            }
            tally.checked++;
            if (range.accepts(value)) {
                tally.passed++;
            } else {
                tally.anomalies.add(String.format("%s=%s outside plausible range %s (%s)", range.field(), value,
                        range.describeBounds(), where));
            }
        }

        tally.checked++;
        Integer code = snapshot.conditionCode();
        if (code == null) {
            if (!malformed.contains(CONDITION_CODE)) {
                tally.missing(CONDITION_CODE);
            }
        } else if (code >= MIN_CONDITION_CODE && code <= MAX_CONDITION_CODE) {
            tally.passed++;
        } else {
            tally.anomalies.add(String.format("%s=%d is not a known condition code (%s)", CONDITION_CODE, code, where));
        }

        tally.checked++;
        if (snapshot.timestamp() != null) {
            tally.passed++;
        } else if (!malformed.contains(TIMESTAMP)) {
            tally.missing(TIMESTAMP);
        }
    }

    private void checkOrdering(List<WeatherSnapshotType> steps, Tally tally) {
        for (int i = 1; i < steps.size(); i++) {
            Instant previous = timestampOf(steps.get(i - 1));
            Instant current = timestampOf(steps.get(i));
            if (previous == null || current == null) {
                // already counted as missing timestamps
                continue;
            }
            tally.checked++;
            if (current.isAfter(previous)) {
                tally.passed++;
            } else if (current.equals(previous)) {
                tally.anomalies.add(String.format("duplicate forecast timestamp %s at step %d", current, i));
            } else {
                tally.anomalies.add(String.format("forecast timestamp %s at step %d is earlier than %s", current, i,
                        previous));
            }
        }
    }

    private static Instant timestampOf(WeatherSnapshotType step) {
        return step == null ? null : step.timestamp();
    }

    /**
     * Running counts for one validation.
     */
    private static final class Tally {
        final List<String> anomalies = new ArrayList<>();
        final Map<String, Integer> missingCounts = new LinkedHashMap<>();
        int checked;
        int passed;
        int readings;

        void missing(String field) {
            missingCounts.merge(field, 1, Integer::sum);
        }
    }
}
