/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherinsights.services;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import villagecompute.weatherinsights.api.types.DataQualityReportType;
import villagecompute.weatherinsights.api.types.RiskKind;
import villagecompute.weatherinsights.api.types.RiskSeverity;
import villagecompute.weatherinsights.api.types.RiskSignalType;
import villagecompute.weatherinsights.api.types.RiskTimeframe;
import villagecompute.weatherinsights.api.types.WeatherSnapshotType;
import villagecompute.weatherinsights.integration.weather.WeatherConditionMapper;

/**
 * Derives hazard signals and trend classifications from current conditions and the forecast series.
 *
 * <p>
 * The analysis window is the current snapshot (lead time zero) followed by the series steps. Each reading is assigned a
 * {@link RiskTimeframe} from its lead time relative to the current snapshot. Rules evaluate each timeframe group and
 * emit at most one candidate per rule; candidates sharing a (kind, timeframe) pair are then merged, keeping the highest
 * severity and joining evidence.
 *
 * <h2>Rules</h2>
 * <ul>
 * <li><b>flood</b>: a run of consecutive readings with rainfall at or above the step threshold; critical when the run
 * peaks at the extreme threshold or totals the critical amount. Single extreme bursts and heavy-rain condition codes
 * give medium.</li>
 * <li><b>storm</b>: thunderstorm condition codes (high, critical together with heavy rain, a qualifying rain run or
 * gale-force wind); rapid pressure falls under humid air (medium).</li>
 * <li><b>heat</b>: heat index (NWS Rothfusz regression) against caution/danger/extreme thresholds.</li>
 * <li><b>wind</b>: peak wind speed against strong/gale/storm thresholds; squall and tornado codes.</li>
 * <li><b>other</b>: frost, dry spell, very high humidity.</li>
 * </ul>
 *
 * <p>
 * Only trusted values ({@link PlausibleRange#trusted}) feed the rules. When the data-quality score is below the
 * confidence floor every severity is capped at medium and a low-confidence signal is appended. Pure function of its
 * inputs and configuration.
 */
@ApplicationScoped
public class RiskForecastAnalyzer {

    private static final Logger LOG = Logger.getLogger(RiskForecastAnalyzer.class);

    private static final Duration STEP = Duration.ofHours(3);
    private static final double HIGH_RAIN_PEAK_FRACTION = 0.8;
    private static final double PRESSURE_FALL_HPA_PER_STEP = 3.0;
    private static final double STORM_HUMIDITY_PERCENT = 75.0;
    private static final double VERY_HUMID_PERCENT = 85.0;
    private static final double TREND_SLOPE_PER_STEP = 0.5;
    private static final double TREND_HIGH_HUMIDITY_PERCENT = 75.0;
    private static final int TORNADO_CODE = 781;

    @ConfigProperty(
            name = "insights.quality.confidence-floor",
            defaultValue = "0.5")
    double confidenceFloor;

    @ConfigProperty(
            name = "insights.risk.rain-step-threshold-mm",
            defaultValue = "10.0")
    double rainStepThresholdMm;

    @ConfigProperty(
            name = "insights.risk.rain-extreme-mm",
            defaultValue = "25.0")
    double rainExtremeMm;

    @ConfigProperty(
            name = "insights.risk.rain-consecutive-steps",
            defaultValue = "3")
    int rainConsecutiveSteps;

    @ConfigProperty(
            name = "insights.risk.rain-critical-total-mm",
            defaultValue = "60.0")
    double rainCriticalTotalMm;

    @ConfigProperty(
            name = "insights.risk.heat-index-caution-c",
            defaultValue = "32.0")
    double heatIndexCautionC;

    @ConfigProperty(
            name = "insights.risk.heat-index-danger-c",
            defaultValue = "41.0")
    double heatIndexDangerC;

    @ConfigProperty(
            name = "insights.risk.heat-index-extreme-c",
            defaultValue = "54.0")
    double heatIndexExtremeC;

    @ConfigProperty(
            name = "insights.risk.wind-strong-ms",
            defaultValue = "15.0")
    double windStrongMs;

    @ConfigProperty(
            name = "insights.risk.wind-gale-ms",
            defaultValue = "20.0")
    double windGaleMs;

    @ConfigProperty(
            name = "insights.risk.wind-storm-ms",
            defaultValue = "25.0")
    double windStormMs;

    @ConfigProperty(
            name = "insights.risk.frost-threshold-c",
            defaultValue = "0.0")
    double frostThresholdC;

    @ConfigProperty(
            name = "insights.risk.dry-humidity-percent",
            defaultValue = "50.0")
    double dryHumidityPercent;

    /**
     * Derives risk signals.
     *
     * @param snapshot
     *            current conditions, may be null
     * @param series
     *            forecast steps, may be null or empty
     * @param quality
     *            data-quality verdict for the same readings
     * @return signals in rule order, merged per (kind, timeframe)
     */
    public List<RiskSignalType> analyze(WeatherSnapshotType snapshot, List<WeatherSnapshotType> series,
            DataQualityReportType quality) {
        List<Reading> window = buildWindow(snapshot, series);
        Map<RiskTimeframe, List<Reading>> groups = groupByTimeframe(window);
        List<RainRun> runs = findRainRuns(window);

        List<RiskSignalType> candidates = new ArrayList<>();
        candidates.addAll(floodSignals(window, groups, runs));
        for (Map.Entry<RiskTimeframe, List<Reading>> group : groups.entrySet()) {
            candidates.addAll(stormSignals(group.getKey(), group.getValue(), runs));
        }
        for (Map.Entry<RiskTimeframe, List<Reading>> group : groups.entrySet()) {
            heatSignal(group.getKey(), group.getValue()).ifPresent(candidates::add);
            windSignals(group.getKey(), group.getValue(), candidates);
            frostSignal(group.getKey(), group.getValue()).ifPresent(candidates::add);
        }
        candidates.addAll(moistureSignals(series));

        List<RiskSignalType> signals = merge(candidates);

        double score = quality == null ? 0.0 : quality.qualityScore();
        if (score < confidenceFloor) {
            List<RiskSignalType> capped = new ArrayList<>();
            for (RiskSignalType signal : signals) {
                capped.add(signal.withSeverity(signal.severity().cappedAt(RiskSeverity.MEDIUM)));
            }
            capped.add(new RiskSignalType(RiskKind.OTHER, RiskSeverity.LOW,
                    String.format(Locale.ROOT,
                            "Low data confidence: quality score %.2f is below %.2f, severities capped at medium", score,
                            confidenceFloor),
                    RiskTimeframe.IMMEDIATE));
            signals = capped;
        }

        LOG.debugf("Risk analysis: readings=%d, candidates=%d, signals=%d, qualityScore=%.2f", window.size(),
                candidates.size(), signals.size(), score);
        return List.copyOf(signals);
    }

    /**
     * Trend classifications over the forecast series, in a fixed order: temperature, humidity, pressure, wind.
     *
     * @return human-readable trend lines, empty when the series has no usable readings
     */
    public List<String> trends(List<WeatherSnapshotType> series) {
        List<String> trends = new ArrayList<>();
        if (series == null || series.isEmpty()) {
            return trends;
        }

        Double temperatureSlope = slope(series, PlausibleRange.TEMPERATURE);
        if (temperatureSlope != null) {
            if (temperatureSlope > TREND_SLOPE_PER_STEP) {
                trends.add(String.format(Locale.ROOT, "Rising temperature trend (+%.1f°C per step)", temperatureSlope));
            } else if (temperatureSlope < -TREND_SLOPE_PER_STEP) {
                trends.add(String.format(Locale.ROOT, "Falling temperature trend (%.1f°C per step)", temperatureSlope));
            } else {
                trends.add("Stable temperature pattern expected");
            }
        }

        Double humidity = mean(series, PlausibleRange.HUMIDITY);
        if (humidity != null && humidity > TREND_HIGH_HUMIDITY_PERCENT) {
            trends.add("High humidity levels - increased thunderstorm risk");
        }

        Double pressureSlope = slope(series, PlausibleRange.PRESSURE);
        if (pressureSlope != null) {
            if (pressureSlope < -TREND_SLOPE_PER_STEP) {
                trends.add("Falling atmospheric pressure - potential weather system approaching");
            } else if (pressureSlope > TREND_SLOPE_PER_STEP) {
                trends.add("Rising atmospheric pressure - clearing weather expected");
            }
        }

        Double peakWind = max(series, PlausibleRange.WIND_SPEED);
        if (peakWind != null && peakWind > windStrongMs) {
            trends.add("High wind speeds expected - potential for severe weather");
        }
        return trends;
    }

    /**
     * Heat index in Celsius using the NWS Rothfusz regression with its low/high humidity adjustments. Below the
     * regression's validity range the simple Steadman form is used.
     */
    static double heatIndexCelsius(double temperatureC, double humidity) {
        double t = temperatureC * 9.0 / 5.0 + 32.0;
        double simple = 0.5 * (t + 61.0 + (t - 68.0) * 1.2 + humidity * 0.094);
        double hi;
        if ((simple + t) / 2.0 < 80.0) {
            hi = simple;
        } else {
            hi = -42.379 + 2.04901523 * t + 10.14333127 * humidity - 0.22475541 * t * humidity
                    - 0.00683783 * t * t - 0.05481717 * humidity * humidity + 0.00122874 * t * t * humidity
                    + 0.00085282 * t * humidity * humidity - 0.00000199 * t * t * humidity * humidity;
            if (humidity < 13 && t >= 80 && t <= 112) {
                hi -= ((13 - humidity) / 4.0) * Math.sqrt((17 - Math.abs(t - 95.0)) / 17.0);
            } else if (humidity > 85 && t >= 80 && t <= 87) {
                hi += ((humidity - 85) / 10.0) * ((87 - t) / 5.0);
            }
        }
        return (hi - 32.0) * 5.0 / 9.0;
    }

    private List<Reading> buildWindow(WeatherSnapshotType snapshot, List<WeatherSnapshotType> series) {
        List<WeatherSnapshotType> steps = series == null ? List.of() : series;
        Instant reference = snapshot != null ? snapshot.timestamp() : null;
        if (reference == null) {
            reference = steps.stream().filter(Objects::nonNull).map(WeatherSnapshotType::timestamp)
                    .filter(Objects::nonNull).findFirst().orElse(null);
        }

        List<Reading> window = new ArrayList<>();
        window.add(new Reading(snapshot == null ? WeatherSnapshotType.empty() : snapshot, "current conditions",
                Duration.ZERO));
        for (int i = 0; i < steps.size(); i++) {
            WeatherSnapshotType step = steps.get(i) == null ? WeatherSnapshotType.empty() : steps.get(i);
            Duration lead = reference != null && step.timestamp() != null
                    ? Duration.between(reference, step.timestamp())
                    : STEP.multipliedBy(i + 1L);
            window.add(new Reading(step, "forecast +" + Math.max(0, lead.toHours()) + "h", lead));
        }
        return window;
    }

    private static Map<RiskTimeframe, List<Reading>> groupByTimeframe(List<Reading> window) {
        Map<RiskTimeframe, List<Reading>> groups = new EnumMap<>(RiskTimeframe.class);
        for (Reading reading : window) {
            groups.computeIfAbsent(reading.timeframe(), k -> new ArrayList<>()).add(reading);
        }
        return groups;
    }

    private List<RainRun> findRainRuns(List<Reading> window) {
        List<RainRun> runs = new ArrayList<>();
        int start = -1;
        for (int i = 0; i <= window.size(); i++) {
            Double rain = i < window.size() ? rainfall(window.get(i).snapshot()) : null;
            boolean heavy = rain != null && rain >= rainStepThresholdMm;
            if (heavy && start < 0) {
                start = i;
            } else if (!heavy && start >= 0) {
                if (i - start >= rainConsecutiveSteps) {
                    runs.add(RainRun.of(window.subList(start, i)));
                }
                start = -1;
            }
        }
        return runs;
    }

    private List<RiskSignalType> floodSignals(List<Reading> window, Map<RiskTimeframe, List<Reading>> groups,
            List<RainRun> runs) {
        List<RiskSignalType> signals = new ArrayList<>();
        Set<Reading> inRun = new LinkedHashSet<>();
        for (RainRun run : runs) {
            inRun.addAll(run.readings());
            RiskSeverity severity;
            if (run.peak() >= rainExtremeMm || run.total() >= rainCriticalTotalMm) {
                severity = RiskSeverity.CRITICAL;
            } else if (run.peak() >= rainExtremeMm * HIGH_RAIN_PEAK_FRACTION) {
                severity = RiskSeverity.HIGH;
            } else {
                severity = RiskSeverity.MEDIUM;
            }
            signals.add(new RiskSignalType(RiskKind.FLOOD, severity,
                    String.format(Locale.ROOT,
                            "Sustained rainfall of %.1f mm/3h or more over %d consecutive readings from %s "
                                    + "(peak %.1f mm, total %.1f mm)",
                            rainStepThresholdMm, run.readings().size(), run.start().label(), run.peak(), run.total()),
                    run.start().timeframe()));
        }

        for (Reading reading : window) {
            Double rain = rainfall(reading.snapshot());
            if (rain != null && rain >= rainExtremeMm && !inRun.contains(reading)) {
                signals.add(new RiskSignalType(RiskKind.FLOOD, RiskSeverity.MEDIUM,
                        String.format(Locale.ROOT, "Intense rainfall burst of %.1f mm/3h at %s", rain, reading.label()),
                        reading.timeframe()));
            }
        }

        for (Map.Entry<RiskTimeframe, List<Reading>> group : groups.entrySet()) {
            for (Reading reading : group.getValue()) {
                Integer code = reading.snapshot().conditionCode();
                if (code != null && !WeatherConditionMapper.isThunderstorm(code)
                        && WeatherConditionMapper.isHeavyRain(code)) {
                    signals.add(new RiskSignalType(RiskKind.FLOOD, RiskSeverity.MEDIUM,
                            String.format("%s (code %d) at %s", WeatherConditionMapper.describe(code), code,
                                    reading.label()),
                            group.getKey()));
                    break;
                }
            }
        }
        return signals;
    }

    private List<RiskSignalType> stormSignals(RiskTimeframe timeframe, List<Reading> group, List<RainRun> runs) {
        List<RiskSignalType> signals = new ArrayList<>();

        Reading thunder = null;
        for (Reading reading : group) {
            Integer code = reading.snapshot().conditionCode();
            if (code != null && WeatherConditionMapper.isThunderstorm(code)) {
                thunder = reading;
                break;
            }
        }
        if (thunder != null) {
            int code = thunder.snapshot().conditionCode();
            Double peakWind = peak(group, PlausibleRange.WIND_SPEED);
            boolean gale = peakWind != null && peakWind >= windGaleMs;
            boolean rainRun = runs.stream().anyMatch(run -> run.touches(timeframe));
            boolean critical = WeatherConditionMapper.isHeavyRain(code) || gale || rainRun;

            StringBuilder evidence = new StringBuilder(String.format("%s (code %d) at %s",
                    WeatherConditionMapper.describe(code), code, thunder.label()));
            Double humidity = PlausibleRange.HUMIDITY.trusted(thunder.snapshot());
            if (humidity != null) {
                evidence.append(String.format(Locale.ROOT, ", humidity %.0f%%", humidity));
            }
            if (rainRun) {
                evidence.append(", with sustained heavy rainfall");
            }
            if (gale) {
                evidence.append(String.format(Locale.ROOT, ", gusts to %.1f m/s", peakWind));
            }
            signals.add(new RiskSignalType(RiskKind.STORM, critical ? RiskSeverity.CRITICAL : RiskSeverity.HIGH,
                    evidence.toString(), timeframe));
        }

        for (int i = 1; i < group.size(); i++) {
            Double before = PlausibleRange.PRESSURE.trusted(group.get(i - 1).snapshot());
            Double after = PlausibleRange.PRESSURE.trusted(group.get(i).snapshot());
            Double humidity = PlausibleRange.HUMIDITY.trusted(group.get(i).snapshot());
            if (before != null && after != null && humidity != null && before - after >= PRESSURE_FALL_HPA_PER_STEP
                    && humidity >= STORM_HUMIDITY_PERCENT) {
                signals.add(new RiskSignalType(RiskKind.STORM, RiskSeverity.MEDIUM,
                        String.format(Locale.ROOT,
                                "Pressure falling %.1f hPa to %.1f hPa by %s with humidity %.0f%%, weather system "
                                        + "approaching",
                                before - after, after, group.get(i).label(), humidity),
                        timeframe));
                break;
            }
        }
        return signals;
    }

    private Optional<RiskSignalType> heatSignal(RiskTimeframe timeframe, List<Reading> group) {
        Reading hottest = null;
        double peakIndex = Double.NEGATIVE_INFINITY;
        for (Reading reading : group) {
            Double temperature = PlausibleRange.TEMPERATURE.trusted(reading.snapshot());
            if (temperature == null) {
                continue;
            }
            Double humidity = PlausibleRange.HUMIDITY.trusted(reading.snapshot());
            double index = humidity != null ? heatIndexCelsius(temperature, humidity) : temperature;
            if (index > peakIndex) {
                peakIndex = index;
                hottest = reading;
            }
        }
        if (hottest == null || peakIndex < heatIndexCautionC) {
            return Optional.empty();
        }

        RiskSeverity severity;
        if (peakIndex >= heatIndexExtremeC) {
            severity = RiskSeverity.CRITICAL;
        } else if (peakIndex >= heatIndexDangerC) {
            severity = RiskSeverity.HIGH;
        } else {
            severity = RiskSeverity.MEDIUM;
        }
        Double humidity = PlausibleRange.HUMIDITY.trusted(hottest.snapshot());
        String evidence = String.format(Locale.ROOT, "Heat index %.1f°C at %s (temperature %.1f°C%s)", peakIndex,
                hottest.label(), PlausibleRange.TEMPERATURE.trusted(hottest.snapshot()),
                humidity != null ? String.format(Locale.ROOT, ", humidity %.0f%%", humidity) : "");
        return Optional.of(new RiskSignalType(RiskKind.HEAT, severity, evidence, timeframe));
    }

    private void windSignals(RiskTimeframe timeframe, List<Reading> group, List<RiskSignalType> out) {
        Reading windiest = null;
        double peakWind = Double.NEGATIVE_INFINITY;
        for (Reading reading : group) {
            Double wind = PlausibleRange.WIND_SPEED.trusted(reading.snapshot());
            if (wind != null && wind > peakWind) {
                peakWind = wind;
                windiest = reading;
            }
        }
        if (windiest != null && peakWind >= windStrongMs) {
            RiskSeverity severity;
            if (peakWind >= windStormMs) {
                severity = RiskSeverity.CRITICAL;
            } else if (peakWind >= windGaleMs) {
                severity = RiskSeverity.HIGH;
            } else {
                severity = RiskSeverity.MEDIUM;
            }
            out.add(new RiskSignalType(RiskKind.WIND, severity,
                    String.format(Locale.ROOT, "Wind speed %.1f m/s at %s", peakWind, windiest.label()), timeframe));
        }

        for (Reading reading : group) {
            Integer code = reading.snapshot().conditionCode();
            if (code != null && WeatherConditionMapper.hazardKind(code).orElse(null) == RiskKind.WIND) {
                out.add(new RiskSignalType(RiskKind.WIND,
                        code == TORNADO_CODE ? RiskSeverity.CRITICAL : RiskSeverity.HIGH,
                        String.format("%s (code %d) at %s", WeatherConditionMapper.describe(code), code,
                                reading.label()),
                        timeframe));
                break;
            }
        }
    }

    private Optional<RiskSignalType> frostSignal(RiskTimeframe timeframe, List<Reading> group) {
        Reading coldest = null;
        double minimum = Double.POSITIVE_INFINITY;
        for (Reading reading : group) {
            Double temperature = PlausibleRange.TEMPERATURE.trusted(reading.snapshot());
            if (temperature != null && temperature < minimum) {
                minimum = temperature;
                coldest = reading;
            }
        }
        if (coldest == null || minimum >= frostThresholdC) {
            return Optional.empty();
        }
        return Optional.of(new RiskSignalType(RiskKind.OTHER, RiskSeverity.MEDIUM,
                String.format(Locale.ROOT, "Frost risk: temperature down to %.1f°C at %s", minimum, coldest.label()),
                timeframe));
    }

    /**
     * Dry-spell and very-high-humidity signals over the whole forecast series.
     */
    private List<RiskSignalType> moistureSignals(List<WeatherSnapshotType> series) {
        List<RiskSignalType> signals = new ArrayList<>();
        if (series == null || series.isEmpty()) {
            return signals;
        }
        Double humidity = mean(series, PlausibleRange.HUMIDITY);
        if (humidity == null) {
            return signals;
        }

        boolean wet = false;
        for (WeatherSnapshotType step : series) {
            if (step == null) {
                continue;
            }
            Double rain = rainfall(step);
            Integer code = step.conditionCode();
            if ((rain != null && rain > 0) || (code != null && code >= 200 && code < 600)) {
                wet = true;
                break;
            }
        }

        if (!wet && humidity < dryHumidityPercent) {
            signals.add(new RiskSignalType(RiskKind.OTHER, RiskSeverity.LOW, String.format(Locale.ROOT,
                    "Dry conditions: no rain expected and mean humidity %.0f%%, monitor irrigation needs", humidity),
                    RiskTimeframe.THIS_WEEK));
        }
        if (humidity > VERY_HUMID_PERCENT) {
            signals.add(new RiskSignalType(RiskKind.OTHER, RiskSeverity.LOW, String.format(Locale.ROOT,
                    "Very high humidity: mean %.0f%%, increased risk of plant disease and heat stress", humidity),
                    RiskTimeframe.THIS_WEEK));
        }
        return signals;
    }

    /**
     * Merges candidates per (kind, timeframe) in first-seen order, keeping the highest severity and joining distinct
     * evidence.
     */
    static List<RiskSignalType> merge(List<RiskSignalType> candidates) {
        Map<String, RiskSignalType> merged = new LinkedHashMap<>();
        for (RiskSignalType candidate : candidates) {
            String key = candidate.kind().value() + "|" + candidate.timeframe().value();
            RiskSignalType existing = merged.get(key);
            if (existing == null) {
                merged.put(key, candidate);
                continue;
            }
            String evidence = existing.evidence().contains(candidate.evidence())
                    ? existing.evidence()
                    : existing.evidence() + "; " + candidate.evidence();
            merged.put(key, new RiskSignalType(existing.kind(),
                    RiskSeverity.max(existing.severity(), candidate.severity()), evidence, existing.timeframe()));
        }
        return new ArrayList<>(merged.values());
    }

    private static Double rainfall(WeatherSnapshotType snapshot) {
        Double threeHours = PlausibleRange.RAINFALL_3H.trusted(snapshot);
        if (threeHours != null) {
            return threeHours;
        }
        Double oneHour = PlausibleRange.RAINFALL_1H.trusted(snapshot);
        return oneHour != null ? oneHour * 3 : null;
    }

    private static Double peak(List<Reading> readings, PlausibleRange range) {
        Double peak = null;
        for (Reading reading : readings) {
            Double value = range.trusted(reading.snapshot());
            if (value != null && (peak == null || value > peak)) {
                peak = value;
            }
        }
        return peak;
    }

    private static Double max(List<WeatherSnapshotType> series, PlausibleRange range) {
        Double max = null;
        for (WeatherSnapshotType step : series) {
            Double value = range.trusted(step);
            if (value != null && (max == null || value > max)) {
                max = value;
            }
        }
        return max;
    }

    private static Double mean(List<WeatherSnapshotType> series, PlausibleRange range) {
        double sum = 0;
        int count = 0;
        for (WeatherSnapshotType step : series) {
            Double value = range.trusted(step);
            if (value != null) {
                sum += value;
                count++;
            }
        }
        return count == 0 ? null : sum / count;
    }

    /**
     * Least-squares slope of the trusted values against step index, null with fewer than two values.
     */
    private static Double slope(List<WeatherSnapshotType> series, PlausibleRange range) {
        double n = 0;
        double sumX = 0;
        double sumY = 0;
        double sumXY = 0;
        double sumXX = 0;
        for (int i = 0; i < series.size(); i++) {
            Double y = range.trusted(series.get(i));
            if (y == null) {
                continue;
            }
            n++;
            sumX += i;
            sumY += y;
            sumXY += i * y;
            sumXX += (double) i * i;
        }
        double denominator = n * sumXX - sumX * sumX;
        if (n < 2 || denominator == 0) {
            return null;
        }
        return (n * sumXY - sumX * sumY) / denominator;
    }

    /**
     * One reading of the analysis window with its lead time from the current snapshot.
     */
    private record Reading(WeatherSnapshotType snapshot, String label, Duration lead) {

        RiskTimeframe timeframe() {
            return RiskTimeframe.fromLeadTime(lead);
        }
    }

    /**
     * Consecutive readings at or above the rainfall step threshold.
     */
    private record RainRun(List<Reading> readings, double peak, double total) {

        static RainRun of(List<Reading> readings) {
            double peak = 0;
            double total = 0;
            for (Reading reading : readings) {
                double rain = rainfall(reading.snapshot());
                peak = Math.max(peak, rain);
                total += rain;
            }
            return new RainRun(List.copyOf(readings), peak, total);
        }

        Reading start() {
            return readings.get(0);
        }

        boolean touches(RiskTimeframe timeframe) {
            return readings.stream().anyMatch(reading -> reading.timeframe() == timeframe);
        }
    }
}
