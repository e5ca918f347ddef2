/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherinsights.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static villagecompute.weatherinsights.TestFixtures.at;
import static villagecompute.weatherinsights.TestFixtures.calm;
import static villagecompute.weatherinsights.TestFixtures.calmCurrent;
import static villagecompute.weatherinsights.TestFixtures.calmSeries;
import static villagecompute.weatherinsights.TestFixtures.series;
import static villagecompute.weatherinsights.TestFixtures.snapshot;
import static villagecompute.weatherinsights.TestFixtures.stormCurrent;
import static villagecompute.weatherinsights.TestFixtures.stormSeries;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import villagecompute.weatherinsights.TestFixtures;
import villagecompute.weatherinsights.api.types.DataQualityReportType;
import villagecompute.weatherinsights.api.types.RiskKind;
import villagecompute.weatherinsights.api.types.RiskSeverity;
import villagecompute.weatherinsights.api.types.RiskSignalType;
import villagecompute.weatherinsights.api.types.RiskTimeframe;
import villagecompute.weatherinsights.api.types.WeatherSnapshotType;

/**
 * Unit tests for {@link RiskForecastAnalyzer}.
 */
class RiskForecastAnalyzerTest {

    private static final DataQualityReportType GOOD_DATA = new DataQualityReportType(1.0, List.of());

    private RiskForecastAnalyzer analyzer;
    private DataQualityValidator validator;

    @BeforeEach
    void setUp() {
        analyzer = TestFixtures.analyzer();
        validator = TestFixtures.validator();
    }

    @Test
    void testAnalyze_calmWeatherHasNoSignals() {
        List<RiskSignalType> signals = analyzer.analyze(calmCurrent(), calmSeries(), GOOD_DATA);

        assertTrue(signals.isEmpty(), "Unexpected signals: " + signals);
    }

    @Test
    void testAnalyze_approachingStormWithSustainedRain() {
        // Arrange
        WeatherSnapshotType current = stormCurrent();
        List<WeatherSnapshotType> series = stormSeries();
        DataQualityReportType quality = validator.validate(current, series);

        // Act
        List<RiskSignalType> signals = analyzer.analyze(current, series, quality);

        // Assert
        RiskSignalType storm = find(signals, RiskKind.STORM, RiskTimeframe.IMMEDIATE).orElseThrow();
        assertEquals(RiskSeverity.CRITICAL, storm.severity());
        assertTrue(storm.evidence().contains("sustained heavy rainfall"), storm.evidence());

        RiskSignalType flood = find(signals, RiskKind.FLOOD, RiskTimeframe.IMMEDIATE).orElseThrow();
        assertEquals(RiskSeverity.CRITICAL, flood.severity(), "4 x 20 mm totals 80 mm");

        RiskSignalType heat = find(signals, RiskKind.HEAT, RiskTimeframe.IMMEDIATE).orElseThrow();
        assertEquals(RiskSeverity.HIGH, heat.severity());
    }

    @Test
    void testAnalyze_atMostOneSignalPerKindAndTimeframe() {
        List<RiskSignalType> signals = analyzer.analyze(stormCurrent(), stormSeries(), GOOD_DATA);

        long distinct = signals.stream().map(s -> s.kind() + "|" + s.timeframe()).distinct().count();
        assertEquals(signals.size(), distinct);
    }

    @Test
    void testAnalyze_lowQualityCapsSeverityAndAppendsNotice() {
        // Arrange
        DataQualityReportType poor = new DataQualityReportType(0.3, List.of("pressure missing in 9 of 9 readings"));

        // Act
        List<RiskSignalType> signals = analyzer.analyze(stormCurrent(), stormSeries(), poor);

        // Assert
        assertTrue(signals.stream().allMatch(s -> s.severity().ordinal() <= RiskSeverity.MEDIUM.ordinal()),
                "Severities must be capped: " + signals);
        RiskSignalType last = signals.get(signals.size() - 1);
        assertEquals(RiskKind.OTHER, last.kind());
        assertEquals(RiskSeverity.LOW, last.severity());
        assertTrue(last.evidence().startsWith("Low data confidence"), last.evidence());
    }

    @Test
    void testAnalyze_emptyDataYieldsOnlyLowConfidenceNotice() {
        // Arrange
        DataQualityReportType quality = validator.validate(WeatherSnapshotType.empty(), List.of());

        // Act
        List<RiskSignalType> signals = analyzer.analyze(WeatherSnapshotType.empty(), List.of(), quality);

        // Assert
        assertEquals(0.0, quality.qualityScore());
        assertEquals(1, signals.size());
        assertEquals(RiskKind.OTHER, signals.get(0).kind());
        assertTrue(signals.get(0).evidence().contains("quality score 0.00 is below 0.50"));
    }

    @Test
    void testAnalyze_implausibleValuesDoNotDriveSignals() {
        // 70 °C is outside the plausible range, so it must not produce a heat signal
        WeatherSnapshotType current = snapshot(70.0, 50.0, 1013.0, 3.0, 0.0, 800, TestFixtures.BASE_TIME);

        List<RiskSignalType> signals = analyzer.analyze(current, calmSeries(), GOOD_DATA);

        assertFalse(signals.stream().anyMatch(s -> s.kind() == RiskKind.HEAT));
    }

    @Test
    void testAnalyze_floodRunLaterInTheWeek() {
        // Arrange: steps 9-11 are 27 to 33 hours out
        List<WeatherSnapshotType> series = series(12,
                i -> i >= 9 && i <= 11 ? snapshot(22.0, 70.0, 1010.0, 4.0, 12.0, 500, at(i)) : calm(i));

        // Act
        List<RiskSignalType> signals = analyzer.analyze(calmCurrent(), series, GOOD_DATA);

        // Assert
        RiskSignalType flood = find(signals, RiskKind.FLOOD, RiskTimeframe.THIS_WEEK).orElseThrow();
        assertEquals(RiskSeverity.MEDIUM, flood.severity());
        assertTrue(flood.evidence().contains("3 consecutive readings"), flood.evidence());
    }

    @Test
    void testAnalyze_twoHeavyStepsAreNotARun() {
        List<WeatherSnapshotType> series = series(8,
                i -> i <= 2 ? snapshot(22.0, 70.0, 1010.0, 4.0, 15.0, 500, at(i)) : calm(i));

        List<RiskSignalType> signals = analyzer.analyze(calmCurrent(), series, GOOD_DATA);

        assertFalse(signals.stream().anyMatch(s -> s.kind() == RiskKind.FLOOD), "Unexpected: " + signals);
    }

    @Test
    void testAnalyze_windThresholds() {
        List<WeatherSnapshotType> series = series(8,
                i -> i == 2 ? snapshot(20.0, 60.0, 1008.0, 22.0, 0.0, 803, at(i)) : calm(i));

        List<RiskSignalType> signals = analyzer.analyze(calmCurrent(), series, GOOD_DATA);

        RiskSignalType wind = find(signals, RiskKind.WIND, RiskTimeframe.TODAY).orElseThrow();
        assertEquals(RiskSeverity.HIGH, wind.severity());
        assertTrue(wind.evidence().startsWith("Wind speed 22.0 m/s"), wind.evidence());
    }

    @Test
    void testAnalyze_tornadoCodeIsCritical() {
        WeatherSnapshotType current = snapshot(25.0, 60.0, 1000.0, 10.0, 0.0, 781, TestFixtures.BASE_TIME);

        List<RiskSignalType> signals = analyzer.analyze(current, calmSeries(), GOOD_DATA);

        assertEquals(RiskSeverity.CRITICAL,
                find(signals, RiskKind.WIND, RiskTimeframe.IMMEDIATE).orElseThrow().severity());
    }

    @Test
    void testAnalyze_frost() {
        List<WeatherSnapshotType> series = series(8,
                i -> i == 4 ? snapshot(-3.0, 60.0, 1020.0, 2.0, 0.0, 800, at(i)) : calm(i));

        List<RiskSignalType> signals = analyzer.analyze(calmCurrent(), series, GOOD_DATA);

        RiskSignalType frost = find(signals, RiskKind.OTHER, RiskTimeframe.TODAY).orElseThrow();
        assertEquals(RiskSeverity.MEDIUM, frost.severity());
        assertTrue(frost.evidence().startsWith("Frost risk"));
    }

    @Test
    void testAnalyze_drySpell() {
        List<WeatherSnapshotType> series = series(8, i -> snapshot(27.0, 35.0, 1015.0, 3.0, 0.0, 800, at(i)));

        List<RiskSignalType> signals = analyzer.analyze(calmCurrent(), series, GOOD_DATA);

        RiskSignalType dry = find(signals, RiskKind.OTHER, RiskTimeframe.THIS_WEEK).orElseThrow();
        assertEquals(RiskSeverity.LOW, dry.severity());
        assertTrue(dry.evidence().startsWith("Dry conditions"));
    }

    @Test
    void testMerge_keepsHighestSeverityAndJoinsEvidence() {
        List<RiskSignalType> merged = RiskForecastAnalyzer.merge(List.of(
                new RiskSignalType(RiskKind.STORM, RiskSeverity.MEDIUM, "pressure falling", RiskTimeframe.TODAY),
                new RiskSignalType(RiskKind.WIND, RiskSeverity.LOW, "breezy", RiskTimeframe.TODAY),
                new RiskSignalType(RiskKind.STORM, RiskSeverity.HIGH, "thunderstorm", RiskTimeframe.TODAY),
                new RiskSignalType(RiskKind.STORM, RiskSeverity.LOW, "thunderstorm", RiskTimeframe.TODAY)));

        assertEquals(2, merged.size());
        assertEquals(RiskKind.STORM, merged.get(0).kind());
        assertEquals(RiskSeverity.HIGH, merged.get(0).severity());
        assertEquals("pressure falling; thunderstorm", merged.get(0).evidence());
        assertEquals(RiskKind.WIND, merged.get(1).kind());
    }

    @Test
    void testMerge_differentTimeframesStaySeparate() {
        List<RiskSignalType> merged = RiskForecastAnalyzer.merge(List.of(
                new RiskSignalType(RiskKind.HEAT, RiskSeverity.MEDIUM, "a", RiskTimeframe.TODAY),
                new RiskSignalType(RiskKind.HEAT, RiskSeverity.HIGH, "b", RiskTimeframe.THIS_WEEK)));

        assertEquals(2, merged.size());
    }

    @Test
    void testHeatIndexCelsius() {
        double humid = RiskForecastAnalyzer.heatIndexCelsius(33.0, 80.0);
        double mild = RiskForecastAnalyzer.heatIndexCelsius(20.0, 50.0);

        assertTrue(humid > 41.0 && humid < 54.0, "Heat index was " + humid);
        assertEquals(20.0, mild, 1.5);
    }

    @Test
    void testTrends_risingTemperatureAndFallingPressure() {
        List<WeatherSnapshotType> series = series(6,
                i -> snapshot(20.0 + i, 60.0, 1015.0 - i * 2, 4.0, 0.0, 800, at(i)));

        List<String> trends = analyzer.trends(series);

        assertEquals(List.of("Rising temperature trend (+1.0°C per step)",
                "Falling atmospheric pressure - potential weather system approaching"), trends);
    }

    @Test
    void testTrends_stableAndEmpty() {
        assertEquals(List.of("Stable temperature pattern expected"), analyzer.trends(calmSeries()));
        assertTrue(analyzer.trends(List.of()).isEmpty());
    }

    private static Optional<RiskSignalType> find(List<RiskSignalType> signals, RiskKind kind,
            RiskTimeframe timeframe) {
        return signals.stream().filter(s -> s.kind() == kind && s.timeframe() == timeframe).findFirst();
    }
}
