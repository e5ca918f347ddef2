package villagecompute.weatherinsights;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntFunction;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import villagecompute.weatherinsights.api.types.Audience;
import villagecompute.weatherinsights.api.types.RecommendationPriority;
import villagecompute.weatherinsights.api.types.RecommendationTiming;
import villagecompute.weatherinsights.api.types.RecommendationType;
import villagecompute.weatherinsights.api.types.WeatherSnapshotType;
import villagecompute.weatherinsights.observability.PipelineMetrics;
import villagecompute.weatherinsights.services.DataQualityValidator;
import villagecompute.weatherinsights.services.ProviderCallExecutor;
import villagecompute.weatherinsights.services.RiskForecastAnalyzer;
import villagecompute.weatherinsights.services.TestServices;

/**
 * Test fixture factory methods for weather readings, recommendations and services wired with their default
 * configuration.
 *
 * <p>
 * <b>Usage Example:</b>
 *
 * <pre>
 * WeatherSnapshotType now = TestFixtures.snapshot(28.0, 60.0, 1012.0, 3.0, null, 800, TestFixtures.BASE_TIME);
 * List&lt;WeatherSnapshotType&gt; series = TestFixtures.series(8, i -&gt; TestFixtures.calm(i));
 * </pre>
 */
public final class TestFixtures {

    /** Fixed reference time for all readings. */
    public static final Instant BASE_TIME = Instant.parse("2025-06-01T06:00:00Z");

    public static final Duration STEP = Duration.ofHours(3);

    public static final int CLEAR_SKY = 800;
    public static final int THUNDERSTORM_HEAVY_RAIN = 202;
    public static final int THUNDERSTORM = 211;
    public static final int LIGHT_RAIN = 500;

    /** Prevent instantiation. */
    private TestFixtures() {
    }

    // ========== READINGS ==========

    /**
     * Builds a reading with the given core fields. Visibility, cloudiness and wind direction are filled with plausible
     * values.
     */
    public static WeatherSnapshotType snapshot(Double temperature, Double humidity, Double pressure, Double windSpeed,
            Double rainfall3h, Integer conditionCode, Instant timestamp) {
        return new WeatherSnapshotType(temperature, humidity, pressure, windSpeed, 180.0, 10.0, 40.0, null,
                rainfall3h, conditionCode, "test conditions", timestamp, List.of());
    }

    /** A mild, dry, complete reading {@code step} forecast steps after {@link #BASE_TIME}. */
    public static WeatherSnapshotType calm(int step) {
        return snapshot(24.0, 55.0, 1013.0, 3.0, 0.0, CLEAR_SKY, at(step));
    }

    /** Mild, dry current conditions at {@link #BASE_TIME}. */
    public static WeatherSnapshotType calmCurrent() {
        return calm(0);
    }

    /** Time of forecast step {@code step}. */
    public static Instant at(int step) {
        return BASE_TIME.plus(STEP.multipliedBy(step));
    }

    /** Series of {@code size} steps produced by {@code factory}, first step at index 1. */
    public static List<WeatherSnapshotType> series(int size, IntFunction<WeatherSnapshotType> factory) {
        List<WeatherSnapshotType> series = new ArrayList<>();
        for (int i = 1; i <= size; i++) {
            series.add(factory.apply(i));
        }
        return series;
    }

    /** Eight calm forecast steps. */
    public static List<WeatherSnapshotType> calmSeries() {
        return series(8, TestFixtures::calm);
    }

    /**
     * Hot, humid current conditions with an approaching thunderstorm.
     */
    public static WeatherSnapshotType stormCurrent() {
        return snapshot(33.0, 80.0, 1004.0, 8.0, 20.0, THUNDERSTORM, BASE_TIME);
    }

    /**
     * Forecast starting with three consecutive 20 mm/3h thunderstorm steps, followed by calm steps.
     */
    public static List<WeatherSnapshotType> stormSeries() {
        return series(8, i -> i <= 3 ? snapshot(31.0, 85.0, 1002.0, 10.0, 20.0, THUNDERSTORM, at(i)) : calm(i));
    }

    // ========== RECOMMENDATIONS ==========

    public static RecommendationType recommendation(String title, RecommendationPriority priority,
            RecommendationTiming timing) {
        return new RecommendationType(title, "Do " + title.toLowerCase(), "Because of " + title.toLowerCase(), priority,
                timing, Audience.GENERAL_PUBLIC, List.of());
    }

    // ========== SERVICES ==========

    public static PipelineMetrics metrics() {
        return new PipelineMetrics(new SimpleMeterRegistry());
    }

    public static DataQualityValidator validator() {
        return new DataQualityValidator();
    }

    public static RiskForecastAnalyzer analyzer() {
        return TestServices.analyzer();
    }

    public static ProviderCallExecutor executor(PipelineMetrics metrics) {
        return TestServices.executor(metrics);
    }
}
