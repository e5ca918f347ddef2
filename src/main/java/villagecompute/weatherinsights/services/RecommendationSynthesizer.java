/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherinsights.services;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.jboss.logging.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.weatherinsights.api.types.Audience;
import villagecompute.weatherinsights.api.types.KnowledgePassageType;
import villagecompute.weatherinsights.api.types.RecommendationPriority;
import villagecompute.weatherinsights.api.types.RecommendationTiming;
import villagecompute.weatherinsights.api.types.RecommendationType;
import villagecompute.weatherinsights.api.types.RiskSeverity;
import villagecompute.weatherinsights.api.types.RiskSignalType;
import villagecompute.weatherinsights.api.types.WeatherSnapshotType;
import villagecompute.weatherinsights.exceptions.SchemaViolationException;
import villagecompute.weatherinsights.integration.ai.InsightTextGenerator;
import villagecompute.weatherinsights.observability.PipelineMetrics;

/**
 * Turns risk signals and retrieved knowledge into audience-specific recommendations and a narrative summary.
 *
 * <h2>Recommendation Contract</h2>
 * <ul>
 * <li>One generation call per signal; one baseline call when there are no signals.</li>
 * <li>Required fields: title, action, reason, priority, timing. {@code resources_needed} is optional.</li>
 * <li>Objects missing a required field or using an unknown priority/timing are discarded. When nothing usable is left
 * for a signal, a deterministic fallback recommendation is used, so every signal is addressed.</li>
 * <li>{@code critical} priority is kept only for critical-severity signals; anything else is lowered to
 * {@code high}. Baseline recommendations are always {@code low}.</li>
 * <li>{@code target_audience} is always set to the requested audience.</li>
 * </ul>
 *
 * <h2>Summary</h2>
 * <p>
 * One generated paragraph, cross-checked against the recommendation set by keyword overlap. On mismatch it is
 * regenerated once; if it still does not match, or generation fails, a templated summary is used.
 *
 * <p>
 * A generation provider that stays unavailable after retry makes the whole result unavailable: no recommendations are
 * invented for the remaining signals.
 */
@ApplicationScoped
public class RecommendationSynthesizer {

    private static final Logger LOG = Logger.getLogger(RecommendationSynthesizer.class);

    static final int MAX_PER_SIGNAL = 3;
    static final double MIN_SUMMARY_OVERLAP = 0.3;
    private static final int MAX_PASSAGE_CHARS = 600;

    private static final Set<String> STOPWORDS = Set.of("about", "above", "after", "again", "against", "along",
            "also", "because", "before", "being", "below", "between", "could", "during", "every", "first", "from",
            "have", "into", "more", "most", "other", "over", "should", "such", "than", "that", "their", "them", "then",
            "there", "these", "they", "this", "those", "through", "today", "under", "until", "very", "weather", "were",
            "what", "when", "where", "which", "while", "will", "with", "within", "would", "your", "recommendations",
            "recommended", "recommend", "actions", "action", "overall", "current", "conditions", "expected", "next",
            "week", "hours", "priority", "immediately", "ensure", "keep", "make", "take");

    private final InsightTextGenerator generator;
    private final ProviderCallExecutor executor;
    private final PipelineMetrics metrics;
    private final ObjectMapper objectMapper;

    @Inject
    public RecommendationSynthesizer(InsightTextGenerator generator, ProviderCallExecutor executor,
            PipelineMetrics metrics, ObjectMapper objectMapper) {
        this.generator = generator;
        this.executor = executor;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
    }

    /**
     * Output of one synthesis. When {@code available} is false the generation provider could not be reached and both
     * {@code recommendations} and {@code summary} are null.
     */
    public record SynthesisResult(List<RecommendationType> recommendations, String summary, boolean available,
            String failureCause) {

        static SynthesisResult unavailable(String cause) {
            return new SynthesisResult(null, null, false, cause);
        }
    }

    /**
     * Synthesizes recommendations and summary.
     *
     * @param signals
     *            risk signals in analyzer order
     * @param passagesBySignal
     *            retrieved passages per signal; missing entries mean no grounding
     * @param audience
     *            requested audience
     * @param currentWeather
     *            current conditions, may be null
     * @return recommendations in generation order with the summary, or an unavailable result
     */
    public SynthesisResult synthesize(List<RiskSignalType> signals,
            Map<RiskSignalType, List<KnowledgePassageType>> passagesBySignal, Audience audience,
            WeatherSnapshotType currentWeather) {
        Audience target = audience == null ? Audience.GENERAL_PUBLIC : audience;
        AudienceProfiles.Profile profile = AudienceProfiles.forAudience(target);
        List<RecommendationType> recommendations = new ArrayList<>();

        if (signals == null || signals.isEmpty()) {
            CallOutcome<String> outcome = generate(buildBaselinePrompt(profile, currentWeather));
            if (!outcome.succeeded()) {
                return SynthesisResult.unavailable("Recommendation generation unavailable");
            }
            List<RecommendationType> baseline = new ArrayList<>();
            for (RecommendationType parsed : parseOrEmpty(outcome.value(), target)) {
                baseline.add(parsed.withPriority(RecommendationPriority.LOW));
            }
            if (baseline.isEmpty()) {
                metrics.recordSynthesisFallback("schema_violation");
                baseline.add(FallbackRecommendations.baseline(target));
            }
            recommendations.addAll(baseline);
        } else {
            for (RiskSignalType signal : signals) {
                List<KnowledgePassageType> passages = passagesBySignal == null
                        ? List.of()
                        : passagesBySignal.getOrDefault(signal, List.of());
                CallOutcome<String> outcome = generate(buildSignalPrompt(signal, passages, profile, currentWeather));
                if (!outcome.succeeded()) {
                    return SynthesisResult.unavailable("Recommendation generation unavailable");
                }
                List<RecommendationType> forSignal = new ArrayList<>();
                for (RecommendationType parsed : parseOrEmpty(outcome.value(), target)) {
                    forSignal.add(clampPriority(parsed, signal));
                }
                if (forSignal.isEmpty()) {
                    LOG.debugf("No usable recommendations for %s signal, using fallback", signal.kind().value());
                    metrics.recordSynthesisFallback("schema_violation");
                    forSignal.add(FallbackRecommendations.forSignal(signal, target));
                }
                recommendations.addAll(forSignal);
            }
        }

        String summary = summarize(recommendations, profile, target, currentWeather);
        LOG.debugf("Synthesized %d recommendations for %s", recommendations.size(), target.value());
        return new SynthesisResult(List.copyOf(recommendations), summary, true, null);
    }

    /**
     * Lowers {@code critical} to {@code high} unless the signal itself is critical.
     */
    static RecommendationType clampPriority(RecommendationType recommendation, RiskSignalType signal) {
        if (recommendation.priority() == RecommendationPriority.CRITICAL
                && signal.severity() != RiskSeverity.CRITICAL) {
            return recommendation.withPriority(RecommendationPriority.HIGH);
        }
        return recommendation;
    }

    /**
     * Parses a completion into recommendations, discarding objects that break the contract.
     *
     * @throws SchemaViolationException
     *             if the completion is not JSON or holds no recommendation objects
     */
    List<RecommendationType> parseRecommendations(String completion, Audience audience) {
        JsonNode root;
        try {
            root = objectMapper.readTree(InsightTextGenerator.stripMarkdown(completion));
        } catch (JsonProcessingException e) {
            throw new SchemaViolationException("Generation output is not valid JSON", e);
        }

        JsonNode items = root;
        if (root.isObject() && root.has("recommendations")) {
            items = root.get("recommendations");
        }
        List<JsonNode> objects = new ArrayList<>();
        if (items.isArray()) {
            items.forEach(objects::add);
        } else if (items.isObject()) {
            objects.add(items);
        } else {
            throw new SchemaViolationException("Generation output holds no recommendation objects");
        }

        List<RecommendationType> recommendations = new ArrayList<>();
        for (JsonNode node : objects) {
            toRecommendation(node, audience).ifPresentOrElse(recommendations::add,
                    () -> LOG.debugf("Discarded recommendation violating contract: %s", node));
            if (recommendations.size() == MAX_PER_SIGNAL) {
                break;
            }
        }
        return recommendations;
    }

    private List<RecommendationType> parseOrEmpty(String completion, Audience audience) {
        try {
            return parseRecommendations(completion, audience);
        } catch (SchemaViolationException e) {
            LOG.warnf("Generation output rejected: %s", e.getMessage());
            return List.of();
        }
    }

    private static Optional<RecommendationType> toRecommendation(JsonNode node, Audience audience) {
        if (!node.isObject()) {
            return Optional.empty();
        }
        String title = text(node, "title");
        String action = text(node, "action");
        String reason = text(node, "reason");
        Optional<RecommendationPriority> priority = RecommendationPriority.fromValue(text(node, "priority"));
        Optional<RecommendationTiming> timing = RecommendationTiming.fromValue(text(node, "timing"));
        if (title == null || action == null || reason == null || priority.isEmpty() || timing.isEmpty()) {
            return Optional.empty();
        }

        List<String> resources = new ArrayList<>();
        JsonNode resourcesNode = node.path("resources_needed");
        if (resourcesNode.isArray()) {
            for (JsonNode resource : resourcesNode) {
                if (resource.isTextual() && !resource.asText().isBlank()) {
                    resources.add(resource.asText().trim());
                }
            }
        }
        return Optional.of(new RecommendationType(title, action, reason, priority.get(), timing.get(), audience,
                resources));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            return null;
        }
        return value.asText().trim();
    }

    private String summarize(List<RecommendationType> recommendations, AudienceProfiles.Profile profile,
            Audience audience, WeatherSnapshotType currentWeather) {
        String prompt = buildSummaryPrompt(recommendations, profile, currentWeather, false);
        for (int attempt = 0; attempt < 2; attempt++) {
            CallOutcome<String> outcome = generate(prompt);
            if (!outcome.succeeded()) {
                metrics.recordSynthesisFallback("summary_unavailable");
                return templatedSummary(recommendations, profile, currentWeather);
            }
            String summary = outcome.value().trim();
            if (summaryMatches(summary, recommendations)) {
                return summary;
            }
            LOG.debugf("Generated summary does not match recommendation set (attempt %d)", attempt + 1);
            prompt = buildSummaryPrompt(recommendations, profile, currentWeather, true);
        }
        metrics.recordSynthesisFallback("summary_mismatch");
        return templatedSummary(recommendations, profile, currentWeather);
    }

    /**
     * Keyword cross-check: enough of the summary's content words must come from the recommendation set.
     */
    static boolean summaryMatches(String summary, List<RecommendationType> recommendations) {
        Set<String> summaryWords = keywords(summary);
        if (summaryWords.isEmpty()) {
            return false;
        }
        Set<String> allowed = new HashSet<>();
        for (RecommendationType recommendation : recommendations) {
            allowed.addAll(keywords(recommendation.title()));
            allowed.addAll(keywords(recommendation.action()));
            allowed.addAll(keywords(recommendation.reason()));
            for (String resource : recommendation.resourcesNeeded()) {
                allowed.addAll(keywords(resource));
            }
        }
        long overlap = summaryWords.stream().filter(allowed::contains).count();
        return (double) overlap / summaryWords.size() >= MIN_SUMMARY_OVERLAP;
    }

    static Set<String> keywords(String text) {
        Set<String> words = new HashSet<>();
        if (text == null) {
            return words;
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (token.length() >= 4 && !STOPWORDS.contains(token)) {
                words.add(stem(token));
            }
        }
        return words;
    }

    private static String stem(String token) {
        if (token.endsWith("ies") && token.length() > 5) {
            return token.substring(0, token.length() - 3) + "y";
        }
        if (token.endsWith("ing") && token.length() > 6) {
            return token.substring(0, token.length() - 3);
        }
        if (token.endsWith("s") && !token.endsWith("ss") && token.length() > 4) {
            return token.substring(0, token.length() - 1);
        }
        return token;
    }

    /**
     * Deterministic summary built only from the recommendation set.
     */
    static String templatedSummary(List<RecommendationType> recommendations, AudienceProfiles.Profile profile,
            WeatherSnapshotType currentWeather) {
        StringBuilder summary = new StringBuilder("Weather outlook for ").append(profile.displayName());
        if (currentWeather != null && currentWeather.conditionDescription() != null) {
            summary.append(": currently ").append(currentWeather.conditionDescription().toLowerCase(Locale.ROOT));
            if (currentWeather.temperature() != null) {
                summary.append(String.format(Locale.ROOT, " at %.1f°C", currentWeather.temperature()));
            }
        }
        summary.append(". ");

        long critical = recommendations.stream().filter(r -> r.priority() == RecommendationPriority.CRITICAL).count();
        long high = recommendations.stream().filter(r -> r.priority() == RecommendationPriority.HIGH).count();
        summary.append(String.format("%d recommendation%s (%d critical, %d high priority).", recommendations.size(),
                recommendations.size() == 1 ? "" : "s", critical, high));

        List<RecommendationType> ordered = RecommendationOrdering.sort(recommendations);
        if (!ordered.isEmpty()) {
            summary.append(" Most urgent: ");
            int shown = Math.min(3, ordered.size());
            for (int i = 0; i < shown; i++) {
                if (i > 0) {
                    summary.append("; ");
                }
                summary.append(ordered.get(i).title());
            }
            summary.append('.');
        }
        return summary.toString();
    }

    private CallOutcome<String> generate(String prompt) {
        return executor.execute(InsightTextGenerator.PROVIDER, () -> generator.generate(prompt));
    }

    private static String buildSignalPrompt(RiskSignalType signal, List<KnowledgePassageType> passages,
            AudienceProfiles.Profile profile, WeatherSnapshotType currentWeather) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("You are a weather advisory assistant writing actionable recommendations for ")
                .append(profile.displayName()).append(".\n\n");
        prompt.append("Audience guidance: ").append(profile.instructions()).append('\n');
        prompt.append("Preferred vocabulary: ").append(String.join(", ", profile.vocabulary())).append("\n\n");
        appendWeather(prompt, currentWeather);
        prompt.append("Risk signal:\n");
        prompt.append("- kind: ").append(signal.kind().value()).append('\n');
        prompt.append("- severity: ").append(signal.severity().value()).append('\n');
        prompt.append("- timeframe: ").append(signal.timeframe().value()).append('\n');
        prompt.append("- evidence: ").append(signal.evidence()).append("\n\n");
        if (!passages.isEmpty()) {
            prompt.append("Reference best practices:\n");
            for (KnowledgePassageType passage : passages) {
                String text = passage.text();
                if (text.length() > MAX_PASSAGE_CHARS) {
                    text = text.substring(0, MAX_PASSAGE_CHARS);
                }
                prompt.append("- ").append(passage.title() == null ? "" : passage.title() + ": ").append(text)
                        .append('\n');
            }
            prompt.append('\n');
        }
        appendContract(prompt, "1 to " + MAX_PER_SIGNAL + " recommendations addressing this signal");
        return prompt.toString();
    }

    private static String buildBaselinePrompt(AudienceProfiles.Profile profile, WeatherSnapshotType currentWeather) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("You are a weather advisory assistant writing actionable recommendations for ")
                .append(profile.displayName()).append(".\n\n");
        prompt.append("Audience guidance: ").append(profile.instructions()).append("\n\n");
        appendWeather(prompt, currentWeather);
        prompt.append("No weather hazards were detected. Suggest routine, low-priority good practice for these "
                + "conditions.\n\n");
        appendContract(prompt, "exactly 1 recommendation with priority \"low\"");
        return prompt.toString();
    }

    private static String buildSummaryPrompt(List<RecommendationType> recommendations,
            AudienceProfiles.Profile profile, WeatherSnapshotType currentWeather, boolean strict) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Write one short paragraph (at most 4 sentences) summarizing these weather recommendations for ")
                .append(profile.displayName()).append(".\n\n");
        appendWeather(prompt, currentWeather);
        prompt.append("Recommendations:\n");
        for (RecommendationType recommendation : recommendations) {
            prompt.append("- [").append(recommendation.priority().value()).append(", ")
                    .append(recommendation.timing().value()).append("] ").append(recommendation.title()).append(": ")
                    .append(recommendation.action()).append('\n');
        }
        prompt.append("\nDo not introduce any action that is not in the list above.");
        if (strict) {
            prompt.append(" Reuse the wording of the listed titles and actions; do not add advice of your own.");
        }
        prompt.append(" Respond with the paragraph only, no JSON and no Markdown.");
        return prompt.toString();
    }

    private static void appendWeather(StringBuilder prompt, WeatherSnapshotType weather) {
        if (weather == null) {
            return;
        }
        prompt.append("Current conditions:");
        if (weather.conditionDescription() != null) {
            prompt.append(' ').append(weather.conditionDescription()).append(',');
        }
        if (weather.temperature() != null) {
            prompt.append(String.format(Locale.ROOT, " %.1f°C,", weather.temperature()));
        }
        if (weather.humidity() != null) {
            prompt.append(String.format(Locale.ROOT, " humidity %.0f%%,", weather.humidity()));
        }
        if (weather.windSpeed() != null) {
            prompt.append(String.format(Locale.ROOT, " wind %.1f m/s,", weather.windSpeed()));
        }
        prompt.setLength(prompt.length() - (prompt.charAt(prompt.length() - 1) == ',' ? 1 : 0));
        prompt.append("\n\n");
    }

    private static void appendContract(StringBuilder prompt, String count) {
        prompt.append("Respond ONLY with a JSON array of ").append(count)
                .append(". Each element must have exactly these fields:\n");
        prompt.append("{\n");
        prompt.append("  \"title\": \"short action summary\",\n");
        prompt.append("  \"action\": \"specific action to take\",\n");
        prompt.append("  \"reason\": \"why it is needed\",\n");
        prompt.append("  \"priority\": \"critical\" | \"high\" | \"medium\" | \"low\",\n");
        prompt.append(
                "  \"timing\": \"immediate\" | \"within_2_hours\" | \"today\" | \"this_week\" | \"next_week\",\n");
        prompt.append("  \"resources_needed\": [\"optional list of resources\"]\n");
        prompt.append("}\n");
        prompt.append("Use priority \"critical\" only for life-threatening situations.");
    }
}
