/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherinsights.services;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.filter.Filter;
import dev.langchain4j.store.embedding.filter.MetadataFilterBuilder;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.weatherinsights.api.types.Audience;
import villagecompute.weatherinsights.api.types.KnowledgeBaseStatsType;
import villagecompute.weatherinsights.api.types.KnowledgePassageType;
import villagecompute.weatherinsights.api.types.RiskSignalType;
import villagecompute.weatherinsights.observability.PipelineMetrics;

/**
 * Retrieves best-practice passages for a risk signal from the similarity-indexed knowledge store.
 *
 * <p>
 * The query text combines the signal kind, the audience and the signal evidence. Three searches are combined: an
 * unfiltered one, a {@code weather_advisory} one for every audience and a {@code best_practice} one for farmers. Results
 * are de-duplicated by passage text (keeping the best score), ordered by descending relevance and cut to {@code k}.
 *
 * <p>
 * Fails softly: an unavailable embedding model or store yields an empty list, never an exception. Callers proceed
 * without grounding.
 */
@ApplicationScoped
public class KnowledgeRetriever {

    private static final Logger LOG = Logger.getLogger(KnowledgeRetriever.class);

    static final String CATEGORY_ADVISORY = "weather_advisory";
    static final String CATEGORY_BEST_PRACTICE = "best_practice";

    private final EmbeddingModel embeddingModel;
    private final EmbeddingStore<TextSegment> embeddingStore;
    private final KnowledgeBaseLoader loader;
    private final PipelineMetrics metrics;

    @ConfigProperty(
            name = "insights.retrieval.top-k",
            defaultValue = "4")
    int defaultTopK;

    @ConfigProperty(
            name = "insights.retrieval.min-score",
            defaultValue = "0.2")
    double minScore;

    @Inject
    public KnowledgeRetriever(EmbeddingModel embeddingModel, EmbeddingStore<TextSegment> embeddingStore,
            KnowledgeBaseLoader loader, PipelineMetrics metrics) {
        this.embeddingModel = embeddingModel;
        this.embeddingStore = embeddingStore;
        this.loader = loader;
        this.metrics = metrics;
    }

    /**
     * Retrieves passages with the configured default {@code k}.
     */
    public List<KnowledgePassageType> retrieve(RiskSignalType signal, Audience audience) {
        return retrieve(signal, audience, defaultTopK);
    }

    /**
     * Retrieves the top-{@code k} passages for a signal.
     *
     * @param signal
     *            risk signal to ground
     * @param audience
     *            requested audience
     * @param k
     *            maximum number of passages
     * @return passages ordered by descending relevance, empty on any failure
     */
    public List<KnowledgePassageType> retrieve(RiskSignalType signal, Audience audience, int k) {
        if (signal == null || k <= 0) {
            return List.of();
        }
        String query = buildQuery(signal, audience);
        try {
            Embedding queryEmbedding = embeddingModel.embed(query).content();

            Map<String, KnowledgePassageType> byText = new LinkedHashMap<>();
            collect(search(queryEmbedding, k, null), byText);
            collect(search(queryEmbedding, k, categoryFilter(CATEGORY_ADVISORY)), byText);
            if (audience == Audience.FARMERS) {
                collect(search(queryEmbedding, k, categoryFilter(CATEGORY_BEST_PRACTICE)), byText);
            }

            List<KnowledgePassageType> passages = new ArrayList<>(byText.values());
            passages.sort(Comparator.comparingDouble(KnowledgePassageType::relevanceScore).reversed());
            if (passages.size() > k) {
                passages = new ArrayList<>(passages.subList(0, k));
            }

            if (passages.isEmpty()) {
                metrics.recordEmptyRetrieval();
            }
            LOG.debugf("Retrieved %d passages for %s/%s", passages.size(), signal.kind().value(),
                    audience == null ? "-" : audience.value());
            return List.copyOf(passages);
        } catch (RuntimeException e) {
            LOG.warnf(e, "Knowledge retrieval failed for %s signal, proceeding without grounding",
                    signal.kind().value());
            metrics.recordEmptyRetrieval();
            return List.of();
        }
    }

    public KnowledgeBaseStatsType stats() {
        return loader.stats();
    }

    static String buildQuery(RiskSignalType signal, Audience audience) {
        String who = audience == null ? Audience.GENERAL_PUBLIC.value() : audience.value();
        return String.format("%s risk for %s: %s", signal.kind().value(), who.replace('_', ' '),
                signal.evidence() == null ? "" : signal.evidence());
    }

    private List<EmbeddingMatch<TextSegment>> search(Embedding queryEmbedding, int k, Filter filter) {
        EmbeddingSearchRequest.EmbeddingSearchRequestBuilder builder = EmbeddingSearchRequest.builder()
                .queryEmbedding(queryEmbedding).maxResults(k).minScore(minScore);
        if (filter != null) {
            builder.filter(filter);
        }
        return embeddingStore.search(builder.build()).matches();
    }

    private static Filter categoryFilter(String category) {
        return MetadataFilterBuilder.metadataKey("category").isEqualTo(category);
    }

    private static void collect(List<EmbeddingMatch<TextSegment>> matches, Map<String, KnowledgePassageType> byText) {
        for (EmbeddingMatch<TextSegment> match : matches) {
            TextSegment segment = match.embedded();
            if (segment == null) {
                continue;
            }
            double score = match.score() == null ? 0.0 : match.score();
            KnowledgePassageType passage = new KnowledgePassageType(segment.text(), score,
                    segment.metadata().getString("source"), segment.metadata().getString("title"),
                    segment.metadata().getString("category"));
            byText.merge(segment.text(), passage,
                    (existing, candidate) -> candidate.relevanceScore() > existing.relevanceScore()
                            ? candidate
                            : existing);
        }
    }
}
