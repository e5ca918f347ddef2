/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherinsights.services;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingStore;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import villagecompute.weatherinsights.api.types.KnowledgeBaseStatsType;
import villagecompute.weatherinsights.api.types.KnowledgeDocumentType;

/**
 * Seeds the knowledge store from the bundled JSON knowledge base and keeps its statistics.
 *
 * <p>
 * Seeding runs once at startup. A failure (missing resource, embedding model not loadable) is logged and leaves the
 * store empty: retrieval then returns no passages and the system status reports the workflow as degraded, but insight
 * runs keep working without grounding.
 *
 * <p>
 * Segment metadata: {@code id}, {@code title}, {@code category} (used by the retrieval filters) and {@code source}.
 */
@ApplicationScoped
public class KnowledgeBaseLoader {

    private static final Logger LOG = Logger.getLogger(KnowledgeBaseLoader.class);

    static final String STORE_NAME = "in-memory";
    static final String DEFAULT_CATEGORY = "weather_advisory";

    private final EmbeddingModel embeddingModel;
    private final EmbeddingStore<TextSegment> embeddingStore;
    private final ObjectMapper objectMapper;

    @ConfigProperty(
            name = "insights.knowledge.resource",
            defaultValue = "knowledge/weather-knowledge.json")
    String resource;

    private volatile boolean seeded;
    private volatile int totalDocuments;
    private volatile int vectorDimension;
    private volatile Map<String, Integer> categoryDistribution = Map.of();

    @Inject
    public KnowledgeBaseLoader(EmbeddingModel embeddingModel, EmbeddingStore<TextSegment> embeddingStore,
            ObjectMapper objectMapper) {
        this.embeddingModel = embeddingModel;
        this.embeddingStore = embeddingStore;
        this.objectMapper = objectMapper;
    }

    void onStart(@Observes StartupEvent event) {
        try {
            seed();
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to seed knowledge base from %s, retrieval will return no passages", resource);
        }
    }

    /**
     * Loads, embeds and stores every knowledge document. Does nothing if the store was already seeded.
     *
     * @return number of documents stored by this call
     */
    public synchronized int seed() {
        if (seeded) {
            return 0;
        }
        List<KnowledgeDocumentType> documents = loadDocuments();
        if (documents.isEmpty()) {
            LOG.warnf("Knowledge base %s is empty", resource);
            seeded = true;
            return 0;
        }

        List<TextSegment> segments = new ArrayList<>();
        Map<String, Integer> categories = new TreeMap<>();
        for (KnowledgeDocumentType document : documents) {
            segments.add(toSegment(document));
            categories.merge(Objects.requireNonNullElse(document.category(), DEFAULT_CATEGORY), 1, Integer::sum);
        }

        List<Embedding> embeddings = embeddingModel.embedAll(segments).content();
        embeddingStore.addAll(embeddings, segments);

        totalDocuments = segments.size();
        vectorDimension = embeddings.get(0).dimension();
        categoryDistribution = Map.copyOf(categories);
        seeded = true;

        LOG.infof("Seeded knowledge base: documents=%d, dimension=%d, categories=%s", totalDocuments, vectorDimension,
                categoryDistribution);
        return totalDocuments;
    }

    public KnowledgeBaseStatsType stats() {
        return new KnowledgeBaseStatsType(totalDocuments, vectorDimension, categoryDistribution, STORE_NAME);
    }

    List<KnowledgeDocumentType> loadDocuments() {
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Knowledge base resource not found: " + resource);
            }
            return objectMapper.readValue(in, new TypeReference<List<KnowledgeDocumentType>>() {
            });
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read knowledge base resource " + resource, e);
        }
    }

    static TextSegment toSegment(KnowledgeDocumentType document) {
        Metadata metadata = new Metadata();
        metadata.put("id", Objects.requireNonNullElse(document.id(), ""));
        metadata.put("title", Objects.requireNonNullElse(document.title(), ""));
        metadata.put("category", Objects.requireNonNullElse(document.category(), DEFAULT_CATEGORY));
        metadata.put("source", Objects.requireNonNullElse(document.source(), "system"));
        return TextSegment.from(document.text(), metadata);
    }
}
