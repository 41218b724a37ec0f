package org.carball.sift;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.carball.sift.analyzer.StructureAnalyzer;
import org.carball.sift.builder.IdentifierNormalizer;
import org.carball.sift.builder.SchemaBuilder;
import org.carball.sift.config.DecisionThresholds;
import org.carball.sift.config.SiftConfig;
import org.carball.sift.decision.SchemaNameRegistry;
import org.carball.sift.decision.StorageDecisionEngine;
import org.carball.sift.index.InMemoryIndexPersistence;
import org.carball.sift.index.IndexPersistence;
import org.carball.sift.index.MetadataIndexer;
import org.carball.sift.media.MediaCategoryResolver;
import org.carball.sift.media.MediaClassifier;
import org.carball.sift.model.decision.SchemaDecision;
import org.carball.sift.model.decision.StorageLocation;
import org.carball.sift.model.index.IndexEntry;
import org.carball.sift.model.index.IndexFilter;
import org.carball.sift.model.index.IndexStats;
import org.carball.sift.model.index.IngestionDetails;
import org.carball.sift.storage.DocumentBackend;
import org.carball.sift.storage.InMemoryDocumentBackend;
import org.carball.sift.storage.InMemoryKeyAllocator;
import org.carball.sift.storage.InMemoryRelationalBackend;
import org.carball.sift.storage.KeyAllocator;
import org.carball.sift.storage.RelationalBackend;
import org.carball.sift.storage.RetryPolicy;
import org.carball.sift.storage.StorageRouter;

import java.time.Clock;
import java.util.List;

/**
 * Entry point into the analysis, routing and indexing core.
 * <p>
 * Built with {@link #builder()}; every collaborator left unset gets an in-memory or
 * default implementation.
 */
@Slf4j
public class SiftEngine {

    private final SiftConfig config;
    private final DecisionThresholds thresholds;
    private final StorageDecisionEngine decisionEngine;
    private final StorageRouter storageRouter;
    private final MediaCategoryResolver categoryResolver;
    private final MetadataIndexer indexer;
    private final SchemaNameRegistry nameRegistry;

    private SiftEngine(SiftConfig config,
                       DecisionThresholds thresholds,
                       StorageDecisionEngine decisionEngine,
                       StorageRouter storageRouter,
                       MediaCategoryResolver categoryResolver,
                       MetadataIndexer indexer,
                       SchemaNameRegistry nameRegistry) {
        this.config = config;
        this.thresholds = thresholds;
        this.decisionEngine = decisionEngine;
        this.storageRouter = storageRouter;
        this.categoryResolver = categoryResolver;
        this.indexer = indexer;
        this.nameRegistry = nameRegistry;
    }

    @Builder
    private static SiftEngine create(SiftConfig config,
                                     DecisionThresholds thresholds,
                                     RelationalBackend relationalBackend,
                                     DocumentBackend documentBackend,
                                     MediaClassifier classifier,
                                     IndexPersistence indexPersistence,
                                     SchemaNameRegistry nameRegistry,
                                     KeyAllocator keyAllocator,
                                     RetryPolicy retryPolicy,
                                     Clock clock) {
        SiftConfig cfg = config != null ? config : SiftConfig.defaults();
        DecisionThresholds limits = thresholds != null ? thresholds : cfg.toThresholds();
        SchemaNameRegistry registry = nameRegistry != null ? nameRegistry : new SchemaNameRegistry();
        RetryPolicy retry = retryPolicy != null ? retryPolicy : RetryPolicy.builder()
                .maxAttempts(cfg.getBackendApplyMaxAttempts())
                .initialBackoffMs(cfg.getBackendApplyBackoffMs())
                .build();

        StructureAnalyzer analyzer = new StructureAnalyzer(limits.getMaxAnalysisDepth());
        SchemaBuilder schemaBuilder = new SchemaBuilder(
                new IdentifierNormalizer(cfg.getMaxIdentifierLength()), limits.getMaxAnalysisDepth());
        StorageDecisionEngine decisionEngine = new StorageDecisionEngine(analyzer, schemaBuilder, registry, limits);

        StorageRouter router = new StorageRouter(
                relationalBackend != null ? relationalBackend : new InMemoryRelationalBackend(),
                documentBackend != null ? documentBackend : new InMemoryDocumentBackend(),
                retry,
                keyAllocator != null ? keyAllocator : new InMemoryKeyAllocator());

        MediaCategoryResolver resolver = MediaCategoryResolver.forClassifier(
                classifier != null ? classifier : MediaClassifier.unavailable(), cfg);

        MetadataIndexer indexer = new MetadataIndexer(
                indexPersistence != null ? indexPersistence : new InMemoryIndexPersistence(),
                clock != null ? clock : Clock.systemUTC(),
                retry);

        log.debug("Engine ready: {}", limits.getConfigurationSummary());
        return new SiftEngine(cfg, limits, decisionEngine, router, resolver, indexer, registry);
    }

    public SchemaDecision analyzeAndDecide(List<JsonNode> records) {
        return decisionEngine.decide(records);
    }

    /**
     * Accepts a single object or an array of objects.
     */
    public SchemaDecision analyzeAndDecide(JsonNode payload) {
        return decisionEngine.decide(payload);
    }

    public StorageLocation applySchema(SchemaDecision decision) {
        return storageRouter.apply(decision);
    }

    /**
     * Applies the decision's schema and writes the records into it.
     */
    public StorageLocation store(SchemaDecision decision, List<JsonNode> records) {
        return storageRouter.store(decision, records);
    }

    public String resolveMediaCategory(byte[] content, String filename) {
        return categoryResolver.resolve(content, filename);
    }

    public long recordIngestion(IngestionDetails details) {
        return indexer.record(details);
    }

    public List<IndexEntry> search(IndexFilter filter) {
        return indexer.search(filter);
    }

    public IndexStats stats() {
        return indexer.stats();
    }

    public SiftConfig getConfig() {
        return config;
    }

    public DecisionThresholds getThresholds() {
        return thresholds;
    }

    public SchemaNameRegistry getNameRegistry() {
        return nameRegistry;
    }
}
