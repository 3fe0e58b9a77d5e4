package br.edu.ifba.kgrag;

import br.edu.ifba.kgrag.adapters.QuarkusEmbeddingAdapter;
import br.edu.ifba.kgrag.adapters.QuarkusLLMAdapter;
import br.edu.ifba.kgrag.concurrency.BatchResult;
import br.edu.ifba.kgrag.concurrency.CancellationToken;
import br.edu.ifba.kgrag.concurrency.TaskOrchestrator;
import br.edu.ifba.kgrag.config.ConcurrencyConfig;
import br.edu.ifba.kgrag.config.KnowledgeGraphConfig;
import br.edu.ifba.kgrag.config.RetrievalConfig;
import br.edu.ifba.kgrag.core.BookContext;
import br.edu.ifba.kgrag.core.SectionInput;
import br.edu.ifba.kgrag.extraction.ExtractionParser;
import br.edu.ifba.kgrag.extraction.ExtractionPrompts;
import br.edu.ifba.kgrag.extraction.KnowledgeGraphExtractor;
import br.edu.ifba.kgrag.pipeline.BookGraphMerger;
import br.edu.ifba.kgrag.pipeline.GraphNormalizer;
import br.edu.ifba.kgrag.pipeline.IdempotentProcessor;
import br.edu.ifba.kgrag.pipeline.KnowledgeGraphEvaluator;
import br.edu.ifba.kgrag.pipeline.MergeStats;
import br.edu.ifba.kgrag.pipeline.ScopedGraphWriter;
import br.edu.ifba.kgrag.pipeline.SectionBuildResult;
import br.edu.ifba.kgrag.pipeline.SectionGraphPipeline;
import br.edu.ifba.kgrag.pipeline.ThresholdFilter;
import br.edu.ifba.kgrag.rerank.Reranker;
import br.edu.ifba.kgrag.rerank.RerankerConfig;
import br.edu.ifba.kgrag.rerank.RerankerFactory;
import br.edu.ifba.kgrag.retrieval.ChunkMentionLinker;
import br.edu.ifba.kgrag.retrieval.EvidenceMerger;
import br.edu.ifba.kgrag.retrieval.GraphRetriever;
import br.edu.ifba.kgrag.retrieval.IndexStats;
import br.edu.ifba.kgrag.retrieval.RetrievalResult;
import br.edu.ifba.kgrag.retrieval.TextChunker;
import br.edu.ifba.kgrag.retrieval.VectorIndexService;
import br.edu.ifba.kgrag.storage.DistanceMetric;
import br.edu.ifba.kgrag.storage.GraphStorage;
import br.edu.ifba.kgrag.storage.VectorStorage;
import br.edu.ifba.kgrag.utils.RetryEventLogger;
import br.edu.ifba.kgrag.utils.ScopeLocks;
import br.edu.ifba.kgrag.utils.TransientFailurePredicate;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Application entry point to the knowledge graph pipeline.
 *
 * <p>Wires the configured storage backend, the LLM and embedding adapters and
 * the reranker into one {@link KnowledgeGraphRag} at startup. The storage
 * backend is selected at build time:</p>
 * <ul>
 * <li>{@code kgrag.storage.backend=sqlite} - single-file SQLite database (default)</li>
 * <li>{@code kgrag.storage.backend=memory} - in-memory stores for tests and demos</li>
 * </ul>
 */
@ApplicationScoped
@Startup
public class KnowledgeGraphService {

    private static final Logger LOG = Logger.getLogger(KnowledgeGraphService.class);

    @Inject
    KnowledgeGraphConfig graphConfig;

    @Inject
    RetrievalConfig retrievalConfig;

    @Inject
    ConcurrencyConfig concurrencyConfig;

    @Inject
    RerankerConfig rerankerConfig;

    @Inject
    RerankerFactory rerankerFactory;

    @Inject
    QuarkusLLMAdapter llmAdapter;

    @Inject
    QuarkusEmbeddingAdapter embeddingAdapter;

    @Inject
    GraphStorage graphStorage;

    @Inject
    VectorStorage vectorStorage;

    @Inject
    RetryEventLogger retryEventLogger;

    @ConfigProperty(name = "kgrag.extraction.system-prompt")
    Optional<String> extractionSystemPrompt;

    @ConfigProperty(name = "kgrag.extraction.user-prompt")
    Optional<String> extractionUserPrompt;

    private KnowledgeGraphRag rag;

    @PostConstruct
    void initialize() {
        graphConfig.validate();
        retrievalConfig.validate();
        LOG.infof("Initializing knowledge graph service (thresholds add=%.2f show=%.2f, alpha=%.2f beta=%.2f, %s)",
            graphConfig.thetaAdd(), graphConfig.thetaShow(),
            retrievalConfig.alpha(), retrievalConfig.beta(), rerankerConfig.describe());

        TransientFailurePredicate transientFailure = new TransientFailurePredicate();
        ExtractionPrompts prompts = new ExtractionPrompts(
            extractionSystemPrompt.orElse(null), extractionUserPrompt.orElse(null));
        KnowledgeGraphExtractor extractor = new KnowledgeGraphExtractor(
            llmAdapter, prompts, new ExtractionParser(), graphConfig.extraction().maxTokens());

        IdempotentProcessor idempotentProcessor = new IdempotentProcessor(graphConfig.maxIdLength());
        ScopedGraphWriter writer = new ScopedGraphWriter(graphStorage, transientFailure, graphConfig.pruneOrphans(),
            new ScopeLocks());
        SectionGraphPipeline sectionPipeline = new SectionGraphPipeline(
            extractor,
            new GraphNormalizer(),
            idempotentProcessor,
            new ThresholdFilter(graphConfig.thetaAdd(), graphConfig.thetaShow(), graphConfig.minEvidenceCount()),
            writer,
            new KnowledgeGraphEvaluator());
        BookGraphMerger bookMerger = new BookGraphMerger(graphStorage, idempotentProcessor, writer);

        RetrievalConfig.Vector vector = retrievalConfig.vector();
        VectorIndexService vectorIndex = new VectorIndexService(
            vectorStorage,
            embeddingAdapter,
            new TextChunker(retrievalConfig.chunk().size(), retrievalConfig.chunk().overlap()),
            vector.collection(),
            DistanceMetric.parse(vector.distance()),
            vector.embedBatchSize());
        vectorIndex.ensureCollection();

        Reranker reranker = rerankerConfig.enabled() ? rerankerFactory.getReranker() : null;
        EvidenceMerger evidenceMerger = new EvidenceMerger(retrievalConfig.alpha(), retrievalConfig.beta(),
            retrievalConfig.maxResults(), reranker, rerankerConfig.topN());

        TaskOrchestrator orchestrator = new TaskOrchestrator(
            concurrencyConfig.maxWorkers(),
            Duration.ofMillis(concurrencyConfig.timeoutMs()),
            concurrencyConfig.retryCount(),
            Duration.ofMillis(concurrencyConfig.backoffMs()),
            transientFailure,
            retryEventLogger);

        this.rag = new KnowledgeGraphRag(sectionPipeline, bookMerger, vectorIndex, new GraphRetriever(graphStorage),
            evidenceMerger, orchestrator, graphStorage, new ChunkMentionLinker(graphStorage), retrievalConfig.hop());
        LOG.info("Knowledge graph service initialized");
    }

    @PreDestroy
    void shutdown() {
        if (rag != null) {
            rag.close();
            LOG.info("Knowledge graph service stopped");
        }
    }

    public SectionBuildResult buildSectionGraph(SectionInput input) {
        return rag.buildSectionGraph(input);
    }

    public BatchResult<SectionBuildResult> buildSectionGraphs(List<SectionInput> inputs, CancellationToken token) {
        return rag.buildSectionGraphs(inputs, token);
    }

    public MergeStats mergeBookGraph(Collection<String> sectionIds, BookContext book) {
        return rag.mergeBookGraph(sectionIds, book);
    }

    public IndexStats indexDocument(String docId, String text, Map<String, Object> metadata) {
        return rag.indexDocument(docId, text, metadata);
    }

    /**
     * Retrieves with the configured result limit.
     */
    public RetrievalResult retrieve(String query, String scope) {
        return rag.retrieve(query, retrievalConfig.maxResults(), true, scope);
    }

    public RetrievalResult retrieve(String query, int topK, boolean includeGraph, String scope) {
        return rag.retrieve(query, topK, includeGraph, scope);
    }

    public GraphStorage.GraphStats getStats(String scope) {
        return scope == null ? rag.getStats() : rag.getStats(scope);
    }

    public KnowledgeGraphRag getRag() {
        return rag;
    }
}
