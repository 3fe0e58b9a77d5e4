package br.edu.ifba.kgrag;

import br.edu.ifba.kgrag.concurrency.BatchResult;
import br.edu.ifba.kgrag.concurrency.CancellationToken;
import br.edu.ifba.kgrag.concurrency.TaskOrchestrator;
import br.edu.ifba.kgrag.core.BookContext;
import br.edu.ifba.kgrag.core.Chunk;
import br.edu.ifba.kgrag.core.Evidence;
import br.edu.ifba.kgrag.core.SectionInput;
import br.edu.ifba.kgrag.pipeline.BookGraphMerger;
import br.edu.ifba.kgrag.pipeline.MergeStats;
import br.edu.ifba.kgrag.pipeline.SectionBuildResult;
import br.edu.ifba.kgrag.pipeline.SectionGraphPipeline;
import br.edu.ifba.kgrag.retrieval.ChunkMentionLinker;
import br.edu.ifba.kgrag.retrieval.EvidenceMerger;
import br.edu.ifba.kgrag.retrieval.GraphHit;
import br.edu.ifba.kgrag.retrieval.GraphRetriever;
import br.edu.ifba.kgrag.retrieval.IndexStats;
import br.edu.ifba.kgrag.retrieval.RetrievalResult;
import br.edu.ifba.kgrag.retrieval.VectorHit;
import br.edu.ifba.kgrag.retrieval.VectorIndexService;
import br.edu.ifba.kgrag.storage.GraphStorage;
import br.edu.ifba.kgrag.storage.GraphStoreException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Knowledge graph construction and dual-channel retrieval.
 *
 * <p>Holds every collaborator explicitly; one instance is built at startup
 * and shared. Per-unit and per-query failures come back as structured
 * results, never as exceptions.</p>
 *
 * <h2>Operations:</h2>
 * <ul>
 *   <li>{@link #buildSectionGraph} / {@link #buildSectionGraphs}: extract and store section graphs</li>
 *   <li>{@link #mergeBookGraph}: fold section graphs into one book graph</li>
 *   <li>{@link #indexDocument}: chunk and embed a document into the vector index and link
 *       its chunks to the graph nodes they mention</li>
 *   <li>{@link #retrieve}: vector and graph search in parallel, fused into ranked evidence</li>
 * </ul>
 */
public class KnowledgeGraphRag implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(KnowledgeGraphRag.class);

    static final String OP_BUILD_SECTION = "build-section";
    static final String OP_MERGE_BOOK = "merge-book";
    static final String OP_INDEX_DOCUMENT = "index-document";

    private final SectionGraphPipeline sectionPipeline;
    private final BookGraphMerger bookMerger;
    private final VectorIndexService vectorIndex;
    private final GraphRetriever graphRetriever;
    private final EvidenceMerger evidenceMerger;
    private final TaskOrchestrator orchestrator;
    private final GraphStorage graphStorage;
    private final ChunkMentionLinker mentionLinker;
    private final int hop;

    public KnowledgeGraphRag(@NotNull SectionGraphPipeline sectionPipeline,
                             @NotNull BookGraphMerger bookMerger,
                             @NotNull VectorIndexService vectorIndex,
                             @NotNull GraphRetriever graphRetriever,
                             @NotNull EvidenceMerger evidenceMerger,
                             @NotNull TaskOrchestrator orchestrator,
                             @NotNull GraphStorage graphStorage,
                             @NotNull ChunkMentionLinker mentionLinker,
                             int hop) {
        this.sectionPipeline = sectionPipeline;
        this.bookMerger = bookMerger;
        this.vectorIndex = vectorIndex;
        this.graphRetriever = graphRetriever;
        this.evidenceMerger = evidenceMerger;
        this.orchestrator = orchestrator;
        this.graphStorage = graphStorage;
        this.mentionLinker = mentionLinker;
        this.hop = hop;
    }

    /**
     * Builds and stores the graph of one section, retrying transient failures.
     * Re-indexing the same section is serialized and replaces its previous edges.
     */
    @NotNull
    public SectionBuildResult buildSectionGraph(@NotNull SectionInput input) {
        try {
            return submitSection(input).join();
        } catch (CompletionException e) {
            return failure(input, e);
        }
    }

    /**
     * Builds many sections on the worker pool. A failing section is reported
     * and does not stop the others; cancelling stops new submissions only.
     */
    @NotNull
    public BatchResult<SectionBuildResult> buildSectionGraphs(@NotNull List<SectionInput> inputs,
                                                              @Nullable CancellationToken token) {
        BatchResult<SectionBuildResult> result = orchestrator.runBatch(OP_BUILD_SECTION, inputs,
            SectionInput::sectionId, this::runSection, token);
        logger.info("Section batch finished: {} built, {} failed, {} cancelled",
            result.successCount(), result.failureCount(), result.cancelled());
        return result;
    }

    /**
     * Adds sections to a book and recomputes the book graph from all of its sections.
     */
    @NotNull
    public MergeStats mergeBookGraph(@NotNull Collection<String> sectionIds, @NotNull BookContext book) {
        try {
            return orchestrator.submit(OP_MERGE_BOOK, book.bookId(), () -> bookMerger.merge(sectionIds, book))
                .join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.error("Book merge failed for {}: {}", book.bookId(), cause.getMessage());
            return MergeStats.failed(book.bookId(), book.scope(), String.valueOf(cause.getMessage()));
        }
    }

    /**
     * Replaces a document's chunks in the vector index, then its chunk to node
     * mention links. A failed linking step is reported in the stats' errors
     * and leaves the indexed chunks in place.
     */
    @NotNull
    public IndexStats indexDocument(@NotNull String docId, @NotNull String text,
                                    @Nullable Map<String, Object> metadata) {
        try {
            return orchestrator.submit(OP_INDEX_DOCUMENT, docId, () -> indexAndLink(docId, text, metadata))
                .join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.error("Indexing document {} failed: {}", docId, cause.getMessage());
            return new IndexStats(0, 0, List.of(cause.getMessage() != null ? cause.getMessage() : cause.toString()));
        }
    }

    private IndexStats indexAndLink(String docId, String text, Map<String, Object> metadata) {
        List<Chunk> chunks = vectorIndex.chunkDocument(docId, text, metadata);
        IndexStats stats = vectorIndex.replaceDocument(docId, chunks);
        try {
            return stats.withMentions(mentionLinker.link(docId, chunks));
        } catch (GraphStoreException e) {
            logger.warn("Linking mentions of document {} failed: {}", docId, e.getMessage());
            return stats.withError("mentions: " + e.getMessage());
        }
    }

    /**
     * Dual-channel retrieval. Both channels run in parallel; a failing channel
     * contributes no hits and is named in the result's errors.
     *
     * @param query        the query
     * @param topK         evidence to return
     * @param includeGraph whether to query the graph channel
     * @param scope        graph scope such as {@code book:<id>}, null for all scopes
     */
    @NotNull
    public RetrievalResult retrieve(@NotNull String query, int topK, boolean includeGraph, @Nullable String scope) {
        if (query.isBlank() || topK <= 0) {
            return RetrievalResult.empty(query, scope);
        }
        long started = System.currentTimeMillis();
        CompletableFuture<List<VectorHit>> vectorFuture =
            orchestrator.supply(() -> vectorIndex.search(query, topK, null));
        CompletableFuture<List<GraphHit>> graphFuture = includeGraph
            ? orchestrator.supply(() -> graphRetriever.search(query, topK, hop, null, scope))
            : CompletableFuture.completedFuture(List.of());

        Map<String, String> errors = new LinkedHashMap<>();
        List<VectorHit> vectorHits = collect(Evidence.SOURCE_VECTOR, vectorFuture, errors);
        List<GraphHit> graphHits = collect(Evidence.SOURCE_GRAPH, graphFuture, errors);

        List<Evidence> evidence = evidenceMerger.merge(query, vectorHits, graphHits, topK);
        long elapsed = System.currentTimeMillis() - started;
        logger.info("Retrieved {} evidence items (vector {}, graph {}) in {} ms",
            evidence.size(), vectorHits.size(), graphHits.size(), elapsed);
        return new RetrievalResult(query, scope, evidence, vectorHits.size(), graphHits.size(), errors, elapsed);
    }

    @NotNull
    public GraphStorage.GraphStats getStats() {
        return graphStorage.getStats().join();
    }

    @NotNull
    public GraphStorage.GraphStats getStats(@NotNull String scope) {
        return graphStorage.getStats(scope).join();
    }

    public VectorIndexService getVectorIndex() {
        return vectorIndex;
    }

    public GraphRetriever getGraphRetriever() {
        return graphRetriever;
    }

    public EvidenceMerger getEvidenceMerger() {
        return evidenceMerger;
    }

    @Override
    public void close() {
        orchestrator.close();
    }

    private CompletableFuture<SectionBuildResult> submitSection(SectionInput input) {
        return orchestrator.submit(OP_BUILD_SECTION, input.sectionId(),
            () -> sectionPipeline.run(input));
    }

    private SectionBuildResult runSection(SectionInput input) {
        SectionBuildResult result = sectionPipeline.run(input);
        if (!result.success()) {
            throw new IllegalStateException(result.error() != null ? result.error() : "section build failed");
        }
        return result;
    }

    private static SectionBuildResult failure(SectionInput input, CompletionException e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        logger.error("Section {} failed: {}", input.sectionId(), message);
        return SectionBuildResult.failure(input.sectionId(), input.contentHash(), input.scope(), message);
    }

    private static <T> List<T> collect(String channel, CompletableFuture<List<T>> future, Map<String, String> errors) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            logger.warn("{} channel failed, continuing without it: {}", channel, message);
            errors.put(channel, message);
            return List.of();
        }
    }
}
