package br.edu.ifba.kgrag.pipeline;

import br.edu.ifba.kgrag.core.Edge;
import br.edu.ifba.kgrag.core.KnowledgeGraph;
import br.edu.ifba.kgrag.core.SectionInput;
import br.edu.ifba.kgrag.extraction.KnowledgeGraphExtractor;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.List;

/**
 * Per-section pipeline: extract, normalize, assign ids, gate, store, evaluate.
 *
 * <p>Stages run strictly in order for one section. Extraction and store
 * failures propagate so the orchestrator can decide whether to retry;
 * everything else is folded into the result.</p>
 */
public class SectionGraphPipeline {

    private static final Logger logger = LoggerFactory.getLogger(SectionGraphPipeline.class);

    private static final String MDC_SECTION = "kg.section";

    private final KnowledgeGraphExtractor extractor;
    private final GraphNormalizer normalizer;
    private final IdempotentProcessor idempotentProcessor;
    private final ThresholdFilter thresholds;
    private final ScopedGraphWriter writer;
    private final KnowledgeGraphEvaluator evaluator;

    public SectionGraphPipeline(@NotNull KnowledgeGraphExtractor extractor,
                                @NotNull GraphNormalizer normalizer,
                                @NotNull IdempotentProcessor idempotentProcessor,
                                @NotNull ThresholdFilter thresholds,
                                @NotNull ScopedGraphWriter writer,
                                @NotNull KnowledgeGraphEvaluator evaluator) {
        this.extractor = extractor;
        this.normalizer = normalizer;
        this.idempotentProcessor = idempotentProcessor;
        this.thresholds = thresholds;
        this.writer = writer;
        this.evaluator = evaluator;
    }

    /**
     * Extracts and stores one section. Runs of the same section are
     * serialized on the section's scope lock.
     */
    @NotNull
    public SectionBuildResult run(@NotNull SectionInput input) {
        return writer.getScopeLocks().withScopeLock(input.scope(), () -> runLocked(input));
    }

    private SectionBuildResult runLocked(SectionInput input) {
        String sectionId = input.sectionId();
        String scope = input.scope();
        MDC.put(MDC_SECTION, sectionId);
        try {
            logger.info("Building section graph for '{}' ({})", input.subchapterTitle(), sectionId);

            KnowledgeGraph raw = extractor.extract(input);
            KnowledgeGraph normalized = normalizer.normalize(raw);
            KnowledgeGraph identified = idempotentProcessor.process(normalized, scope, sectionId);

            List<Edge> storable = thresholds.filterForStorage(identified.edges());
            if (storable.size() < identified.edges().size()) {
                logger.debug("Storage gate dropped {} of {} edges",
                    identified.edges().size() - storable.size(), identified.edges().size());
            }
            KnowledgeGraph gated = identified.withEdges(storable);

            StoreStats storeStats = writer.rewriteScope(scope, gated);
            SectionInsights insights = evaluator.evaluate(gated,
                List.of(input.subchapterTitle()), input.keywords());

            return new SectionBuildResult(sectionId, input.contentHash(), scope, storeStats.success(),
                storeStats, insights, gated, thresholds.filterForDisplay(storable), storeStats.error());
        } finally {
            MDC.remove(MDC_SECTION);
        }
    }
}
