package br.edu.ifba.kgrag.extraction;

import br.edu.ifba.kgrag.core.Edge;
import br.edu.ifba.kgrag.core.KnowledgeGraph;
import br.edu.ifba.kgrag.core.Node;
import br.edu.ifba.kgrag.core.SectionInput;
import br.edu.ifba.kgrag.extraction.ExtractionParser.ParseResult;
import br.edu.ifba.kgrag.extraction.ExtractionParser.ParsedNode;
import br.edu.ifba.kgrag.extraction.ExtractionParser.ParsedRelation;
import br.edu.ifba.kgrag.llm.LLMFunction;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns one section into a draft graph with a single LLM call.
 *
 * <p>Draft nodes carry no id; draft edges reference their endpoints by
 * name. Ids are assigned later by the idempotent processor.</p>
 *
 * <p>An empty answer raises {@link ExtractionException}. An answer the parser
 * cannot read yields an empty graph, so one bad section never aborts a batch.
 * {@link br.edu.ifba.kgrag.llm.LlmCallException} propagates unchanged for the
 * orchestrator to retry.</p>
 */
public class KnowledgeGraphExtractor {

    private static final Logger logger = LoggerFactory.getLogger(KnowledgeGraphExtractor.class);

    private final LLMFunction llm;
    private final ExtractionPrompts prompts;
    private final ExtractionParser parser;
    private final int maxTokens;

    public KnowledgeGraphExtractor(@NotNull LLMFunction llm, @NotNull ExtractionPrompts prompts,
                                   @NotNull ExtractionParser parser, int maxTokens) {
        this.llm = Objects.requireNonNull(llm, "llm");
        this.prompts = Objects.requireNonNull(prompts, "prompts");
        this.parser = Objects.requireNonNull(parser, "parser");
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive, got " + maxTokens);
        }
        this.maxTokens = maxTokens;
    }

    @NotNull
    public KnowledgeGraph extract(@NotNull SectionInput input) {
        String sectionId = input.sectionId();
        String answer = llm.generate(
            prompts.formatUserPrompt(input), prompts.formatSystemPrompt(input.language()), maxTokens);

        if (answer == null || answer.isBlank()) {
            throw new ExtractionException("LLM returned empty content for section " + sectionId, sectionId);
        }

        ParseResult parsed = parser.parse(answer);
        if (!parsed.isOk()) {
            logger.warn("Unreadable extraction answer for section {} ({}), using an empty graph",
                sectionId, parsed.error());
            return KnowledgeGraph.empty();
        }
        if (parsed.skippedLines() > 0) {
            logger.debug("Skipped {} malformed lines in extraction answer for section {}",
                parsed.skippedLines(), sectionId);
        }

        String scope = input.scope();
        List<Node> nodes = new ArrayList<>(parsed.nodes().size());
        for (ParsedNode parsedNode : parsed.nodes()) {
            nodes.add(Node.builder()
                .name(parsedNode.name())
                .description(parsedNode.description())
                .scope(scope)
                .chapter(input.chapterTitle())
                .subchapter(input.subchapterTitle())
                .build());
        }

        List<Edge> edges = new ArrayList<>(parsed.relations().size());
        for (ParsedRelation relation : parsed.relations()) {
            edges.add(Edge.builder()
                .sourceName(relation.source())
                .targetName(relation.target())
                .label(relation.label())
                .description("extracted relation: " + relation.source() + " -> " + relation.target())
                .evidence("extracted relation: " + relation.source() + " -> " + relation.target())
                .confidence(Edge.DEFAULT_CONFIDENCE)
                .weight(Edge.DEFAULT_WEIGHT)
                .scope(scope)
                .srcSection(sectionId)
                .build());
        }

        logger.info("Extracted {} nodes and {} relations from section {}", nodes.size(), edges.size(), sectionId);
        return new KnowledgeGraph(nodes, edges, parsed.hierarchy());
    }
}
