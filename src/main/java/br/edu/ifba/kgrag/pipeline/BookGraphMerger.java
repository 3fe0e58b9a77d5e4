package br.edu.ifba.kgrag.pipeline;

import br.edu.ifba.kgrag.core.BookContext;
import br.edu.ifba.kgrag.core.Edge;
import br.edu.ifba.kgrag.core.KnowledgeGraph;
import br.edu.ifba.kgrag.core.Node;
import br.edu.ifba.kgrag.core.RelationType;
import br.edu.ifba.kgrag.core.Scopes;
import br.edu.ifba.kgrag.storage.GraphStorage;
import br.edu.ifba.kgrag.utils.IdentityUtil;
import br.edu.ifba.kgrag.utils.ScopeLocks;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Consolidates section graphs into one book graph.
 *
 * <p>The book scope remembers its member sections. Each merge adds the
 * requested sections to that set and recomputes the whole book from every
 * member, read in sorted scope order, so merging {@code [A,B]} then {@code [C]}
 * ends in the same graph as merging {@code [A,B,C]} at once.</p>
 *
 * <p>Nodes group by their book-scoped id, which is a function of canonical
 * name and type. A group keeps the first member's name, the longest
 * description, the union of aliases and the highest score. Edges group by
 * {@code (source, target, type)} after endpoint remapping: weights are
 * averaged, the highest confidence wins, and distinct descriptions and
 * per-section evidence are concatenated with {@code ;}.</p>
 */
public class BookGraphMerger {

    private static final Logger logger = LoggerFactory.getLogger(BookGraphMerger.class);

    private static final String SEPARATOR = "; ";

    private final GraphStorage storage;
    private final IdempotentProcessor idempotentProcessor;
    private final ScopedGraphWriter writer;

    public BookGraphMerger(@NotNull GraphStorage storage, @NotNull IdempotentProcessor idempotentProcessor,
                           @NotNull ScopedGraphWriter writer) {
        this.storage = storage;
        this.idempotentProcessor = idempotentProcessor;
        this.writer = writer;
    }

    /**
     * Adds {@code sectionIds} to the book and rewrites the book scope.
     */
    @NotNull
    public MergeStats merge(@NotNull Collection<String> sectionIds, @NotNull BookContext book) {
        String bookScope = book.scope();
        try (ScopeLocks.Held ignored = writer.getScopeLocks().acquireInOrder(bookScope)) {
            List<String> requested = sectionIds.stream().map(Scopes::section).distinct().sorted().toList();
            if (!requested.isEmpty()) {
                storage.addScopeMembers(bookScope, requested).join();
            }
            List<String> members = storage.getScopeMembers(bookScope).join();
            logger.info("Merging {} sections ({} requested) into {}", members.size(), requested.size(), bookScope);

            List<SectionGraph> sections = loadSections(members);
            KnowledgeGraph merged = mergeGraphs(sections, book);

            int originalNodes = sections.stream().mapToInt(s -> s.graph().nodes().size()).sum();
            int originalEdges = sections.stream().mapToInt(s -> s.graph().edges().size()).sum();
            StoreStats storeStats = writer.rewriteScope(bookScope, merged);

            MergeStats stats = new MergeStats(book.bookId(), bookScope, members,
                originalNodes, originalEdges, merged.nodes().size(), merged.edges().size(),
                MergeStats.dedupRatio(originalNodes, merged.nodes().size()),
                MergeStats.dedupRatio(originalEdges, merged.edges().size()),
                chapters(merged.nodes()), merged.hierarchy(), storeStats);
            logger.info("Book {} merged: {} -> {} nodes, {} -> {} edges",
                book.bookId(), originalNodes, stats.mergedNodes(), originalEdges, stats.mergedEdges());
            return stats;
        }
    }

    private List<SectionGraph> loadSections(List<String> memberScopes) {
        try (ScopeLocks.Held ignored = writer.getScopeLocks().acquireInOrder(memberScopes.toArray(String[]::new))) {
            List<SectionGraph> sections = new ArrayList<>(memberScopes.size());
            for (String scope : memberScopes) {
                List<Node> nodes = storage.getNodesByScope(scope).join();
                List<Edge> edges = storage.getEdgesByScope(scope).join();
                if (nodes.isEmpty()) {
                    logger.warn("Section scope {} has no stored nodes", scope);
                }
                sections.add(new SectionGraph(scope, new KnowledgeGraph(nodes, edges, "")));
            }
            return sections;
        }
    }

    /**
     * Pure merge of section graphs into the book scope. Sections are processed
     * in scope order, nodes and edges in id order.
     */
    @NotNull
    public KnowledgeGraph mergeGraphs(@NotNull List<SectionGraph> sections, @NotNull BookContext book) {
        String bookScope = book.scope();
        List<SectionGraph> ordered = sections.stream()
            .sorted(Comparator.comparing(SectionGraph::scope))
            .toList();

        Map<String, NodeGroup> nodeGroups = new LinkedHashMap<>();
        Map<String, String> bookIdBySectionNodeId = new HashMap<>();
        for (SectionGraph section : ordered) {
            section.graph().nodes().stream()
                .sorted(Comparator.comparing(Node::requireId))
                .forEach(node -> {
                    String canonical = IdentityUtil.canonicalize(node.getName());
                    String bookNodeId = idempotentProcessor.nodeId(canonical, node.getType(), bookScope);
                    bookIdBySectionNodeId.put(node.requireId(), bookNodeId);
                    nodeGroups.computeIfAbsent(bookNodeId, NodeGroup::new).add(node, canonical);
                });
        }

        Map<String, EdgeGroup> edgeGroups = new LinkedHashMap<>();
        int unmapped = 0;
        for (SectionGraph section : ordered) {
            List<Edge> edges = section.graph().edges().stream()
                .sorted(Comparator.comparing(Edge::getRid, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
            for (Edge edge : edges) {
                String source = bookIdBySectionNodeId.get(edge.getSourceId());
                String target = bookIdBySectionNodeId.get(edge.getTargetId());
                if (source == null || target == null) {
                    unmapped++;
                    continue;
                }
                String key = source + "|" + target + "|" + edge.getType().name();
                edgeGroups.computeIfAbsent(key, k -> new EdgeGroup(source, target, edge.getType()))
                    .add(edge, section.scope());
            }
        }
        if (unmapped > 0) {
            logger.warn("Skipped {} section edges whose endpoints are not stored nodes", unmapped);
        }

        List<Node> nodes = nodeGroups.values().stream().map(group -> group.toNode(bookScope)).toList();
        List<Edge> edges = edgeGroups.values().stream().map(group -> group.toEdge(bookScope)).toList();
        return new KnowledgeGraph(nodes, edges, hierarchy(book, chapters(nodes)));
    }

    private static List<String> chapters(List<Node> nodes) {
        Set<String> chapters = new TreeSet<>();
        for (Node node : nodes) {
            if (node.getChapter() != null && !node.getChapter().isBlank()) {
                chapters.add(node.getChapter());
            }
        }
        return List.copyOf(chapters);
    }

    private static String hierarchy(BookContext book, List<String> chapters) {
        if (chapters.isEmpty()) {
            return "";
        }
        return "Book: " + book.topic() + " (ID: " + book.bookId() + ")\n"
            + "Chapters: " + String.join(", ", chapters) + "\n"
            + "Total Chapters: " + chapters.size();
    }

    /**
     * A stored section graph with its scope.
     */
    public record SectionGraph(@NotNull String scope, @NotNull KnowledgeGraph graph) {}

    private static final class NodeGroup {
        private final String id;
        private Node first;
        private String name;
        private String description = "";
        private final Set<String> aliases = new LinkedHashSet<>();
        private double score = Double.NEGATIVE_INFINITY;
        private Instant createdAt;
        private Instant updatedAt;

        NodeGroup(String id) {
            this.id = id;
        }

        void add(Node node, String canonicalName) {
            if (first == null) {
                first = node;
                name = canonicalName;
            } else if (!canonicalName.equals(name)) {
                aliases.add(canonicalName);
            }
            if (node.getDescription().length() > description.length()) {
                description = node.getDescription();
            }
            aliases.addAll(node.getAliases());
            score = Math.max(score, node.getScore());
            createdAt = earliest(createdAt, node.getCreatedAt());
            updatedAt = latest(updatedAt, node.getUpdatedAt());
        }

        Node toNode(String scope) {
            return first.toBuilder()
                .id(id)
                .name(name)
                .description(description)
                .aliases(GraphNormalizer.normalizeAliases(new ArrayList<>(aliases), name))
                .score(score)
                .scope(scope)
                .subchapter(null)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .build();
        }
    }

    private static final class EdgeGroup {
        private final String source;
        private final String target;
        private final RelationType type;
        private String typeLabel;
        private String srcSection;
        private double weightSum;
        private int count;
        private double confidence;
        private final Set<String> descriptions = new LinkedHashSet<>();
        private final Set<String> evidence = new LinkedHashSet<>();
        private Instant createdAt;
        private Instant updatedAt;

        EdgeGroup(String source, String target, RelationType type) {
            this.source = source;
            this.target = target;
            this.type = type;
        }

        void add(Edge edge, String sectionScope) {
            count++;
            weightSum += edge.getWeight();
            confidence = Math.max(confidence, edge.getConfidence());
            typeLabel = typeLabel != null ? typeLabel : edge.getTypeLabel();
            srcSection = srcSection != null ? srcSection : edge.getSrcSection();
            if (!edge.getDescription().isBlank()) {
                descriptions.add(edge.getDescription());
            }
            String origin = edge.getSrcSection() != null ? edge.getSrcSection() : Scopes.idOf(sectionScope);
            if (edge.getEvidence() != null) {
                for (String fragment : edge.getEvidence().split(";")) {
                    if (!fragment.isBlank()) {
                        evidence.add(origin + ": " + fragment.trim());
                    }
                }
            } else {
                evidence.add(origin + ": " + edge.getDescription());
            }
            createdAt = earliest(createdAt, edge.getCreatedAt());
            updatedAt = latest(updatedAt, edge.getUpdatedAt());
        }

        Edge toEdge(String scope) {
            return Edge.builder()
                .rid(IdentityUtil.relationId(type.name(), source, target, scope))
                .type(type)
                .typeLabel(typeLabel)
                .sourceId(source)
                .targetId(target)
                .description(String.join(SEPARATOR, descriptions))
                .evidence(String.join(SEPARATOR, evidence))
                .confidence(confidence)
                .weight(weightSum / count)
                .scope(scope)
                .srcSection(srcSection)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .build();
        }
    }

    @Nullable
    private static Instant earliest(@Nullable Instant a, @Nullable Instant b) {
        if (a == null) {
            return b;
        }
        return b == null || a.isBefore(b) ? a : b;
    }

    @Nullable
    private static Instant latest(@Nullable Instant a, @Nullable Instant b) {
        if (a == null) {
            return b;
        }
        return b == null || a.isAfter(b) ? a : b;
    }
}
