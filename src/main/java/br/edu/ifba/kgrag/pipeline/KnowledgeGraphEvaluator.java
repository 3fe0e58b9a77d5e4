package br.edu.ifba.kgrag.pipeline;

import br.edu.ifba.kgrag.core.Edge;
import br.edu.ifba.kgrag.core.KnowledgeGraph;
import br.edu.ifba.kgrag.core.Node;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Structural and coverage figures for a graph.
 */
public class KnowledgeGraphEvaluator {

    @NotNull
    public SectionInsights evaluate(@NotNull KnowledgeGraph graph, @NotNull Collection<String> expectedSubchapters,
                                    @NotNull Collection<String> keywords) {
        List<Node> nodes = graph.nodes();
        List<Edge> edges = graph.edges();

        List<Integer> componentSizes = componentSizes(nodes, edges);
        int maxComponent = componentSizes.stream().mapToInt(Integer::intValue).max().orElse(0);
        double connectivity = nodes.isEmpty() ? 0.0 : (double) maxComponent / nodes.size();

        Map<String, Integer> relationTypes = new TreeMap<>();
        for (Edge edge : edges) {
            relationTypes.merge(edge.getType().name(), 1, Integer::sum);
        }
        double richness = nodes.isEmpty() ? 0.0 : Math.min(1.0, (double) edges.size() / nodes.size());

        Set<String> expected = new HashSet<>();
        for (String subchapter : expectedSubchapters) {
            if (subchapter != null && !subchapter.isBlank()) {
                expected.add(subchapter);
            }
        }
        Set<String> covered = new HashSet<>();
        for (Node node : nodes) {
            if (node.getSubchapter() != null && expected.contains(node.getSubchapter())) {
                covered.add(node.getSubchapter());
            }
        }
        double subchapterCoverage = expected.isEmpty() ? 1.0 : (double) covered.size() / expected.size();

        List<String> coveredKeywords = new ArrayList<>();
        Set<String> distinctKeywords = new LinkedHashSet<>();
        for (String keyword : keywords) {
            if (keyword != null && !keyword.isBlank()) {
                distinctKeywords.add(keyword.trim());
            }
        }
        for (String keyword : distinctKeywords) {
            if (mentioned(keyword.toLowerCase(Locale.ROOT), nodes)) {
                coveredKeywords.add(keyword);
            }
        }
        double keywordCoverage = distinctKeywords.isEmpty() ? 1.0
            : (double) coveredKeywords.size() / distinctKeywords.size();

        double coverage = 0.4 * subchapterCoverage + 0.3 * keywordCoverage + 0.2 * connectivity + 0.1 * richness;
        String summary = String.format(Locale.ROOT,
            "%d nodes, %d edges, connectivity %.2f, coverage %.2f",
            nodes.size(), edges.size(), connectivity, coverage);

        return new SectionInsights(connectivity, componentSizes.size(), maxComponent, relationTypes, richness,
            subchapterCoverage, keywordCoverage, coverage, coveredKeywords, summary);
    }

    private static boolean mentioned(String keyword, List<Node> nodes) {
        for (Node node : nodes) {
            if (node.getName().toLowerCase(Locale.ROOT).contains(keyword)
                    || node.getDescription().toLowerCase(Locale.ROOT).contains(keyword)) {
                return true;
            }
            for (String alias : node.getAliases()) {
                if (alias.toLowerCase(Locale.ROOT).contains(keyword)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static List<Integer> componentSizes(List<Node> nodes, List<Edge> edges) {
        Map<String, List<String>> adjacency = new LinkedHashMap<>();
        for (Node node : nodes) {
            if (node.getId() != null) {
                adjacency.putIfAbsent(node.getId(), new ArrayList<>());
            }
        }
        for (Edge edge : edges) {
            List<String> fromSource = adjacency.get(edge.getSourceId());
            List<String> fromTarget = adjacency.get(edge.getTargetId());
            if (fromSource != null && fromTarget != null) {
                fromSource.add(edge.getTargetId());
                fromTarget.add(edge.getSourceId());
            }
        }

        Set<String> visited = new HashSet<>();
        List<Integer> sizes = new ArrayList<>();
        for (String start : adjacency.keySet()) {
            if (visited.contains(start)) {
                continue;
            }
            int size = 0;
            Deque<String> stack = new ArrayDeque<>();
            stack.push(start);
            visited.add(start);
            while (!stack.isEmpty()) {
                String current = stack.pop();
                size++;
                for (String next : adjacency.get(current)) {
                    if (visited.add(next)) {
                        stack.push(next);
                    }
                }
            }
            sizes.add(size);
        }
        return sizes;
    }
}
