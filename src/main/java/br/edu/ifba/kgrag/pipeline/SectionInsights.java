package br.edu.ifba.kgrag.pipeline;

import java.util.List;
import java.util.Map;

/**
 * Quality figures for a section graph.
 *
 * @param connectivityScore   largest connected component over node count
 * @param components          number of connected components
 * @param maxComponentSize    nodes in the largest component
 * @param relationTypes       edge count per relation type
 * @param relationRichness    {@code min(1, edges / nodes)}
 * @param subchapterCoverage  share of expected subchapters that have nodes
 * @param keywordCoverage     share of keywords found in node names, descriptions or aliases
 * @param coverageScore       {@code 0.4*sub + 0.3*kw + 0.2*connectivity + 0.1*richness}
 * @param coveredKeywords     keywords that were found
 * @param summary             one-line human-readable digest
 */
public record SectionInsights(
    double connectivityScore,
    int components,
    int maxComponentSize,
    Map<String, Integer> relationTypes,
    double relationRichness,
    double subchapterCoverage,
    double keywordCoverage,
    double coverageScore,
    List<String> coveredKeywords,
    String summary
) {

    public SectionInsights {
        relationTypes = relationTypes != null ? Map.copyOf(relationTypes) : Map.of();
        coveredKeywords = coveredKeywords != null ? List.copyOf(coveredKeywords) : List.of();
    }
}
