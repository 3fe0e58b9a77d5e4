package br.edu.ifba.kgrag.pipeline;

import br.edu.ifba.kgrag.core.Edge;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ThresholdFilterTest {

    private ThresholdFilter filter;

    @BeforeEach
    void setUp() {
        filter = new ThresholdFilter();
    }

    private static Edge edge(double confidence, String evidence) {
        return Edge.builder().sourceName("a").targetName("b").confidence(confidence).evidence(evidence).build();
    }

    @Test
    @DisplayName("an edge between the two gates is stored but not displayed")
    void testBetweenGates() {
        Edge edge = edge(0.56, "first; second");
        assertTrue(filter.passesStorage(edge));
        assertFalse(filter.passesDisplay(edge));
    }

    @Test
    @DisplayName("display needs enough evidence fragments")
    void testEvidenceRequirement() {
        assertFalse(filter.passesDisplay(edge(0.9, "only one")));
        assertTrue(filter.passesDisplay(edge(0.9, "one; two")));
    }

    @Test
    void testStorageGateDropsWeakEdges() {
        List<Edge> kept = filter.filterForStorage(List.of(edge(0.5, null), edge(0.55, null), edge(0.8, null)));
        assertEquals(2, kept.size());
    }

    @Test
    void testInvalidThresholdsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ThresholdFilter(1.2, 0.6, 2));
        assertThrows(IllegalArgumentException.class, () -> new ThresholdFilter(0.5, 0.6, 0));
    }
}
