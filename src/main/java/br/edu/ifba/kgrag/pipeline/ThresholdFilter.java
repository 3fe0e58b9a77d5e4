package br.edu.ifba.kgrag.pipeline;

import br.edu.ifba.kgrag.core.Edge;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Confidence gates for edges.
 *
 * <p>The storage gate is permissive so weak signal can be corroborated later;
 * the display gate also requires {@code minEvidenceCount} evidence fragments.</p>
 */
public class ThresholdFilter {

    public static final double DEFAULT_THETA_ADD = 0.55;
    public static final double DEFAULT_THETA_SHOW = 0.60;
    public static final int DEFAULT_MIN_EVIDENCE_COUNT = 2;

    private final double thetaAdd;
    private final double thetaShow;
    private final int minEvidenceCount;

    public ThresholdFilter() {
        this(DEFAULT_THETA_ADD, DEFAULT_THETA_SHOW, DEFAULT_MIN_EVIDENCE_COUNT);
    }

    public ThresholdFilter(double thetaAdd, double thetaShow, int minEvidenceCount) {
        if (thetaAdd < 0.0 || thetaAdd > 1.0 || thetaShow < 0.0 || thetaShow > 1.0) {
            throw new IllegalArgumentException(String.format(
                "Thresholds must be in [0,1], got theta-add=%.2f, theta-show=%.2f", thetaAdd, thetaShow));
        }
        if (minEvidenceCount < 1) {
            throw new IllegalArgumentException("minEvidenceCount must be >= 1, got " + minEvidenceCount);
        }
        this.thetaAdd = thetaAdd;
        this.thetaShow = thetaShow;
        this.minEvidenceCount = minEvidenceCount;
    }

    @NotNull
    public List<Edge> filterForStorage(@NotNull List<Edge> edges) {
        return edges.stream().filter(this::passesStorage).toList();
    }

    @NotNull
    public List<Edge> filterForDisplay(@NotNull List<Edge> edges) {
        return edges.stream().filter(this::passesDisplay).toList();
    }

    public boolean passesStorage(@NotNull Edge edge) {
        return edge.getConfidence() >= thetaAdd;
    }

    public boolean passesDisplay(@NotNull Edge edge) {
        return edge.getConfidence() >= thetaShow && edge.evidenceCount() >= minEvidenceCount;
    }

    public double getThetaAdd() {
        return thetaAdd;
    }

    public double getThetaShow() {
        return thetaShow;
    }

    public int getMinEvidenceCount() {
        return minEvidenceCount;
    }
}
