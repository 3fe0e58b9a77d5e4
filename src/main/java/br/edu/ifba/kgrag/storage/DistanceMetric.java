package br.edu.ifba.kgrag.storage;

import br.edu.ifba.kgrag.utils.VectorUtil;
import org.jetbrains.annotations.NotNull;

import java.util.Locale;

/**
 * Distance metric of a vector collection, fixed at creation. Every metric is
 * turned into a similarity where higher is better.
 */
public enum DistanceMetric {

    COSINE {
        @Override
        public double similarity(float[] a, float[] b) {
            return VectorUtil.cosineSimilarity(a, b);
        }
    },
    DOT {
        @Override
        public double similarity(float[] a, float[] b) {
            return VectorUtil.dotProduct(a, b);
        }
    },
    EUCLID {
        @Override
        public double similarity(float[] a, float[] b) {
            return 1.0 / (1.0 + VectorUtil.euclideanDistance(a, b));
        }
    };

    public abstract double similarity(float[] a, float[] b);

    /**
     * Parses a configured metric name, case-insensitively.
     */
    @NotNull
    public static DistanceMetric parse(@NotNull String name) {
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        if ("EUCLIDEAN".equals(normalized)) {
            return EUCLID;
        }
        return valueOf(normalized);
    }
}
