package br.edu.ifba.kgrag.utils;

import org.jetbrains.annotations.NotNull;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.List;

/**
 * Vector math and the little-endian float32 BLOB layout used by the SQLite
 * vector index.
 */
public final class VectorUtil {

    private VectorUtil() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Encodes a vector as little-endian float32 bytes.
     *
     * @param vector the vector
     * @return 4 bytes per component
     */
    @NotNull
    public static byte[] toBytes(@NotNull float[] vector) {
        ByteBuffer buffer = ByteBuffer.allocate(vector.length * Float.BYTES);
        buffer.order(ByteOrder.LITTLE_ENDIAN);
        for (float value : vector) {
            buffer.putFloat(value);
        }
        return buffer.array();
    }

    /**
     * Decodes bytes written by {@link #toBytes(float[])}.
     *
     * @param bytes stored bytes
     * @return the vector
     */
    @NotNull
    public static float[] fromBytes(@NotNull byte[] bytes) {
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        buffer.order(ByteOrder.LITTLE_ENDIAN);
        float[] vector = new float[bytes.length / Float.BYTES];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = buffer.getFloat();
        }
        return vector;
    }

    /**
     * Converts a JSON-style list of numbers to a float array.
     */
    @NotNull
    public static float[] toFloatArray(@NotNull List<? extends Number> values) {
        float[] result = new float[values.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = values.get(i).floatValue();
        }
        return result;
    }

    /**
     * Cosine similarity in [-1, 1]; 0 when either vector has zero magnitude.
     */
    public static double cosineSimilarity(@NotNull float[] a, @NotNull float[] b) {
        requireSameDimension(a, b);

        double dotProduct = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dotProduct += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }

        double magnitude = Math.sqrt(normA) * Math.sqrt(normB);
        if (magnitude == 0) {
            return 0.0;
        }
        return dotProduct / magnitude;
    }

    /**
     * Plain dot product.
     */
    public static double dotProduct(@NotNull float[] a, @NotNull float[] b) {
        requireSameDimension(a, b);
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    /**
     * Euclidean distance.
     */
    public static double euclideanDistance(@NotNull float[] a, @NotNull float[] b) {
        requireSameDimension(a, b);
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            double diff = a[i] - b[i];
            sum += diff * diff;
        }
        return Math.sqrt(sum);
    }

    private static void requireSameDimension(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException(
                "Vectors must have same dimensions: " + a.length + " vs " + b.length
            );
        }
    }
}
