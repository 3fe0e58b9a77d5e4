package br.edu.ifba.kgrag.storage;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.Objects;

/**
 * Payload filter for vector search. All present conditions must hold.
 *
 * @param docId    document id, or null for any
 * @param scope    scope tag, or null for any
 * @param metadata metadata entries that must be equal, compared as strings
 */
public record VectorFilter(
    @Nullable String docId,
    @Nullable String scope,
    @NotNull Map<String, String> metadata
) {

    public VectorFilter {
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public static VectorFilter none() {
        return new VectorFilter(null, null, Map.of());
    }

    public static VectorFilter byDocument(@NotNull String docId) {
        return new VectorFilter(docId, null, Map.of());
    }

    public static VectorFilter byScope(@NotNull String scope) {
        return new VectorFilter(null, scope, Map.of());
    }

    public boolean isEmpty() {
        return docId == null && scope == null && metadata.isEmpty();
    }

    /**
     * Checks a stored point against this filter.
     */
    public boolean matches(@Nullable String pointDocId, @Nullable String pointScope,
                           @NotNull Map<String, Object> pointMetadata) {
        if (docId != null && !docId.equals(pointDocId)) {
            return false;
        }
        if (scope != null && !scope.equals(pointScope)) {
            return false;
        }
        for (Map.Entry<String, String> condition : metadata.entrySet()) {
            Object value = pointMetadata.get(condition.getKey());
            if (value == null || !Objects.equals(condition.getValue(), String.valueOf(value))) {
                return false;
            }
        }
        return true;
    }
}
