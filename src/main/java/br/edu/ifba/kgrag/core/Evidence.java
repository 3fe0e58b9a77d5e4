package br.edu.ifba.kgrag.core;

import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A scored unit of retrieved content. Built per query, never persisted.
 *
 * @param id       {@code <prefix>_<hash>}
 * @param type     channel of origin
 * @param content  text handed to downstream prompting
 * @param score    final score
 * @param sources  channel names that produced this content ({@code vector}, {@code graph})
 * @param metadata channel-specific details
 */
public record Evidence(
    @NotNull String id,
    @NotNull EvidenceType type,
    @NotNull String content,
    double score,
    @NotNull List<String> sources,
    @NotNull Map<String, Object> metadata
) {

    public static final String SOURCE_VECTOR = "vector";
    public static final String SOURCE_GRAPH = "graph";

    public Evidence {
        content = content != null ? content : "";
        sources = sources != null ? List.copyOf(sources) : List.of();
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }

    public Evidence withScore(double newScore) {
        return new Evidence(id, type, content, newScore, sources, metadata);
    }

    public boolean isMultiSource() {
        return sources.size() > 1;
    }
}
