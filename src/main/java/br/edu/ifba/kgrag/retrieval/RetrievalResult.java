package br.edu.ifba.kgrag.retrieval;

import br.edu.ifba.kgrag.core.Evidence;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ranked evidence for one query plus a note of which channels contributed.
 *
 * @param query      the query
 * @param scope      scope filter used, may be null
 * @param evidence   ranked evidence, possibly empty
 * @param vectorHits hits returned by the vector channel
 * @param graphHits  hits returned by the graph channel
 * @param errors     channel name to failure message for channels that failed
 * @param elapsedMs  wall time of the retrieval
 */
public record RetrievalResult(
    @NotNull String query,
    @Nullable String scope,
    @NotNull List<Evidence> evidence,
    int vectorHits,
    int graphHits,
    @NotNull Map<String, String> errors,
    long elapsedMs
) {

    public RetrievalResult {
        evidence = List.copyOf(evidence);
        errors = errors != null ? Collections.unmodifiableMap(new LinkedHashMap<>(errors)) : Map.of();
    }

    public static RetrievalResult empty(@NotNull String query, @Nullable String scope) {
        return new RetrievalResult(query, scope, List.of(), 0, 0, Map.of(), 0L);
    }

    /**
     * Channels that returned at least one hit.
     */
    public List<String> contributingChannels() {
        List<String> channels = new ArrayList<>(2);
        if (vectorHits > 0) {
            channels.add(Evidence.SOURCE_VECTOR);
        }
        if (graphHits > 0) {
            channels.add(Evidence.SOURCE_GRAPH);
        }
        return channels;
    }

    public boolean isDegraded() {
        return !errors.isEmpty();
    }
}
