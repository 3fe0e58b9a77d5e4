package br.edu.ifba.kgrag.retrieval;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of indexing a set of chunks.
 *
 * @param indexed  chunks written to the vector collection
 * @param failed   chunks whose embedding batch failed
 * @param errors   one message per failed batch or step
 * @param mentions chunk to node mention links recorded
 */
public record IndexStats(int indexed, int failed, @NotNull List<String> errors, int mentions) {

    public IndexStats {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public IndexStats(int indexed, int failed, @NotNull List<String> errors) {
        this(indexed, failed, errors, 0);
    }

    public static IndexStats empty() {
        return new IndexStats(0, 0, List.of());
    }

    public IndexStats withMentions(int linked) {
        return new IndexStats(indexed, failed, errors, linked);
    }

    public IndexStats withError(@NotNull String error) {
        List<String> all = new ArrayList<>(errors);
        all.add(error);
        return new IndexStats(indexed, failed, all, mentions);
    }

    public int total() {
        return indexed + failed;
    }

    public boolean isComplete() {
        return failed == 0;
    }
}
