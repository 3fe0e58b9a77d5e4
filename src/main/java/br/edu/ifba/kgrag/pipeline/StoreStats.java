package br.edu.ifba.kgrag.pipeline;

import org.jetbrains.annotations.Nullable;

/**
 * Outcome of writing one scope.
 *
 * @param scope        scope that was rewritten
 * @param success      false when the rewrite could not run at all
 * @param nodesWritten nodes upserted
 * @param edgesWritten edges upserted
 * @param edgesDeleted edges removed by the scope delete
 * @param nodesRemoved nodes of the scope missing from the new node set
 * @param nodesPruned  orphan nodes removed, 0 when pruning is off
 * @param errors       individual node or edge writes that failed
 * @param error        first failure message, null when clean
 */
public record StoreStats(
    String scope,
    boolean success,
    int nodesWritten,
    int edgesWritten,
    int edgesDeleted,
    int nodesRemoved,
    int nodesPruned,
    int errors,
    @Nullable String error
) {

    public static StoreStats failed(String scope, String error) {
        return new StoreStats(scope, false, 0, 0, 0, 0, 0, 1, error);
    }

    public static StoreStats empty(String scope) {
        return new StoreStats(scope, true, 0, 0, 0, 0, 0, 0, null);
    }
}
