package br.edu.ifba.kgrag.pipeline;

import br.edu.ifba.kgrag.core.Edge;
import br.edu.ifba.kgrag.core.KnowledgeGraph;
import br.edu.ifba.kgrag.core.Node;
import br.edu.ifba.kgrag.storage.GraphStorage;
import br.edu.ifba.kgrag.utils.ScopeLocks;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Re-indexes one scope: delete its edges, upsert the new node and edge set,
 * then drop the scope's nodes that the new set no longer contains. All of it
 * runs under the scope lock.
 *
 * <p>Node ids embed the scope, so a scope's nodes belong to it alone and the
 * stored view of a scope always matches its latest rewrite.
 * A failing node or edge write is counted and the batch continues. When the
 * store is unavailable (the scope delete fails, or every write failed
 * transiently) the failure is rethrown so the caller can retry the unit.</p>
 */
public class ScopedGraphWriter {

    private static final Logger logger = LoggerFactory.getLogger(ScopedGraphWriter.class);

    private final GraphStorage storage;
    private final Predicate<Throwable> transientFailure;
    private final boolean pruneOrphans;
    private final ScopeLocks scopeLocks;

    public ScopedGraphWriter(@NotNull GraphStorage storage, @NotNull Predicate<Throwable> transientFailure,
                             boolean pruneOrphans, @NotNull ScopeLocks scopeLocks) {
        this.storage = storage;
        this.transientFailure = transientFailure;
        this.pruneOrphans = pruneOrphans;
        this.scopeLocks = scopeLocks;
    }

    @NotNull
    public StoreStats rewriteScope(@NotNull String scope, @NotNull KnowledgeGraph graph) {
        return scopeLocks.withScopeLock(scope, () -> rewriteLocked(scope, graph));
    }

    @NotNull
    public ScopeLocks getScopeLocks() {
        return scopeLocks;
    }

    private StoreStats rewriteLocked(String scope, KnowledgeGraph graph) {
        int edgesDeleted;
        try {
            edgesDeleted = storage.deleteByScope(scope).join();
        } catch (CompletionException e) {
            Throwable cause = unwrap(e);
            if (transientFailure.test(cause)) {
                throw e;
            }
            logger.error("Could not clear scope {}: {}", scope, cause.getMessage());
            return StoreStats.failed(scope, cause.getMessage());
        }

        int nodesWritten = 0;
        int edgesWritten = 0;
        int errors = 0;
        String firstError = null;
        CompletionException lastTransient = null;

        for (Node node : graph.nodes()) {
            try {
                if (Boolean.TRUE.equals(storage.upsertNode(node).join())) {
                    nodesWritten++;
                }
            } catch (CompletionException e) {
                errors++;
                Throwable cause = unwrap(e);
                firstError = firstError != null ? firstError : cause.getMessage();
                lastTransient = transientFailure.test(cause) ? e : lastTransient;
                logger.warn("Failed to write node {} in scope {}: {}", node.getId(), scope, cause.getMessage());
            }
        }

        for (Edge edge : graph.edges()) {
            try {
                if (Boolean.TRUE.equals(storage.upsertEdge(edge).join())) {
                    edgesWritten++;
                }
            } catch (CompletionException e) {
                errors++;
                Throwable cause = unwrap(e);
                firstError = firstError != null ? firstError : cause.getMessage();
                lastTransient = transientFailure.test(cause) ? e : lastTransient;
                logger.warn("Failed to write edge {} in scope {}: {}", edge.getRid(), scope, cause.getMessage());
            }
        }

        if (lastTransient != null && nodesWritten == 0 && edgesWritten == 0) {
            throw lastTransient;
        }

        Set<String> keepIds = graph.nodes().stream()
            .map(Node::getId)
            .filter(Objects::nonNull)
            .collect(Collectors.toSet());
        int nodesRemoved = storage.retainNodes(scope, keepIds).join();

        int nodesPruned = 0;
        if (pruneOrphans) {
            nodesPruned = storage.pruneOrphans(scope).join();
        }

        logger.info("Stored scope {}: {} nodes, {} edges, {} old edges deleted, {} stale nodes removed, {} errors",
            scope, nodesWritten, edgesWritten, edgesDeleted, nodesRemoved, errors);
        return new StoreStats(scope, true, nodesWritten, edgesWritten, edgesDeleted, nodesRemoved, nodesPruned,
            errors, firstError);
    }

    static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
