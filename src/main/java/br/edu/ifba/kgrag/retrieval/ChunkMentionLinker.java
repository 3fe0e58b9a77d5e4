package br.edu.ifba.kgrag.retrieval;

import br.edu.ifba.kgrag.core.Chunk;
import br.edu.ifba.kgrag.core.ChunkMention;
import br.edu.ifba.kgrag.core.Node;
import br.edu.ifba.kgrag.storage.GraphStorage;
import br.edu.ifba.kgrag.storage.MatchRank;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Links indexed chunks to the graph nodes they name.
 *
 * <p>A chunk mentions a node when the node's name (confidence 1.0) or one of
 * its aliases (0.9) occurs in the chunk text, case-insensitively and on word
 * boundaries for alphabetic terms. When the chunk metadata carries a
 * {@code scope}, every node of that scope is checked; otherwise candidates
 * come from {@link GraphStorage#findCandidates}, which only finds names.</p>
 */
public class ChunkMentionLinker {

    private static final Logger logger = LoggerFactory.getLogger(ChunkMentionLinker.class);

    static final int MAX_CANDIDATES_PER_CHUNK = 200;
    static final int MIN_TERM_LENGTH = 2;

    private final GraphStorage graphStorage;

    public ChunkMentionLinker(@NotNull GraphStorage graphStorage) {
        this.graphStorage = graphStorage;
    }

    /**
     * Replaces the mention links of a document with those found in its chunks.
     *
     * @return number of links written
     */
    public int link(@NotNull String docId, @NotNull List<Chunk> chunks) {
        Map<String, List<Node>> nodesByScope = new HashMap<>();
        List<ChunkMention> mentions = new ArrayList<>();
        for (Chunk chunk : chunks) {
            String scope = scopeOf(chunk);
            List<Node> candidates = scope != null
                ? nodesByScope.computeIfAbsent(scope, key -> join(graphStorage.getNodesByScope(key)))
                : join(graphStorage.findCandidates(chunk.text(), null, null, MAX_CANDIDATES_PER_CHUNK));
            mentions.addAll(mentionsIn(chunk, candidates));
        }
        int written = join(graphStorage.replaceMentions(docId, mentions));
        logger.info("Linked {} node mentions across {} chunks of document {}", written, chunks.size(), docId);
        return written;
    }

    @NotNull
    static List<ChunkMention> mentionsIn(@NotNull Chunk chunk, @NotNull List<Node> candidates) {
        String text = chunk.text().toLowerCase(Locale.ROOT);
        List<ChunkMention> found = new ArrayList<>();
        for (Node node : candidates) {
            double confidence = confidence(node, text);
            if (confidence > 0 && node.getId() != null) {
                found.add(new ChunkMention(chunk.chunkId(), chunk.docId(), node.getId(), confidence));
            }
        }
        return found;
    }

    /**
     * @return 1.0 for a name hit, 0.9 for an alias hit, 0 when the node is not named
     */
    static double confidence(@NotNull Node node, @NotNull String loweredText) {
        if (occurs(node.getName(), loweredText)) {
            return MatchRank.EXACT_NAME;
        }
        for (String alias : node.getAliases()) {
            if (occurs(alias, loweredText)) {
                return MatchRank.EXACT_ALIAS;
            }
        }
        return 0;
    }

    static boolean occurs(@NotNull String term, @NotNull String loweredText) {
        String needle = term.trim().toLowerCase(Locale.ROOT);
        if (needle.length() < MIN_TERM_LENGTH) {
            return false;
        }
        int at = loweredText.indexOf(needle);
        while (at >= 0) {
            int end = at + needle.length();
            if (bounded(loweredText, at - 1, needle.charAt(0))
                    && bounded(loweredText, end, needle.charAt(needle.length() - 1))) {
                return true;
            }
            at = loweredText.indexOf(needle, at + 1);
        }
        return false;
    }

    // Ideographic term edges match without a separator
    private static boolean bounded(String text, int index, char edge) {
        if (!isWordChar(edge) || index < 0 || index >= text.length()) {
            return true;
        }
        return !isWordChar(text.charAt(index));
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) && !Character.isIdeographic(c);
    }

    @Nullable
    private static String scopeOf(Chunk chunk) {
        Object scope = chunk.metadata().get(VectorIndexService.SCOPE_KEY);
        return scope instanceof String value && !value.isBlank() ? value : null;
    }

    private static <T> T join(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }
}
