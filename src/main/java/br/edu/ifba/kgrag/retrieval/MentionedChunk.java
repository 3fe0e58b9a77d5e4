package br.edu.ifba.kgrag.retrieval;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * A chunk reached through its entity mentions.
 *
 * @param chunkId    chunk id in the vector collection
 * @param docId      owning document
 * @param nodeIds    queried entities the chunk mentions, sorted
 * @param confidence strongest mention confidence
 */
public record MentionedChunk(@NotNull String chunkId, @NotNull String docId, @NotNull List<String> nodeIds,
                             double confidence) {

    public MentionedChunk {
        nodeIds = List.copyOf(nodeIds);
    }

    public int entityCount() {
        return nodeIds.size();
    }
}
