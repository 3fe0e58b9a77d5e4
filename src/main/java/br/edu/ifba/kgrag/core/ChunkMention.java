package br.edu.ifba.kgrag.core;

import org.jetbrains.annotations.NotNull;

/**
 * {@code Chunk -MENTIONS-> Node}, weighted by how the node was recognised in
 * the chunk text.
 *
 * @param chunkId    mentioning chunk
 * @param docId      document owning the chunk
 * @param nodeId     mentioned node
 * @param confidence 1.0 for a name hit, lower for an alias hit
 */
public record ChunkMention(@NotNull String chunkId, @NotNull String docId, @NotNull String nodeId, double confidence) {
}
