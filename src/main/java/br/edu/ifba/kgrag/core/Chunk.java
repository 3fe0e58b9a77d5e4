package br.edu.ifba.kgrag.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A slice of a document indexed in the vector store.
 *
 * @param chunkId   {@code <docId>_chunk_<index>_<hash>}
 * @param docId     owning document
 * @param text      chunk text
 * @param startChar inclusive offset into the document
 * @param endChar   exclusive offset into the document
 * @param vectorId  id of the stored vector, null before indexing
 * @param metadata  chunk metadata merged with document metadata
 */
public record Chunk(
    @NotNull String chunkId,
    @NotNull String docId,
    @NotNull String text,
    int startChar,
    int endChar,
    @Nullable String vectorId,
    @NotNull Map<String, Object> metadata
) {

    public Chunk {
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }

    public Chunk withVectorId(@NotNull String newVectorId) {
        return new Chunk(chunkId, docId, text, startChar, endChar, newVectorId, metadata);
    }
}
