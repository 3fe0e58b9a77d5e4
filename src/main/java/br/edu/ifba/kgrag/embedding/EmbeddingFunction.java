package br.edu.ifba.kgrag.embedding;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Text-to-vector embedding with a fixed dimension per configured model.
 */
public interface EmbeddingFunction {

    /**
     * Generate embeddings for a batch of texts.
     *
     * @param texts texts to embed
     * @return one vector per input text, in input order
     */
    CompletableFuture<List<float[]>> embed(@NotNull List<String> texts);

    /**
     * Dimension every returned vector has.
     */
    int dimension();

    /**
     * Convenience method for embedding a single text.
     */
    default CompletableFuture<float[]> embedSingle(@NotNull String text) {
        return embed(List.of(text)).thenApply(embeddings -> embeddings.get(0));
    }
}
