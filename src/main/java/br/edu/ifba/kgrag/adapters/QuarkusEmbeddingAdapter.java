package br.edu.ifba.kgrag.adapters;

import br.edu.ifba.kgrag.embedding.EmbeddingFunction;
import br.edu.ifba.kgrag.embedding.EmbeddingRequest;
import br.edu.ifba.kgrag.embedding.EmbeddingResponse;
import br.edu.ifba.kgrag.embedding.LlmEmbeddingClient;
import br.edu.ifba.kgrag.llm.LlmCallException;
import br.edu.ifba.kgrag.storage.VectorDimensionMismatchException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.WebApplicationException;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Adapter that bridges the Quarkus {@link LlmEmbeddingClient} to {@link EmbeddingFunction}.
 *
 * <p>Every returned vector must have the configured dimension. A model that
 * answers with another dimension fails with
 * {@link VectorDimensionMismatchException}; vectors are never truncated.</p>
 */
@ApplicationScoped
public class QuarkusEmbeddingAdapter implements EmbeddingFunction {

    private static final Logger LOG = Logger.getLogger(QuarkusEmbeddingAdapter.class);

    @Inject
    @RestClient
    LlmEmbeddingClient embeddingClient;

    @ConfigProperty(name = "embedding.model")
    String embeddingModel;

    @ConfigProperty(name = "kgrag.retrieval.vector.dimension", defaultValue = "768")
    Integer vectorDimension;

    @Override
    public CompletableFuture<List<float[]>> embed(@NotNull final List<String> texts) {
        if (texts.isEmpty()) {
            LOG.debug("Empty text list provided for embedding");
            return CompletableFuture.completedFuture(List.of());
        }
        LOG.debugf("Embedding request - texts: %d, model: %s", Integer.valueOf(texts.size()), embeddingModel);

        try {
            final EmbeddingResponse response = embeddingClient.embed(new EmbeddingRequest(embeddingModel, texts));
            return CompletableFuture.completedFuture(toVectors(response, texts.size(), vectorDimension));
        } catch (LlmCallException | VectorDimensionMismatchException e) {
            return CompletableFuture.failedFuture(e);
        } catch (WebApplicationException e) {
            return CompletableFuture.failedFuture(LlmCallException.forStatus(e.getResponse().getStatus(),
                    "Embedding call failed: " + e.getMessage()));
        } catch (ProcessingException e) {
            LOG.warnf("Embedding transport failure: %s", e.getMessage());
            return CompletableFuture.failedFuture(
                    new LlmCallException("Embedding transport failure: " + e.getMessage(), true, e));
        }
    }

    @Override
    public int dimension() {
        return vectorDimension;
    }

    /**
     * Converts the response to float vectors in input order.
     *
     * @throws LlmCallException when the response is empty or has the wrong number of vectors
     * @throws VectorDimensionMismatchException when a vector has another dimension
     */
    static List<float[]> toVectors(final EmbeddingResponse response, final int expectedCount, final int dimension) {
        if (response == null || response.data() == null || response.data().isEmpty()) {
            throw new LlmCallException("Embedding API returned no data", false);
        }
        if (response.data().size() != expectedCount) {
            throw new LlmCallException(String.format("Expected %d embeddings but received %d",
                    expectedCount, response.data().size()), false);
        }

        final List<EmbeddingResponse.Embedding> ordered = new ArrayList<>(response.data());
        if (ordered.stream().allMatch(data -> data.index() != null)) {
            ordered.sort(Comparator.comparing(EmbeddingResponse.Embedding::index));
        }

        final List<float[]> embeddings = new ArrayList<>(ordered.size());
        for (final EmbeddingResponse.Embedding data : ordered) {
            final List<Double> values = data.embedding();
            if (values == null || values.isEmpty()) {
                throw new LlmCallException("Embedding API returned null or empty vector", false);
            }
            if (values.size() != dimension) {
                throw new VectorDimensionMismatchException("embedding model", dimension, values.size());
            }
            final float[] vector = new float[dimension];
            for (int i = 0; i < dimension; i++) {
                vector[i] = values.get(i).floatValue();
            }
            embeddings.add(vector);
        }
        LOG.debugf("Generated %d embeddings with dimension %d",
                Integer.valueOf(embeddings.size()), Integer.valueOf(dimension));
        return embeddings;
    }
}
