package br.edu.ifba.kgrag.embedding;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record EmbeddingResponse(
    String model,
    List<Embedding> data
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Embedding(
        List<Double> embedding,
        Integer index
    ) {}
}
