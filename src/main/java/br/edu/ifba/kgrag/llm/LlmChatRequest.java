package br.edu.ifba.kgrag.llm;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * OpenAI-compatible chat completion request.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LlmChatRequest(
    String model,
    List<ChatMessage> messages,
    Boolean stream,

    @JsonProperty("max_tokens")
    Integer maxTokens,

    Double temperature
) {

    public LlmChatRequest(final String model, final List<ChatMessage> messages,
                          final Integer maxTokens, final Double temperature) {
        this(model, messages, Boolean.FALSE, maxTokens, temperature);
    }
}
