package br.edu.ifba.kgrag.llm;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Functional interface for Large Language Model completion.
 *
 * <p>Calls are synchronous; callers run them on the worker pool. Failures
 * surface as {@link LlmCallException}, whose {@code retryable} flag tells the
 * orchestrator whether another attempt makes sense. An empty answer is not a
 * protocol error and is returned as an empty string.</p>
 */
@FunctionalInterface
public interface LLMFunction {

    /**
     * Generate a completion from the LLM.
     *
     * @param prompt       the user prompt
     * @param systemPrompt optional system prompt
     * @param maxTokens    completion budget
     * @return generated text, possibly empty
     * @throws LlmCallException when the call fails
     */
    @NotNull
    String generate(@NotNull String prompt, @Nullable String systemPrompt, int maxTokens);

    /**
     * Convenience method for prompts without a system prompt.
     */
    @NotNull
    default String generate(@NotNull String prompt, int maxTokens) {
        return generate(prompt, null, maxTokens);
    }
}
