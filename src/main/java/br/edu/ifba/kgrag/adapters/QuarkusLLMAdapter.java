package br.edu.ifba.kgrag.adapters;

import br.edu.ifba.kgrag.llm.ChatMessage;
import br.edu.ifba.kgrag.llm.LLMFunction;
import br.edu.ifba.kgrag.llm.LlmCallException;
import br.edu.ifba.kgrag.llm.LlmChatClient;
import br.edu.ifba.kgrag.llm.LlmChatRequest;
import br.edu.ifba.kgrag.llm.LlmChatResponse;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.WebApplicationException;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Adapter that bridges the Quarkus {@link LlmChatClient} to the {@link LLMFunction}
 * used by knowledge graph extraction.
 *
 * <p>Transport failures become retryable {@link LlmCallException}s; HTTP errors
 * arrive already mapped by the client's exception mapper.</p>
 */
@ApplicationScoped
public class QuarkusLLMAdapter implements LLMFunction {

    private static final Logger LOG = Logger.getLogger(QuarkusLLMAdapter.class);

    @Inject
    @RestClient
    LlmChatClient chatClient;

    @ConfigProperty(name = "chat.model")
    String defaultModel;

    @ConfigProperty(name = "chat.temperature", defaultValue = "0.2")
    Double defaultTemperature;

    @Override
    @NotNull
    public String generate(@NotNull final String prompt, @Nullable final String systemPrompt, final int maxTokens) {
        LOG.debugf("LLM request - prompt length: %d, system prompt: %s, max tokens: %d",
                Integer.valueOf(prompt.length()),
                systemPrompt != null ? "present" : "none",
                Integer.valueOf(maxTokens));

        final LlmChatRequest request = new LlmChatRequest(
                defaultModel,
                buildMessages(prompt, systemPrompt),
                maxTokens > 0 ? Integer.valueOf(maxTokens) : null,
                defaultTemperature);

        final LlmChatResponse response;
        try {
            response = chatClient.chat(request);
        } catch (LlmCallException e) {
            throw e;
        } catch (WebApplicationException e) {
            throw LlmCallException.forStatus(e.getResponse().getStatus(),
                    "LLM call failed: " + e.getMessage());
        } catch (ProcessingException e) {
            LOG.warnf("LLM transport failure: %s", e.getMessage());
            throw new LlmCallException("LLM transport failure: " + e.getMessage(), true, e);
        }

        final String content = extractContent(response);
        final String tokenInfo = response != null && response.usage() != null
                ? String.valueOf(response.usage().totalTokens()) : "unknown";
        LOG.debugf("LLM response received - length: %d characters, tokens: %s",
                Integer.valueOf(content.length()), tokenInfo);
        return content;
    }

    /**
     * Message order: [system], [user prompt].
     */
    static List<ChatMessage> buildMessages(@NotNull final String prompt, @Nullable final String systemPrompt) {
        final List<ChatMessage> messages = new ArrayList<>(2);
        if (systemPrompt != null && !systemPrompt.isEmpty()) {
            messages.add(ChatMessage.system(systemPrompt));
        }
        messages.add(ChatMessage.user(prompt));
        return messages;
    }

    /**
     * First choice's content, or an empty string when the answer has none.
     */
    @NotNull
    static String extractContent(@Nullable final LlmChatResponse response) {
        if (response == null || response.choices() == null || response.choices().isEmpty()) {
            return "";
        }
        final LlmChatResponse.Choice choice = response.choices().get(0);
        if (choice.message() == null || choice.message().content() == null) {
            return "";
        }
        return choice.message().content();
    }
}
