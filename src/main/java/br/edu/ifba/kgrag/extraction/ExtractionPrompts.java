package br.edu.ifba.kgrag.extraction;

import br.edu.ifba.kgrag.core.RelationType;
import br.edu.ifba.kgrag.core.SectionInput;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Prompts for extracting a section graph in the markdown layout that
 * {@link ExtractionParser} reads.
 *
 * <p>Placeholders: {@code {language}} and {@code {relation_types}} in the
 * system prompt; {@code {topic}}, {@code {chapter}}, {@code {subchapter}},
 * {@code {keywords}} and {@code {input_text}} in the user prompt. Both
 * templates can be overridden with {@code kgrag.extraction.system-prompt}
 * and {@code kgrag.extraction.user-prompt}.</p>
 */
public class ExtractionPrompts {

    /** Section text beyond this many characters is not sent. */
    public static final int MAX_INPUT_CHARS = 3000;

    public static final String DEFAULT_RELATION_TYPES = Arrays.stream(RelationType.values())
        .map(Enum::name)
        .collect(Collectors.joining(", "));

    public static final String DEFAULT_SYSTEM_PROMPT = """
        You are a knowledge engineer building a concept graph for a textbook.
        Read the section and list its key concepts and how they relate.
        Answer in {language}, using exactly this markdown layout:

        ### Nodes
        - concept name: one-sentence description

        ### Relations
        - source concept -> target concept: RELATION_TYPE

        ### Hierarchy
        an indented outline of the concepts, broadest first

        Rules:
        - Use relation types from: {relation_types}.
        - Every relation endpoint must appear under Nodes with the same name.
        - Do not add any text outside the three sections.
        """;

    public static final String DEFAULT_USER_PROMPT = """
        Topic: {topic}
        Chapter: {chapter}
        Section: {subchapter}
        Keywords: {keywords}

        Section text:
        {input_text}
        """;

    private final String systemPrompt;
    private final String userPrompt;

    public ExtractionPrompts() {
        this(null, null);
    }

    public ExtractionPrompts(@Nullable String systemPrompt, @Nullable String userPrompt) {
        this.systemPrompt = systemPrompt == null || systemPrompt.isBlank() ? DEFAULT_SYSTEM_PROMPT : systemPrompt;
        this.userPrompt = userPrompt == null || userPrompt.isBlank() ? DEFAULT_USER_PROMPT : userPrompt;
    }

    @NotNull
    public String formatSystemPrompt(@Nullable String language) {
        return systemPrompt
            .replace("{language}", language != null ? language : SectionInput.DEFAULT_LANGUAGE)
            .replace("{relation_types}", DEFAULT_RELATION_TYPES);
    }

    @NotNull
    public String formatUserPrompt(@NotNull SectionInput input) {
        String content = input.content();
        if (content.length() > MAX_INPUT_CHARS) {
            content = content.substring(0, MAX_INPUT_CHARS);
        }
        return userPrompt
            .replace("{topic}", input.topic())
            .replace("{chapter}", input.chapterTitle())
            .replace("{subchapter}", input.subchapterTitle())
            .replace("{keywords}", String.join(", ", input.keywords()))
            .replace("{input_text}", content);
    }
}
