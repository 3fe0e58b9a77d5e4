package br.edu.ifba.kgrag.core;

import br.edu.ifba.kgrag.utils.IdentityUtil;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * One content unit (a subchapter) to turn into a section graph.
 */
public record SectionInput(
    @NotNull String topic,
    @NotNull String chapterTitle,
    @NotNull String subchapterTitle,
    @NotNull String content,
    @NotNull List<String> keywords,
    @NotNull String language
) {

    public static final String DEFAULT_LANGUAGE = "中文";

    public SectionInput {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic must not be blank");
        }
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("content must not be blank");
        }
        chapterTitle = chapterTitle != null ? chapterTitle : "";
        subchapterTitle = subchapterTitle != null ? subchapterTitle : "";
        keywords = keywords != null ? List.copyOf(keywords) : List.of();
        language = language == null || language.isBlank() ? DEFAULT_LANGUAGE : language;
    }

    public SectionInput(String topic, String chapterTitle, String subchapterTitle, String content) {
        this(topic, chapterTitle, subchapterTitle, content, List.of(), DEFAULT_LANGUAGE);
    }

    public String sectionId() {
        return IdentityUtil.sectionId(topic, chapterTitle, subchapterTitle);
    }

    public String scope() {
        return Scopes.section(sectionId());
    }

    public String contentHash() {
        return IdentityUtil.contentHash(content);
    }
}
