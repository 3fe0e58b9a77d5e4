package br.edu.ifba.kgrag.core;

import br.edu.ifba.kgrag.utils.IdentityUtil;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Identifies the book a set of sections is merged into.
 *
 * @param topic book topic
 * @param runId run or thread identifier, keeps repeated runs on one topic apart
 */
public record BookContext(@NotNull String topic, @Nullable String runId) {

    public BookContext {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic must not be blank");
        }
    }

    public String bookId() {
        return IdentityUtil.bookId(topic, runId);
    }

    public String scope() {
        return Scopes.book(bookId());
    }
}
