package br.edu.ifba.kgrag.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Scope tags partitioning the graph into section and book views.
 */
public final class Scopes {

    public static final String SECTION_PREFIX = "section:";
    public static final String BOOK_PREFIX = "book:";

    private Scopes() {
        throw new UnsupportedOperationException("Utility class");
    }

    @NotNull
    public static String section(@NotNull String sectionId) {
        return SECTION_PREFIX + sectionId;
    }

    @NotNull
    public static String book(@NotNull String bookId) {
        return BOOK_PREFIX + bookId;
    }

    public static boolean isSection(@Nullable String scope) {
        return scope != null && scope.startsWith(SECTION_PREFIX);
    }

    public static boolean isBook(@Nullable String scope) {
        return scope != null && scope.startsWith(BOOK_PREFIX);
    }

    /**
     * Strips the prefix of a section or book scope.
     *
     * @throws IllegalArgumentException for an untagged scope
     */
    @NotNull
    public static String idOf(@NotNull String scope) {
        if (isSection(scope)) {
            return scope.substring(SECTION_PREFIX.length());
        }
        if (isBook(scope)) {
            return scope.substring(BOOK_PREFIX.length());
        }
        throw new IllegalArgumentException("Not a section or book scope: " + scope);
    }
}
