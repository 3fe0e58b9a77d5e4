package br.edu.ifba.kgrag.storage;

import br.edu.ifba.kgrag.core.Node;
import org.jetbrains.annotations.NotNull;

import java.util.Locale;

/**
 * Match strength of a node against an entity query.
 *
 * <p>Exact name (1.0) &gt; exact alias (0.9) &gt; name prefix (0.8) &gt; name
 * contains, or query contains name (0.7) &gt; description contains (0.6) &gt;
 * anything else (0.5). Stores order candidates by this rank before limiting
 * them.</p>
 */
public final class MatchRank {

    public static final double EXACT_NAME = 1.0;
    public static final double EXACT_ALIAS = 0.9;
    public static final double NAME_PREFIX = 0.8;
    public static final double NAME_CONTAINS = 0.7;
    public static final double DESCRIPTION_CONTAINS = 0.6;
    public static final double FALLBACK = 0.5;

    private MatchRank() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * @param node          candidate
     * @param loweredQuery  query, trimmed and lower-cased with {@link Locale#ROOT}
     */
    public static double score(@NotNull Node node, @NotNull String loweredQuery) {
        String name = node.getName().toLowerCase(Locale.ROOT);
        if (name.equals(loweredQuery)) {
            return EXACT_NAME;
        }
        for (String alias : node.getAliases()) {
            if (alias.toLowerCase(Locale.ROOT).equals(loweredQuery)) {
                return EXACT_ALIAS;
            }
        }
        if (name.startsWith(loweredQuery)) {
            return NAME_PREFIX;
        }
        if (name.contains(loweredQuery) || (!name.isEmpty() && loweredQuery.contains(name))) {
            return NAME_CONTAINS;
        }
        if (node.getDescription().toLowerCase(Locale.ROOT).contains(loweredQuery)) {
            return DESCRIPTION_CONTAINS;
        }
        return FALLBACK;
    }
}
