package br.edu.ifba.kgrag.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Closed set of relation types stored in the graph.
 *
 * <p>Free-text labels from extraction are mapped with {@link #fromLabel(String)};
 * anything unknown becomes {@link #RELATED} and the caller keeps the raw
 * label in {@code type_label}.</p>
 */
public enum RelationType {
    IS_A,
    PART_OF,
    CONTAINS,
    PREREQUISITE_OF,
    DEPENDS_ON,
    USES,
    CAUSES,
    EXAMPLE_OF,
    CONTRASTS_WITH,
    DERIVED_FROM,
    RELATED;

    /** Identifier shape allowed for relation type names. */
    public static final Pattern SAFE_IDENTIFIER = Pattern.compile("^[A-Z][A-Z0-9_]{0,63}$");

    private static final Pattern NON_IDENTIFIER = Pattern.compile("[^A-Z0-9]+");

    private static final Map<String, RelationType> SYNONYMS = Map.ofEntries(
        Map.entry("ISA", IS_A),
        Map.entry("IS", IS_A),
        Map.entry("TYPE_OF", IS_A),
        Map.entry("KIND_OF", IS_A),
        Map.entry("是一种", IS_A),
        Map.entry("属于", IS_A),
        Map.entry("PARTOF", PART_OF),
        Map.entry("BELONGS_TO", PART_OF),
        Map.entry("组成部分", PART_OF),
        Map.entry("HAS", CONTAINS),
        Map.entry("HAS_PART", CONTAINS),
        Map.entry("INCLUDES", CONTAINS),
        Map.entry("包含", CONTAINS),
        Map.entry("PREREQUISITE", PREREQUISITE_OF),
        Map.entry("PRECEDES", PREREQUISITE_OF),
        Map.entry("前置", PREREQUISITE_OF),
        Map.entry("先修", PREREQUISITE_OF),
        Map.entry("REQUIRES", DEPENDS_ON),
        Map.entry("DEPENDS", DEPENDS_ON),
        Map.entry("依赖", DEPENDS_ON),
        Map.entry("USED_BY", USES),
        Map.entry("APPLIES", USES),
        Map.entry("应用", USES),
        Map.entry("使用", USES),
        Map.entry("LEADS_TO", CAUSES),
        Map.entry("RESULTS_IN", CAUSES),
        Map.entry("导致", CAUSES),
        Map.entry("EXAMPLE", EXAMPLE_OF),
        Map.entry("INSTANCE_OF", EXAMPLE_OF),
        Map.entry("示例", EXAMPLE_OF),
        Map.entry("例子", EXAMPLE_OF),
        Map.entry("CONTRASTS", CONTRASTS_WITH),
        Map.entry("OPPOSITE_OF", CONTRASTS_WITH),
        Map.entry("对比", CONTRASTS_WITH),
        Map.entry("DERIVES_FROM", DERIVED_FROM),
        Map.entry("BASED_ON", DERIVED_FROM),
        Map.entry("派生", DERIVED_FROM),
        Map.entry("RELATED_TO", RELATED),
        Map.entry("RELATES_TO", RELATED),
        Map.entry("相关", RELATED)
    );

    /**
     * Maps a free-text label onto the closed set.
     *
     * @param label raw label, may be null
     * @return matching type, {@link #RELATED} when unknown
     */
    @NotNull
    public static RelationType fromLabel(@Nullable String label) {
        if (label == null || label.isBlank()) {
            return RELATED;
        }
        String trimmed = label.trim();
        RelationType synonym = SYNONYMS.get(trimmed);
        if (synonym != null) {
            return synonym;
        }
        String normalized = normalize(trimmed);
        if (!SAFE_IDENTIFIER.matcher(normalized).matches()) {
            return RELATED;
        }
        for (RelationType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        return SYNONYMS.getOrDefault(normalized, RELATED);
    }

    /**
     * Parses a stored type name. Storage only ever writes {@link #name()}, so
     * anything else is a corrupt row.
     */
    @NotNull
    public static RelationType fromStored(@NotNull String stored) {
        if (!SAFE_IDENTIFIER.matcher(stored).matches()) {
            throw new IllegalArgumentException("Unsafe relation type identifier: " + stored);
        }
        return valueOf(stored);
    }

    private static String normalize(String label) {
        String upper = label.toUpperCase(Locale.ROOT);
        String collapsed = NON_IDENTIFIER.matcher(upper).replaceAll("_");
        int start = 0;
        int end = collapsed.length();
        while (start < end && collapsed.charAt(start) == '_') {
            start++;
        }
        while (end > start && collapsed.charAt(end - 1) == '_') {
            end--;
        }
        return collapsed.substring(start, end);
    }
}
