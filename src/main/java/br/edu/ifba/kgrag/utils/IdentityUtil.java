package br.edu.ifba.kgrag.utils;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Deterministic identifiers for the knowledge graph.
 *
 * <p>Every id produced here is a pure function of canonical content, so two
 * extraction runs over the same input always land on the same keys. The
 * graph store relies on that to make upserts idempotent.</p>
 *
 * <ul>
 *   <li>{@link #slug(String)} keeps {@code [A-Za-z0-9_]} and CJK ideographs</li>
 *   <li>{@link #contentHash(String)} hashes whitespace-normalized text</li>
 *   <li>{@link #nodeId(String, String, String)} and {@link #relationId} derive graph keys</li>
 * </ul>
 */
public final class IdentityUtil {

    /** Node type that is left out of node ids. */
    public static final String DEFAULT_NODE_TYPE = "Concept";

    /** Ids longer than this are shortened to a prefix plus a hash suffix. */
    public static final int DEFAULT_MAX_ID_LENGTH = 64;

    private static final int SECTION_ID_LENGTH = 12;
    private static final int CONTENT_HASH_LENGTH = 12;
    private static final int RELATION_ID_LENGTH = 16;
    private static final int SCOPE_HASH_LENGTH = 8;
    private static final int LONG_ID_PREFIX = 50;

    private static final Pattern NON_SLUG = Pattern.compile("[^A-Za-z0-9_\\u4e00-\\u9fff]+");
    private static final Pattern UNDERSCORES = Pattern.compile("_+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private IdentityUtil() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Reduces text to a lowercase slug of ASCII word characters and CJK
     * ideographs, with runs of anything else collapsed to a single underscore.
     *
     * @param text input text, may be null
     * @return slug, empty for empty input
     */
    @NotNull
    public static String slug(@Nullable String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String cleaned = NON_SLUG.matcher(text).replaceAll("_");
        cleaned = UNDERSCORES.matcher(cleaned).replaceAll("_");
        int start = 0;
        int end = cleaned.length();
        while (start < end && cleaned.charAt(start) == '_') {
            start++;
        }
        while (end > start && cleaned.charAt(end - 1) == '_') {
            end--;
        }
        return cleaned.substring(start, end).toLowerCase(Locale.ROOT);
    }

    /**
     * Trims and collapses internal whitespace.
     *
     * @param name raw name, may be null
     * @return canonical form, empty for null
     */
    @NotNull
    public static String canonicalize(@Nullable String name) {
        if (name == null) {
            return "";
        }
        return WHITESPACE.matcher(name.trim()).replaceAll(" ");
    }

    /**
     * Fixed-length digest of whitespace-normalized text.
     *
     * @param text input text
     * @return 12 hex characters, or empty for empty input
     */
    @NotNull
    public static String contentHash(@Nullable String text) {
        String normalized = canonicalize(text);
        if (normalized.isEmpty()) {
            return "";
        }
        return md5Hex(normalized).substring(0, CONTENT_HASH_LENGTH);
    }

    /**
     * Section identifier derived from its position in the document outline.
     */
    @NotNull
    public static String sectionId(@NotNull String topic, @NotNull String chapter, @NotNull String subchapter) {
        return md5Hex(topic + "|" + chapter + "|" + subchapter).substring(0, SECTION_ID_LENGTH);
    }

    /**
     * Concept identifier scoped to a section outline position.
     */
    @NotNull
    public static String conceptId(@NotNull String name, @NotNull String topic,
                                   @NotNull String chapter, @NotNull String subchapter) {
        String digest = md5Hex(topic + "|" + chapter + "|" + subchapter).substring(0, 6);
        return "concept:" + slug(name) + ":" + digest;
    }

    /**
     * Book identifier. The run id keeps repeated runs on the same topic apart.
     *
     * @param topic book topic
     * @param runId run or thread identifier, may be blank
     * @return {@code <slug>_<runId[:8]>}, or just the slug when no run id is given
     */
    @NotNull
    public static String bookId(@NotNull String topic, @Nullable String runId) {
        String base = slug(topic);
        if (runId == null || runId.isBlank()) {
            return base;
        }
        String run = runId.trim();
        return base + "_" + slug(run.substring(0, Math.min(8, run.length())));
    }

    /**
     * Node id from canonical name, type and scope, capped at the default length.
     */
    @NotNull
    public static String nodeId(@NotNull String canonicalName, @Nullable String type, @NotNull String scope) {
        return nodeId(canonicalName, type, scope, DEFAULT_MAX_ID_LENGTH);
    }

    /**
     * Node id from canonical name, type and scope.
     *
     * <p>Layout is {@code slug(name)[_type]_scopeHash}. The type segment is
     * omitted for {@value #DEFAULT_NODE_TYPE}. Ids above {@code maxLength}
     * become {@code id[:50] + "_" + md5(id)[:8]}.</p>
     */
    @NotNull
    public static String nodeId(@NotNull String canonicalName, @Nullable String type,
                                @NotNull String scope, int maxLength) {
        StringBuilder id = new StringBuilder(slug(canonicalName));
        if (type != null && !type.isBlank() && !DEFAULT_NODE_TYPE.equalsIgnoreCase(type.trim())) {
            id.append('_').append(slug(type));
        }
        id.append('_').append(md5Hex(scope).substring(0, SCOPE_HASH_LENGTH));

        String raw = id.toString();
        if (raw.length() > maxLength) {
            return raw.substring(0, LONG_ID_PREFIX) + "_" + md5Hex(raw).substring(0, SCOPE_HASH_LENGTH);
        }
        return raw;
    }

    /**
     * Edge id. Only type, endpoints and scope take part, so property updates
     * never change it.
     */
    @NotNull
    public static String relationId(@NotNull String type, @NotNull String sourceId,
                                    @NotNull String targetId, @NotNull String scope) {
        return md5Hex(type + "|" + sourceId + "|" + targetId + "|" + scope).substring(0, RELATION_ID_LENGTH);
    }

    /**
     * Lowercase hex MD5 of the UTF-8 bytes of {@code text}.
     */
    @NotNull
    public static String md5Hex(@NotNull String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
