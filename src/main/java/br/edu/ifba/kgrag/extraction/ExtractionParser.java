package br.edu.ifba.kgrag.extraction;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Reads the markdown answer of the extraction prompt.
 *
 * <p>Recognized headings (any level from {@code ##}): {@code Nodes}/{@code 节点},
 * {@code Relations}/{@code 关系} and {@code Hierarchy}/{@code 层次结构}. Lines that
 * do not fit their section are skipped and counted. The parser never throws;
 * an answer without any recognized section is an {@link ParseResult#err}.</p>
 */
public class ExtractionParser {

    private enum Section { NODES, RELATIONS, HIERARCHY, OTHER }

    private static final Map<String, Section> HEADINGS = Map.of(
        "nodes", Section.NODES,
        "节点", Section.NODES,
        "entities", Section.NODES,
        "relations", Section.RELATIONS,
        "relationships", Section.RELATIONS,
        "关系", Section.RELATIONS,
        "hierarchy", Section.HIERARCHY,
        "层次结构", Section.HIERARCHY
    );

    @NotNull
    public ParseResult parse(@Nullable String raw) {
        if (raw == null || raw.isBlank()) {
            return ParseResult.err("empty answer");
        }

        List<ParsedNode> nodes = new ArrayList<>();
        List<ParsedRelation> relations = new ArrayList<>();
        StringBuilder hierarchy = new StringBuilder();
        Section current = null;
        boolean sawSection = false;
        int skipped = 0;

        for (String line : raw.split("\\r?\\n")) {
            String trimmed = line.trim();
            if (trimmed.startsWith("##")) {
                current = headingOf(trimmed);
                sawSection |= current != Section.OTHER;
                continue;
            }
            if (current == null || current == Section.OTHER || trimmed.isEmpty()) {
                continue;
            }
            switch (current) {
                case NODES -> {
                    ParsedNode node = parseNode(trimmed);
                    if (node != null) {
                        nodes.add(node);
                    } else {
                        skipped++;
                    }
                }
                case RELATIONS -> {
                    ParsedRelation relation = parseRelation(trimmed);
                    if (relation != null) {
                        relations.add(relation);
                    } else {
                        skipped++;
                    }
                }
                case HIERARCHY -> hierarchy.append(line.stripTrailing()).append('\n');
                default -> { }
            }
        }

        if (!sawSection) {
            return ParseResult.err("no Nodes, Relations or Hierarchy section found");
        }
        return ParseResult.ok(nodes, relations, hierarchy.toString().strip(), skipped);
    }

    private static Section headingOf(String line) {
        String title = line.replaceFirst("^#+", "").trim()
            .replaceAll("[:：]$", "")
            .toLowerCase(Locale.ROOT);
        return HEADINGS.getOrDefault(title, Section.OTHER);
    }

    @Nullable
    static ParsedNode parseNode(String line) {
        String body = stripBullet(line);
        if (body == null) {
            return null;
        }
        int colon = indexOfColon(body, 0);
        if (colon <= 0) {
            return null;
        }
        String name = stripEmphasis(body.substring(0, colon));
        if (name.isEmpty()) {
            return null;
        }
        return new ParsedNode(name, body.substring(colon + 1).trim());
    }

    @Nullable
    static ParsedRelation parseRelation(String line) {
        String body = stripBullet(line);
        if (body == null) {
            return null;
        }
        int arrow = body.indexOf("->");
        int arrowLength = 2;
        if (arrow < 0) {
            arrow = body.indexOf('→');
            arrowLength = 1;
        }
        if (arrow <= 0) {
            return null;
        }
        int colon = indexOfColon(body, arrow + arrowLength);
        String source = stripEmphasis(body.substring(0, arrow));
        String target = stripEmphasis(colon > 0
            ? body.substring(arrow + arrowLength, colon)
            : body.substring(arrow + arrowLength));
        String label = colon > 0 ? body.substring(colon + 1).trim() : "";
        if (source.isEmpty() || target.isEmpty()) {
            return null;
        }
        return new ParsedRelation(source, target, label.isEmpty() ? null : label);
    }

    @Nullable
    private static String stripBullet(String line) {
        if (line.startsWith("- ") || line.startsWith("* ")) {
            return line.substring(2).trim();
        }
        return null;
    }

    private static int indexOfColon(String text, int from) {
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == ':' || c == '：') {
                return i;
            }
        }
        return -1;
    }

    private static String stripEmphasis(String text) {
        return text.replace("**", "").replace("`", "").trim();
    }

    public record ParsedNode(@NotNull String name, @NotNull String description) {}

    public record ParsedRelation(@NotNull String source, @NotNull String target, @Nullable String label) {}

    /**
     * Outcome of parsing: either the parsed sections or the reason nothing
     * could be read.
     */
    public static final class ParseResult {

        private final List<ParsedNode> nodes;
        private final List<ParsedRelation> relations;
        private final String hierarchy;
        private final int skippedLines;
        private final String error;

        private ParseResult(List<ParsedNode> nodes, List<ParsedRelation> relations, String hierarchy,
                            int skippedLines, String error) {
            this.nodes = nodes;
            this.relations = relations;
            this.hierarchy = hierarchy;
            this.skippedLines = skippedLines;
            this.error = error;
        }

        public static ParseResult ok(List<ParsedNode> nodes, List<ParsedRelation> relations,
                                     String hierarchy, int skippedLines) {
            return new ParseResult(List.copyOf(nodes), List.copyOf(relations),
                Objects.requireNonNullElse(hierarchy, ""), skippedLines, null);
        }

        public static ParseResult err(@NotNull String reason) {
            return new ParseResult(List.of(), List.of(), "", 0, reason);
        }

        public boolean isOk() {
            return error == null;
        }

        public List<ParsedNode> nodes() {
            return nodes;
        }

        public List<ParsedRelation> relations() {
            return relations;
        }

        public String hierarchy() {
            return hierarchy;
        }

        public int skippedLines() {
            return skippedLines;
        }

        /**
         * @return why parsing failed, null for an ok result
         */
        @Nullable
        public String error() {
            return error;
        }
    }
}
