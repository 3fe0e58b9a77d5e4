package br.edu.ifba.kgrag.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A concept node of the knowledge graph.
 *
 * <p>Draft nodes coming out of extraction have no id yet; the idempotent
 * processor assigns one from {@code (canonical name, type, scope)}.
 * Timestamps are bookkeeping and do not take part in equality.</p>
 */
public final class Node {

    public static final String DEFAULT_TYPE = "Concept";

    @Nullable
    private final String id;

    @NotNull
    private final String name;

    @NotNull
    private final String type;

    @NotNull
    private final String description;

    @NotNull
    private final List<String> aliases;

    @Nullable
    private final String scope;

    private final double score;

    @Nullable
    private final String chapter;

    @Nullable
    private final String subchapter;

    @Nullable
    private final Instant createdAt;

    @Nullable
    private final Instant updatedAt;

    private Node(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "name must not be null");
        this.id = builder.id;
        this.type = builder.type == null || builder.type.isBlank() ? DEFAULT_TYPE : builder.type;
        this.description = builder.description != null ? builder.description : "";
        this.aliases = Collections.unmodifiableList(new ArrayList<>(builder.aliases));
        this.scope = builder.scope;
        this.score = builder.score;
        this.chapter = builder.chapter;
        this.subchapter = builder.subchapter;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
    }

    @Nullable
    public String getId() {
        return id;
    }

    @NotNull
    public String getName() {
        return name;
    }

    @NotNull
    public String getType() {
        return type;
    }

    @NotNull
    public String getDescription() {
        return description;
    }

    @NotNull
    public List<String> getAliases() {
        return aliases;
    }

    @Nullable
    public String getScope() {
        return scope;
    }

    public double getScore() {
        return score;
    }

    @Nullable
    public String getChapter() {
        return chapter;
    }

    @Nullable
    public String getSubchapter() {
        return subchapter;
    }

    @Nullable
    public Instant getCreatedAt() {
        return createdAt;
    }

    @Nullable
    public Instant getUpdatedAt() {
        return updatedAt;
    }

    /**
     * @return id, failing when the node is still a draft
     */
    @NotNull
    public String requireId() {
        if (id == null) {
            throw new IllegalStateException("Node '" + name + "' has no id yet");
        }
        return id;
    }

    public Node withId(@NotNull String newId) {
        return toBuilder().id(newId).build();
    }

    public Node withScope(@NotNull String newScope) {
        return toBuilder().scope(newScope).build();
    }

    public Node withTimestamps(@Nullable Instant created, @Nullable Instant updated) {
        return toBuilder().createdAt(created).updatedAt(updated).build();
    }

    public Builder toBuilder() {
        return new Builder()
            .id(id)
            .name(name)
            .type(type)
            .description(description)
            .aliases(aliases)
            .scope(scope)
            .score(score)
            .chapter(chapter)
            .subchapter(subchapter)
            .createdAt(createdAt)
            .updatedAt(updatedAt);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Node node = (Node) obj;
        return Double.compare(node.score, score) == 0 &&
               Objects.equals(id, node.id) &&
               name.equals(node.name) &&
               type.equals(node.type) &&
               description.equals(node.description) &&
               aliases.equals(node.aliases) &&
               Objects.equals(scope, node.scope) &&
               Objects.equals(chapter, node.chapter) &&
               Objects.equals(subchapter, node.subchapter);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, type, description, aliases, scope, score, chapter, subchapter);
    }

    @Override
    public String toString() {
        return "Node{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", type='" + type + '\'' +
                ", scope='" + scope + '\'' +
                ", aliases=" + aliases +
                ", score=" + score +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for Node instances.
     */
    public static class Builder {
        private String id;
        private String name;
        private String type = DEFAULT_TYPE;
        private String description = "";
        private List<String> aliases = new ArrayList<>();
        private String scope;
        private double score = 1.0;
        private String chapter;
        private String subchapter;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(@Nullable String id) {
            this.id = id;
            return this;
        }

        public Builder name(@NotNull String name) {
            this.name = name;
            return this;
        }

        public Builder type(@Nullable String type) {
            this.type = type;
            return this;
        }

        public Builder description(@Nullable String description) {
            this.description = description;
            return this;
        }

        public Builder aliases(@Nullable List<String> aliases) {
            this.aliases = aliases != null ? new ArrayList<>(aliases) : new ArrayList<>();
            return this;
        }

        public Builder addAlias(@NotNull String alias) {
            if (!aliases.contains(alias)) {
                aliases.add(alias);
            }
            return this;
        }

        public Builder scope(@Nullable String scope) {
            this.scope = scope;
            return this;
        }

        public Builder score(double score) {
            this.score = score;
            return this;
        }

        public Builder chapter(@Nullable String chapter) {
            this.chapter = chapter;
            return this;
        }

        public Builder subchapter(@Nullable String subchapter) {
            this.subchapter = subchapter;
            return this;
        }

        public Builder createdAt(@Nullable Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(@Nullable Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Node build() {
            return new Node(this);
        }
    }
}
