package br.edu.ifba.kgrag.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.Objects;

/**
 * A typed relation between two nodes.
 *
 * <p>Draft edges from extraction carry endpoint names only; the idempotent
 * processor resolves them to node ids and assigns the {@code rid}. The
 * {@code rid} depends on type, endpoints and scope only, so updating
 * description or confidence never changes it.</p>
 */
public final class Edge {

    public static final double DEFAULT_CONFIDENCE = 0.8;
    public static final double DEFAULT_WEIGHT = 1.0;

    @Nullable
    private final String rid;

    @NotNull
    private final RelationType type;

    @Nullable
    private final String typeLabel;

    @Nullable
    private final String sourceId;

    @Nullable
    private final String targetId;

    @Nullable
    private final String sourceName;

    @Nullable
    private final String targetName;

    @NotNull
    private final String description;

    @Nullable
    private final String evidence;

    private final double confidence;

    private final double weight;

    @Nullable
    private final String scope;

    @Nullable
    private final String srcSection;

    @Nullable
    private final Instant createdAt;

    @Nullable
    private final Instant updatedAt;

    private Edge(Builder builder) {
        if (builder.confidence < 0.0 || builder.confidence > 1.0 || Double.isNaN(builder.confidence)) {
            throw new IllegalArgumentException("confidence must be in [0,1], got " + builder.confidence);
        }
        if (builder.weight < 0.0 || Double.isNaN(builder.weight)) {
            throw new IllegalArgumentException("weight must be >= 0, got " + builder.weight);
        }
        if (builder.sourceId == null && builder.sourceName == null) {
            throw new IllegalArgumentException("edge needs a source id or name");
        }
        if (builder.targetId == null && builder.targetName == null) {
            throw new IllegalArgumentException("edge needs a target id or name");
        }
        this.rid = builder.rid;
        this.type = builder.type != null ? builder.type : RelationType.RELATED;
        this.typeLabel = builder.typeLabel;
        this.sourceId = builder.sourceId;
        this.targetId = builder.targetId;
        this.sourceName = builder.sourceName;
        this.targetName = builder.targetName;
        this.description = builder.description != null ? builder.description : "";
        this.evidence = builder.evidence;
        this.confidence = builder.confidence;
        this.weight = builder.weight;
        this.scope = builder.scope;
        this.srcSection = builder.srcSection;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
    }

    @Nullable
    public String getRid() {
        return rid;
    }

    @NotNull
    public RelationType getType() {
        return type;
    }

    /**
     * Raw label from extraction when it did not map onto a known type.
     */
    @Nullable
    public String getTypeLabel() {
        return typeLabel;
    }

    @Nullable
    public String getSourceId() {
        return sourceId;
    }

    @Nullable
    public String getTargetId() {
        return targetId;
    }

    @Nullable
    public String getSourceName() {
        return sourceName;
    }

    @Nullable
    public String getTargetName() {
        return targetName;
    }

    @NotNull
    public String getDescription() {
        return description;
    }

    @Nullable
    public String getEvidence() {
        return evidence;
    }

    public double getConfidence() {
        return confidence;
    }

    public double getWeight() {
        return weight;
    }

    @Nullable
    public String getScope() {
        return scope;
    }

    @Nullable
    public String getSrcSection() {
        return srcSection;
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
     * Number of {@code ;}-separated evidence fragments, 1 when there is no
     * evidence string.
     */
    public int evidenceCount() {
        if (evidence == null || evidence.isBlank()) {
            return 1;
        }
        int count = 0;
        for (String part : evidence.split(";")) {
            if (!part.isBlank()) {
                count++;
            }
        }
        return Math.max(count, 1);
    }

    /**
     * @return true when both endpoints are resolved to node ids
     */
    public boolean isResolved() {
        return sourceId != null && targetId != null;
    }

    /**
     * Source id, or the source name of a draft edge.
     */
    @NotNull
    public String sourceKey() {
        return sourceId != null ? sourceId : Objects.requireNonNull(sourceName);
    }

    @NotNull
    public String targetKey() {
        return targetId != null ? targetId : Objects.requireNonNull(targetName);
    }

    /**
     * Id of the endpoint opposite to {@code nodeId}, or null if the edge does
     * not touch it.
     */
    @Nullable
    public String otherEnd(@NotNull String nodeId) {
        if (nodeId.equals(sourceId)) {
            return targetId;
        }
        if (nodeId.equals(targetId)) {
            return sourceId;
        }
        return null;
    }

    public Edge withTimestamps(@Nullable Instant created, @Nullable Instant updated) {
        return toBuilder().createdAt(created).updatedAt(updated).build();
    }

    public Builder toBuilder() {
        return new Builder()
            .rid(rid)
            .type(type)
            .typeLabel(typeLabel)
            .sourceId(sourceId)
            .targetId(targetId)
            .sourceName(sourceName)
            .targetName(targetName)
            .description(description)
            .evidence(evidence)
            .confidence(confidence)
            .weight(weight)
            .scope(scope)
            .srcSection(srcSection)
            .createdAt(createdAt)
            .updatedAt(updatedAt);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Edge edge = (Edge) obj;
        return Double.compare(edge.confidence, confidence) == 0 &&
               Double.compare(edge.weight, weight) == 0 &&
               Objects.equals(rid, edge.rid) &&
               type == edge.type &&
               Objects.equals(typeLabel, edge.typeLabel) &&
               Objects.equals(sourceId, edge.sourceId) &&
               Objects.equals(targetId, edge.targetId) &&
               description.equals(edge.description) &&
               Objects.equals(evidence, edge.evidence) &&
               Objects.equals(scope, edge.scope) &&
               Objects.equals(srcSection, edge.srcSection);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rid, type, typeLabel, sourceId, targetId, description, evidence,
            confidence, weight, scope, srcSection);
    }

    @Override
    public String toString() {
        return "Edge{" +
                "rid='" + rid + '\'' +
                ", type=" + type +
                ", source='" + sourceKey() + '\'' +
                ", target='" + targetKey() + '\'' +
                ", confidence=" + confidence +
                ", weight=" + weight +
                ", scope='" + scope + '\'' +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for Edge instances.
     */
    public static class Builder {
        private String rid;
        private RelationType type = RelationType.RELATED;
        private String typeLabel;
        private String sourceId;
        private String targetId;
        private String sourceName;
        private String targetName;
        private String description = "";
        private String evidence;
        private double confidence = DEFAULT_CONFIDENCE;
        private double weight = DEFAULT_WEIGHT;
        private String scope;
        private String srcSection;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder rid(@Nullable String rid) {
            this.rid = rid;
            return this;
        }

        public Builder type(@NotNull RelationType type) {
            this.type = type;
            return this;
        }

        /**
         * Maps a free-text label, keeping it as {@code typeLabel} when it is
         * not a known type name.
         */
        public Builder label(@Nullable String label) {
            this.type = RelationType.fromLabel(label);
            String trimmed = label == null ? "" : label.trim();
            this.typeLabel = trimmed.isEmpty() || trimmed.equals(type.name()) ? null : trimmed;
            return this;
        }

        public Builder typeLabel(@Nullable String typeLabel) {
            this.typeLabel = typeLabel;
            return this;
        }

        public Builder sourceId(@Nullable String sourceId) {
            this.sourceId = sourceId;
            return this;
        }

        public Builder targetId(@Nullable String targetId) {
            this.targetId = targetId;
            return this;
        }

        public Builder sourceName(@Nullable String sourceName) {
            this.sourceName = sourceName;
            return this;
        }

        public Builder targetName(@Nullable String targetName) {
            this.targetName = targetName;
            return this;
        }

        public Builder description(@Nullable String description) {
            this.description = description;
            return this;
        }

        public Builder evidence(@Nullable String evidence) {
            this.evidence = evidence;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder weight(double weight) {
            this.weight = weight;
            return this;
        }

        public Builder scope(@Nullable String scope) {
            this.scope = scope;
            return this;
        }

        public Builder srcSection(@Nullable String srcSection) {
            this.srcSection = srcSection;
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

        public Edge build() {
            return new Edge(this);
        }
    }
}
