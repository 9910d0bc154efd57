package com.catalog.quality.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A detected breach of a quality rule against one normalized record.
 * {@code resolved} moves one way; the first resolver is kept.
 */
public final class Violation {
    private final long id;
    private final String databaseKey;
    private final long normalizedItemId;
    private final String ruleName;
    private final ViolationCategory category;
    private final Severity severity;
    private final String message;
    private final String recommendation;
    private final String fieldName;
    private final String currentValue;
    private final boolean resolved;
    private final String resolvedBy;
    private final Instant resolvedAt;
    private final Instant createdAt;

    private Violation(Builder builder) {
        this.id = builder.id;
        this.databaseKey = builder.databaseKey;
        this.normalizedItemId = builder.normalizedItemId;
        this.ruleName = builder.ruleName;
        this.category = builder.category;
        this.severity = builder.severity;
        this.message = builder.message;
        this.recommendation = builder.recommendation;
        this.fieldName = builder.fieldName;
        this.currentValue = builder.currentValue;
        this.resolved = builder.resolved;
        this.resolvedBy = builder.resolvedBy;
        this.resolvedAt = builder.resolvedAt;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
    }

    public long getId() {
        return id;
    }

    public String getDatabaseKey() {
        return databaseKey;
    }

    public long getNormalizedItemId() {
        return normalizedItemId;
    }

    public String getRuleName() {
        return ruleName;
    }

    public ViolationCategory getCategory() {
        return category;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getMessage() {
        return message;
    }

    public String getRecommendation() {
        return recommendation;
    }

    public String getFieldName() {
        return fieldName;
    }

    public String getCurrentValue() {
        return currentValue;
    }

    public boolean isResolved() {
        return resolved;
    }

    public String getResolvedBy() {
        return resolvedBy;
    }

    public Instant getResolvedAt() {
        return resolvedAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * Returns a resolved copy. An already resolved violation is returned unchanged.
     */
    public Violation resolve(String by, Instant at) {
        if (resolved) {
            return this;
        }
        return toBuilder().resolved(true).resolvedBy(by).resolvedAt(at).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .databaseKey(databaseKey)
                .normalizedItemId(normalizedItemId)
                .ruleName(ruleName)
                .category(category)
                .severity(severity)
                .message(message)
                .recommendation(recommendation)
                .fieldName(fieldName)
                .currentValue(currentValue)
                .resolved(resolved)
                .resolvedBy(resolvedBy)
                .resolvedAt(resolvedAt)
                .createdAt(createdAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id == ((Violation) o).id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return "Violation{" +
                "id=" + id +
                ", item=" + normalizedItemId +
                ", rule='" + ruleName + '\'' +
                ", severity=" + severity +
                ", resolved=" + resolved +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private long id;
        private String databaseKey;
        private long normalizedItemId;
        private String ruleName;
        private ViolationCategory category;
        private Severity severity;
        private String message;
        private String recommendation;
        private String fieldName;
        private String currentValue;
        private boolean resolved;
        private String resolvedBy;
        private Instant resolvedAt;
        private Instant createdAt;

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder databaseKey(String databaseKey) {
            this.databaseKey = databaseKey;
            return this;
        }

        public Builder normalizedItemId(long normalizedItemId) {
            this.normalizedItemId = normalizedItemId;
            return this;
        }

        public Builder ruleName(String ruleName) {
            this.ruleName = ruleName;
            return this;
        }

        public Builder category(ViolationCategory category) {
            this.category = category;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder recommendation(String recommendation) {
            this.recommendation = recommendation;
            return this;
        }

        public Builder fieldName(String fieldName) {
            this.fieldName = fieldName;
            return this;
        }

        public Builder currentValue(String currentValue) {
            this.currentValue = currentValue;
            return this;
        }

        public Builder resolved(boolean resolved) {
            this.resolved = resolved;
            return this;
        }

        public Builder resolvedBy(String resolvedBy) {
            this.resolvedBy = resolvedBy;
            return this;
        }

        public Builder resolvedAt(Instant resolvedAt) {
            this.resolvedAt = resolvedAt;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Violation build() {
            Objects.requireNonNull(databaseKey, "databaseKey is required");
            Objects.requireNonNull(ruleName, "ruleName is required");
            Objects.requireNonNull(category, "category is required");
            Objects.requireNonNull(severity, "severity is required");
            return new Violation(this);
        }
    }
}
