package com.catalog.quality.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A proposed field-level correction with an associated confidence.
 * {@code applied} moves one way and an applied suggestion is never modified again.
 */
public final class Suggestion {
    private final long id;
    private final String databaseKey;
    private final long normalizedItemId;
    private final SuggestionType type;
    private final SuggestionPriority priority;
    private final String field;
    private final String currentValue;
    private final String suggestedValue;
    private final double confidence;
    private final String reasoning;
    private final boolean autoApplyable;
    private final boolean applied;
    private final Instant appliedAt;
    private final Instant createdAt;

    private Suggestion(Builder builder) {
        this.id = builder.id;
        this.databaseKey = builder.databaseKey;
        this.normalizedItemId = builder.normalizedItemId;
        this.type = builder.type;
        this.priority = builder.priority;
        this.field = builder.field;
        this.currentValue = builder.currentValue;
        this.suggestedValue = builder.suggestedValue;
        this.confidence = builder.confidence;
        this.reasoning = builder.reasoning;
        this.autoApplyable = builder.autoApplyable;
        this.applied = builder.applied;
        this.appliedAt = builder.appliedAt;
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

    public SuggestionType getType() {
        return type;
    }

    public SuggestionPriority getPriority() {
        return priority;
    }

    public String getField() {
        return field;
    }

    public String getCurrentValue() {
        return currentValue;
    }

    public String getSuggestedValue() {
        return suggestedValue;
    }

    public double getConfidence() {
        return confidence;
    }

    public String getReasoning() {
        return reasoning;
    }

    public boolean isAutoApplyable() {
        return autoApplyable;
    }

    public boolean isApplied() {
        return applied;
    }

    public Instant getAppliedAt() {
        return appliedAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * Returns a copy marked as applied at the given instant.
     *
     * @throws IllegalStateException if already applied
     */
    public Suggestion markApplied(Instant at) {
        if (applied) {
            throw new IllegalStateException("Suggestion already applied: " + id);
        }
        return toBuilder().applied(true).appliedAt(at).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .databaseKey(databaseKey)
                .normalizedItemId(normalizedItemId)
                .type(type)
                .priority(priority)
                .field(field)
                .currentValue(currentValue)
                .suggestedValue(suggestedValue)
                .confidence(confidence)
                .reasoning(reasoning)
                .autoApplyable(autoApplyable)
                .applied(applied)
                .appliedAt(appliedAt)
                .createdAt(createdAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id == ((Suggestion) o).id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return "Suggestion{" +
                "id=" + id +
                ", item=" + normalizedItemId +
                ", type=" + type +
                ", field='" + field + '\'' +
                ", suggested='" + suggestedValue + '\'' +
                ", confidence=" + confidence +
                ", applied=" + applied +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private long id;
        private String databaseKey;
        private long normalizedItemId;
        private SuggestionType type;
        private SuggestionPriority priority;
        private String field;
        private String currentValue;
        private String suggestedValue;
        private double confidence;
        private String reasoning;
        private boolean autoApplyable;
        private boolean applied;
        private Instant appliedAt;
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

        public Builder type(SuggestionType type) {
            this.type = type;
            return this;
        }

        public Builder priority(SuggestionPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder field(String field) {
            this.field = field;
            return this;
        }

        public Builder currentValue(String currentValue) {
            this.currentValue = currentValue;
            return this;
        }

        public Builder suggestedValue(String suggestedValue) {
            this.suggestedValue = suggestedValue;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder reasoning(String reasoning) {
            this.reasoning = reasoning;
            return this;
        }

        public Builder autoApplyable(boolean autoApplyable) {
            this.autoApplyable = autoApplyable;
            return this;
        }

        public Builder applied(boolean applied) {
            this.applied = applied;
            return this;
        }

        public Builder appliedAt(Instant appliedAt) {
            this.appliedAt = appliedAt;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Suggestion build() {
            Objects.requireNonNull(databaseKey, "databaseKey is required");
            Objects.requireNonNull(type, "type is required");
            Objects.requireNonNull(priority, "priority is required");
            if (confidence < 0.0 || confidence > 1.0) {
                throw new IllegalArgumentException("confidence must be between 0.0 and 1.0: " + confidence);
            }
            if (autoApplyable && !type.writesField()) {
                throw new IllegalArgumentException(type.wireName() + " suggestions are never auto-applyable");
            }
            return new Suggestion(this);
        }
    }
}
