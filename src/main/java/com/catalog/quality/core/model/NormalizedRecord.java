package com.catalog.quality.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Canonical form of a raw catalog entry after normalization.
 *
 * <p>Instances are immutable snapshots. Stores hand out copies and accept
 * replacements built with {@link #toBuilder()}, so a reader never observes
 * a half-written record. Records are deactivated by merges, never deleted.</p>
 */
public final class NormalizedRecord {
    private final long id;
    private final String databaseKey;
    private final String reference;
    private final String code;
    private final String name;
    private final String normalizedName;
    private final Map<String, String> attributes;
    private final ProcessingLevel processingLevel;
    private final double qualityScore;
    private final double aiConfidence;
    private final boolean active;
    private final int mergedCount;
    private final Instant createdAt;
    private final Instant updatedAt;

    private NormalizedRecord(Builder builder) {
        this.id = builder.id;
        this.databaseKey = builder.databaseKey;
        this.reference = builder.reference;
        this.code = builder.code != null ? builder.code : "";
        this.name = builder.name != null ? builder.name : "";
        this.normalizedName = builder.normalizedName != null ? builder.normalizedName : "";
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
        this.processingLevel = builder.processingLevel != null ? builder.processingLevel : ProcessingLevel.BASIC;
        this.qualityScore = builder.qualityScore;
        this.aiConfidence = builder.aiConfidence;
        this.active = builder.active;
        this.mergedCount = builder.mergedCount;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;
    }

    public long getId() {
        return id;
    }

    public String getDatabaseKey() {
        return databaseKey;
    }

    public String getReference() {
        return reference;
    }

    public String getCode() {
        return code;
    }

    public String getName() {
        return name;
    }

    public String getNormalizedName() {
        return normalizedName;
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    public String getAttribute(String key) {
        return attributes.get(key);
    }

    public ProcessingLevel getProcessingLevel() {
        return processingLevel;
    }

    public double getQualityScore() {
        return qualityScore;
    }

    public double getAiConfidence() {
        return aiConfidence;
    }

    public boolean isActive() {
        return active;
    }

    public int getMergedCount() {
        return mergedCount;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    /**
     * Reads a writable field by name: {@code name}, {@code code} or an attribute key.
     */
    public String fieldValue(String field) {
        return switch (field) {
            case "name" -> name;
            case "code" -> code;
            default -> attributes.get(field);
        };
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .databaseKey(databaseKey)
                .reference(reference)
                .code(code)
                .name(name)
                .normalizedName(normalizedName)
                .attributes(attributes)
                .processingLevel(processingLevel)
                .qualityScore(qualityScore)
                .aiConfidence(aiConfidence)
                .active(active)
                .mergedCount(mergedCount)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NormalizedRecord that = (NormalizedRecord) o;
        return id == that.id && Objects.equals(databaseKey, that.databaseKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(databaseKey, id);
    }

    @Override
    public String toString() {
        return "NormalizedRecord{" +
                "id=" + id +
                ", databaseKey='" + databaseKey + '\'' +
                ", code='" + code + '\'' +
                ", name='" + name + '\'' +
                ", level=" + processingLevel +
                ", qualityScore=" + qualityScore +
                ", active=" + active +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private long id;
        private String databaseKey;
        private String reference;
        private String code;
        private String name;
        private String normalizedName;
        private final Map<String, String> attributes = new LinkedHashMap<>();
        private ProcessingLevel processingLevel;
        private double qualityScore;
        private double aiConfidence;
        private boolean active = true;
        private int mergedCount;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder databaseKey(String databaseKey) {
            this.databaseKey = databaseKey;
            return this;
        }

        public Builder reference(String reference) {
            this.reference = reference;
            return this;
        }

        public Builder code(String code) {
            this.code = code;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder normalizedName(String normalizedName) {
            this.normalizedName = normalizedName;
            return this;
        }

        public Builder attributes(Map<String, String> attributes) {
            this.attributes.clear();
            if (attributes != null) {
                this.attributes.putAll(attributes);
            }
            return this;
        }

        public Builder attribute(String key, String value) {
            if (value == null) {
                this.attributes.remove(key);
            } else {
                this.attributes.put(key, value);
            }
            return this;
        }

        public Builder processingLevel(ProcessingLevel processingLevel) {
            this.processingLevel = processingLevel;
            return this;
        }

        public Builder qualityScore(double qualityScore) {
            this.qualityScore = qualityScore;
            return this;
        }

        public Builder aiConfidence(double aiConfidence) {
            this.aiConfidence = aiConfidence;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder mergedCount(int mergedCount) {
            this.mergedCount = mergedCount;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        /**
         * Writes a field by name: {@code name}, {@code code} or an attribute key.
         */
        public Builder field(String field, String value) {
            switch (field) {
                case "name" -> this.name = value;
                case "code" -> this.code = value;
                default -> attribute(field, value);
            }
            return this;
        }

        public NormalizedRecord build() {
            Objects.requireNonNull(databaseKey, "databaseKey is required");
            Objects.requireNonNull(reference, "reference is required");
            if (qualityScore < 0.0 || qualityScore > 1.0) {
                throw new IllegalArgumentException("qualityScore must be between 0.0 and 1.0: " + qualityScore);
            }
            if (aiConfidence < 0.0 || aiConfidence > 1.0) {
                throw new IllegalArgumentException("aiConfidence must be between 0.0 and 1.0: " + aiConfidence);
            }
            if (mergedCount < 0) {
                throw new IllegalArgumentException("mergedCount must be >= 0");
            }
            return new NormalizedRecord(this);
        }
    }
}
