package com.catalog.quality.core.model;

import com.catalog.quality.duplicate.DetectionMethod;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A cluster of normalized records believed to denote the same real-world entity.
 *
 * <p>The group holds member ids and one designated master id; records never
 * point back to their group. {@code merged} moves one way, false to true,
 * and a merged group is never modified again.</p>
 */
public final class DuplicateGroup {
    private final long id;
    private final String databaseKey;
    private final DetectionMethod detectionMethod;
    private final double similarityScore;
    private final long suggestedMasterId;
    private final List<Long> memberIds;
    private final boolean merged;
    private final Instant mergedAt;
    private final Instant createdAt;

    private DuplicateGroup(Builder builder) {
        this.id = builder.id;
        this.databaseKey = builder.databaseKey;
        this.detectionMethod = builder.detectionMethod;
        this.similarityScore = builder.similarityScore;
        this.suggestedMasterId = builder.suggestedMasterId;
        this.memberIds = List.copyOf(builder.memberIds);
        this.merged = builder.merged;
        this.mergedAt = builder.mergedAt;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
    }

    public long getId() {
        return id;
    }

    public String getDatabaseKey() {
        return databaseKey;
    }

    public DetectionMethod getDetectionMethod() {
        return detectionMethod;
    }

    public double getSimilarityScore() {
        return similarityScore;
    }

    public long getSuggestedMasterId() {
        return suggestedMasterId;
    }

    public List<Long> getMemberIds() {
        return memberIds;
    }

    public int getItemCount() {
        return memberIds.size();
    }

    public boolean isMerged() {
        return merged;
    }

    public Instant getMergedAt() {
        return mergedAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * Returns a copy of this group marked as merged at the given instant.
     *
     * @throws IllegalStateException if the group is already merged
     */
    public DuplicateGroup markMerged(Instant at) {
        if (merged) {
            throw new IllegalStateException("Duplicate group already merged: " + id);
        }
        return toBuilder().merged(true).mergedAt(at).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .databaseKey(databaseKey)
                .detectionMethod(detectionMethod)
                .similarityScore(similarityScore)
                .suggestedMasterId(suggestedMasterId)
                .memberIds(memberIds)
                .merged(merged)
                .mergedAt(mergedAt)
                .createdAt(createdAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id == ((DuplicateGroup) o).id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return "DuplicateGroup{" +
                "id=" + id +
                ", databaseKey='" + databaseKey + '\'' +
                ", method=" + detectionMethod +
                ", score=" + similarityScore +
                ", master=" + suggestedMasterId +
                ", members=" + memberIds +
                ", merged=" + merged +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private long id;
        private String databaseKey;
        private DetectionMethod detectionMethod;
        private double similarityScore;
        private long suggestedMasterId;
        private List<Long> memberIds = List.of();
        private boolean merged;
        private Instant mergedAt;
        private Instant createdAt;

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder databaseKey(String databaseKey) {
            this.databaseKey = databaseKey;
            return this;
        }

        public Builder detectionMethod(DetectionMethod detectionMethod) {
            this.detectionMethod = detectionMethod;
            return this;
        }

        public Builder similarityScore(double similarityScore) {
            this.similarityScore = similarityScore;
            return this;
        }

        public Builder suggestedMasterId(long suggestedMasterId) {
            this.suggestedMasterId = suggestedMasterId;
            return this;
        }

        public Builder memberIds(List<Long> memberIds) {
            this.memberIds = memberIds;
            return this;
        }

        public Builder merged(boolean merged) {
            this.merged = merged;
            return this;
        }

        public Builder mergedAt(Instant mergedAt) {
            this.mergedAt = mergedAt;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public DuplicateGroup build() {
            Objects.requireNonNull(databaseKey, "databaseKey is required");
            Objects.requireNonNull(detectionMethod, "detectionMethod is required");
            Objects.requireNonNull(memberIds, "memberIds is required");
            if (similarityScore < 0.0 || similarityScore > 1.0) {
                throw new IllegalArgumentException("similarityScore must be between 0.0 and 1.0: " + similarityScore);
            }
            if (memberIds.size() < 2) {
                throw new IllegalArgumentException("A duplicate group needs at least two members");
            }
            if (!memberIds.contains(suggestedMasterId)) {
                throw new IllegalArgumentException("suggestedMasterId must be a member: " + suggestedMasterId);
            }
            return new DuplicateGroup(this);
        }
    }
}
