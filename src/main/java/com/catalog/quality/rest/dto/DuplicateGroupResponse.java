package com.catalog.quality.rest.dto;

import com.catalog.quality.core.model.DuplicateGroup;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record DuplicateGroupResponse(
        @JsonProperty("id") long id,
        @JsonProperty("database") String database,
        @JsonProperty("detection_method") String detectionMethod,
        @JsonProperty("similarity_score") double similarityScore,
        @JsonProperty("suggested_master_id") long suggestedMasterId,
        @JsonProperty("item_count") int itemCount,
        @JsonProperty("member_ids") List<Long> memberIds,
        @JsonProperty("merged") boolean merged,
        @JsonProperty("merged_at") String mergedAt,
        @JsonProperty("created_at") String createdAt
) {
    public static DuplicateGroupResponse from(DuplicateGroup group) {
        return new DuplicateGroupResponse(group.getId(), group.getDatabaseKey(),
                group.getDetectionMethod().wireName(), group.getSimilarityScore(), group.getSuggestedMasterId(),
                group.getItemCount(), group.getMemberIds(), group.isMerged(),
                Timestamps.iso(group.getMergedAt()), Timestamps.iso(group.getCreatedAt()));
    }
}
