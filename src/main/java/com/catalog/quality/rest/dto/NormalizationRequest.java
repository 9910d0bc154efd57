package com.catalog.quality.rest.dto;

import com.catalog.quality.api.NormalizationScope;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of start and stop calls. {@code all_active} targets the active databases of the project;
 * otherwise {@code database_path} names one database.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NormalizationRequest(
        @JsonProperty("all_active") boolean allActive,
        @JsonProperty("database_path") String databasePath,
        @JsonProperty("project_id") String projectId
) {

    /**
     * @param globalWhenEmpty an empty request means every database (stop) instead of an error (start)
     */
    public NormalizationScope toScope(boolean globalWhenEmpty) {
        if (allActive) {
            return NormalizationScope.allActive(projectId);
        }
        if (databasePath != null && !databasePath.isBlank()) {
            return NormalizationScope.database(databasePath);
        }
        if (projectId != null && !projectId.isBlank()) {
            return NormalizationScope.allActive(projectId);
        }
        return globalWhenEmpty ? NormalizationScope.global() : NormalizationScope.database(databasePath);
    }
}
