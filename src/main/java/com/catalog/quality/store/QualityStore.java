package com.catalog.quality.store;

import com.catalog.quality.core.model.DuplicateGroup;
import com.catalog.quality.core.model.Suggestion;
import com.catalog.quality.core.model.Violation;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Shared store of analysis results. Ids are unique across all databases and every
 * listing is sorted by id.
 */
public interface QualityStore {

    /**
     * Stores a new group and returns it with its assigned id.
     */
    DuplicateGroup insertGroup(DuplicateGroup group);

    Optional<DuplicateGroup> findGroup(long id);

    DuplicateGroup updateGroup(DuplicateGroup group);

    List<DuplicateGroup> groups(Predicate<DuplicateGroup> filter);

    Violation insertViolation(Violation violation);

    Optional<Violation> findViolation(long id);

    Violation updateViolation(Violation violation);

    List<Violation> violations(Predicate<Violation> filter);

    Suggestion insertSuggestion(Suggestion suggestion);

    Optional<Suggestion> findSuggestion(long id);

    Suggestion updateSuggestion(Suggestion suggestion);

    List<Suggestion> suggestions(Predicate<Suggestion> filter);
}
