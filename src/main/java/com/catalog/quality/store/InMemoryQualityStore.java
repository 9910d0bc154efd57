package com.catalog.quality.store;

import com.catalog.quality.core.model.DuplicateGroup;
import com.catalog.quality.core.model.Suggestion;
import com.catalog.quality.core.model.Violation;
import com.catalog.quality.error.NotFoundException;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * Thread-safe {@link QualityStore} on sorted concurrent maps.
 */
public class InMemoryQualityStore implements QualityStore {

    private final ConcurrentSkipListMap<Long, DuplicateGroup> groups = new ConcurrentSkipListMap<>();
    private final ConcurrentSkipListMap<Long, Violation> violations = new ConcurrentSkipListMap<>();
    private final ConcurrentSkipListMap<Long, Suggestion> suggestions = new ConcurrentSkipListMap<>();
    private final AtomicLong groupIds = new AtomicLong();
    private final AtomicLong violationIds = new AtomicLong();
    private final AtomicLong suggestionIds = new AtomicLong();

    @Override
    public DuplicateGroup insertGroup(DuplicateGroup group) {
        DuplicateGroup stored = group.toBuilder().id(groupIds.incrementAndGet()).build();
        groups.put(stored.getId(), stored);
        return stored;
    }

    @Override
    public Optional<DuplicateGroup> findGroup(long id) {
        return Optional.ofNullable(groups.get(id));
    }

    @Override
    public DuplicateGroup updateGroup(DuplicateGroup group) {
        return replace(groups, group.getId(), group, "Duplicate group");
    }

    @Override
    public List<DuplicateGroup> groups(Predicate<DuplicateGroup> filter) {
        return groups.values().stream().filter(filter).toList();
    }

    @Override
    public Violation insertViolation(Violation violation) {
        Violation stored = violation.toBuilder().id(violationIds.incrementAndGet()).build();
        violations.put(stored.getId(), stored);
        return stored;
    }

    @Override
    public Optional<Violation> findViolation(long id) {
        return Optional.ofNullable(violations.get(id));
    }

    @Override
    public Violation updateViolation(Violation violation) {
        return replace(violations, violation.getId(), violation, "Violation");
    }

    @Override
    public List<Violation> violations(Predicate<Violation> filter) {
        return violations.values().stream().filter(filter).toList();
    }

    @Override
    public Suggestion insertSuggestion(Suggestion suggestion) {
        Suggestion stored = suggestion.toBuilder().id(suggestionIds.incrementAndGet()).build();
        suggestions.put(stored.getId(), stored);
        return stored;
    }

    @Override
    public Optional<Suggestion> findSuggestion(long id) {
        return Optional.ofNullable(suggestions.get(id));
    }

    @Override
    public Suggestion updateSuggestion(Suggestion suggestion) {
        return replace(suggestions, suggestion.getId(), suggestion, "Suggestion");
    }

    @Override
    public List<Suggestion> suggestions(Predicate<Suggestion> filter) {
        return suggestions.values().stream().filter(filter).toList();
    }

    private static <T> T replace(ConcurrentSkipListMap<Long, T> map, long id, T value, String what) {
        T replaced = map.computeIfPresent(id, (k, old) -> value);
        if (replaced == null) {
            throw NotFoundException.of(what, id);
        }
        return replaced;
    }
}
