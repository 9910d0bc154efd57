package com.catalog.quality.rest.dto;

import com.catalog.quality.api.Page;
import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Paginated listing. The items are serialized under a collection-specific name such as
 * {@code groups} or {@code violations}.
 */
public record ListResponse<T>(
        @JsonIgnore String itemsName,
        @JsonIgnore List<T> items,
        @JsonProperty("total") long total,
        @JsonProperty("limit") int limit,
        @JsonProperty("offset") int offset
) {
    public static <S, T> ListResponse<T> from(String itemsName, Page<S> page, Function<S, T> mapper) {
        return new ListResponse<>(itemsName, page.items().stream().map(mapper).toList(),
                page.total(), page.limit(), page.offset());
    }

    @JsonAnyGetter
    public Map<String, Object> namedItems() {
        return Map.of(itemsName, items);
    }
}
