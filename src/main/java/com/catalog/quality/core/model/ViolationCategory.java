package com.catalog.quality.core.model;

public enum ViolationCategory {
    COMPLETENESS("completeness"),
    ACCURACY("accuracy"),
    CONSISTENCY("consistency"),
    FORMAT("format");

    private final String wireName;

    ViolationCategory(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static ViolationCategory fromWireName(String value) {
        for (ViolationCategory category : values()) {
            if (category.wireName.equalsIgnoreCase(value) || category.name().equalsIgnoreCase(value)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown violation category: " + value);
    }
}
