package com.catalog.quality.normalization;

import java.util.List;

/**
 * Built-in name rules for Russian and international catalog names.
 */
public final class DefaultNameRules {

    private static final String LEGAL_FORMS = "ООО|ОАО|ЗАО|ПАО|АО|ИП|LLC|Ltd\\.?|Inc\\.?|GmbH";

    private DefaultNameRules() {
    }

    public static List<NameRule> canonicalRules() {
        return List.of(
                NameRule.builder()
                        .name("quotes")
                        .pattern("[«»“”„\"]")
                        .replacement("\"")
                        .priority(10)
                        .build(),
                NameRule.builder()
                        .name("apostrophes")
                        .pattern("[‘’`]")
                        .replacement("'")
                        .priority(10)
                        .build(),
                NameRule.builder()
                        .name("whitespace")
                        .pattern("[\\s\\u00A0]+")
                        .replacement(" ")
                        .priority(20)
                        .build(),
                NameRule.builder()
                        .name("leading-punctuation")
                        .pattern("^[\\s,;:.\\-_*]+")
                        .priority(30)
                        .build(),
                NameRule.builder()
                        .name("trailing-punctuation")
                        .pattern("[\\s,;:\\-_*]+$")
                        .priority(30)
                        .build());
    }

    /**
     * Strips legal forms as standalone tokens, and the quotes that usually wrap the brand
     * after them ({@code ООО "Ромашка"}).
     */
    public static List<NameRule> legalFormRules() {
        return List.of(
                NameRule.builder()
                        .name("legal-form")
                        .pattern("(?<![\\w])(" + LEGAL_FORMS + ")(?![\\w])")
                        .replacement(" ")
                        .priority(10)
                        .build(),
                NameRule.builder()
                        .name("quotes-after-legal-form")
                        .pattern("[\"']")
                        .replacement(" ")
                        .priority(20)
                        .build(),
                NameRule.builder()
                        .name("separators")
                        .pattern("^[\\s,.]+|[\\s,]+$")
                        .priority(30)
                        .build());
    }
}
