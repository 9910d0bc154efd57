package com.catalog.quality.violation;

import com.catalog.quality.core.model.NormalizedRecord;
import com.catalog.quality.core.model.ProcessingLevel;
import com.catalog.quality.core.model.Severity;
import com.catalog.quality.core.model.ViolationCategory;
import com.catalog.quality.normalization.AttributeExtractor;
import com.catalog.quality.normalization.CodeNormalizer;
import com.catalog.quality.normalization.IdentifierValidator;

import java.util.List;
import java.util.regex.Pattern;

/**
 * The fixed rule catalogue. Rules look at one record at a time.
 */
public final class ViolationRules {

    public static final String NAME_REQUIRED = "name_required";
    public static final String CODE_REQUIRED = "code_required";
    public static final String NAME_TOO_SHORT = "name_too_short";
    public static final String NAME_WHITESPACE = "name_whitespace";
    public static final String NAME_ALL_CAPS = "name_all_caps";
    public static final String CODE_FORMAT = "code_format";
    public static final String INN_INVALID = "inn_invalid";
    public static final String KPP_INVALID = "kpp_invalid";
    public static final String LOW_QUALITY_SCORE = "low_quality_score";
    public static final String BENCHMARK_INCONSISTENT = "benchmark_inconsistent";
    public static final String AI_LOW_CONFIDENCE = "ai_low_confidence";

    static final int MIN_NAME_LENGTH = 3;
    static final double LOW_QUALITY = 0.5;
    static final double BENCHMARK = 0.9;
    static final double LOW_AI_CONFIDENCE = 0.7;

    private static final Pattern MESSY_WHITESPACE = Pattern.compile("^\\s|\\s$|\\s{2,}");

    private ViolationRules() {
    }

    public static List<ViolationRule> catalogue() {
        return List.of(
                ViolationRule.builder()
                        .name(NAME_REQUIRED)
                        .category(ViolationCategory.COMPLETENESS)
                        .severity(Severity.CRITICAL)
                        .field("name")
                        .violatedBy(r -> r.getName().isBlank())
                        .message("Field '{field}' is empty")
                        .recommendation("Fill in the item name from the source system")
                        .build(),
                ViolationRule.builder()
                        .name(CODE_REQUIRED)
                        .category(ViolationCategory.COMPLETENESS)
                        .severity(Severity.ERROR)
                        .field("code")
                        .violatedBy(r -> r.getCode().isBlank())
                        .message("Field '{field}' is empty")
                        .recommendation("Assign a code to the item")
                        .build(),
                ViolationRule.builder()
                        .name(NAME_TOO_SHORT)
                        .category(ViolationCategory.ACCURACY)
                        .severity(Severity.WARNING)
                        .field("name")
                        .violatedBy(r -> !r.getName().isBlank() && r.getName().trim().length() < MIN_NAME_LENGTH)
                        .message("Name '{value}' is shorter than " + MIN_NAME_LENGTH + " characters")
                        .recommendation("Use the full item name")
                        .build(),
                ViolationRule.builder()
                        .name(NAME_WHITESPACE)
                        .category(ViolationCategory.FORMAT)
                        .severity(Severity.INFO)
                        .field("name")
                        .violatedBy(r -> MESSY_WHITESPACE.matcher(r.getName()).find())
                        .message("Name '{value}' has leading, trailing or repeated spaces")
                        .recommendation("Trim the name and collapse repeated spaces")
                        .build(),
                ViolationRule.builder()
                        .name(NAME_ALL_CAPS)
                        .category(ViolationCategory.FORMAT)
                        .severity(Severity.INFO)
                        .field("name")
                        .violatedBy(r -> isAllCaps(r.getName()))
                        .message("Name '{value}' is written in capitals")
                        .recommendation("Write the name in regular case")
                        .build(),
                ViolationRule.builder()
                        .name(CODE_FORMAT)
                        .category(ViolationCategory.FORMAT)
                        .severity(Severity.WARNING)
                        .field("code")
                        .violatedBy(r -> !r.getCode().isBlank() && !CodeNormalizer.isWellFormed(r.getCode()))
                        .message("Code '{value}' is not in canonical form")
                        .recommendation("Remove spaces, use upper case letters, digits and . _ / - only")
                        .build(),
                ViolationRule.builder()
                        .name(INN_INVALID)
                        .category(ViolationCategory.ACCURACY)
                        .severity(Severity.ERROR)
                        .field(AttributeExtractor.INN)
                        .violatedBy(r -> r.getAttribute(AttributeExtractor.INN) != null
                                && !IdentifierValidator.isValidInn(r.getAttribute(AttributeExtractor.INN)))
                        .message("INN '{value}' fails the checksum")
                        .recommendation("Check the INN against the registration documents")
                        .build(),
                ViolationRule.builder()
                        .name(KPP_INVALID)
                        .category(ViolationCategory.FORMAT)
                        .severity(Severity.WARNING)
                        .field(AttributeExtractor.KPP)
                        .violatedBy(r -> r.getAttribute(AttributeExtractor.KPP) != null
                                && !IdentifierValidator.isValidKpp(r.getAttribute(AttributeExtractor.KPP)))
                        .message("KPP '{value}' is not 9 digits")
                        .recommendation("Check the KPP against the registration documents")
                        .build(),
                ViolationRule.builder()
                        .name(LOW_QUALITY_SCORE)
                        .category(ViolationCategory.ACCURACY)
                        .severity(Severity.WARNING)
                        .field("quality_score")
                        .violatedBy(r -> r.getQualityScore() < LOW_QUALITY)
                        .message("Quality score {value} is below " + LOW_QUALITY)
                        .recommendation("Complete the missing fields and normalize again")
                        .build(),
                ViolationRule.builder()
                        .name(BENCHMARK_INCONSISTENT)
                        .category(ViolationCategory.CONSISTENCY)
                        .severity(Severity.ERROR)
                        .field("processing_level")
                        .violatedBy(r -> r.getProcessingLevel() == ProcessingLevel.BENCHMARK
                                && r.getQualityScore() < BENCHMARK)
                        .message("Record is at level '{value}' but its quality score is below " + BENCHMARK)
                        .recommendation("Normalize the record again to recompute its level")
                        .build(),
                ViolationRule.builder()
                        .name(AI_LOW_CONFIDENCE)
                        .category(ViolationCategory.CONSISTENCY)
                        .severity(Severity.INFO)
                        .field("ai_confidence")
                        .violatedBy(r -> r.getProcessingLevel() == ProcessingLevel.AI_ENHANCED
                                && r.getAiConfidence() < LOW_AI_CONFIDENCE)
                        .message("AI confidence {value} is below " + LOW_AI_CONFIDENCE)
                        .recommendation("Review the AI enhancement by hand")
                        .build());
    }

    /**
     * Current value of the field a rule looks at, as shown in the violation.
     */
    static String valueOf(NormalizedRecord record, String field) {
        return switch (field) {
            case "quality_score" -> Double.toString(record.getQualityScore());
            case "ai_confidence" -> Double.toString(record.getAiConfidence());
            case "processing_level" -> record.getProcessingLevel().wireName();
            default -> record.fieldValue(field);
        };
    }

    static boolean isAllCaps(String name) {
        long letters = name.chars().filter(Character::isLetter).count();
        return letters > 3 && name.equals(name.toUpperCase()) && !name.equals(name.toLowerCase());
    }
}
