package com.catalog.quality.normalization;

import com.catalog.quality.core.model.NormalizedRecord;

/**
 * Default scorer rewarding filled and well-formed fields.
 *
 * <table>
 *   <caption>weights</caption>
 *   <tr><td>name present</td><td>0.30</td></tr>
 *   <tr><td>code present</td><td>0.25</td></tr>
 *   <tr><td>name at least 3 characters and not shouted</td><td>0.15</td></tr>
 *   <tr><td>code well-formed</td><td>0.10</td></tr>
 *   <tr><td>valid INN, or else unit/article present (0.10)</td><td>0.20</td></tr>
 * </table>
 *
 * An invalid INN or KPP costs the identifier share. AI confidence is always 0.
 */
public class CompletenessScorer implements RecordScorer {

    @Override
    public RecordScore score(NormalizedRecord record) {
        double score = 0.0;
        String name = record.getName();
        String code = record.getCode();
        if (!name.isBlank()) {
            score += 0.30;
            if (name.length() >= 3 && !isShouted(name)) {
                score += 0.15;
            }
        }
        if (!code.isBlank()) {
            score += 0.25;
            if (CodeNormalizer.isWellFormed(code)) {
                score += 0.10;
            }
        }
        score += identifierShare(record);
        return new RecordScore(Math.min(1.0, round(score)), 0.0);
    }

    private static double identifierShare(NormalizedRecord record) {
        String inn = record.getAttribute(AttributeExtractor.INN);
        String kpp = record.getAttribute(AttributeExtractor.KPP);
        if (inn != null && !IdentifierValidator.isValidInn(inn)) {
            return 0.0;
        }
        if (kpp != null && !IdentifierValidator.isValidKpp(kpp)) {
            return 0.0;
        }
        if (inn != null) {
            return 0.20;
        }
        boolean described = record.getAttribute(AttributeExtractor.UNIT) != null
                || record.getAttribute(AttributeExtractor.ARTICLE) != null;
        return described ? 0.10 : 0.0;
    }

    static boolean isShouted(String name) {
        long letters = name.chars().filter(Character::isLetter).count();
        return letters > 3 && name.equals(name.toUpperCase()) && !name.equals(name.toLowerCase());
    }

    private static double round(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
