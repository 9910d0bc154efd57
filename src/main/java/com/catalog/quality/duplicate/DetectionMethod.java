package com.catalog.quality.duplicate;

import com.catalog.quality.core.model.NormalizedRecord;
import com.catalog.quality.similarity.CompositeSimilarity;
import com.catalog.quality.similarity.JaroWinklerSimilarity;
import com.catalog.quality.similarity.PhoneticEncoder;
import com.catalog.quality.similarity.StringSimilarity;
import com.catalog.quality.similarity.TokenSetSimilarity;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Duplicate detection strategies in precedence order. {@link #MIXED} never matches on its
 * own; it tags a pair that more than one fuzzy strategy matched.
 */
public enum DetectionMethod {

    EXACT_CODE("exact_code") {
        @Override
        public StrategyMatch score(NormalizedRecord a, NormalizedRecord b, DetectionThresholds thresholds) {
            return !a.getCode().isEmpty() && a.getCode().equals(b.getCode()) ? StrategyMatch.of(1.0) : StrategyMatch.none();
        }
    },

    EXACT_NAME("exact_name") {
        @Override
        public StrategyMatch score(NormalizedRecord a, NormalizedRecord b, DetectionThresholds thresholds) {
            String key = a.getNormalizedName();
            return !key.isEmpty() && key.equals(b.getNormalizedName()) ? StrategyMatch.of(1.0) : StrategyMatch.none();
        }
    },

    SEMANTIC("semantic") {
        @Override
        public StrategyMatch score(NormalizedRecord a, NormalizedRecord b, DetectionThresholds thresholds) {
            if (!comparable(a, b)) {
                return StrategyMatch.none();
            }
            double score = Measures.COMPOSITE.compute(a.getNormalizedName(), b.getNormalizedName());
            return score >= thresholds.semantic() ? StrategyMatch.of(score) : StrategyMatch.none();
        }
    },

    PHONETIC("phonetic") {
        @Override
        public StrategyMatch score(NormalizedRecord a, NormalizedRecord b, DetectionThresholds thresholds) {
            if (!comparable(a, b)) {
                return StrategyMatch.none();
            }
            List<String> left = PhoneticEncoder.encodeTokens(a.getNormalizedName());
            if (left.isEmpty() || !left.equals(PhoneticEncoder.encodeTokens(b.getNormalizedName()))) {
                return StrategyMatch.none();
            }
            return StrategyMatch.of(Measures.JARO_WINKLER.compute(a.getNormalizedName(), b.getNormalizedName()));
        }
    },

    WORD_BASED("word_based") {
        @Override
        public StrategyMatch score(NormalizedRecord a, NormalizedRecord b, DetectionThresholds thresholds) {
            if (!comparable(a, b)) {
                return StrategyMatch.none();
            }
            double score = Measures.TOKENS.compute(a.getNormalizedName(), b.getNormalizedName());
            return score >= thresholds.wordBased() ? StrategyMatch.of(score) : StrategyMatch.none();
        }
    },

    MIXED("mixed") {
        @Override
        public StrategyMatch score(NormalizedRecord a, NormalizedRecord b, DetectionThresholds thresholds) {
            return StrategyMatch.none();
        }
    };

    private final String wireName;

    DetectionMethod(String wireName) {
        this.wireName = wireName;
    }

    public abstract StrategyMatch score(NormalizedRecord a, NormalizedRecord b, DetectionThresholds thresholds);

    public String wireName() {
        return wireName;
    }

    /**
     * Tags a record pair: the first exact strategy that matches wins; otherwise one matching
     * fuzzy strategy keeps its own tag and several become {@link #MIXED} with the best score.
     */
    public static Optional<PairMatch> classify(NormalizedRecord a, NormalizedRecord b, DetectionThresholds thresholds) {
        for (DetectionMethod method : List.of(EXACT_CODE, EXACT_NAME)) {
            StrategyMatch match = method.score(a, b, thresholds);
            if (match.matched()) {
                return Optional.of(new PairMatch(method, match.score()));
            }
        }
        List<PairMatch> fuzzy = new ArrayList<>();
        for (DetectionMethod method : List.of(SEMANTIC, PHONETIC, WORD_BASED)) {
            StrategyMatch match = method.score(a, b, thresholds);
            if (match.matched()) {
                fuzzy.add(new PairMatch(method, match.score()));
            }
        }
        if (fuzzy.isEmpty()) {
            return Optional.empty();
        }
        if (fuzzy.size() == 1) {
            return Optional.of(fuzzy.get(0));
        }
        double best = fuzzy.stream().mapToDouble(PairMatch::score).max().orElse(0.0);
        return Optional.of(new PairMatch(MIXED, best));
    }

    public static DetectionMethod fromWireName(String value) {
        for (DetectionMethod method : values()) {
            if (method.wireName.equalsIgnoreCase(value) || method.name().equalsIgnoreCase(value)) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unknown detection method: " + value);
    }

    private static boolean comparable(NormalizedRecord a, NormalizedRecord b) {
        return !a.getNormalizedName().isEmpty() && !b.getNormalizedName().isEmpty();
    }

    public record PairMatch(DetectionMethod method, double score) {
    }

    private static final class Measures {
        static final StringSimilarity COMPOSITE = new CompositeSimilarity();
        static final StringSimilarity JARO_WINKLER = new JaroWinklerSimilarity();
        static final StringSimilarity TOKENS = new TokenSetSimilarity();
    }
}
