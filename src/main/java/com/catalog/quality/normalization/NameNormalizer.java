package com.catalog.quality.normalization;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Produces the two name forms of a record.
 *
 * <ul>
 *   <li>{@link #canonical(String)}: the display name, with quotes unified, whitespace collapsed
 *       and surrounding punctuation removed. Case is preserved.</li>
 *   <li>{@link #matchKey(String)}: the canonical name with legal-form tokens stripped,
 *       lower-cased. Exact-name duplicate detection compares these keys.</li>
 * </ul>
 */
public class NameNormalizer {
    private static final Logger log = LoggerFactory.getLogger(NameNormalizer.class);

    private final List<NameRule> canonicalRules;
    private final List<NameRule> keyRules;

    public NameNormalizer(List<NameRule> canonicalRules, List<NameRule> keyRules) {
        this.canonicalRules = sorted(canonicalRules);
        this.keyRules = sorted(keyRules);
    }

    public static NameNormalizer defaults() {
        return new NameNormalizer(DefaultNameRules.canonicalRules(), DefaultNameRules.legalFormRules());
    }

    public String canonical(String name) {
        if (name == null || name.isBlank()) {
            return "";
        }
        return collapse(applyAll(canonicalRules, name));
    }

    public String matchKey(String name) {
        String canonical = canonical(name);
        if (canonical.isEmpty()) {
            return "";
        }
        String stripped = collapse(applyAll(keyRules, canonical));
        // a name made only of a legal form keeps it as the key
        return (stripped.isEmpty() ? canonical : stripped).toLowerCase(Locale.ROOT);
    }

    public List<NameRule> rules() {
        List<NameRule> all = new ArrayList<>(canonicalRules);
        all.addAll(keyRules);
        return List.copyOf(all);
    }

    private static String applyAll(List<NameRule> rules, String input) {
        String result = input;
        for (NameRule rule : rules) {
            String before = result;
            result = rule.apply(result);
            if (log.isTraceEnabled() && !before.equals(result)) {
                log.trace("name.rule.applied rule={} before='{}' after='{}'", rule.getName(), before, result);
            }
        }
        return result;
    }

    private static String collapse(String value) {
        return value.trim().replaceAll("\\s+", " ");
    }

    private static List<NameRule> sorted(List<NameRule> rules) {
        List<NameRule> copy = new ArrayList<>(rules);
        copy.sort(Comparator.comparingInt(NameRule::getPriority));
        return List.copyOf(copy);
    }
}
