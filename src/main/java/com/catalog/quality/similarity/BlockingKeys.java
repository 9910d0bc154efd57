package com.catalog.quality.similarity;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Candidate blocking for fuzzy duplicate strategies. Two records are compared only
 * when they share at least one key.
 *
 * <ul>
 *   <li>{@code p:} first three characters</li>
 *   <li>{@code t:} the two alphabetically smallest tokens</li>
 *   <li>{@code w:} each token of four or more characters</li>
 *   <li>{@code s:} sorted phonetic codes of all tokens</li>
 * </ul>
 */
public final class BlockingKeys {

    private BlockingKeys() {
    }

    public static Set<String> of(String normalizedName) {
        Set<String> keys = new LinkedHashSet<>();
        if (normalizedName == null || normalizedName.isBlank()) {
            return keys;
        }
        String name = normalizedName.trim().toLowerCase();
        keys.add("p:" + name.substring(0, Math.min(3, name.length())));

        String[] tokens = name.split("\\s+");
        String[] sorted = Arrays.copyOf(tokens, tokens.length);
        Arrays.sort(sorted);
        keys.add(sorted.length >= 2 ? "t:" + sorted[0] + "|" + sorted[1] : "t:" + sorted[0]);
        for (String token : tokens) {
            if (token.length() >= 4) {
                keys.add("w:" + token);
            }
        }

        List<String> phonetic = PhoneticEncoder.encodeTokens(name);
        if (!phonetic.isEmpty()) {
            keys.add("s:" + String.join("|", phonetic));
        }
        return keys;
    }
}
