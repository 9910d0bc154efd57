package com.catalog.quality.normalization;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls domain fields out of a tag-structured payload such as
 * {@code <ИНН>7707083893</ИНН><КПП>773601001</КПП>}. Tag aliases map to canonical
 * attribute keys; unknown tags are ignored. The first occurrence of a key wins.
 */
public class AttributeExtractor {

    public static final String INN = "inn";
    public static final String KPP = "kpp";
    public static final String UNIT = "unit";
    public static final String ARTICLE = "article";

    private static final Pattern TAG = Pattern.compile(
            "<([\\p{L}\\w]+)[^>]*>\\s*([^<]*?)\\s*</\\1>", Pattern.UNICODE_CHARACTER_CLASS);

    private static final Map<String, String> DEFAULT_ALIASES = Map.ofEntries(
            Map.entry("инн", INN),
            Map.entry("inn", INN),
            Map.entry("кпп", KPP),
            Map.entry("kpp", KPP),
            Map.entry("единицаизмерения", UNIT),
            Map.entry("unit", UNIT),
            Map.entry("артикул", ARTICLE),
            Map.entry("article", ARTICLE));

    private final Map<String, String> aliases;

    public AttributeExtractor() {
        this(DEFAULT_ALIASES);
    }

    /**
     * @param aliases lower-cased tag name to attribute key
     */
    public AttributeExtractor(Map<String, String> aliases) {
        this.aliases = Map.copyOf(aliases);
    }

    public Map<String, String> extract(String payload) {
        Map<String, String> attributes = new LinkedHashMap<>();
        if (payload == null || payload.isBlank()) {
            return attributes;
        }
        Matcher matcher = TAG.matcher(payload);
        while (matcher.find()) {
            String key = aliases.get(matcher.group(1).toLowerCase());
            String value = matcher.group(2);
            if (key != null && !value.isEmpty()) {
                attributes.putIfAbsent(key, value);
            }
        }
        return attributes;
    }
}
