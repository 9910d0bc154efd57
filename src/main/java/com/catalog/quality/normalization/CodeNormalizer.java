package com.catalog.quality.normalization;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical form of item codes: no whitespace anywhere, upper case.
 */
public final class CodeNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern ALLOWED = Pattern.compile("[A-Z0-9А-ЯЁ._/\\-]*");

    private CodeNormalizer() {
    }

    public static String canonical(String code) {
        if (code == null) {
            return "";
        }
        return WHITESPACE.matcher(code).replaceAll("").toUpperCase(Locale.ROOT);
    }

    /**
     * True when the code is already canonical and uses only letters, digits and {@code . _ / -}.
     */
    public static boolean isWellFormed(String code) {
        return code != null && code.equals(canonical(code)) && ALLOWED.matcher(code).matches();
    }
}
