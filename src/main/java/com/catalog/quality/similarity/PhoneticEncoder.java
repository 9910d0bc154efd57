package com.catalog.quality.similarity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Soundex-style encoder covering Cyrillic and Latin letters.
 *
 * <p>Codes are four characters: the upper-cased first letter followed by three digits,
 * zero padded. Adjacent letters with the same digit collapse; letters mapping to 0 are
 * skipped but break a run of equal digits.</p>
 */
public final class PhoneticEncoder {

    private static final int CODE_LENGTH = 4;

    private PhoneticEncoder() {
    }

    public static String encode(String word) {
        if (word == null) {
            return "";
        }
        String upper = word.toUpperCase(Locale.ROOT);
        int start = 0;
        while (start < upper.length() && digit(upper.charAt(start)) < 0) {
            start++;
        }
        if (start == upper.length()) {
            return "";
        }
        StringBuilder code = new StringBuilder(CODE_LENGTH);
        char first = upper.charAt(start);
        code.append(first);
        int previous = digit(first);
        for (int i = start + 1; i < upper.length() && code.length() < CODE_LENGTH; i++) {
            int d = digit(upper.charAt(i));
            if (d < 0) {
                continue;
            }
            if (d != 0 && d != previous) {
                code.append((char) ('0' + d));
            }
            previous = d;
        }
        while (code.length() < CODE_LENGTH) {
            code.append('0');
        }
        return code.toString();
    }

    /**
     * Encodes every whitespace-separated token and returns the codes sorted,
     * so that two names compare as multisets.
     */
    public static List<String> encodeTokens(String text) {
        List<String> codes = new ArrayList<>();
        if (text == null) {
            return codes;
        }
        for (String token : text.trim().split("\\s+")) {
            String code = encode(token);
            if (!code.isEmpty()) {
                codes.add(code);
            }
        }
        Collections.sort(codes);
        return codes;
    }

    /**
     * Digit for a letter, 0 for vowels and signs, -1 for anything that is not a letter we know.
     */
    static int digit(char c) {
        switch (c) {
            // Latin
            case 'A': case 'E': case 'I': case 'O': case 'U': case 'Y': case 'H': case 'W':
                return 0;
            case 'B': case 'F': case 'P': case 'V':
                return 1;
            case 'C': case 'G': case 'J': case 'K': case 'Q': case 'S': case 'X': case 'Z':
                return 2;
            case 'D': case 'T':
                return 3;
            case 'L':
                return 4;
            case 'M': case 'N':
                return 5;
            case 'R':
                return 6;
            // Cyrillic
            case 'А': case 'Е': case 'Ё': case 'И': case 'О': case 'У': case 'Ы': case 'Э': case 'Ю': case 'Я':
            case 'Ь': case 'Ъ':
                return 0;
            case 'Б': case 'П': case 'Ф': case 'В':
                return 1;
            case 'Г': case 'К': case 'Х':
                return 2;
            case 'Д': case 'Т':
                return 3;
            case 'Ж': case 'Ш': case 'Щ': case 'Ч':
                return 4;
            case 'З': case 'С': case 'Ц':
                return 5;
            case 'Л':
                return 6;
            case 'М': case 'Н':
                return 7;
            case 'Р':
                return 8;
            case 'Й':
                return 9;
            default:
                return -1;
        }
    }
}
