package com.catalog.quality.normalization;

/**
 * Russian taxpayer identifiers: INN with its official check digits, KPP by shape.
 */
public final class IdentifierValidator {

    private static final int[] INN10 = {2, 4, 10, 3, 5, 9, 4, 6, 8};
    private static final int[] INN12_FIRST = {7, 2, 4, 10, 3, 5, 9, 4, 6, 8};
    private static final int[] INN12_SECOND = {3, 7, 2, 4, 10, 3, 5, 9, 4, 6, 8};

    private IdentifierValidator() {
    }

    public static boolean isValidInn(String inn) {
        if (inn == null || !inn.matches("\\d{10}|\\d{12}")) {
            return false;
        }
        int[] digits = inn.chars().map(c -> c - '0').toArray();
        if (digits.length == 10) {
            return checkDigit(digits, INN10) == digits[9];
        }
        return checkDigit(digits, INN12_FIRST) == digits[10]
                && checkDigit(digits, INN12_SECOND) == digits[11];
    }

    public static boolean isValidKpp(String kpp) {
        return kpp != null && kpp.matches("\\d{9}");
    }

    private static int checkDigit(int[] digits, int[] weights) {
        int sum = 0;
        for (int i = 0; i < weights.length; i++) {
            sum += digits[i] * weights[i];
        }
        return sum % 11 % 10;
    }
}
