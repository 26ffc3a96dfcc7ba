package com.tx.insights.matching;

/**
 * GS1 check-digit validation for GTIN-8, GTIN-12, GTIN-13 and GTIN-14.
 *
 * <p>Weights alternate 3 and 1 starting from the digit left of the check digit.
 * The check digit is {@code (10 - sum % 10) % 10}.
 */
public final class GtinValidator {

    private GtinValidator() {
    }

    /**
     * Returns true when the code has a valid GTIN length and check digit.
     * Spaces and hyphens are ignored; any other non-digit makes the code invalid.
     */
    public static boolean isValid(String code) {
        String digits = digitsOnly(code);
        if (digits == null) {
            return false;
        }
        int length = digits.length();
        if (length != 8 && length != 12 && length != 13 && length != 14) {
            return false;
        }
        int expected = checkDigit(digits.substring(0, length - 1));
        return digits.charAt(length - 1) - '0' == expected;
    }

    /**
     * Computes the check digit for a GTIN body (all digits except the check digit).
     */
    public static int checkDigit(String body) {
        int sum = 0;
        boolean weightThree = true;
        for (int i = body.length() - 1; i >= 0; i--) {
            char c = body.charAt(i);
            if (c < '0' || c > '9') {
                throw new IllegalArgumentException("GTIN body must contain digits only: " + body);
            }
            int digit = c - '0';
            sum += weightThree ? digit * 3 : digit;
            weightThree = !weightThree;
        }
        return (10 - sum % 10) % 10;
    }

    /**
     * True when the value looks like a GTIN attempt: 8 to 14 digits once spaces and hyphens
     * are removed. Says nothing about the checksum.
     */
    public static boolean looksLikeGtin(String value) {
        String digits = digitsOnly(value);
        return digits != null && digits.length() >= 8 && digits.length() <= 14;
    }

    /**
     * Canonical comparison form: digits with leading zeros stripped, so a GTIN-12 and its
     * zero-padded GTIN-13 compare equal. Returns null for values that are not digit strings.
     */
    public static String canonical(String code) {
        String digits = digitsOnly(code);
        if (digits == null) {
            return null;
        }
        int i = 0;
        while (i < digits.length() - 1 && digits.charAt(i) == '0') {
            i++;
        }
        return digits.substring(i);
    }

    public static boolean sameProduct(String a, String b) {
        if (!isValid(a) || !isValid(b)) {
            return false;
        }
        return canonical(a).equals(canonical(b));
    }

    private static String digitsOnly(String value) {
        if (value == null) {
            return null;
        }
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c >= '0' && c <= '9') {
                sb.append(c);
            } else if (c != ' ' && c != '-') {
                return null;
            }
        }
        return sb.length() == 0 ? null : sb.toString();
    }
}
