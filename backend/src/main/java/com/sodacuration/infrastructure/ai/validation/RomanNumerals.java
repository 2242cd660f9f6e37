package com.sodacuration.infrastructure.ai.validation;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * Canonical (subtractive-notation) Roman numerals, 1 to 4999.
 */
public final class RomanNumerals {

    private static final Pattern CANONICAL = Pattern.compile(
            "^(?=[MDCLXVI])M{0,4}(CM|CD|D?C{0,3})(XC|XL|L?X{0,3})(IX|IV|V?I{0,3})$"
    );

    private static final Map<Character, Integer> VALUES = Map.of(
            'I', 1, 'V', 5, 'X', 10, 'L', 50, 'C', 100, 'D', 500, 'M', 1000
    );

    private static final int[] ARABIC = {1000, 900, 500, 400, 100, 90, 50, 40, 10, 9, 5, 4, 1};
    private static final String[] SYMBOLS = {"M", "CM", "D", "CD", "C", "XC", "L", "XL", "X", "IX", "V", "IV", "I"};

    private RomanNumerals() {
    }

    /**
     * Rejects non-canonical forms such as "IIII" or "VX".
     */
    public static boolean isCanonical(String numeral) {
        return numeral != null && CANONICAL.matcher(numeral).matches();
    }

    public static int toInt(String numeral) {
        if (!isCanonical(numeral)) {
            throw new IllegalArgumentException("Not a canonical Roman numeral: " + numeral);
        }
        int total = 0;
        int previous = 0;
        for (int i = numeral.length() - 1; i >= 0; i--) {
            int current = VALUES.get(numeral.charAt(i));
            total += current >= previous ? current : -current;
            previous = current;
        }
        return total;
    }

    public static String toRoman(int number) {
        if (number <= 0 || number >= 5000) {
            throw new IllegalArgumentException("Out of Roman numeral range: " + number);
        }
        StringBuilder sb = new StringBuilder();
        int remaining = number;
        for (int i = 0; i < ARABIC.length; i++) {
            while (remaining >= ARABIC[i]) {
                sb.append(SYMBOLS[i]);
                remaining -= ARABIC[i];
            }
        }
        return sb.toString();
    }
}
