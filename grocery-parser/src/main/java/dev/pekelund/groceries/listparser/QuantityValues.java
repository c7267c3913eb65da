package dev.pekelund.groceries.listparser;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;

/**
 * Converts the quantity tokens captured by the matchers into decimals.
 */
final class QuantityValues {

    static final List<String> NUMBER_WORDS = List.of(
        "one", "two", "three", "four", "five", "six", "seven", "eight", "nine", "ten", "eleven", "twelve");

    private static final int FRACTION_SCALE = 4;

    private QuantityValues() {
    }

    static BigDecimal decimal(String token) {
        return new BigDecimal(token.trim());
    }

    static BigDecimal numberWord(String token) {
        int index = NUMBER_WORDS.indexOf(token.trim().toLowerCase(Locale.ROOT));
        if (index < 0) {
            throw new IllegalArgumentException("Not a number word: " + token);
        }
        return BigDecimal.valueOf(index + 1L);
    }

    static BigDecimal fraction(String token) {
        String[] parts = token.trim().split("/");
        BigDecimal numerator = new BigDecimal(parts[0].trim());
        BigDecimal denominator = new BigDecimal(parts[1].trim());
        if (denominator.signum() == 0) {
            return numerator;
        }
        return numerator.divide(denominator, FRACTION_SCALE, RoundingMode.HALF_UP).stripTrailingZeros();
    }

    static BigDecimal mixedNumber(String token) {
        String[] parts = token.trim().split("\\s+", 2);
        return decimal(parts[0]).add(fraction(parts[1]));
    }

    static String numberWordAlternation() {
        return String.join("|", NUMBER_WORDS);
    }
}
