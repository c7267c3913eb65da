package dev.pekelund.groceries.listparser;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex fragments shared by the quantity matchers.
 */
final class QuantityPatterns {

    static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    static final String BULLET_GLYPHS = "-*•·◦▪▫◆◇→➤➢>";

    /**
     * Item name following a quantity. It may not itself start with a quantity or a list marker, so
     * re-parsing an extracted name never finds another quantity. It may not start with whitespace
     * either, which keeps the preceding {@code \s*} from giving back a space to slip past the checks.
     */
    static final String REST = "(?<rest>(?!\\s)(?!\\d)(?!(?:" + QuantityValues.numberWordAlternation() + ")\\s)"
        + "(?![" + BULLET_GLYPHS + "])(?![a-z]\\)).*)";

    /**
     * A unit word with optional plural "s" and abbreviation dot, not followed by further letters.
     */
    static String unit(String alternation) {
        return "(?<unit>(?:" + alternation + ")s?)(?!\\p{L})\\.?";
    }

    private static final Pattern UNIT_PREFIX = Pattern.compile(
        "^" + unit(UnitVocabulary.fullAlternation()) + "\\s*" + REST + "$", FLAGS);

    private QuantityPatterns() {
    }

    /**
     * Splits a leading unit word off a captured remainder such as "cup flour".
     *
     * @return unit and item name, or empty when the remainder does not start with a unit; a remainder
     *     that is only a unit word is also used as the item name
     */
    static Optional<String[]> splitLeadingUnit(String remainder) {
        Matcher matcher = UNIT_PREFIX.matcher(remainder);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        String rest = matcher.group("rest").trim();
        if (rest.isEmpty()) {
            rest = remainder.trim();
        }
        return Optional.of(new String[] {matcher.group("unit"), rest});
    }
}
