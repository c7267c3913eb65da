package dev.pekelund.groceries.listparser;

import java.util.List;

/**
 * The default matcher table. Order is priority: the first matcher that accepts a line decides its
 * quantity and unit.
 */
public final class QuantityMatchers {

    private QuantityMatchers() {
    }

    public static List<QuantityMatcher> defaultTable() {
        return List.of(
            new UnitQuantityMatcher("weight", UnitQuantityMatcher.DECIMAL, UnitVocabulary.WEIGHT),
            new UnitQuantityMatcher("volume", UnitQuantityMatcher.DECIMAL, UnitVocabulary.VOLUME),
            new UnitQuantityMatcher("cooking-volume", UnitQuantityMatcher.DECIMAL, UnitVocabulary.COOKING_VOLUME),
            new UnitQuantityMatcher("packaging", UnitQuantityMatcher.INTEGER, UnitVocabulary.PACKAGING),
            new UnitQuantityMatcher("dozen", UnitQuantityMatcher.INTEGER, UnitVocabulary.DOZEN),
            new LeadingQuantityMatcher("integer", "\\d+", QuantityValues::decimal),
            new LeadingQuantityMatcher("number-word", QuantityValues.numberWordAlternation(),
                QuantityValues::numberWord),
            new LeadingQuantityMatcher("fraction", "\\d+/\\d+", QuantityValues::fraction),
            new LeadingQuantityMatcher("mixed-number", "\\d+\\s+\\d+/\\d+", QuantityValues::mixedNumber)
        );
    }
}
