package dev.pekelund.groceries.listparser;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Matches a number directly followed by a unit word from one {@link UnitVocabulary} group,
 * e.g. {@code "2 lbs chicken breast"} or {@code "500g flour"}.
 */
final class UnitQuantityMatcher implements QuantityMatcher {

    static final String DECIMAL = "\\d+(?:\\.\\d+)?";
    static final String INTEGER = "\\d+";

    private final String name;
    private final Pattern pattern;

    UnitQuantityMatcher(String name, String quantityPattern, UnitVocabulary units) {
        this.name = name;
        this.pattern = Pattern.compile("^(?<quantity>" + quantityPattern + ")\\s*"
            + QuantityPatterns.unit(units.alternation()) + "\\s*" + QuantityPatterns.REST + "$",
            QuantityPatterns.FLAGS);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Optional<QuantityMatch> tryMatch(String line) {
        Matcher matcher = pattern.matcher(line);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        BigDecimal quantity = QuantityValues.decimal(matcher.group("quantity"));
        String itemName = matcher.group("rest").trim();
        if (itemName.isEmpty()) {
            // "2 lbs": the unit text stands in for the missing name
            itemName = line.substring(matcher.end("quantity")).trim();
        }
        return Optional.of(new QuantityMatch(quantity, matcher.group("unit"), itemName));
    }

    @Override
    public String toString() {
        return name;
    }
}
