package dev.pekelund.groceries.listparser;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Matches a leading quantity token (integer, number word, fraction or mixed number) followed by the
 * rest of the line. A unit written at the start of the rest, as in {@code "1/2 cup flour"}, is split
 * off; otherwise the whole rest becomes the item name.
 */
final class LeadingQuantityMatcher implements QuantityMatcher {

    private final String name;
    private final Pattern pattern;
    private final Function<String, BigDecimal> converter;

    LeadingQuantityMatcher(String name, String quantityPattern, Function<String, BigDecimal> converter) {
        this.name = name;
        this.pattern = Pattern.compile("^(?<quantity>" + quantityPattern + ")\\s+" + QuantityPatterns.REST + "$",
            QuantityPatterns.FLAGS);
        this.converter = converter;
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
        String remainder = matcher.group("rest").trim();
        if (remainder.isEmpty()) {
            return Optional.empty();
        }
        BigDecimal quantity = converter.apply(matcher.group("quantity"));
        return Optional.of(QuantityPatterns.splitLeadingUnit(remainder)
            .map(split -> new QuantityMatch(quantity, split[0], split[1]))
            .orElseGet(() -> new QuantityMatch(quantity, null, remainder)));
    }

    @Override
    public String toString() {
        return name;
    }
}
