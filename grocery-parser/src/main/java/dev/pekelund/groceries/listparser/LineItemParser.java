package dev.pekelund.groceries.listparser;

import dev.pekelund.groceries.catalog.Category;
import dev.pekelund.groceries.catalog.CategoryClassifier;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses one line of grocery list text into a {@link ParsedItem}. Leading list markers are removed,
 * then the {@link QuantityMatcher} table is consulted in order and the first match supplies quantity,
 * unit and item name. Lines no matcher accepts keep their cleaned text as the item name.
 */
public class LineItemParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(LineItemParser.class);

    private static final Pattern BULLET = Pattern.compile("^(?:[" + QuantityPatterns.BULLET_GLYPHS + "]\\s*)+");
    private static final Pattern NUMERIC_ORDINAL = Pattern.compile("^\\d+\\.\\s+");
    private static final Pattern LETTERED_ORDINAL = Pattern.compile("^[a-z]\\)\\s*", Pattern.CASE_INSENSITIVE);

    private final CategoryClassifier categoryClassifier;
    private final List<QuantityMatcher> matchers;

    public LineItemParser(CategoryClassifier categoryClassifier) {
        this(categoryClassifier, QuantityMatchers.defaultTable());
    }

    public LineItemParser(CategoryClassifier categoryClassifier, List<QuantityMatcher> matchers) {
        this.categoryClassifier = Objects.requireNonNull(categoryClassifier, "categoryClassifier");
        this.matchers = List.copyOf(matchers);
    }

    public ParsedItem parseLine(String line) {
        String original = line == null ? "" : line.trim();
        String cleaned = stripListMarkers(original);

        String itemName = cleaned;
        QuantityMatch match = findQuantity(cleaned).orElse(null);
        if (match != null) {
            String extracted = match.itemName().trim();
            itemName = extracted.isEmpty() ? cleaned : extracted;
        }

        Category category = categoryClassifier.classify(itemName);
        return new ParsedItem(original, itemName.trim(),
            match != null ? match.quantity() : null,
            match != null ? match.unit() : null,
            category);
    }

    /**
     * Removes a leading bullet glyph, then a {@code "1. "} ordinal, then an {@code "a) "} ordinal.
     * The cascade repeats while it still changes the text so that nested markers such as
     * {@code "- 1. a) milk"} are fully removed.
     */
    static String stripListMarkers(String value) {
        String current = value == null ? "" : value.trim();
        String previous;
        do {
            previous = current;
            current = BULLET.matcher(current).replaceFirst("").trim();
            current = NUMERIC_ORDINAL.matcher(current).replaceFirst("").trim();
            current = LETTERED_ORDINAL.matcher(current).replaceFirst("").trim();
        } while (!current.equals(previous));
        return current;
    }

    private Optional<QuantityMatch> findQuantity(String cleaned) {
        if (cleaned.isEmpty()) {
            return Optional.empty();
        }
        for (QuantityMatcher matcher : matchers) {
            Optional<QuantityMatch> match = matcher.tryMatch(cleaned);
            if (match.isPresent()) {
                LOGGER.debug("Matcher '{}' accepted line '{}'", matcher.name(), cleaned);
                return match;
            }
        }
        return Optional.empty();
    }
}
