package dev.pekelund.groceries.listparser;

import dev.pekelund.groceries.catalog.Category;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Splits free-form grocery list text into lines and parses each one with {@link LineItemParser}.
 */
public class GroceryListParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(GroceryListParser.class);

    private static final Pattern SEPARATORS = Pattern.compile("\\r?\\n|\\r|[;,]");
    private static final Pattern NOISE_HEADER = Pattern.compile(
        "^(grocery list|shopping list|to buy|items needed):?$",
        Pattern.CASE_INSENSITIVE
    );

    private final LineItemParser lineItemParser;

    public GroceryListParser(LineItemParser lineItemParser) {
        this.lineItemParser = Objects.requireNonNull(lineItemParser, "lineItemParser");
    }

    public List<ParsedItem> parseList(String text) {
        if (!StringUtils.hasText(text)) {
            return List.of();
        }
        List<ParsedItem> items = splitLines(text).stream()
            .map(lineItemParser::parseLine)
            .collect(Collectors.toCollection(ArrayList::new));
        LOGGER.info("Parsed {} grocery items from {} characters of text", items.size(), text.length());
        return List.copyOf(items);
    }

    public GroceryListParseResult parse(String text, boolean groupByCategory) {
        List<ParsedItem> items = parseList(text);
        if (!groupByCategory) {
            return new GroceryListParseResult(items, items.size(), Map.of(), List.of());
        }
        Map<Category, List<ParsedItem>> grouped = groupByCategory(items);
        return new GroceryListParseResult(items, items.size(), grouped, new ArrayList<>(grouped.keySet()));
    }

    /**
     * Re-indexes already parsed items by category, keeping categories in the order they first appear.
     */
    public static Map<Category, List<ParsedItem>> groupByCategory(List<ParsedItem> items) {
        Map<Category, List<ParsedItem>> grouped = new LinkedHashMap<>();
        if (items == null) {
            return grouped;
        }
        for (ParsedItem item : items) {
            grouped.computeIfAbsent(item.category(), key -> new ArrayList<>()).add(item);
        }
        return grouped;
    }

    static List<String> splitLines(String text) {
        return Arrays.stream(SEPARATORS.split(text))
            .map(String::trim)
            .filter(line -> !line.isEmpty())
            .filter(line -> !NOISE_HEADER.matcher(line).matches())
            .collect(Collectors.toList());
    }
}
