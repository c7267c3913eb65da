package dev.pekelund.groceries.listparser;

import dev.pekelund.groceries.catalog.Category;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Items parsed from a grocery list, optionally re-indexed by category.
 *
 * @param items           parsed items in input order
 * @param itemCount       number of parsed items
 * @param itemsByCategory items grouped by category in first-seen order, empty unless grouping was requested
 * @param categories      the keys of {@code itemsByCategory}
 */
public record GroceryListParseResult(
    List<ParsedItem> items,
    int itemCount,
    Map<Category, List<ParsedItem>> itemsByCategory,
    List<Category> categories
) {

    public GroceryListParseResult {
        items = items == null ? List.of() : List.copyOf(items);
        itemsByCategory = itemsByCategory == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(itemsByCategory));
        categories = categories == null ? List.of() : List.copyOf(categories);
    }
}
