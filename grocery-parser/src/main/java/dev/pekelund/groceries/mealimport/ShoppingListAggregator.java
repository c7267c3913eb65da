package dev.pekelund.groceries.mealimport;

import dev.pekelund.groceries.catalog.Category;
import dev.pekelund.groceries.catalog.CategoryClassifier;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Sums meal ingredients into shopping list lines keyed by lower-cased name and exact unit.
 * Amounts under different unit spellings ("cup" and "cups") stay separate lines. When the same
 * name appears with different casing, the lexicographically smallest spelling is shown, so the
 * result does not depend on the order ingredients are visited in.
 */
public class ShoppingListAggregator {

    private static final Comparator<ShoppingItem> ORDER = Comparator
        .comparing((ShoppingItem item) -> item.category().label())
        .thenComparing(ShoppingItem::name, String.CASE_INSENSITIVE_ORDER)
        .thenComparing(ShoppingItem::name)
        .thenComparing(item -> item.unit() == null ? "" : item.unit());

    private final CategoryClassifier categoryClassifier;

    public ShoppingListAggregator(CategoryClassifier categoryClassifier) {
        this.categoryClassifier = Objects.requireNonNull(categoryClassifier, "categoryClassifier");
    }

    public List<ShoppingItem> aggregate(List<MealItem> items) {
        Map<AggregationKey, Accumulator> totals = new HashMap<>();
        if (items != null) {
            for (MealItem item : items) {
                if (item == null || item.name() == null || item.name().isBlank()) {
                    continue;
                }
                String displayName = item.name().trim();
                AggregationKey key = new AggregationKey(displayName.toLowerCase(Locale.ROOT), item.unit());
                totals.computeIfAbsent(key, ignored -> new Accumulator()).add(displayName, item.amount());
            }
        }

        List<ShoppingItem> result = new ArrayList<>(totals.size());
        totals.forEach((key, accumulator) -> {
            Category category = categoryClassifier.classify(accumulator.displayName);
            result.add(new ShoppingItem(accumulator.displayName, accumulator.quantity, key.unit(), category));
        });
        result.sort(ORDER);
        return List.copyOf(result);
    }

    private record AggregationKey(String normalisedName, String unit) {
    }

    private static final class Accumulator {

        private String displayName;
        private BigDecimal quantity = BigDecimal.ZERO;

        void add(String name, BigDecimal amount) {
            if (displayName == null || name.compareTo(displayName) < 0) {
                displayName = name;
            }
            quantity = quantity.add(amount == null ? BigDecimal.ONE : amount);
        }
    }
}
