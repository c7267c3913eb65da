package dev.pekelund.groceries.catalog;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Assigns a {@link Category} to an item name using an ordered list of keyword rules.
 * The first rule whose keywords occur in the lower-cased name wins, so the order of
 * {@link #RULES} is significant: "ice cream" is dairy because the dairy rule sees "cream"
 * before the frozen rule is consulted.
 */
public final class CategoryClassifier {

    private static final List<CategoryRule> RULES = List.of(
        new CategoryRule(Category.DAIRY, "milk|cheese|yogurt|butter|cream|eggs"),
        new CategoryRule(Category.BAKERY, "bread|bagel|muffin|cake|cookie"),
        new CategoryRule(Category.PRODUCE, "apple|banana|orange|strawberry|grape|fruit"),
        new CategoryRule(Category.PRODUCE, "carrot|lettuce|tomato|potato|onion|vegetable|salad"),
        new CategoryRule(Category.MEAT, "chicken|beef|pork|turkey|fish|salmon|meat"),
        new CategoryRule(Category.PANTRY, "cereal|pasta|rice|beans|soup|sauce|quinoa|oats"),
        new CategoryRule(Category.FROZEN, "frozen|ice cream")
    );

    public Category classify(String itemName) {
        if (itemName == null || itemName.isBlank()) {
            return Category.OTHER;
        }
        String lower = itemName.toLowerCase(Locale.ROOT);
        for (CategoryRule rule : RULES) {
            if (rule.matches(lower)) {
                return rule.category();
            }
        }
        return Category.OTHER;
    }

    private record CategoryRule(Category category, Pattern keywords) {

        CategoryRule(Category category, String keywords) {
            this(category, Pattern.compile(keywords));
        }

        boolean matches(String lowerCaseName) {
            return keywords.matcher(lowerCaseName).find();
        }
    }
}
