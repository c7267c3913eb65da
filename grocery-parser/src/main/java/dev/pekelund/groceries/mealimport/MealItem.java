package dev.pekelund.groceries.mealimport;

import dev.pekelund.groceries.catalog.Category;
import java.math.BigDecimal;

/**
 * An ingredient of an imported meal with defaults applied: amount 1 and unit "each" when the source
 * omitted them.
 */
public record MealItem(
    String name,
    BigDecimal amount,
    String unit,
    Category category,
    String prep,
    String note,
    String size
) {
}
