package dev.pekelund.groceries.mealimport;

import dev.pekelund.groceries.catalog.Category;
import java.math.BigDecimal;

/**
 * One line of a derived shopping list; {@code quantity} is the sum over every meal using the same
 * name and unit.
 */
public record ShoppingItem(String name, BigDecimal quantity, String unit, Category category) {
}
