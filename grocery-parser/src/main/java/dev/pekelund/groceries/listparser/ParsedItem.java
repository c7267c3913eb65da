package dev.pekelund.groceries.listparser;

import dev.pekelund.groceries.catalog.Category;
import java.math.BigDecimal;

/**
 * A single grocery list entry after parsing.
 *
 * @param original the trimmed input line
 * @param itemName the item name without bullets, ordinals, quantity or unit
 * @param quantity the extracted quantity, or {@code null} when the line carries none
 * @param unit     the unit as written, or {@code null}
 * @param category the department the item name classifies into
 */
public record ParsedItem(
    String original,
    String itemName,
    BigDecimal quantity,
    String unit,
    Category category
) {

    public ParsedItem {
        category = category == null ? Category.OTHER : category;
    }

    public boolean hasQuantity() {
        return quantity != null;
    }
}
