package dev.pekelund.groceries.listparser;

import java.math.BigDecimal;

/**
 * Outcome of a successful quantity matcher: the quantity, the unit if one was written, and the
 * remaining item name.
 */
public record QuantityMatch(BigDecimal quantity, String unit, String itemName) {
}
