package dev.pekelund.groceries.catalog;

import java.util.Locale;

/**
 * Coarse grocery department used to group parsed items and shopping list lines.
 */
public enum Category {

    DAIRY("dairy"),
    BAKERY("bakery"),
    PRODUCE("produce"),
    MEAT("meat"),
    PANTRY("pantry"),
    FROZEN("frozen"),
    OTHER("other");

    private final String label;

    Category(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Resolves a category from its label, falling back to {@link #OTHER} for unknown values.
     */
    public static Category fromLabel(String label) {
        if (label == null) {
            return OTHER;
        }
        String normalised = label.trim().toLowerCase(Locale.ROOT);
        for (Category category : values()) {
            if (category.label.equals(normalised)) {
                return category;
            }
        }
        return OTHER;
    }

    @Override
    public String toString() {
        return label;
    }
}
