package dev.pekelund.groceries.mealplan;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Optional;

/**
 * Meal slot a narrative recipe belongs to.
 */
public enum MealType {

    BREAKFAST("breakfast"),
    LUNCH("lunch"),
    DINNER("dinner"),
    SNACK("snack"),
    SUGGESTED_MEAL("suggested meal");

    private final String label;

    MealType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Resolves the meal type named in a header such as {@code "Snacks:"}.
     */
    public static Optional<MealType> fromHeader(String header) {
        if (header == null) {
            return Optional.empty();
        }
        String normalised = header.trim().toLowerCase(Locale.ROOT);
        return switch (normalised) {
            case "breakfast" -> Optional.of(BREAKFAST);
            case "lunch" -> Optional.of(LUNCH);
            case "dinner" -> Optional.of(DINNER);
            case "snack", "snacks" -> Optional.of(SNACK);
            default -> Optional.empty();
        };
    }

    @Override
    public String toString() {
        return label;
    }
}
