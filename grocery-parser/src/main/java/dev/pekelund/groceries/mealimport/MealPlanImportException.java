package dev.pekelund.groceries.mealimport;

import java.util.List;

/**
 * Signals a structured meal plan that cannot be read or imported.
 */
public class MealPlanImportException extends RuntimeException {

    private final List<String> errors;

    public MealPlanImportException(String message) {
        this(message, List.of());
    }

    public MealPlanImportException(String message, List<String> errors) {
        super(message);
        this.errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public MealPlanImportException(String message, Throwable cause) {
        super(message, cause);
        this.errors = List.of();
    }

    public List<String> getErrors() {
        return errors;
    }
}
