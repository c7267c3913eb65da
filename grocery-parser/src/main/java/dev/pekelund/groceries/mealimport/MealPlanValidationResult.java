package dev.pekelund.groceries.mealimport;

import java.util.List;

/**
 * Outcome of validating a structured meal plan. Warnings never affect {@code success}.
 */
public record MealPlanValidationResult(boolean success, List<String> errors, List<String> warnings) {

    public MealPlanValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    static MealPlanValidationResult of(List<String> errors, List<String> warnings) {
        return new MealPlanValidationResult(errors == null || errors.isEmpty(), errors, warnings);
    }
}
