package dev.pekelund.groceries.mealimport;

import java.util.Map;

/**
 * Headline numbers shown after an import.
 *
 * @param categories shopping list lines per category label
 */
public record MealPlanImportSummary(
    int daysPlanned,
    int totalMeals,
    int uniqueRecipes,
    int shoppingItems,
    int servingsPlanned,
    String planDuration,
    Map<String, Integer> categories
) {
}
