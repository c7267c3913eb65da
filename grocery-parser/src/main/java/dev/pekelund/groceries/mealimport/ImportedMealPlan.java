package dev.pekelund.groceries.mealimport;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical meal plan produced by {@link StructuredMealPlanImporter}.
 *
 * @param days         day name to meal type to meal, in plan order
 * @param totalMeals   meals that have at least one ingredient
 * @param totalItems   ingredient lines across all meals
 * @param shoppingList aggregated ingredients, derived from {@code days}
 */
public record ImportedMealPlan(
    String id,
    String name,
    String userId,
    String weekOf,
    String endDate,
    int servings,
    Map<String, Map<String, NormalizedMeal>> days,
    List<ImportedRecipe> recipes,
    int totalMeals,
    int totalItems,
    ShoppingList shoppingList
) {

    public ImportedMealPlan {
        Map<String, Map<String, NormalizedMeal>> copy = new LinkedHashMap<>();
        if (days != null) {
            days.forEach((day, meals) -> copy.put(day, Collections.unmodifiableMap(new LinkedHashMap<>(meals))));
        }
        days = Collections.unmodifiableMap(copy);
        recipes = recipes == null ? List.of() : List.copyOf(recipes);
    }
}
