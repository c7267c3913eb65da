package dev.pekelund.groceries.mealimport;

import java.util.List;

/**
 * Flat recipe view of one imported meal, carrying the day and meal type it was planned for.
 */
public record ImportedRecipe(
    String id,
    String name,
    String description,
    String mealType,
    String day,
    int prepTime,
    int cookTime,
    int totalTime,
    int servings,
    String difficulty,
    List<MealItem> ingredients,
    List<String> instructions,
    List<String> tags,
    String source
) {

    public static final String SOURCE = "imported_meal_plan";

    public ImportedRecipe {
        ingredients = ingredients == null ? List.of() : List.copyOf(ingredients);
        instructions = instructions == null ? List.of() : List.copyOf(instructions);
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
