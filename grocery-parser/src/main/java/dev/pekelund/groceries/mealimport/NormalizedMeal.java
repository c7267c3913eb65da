package dev.pekelund.groceries.mealimport;

import java.util.List;

public record NormalizedMeal(
    String name,
    int prepTime,
    int cookTime,
    int servings,
    List<String> instructions,
    List<String> tags,
    List<MealItem> items
) {

    public NormalizedMeal {
        instructions = instructions == null ? List.of() : List.copyOf(instructions);
        tags = tags == null ? List.of() : List.copyOf(tags);
        items = items == null ? List.of() : List.copyOf(items);
    }
}
