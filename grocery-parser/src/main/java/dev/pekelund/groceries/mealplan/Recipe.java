package dev.pekelund.groceries.mealplan;

import java.util.ArrayList;
import java.util.List;

/**
 * A meal extracted from narrative meal plan text. Instances are immutable; the extractor builds a
 * recipe by deriving a new copy for every ingredient or instruction line it reads.
 */
public record Recipe(
    String id,
    String title,
    MealType mealType,
    String day,
    List<String> ingredients,
    List<String> instructions,
    List<String> tags,
    String servings,
    String prepTime,
    String cookTime
) {

    public Recipe {
        day = day == null ? "" : day;
        ingredients = ingredients == null ? List.of() : List.copyOf(ingredients);
        instructions = instructions == null ? List.of() : List.copyOf(instructions);
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public boolean hasTitle() {
        return title != null && !title.isBlank();
    }

    public Recipe withIngredient(String ingredient) {
        return new Recipe(id, title, mealType, day, append(ingredients, ingredient), instructions, tags,
            servings, prepTime, cookTime);
    }

    public Recipe withInstruction(String instruction) {
        return new Recipe(id, title, mealType, day, ingredients, append(instructions, instruction), tags,
            servings, prepTime, cookTime);
    }

    private static List<String> append(List<String> values, String value) {
        List<String> copy = new ArrayList<>(values);
        copy.add(value);
        return copy;
    }
}
