package dev.pekelund.groceries.mealimport;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MealDetail(
    String name,
    String description,
    Integer prepTime,
    Integer cookTime,
    Integer servings,
    String difficulty,
    List<MealIngredient> ingredients,
    List<String> instructions,
    List<String> tags
) {
}
