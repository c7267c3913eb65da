package dev.pekelund.groceries.mealplan;

import java.util.List;

/**
 * Result of scanning narrative text for meals.
 *
 * @param isMealPlan   always {@code true}; callers use it to tell this result apart from other AI responses
 * @param recipes      at most the configured number of recipes, in order of appearance
 * @param totalRecipes number of recipes found before truncation
 */
public record MealPlanExtraction(boolean isMealPlan, List<Recipe> recipes, int totalRecipes) {

    public MealPlanExtraction {
        recipes = recipes == null ? List.of() : List.copyOf(recipes);
    }

    public static MealPlanExtraction empty() {
        return new MealPlanExtraction(true, List.of(), 0);
    }
}
