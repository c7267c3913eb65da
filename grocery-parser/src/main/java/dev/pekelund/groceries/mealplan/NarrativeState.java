package dev.pekelund.groceries.mealplan;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable state of the narrative extractor between two lines.
 *
 * @param mode          which section subsequent bullet or numbered lines belong to
 * @param currentDay    label of the most recent day header, empty before the first one
 * @param currentRecipe recipe still receiving ingredients and instructions, or {@code null}
 * @param recipes       recipes sealed so far, in order of appearance
 */
public record NarrativeState(
    Mode mode,
    String currentDay,
    Recipe currentRecipe,
    List<Recipe> recipes
) {

    public enum Mode {
        NONE,
        INGREDIENTS,
        INSTRUCTIONS
    }

    public NarrativeState {
        mode = mode == null ? Mode.NONE : mode;
        currentDay = currentDay == null ? "" : currentDay;
        recipes = recipes == null ? List.of() : List.copyOf(recipes);
    }

    public static NarrativeState initial() {
        return new NarrativeState(Mode.NONE, "", null, List.of());
    }

    public NarrativeState withDay(String day) {
        return new NarrativeState(mode, day, currentRecipe, recipes);
    }

    public NarrativeState withMode(Mode newMode) {
        return new NarrativeState(newMode, currentDay, currentRecipe, recipes);
    }

    /**
     * Seals the current recipe and starts building {@code recipe}; the section mode resets.
     */
    public NarrativeState open(Recipe recipe) {
        return new NarrativeState(Mode.NONE, currentDay, recipe, sealedRecipes());
    }

    public NarrativeState withIngredient(String ingredient) {
        if (currentRecipe == null) {
            return this;
        }
        return new NarrativeState(mode, currentDay, currentRecipe.withIngredient(ingredient), recipes);
    }

    public NarrativeState withInstruction(String instruction) {
        if (currentRecipe == null) {
            return this;
        }
        return new NarrativeState(mode, currentDay, currentRecipe.withInstruction(instruction), recipes);
    }

    /**
     * Recipes sealed so far plus the current one, if it has a title.
     */
    public List<Recipe> sealedRecipes() {
        if (currentRecipe == null || !currentRecipe.hasTitle()) {
            return recipes;
        }
        List<Recipe> sealed = new ArrayList<>(recipes);
        sealed.add(currentRecipe);
        return List.copyOf(sealed);
    }
}
