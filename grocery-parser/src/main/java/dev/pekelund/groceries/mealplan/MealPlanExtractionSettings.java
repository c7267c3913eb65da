package dev.pekelund.groceries.mealplan;

import java.util.Map;
import java.util.Objects;
import org.springframework.util.StringUtils;

/**
 * Limits and defaults applied by the narrative meal plan extractor, resolved from the environment.
 *
 * @param maxRecipes         recipes returned from one extraction; the total count is reported separately
 * @param fallbackThreshold  the fallback scan runs when fewer recipes than this were found from headers
 * @param maxFallbackRecipes recipes the fallback scan may add
 * @param defaultServings    servings assigned to recipes found under meal headers
 * @param defaultPrepTime    preparation time assigned to recipes found under meal headers
 * @param defaultCookTime    cooking time assigned to recipes found under meal headers
 */
public record MealPlanExtractionSettings(
    int maxRecipes,
    int fallbackThreshold,
    int maxFallbackRecipes,
    String defaultServings,
    String defaultPrepTime,
    String defaultCookTime
) {

    public static final int DEFAULT_MAX_RECIPES = 7;
    public static final int DEFAULT_FALLBACK_THRESHOLD = 3;
    public static final int DEFAULT_MAX_FALLBACK_RECIPES = 5;
    public static final String DEFAULT_SERVINGS = "4 people";
    public static final String DEFAULT_PREP_TIME = "15-30 minutes";
    public static final String DEFAULT_COOK_TIME = "Varies";

    public static MealPlanExtractionSettings defaults() {
        return new MealPlanExtractionSettings(DEFAULT_MAX_RECIPES, DEFAULT_FALLBACK_THRESHOLD,
            DEFAULT_MAX_FALLBACK_RECIPES, DEFAULT_SERVINGS, DEFAULT_PREP_TIME, DEFAULT_COOK_TIME);
    }

    public static MealPlanExtractionSettings fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    static MealPlanExtractionSettings fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");

        int maxRecipes = positiveInt(env, "MEAL_PLAN_MAX_RECIPES", DEFAULT_MAX_RECIPES);
        int fallbackThreshold = positiveInt(env, "MEAL_PLAN_FALLBACK_THRESHOLD", DEFAULT_FALLBACK_THRESHOLD);
        int maxFallbackRecipes = positiveInt(env, "MEAL_PLAN_MAX_FALLBACK_RECIPES", DEFAULT_MAX_FALLBACK_RECIPES);
        String servings = textOrDefault(env.get("MEAL_PLAN_DEFAULT_SERVINGS"), DEFAULT_SERVINGS);
        String prepTime = textOrDefault(env.get("MEAL_PLAN_DEFAULT_PREP_TIME"), DEFAULT_PREP_TIME);
        String cookTime = textOrDefault(env.get("MEAL_PLAN_DEFAULT_COOK_TIME"), DEFAULT_COOK_TIME);

        return new MealPlanExtractionSettings(maxRecipes, fallbackThreshold, maxFallbackRecipes, servings,
            prepTime, cookTime);
    }

    private static int positiveInt(Map<String, String> env, String name, int defaultValue) {
        String raw = env.get(name);
        if (!StringUtils.hasText(raw)) {
            return defaultValue;
        }
        int value;
        try {
            value = Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalStateException(String.format("%s must be a whole number but was '%s'", name, raw), ex);
        }
        if (value <= 0) {
            throw new IllegalStateException(String.format("%s must be positive but was %d", name, value));
        }
        return value;
    }

    private static String textOrDefault(String value, String defaultValue) {
        return StringUtils.hasText(value) ? value.trim() : defaultValue;
    }
}
