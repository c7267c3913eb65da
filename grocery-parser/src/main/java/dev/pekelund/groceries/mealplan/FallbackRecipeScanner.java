package dev.pekelund.groceries.mealplan;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Looser second pass over narrative text that picks up meal-like sentences when the text has too few
 * meal headers, e.g. "Grilled chicken with quinoa and greens".
 */
class FallbackRecipeScanner {

    static final int MIN_LENGTH = 15;
    static final int MAX_LENGTH = 80;

    private static final List<String> FOOD_KEYWORDS = List.of(
        "chicken", "salmon", "pasta", "salad", "soup", "stir", "grilled", "baked", "with", "recipe");

    private static final Pattern QUANTITY_PREFIX = Pattern.compile(
        "^\\d+\\s*(oz|lb|cups?|tbsp|tsp|bunch|bag|jar|can|container|loaf)",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern NUMBERED_STEP = Pattern.compile("^\\d+\\.");
    private static final Pattern TITLE_MARKUP = Pattern.compile("[*#-]+");

    private static final List<String> TAGS = List.of("meal idea");

    private final Supplier<String> idGenerator;

    FallbackRecipeScanner(Supplier<String> idGenerator) {
        this.idGenerator = idGenerator;
    }

    List<Recipe> scan(List<String> lines, int limit) {
        List<Recipe> found = new ArrayList<>();
        for (String raw : lines) {
            if (found.size() >= limit) {
                break;
            }
            String line = raw == null ? "" : raw.trim();
            if (isSkipped(line) || !looksLikeMeal(line)) {
                continue;
            }
            String title = TITLE_MARKUP.matcher(line).replaceAll("").trim();
            found.add(new Recipe(idGenerator.get(), title, MealType.SUGGESTED_MEAL, "", List.of(), List.of(), TAGS,
                "", "", ""));
        }
        return found;
    }

    private boolean isSkipped(String line) {
        if (line.isEmpty()) {
            return true;
        }
        String lower = line.toLowerCase(Locale.ROOT);
        return lower.contains("grocery")
            || lower.contains("shopping")
            || line.startsWith("-")
            || line.startsWith("•")
            || QUANTITY_PREFIX.matcher(line).find();
    }

    private boolean looksLikeMeal(String line) {
        if (line.length() < MIN_LENGTH || line.length() > MAX_LENGTH) {
            return false;
        }
        if (NUMBERED_STEP.matcher(line).find()) {
            return false;
        }
        String lower = line.toLowerCase(Locale.ROOT);
        return FOOD_KEYWORDS.stream().anyMatch(lower::contains);
    }
}
