package dev.pekelund.groceries.mealplan;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Extracts recipes from narrative meal plan text such as an AI chat answer. Lines are folded through
 * {@link #step(NarrativeState, String)}: day headers set the current day, meal headers open a new recipe,
 * and "Ingredients:" / "Instructions:" markers decide where the following bullet and numbered lines go.
 * When the headers yield too few recipes, {@link FallbackRecipeScanner} adds meal-like sentences.
 */
public class MealPlanNarrativeExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(MealPlanNarrativeExtractor.class);

    private static final Pattern DAY_NUMBER_HEADER = Pattern.compile(
        "^Day\\s+(\\d+)(?:\\s*\\(([^)]+)\\))?:?",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern WEEKDAY_HEADER = Pattern.compile(
        "^(Monday|Tuesday|Wednesday|Thursday|Friday|Saturday|Sunday)\\s*:?$",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern MEAL_HEADER = Pattern.compile(
        "^[-*•]?\\s*(Breakfast|Lunch|Dinner|Snacks?):\\s*(.+)$",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern INSTRUCTIONS_MARKER = Pattern.compile("instructions?:|directions?:|method:|steps:");
    private static final Pattern INGREDIENT_LINE = Pattern.compile("^[-•*]\\s*(.+)$");
    private static final Pattern NUMBERED_STEP = Pattern.compile("^\\d+\\.\\s*(.+)$");
    private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n|\\r");

    private static final String DEFAULT_TAG = "meal plan";

    private final MealPlanExtractionSettings settings;
    private final Supplier<String> idGenerator;
    private final FallbackRecipeScanner fallbackScanner;

    public MealPlanNarrativeExtractor(MealPlanExtractionSettings settings) {
        this(settings, () -> "recipe_" + UUID.randomUUID());
    }

    public MealPlanNarrativeExtractor(MealPlanExtractionSettings settings, Supplier<String> idGenerator) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
        this.fallbackScanner = new FallbackRecipeScanner(idGenerator);
    }

    public MealPlanExtraction extract(String text) {
        if (!StringUtils.hasText(text)) {
            return MealPlanExtraction.empty();
        }

        List<String> lines = Arrays.asList(LINE_BREAK.split(text));
        NarrativeState state = NarrativeState.initial();
        for (String line : lines) {
            state = step(state, line);
        }

        List<Recipe> recipes = new ArrayList<>(state.sealedRecipes());
        LOGGER.debug("Found {} recipes under meal headers", recipes.size());

        if (recipes.size() < settings.fallbackThreshold()) {
            List<Recipe> fallback = fallbackScanner.scan(lines, settings.maxFallbackRecipes());
            LOGGER.debug("Fallback scan added {} meal ideas", fallback.size());
            recipes.addAll(fallback);
        }

        int total = recipes.size();
        List<Recipe> limited = recipes.subList(0, Math.min(total, settings.maxRecipes()));
        LOGGER.info("Meal plan extraction complete: {} recipes found, returning {}", total, limited.size());
        return new MealPlanExtraction(true, limited, total);
    }

    /**
     * Applies one line of narrative text to the extraction state.
     */
    NarrativeState step(NarrativeState state, String rawLine) {
        String line = rawLine == null ? "" : rawLine.trim();
        if (line.isEmpty()) {
            return state;
        }

        String day = matchDayHeader(line);
        if (day != null) {
            LOGGER.debug("Detected day header '{}'", day);
            return state.withDay(day);
        }

        Matcher mealMatcher = MEAL_HEADER.matcher(line);
        if (mealMatcher.matches()) {
            MealType mealType = MealType.fromHeader(mealMatcher.group(1)).orElse(MealType.SUGGESTED_MEAL);
            String title = mealMatcher.group(2).trim();
            LOGGER.debug("Detected {} '{}' for day '{}'", mealType, title, state.currentDay());
            return state.open(newRecipe(title, mealType, state.currentDay()));
        }

        String lower = line.toLowerCase(Locale.ROOT);
        if (lower.contains("ingredients:")) {
            return state.withMode(NarrativeState.Mode.INGREDIENTS);
        }
        if (INSTRUCTIONS_MARKER.matcher(lower).find()) {
            return state.withMode(NarrativeState.Mode.INSTRUCTIONS);
        }

        if (state.mode() == NarrativeState.Mode.INGREDIENTS) {
            Matcher ingredient = INGREDIENT_LINE.matcher(line);
            if (ingredient.matches()) {
                return state.withIngredient(ingredient.group(1).trim());
            }
        } else if (state.mode() == NarrativeState.Mode.INSTRUCTIONS) {
            Matcher instruction = NUMBERED_STEP.matcher(line);
            if (instruction.matches()) {
                return state.withInstruction(instruction.group(1).trim());
            }
        }
        return state;
    }

    private String matchDayHeader(String line) {
        Matcher dayNumber = DAY_NUMBER_HEADER.matcher(line);
        if (dayNumber.find()) {
            return dayNumber.group().replace(":", "").trim();
        }
        Matcher weekday = WEEKDAY_HEADER.matcher(line);
        if (weekday.matches()) {
            return weekday.group(1);
        }
        return null;
    }

    private Recipe newRecipe(String title, MealType mealType, String day) {
        String tag = day.toLowerCase(Locale.ROOT).contains("day") ? day : DEFAULT_TAG;
        return new Recipe(idGenerator.get(), title, mealType, day, List.of(), List.of(), List.of(tag),
            settings.defaultServings(), settings.defaultPrepTime(), settings.defaultCookTime());
    }
}
