package dev.pekelund.groceries.mealimport;

import dev.pekelund.groceries.catalog.CategoryClassifier;
import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;

/**
 * Validates structured meal plan documents and converts them into {@link ImportedMealPlan}s with a
 * derived shopping list.
 *
 * <p>{@link #importMealPlan(MealPlanDocument, String)} only accepts documents that pass
 * {@link #validate(MealPlanDocument)}; an invalid document is rejected with a
 * {@link MealPlanImportException} listing the validation errors rather than being repaired.</p>
 */
public class StructuredMealPlanImporter {

    private static final Logger LOGGER = LoggerFactory.getLogger(StructuredMealPlanImporter.class);

    static final String DEFAULT_TITLE = "Imported Meal Plan";
    static final String DEFAULT_UNIT = "each";
    static final String DEFAULT_DIFFICULTY = "medium";
    static final int DEFAULT_SERVINGS = 4;

    private final CategoryClassifier categoryClassifier;
    private final ShoppingListAggregator shoppingListAggregator;
    private final Supplier<String> idGenerator;

    public StructuredMealPlanImporter(CategoryClassifier categoryClassifier) {
        this(categoryClassifier, () -> UUID.randomUUID().toString());
    }

    public StructuredMealPlanImporter(CategoryClassifier categoryClassifier, Supplier<String> idGenerator) {
        this.categoryClassifier = Objects.requireNonNull(categoryClassifier, "categoryClassifier");
        this.shoppingListAggregator = new ShoppingListAggregator(categoryClassifier);
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
    }

    public MealPlanValidationResult validate(MealPlanDocument document) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (document == null) {
            errors.add("Meal plan object is required");
            return MealPlanValidationResult.of(errors, warnings);
        }

        if (CollectionUtils.isEmpty(document.days())) {
            errors.add("mealPlan.days array is required and must not be empty");
        } else {
            List<DayPlan> days = document.days();
            for (int index = 0; index < days.size(); index++) {
                validateDay(days.get(index), index + 1, errors, warnings);
            }
        }

        if (document.displayTitle() == null) {
            warnings.add("Meal plan title is recommended");
        }

        return MealPlanValidationResult.of(errors, warnings);
    }

    private void validateDay(DayPlan day, int dayNumber, List<String> errors, List<String> warnings) {
        if (day == null || CollectionUtils.isEmpty(day.meals())) {
            errors.add(String.format("Day %d: meals object is required and must not be empty", dayNumber));
            return;
        }
        day.meals().forEach((mealType, meal) -> {
            if (meal == null || CollectionUtils.isEmpty(meal.ingredients())) {
                errors.add(String.format("Day %d %s: ingredients list is required and must not be empty",
                    dayNumber, mealType));
                return;
            }
            List<MealIngredient> ingredients = meal.ingredients();
            for (int index = 0; index < ingredients.size(); index++) {
                MealIngredient ingredient = ingredients.get(index);
                if (ingredient == null || !StringUtils.hasText(ingredient.item())) {
                    warnings.add(String.format("Day %d %s: ingredient %d has no item name and is left off the"
                        + " shopping list", dayNumber, mealType, index + 1));
                }
            }
        });
    }

    public ImportedMealPlan importMealPlan(MealPlanDocument document, String userId) {
        MealPlanValidationResult validation = validate(document);
        if (!validation.success()) {
            LOGGER.warn("Rejected meal plan import for user {}: {}", userId, validation.errors());
            throw new MealPlanImportException("Meal plan failed validation", validation.errors());
        }

        String title = document.displayTitle() != null ? document.displayTitle() : DEFAULT_TITLE;
        int planServings = document.servings() != null ? document.servings() : DEFAULT_SERVINGS;

        Map<String, Map<String, NormalizedMeal>> days = new LinkedHashMap<>();
        List<ImportedRecipe> recipes = new ArrayList<>();
        List<MealItem> allItems = new ArrayList<>();
        int totalMeals = 0;

        List<DayPlan> dayPlans = document.days();
        for (int position = 0; position < dayPlans.size(); position++) {
            DayPlan dayPlan = dayPlans.get(position);
            String dayName = uniqueDayName(resolveDayName(dayPlan, position), dayPlan, position, days);
            Map<String, NormalizedMeal> meals = new LinkedHashMap<>();

            for (Map.Entry<String, MealDetail> entry : dayPlan.meals().entrySet()) {
                String mealType = entry.getKey();
                MealDetail meal = entry.getValue();
                List<MealItem> items = meal.ingredients().stream()
                    .map(this::toMealItem)
                    .toList();
                NormalizedMeal normalized = normalize(meal, mealType, items);
                meals.put(mealType, normalized);
                recipes.add(toRecipe(meal, normalized, mealType, dayName));
                allItems.addAll(items);
                if (!items.isEmpty()) {
                    totalMeals++;
                }
            }
            days.put(dayName, meals);
        }

        ShoppingList shoppingList = new ShoppingList(title + " - Shopping List",
            shoppingListAggregator.aggregate(allItems));

        ImportedMealPlan plan = new ImportedMealPlan("mealplan_" + idGenerator.get(), title, userId,
            document.startDate(), document.endDate(), planServings, days, recipes, totalMeals, allItems.size(),
            shoppingList);
        LOGGER.info("Imported meal plan '{}' for user {}: {} days, {} meals, {} ingredients, {} shopping items",
            title, userId, days.size(), totalMeals, allItems.size(), shoppingList.items().size());
        return plan;
    }

    public MealPlanImportSummary summarize(ImportedMealPlan plan) {
        Objects.requireNonNull(plan, "plan");
        Map<String, Integer> categories = new TreeMap<>();
        for (ShoppingItem item : plan.shoppingList().items()) {
            categories.merge(item.category().label(), 1, Integer::sum);
        }
        int daysPlanned = plan.days().size();
        return new MealPlanImportSummary(daysPlanned, plan.totalMeals(), plan.recipes().size(),
            plan.shoppingList().items().size(), plan.servings(), daysPlanned + " days", categories);
    }

    /**
     * Explicit day name, else the weekday of {@code date}, else {@code day} counted from Monday,
     * else the position in the plan.
     */
    static String resolveDayName(DayPlan dayPlan, int position) {
        if (StringUtils.hasText(dayPlan.dayName())) {
            return dayPlan.dayName().trim();
        }
        if (StringUtils.hasText(dayPlan.date())) {
            try {
                return weekdayName(LocalDate.parse(dayPlan.date().trim()).getDayOfWeek());
            } catch (DateTimeParseException ex) {
                LOGGER.debug("Ignoring unparseable meal plan date '{}'", dayPlan.date(), ex);
            }
        }
        if (dayPlan.day() != null && dayPlan.day() > 0) {
            return weekdayName(DayOfWeek.of((dayPlan.day() - 1) % 7 + 1));
        }
        return position < 7 ? weekdayName(DayOfWeek.of(position + 1)) : "Day " + (position + 1);
    }

    private static String uniqueDayName(String candidate, DayPlan dayPlan, int position,
        Map<String, ?> existing) {

        if (!existing.containsKey(candidate)) {
            return candidate;
        }
        int number = dayPlan.day() != null && dayPlan.day() > 0 ? dayPlan.day() : position + 1;
        String numbered = "Day " + number;
        if (!existing.containsKey(numbered)) {
            return numbered;
        }
        return "Day " + (position + 1) + " (" + candidate + ")";
    }

    private static String weekdayName(DayOfWeek dayOfWeek) {
        return dayOfWeek.getDisplayName(TextStyle.FULL, Locale.ENGLISH);
    }

    private MealItem toMealItem(MealIngredient ingredient) {
        if (ingredient == null) {
            return new MealItem("", BigDecimal.ONE, DEFAULT_UNIT, categoryClassifier.classify(""), null, null, null);
        }
        String name = ingredient.item() != null ? ingredient.item().trim() : "";
        BigDecimal amount = ingredient.amount() != null ? ingredient.amount() : BigDecimal.ONE;
        String unit = StringUtils.hasText(ingredient.unit()) ? ingredient.unit() : DEFAULT_UNIT;
        return new MealItem(name, amount, unit, categoryClassifier.classify(name), ingredient.prep(),
            ingredient.note(), ingredient.size());
    }

    private NormalizedMeal normalize(MealDetail meal, String mealType, List<MealItem> items) {
        String name = StringUtils.hasText(meal.name()) ? meal.name().trim() : StringUtils.capitalize(mealType);
        return new NormalizedMeal(name, orZero(meal.prepTime()), orZero(meal.cookTime()),
            meal.servings() != null ? meal.servings() : DEFAULT_SERVINGS, meal.instructions(), meal.tags(), items);
    }

    private ImportedRecipe toRecipe(MealDetail meal, NormalizedMeal normalized, String mealType, String dayName) {
        String description = meal.description() != null ? meal.description() : "";
        String difficulty = StringUtils.hasText(meal.difficulty()) ? meal.difficulty() : DEFAULT_DIFFICULTY;
        return new ImportedRecipe("recipe_" + idGenerator.get(), normalized.name(), description, mealType, dayName,
            normalized.prepTime(), normalized.cookTime(), normalized.prepTime() + normalized.cookTime(),
            normalized.servings(), difficulty, normalized.items(), normalized.instructions(), normalized.tags(),
            ImportedRecipe.SOURCE);
    }

    private static int orZero(Integer value) {
        return value != null ? value : 0;
    }
}
