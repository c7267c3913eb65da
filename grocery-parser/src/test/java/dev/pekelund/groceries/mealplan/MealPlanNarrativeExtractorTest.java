package dev.pekelund.groceries.mealplan;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MealPlanNarrativeExtractorTest {

    private MealPlanNarrativeExtractor extractor;

    @BeforeEach
    void setUp() {
        AtomicInteger sequence = new AtomicInteger();
        extractor = new MealPlanNarrativeExtractor(MealPlanExtractionSettings.defaults(),
            () -> "recipe-" + sequence.incrementAndGet());
    }

    @Test
    void threeMealHeadersNeedNoFallback() {
        String text = "Day 1 (Monday): \n- Breakfast: Oatmeal\n- Lunch: Sandwich\n- Dinner: Chicken";

        MealPlanExtraction extraction = extractor.extract(text);

        assertThat(extraction.isMealPlan()).isTrue();
        assertThat(extraction.totalRecipes()).isEqualTo(3);
        assertThat(extraction.recipes()).extracting(Recipe::title)
            .containsExactly("Oatmeal", "Sandwich", "Chicken");
        assertThat(extraction.recipes()).extracting(Recipe::mealType)
            .containsExactly(MealType.BREAKFAST, MealType.LUNCH, MealType.DINNER);
        assertThat(extraction.recipes()).allSatisfy(recipe -> {
            assertThat(recipe.day()).isEqualTo("Day 1 (Monday)");
            assertThat(recipe.tags()).containsExactly("Day 1 (Monday)");
            assertThat(recipe.servings()).isEqualTo("4 people");
            assertThat(recipe.prepTime()).isEqualTo("15-30 minutes");
            assertThat(recipe.cookTime()).isEqualTo("Varies");
        });
        assertThat(extraction.recipes()).extracting(Recipe::id)
            .containsExactly("recipe-1", "recipe-2", "recipe-3");
    }

    @Test
    void collectsIngredientsAndInstructionsPerRecipe() {
        String text = """
            Monday:
            Dinner: Lemon Herb Salmon
            Ingredients:
            - 4 salmon fillets
            • 2 lemons
            * fresh dill
            Instructions:
            1. Preheat oven to 400F.
            2. Bake salmon for 15 minutes.
            Some commentary that is ignored
            Tuesday
            Lunch: Greek Salad
            Ingredients:
            - cucumber
            Directions:
            1. Chop and toss.
            Snacks: Apple slices
            """;

        MealPlanExtraction extraction = extractor.extract(text);

        assertThat(extraction.totalRecipes()).isEqualTo(3);
        Recipe salmon = extraction.recipes().get(0);
        assertThat(salmon.day()).isEqualTo("Monday");
        assertThat(salmon.tags()).containsExactly("Monday");
        assertThat(salmon.ingredients()).containsExactly("4 salmon fillets", "2 lemons", "fresh dill");
        assertThat(salmon.instructions()).containsExactly("Preheat oven to 400F.", "Bake salmon for 15 minutes.");

        Recipe salad = extraction.recipes().get(1);
        assertThat(salad.day()).isEqualTo("Tuesday");
        assertThat(salad.ingredients()).containsExactly("cucumber");
        assertThat(salad.instructions()).containsExactly("Chop and toss.");

        Recipe snack = extraction.recipes().get(2);
        assertThat(snack.mealType()).isEqualTo(MealType.SNACK);
        assertThat(snack.ingredients()).isEmpty();
    }

    @Test
    void recipesWithoutDayAreTaggedAsMealPlan() {
        MealPlanExtraction extraction = extractor.extract("Breakfast: Eggs\nLunch: Soup\nDinner: Tacos");

        assertThat(extraction.recipes()).allSatisfy(recipe -> {
            assertThat(recipe.day()).isEmpty();
            assertThat(recipe.tags()).containsExactly("meal plan");
        });
    }

    @Test
    void outputIsCappedAtSevenWhileTotalIsKept() {
        StringBuilder text = new StringBuilder();
        for (int day = 1; day <= 3; day++) {
            text.append("Day ").append(day).append(":\n")
                .append("- Breakfast: Breakfast ").append(day).append('\n')
                .append("- Lunch: Lunch ").append(day).append('\n')
                .append("- Dinner: Dinner ").append(day).append('\n');
        }

        MealPlanExtraction extraction = extractor.extract(text.toString());

        assertThat(extraction.totalRecipes()).isEqualTo(9);
        assertThat(extraction.recipes()).hasSize(7);
        assertThat(extraction.recipes().get(6).title()).isEqualTo("Breakfast 3");
        assertThat(extraction.recipes().get(6).day()).isEqualTo("Day 3");
    }

    @Test
    void fallbackPicksUpMealSentencesWhenHeadersAreSparse() {
        String text = """
            Here are some ideas for this week:
            **Grilled chicken with quinoa**
            # Creamy tomato soup
            Short salad
            1. Baked salmon with asparagus
            - Pasta primavera with peas
            2 cups pasta with extra sauce
            Grocery list: chicken with everything
            Leftover night with the family
            """;

        MealPlanExtraction extraction = extractor.extract(text);

        assertThat(extraction.recipes()).extracting(Recipe::title)
            .containsExactly("Grilled chicken with quinoa", "Creamy tomato soup", "Leftover night with the family");
        assertThat(extraction.recipes()).allSatisfy(recipe -> {
            assertThat(recipe.mealType()).isEqualTo(MealType.SUGGESTED_MEAL);
            assertThat(recipe.tags()).containsExactly("meal idea");
        });
        assertThat(extraction.totalRecipes()).isEqualTo(3);
    }

    @Test
    void fallbackIsAppendedAfterHeaderRecipesAndLimitedToFive() {
        StringBuilder text = new StringBuilder("Dinner: Tacos\n");
        for (int i = 1; i <= 8; i++) {
            text.append("Baked chicken variation number ").append(i).append('\n');
        }

        MealPlanExtraction extraction = extractor.extract(text.toString());

        assertThat(extraction.totalRecipes()).isEqualTo(6);
        assertThat(extraction.recipes().get(0).title()).isEqualTo("Tacos");
        assertThat(extraction.recipes().get(5).title()).isEqualTo("Baked chicken variation number 5");
    }

    @Test
    void emptyOrUnrecognisedTextYieldsEmptyResult() {
        assertThat(extractor.extract("")).isEqualTo(MealPlanExtraction.empty());
        assertThat(extractor.extract(null).recipes()).isEmpty();

        MealPlanExtraction nothing = extractor.extract("hello\nworld");
        assertThat(nothing.isMealPlan()).isTrue();
        assertThat(nothing.recipes()).isEmpty();
        assertThat(nothing.totalRecipes()).isZero();
    }

    @Test
    void recipeCountNeverExceedsConfiguredCap() {
        MealPlanNarrativeExtractor capped = new MealPlanNarrativeExtractor(
            new MealPlanExtractionSettings(2, 3, 5, "2", "5 min", "10 min"));

        MealPlanExtraction extraction = capped.extract("Breakfast: A\nLunch: B\nDinner: C\nSnack: D");

        assertThat(extraction.recipes()).hasSize(2);
        assertThat(extraction.totalRecipes()).isEqualTo(4);
        assertThat(extraction.recipes().get(0).servings()).isEqualTo("2");
        assertThat(extraction.recipes().get(0).id()).startsWith("recipe_");
    }
}
