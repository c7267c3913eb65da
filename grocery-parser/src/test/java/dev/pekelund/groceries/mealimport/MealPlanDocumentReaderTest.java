package dev.pekelund.groceries.mealimport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pekelund.groceries.catalog.CategoryClassifier;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class MealPlanDocumentReaderTest {

    private final MealPlanDocumentReader reader = new MealPlanDocumentReader(new ObjectMapper().findAndRegisterModules());

    @Test
    void readsWrappedFixture() throws IOException {
        MealPlanDocument document = reader.read(fixture("mealplans/two-day-family-plan.json"));

        assertThat(document.displayTitle()).isEqualTo("Healthy Family Meal Plan");
        assertThat(document.servings()).isEqualTo(4);
        assertThat(document.startDate()).isEqualTo("2025-01-06");
        assertThat(document.days()).hasSize(2);

        DayPlan monday = document.days().get(0);
        assertThat(monday.dayName()).isEqualTo("Monday");
        assertThat(monday.meals()).containsOnlyKeys("breakfast", "lunch", "dinner");
        assertThat(monday.meals().keySet()).containsExactly("breakfast", "lunch", "dinner");

        MealIngredient chia = monday.meals().get("breakfast").ingredients().get(2);
        assertThat(chia.item()).isEqualTo("chia seeds");
        assertThat(chia.amount()).isEqualByComparingTo("0.25");
        assertThat(chia.unit()).isEqualTo("cup");

        MealIngredient salmon = monday.meals().get("dinner").ingredients().get(0);
        assertThat(salmon.size()).isEqualTo("6 oz each");
    }

    @Test
    void readsBarePlanObject() {
        MealPlanDocument document = reader.read("""
            {"name": "Weeknight Plan", "days": [{"day": 1, "meals": {"dinner": {"ingredients": [{"item": "rice"}]}}}]}
            """);

        assertThat(document.title()).isNull();
        assertThat(document.displayTitle()).isEqualTo("Weeknight Plan");
        assertThat(document.days().get(0).meals().get("dinner").ingredients())
            .extracting(MealIngredient::item).containsExactly("rice");
    }

    @Test
    void stripsMarkdownCodeFences() {
        MealPlanDocument document = reader.read("""
            ```json
            {"mealPlan": {"title": "Fenced", "days": []}}
            ```
            """);

        assertThat(document.title()).isEqualTo("Fenced");
        assertThat(document.days()).isEmpty();
    }

    @Test
    void readsAmountsWrittenAsText() {
        MealPlanDocument document = reader.read("""
            {"days": [{"meals": {"dinner": {"ingredients": [
              {"item": "butter", "amount": "1/2", "unit": "cup"},
              {"item": "flour", "amount": "1 1/2", "unit": "cups"},
              {"item": "milk", "amount": " 2.5 ", "unit": "cups"},
              {"item": "salt", "amount": "a pinch"},
              {"item": "pepper", "amount": "1/0"},
              {"item": "rice", "amount": null},
              {"item": "beans", "amount": 3}
            ]}}}]}
            """);

        assertThat(document.days().get(0).meals().get("dinner").ingredients())
            .extracting(MealIngredient::amount)
            .containsExactly(new BigDecimal("0.5"), new BigDecimal("1.5"), new BigDecimal("2.5"), null, null, null,
                new BigDecimal("3"));
    }

    @Test
    void textAmountFallsBackToDefaultOnImport() {
        MealPlanDocument document = reader.read("""
            {"title": "Pinch", "days": [{"meals": {"dinner": {"ingredients": [
              {"item": "salt", "amount": "a pinch"},
              {"item": "sugar", "amount": "1/4", "unit": "cup"}
            ]}}}]}
            """);

        StructuredMealPlanImporter importer = new StructuredMealPlanImporter(new CategoryClassifier());
        ImportedMealPlan plan = importer.importMealPlan(document, "user");

        assertThat(plan.days().get("Monday").get("dinner").items())
            .extracting(MealItem::amount)
            .containsExactly(BigDecimal.ONE, new BigDecimal("0.25"));
    }

    @Test
    void rejectsStructuredAmount() {
        assertThatThrownBy(() -> reader.read("""
            {"days": [{"meals": {"dinner": {"ingredients": [{"item": "salt", "amount": [1, 2]}]}}}]}
            """))
            .isInstanceOf(MealPlanImportException.class)
            .hasMessage("Meal plan JSON does not match the expected structure");
    }

    @Test
    void rejectsBlankInput() {
        assertThatThrownBy(() -> reader.read("  "))
            .isInstanceOf(MealPlanImportException.class)
            .hasMessage("Meal plan JSON is required");
    }

    @Test
    void rejectsMalformedJson() {
        assertThatThrownBy(() -> reader.read("{\"mealPlan\": {\"days\": [}"))
            .isInstanceOf(MealPlanImportException.class)
            .hasMessage("Meal plan is not valid JSON")
            .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void rejectsNonObjectDocuments() {
        assertThatThrownBy(() -> reader.read("[1, 2, 3]"))
            .isInstanceOf(MealPlanImportException.class)
            .hasMessage("Meal plan JSON must be an object");
        assertThatThrownBy(() -> reader.read("{\"mealPlan\": null}"))
            .isInstanceOf(MealPlanImportException.class)
            .hasMessage("mealPlan property is required");
    }

    @Test
    void rejectsMismatchedStructure() {
        assertThatThrownBy(() -> reader.read("{\"mealPlan\": {\"days\": \"every day\"}}"))
            .isInstanceOf(MealPlanImportException.class)
            .hasMessage("Meal plan JSON does not match the expected structure");
    }

    static String fixture(String path) throws IOException {
        try (InputStream input = MealPlanDocumentReaderTest.class.getClassLoader().getResourceAsStream(path)) {
            assertThat(input).as("fixture %s", path).isNotNull();
            return new String(input.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
