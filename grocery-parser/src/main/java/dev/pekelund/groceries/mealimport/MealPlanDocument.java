package dev.pekelund.groceries.mealimport;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * Structured meal plan as submitted for import, typically the {@code mealPlan} object of a JSON upload.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MealPlanDocument(
    String title,
    String name,
    Integer servings,
    String startDate,
    String endDate,
    List<DayPlan> days
) {

    /**
     * The plan title, falling back to {@code name} for documents that use that field instead.
     */
    public String displayTitle() {
        if (title != null && !title.isBlank()) {
            return title.trim();
        }
        return name != null && !name.isBlank() ? name.trim() : null;
    }
}
