package dev.pekelund.groceries.mealimport;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;

/**
 * One day of a structured meal plan. {@code meals} is keyed by meal type ("breakfast", "lunch", ...)
 * and keeps the order of the source document.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DayPlan(
    Integer day,
    String date,
    String dayName,
    Map<String, MealDetail> meals
) {
}
