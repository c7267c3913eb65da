package dev.pekelund.groceries.mealimport;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import java.math.BigDecimal;

/**
 * One ingredient line of a meal. {@code amount} may be written as a number or as text like "1/2".
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MealIngredient(
    String item,
    @JsonDeserialize(using = LenientAmountDeserializer.class) BigDecimal amount,
    String unit,
    String prep,
    String note,
    String size
) {
}
