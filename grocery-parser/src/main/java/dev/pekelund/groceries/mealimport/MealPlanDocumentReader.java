package dev.pekelund.groceries.mealimport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Reads structured meal plan JSON. Both the wrapped form {@code {"mealPlan": {...}}} and a bare plan
 * object are accepted, and Markdown code fences around the JSON (as AI assistants tend to add) are removed.
 */
public class MealPlanDocumentReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(MealPlanDocumentReader.class);

    private static final String WRAPPER_FIELD = "mealPlan";

    private final ObjectMapper objectMapper;

    public MealPlanDocumentReader(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public MealPlanDocument read(String json) {
        if (!StringUtils.hasText(json)) {
            throw new MealPlanImportException("Meal plan JSON is required");
        }

        String sanitised = stripCodeFences(json);
        JsonNode root;
        try {
            root = objectMapper.readTree(sanitised);
        } catch (IOException ex) {
            LOGGER.warn("Failed to parse meal plan JSON. Payload begins with: {}", preview(sanitised));
            throw new MealPlanImportException("Meal plan is not valid JSON", ex);
        }

        if (root == null || !root.isObject()) {
            throw new MealPlanImportException("Meal plan JSON must be an object");
        }
        JsonNode plan = root.has(WRAPPER_FIELD) ? root.get(WRAPPER_FIELD) : root;
        if (plan.isNull()) {
            throw new MealPlanImportException("mealPlan property is required");
        }

        try {
            return objectMapper.treeToValue(plan, MealPlanDocument.class);
        } catch (IOException | IllegalArgumentException ex) {
            throw new MealPlanImportException("Meal plan JSON does not match the expected structure", ex);
        }
    }

    private String stripCodeFences(String json) {
        String trimmed = json.trim();
        if (trimmed.startsWith("```") && trimmed.endsWith("```") && trimmed.length() >= 6) {
            int firstBreak = trimmed.indexOf('\n');
            if (firstBreak > 0) {
                trimmed = trimmed.substring(firstBreak + 1, trimmed.length() - 3).trim();
            } else {
                trimmed = trimmed.substring(3, trimmed.length() - 3).trim();
            }
            LOGGER.debug("Removed Markdown code fences from meal plan JSON");
        }
        return trimmed;
    }

    private String preview(String value) {
        int max = Math.min(value.length(), 256);
        return value.substring(0, max);
    }
}
