package dev.pekelund.groceries;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pekelund.groceries.catalog.CategoryClassifier;
import dev.pekelund.groceries.listparser.GroceryListParser;
import dev.pekelund.groceries.listparser.LineItemParser;
import dev.pekelund.groceries.mealimport.MealPlanDocumentReader;
import dev.pekelund.groceries.mealimport.StructuredMealPlanImporter;
import dev.pekelund.groceries.mealplan.MealPlanExtractionSettings;
import dev.pekelund.groceries.mealplan.MealPlanNarrativeExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Exposes the grocery list, narrative meal plan and structured meal plan parsers to an embedding
 * Spring application.
 */
@Configuration
public class GroceryParsingConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(GroceryParsingConfiguration.class);

    @Bean
    public CategoryClassifier categoryClassifier() {
        return new CategoryClassifier();
    }

    @Bean
    public LineItemParser lineItemParser(CategoryClassifier categoryClassifier) {
        return new LineItemParser(categoryClassifier);
    }

    @Bean
    public GroceryListParser groceryListParser(LineItemParser lineItemParser) {
        return new GroceryListParser(lineItemParser);
    }

    @Bean
    public MealPlanExtractionSettings mealPlanExtractionSettings() {
        MealPlanExtractionSettings settings = MealPlanExtractionSettings.fromEnvironment();
        LOGGER.info("Configured meal plan extraction - max recipes: {}, fallback threshold: {}, max fallback recipes: {}",
            settings.maxRecipes(), settings.fallbackThreshold(), settings.maxFallbackRecipes());
        return settings;
    }

    @Bean
    public MealPlanNarrativeExtractor mealPlanNarrativeExtractor(MealPlanExtractionSettings mealPlanExtractionSettings) {
        return new MealPlanNarrativeExtractor(mealPlanExtractionSettings);
    }

    @Bean
    public StructuredMealPlanImporter structuredMealPlanImporter(CategoryClassifier categoryClassifier) {
        return new StructuredMealPlanImporter(categoryClassifier);
    }

    /**
     * Uses the host application's {@link ObjectMapper} when it has one; otherwise the reader gets a
     * private mapper so that no {@code ObjectMapper} bean is contributed to the host context.
     */
    @Bean
    public MealPlanDocumentReader mealPlanDocumentReader(ObjectProvider<ObjectMapper> objectMapper) {
        ObjectMapper resolvedObjectMapper = objectMapper.getIfAvailable(GroceryParsingConfiguration::readerObjectMapper);
        LOGGER.info("Meal plan document reader using ObjectMapper instance id {}",
            System.identityHashCode(resolvedObjectMapper));
        return new MealPlanDocumentReader(resolvedObjectMapper);
    }

    private static ObjectMapper readerObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules();
        return mapper;
    }
}
