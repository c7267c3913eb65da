package dev.pekelund.groceries.catalog;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class CategoryClassifierTest {

    private final CategoryClassifier classifier = new CategoryClassifier();

    @ParameterizedTest
    @CsvSource({
        "Whole milk, DAIRY",
        "cheddar cheese, DAIRY",
        "sourdough bread, BAKERY",
        "bananas, PRODUCE",
        "romaine lettuce, PRODUCE",
        "chicken breast, MEAT",
        "organic quinoa, PANTRY",
        "rolled oats, PANTRY",
        "marinara sauce, PANTRY",
        "frozen peas, FROZEN",
        "paper towels, OTHER"
    })
    void classifiesByKeyword(String name, Category expected) {
        assertThat(classifier.classify(name)).isEqualTo(expected);
    }

    @Test
    void earlierRulesWinWhenKeywordsOverlap() {
        // "cream" is a dairy keyword and dairy is checked before frozen
        assertThat(classifier.classify("vanilla ice cream")).isEqualTo(Category.DAIRY);
        // "butter" beats "apple"
        assertThat(classifier.classify("apple butter")).isEqualTo(Category.DAIRY);
        // "fruit" is produce, checked before frozen
        assertThat(classifier.classify("frozen fruit")).isEqualTo(Category.PRODUCE);
        assertThat(classifier.classify("chicken soup")).isEqualTo(Category.MEAT);
    }

    @Test
    void classificationIgnoresCase() {
        assertThat(classifier.classify("MILK")).isEqualTo(classifier.classify("milk"));
        assertThat(classifier.classify("Salmon Fillets")).isEqualTo(Category.MEAT);
    }

    @Test
    void blankAndNullNamesAreOther() {
        assertThat(classifier.classify("")).isEqualTo(Category.OTHER);
        assertThat(classifier.classify("   ")).isEqualTo(Category.OTHER);
        assertThat(classifier.classify(null)).isEqualTo(Category.OTHER);
    }

    @Test
    void labelsRoundTripThroughFromLabel() {
        for (Category category : Category.values()) {
            assertThat(Category.fromLabel(category.label())).isEqualTo(category);
        }
        assertThat(Category.fromLabel("Produce ")).isEqualTo(Category.PRODUCE);
        assertThat(Category.fromLabel("canned")).isEqualTo(Category.OTHER);
    }
}
