package dev.pekelund.groceries.listparser;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Unit words recognised after a leading quantity, grouped in the order the matcher table tries them.
 */
public enum UnitVocabulary {

    WEIGHT("lb", "lbs", "pound", "pounds", "oz", "ounce", "ounces", "kg", "kilogram", "kilograms", "g", "gram",
        "grams"),
    VOLUME("l", "liter", "liters", "ml", "milliliter", "milliliters", "gal", "gallon", "gallons"),
    COOKING_VOLUME("cup", "cups", "tbsp", "tablespoon", "tablespoons", "tsp", "teaspoon", "teaspoons"),
    PACKAGING("pack", "packs", "package", "packages", "bag", "bags", "box", "boxes", "can", "cans", "jar", "jars",
        "bottle", "bottles"),
    DOZEN("dozen", "doz");

    private final List<String> words;

    UnitVocabulary(String... words) {
        this.words = List.of(words);
    }

    public List<String> words() {
        return words;
    }

    /**
     * Regex alternation over this group's words, longest first so that "lbs" is not cut short at "lb".
     */
    public String alternation() {
        return alternationOf(words);
    }

    /**
     * Regex alternation over every unit word of every group.
     */
    public static String fullAlternation() {
        return alternationOf(Arrays.stream(values())
            .flatMap(group -> group.words.stream())
            .collect(Collectors.toList()));
    }

    private static String alternationOf(List<String> words) {
        return words.stream()
            .distinct()
            .sorted(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()))
            .collect(Collectors.joining("|"));
    }
}
