package dev.pekelund.groceries.mealimport;

import java.util.List;

public record ShoppingList(String name, List<ShoppingItem> items) {

    public ShoppingList {
        items = items == null ? List.of() : List.copyOf(items);
    }
}
