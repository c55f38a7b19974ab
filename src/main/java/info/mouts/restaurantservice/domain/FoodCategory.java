package info.mouts.restaurantservice.domain;

import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Menu section a {@link FoodItem} belongs to.
 */
public enum FoodCategory {
    APPETIZER("appetizer"),
    MAIN_COURSE("main_course"),
    DESSERT("dessert"),
    BEVERAGE("beverage"),
    SALAD("salad");

    private final String value;

    FoodCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Resolves a category from its wire value, ignoring case.
     *
     * @param value The wire value, e.g. {@code "main_course"}.
     * @return The matching {@link FoodCategory}.
     * @throws IllegalArgumentException if no category has the given value.
     */
    @JsonCreator
    public static FoodCategory fromValue(String value) {
        return Arrays.stream(values())
                .filter(category -> category.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown food category: " + value));
    }
}
