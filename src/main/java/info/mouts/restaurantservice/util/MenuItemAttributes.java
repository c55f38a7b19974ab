package info.mouts.restaurantservice.util;

import java.util.ArrayList;
import java.util.List;

import info.mouts.restaurantservice.domain.FoodItem;
import info.mouts.restaurantservice.domain.PriceTier;

/**
 * Read-only attributes derived from a stored {@link FoodItem}.
 */
public final class MenuItemAttributes {
    public static final String VEGETARIAN = "Vegetarian";
    public static final String SPICY = "Spicy";

    private MenuItemAttributes() {
    }

    public static PriceTier priceTier(FoodItem item) {
        return PriceTier.of(item.getPrice());
    }

    /**
     * Dietary labels of the item, {@value #VEGETARIAN} first and then
     * {@value #SPICY}. Empty when neither applies.
     */
    public static List<String> dietaryInfo(FoodItem item) {
        List<String> info = new ArrayList<>();
        if (item.isVegetarian()) {
            info.add(VEGETARIAN);
        }
        if (item.isSpicy()) {
            info.add(SPICY);
        }
        return info;
    }
}
