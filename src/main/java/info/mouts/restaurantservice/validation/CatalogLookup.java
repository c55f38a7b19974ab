package info.mouts.restaurantservice.validation;

import java.util.Optional;

import info.mouts.restaurantservice.domain.FoodItem;

/**
 * Read-only access to the menu, handed to {@link OrderValidator} so it can check
 * order lines without depending on the store.
 */
@FunctionalInterface
public interface CatalogLookup {
    Optional<FoodItem> findMenuItem(Long menuItemId);
}
