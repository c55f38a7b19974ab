package info.mouts.restaurantservice.service;

import java.util.List;

import info.mouts.restaurantservice.domain.FoodCategory;
import info.mouts.restaurantservice.domain.FoodItem;
import info.mouts.restaurantservice.dto.FoodItemRequestDTO;

public interface FoodItemService {
    /**
     * Finds all menu items.
     *
     * @return A list of all menu items, ordered by ID.
     */
    List<FoodItem> findAll();

    /**
     * Finds a menu item by its ID.
     *
     * @param menuItemId The ID of the menu item.
     * @return The found menu item.
     * @throws MenuItemNotFoundException if no menu item exists with the given ID.
     */
    FoodItem findById(Long menuItemId);

    List<FoodItem> findByCategory(FoodCategory category);

    /**
     * Validates a candidate menu item and stores it under a new ID.
     *
     * @param request The candidate menu item.
     * @return The stored menu item.
     * @throws ValidationException if the candidate breaks any rule.
     */
    FoodItem create(FoodItemRequestDTO request);

    /**
     * Validates a candidate menu item and replaces every field of the existing
     * item with it.
     *
     * @param menuItemId The ID of the menu item to replace.
     * @param request    The candidate menu item.
     * @return The replaced menu item.
     * @throws ValidationException      if the candidate breaks any rule.
     * @throws MenuItemNotFoundException if no menu item exists with the given ID.
     */
    FoodItem replace(Long menuItemId, FoodItemRequestDTO request);

    /**
     * Removes a menu item. Orders already referencing it are left untouched.
     *
     * @param menuItemId The ID of the menu item to delete.
     * @throws MenuItemNotFoundException if no menu item exists with the given ID.
     */
    void delete(Long menuItemId);
}
