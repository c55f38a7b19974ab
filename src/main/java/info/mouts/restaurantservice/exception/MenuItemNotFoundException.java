package info.mouts.restaurantservice.exception;

import lombok.Getter;

/**
 * Thrown when a menu item addressed by the request path does not exist.
 * A missing menu item referenced from an order body is reported with
 * {@link MenuItemReferenceException} instead.
 */
@Getter
public class MenuItemNotFoundException extends RuntimeException {
    private final Long menuItemId;

    public MenuItemNotFoundException(Long menuItemId) {
        super("Menu item not found for ID: " + menuItemId);
        this.menuItemId = menuItemId;
    }
}
