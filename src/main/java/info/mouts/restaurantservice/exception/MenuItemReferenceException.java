package info.mouts.restaurantservice.exception;

import info.mouts.restaurantservice.domain.FoodItem;
import lombok.Getter;

/**
 * Thrown when an order line points at a menu item that cannot be ordered.
 * The faulty input is the order body, so this is a client error rather than
 * a missing resource.
 */
@Getter
public class MenuItemReferenceException extends RuntimeException {
    public enum Reason {
        NOT_FOUND,
        UNAVAILABLE
    }

    private final Long menuItemId;
    private final Reason reason;

    private MenuItemReferenceException(Long menuItemId, Reason reason, String message) {
        super(message);
        this.menuItemId = menuItemId;
        this.reason = reason;
    }

    public static MenuItemReferenceException notFound(Long menuItemId) {
        return new MenuItemReferenceException(menuItemId, Reason.NOT_FOUND,
                "Menu item with ID " + menuItemId + " not found");
    }

    public static MenuItemReferenceException unavailable(FoodItem menuItem) {
        return new MenuItemReferenceException(menuItem.getId(), Reason.UNAVAILABLE,
                "Menu item '" + menuItem.getName() + "' is not available");
    }
}
