package info.mouts.restaurantservice.exception;

public class OrderItemNotFoundException extends RuntimeException {
    public OrderItemNotFoundException(Long orderId, Long itemId) {
        super("Order item with ID " + itemId + " not found within order ID " + orderId);
    }
}
