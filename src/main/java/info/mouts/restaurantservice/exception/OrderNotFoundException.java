package info.mouts.restaurantservice.exception;

import lombok.Getter;

@Getter
public class OrderNotFoundException extends RuntimeException {
    private final Long orderId;

    public OrderNotFoundException(Long orderId) {
        super("Order not found for ID: " + orderId);
        this.orderId = orderId;
    }
}
