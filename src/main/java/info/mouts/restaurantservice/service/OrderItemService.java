package info.mouts.restaurantservice.service;

import java.util.List;

import info.mouts.restaurantservice.domain.OrderItem;

public interface OrderItemService {
    /**
     * Finds all order items for a given order ID.
     *
     * @param orderId The ID of the order to find items for.
     * @return A list of all order items for the given order ID.
     * @throws OrderNotFoundException if no order exists with the given ID.
     */
    List<OrderItem> findOrderItemsByOrderId(Long orderId);

    /**
     * Finds an order item by its unique ID, ensuring it belongs to the specified
     * order ID.
     *
     * @param orderId The ID of the parent order.
     * @param itemId  The ID of the item to find.
     * @return The order item with the given ID.
     */
    OrderItem findByOrderIdAndItemId(Long orderId, Long itemId);
}
