package info.mouts.restaurantservice.service;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import info.mouts.restaurantservice.domain.Order;
import info.mouts.restaurantservice.domain.OrderStatus;
import info.mouts.restaurantservice.dto.OrderRequestDTO;

public interface OrderService {
    /**
     * Validates an incoming order against its own rules and the menu, then
     * stores it. Nothing is stored when validation fails.
     *
     * @param request The {@link OrderRequestDTO} instance containing the order
     *                data received.
     * @return The saved {@link Order} entity.
     * @throws ValidationException          if the order is malformed.
     * @throws MenuItemReferenceException if a line points at a missing or
     *                                      unavailable menu item.
     */
    Order placeOrder(OrderRequestDTO request);

    /**
     * Finds an order by its unique ID.
     *
     * @param orderId The ID of the order to find.
     * @return The found Order entity.
     * @throws OrderNotFoundException if no order exists with the given ID.
     */
    Order findByOrderId(Long orderId);

    /**
     * Finds all orders with pagination.
     *
     * @param pageable The pagination information.
     * @return A page of orders.
     */
    Page<Order> findAll(Pageable pageable);

    /**
     * Overwrites the status of an order. Any status may follow any other.
     *
     * @param orderId The ID of the order.
     * @param status  The new status.
     * @return The updated order.
     * @throws OrderNotFoundException if no order exists with the given ID.
     */
    Order updateStatus(Long orderId, OrderStatus status);
}
