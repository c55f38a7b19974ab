package info.mouts.restaurantservice.service.impl;

import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import info.mouts.restaurantservice.domain.OrderItem;
import info.mouts.restaurantservice.exception.OrderItemNotFoundException;
import info.mouts.restaurantservice.exception.OrderNotFoundException;
import info.mouts.restaurantservice.repository.OrderItemRepository;
import info.mouts.restaurantservice.repository.OrderRepository;
import info.mouts.restaurantservice.service.OrderItemService;
import lombok.extern.slf4j.Slf4j;

/**
 * Implementation of the {@link OrderItemService} interface.
 * Provides functionality to retrieve the lines of an order.
 */
@Service
@Slf4j
public class OrderItemServiceImpl implements OrderItemService {

    private final OrderItemRepository orderItemRepository;
    private final OrderRepository orderRepository;

    /**
     * Constructs an instance of {@code OrderItemServiceImpl}.
     *
     * @param orderItemRepository The repository for order item data access.
     * @param orderRepository     The repository used to confirm the parent order
     *                            exists.
     */
    public OrderItemServiceImpl(OrderItemRepository orderItemRepository, OrderRepository orderRepository) {
        this.orderItemRepository = orderItemRepository;
        this.orderRepository = orderRepository;
    }

    /**
     * Finds all order items associated with a specific order ID.
     *
     * @param orderId The ID of the order.
     * @return A {@link List} of {@link OrderItem} entities associated with the
     *         given order ID.
     * @throws OrderNotFoundException If no order exists with the given ID.
     */
    @Override
    @Transactional(readOnly = true)
    public List<OrderItem> findOrderItemsByOrderId(Long orderId) {
        log.debug("Attempting to find order items for the order with ID: {}", orderId);

        if (!orderRepository.existsById(orderId)) {
            log.warn("Order not found for ID: {}", orderId);
            throw new OrderNotFoundException(orderId);
        }

        return orderItemRepository.findByOrder_IdOrderByIdAsc(orderId);
    }

    /**
     * Finds a specific order item by its ID and validates that it belongs to the
     * parent order with the given ID.
     *
     * @param orderId The ID of the expected parent order
     * @param itemId  The ID of the order item to find.
     * @return The {@link OrderItem} entity if found.
     * @throws OrderItemNotFoundException If no such item exists within the order.
     */
    @Override
    @Transactional(readOnly = true)
    public OrderItem findByOrderIdAndItemId(Long orderId, Long itemId) {
        log.debug("Attempting to find order item by ID: {} for order ID: {}", itemId, orderId);

        OrderItem item = orderItemRepository.findByIdAndOrder_Id(itemId, orderId)
                .orElseThrow(() -> {
                    log.warn("Order item {} not found within order {}", itemId, orderId);
                    return new OrderItemNotFoundException(orderId, itemId);
                });

        log.debug("Order item {} found for order {}", itemId, orderId);
        return item;
    }

}
