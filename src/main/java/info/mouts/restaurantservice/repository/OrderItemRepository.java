package info.mouts.restaurantservice.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import info.mouts.restaurantservice.domain.OrderItem;

/**
 * Repository interface for managing {@link OrderItem} entities.
 */
@Repository
public interface OrderItemRepository extends JpaRepository<OrderItem, Long> {
    /**
     * Finds all order items by the given order ID, in insertion order.
     *
     * @param orderId The ID of the order to find items for
     * @return A list of order items associated with the given order ID
     */
    List<OrderItem> findByOrder_IdOrderByIdAsc(Long orderId);

    /**
     * Finds an order item by its ID, restricted to the given parent order.
     *
     * @param id      The ID of the order item
     * @param orderId The ID of the expected parent order
     * @return an optional containing the item if it exists within the order
     */
    Optional<OrderItem> findByIdAndOrder_Id(Long id, Long orderId);
}
