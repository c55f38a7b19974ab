package info.mouts.restaurantservice.repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;

import info.mouts.restaurantservice.domain.Customer;
import info.mouts.restaurantservice.domain.Order;
import info.mouts.restaurantservice.domain.OrderItem;
import info.mouts.restaurantservice.domain.OrderStatus;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
public class OrderRepositoryTest {
    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private OrderRepository orderRepository;

    @Autowired
    private OrderItemRepository orderItemRepository;

    private Order createTestOrder(String customerName) {
        Order order = Order.builder()
                .customer(Customer.builder().name(customerName).phone("5551234567").address("12 Baker Street")
                        .build())
                .status(OrderStatus.PENDING)
                .deliveryFee(new BigDecimal("2.99"))
                .build();

        order.addItem(OrderItem.builder()
                .menuItemId(1L)
                .menuItemName("Tomato Soup")
                .quantity(2)
                .unitPrice(new BigDecimal("2.50"))
                .build());
        order.addItem(OrderItem.builder()
                .menuItemId(2L)
                .menuItemName("Garlic Bread")
                .quantity(1)
                .unitPrice(BigDecimal.TEN)
                .build());
        return order;
    }

    @Test
    @DisplayName("Should save and retrieve an order with its customer and items")
    public void testSaveAndFindById() {
        Order savedOrder = orderRepository.save(createTestOrder("Jane Doe"));
        entityManager.flush();
        entityManager.clear();

        Optional<Order> foundOrderOpt = orderRepository.findById(savedOrder.getId());

        assertThat(foundOrderOpt).isPresent();

        Order foundOrder = foundOrderOpt.get();

        assertThat(foundOrder.getCustomer().getName()).isEqualTo("Jane Doe");
        assertThat(foundOrder.getCustomer().getPhone()).isEqualTo("5551234567");
        assertThat(foundOrder.getStatus()).isEqualTo(OrderStatus.PENDING);
        assertThat(foundOrder.getDeliveryFee()).isEqualTo(new BigDecimal("2.99"));
        assertThat(foundOrder.getItems()).hasSize(2);
        assertThat(foundOrder.getItems().get(0).getMenuItemName()).isEqualTo("Tomato Soup");
        assertThat(foundOrder.getItems().get(1).getUnitPrice()).isEqualTo(BigDecimal.TEN.setScale(2));
        assertThat(foundOrder.getCreatedAt()).isNotNull();
        assertThat(foundOrder.getUpdatedAt()).isNotNull();
        assertThat(foundOrder.getVersion()).isEqualTo(0);
    }

    @Test
    @DisplayName("Should assign increasing IDs to successive orders")
    void shouldAssignIncreasingIds() {
        Order first = orderRepository.saveAndFlush(createTestOrder("First Customer"));
        Order second = orderRepository.saveAndFlush(createTestOrder("Second Customer"));

        assertThat(first.getId()).isNotNull();
        assertThat(second.getId()).isGreaterThan(first.getId());
    }

    @Test
    @DisplayName("Should page orders")
    void shouldPageOrders() {
        for (int i = 0; i < 3; i++) {
            entityManager.persist(createTestOrder("Customer " + (char) ('A' + i)));
        }
        entityManager.flush();

        Page<Order> page = orderRepository.findAll(PageRequest.of(0, 2, Sort.by(Sort.Direction.DESC, "id")));

        assertThat(page.getContent()).hasSize(2);
        assertThat(page.getTotalElements()).isEqualTo(3);
        assertThat(page.getContent().get(0).getCustomer().getName()).isEqualTo("Customer C");
    }

    @Test
    @DisplayName("Should find the items of an order, and a single item only within its order")
    void shouldFindItemsScopedToOrder() {
        Order order = entityManager.persistFlushFind(createTestOrder("Jane Doe"));
        Order other = entityManager.persistFlushFind(createTestOrder("John Roe"));
        entityManager.clear();

        List<OrderItem> items = orderItemRepository.findByOrder_IdOrderByIdAsc(order.getId());
        assertThat(items).extracting(OrderItem::getMenuItemName).containsExactly("Tomato Soup", "Garlic Bread");

        Long itemId = items.get(0).getId();
        assertThat(orderItemRepository.findByIdAndOrder_Id(itemId, order.getId())).isPresent();
        assertThat(orderItemRepository.findByIdAndOrder_Id(itemId, other.getId())).isNotPresent();
    }

    @Test
    @DisplayName("Should increment version on update")
    void testOptimisticLockingVersionIncrement() {
        Order order = createTestOrder("Jane Doe");
        entityManager.persistAndFlush(order);
        long initialVersion = order.getVersion();
        entityManager.clear();

        Order orderToUpdate = orderRepository.findById(order.getId()).orElseThrow();
        orderToUpdate.setStatus(OrderStatus.DELIVERED);
        orderRepository.saveAndFlush(orderToUpdate);
        entityManager.clear();

        Order updatedOrder = orderRepository.findById(order.getId()).orElseThrow();
        assertThat(updatedOrder.getVersion()).isEqualTo(initialVersion + 1);
        assertThat(updatedOrder.getStatus()).isEqualTo(OrderStatus.DELIVERED);
    }
}
