package info.mouts.restaurantservice.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.util.Set;

import org.junit.jupiter.api.Test;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;

public class OrderTest {

    private static Validator validator = Validation.buildDefaultValidatorFactory().getValidator();

    private static Order newOrder() {
        return Order.builder()
                .id(1L)
                .customer(Customer.builder().name("Jane Doe").phone("5551234567").build())
                .status(OrderStatus.PENDING)
                .deliveryFee(new BigDecimal("2.99"))
                .build();
    }

    @Test
    void testOrderCreation() {
        Order order = newOrder();

        OrderItem item = OrderItem.builder().menuItemId(1L).menuItemName("Caesar Salad")
                .quantity(1).unitPrice(BigDecimal.TEN).build();
        order.addItem(item);

        assertEquals(OrderStatus.PENDING, order.getStatus());
        assertEquals(1, order.getItems().size());
        assertSame(order, item.getOrder(), "Order reference should be set in OrderItem");

        Set<ConstraintViolation<Order>> violations = validator.validate(order);
        assertTrue(violations.isEmpty(), "Order should be valid");
    }

    @Test
    void testAddItemsToOrder() {
        Order order = newOrder();

        OrderItem item1 = OrderItem.builder().menuItemId(1L).menuItemName("Caesar Salad")
                .quantity(1).unitPrice(BigDecimal.TEN).build();
        OrderItem item2 = OrderItem.builder().menuItemId(2L).menuItemName("Lemonade")
                .quantity(2).unitPrice(new BigDecimal("5.50")).build();

        order.addItem(item1);
        order.addItem(item2);

        assertEquals(2, order.getItems().size());

        OrderItem firstItem = order.getItems().get(0);
        OrderItem lastItem = order.getItems().get(1);

        assertSame(order, firstItem.getOrder());
        assertSame(order, lastItem.getOrder());
        assertEquals(item1, firstItem);
        assertEquals(item2, lastItem);
    }

    @Test
    void testOrderWithoutItemsIsInvalid() {
        Set<ConstraintViolation<Order>> violations = validator.validate(newOrder());

        assertFalse(violations.isEmpty());
        assertTrue(violations.stream().anyMatch(v -> v.getPropertyPath().toString().equals("items")));
    }

    @Test
    void testCustomerPhoneMustHaveTenDigits() {
        Order order = newOrder();
        order.getCustomer().setPhone("555-1234");
        order.addItem(OrderItem.builder().menuItemId(1L).menuItemName("Soup")
                .quantity(1).unitPrice(BigDecimal.ONE).build());

        Set<ConstraintViolation<Order>> violations = validator.validate(order);

        assertEquals(1, violations.size());
        assertEquals("customer.phone", violations.iterator().next().getPropertyPath().toString());
    }
}
