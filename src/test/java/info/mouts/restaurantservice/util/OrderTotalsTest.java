package info.mouts.restaurantservice.util;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;

import org.junit.jupiter.api.Test;

import info.mouts.restaurantservice.domain.Order;
import info.mouts.restaurantservice.domain.OrderItem;

class OrderTotalsTest {

    private static OrderItem line(long menuItemId, int quantity, String unitPrice) {
        return OrderItem.builder()
                .menuItemId(menuItemId)
                .menuItemName("Item " + menuItemId)
                .quantity(quantity)
                .unitPrice(new BigDecimal(unitPrice))
                .build();
    }

    @Test
    void threeLinesOfTwo_shouldSumExactly() {
        Order order = Order.builder().deliveryFee(new BigDecimal("2.99")).build();
        order.addItem(line(1, 2, "2.50"));
        order.addItem(line(2, 2, "2.50"));
        order.addItem(line(3, 2, "2.50"));

        assertThat(OrderTotals.itemsTotal(order)).isEqualTo(new BigDecimal("15.00"));
        assertThat(OrderTotals.totalAmount(order)).isEqualTo(new BigDecimal("17.99"));
        assertThat(OrderTotals.totalItemsCount(order)).isEqualTo(6);
    }

    @Test
    void decimalFractions_shouldNotDrift() {
        Order order = Order.builder().deliveryFee(new BigDecimal("0.00")).build();
        for (int i = 1; i <= 10; i++) {
            order.addItem(line(i, 1, "0.10"));
        }

        assertThat(OrderTotals.itemsTotal(order)).isEqualTo(new BigDecimal("1.00"));
        assertThat(OrderTotals.totalAmount(order)).isEqualTo(new BigDecimal("1.00"));
    }

    @Test
    void lineTotal_shouldCarryTwoFractionDigits() {
        assertThat(OrderTotals.lineTotal(line(1, 3, "8.5"))).isEqualTo(new BigDecimal("25.50"));
        assertThat(OrderTotals.lineTotal(line(1, 10, "9999.99"))).isEqualTo(new BigDecimal("99999.90"));
    }

    @Test
    void orderWithoutItems_shouldTotalTheDeliveryFee() {
        Order order = Order.builder().deliveryFee(new BigDecimal("2.99")).build();

        assertThat(OrderTotals.itemsTotal(order)).isEqualTo(new BigDecimal("0.00"));
        assertThat(OrderTotals.totalAmount(order)).isEqualTo(new BigDecimal("2.99"));
        assertThat(OrderTotals.totalItemsCount(order)).isZero();
    }

    @Test
    void missingDeliveryFee_shouldCountAsZero() {
        Order order = Order.builder().build();
        order.addItem(line(1, 1, "4.00"));

        assertThat(OrderTotals.totalAmount(order)).isEqualTo(new BigDecimal("4.00"));
    }
}
