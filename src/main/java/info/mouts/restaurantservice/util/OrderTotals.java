package info.mouts.restaurantservice.util;

import java.math.BigDecimal;

import info.mouts.restaurantservice.domain.Order;
import info.mouts.restaurantservice.domain.OrderItem;

/**
 * Monetary and count aggregates of an {@link Order}. Every line is computed on
 * its own and the lines are summed exactly, without intermediate rounding.
 */
public final class OrderTotals {
    private OrderTotals() {
    }

    /**
     * Quantity times unit price of a single line.
     *
     * @param item The order line.
     * @return The line total with two fractional digits.
     */
    public static BigDecimal lineTotal(OrderItem item) {
        BigDecimal total = item.getUnitPrice().multiply(BigDecimal.valueOf(item.getQuantity()));
        return MoneyUtils.normalize(total);
    }

    /**
     * Sum of all line totals. Returns {@code 0.00} for an order without items.
     *
     * @param order The order entity (must have items loaded).
     * @return The items total with two fractional digits.
     */
    public static BigDecimal itemsTotal(Order order) {
        if (order.getItems() == null || order.getItems().isEmpty()) {
            return MoneyUtils.normalize(BigDecimal.ZERO);
        }

        BigDecimal total = order.getItems().stream()
                .map(OrderTotals::lineTotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return MoneyUtils.normalize(total);
    }

    public static BigDecimal totalAmount(Order order) {
        BigDecimal deliveryFee = order.getDeliveryFee() == null ? BigDecimal.ZERO : order.getDeliveryFee();
        return MoneyUtils.normalize(itemsTotal(order).add(deliveryFee));
    }

    public static int totalItemsCount(Order order) {
        if (order.getItems() == null) {
            return 0;
        }
        return order.getItems().stream()
                .mapToInt(OrderItem::getQuantity)
                .sum();
    }
}
