package info.mouts.restaurantservice.domain;

import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Represents the current status of an order.
 * Any status may be replaced by any other status; there is no transition
 * table.
 */
public enum OrderStatus {
    /**
     * Initial state of every newly placed order.
     */
    PENDING("pending"),

    /**
     * The kitchen has accepted the order.
     */
    CONFIRMED("confirmed"),

    /**
     * The order is prepared and waiting for pickup or delivery.
     */
    READY("ready"),

    /**
     * The order has been handed over to the customer.
     */
    DELIVERED("delivered");

    private final String value;

    OrderStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Resolves a status from its wire value, ignoring case.
     *
     * @param value The wire value, e.g. {@code "ready"}.
     * @return The matching {@link OrderStatus}.
     * @throws IllegalArgumentException if no status has the given value.
     */
    @JsonCreator
    public static OrderStatus fromValue(String value) {
        return Arrays.stream(values())
                .filter(status -> status.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown order status: " + value));
    }
}
