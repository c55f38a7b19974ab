package info.mouts.restaurantservice.domain;

import java.math.BigDecimal;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Price band of a menu item, derived from its price and never stored.
 */
public enum PriceTier {
    BUDGET("Budget"),
    MID_RANGE("Mid-range"),
    PREMIUM("Premium");

    private static final BigDecimal MID_RANGE_FLOOR = new BigDecimal("10");
    private static final BigDecimal MID_RANGE_CEILING = new BigDecimal("25");

    private final String label;

    PriceTier(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Classifies a price: below 10 is {@link #BUDGET}, 10 to 25 inclusive is
     * {@link #MID_RANGE}, anything above is {@link #PREMIUM}.
     *
     * @param price The item price, never {@code null}.
     * @return The tier of the price.
     */
    public static PriceTier of(BigDecimal price) {
        if (price.compareTo(MID_RANGE_FLOOR) < 0) {
            return BUDGET;
        }
        if (price.compareTo(MID_RANGE_CEILING) <= 0) {
            return MID_RANGE;
        }
        return PREMIUM;
    }
}
