package info.mouts.restaurantservice.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Helpers for monetary values. All amounts are {@link BigDecimal}s carried
 * with exactly {@value #MONEY_SCALE} fractional digits.
 */
public final class MoneyUtils {
    public static final int MONEY_SCALE = 2;

    private MoneyUtils() {
    }

    /**
     * Number of significant fractional digits, ignoring trailing zeros.
     * {@code 12.50} has one, {@code 12.00} and {@code 1E+1} have none.
     */
    public static int fractionDigits(BigDecimal amount) {
        return Math.max(amount.stripTrailingZeros().scale(), 0);
    }

    public static boolean hasMoneyScale(BigDecimal amount) {
        return fractionDigits(amount) <= MONEY_SCALE;
    }

    /**
     * Total number of significant digits once the amount is written with two
     * fractional digits, e.g. {@code 9999.99} has six. Amounts of one or more
     * are counted from their exponent, so {@code 1E+999999999} is never expanded.
     */
    public static int totalDigits(BigDecimal amount) {
        BigDecimal stripped = amount.abs().stripTrailingZeros();
        long integerDigits = (long) stripped.precision() - stripped.scale();
        if (stripped.signum() != 0 && integerDigits > 0) {
            return (int) Math.min(integerDigits + MONEY_SCALE, Integer.MAX_VALUE);
        }
        return amount.abs().setScale(MONEY_SCALE, RoundingMode.UNNECESSARY).precision();
    }

    /**
     * Rescales an amount to two fractional digits without rounding.
     *
     * @param amount The amount, may be {@code null}.
     * @return The rescaled amount, or {@code null} for a {@code null} input.
     * @throws ArithmeticException if the amount has more than two significant
     *                             fractional digits.
     */
    public static BigDecimal normalize(BigDecimal amount) {
        if (amount == null) {
            return null;
        }
        return amount.setScale(MONEY_SCALE, RoundingMode.UNNECESSARY);
    }
}
