package info.mouts.restaurantservice.dto;

import java.math.BigDecimal;
import java.util.List;

import info.mouts.restaurantservice.domain.OrderStatus;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Candidate order. Checked by
 * {@link info.mouts.restaurantservice.validation.OrderValidator}; status and
 * delivery fee fall back to {@code pending} and the configured default fee.
 */
@Data
@NoArgsConstructor
public class OrderRequestDTO {
    private CustomerDTO customer;

    private List<OrderItemRequestDTO> items;

    private OrderStatus status;

    private BigDecimal deliveryFee;

    private String specialInstructions;
}
