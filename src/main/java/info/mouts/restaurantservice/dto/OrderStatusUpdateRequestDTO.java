package info.mouts.restaurantservice.dto;

import info.mouts.restaurantservice.domain.OrderStatus;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class OrderStatusUpdateRequestDTO {
    @NotNull(message = "Status cannot be null in status update request")
    private OrderStatus status;
}
