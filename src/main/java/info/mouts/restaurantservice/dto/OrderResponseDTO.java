package info.mouts.restaurantservice.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

import org.springframework.hateoas.RepresentationModel;
import org.springframework.hateoas.server.core.Relation;

import info.mouts.restaurantservice.domain.OrderStatus;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@EqualsAndHashCode(callSuper = false)
@Relation(collectionRelation = "orders", itemRelation = "order")
@Schema(description = "Detailed information about an order, including derived totals")
public class OrderResponseDTO extends RepresentationModel<OrderResponseDTO> {
    @Schema(description = "Identifier assigned by the service", example = "1")
    private Long id;

    private CustomerDTO customer;

    private List<OrderItemResponseDTO> items;

    @Schema(description = "Current status of the order", example = "pending")
    private OrderStatus status;

    @Schema(example = "2.99")
    private BigDecimal deliveryFee;

    @Schema(example = "Ring the bell twice")
    private String specialInstructions;

    @Schema(description = "Sum of all line totals", example = "15.00")
    private BigDecimal itemsTotal;

    @Schema(description = "Items total plus delivery fee", example = "17.99")
    private BigDecimal totalAmount;

    @Schema(description = "Sum of all quantities", example = "6")
    private Integer totalItemsCount;

    @Schema(description = "Timestamp when the order was created", example = "2025-04-01T12:00:00")
    private LocalDateTime createdAt;

    @Schema(description = "Timestamp of the last change", example = "2025-04-01T12:30:00")
    private LocalDateTime updatedAt;
}
