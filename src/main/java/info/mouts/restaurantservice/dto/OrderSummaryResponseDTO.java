package info.mouts.restaurantservice.dto;

import java.math.BigDecimal;

import org.springframework.hateoas.server.core.Relation;

import info.mouts.restaurantservice.domain.OrderStatus;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Relation(collectionRelation = "orders", itemRelation = "order")
@Schema(description = "Short form of an order used in listings")
public class OrderSummaryResponseDTO {
    @Schema(example = "1")
    private Long id;

    @Schema(example = "Jane Doe")
    private String customerName;

    @Schema(example = "pending")
    private OrderStatus status;

    @Schema(example = "17.99")
    private BigDecimal totalAmount;

    @Schema(example = "6")
    private Integer totalItemsCount;
}
