package info.mouts.restaurantservice.dto;

import java.math.BigDecimal;

import org.springframework.hateoas.RepresentationModel;
import org.springframework.hateoas.server.core.Relation;

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
@Relation(collectionRelation = "orderItems", itemRelation = "orderItem")
@Schema(description = "Details of a line within an order response")
public class OrderItemResponseDTO extends RepresentationModel<OrderItemResponseDTO> {
    @Schema(description = "Identifier of the order line", example = "7")
    private Long id;

    @Schema(description = "Identifier of the ordered menu item", example = "3")
    private Long menuItemId;

    @Schema(description = "Name of the menu item at ordering time", example = "Garlic Bread")
    private String menuItemName;

    @Schema(description = "Number of units ordered", example = "2")
    private Integer quantity;

    @Schema(description = "Price per unit", example = "2.50")
    private BigDecimal unitPrice;

    @Schema(description = "Quantity times unit price", example = "5.00")
    private BigDecimal itemTotal;
}
