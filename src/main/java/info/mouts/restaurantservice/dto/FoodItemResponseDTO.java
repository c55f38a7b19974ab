package info.mouts.restaurantservice.dto;

import java.math.BigDecimal;
import java.util.List;

import org.springframework.hateoas.RepresentationModel;
import org.springframework.hateoas.server.core.Relation;

import info.mouts.restaurantservice.domain.FoodCategory;
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
@Relation(collectionRelation = "menuItems", itemRelation = "menuItem")
@Schema(description = "Menu item with its derived attributes")
public class FoodItemResponseDTO extends RepresentationModel<FoodItemResponseDTO> {
    @Schema(description = "Identifier assigned by the service", example = "1")
    private Long id;

    @Schema(example = "Margherita Pizza")
    private String name;

    @Schema(example = "Tomato, mozzarella and fresh basil on a thin crust")
    private String description;

    @Schema(example = "main_course")
    private FoodCategory category;

    @Schema(example = "12.50")
    private BigDecimal price;

    @Schema(example = "true")
    private Boolean available;

    @Schema(description = "Preparation time in minutes", example = "15")
    private Integer preparationTime;

    private List<String> ingredients;

    @Schema(example = "650")
    private Integer calories;

    @Schema(example = "true")
    private Boolean vegetarian;

    @Schema(example = "false")
    private Boolean spicy;

    @Schema(description = "Budget (below 10), Mid-range (10 to 25) or Premium (above 25)", example = "Mid-range")
    private String priceCategory;

    @Schema(description = "Vegetarian and/or Spicy", example = "[\"Vegetarian\"]")
    private List<String> dietaryInfo;
}
