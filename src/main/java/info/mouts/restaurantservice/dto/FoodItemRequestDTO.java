package info.mouts.restaurantservice.dto;

import java.math.BigDecimal;
import java.util.List;

import info.mouts.restaurantservice.domain.FoodCategory;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Candidate menu item as received on create and full replace. Checked by
 * {@link info.mouts.restaurantservice.validation.FoodItemValidator}.
 */
@Data
@NoArgsConstructor
@Schema(description = "Menu item to create or replace")
public class FoodItemRequestDTO {
    @Schema(description = "Letters and spaces only, 3 to 100 characters", example = "Margherita Pizza")
    private String name;

    @Schema(description = "10 to 500 characters", example = "Tomato, mozzarella and fresh basil on a thin crust")
    private String description;

    @Schema(description = "Menu section", example = "main_course")
    private FoodCategory category;

    @Schema(description = "Between 1.00 and 100.00, at most two decimals", example = "12.50")
    private BigDecimal price;

    @Schema(description = "Whether the item can be ordered", example = "true")
    private Boolean available = Boolean.TRUE;

    @Schema(description = "Minutes, 1 to 120 (at most 10 for beverages)", example = "15")
    private Integer preparationTime;

    @Schema(description = "At least one ingredient", example = "[\"tomato\", \"mozzarella\", \"basil\"]")
    private List<String> ingredients;

    @Schema(description = "Optional, positive; below 800 for vegetarian items", example = "650")
    private Integer calories;

    @Schema(example = "true")
    private Boolean vegetarian = Boolean.FALSE;

    @Schema(description = "Desserts and beverages cannot be spicy", example = "false")
    private Boolean spicy = Boolean.FALSE;
}
