package info.mouts.restaurantservice.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Confirmation of a menu item removal")
public class MenuItemDeletedResponseDTO {
    @Schema(example = "Menu item deleted successfully")
    private String message;

    @Schema(example = "3")
    private Long deletedItemId;
}
