package info.mouts.restaurantservice.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Customer placing the order")
public class CustomerDTO {
    @Schema(description = "2 to 50 characters", example = "Jane Doe")
    private String name;

    @Schema(description = "Exactly 10 digits", example = "5551234567")
    private String phone;

    @Schema(description = "Optional, up to 200 characters", example = "12 Baker Street")
    private String address;
}
