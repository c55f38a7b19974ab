package info.mouts.restaurantservice.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Customer details embedded in an {@link Order}. Has no identity of its own.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString
@EqualsAndHashCode
@Embeddable
public class Customer {
    @NotBlank(message = "Customer name cannot be blank")
    @Size(min = 2, max = 50)
    @Column(nullable = false, name = "customer_name", length = 50)
    private String name;

    @NotBlank(message = "Customer phone cannot be blank")
    @Pattern(regexp = "^\\d{10}$", message = "Customer phone must have exactly 10 digits")
    @Column(nullable = false, name = "customer_phone", length = 10)
    private String phone;

    @Size(max = 200)
    @Column(name = "customer_address", length = 200)
    private String address;
}
