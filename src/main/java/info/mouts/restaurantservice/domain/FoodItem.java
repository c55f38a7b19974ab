package info.mouts.restaurantservice.domain;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Represents a dish or drink on the menu.
 * Price tier and dietary info are not stored; see
 * {@link info.mouts.restaurantservice.util.MenuItemAttributes}.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString
@EqualsAndHashCode
@Entity
@Table(name = "food_items", indexes = {
        @Index(name = "idx_food_item_category", columnList = "category")
})
public class FoodItem {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotBlank(message = "Name cannot be blank")
    @Size(min = 3, max = 100)
    @Column(nullable = false, length = 100)
    private String name;

    @NotBlank(message = "Description cannot be blank")
    @Size(min = 10, max = 500)
    @Column(nullable = false, length = 500)
    private String description;

    @NotNull(message = "Category cannot be null")
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private FoodCategory category;

    @NotNull(message = "Price cannot be null")
    @DecimalMin("1.00")
    @DecimalMax("100.00")
    @Column(nullable = false, precision = 5, scale = 2)
    private BigDecimal price;

    @Builder.Default
    @Column(nullable = false)
    private boolean available = true;

    @NotNull(message = "Preparation time cannot be null")
    @Min(1)
    @Max(120)
    @Column(nullable = false, name = "preparation_time")
    private Integer preparationTime;

    @NotEmpty(message = "Item must have at least one ingredient")
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "food_item_ingredients", joinColumns = @JoinColumn(name = "food_item_id"))
    @OrderColumn(name = "position")
    @Column(name = "ingredient", nullable = false, length = 255)
    @Builder.Default
    private List<String> ingredients = new ArrayList<String>();

    @Positive
    private Integer calories;

    @Column(nullable = false)
    private boolean vegetarian;

    @Column(nullable = false)
    private boolean spicy;
}
