package info.mouts.restaurantservice.mapper;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;

import org.junit.jupiter.api.Test;
import org.mapstruct.factory.Mappers;

import info.mouts.restaurantservice.domain.FoodCategory;
import info.mouts.restaurantservice.domain.FoodItem;
import info.mouts.restaurantservice.dto.FoodItemRequestDTO;
import info.mouts.restaurantservice.dto.FoodItemResponseDTO;

class MenuMapperTest {

    private final MenuMapper menuMapper = Mappers.getMapper(MenuMapper.class);

    private static FoodItemRequestDTO curryRequest() {
        FoodItemRequestDTO request = new FoodItemRequestDTO();
        request.setName("Green Curry");
        request.setDescription("Thai green curry with jasmine rice");
        request.setCategory(FoodCategory.MAIN_COURSE);
        request.setPrice(new BigDecimal("14.5"));
        request.setPreparationTime(25);
        request.setIngredients(new ArrayList<>(Arrays.asList("coconut milk", "green chili", "rice")));
        request.setCalories(650);
        request.setVegetarian(true);
        request.setSpicy(true);
        return request;
    }

    @Test
    void toEntity_shouldNormalizePriceAndApplyDefaults() {
        FoodItem entity = menuMapper.toEntity(curryRequest());

        assertThat(entity.getId()).isNull();
        assertThat(entity.getPrice()).isEqualTo(new BigDecimal("14.50"));
        assertThat(entity.isAvailable()).isTrue();
        assertThat(entity.getIngredients()).containsExactly("coconut milk", "green chili", "rice");
    }

    @Test
    void updateEntity_shouldReplaceFieldsAndKeepId() {
        FoodItem existing = FoodItem.builder().id(9L).name("Old Name").available(true)
                .ingredients(new ArrayList<>(Arrays.asList("water"))).build();

        FoodItemRequestDTO request = curryRequest();
        request.setAvailable(false);
        menuMapper.updateEntity(request, existing);

        assertThat(existing.getId()).isEqualTo(9L);
        assertThat(existing.getName()).isEqualTo("Green Curry");
        assertThat(existing.isAvailable()).isFalse();
        assertThat(existing.getIngredients()).containsExactly("coconut milk", "green chili", "rice");
    }

    @Test
    void toFoodItemResponseDto_shouldAddDerivedAttributes() {
        FoodItem entity = menuMapper.toEntity(curryRequest());
        entity.setId(3L);

        FoodItemResponseDTO response = menuMapper.toFoodItemResponseDto(entity);

        assertThat(response.getId()).isEqualTo(3L);
        assertThat(response.getCategory()).isEqualTo(FoodCategory.MAIN_COURSE);
        assertThat(response.getPriceCategory()).isEqualTo("Mid-range");
        assertThat(response.getDietaryInfo()).containsExactly("Vegetarian", "Spicy");
        assertThat(response.getLinks()).isEmpty();
    }
}
