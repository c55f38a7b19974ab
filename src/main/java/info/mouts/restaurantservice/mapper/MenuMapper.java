package info.mouts.restaurantservice.mapper;

import java.util.List;

import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.MappingTarget;

import info.mouts.restaurantservice.domain.FoodItem;
import info.mouts.restaurantservice.dto.FoodItemRequestDTO;
import info.mouts.restaurantservice.dto.FoodItemResponseDTO;
import info.mouts.restaurantservice.util.MenuItemAttributes;
import info.mouts.restaurantservice.util.MoneyUtils;

/**
 * Mapper interface for converting between menu item DTOs and the
 * {@link FoodItem} entity using MapStruct.
 * The response side adds the derived price category and dietary info.
 */
@Mapper(componentModel = "spring", imports = { MenuItemAttributes.class, MoneyUtils.class })
public interface MenuMapper {

    /**
     * Maps a validated {@link FoodItemRequestDTO} to a new {@link FoodItem}.
     * The price is rescaled to two fractional digits.
     *
     * @param dto The source {@link FoodItemRequestDTO}.
     * @return The mapped {@link FoodItem} entity, without an ID.
     */
    @Mapping(target = "id", ignore = true)
    @Mapping(target = "price", expression = "java(MoneyUtils.normalize(dto.getPrice()))")
    FoodItem toEntity(FoodItemRequestDTO dto);

    /**
     * Copies every field of a validated {@link FoodItemRequestDTO} onto an
     * existing {@link FoodItem}, keeping its ID.
     *
     * @param dto    The source {@link FoodItemRequestDTO}.
     * @param entity The entity being replaced.
     */
    @Mapping(target = "id", ignore = true)
    @Mapping(target = "price", expression = "java(MoneyUtils.normalize(dto.getPrice()))")
    void updateEntity(FoodItemRequestDTO dto, @MappingTarget FoodItem entity);

    /**
     * Maps a {@link FoodItem} to a {@link FoodItemResponseDTO}, computing the
     * price category and dietary info on the way.
     *
     * @param entity The source {@link FoodItem} entity.
     * @return The mapped {@link FoodItemResponseDTO}.
     */
    @Mapping(target = "priceCategory", expression = "java(MenuItemAttributes.priceTier(entity).getLabel())")
    @Mapping(target = "dietaryInfo", expression = "java(MenuItemAttributes.dietaryInfo(entity))")
    FoodItemResponseDTO toFoodItemResponseDto(FoodItem entity);

    List<FoodItemResponseDTO> toFoodItemResponseDtoList(List<FoodItem> entityList);
}
