package info.mouts.restaurantservice.mapper;

import java.util.List;

import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Mappings;

import info.mouts.restaurantservice.domain.Customer;
import info.mouts.restaurantservice.domain.Order;
import info.mouts.restaurantservice.domain.OrderItem;
import info.mouts.restaurantservice.dto.CustomerDTO;
import info.mouts.restaurantservice.dto.OrderItemRequestDTO;
import info.mouts.restaurantservice.dto.OrderItemResponseDTO;
import info.mouts.restaurantservice.dto.OrderRequestDTO;
import info.mouts.restaurantservice.dto.OrderResponseDTO;
import info.mouts.restaurantservice.dto.OrderSummaryResponseDTO;
import info.mouts.restaurantservice.util.MoneyUtils;
import info.mouts.restaurantservice.util.OrderTotals;

/**
 * Mapper interface for converting between Order DTOs (Data Transfer Objects)
 * and Order domain entities using MapStruct.
 * Totals on the response side are derived through {@link OrderTotals}.
 */
@Mapper(componentModel = "spring", imports = { MoneyUtils.class, OrderTotals.class })
public interface OrderMapper {

    /**
     * Maps an {@link OrderItemRequestDTO} to an {@link OrderItem} entity.
     * Ignores the 'id' and 'order' fields during mapping.
     *
     * @param dto The source {@link OrderItemRequestDTO}.
     * @return The mapped {@link OrderItem} entity.
     */
    @Mapping(target = "id", ignore = true)
    @Mapping(target = "order", ignore = true)
    @Mapping(target = "unitPrice", expression = "java(MoneyUtils.normalize(dto.getUnitPrice()))")
    OrderItem toEntity(OrderItemRequestDTO dto);

    /**
     * Maps a list of {@link OrderItemRequestDTO}s to a list of {@link OrderItem}
     * entities.
     *
     * @param dtoList The list of source {@link OrderItemRequestDTO}s.
     * @return A list of mapped {@link OrderItem} entities.
     */
    List<OrderItem> toEntityList(List<OrderItemRequestDTO> dtoList);

    Customer toCustomer(CustomerDTO dto);

    CustomerDTO toCustomerDto(Customer customer);

    /**
     * Maps an {@link OrderRequestDTO} to an {@link Order} entity.
     * Status and delivery fee are copied as given and may be {@code null}.
     *
     * @param dto The source {@link OrderRequestDTO}.
     * @return The mapped {@link Order} entity.
     */
    @Mappings({
            @Mapping(target = "id", ignore = true),
            @Mapping(target = "createdAt", ignore = true),
            @Mapping(target = "updatedAt", ignore = true),
            @Mapping(target = "version", ignore = true),
            @Mapping(target = "deliveryFee", expression = "java(MoneyUtils.normalize(dto.getDeliveryFee()))"),
            @Mapping(source = "items", target = "items")
    })
    Order toEntity(OrderRequestDTO dto);

    /**
     * Maps an {@link OrderItem} entity to an {@link OrderItemResponseDTO}.
     *
     * @param entity The source {@link OrderItem} entity.
     * @return The mapped {@link OrderItemResponseDTO}.
     */
    @Mapping(target = "itemTotal", expression = "java(OrderTotals.lineTotal(entity))")
    OrderItemResponseDTO toOrderItemResponseDto(OrderItem entity);

    /**
     * Maps a list of {@link OrderItem} entities to a list of
     * {@link OrderItemResponseDTO}s.
     *
     * @param entityList The list of source {@link OrderItem} entities.
     * @return A list of mapped {@link OrderItemResponseDTO}s.
     */
    List<OrderItemResponseDTO> toOrderItemResponseDtoList(List<OrderItem> entityList);

    /**
     * Maps an {@link Order} entity to an {@link OrderResponseDTO} with its items
     * and derived totals.
     *
     * @param entity The source {@link Order} entity.
     * @return The mapped {@link OrderResponseDTO}.
     */
    @Mappings({
            @Mapping(target = "itemsTotal", expression = "java(OrderTotals.itemsTotal(entity))"),
            @Mapping(target = "totalAmount", expression = "java(OrderTotals.totalAmount(entity))"),
            @Mapping(target = "totalItemsCount", expression = "java(OrderTotals.totalItemsCount(entity))")
    })
    OrderResponseDTO toOrderResponseDto(Order entity);

    /**
     * Maps an {@link Order} entity to the short {@link OrderSummaryResponseDTO}
     * used in listings.
     *
     * @param entity The source {@link Order} entity.
     * @return The mapped {@link OrderSummaryResponseDTO}.
     */
    @Mappings({
            @Mapping(source = "customer.name", target = "customerName"),
            @Mapping(target = "totalAmount", expression = "java(OrderTotals.totalAmount(entity))"),
            @Mapping(target = "totalItemsCount", expression = "java(OrderTotals.totalItemsCount(entity))")
    })
    OrderSummaryResponseDTO toOrderSummaryDto(Order entity);
}
