package info.mouts.restaurantservice.mapper;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.util.Arrays;

import org.junit.jupiter.api.Test;
import org.mapstruct.factory.Mappers;

import info.mouts.restaurantservice.domain.Customer;
import info.mouts.restaurantservice.domain.Order;
import info.mouts.restaurantservice.domain.OrderItem;
import info.mouts.restaurantservice.domain.OrderStatus;
import info.mouts.restaurantservice.dto.CustomerDTO;
import info.mouts.restaurantservice.dto.OrderItemRequestDTO;
import info.mouts.restaurantservice.dto.OrderRequestDTO;
import info.mouts.restaurantservice.dto.OrderResponseDTO;
import info.mouts.restaurantservice.dto.OrderSummaryResponseDTO;

class OrderMapperTest {

    private final OrderMapper orderMapper = Mappers.getMapper(OrderMapper.class);

    private static Order storedOrder() {
        Order order = Order.builder()
                .id(12L)
                .customer(Customer.builder().name("Jane Doe").phone("5551234567").build())
                .status(OrderStatus.READY)
                .deliveryFee(new BigDecimal("2.99"))
                .build();
        order.addItem(OrderItem.builder().id(1L).menuItemId(1L).menuItemName("Soup")
                .quantity(2).unitPrice(new BigDecimal("2.50")).build());
        order.addItem(OrderItem.builder().id(2L).menuItemId(2L).menuItemName("Bread")
                .quantity(2).unitPrice(new BigDecimal("2.50")).build());
        order.addItem(OrderItem.builder().id(3L).menuItemId(3L).menuItemName("Tea")
                .quantity(2).unitPrice(new BigDecimal("2.50")).build());
        return order;
    }

    @Test
    void toEntity_shouldCopyLinesAndNormalizeMoney() {
        OrderRequestDTO request = new OrderRequestDTO();
        request.setCustomer(new CustomerDTO("Jane Doe", "5551234567", null));
        request.setItems(Arrays.asList(new OrderItemRequestDTO(1L, "Soup", 2, new BigDecimal("2.5"))));
        request.setDeliveryFee(new BigDecimal("1.5"));
        request.setSpecialInstructions("No onions");

        Order order = orderMapper.toEntity(request);

        assertThat(order.getId()).isNull();
        assertThat(order.getStatus()).isNull();
        assertThat(order.getCustomer().getPhone()).isEqualTo("5551234567");
        assertThat(order.getDeliveryFee()).isEqualTo(new BigDecimal("1.50"));
        assertThat(order.getSpecialInstructions()).isEqualTo("No onions");
        assertThat(order.getItems()).hasSize(1);
        assertThat(order.getItems().get(0).getUnitPrice()).isEqualTo(new BigDecimal("2.50"));
        assertThat(order.getItems().get(0).getMenuItemName()).isEqualTo("Soup");
    }

    @Test
    void toEntity_shouldLeaveMissingDeliveryFeeUnset() {
        OrderRequestDTO request = new OrderRequestDTO();
        request.setItems(Arrays.asList(new OrderItemRequestDTO(1L, "Soup", 1, new BigDecimal("2.50"))));

        assertThat(orderMapper.toEntity(request).getDeliveryFee()).isNull();
    }

    @Test
    void toOrderResponseDto_shouldComputeTotals() {
        OrderResponseDTO response = orderMapper.toOrderResponseDto(storedOrder());

        assertThat(response.getId()).isEqualTo(12L);
        assertThat(response.getCustomer().getName()).isEqualTo("Jane Doe");
        assertThat(response.getItems()).hasSize(3);
        assertThat(response.getItems().get(0).getItemTotal()).isEqualTo(new BigDecimal("5.00"));
        assertThat(response.getItemsTotal()).isEqualTo(new BigDecimal("15.00"));
        assertThat(response.getTotalAmount()).isEqualTo(new BigDecimal("17.99"));
        assertThat(response.getTotalItemsCount()).isEqualTo(6);
    }

    @Test
    void toOrderSummaryDto_shouldFlattenCustomerName() {
        OrderSummaryResponseDTO summary = orderMapper.toOrderSummaryDto(storedOrder());

        assertThat(summary.getId()).isEqualTo(12L);
        assertThat(summary.getCustomerName()).isEqualTo("Jane Doe");
        assertThat(summary.getStatus()).isEqualTo(OrderStatus.READY);
        assertThat(summary.getTotalAmount()).isEqualTo(new BigDecimal("17.99"));
        assertThat(summary.getTotalItemsCount()).isEqualTo(6);
    }
}
