package info.mouts.restaurantservice.service.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import info.mouts.restaurantservice.domain.Order;
import info.mouts.restaurantservice.domain.OrderItem;
import info.mouts.restaurantservice.exception.OrderItemNotFoundException;
import info.mouts.restaurantservice.exception.OrderNotFoundException;
import info.mouts.restaurantservice.repository.OrderItemRepository;
import info.mouts.restaurantservice.repository.OrderRepository;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
public class OrderItemServiceTest {
    @Mock
    private OrderItemRepository orderItemRepository;

    @Mock
    private OrderRepository orderRepository;

    @InjectMocks
    private OrderItemServiceImpl orderItemService;

    private Order mappedOrder;
    private OrderItem item1;
    private OrderItem item2;
    private Long orderId = 10L;

    @BeforeEach
    void setUp() {
        mappedOrder = Order.builder().id(orderId).build();

        item1 = OrderItem.builder()
                .id(100L)
                .order(mappedOrder)
                .menuItemId(1L)
                .menuItemName("Tomato Soup")
                .quantity(2)
                .unitPrice(BigDecimal.TEN)
                .build();

        item2 = OrderItem.builder()
                .id(101L)
                .order(mappedOrder)
                .menuItemId(2L)
                .menuItemName("Garlic Bread")
                .quantity(1)
                .unitPrice(BigDecimal.ONE)
                .build();
    }

    @Test
    @DisplayName("Should return list of order items for a given order ID")
    void findOrderItemsByOrderId_found() {
        when(orderRepository.existsById(orderId)).thenReturn(true);
        when(orderItemRepository.findByOrder_IdOrderByIdAsc(orderId)).thenReturn(Arrays.asList(item1, item2));

        List<OrderItem> result = orderItemService.findOrderItemsByOrderId(orderId);

        assertThat(result).containsExactly(item1, item2);
        verify(orderItemRepository, times(1)).findByOrder_IdOrderByIdAsc(orderId);
    }

    @Test
    @DisplayName("Should return empty list when the order exists but has no items")
    void findOrderItemsByOrderId_empty() {
        when(orderRepository.existsById(orderId)).thenReturn(true);
        when(orderItemRepository.findByOrder_IdOrderByIdAsc(orderId)).thenReturn(Collections.emptyList());

        assertThat(orderItemService.findOrderItemsByOrderId(orderId)).isEmpty();
    }

    @Test
    @DisplayName("Should throw OrderNotFoundException when the order does not exist")
    void findOrderItemsByOrderId_orderNotFound() {
        when(orderRepository.existsById(99L)).thenReturn(false);

        OrderNotFoundException thrown = assertThrows(OrderNotFoundException.class,
                () -> orderItemService.findOrderItemsByOrderId(99L));

        assertThat(thrown.getMessage()).contains("99");
        verify(orderItemRepository, never()).findByOrder_IdOrderByIdAsc(anyLong());
    }

    @Test
    @DisplayName("Should return order item when found within the order")
    void findByOrderIdAndItemId_found() {
        when(orderItemRepository.findByIdAndOrder_Id(100L, orderId)).thenReturn(Optional.of(item1));

        OrderItem result = orderItemService.findByOrderIdAndItemId(orderId, 100L);

        assertThat(result).isEqualTo(item1);
        verify(orderItemRepository, times(1)).findByIdAndOrder_Id(100L, orderId);
    }

    @Test
    @DisplayName("Should throw OrderItemNotFoundException when the item is not part of the order")
    void findByOrderIdAndItemId_notFound() {
        when(orderItemRepository.findByIdAndOrder_Id(100L, 11L)).thenReturn(Optional.empty());

        OrderItemNotFoundException thrown = assertThrows(OrderItemNotFoundException.class,
                () -> orderItemService.findByOrderIdAndItemId(11L, 100L));

        assertThat(thrown.getMessage()).isEqualTo("Order item with ID 100 not found within order ID 11");
    }
}
