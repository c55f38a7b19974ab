package info.mouts.restaurantservice.service.impl;

import java.math.BigDecimal;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import info.mouts.restaurantservice.domain.Order;
import info.mouts.restaurantservice.domain.OrderStatus;
import info.mouts.restaurantservice.dto.OrderRequestDTO;
import info.mouts.restaurantservice.exception.MenuItemReferenceException;
import info.mouts.restaurantservice.exception.OrderNotFoundException;
import info.mouts.restaurantservice.exception.ValidationException;
import info.mouts.restaurantservice.mapper.OrderMapper;
import info.mouts.restaurantservice.repository.FoodItemRepository;
import info.mouts.restaurantservice.repository.OrderRepository;
import info.mouts.restaurantservice.service.OrderService;
import info.mouts.restaurantservice.util.MoneyUtils;
import info.mouts.restaurantservice.util.OrderTotals;
import info.mouts.restaurantservice.validation.CatalogLookup;
import info.mouts.restaurantservice.validation.OrderValidator;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

/**
 * Implementation of the {@link OrderService} interface.
 * Handles the business logic related to order placement, retrieval, and
 * status changes.
 * Includes metric collection for placed and rejected orders.
 */
@Service
@Slf4j
public class OrderServiceImpl implements OrderService {

    private final OrderRepository orderRepository;
    private final OrderMapper orderMapper;
    private final OrderValidator orderValidator;
    private final CatalogLookup catalogLookup;
    private final BigDecimal defaultDeliveryFee;

    private Timer orderPlacementTimer;
    private Counter placedOrdersCounter;
    private Counter invalidOrdersCounter;
    private Counter unknownItemOrdersCounter;
    private Counter unavailableItemOrdersCounter;

    /**
     * Constructs an instance of {@code OrderServiceImpl}.
     *
     * @param orderRepository    The repository for order data access.
     * @param foodItemRepository The menu store, exposed to validation as a
     *                           read-only {@link CatalogLookup}.
     * @param orderMapper        The mapper for converting between DTOs and
     *                           entities.
     * @param orderValidator     The validator applied to every candidate order.
     * @param meterRegistry      The registry for collecting metrics.
     * @param defaultDeliveryFee The fee applied when the request carries none.
     */
    public OrderServiceImpl(OrderRepository orderRepository, FoodItemRepository foodItemRepository,
            OrderMapper orderMapper, OrderValidator orderValidator, MeterRegistry meterRegistry,
            @Value("${app.orders.default-delivery-fee:2.99}") BigDecimal defaultDeliveryFee) {
        this.orderRepository = orderRepository;
        this.orderMapper = orderMapper;
        this.orderValidator = orderValidator;
        this.catalogLookup = foodItemRepository::findById;
        this.defaultDeliveryFee = MoneyUtils.normalize(defaultDeliveryFee);

        initializeMetrics(meterRegistry);
    }

    /**
     * Validates and saves an incoming order. Status defaults to
     * {@link OrderStatus#PENDING} and the delivery fee to the configured
     * default. A rejected order is never saved, so it consumes no ID.
     *
     * @param request The {@link OrderRequestDTO} containing the order details.
     * @return The saved {@link Order} entity.
     * @throws ValidationException          If the order is malformed.
     * @throws MenuItemReferenceException If a line points at a missing or
     *                                      unavailable menu item.
     */
    @Override
    @Transactional
    public Order placeOrder(OrderRequestDTO request) {
        return this.orderPlacementTimer.record(() -> {
            log.info("Processing incoming order for customer {}",
                    request.getCustomer() == null ? null : request.getCustomer().getName());

            try {
                orderValidator.validate(request, catalogLookup);
            } catch (ValidationException e) {
                invalidOrdersCounter.increment();
                throw e;
            } catch (MenuItemReferenceException e) {
                if (e.getReason() == MenuItemReferenceException.Reason.NOT_FOUND) {
                    unknownItemOrdersCounter.increment();
                } else {
                    unavailableItemOrdersCounter.increment();
                }
                throw e;
            }

            Order order = orderMapper.toEntity(request);
            order.getItems().forEach(item -> item.setOrder(order));

            if (order.getStatus() == null) {
                order.setStatus(OrderStatus.PENDING);
            }
            if (order.getDeliveryFee() == null) {
                order.setDeliveryFee(defaultDeliveryFee);
            }

            Order savedOrder = orderRepository.save(order);
            placedOrdersCounter.increment();

            log.info("Order {} placed with {} item(s), total amount {}", savedOrder.getId(),
                    OrderTotals.totalItemsCount(savedOrder), OrderTotals.totalAmount(savedOrder));

            return savedOrder;
        });
    }

    /**
     * Finds an order by its ID.
     *
     * @param orderId The ID of the order to find.
     * @return The {@link Order} entity if found.
     * @throws OrderNotFoundException If no order is found with the given ID.
     */
    @Override
    @Transactional(readOnly = true)
    public Order findByOrderId(Long orderId) {
        log.debug("Attempting to find order by ID: {}", orderId);

        return orderRepository.findById(orderId)
                .orElseThrow(() -> {
                    log.warn("Order not found for ID: {}", orderId);
                    return new OrderNotFoundException(orderId);
                });
    }

    /**
     * Retrieves a paginated list of all orders from the database.
     *
     * @param pageable The pagination information (page number, size, sort).
     * @return A {@link Page} containing the {@link Order} entities for the
     *         requested page.
     */
    @Override
    @Transactional(readOnly = true)
    public Page<Order> findAll(Pageable pageable) {
        log.debug("Attempting to find all orders with pagination: {}", pageable);

        return orderRepository.findAll(pageable);
    }

    @Override
    @Transactional
    public Order updateStatus(Long orderId, OrderStatus status) {
        Order order = findByOrderId(orderId);
        OrderStatus previous = order.getStatus();

        order.setStatus(status);
        Order savedOrder = orderRepository.save(order);

        log.info("Order {} status changed from {} to {}", orderId, previous, status);
        return savedOrder;
    }

    /**
     * Initializes the Micrometer metrics for the order service.
     * Registers a timer for placement duration and counters for placed and
     * rejected orders.
     *
     * @param registry The meter registry to register the metrics with.
     */
    private void initializeMetrics(MeterRegistry registry) {
        this.orderPlacementTimer = Timer.builder("orders.placement.time")
                .description("Time taken to validate and store an incoming order")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        this.placedOrdersCounter = Counter.builder("orders.placed")
                .description("Orders accepted and stored")
                .register(registry);

        this.invalidOrdersCounter = rejectedCounter(registry, "validation");
        this.unknownItemOrdersCounter = rejectedCounter(registry, "not_found");
        this.unavailableItemOrdersCounter = rejectedCounter(registry, "unavailable");
    }

    private Counter rejectedCounter(MeterRegistry registry, String reason) {
        return Counter.builder("orders.rejected")
                .description("Orders rejected before being stored")
                .tag("reason", reason)
                .register(registry);
    }
}
