package info.mouts.restaurantservice.controller;

import java.util.List;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.web.PageableDefault;
import org.springframework.data.web.PagedResourcesAssembler;
import org.springframework.hateoas.CollectionModel;
import org.springframework.hateoas.EntityModel;
import org.springframework.hateoas.MediaTypes;
import org.springframework.hateoas.PagedModel;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import info.mouts.restaurantservice.domain.Order;
import info.mouts.restaurantservice.domain.OrderItem;
import info.mouts.restaurantservice.dto.OrderItemResponseDTO;
import info.mouts.restaurantservice.dto.OrderRequestDTO;
import info.mouts.restaurantservice.dto.OrderResponseDTO;
import info.mouts.restaurantservice.dto.OrderStatusUpdateRequestDTO;
import info.mouts.restaurantservice.dto.OrderSummaryResponseDTO;
import info.mouts.restaurantservice.mapper.OrderMapper;
import info.mouts.restaurantservice.service.OrderItemService;
import info.mouts.restaurantservice.service.OrderService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;

import static org.springframework.hateoas.server.mvc.WebMvcLinkBuilder.*;

/**
 * REST controller for placing and retrieving {@link Order}s.
 * Provides endpoints to place orders, list them, get specific orders, change
 * their status and retrieve the items associated with an order.
 * Uses HATEOAS to provide navigational links in responses.
 */
@RestController
@RequestMapping("/api/v1/orders")
@Tag(name = "Orders API", description = "Endpoints for placing and retrieving orders and their items")
@Slf4j
public class OrderController {
    private final OrderService orderService;
    private final OrderItemService orderItemService;

    private final PagedResourcesAssembler<OrderSummaryResponseDTO> pagedResourcesAssembler;

    private final OrderMapper orderMapper;

    /**
     * Constructs an instance of {@code OrderController}.
     *
     * @param orderService            Service for order-related operations.
     * @param orderItemService        Service for order item-related operations.
     * @param orderMapper             Mapper for converting between entities and
     *                                DTOs.
     * @param pagedResourcesAssembler Assembler for creating HATEOAS PagedModel.
     */
    public OrderController(OrderService orderService, OrderItemService orderItemService, OrderMapper orderMapper,
            PagedResourcesAssembler<OrderSummaryResponseDTO> pagedResourcesAssembler) {
        this.orderService = orderService;
        this.orderItemService = orderItemService;
        this.orderMapper = orderMapper;
        this.pagedResourcesAssembler = pagedResourcesAssembler;
    }

    /**
     * Places a new order after checking it against the menu.
     *
     * @param request The candidate order.
     * @return A {@link ResponseEntity} with status 201 containing the
     *         {@link OrderResponseDTO} with HATEOAS links (self, items).
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Place an Order", description = "Validates an order against the menu and stores it with status pending.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Order placed", content = @Content(mediaType = MediaTypes.HAL_JSON_VALUE, schema = @Schema(implementation = OrderResponseDTO.class))),
            @ApiResponse(responseCode = "400", description = "Order is malformed or references a missing or unavailable menu item", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<OrderResponseDTO> placeOrder(@RequestBody OrderRequestDTO request) {
        OrderResponseDTO responseDTO = toResponse(orderService.placeOrder(request));

        return ResponseEntity.status(HttpStatus.CREATED)
                .location(linkTo(methodOn(OrderController.class).findByOrderId(responseDTO.getId())).toUri())
                .body(responseDTO);
    }

    /**
     * <p>
     * Retrieves a paginated list of order summaries.
     * </p>
     * <p>
     * Uses HATEOAS to provide navigational links in responses.
     * </p>
     *
     * @param pageable Pagination and sorting information (defaults to size 10,
     *                 sorted by createdAt descending).
     * @return A {@link ResponseEntity} containing a {@link PagedModel} of
     *         {@link OrderSummaryResponseDTO}s with HATEOAS links.
     */
    @GetMapping(produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Get All Orders", description = "Retrieves a paginated list of order summaries.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Orders retrieved successfully", content = @Content(mediaType = MediaTypes.HAL_JSON_VALUE, schema = @Schema(implementation = PagedModel.class)))
    })
    public ResponseEntity<PagedModel<EntityModel<OrderSummaryResponseDTO>>> findAllOrders(
            @Parameter(hidden = true) @PageableDefault(size = 10, sort = "createdAt", direction = Sort.Direction.DESC) Pageable pageable) {
        Page<Order> orders = orderService.findAll(pageable);

        Page<OrderSummaryResponseDTO> summaries = orders.map(orderMapper::toOrderSummaryDto);

        return ResponseEntity.ok(pagedResourcesAssembler.toModel(summaries, summary -> EntityModel.of(summary,
                linkTo(methodOn(OrderController.class).findByOrderId(summary.getId())).withSelfRel())));
    }

    /**
     * <p>
     * Retrieves an order by its ID.
     * </p>
     * <p>
     * Uses HATEOAS to provide navigational links in responses.
     * </p>
     *
     * @param orderId The ID of the order to retrieve.
     * @return A {@link ResponseEntity} containing the {@link OrderResponseDTO} with
     *         HATEOAS links (self, items).
     */
    @GetMapping(value = "/{orderId}", produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Get an Order by ID", description = "Retrieves an order by its ID, including derived totals.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Order retrieved successfully", content = @Content(mediaType = MediaTypes.HAL_JSON_VALUE, schema = @Schema(implementation = OrderResponseDTO.class))),
            @ApiResponse(responseCode = "400", description = "Invalid ID", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Order not found for the given ID", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "500", description = "Internal Server Error", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<OrderResponseDTO> findByOrderId(@PathVariable Long orderId) {
        return ResponseEntity.ok(toResponse(orderService.findByOrderId(orderId)));
    }

    /**
     * Overwrites the status of an order. Any status may follow any other.
     *
     * @param orderId The ID of the order.
     * @param request The new status.
     * @return A {@link ResponseEntity} containing the updated
     *         {@link OrderResponseDTO}.
     */
    @PutMapping(value = "/{orderId}/status", consumes = MediaType.APPLICATION_JSON_VALUE, produces = {
            MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Update Order Status", description = "Sets the status of an order to pending, confirmed, ready or delivered.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Status updated", content = @Content(mediaType = MediaTypes.HAL_JSON_VALUE, schema = @Schema(implementation = OrderResponseDTO.class))),
            @ApiResponse(responseCode = "400", description = "Missing or unknown status", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Order not found for the given ID", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<OrderResponseDTO> updateOrderStatus(@PathVariable Long orderId,
            @Validated @RequestBody OrderStatusUpdateRequestDTO request) {
        return ResponseEntity.ok(toResponse(orderService.updateStatus(orderId, request.getStatus())));
    }

    /**
     * <p>
     * Retrieves the list of items associated with a specific order.
     * </p>
     * <p>
     * Uses HATEOAS to provide navigational links in responses.
     * </p>
     *
     * @param orderId The ID of the order whose items are to be retrieved.
     * @return A {@link ResponseEntity} containing a {@link CollectionModel} of
     *         {@link OrderItemResponseDTO}s with HATEOAS links (self, order,
     *         individual items).
     */
    @GetMapping(value = "/{orderId}/items", produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Get Items for an Order", description = "Retrieves the list of items associated with a specific order.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Items retrieved successfully", content = @Content(mediaType = MediaTypes.HAL_JSON_VALUE, schema = @Schema(implementation = CollectionModel.class))),
            @ApiResponse(responseCode = "400", description = "Invalid ID", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Order not found for the given ID", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<CollectionModel<OrderItemResponseDTO>> findOrderItems(@PathVariable Long orderId) {
        List<OrderItem> orderItems = orderItemService.findOrderItemsByOrderId(orderId);

        List<OrderItemResponseDTO> responseDTOs = orderMapper.toOrderItemResponseDtoList(orderItems);
        responseDTOs.forEach(
                dto -> dto.add(
                        linkTo(methodOn(OrderController.class).findOrderItem(orderId,
                                dto.getId())).withRel("item")));

        CollectionModel<OrderItemResponseDTO> collectionModel = CollectionModel.of(responseDTOs);

        collectionModel.add(linkTo(methodOn(OrderController.class).findOrderItems(orderId)).withSelfRel());
        collectionModel.add(linkTo(methodOn(OrderController.class).findByOrderId(orderId)).withRel("order"));

        return ResponseEntity.ok(collectionModel);
    }

    /**
     * <p>
     * Retrieves a single item of an order.
     * </p>
     * <p>
     * Uses HATEOAS to provide navigational links in responses.
     * </p>
     *
     * @param orderId The ID of the parent order.
     * @param itemId  The ID of the specific item to retrieve.
     * @return A {@link ResponseEntity} containing the {@link OrderItemResponseDTO}
     */
    @GetMapping(value = "/{orderId}/items/{itemId}", produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Get an Item for an Order", description = "Retrieves an item of an order by its ID.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Item retrieved successfully", content = @Content(mediaType = MediaTypes.HAL_JSON_VALUE, schema = @Schema(implementation = OrderItemResponseDTO.class))),
            @ApiResponse(responseCode = "400", description = "Invalid ID", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Item not found for the given ID", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<OrderItemResponseDTO> findOrderItem(@PathVariable Long orderId,
            @PathVariable Long itemId) {
        OrderItem orderItem = orderItemService.findByOrderIdAndItemId(orderId, itemId);
        OrderItemResponseDTO responseDTO = orderMapper.toOrderItemResponseDto(orderItem);

        responseDTO.add(linkTo(methodOn(OrderController.class).findOrderItem(orderId, itemId)).withSelfRel());
        responseDTO.add(linkTo(methodOn(OrderController.class).findByOrderId(orderId)).withRel("order"));
        responseDTO.add(linkTo(methodOn(OrderController.class).findOrderItems(orderId)).withRel("items"));

        return ResponseEntity.ok(responseDTO);
    }

    private OrderResponseDTO toResponse(Order order) {
        OrderResponseDTO responseDTO = orderMapper.toOrderResponseDto(order);

        responseDTO.add(linkTo(methodOn(OrderController.class).findByOrderId(responseDTO.getId())).withSelfRel());
        responseDTO.add(linkTo(methodOn(OrderController.class).findOrderItems(responseDTO.getId())).withRel("items"));

        return responseDTO;
    }
}
