package info.mouts.restaurantservice.controller;

import java.util.List;

import org.springframework.hateoas.CollectionModel;
import org.springframework.hateoas.MediaTypes;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import info.mouts.restaurantservice.domain.FoodCategory;
import info.mouts.restaurantservice.domain.FoodItem;
import info.mouts.restaurantservice.dto.FoodItemRequestDTO;
import info.mouts.restaurantservice.dto.FoodItemResponseDTO;
import info.mouts.restaurantservice.dto.MenuItemDeletedResponseDTO;
import info.mouts.restaurantservice.mapper.MenuMapper;
import info.mouts.restaurantservice.service.FoodItemService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;

import static org.springframework.hateoas.server.mvc.WebMvcLinkBuilder.*;

/**
 * REST controller for managing the menu.
 * Provides endpoints to list, add, replace and delete {@link FoodItem}s.
 * Uses HATEOAS to provide navigational links in responses.
 */
@RestController
@RequestMapping("/api/v1/menu")
@Tag(name = "Menu API", description = "Endpoints for managing menu items")
@Slf4j
public class MenuController {
    private final FoodItemService foodItemService;
    private final MenuMapper menuMapper;

    /**
     * Constructs an instance of {@code MenuController}.
     *
     * @param foodItemService Service for menu item operations.
     * @param menuMapper      Mapper for converting between entities and DTOs.
     */
    public MenuController(FoodItemService foodItemService, MenuMapper menuMapper) {
        this.foodItemService = foodItemService;
        this.menuMapper = menuMapper;
    }

    /**
     * Retrieves every menu item.
     *
     * @return A {@link ResponseEntity} containing a {@link CollectionModel} of
     *         {@link FoodItemResponseDTO}s with HATEOAS links.
     */
    @GetMapping(produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Get All Menu Items", description = "Retrieves every menu item with its derived attributes.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Menu items retrieved successfully", content = @Content(mediaType = MediaTypes.HAL_JSON_VALUE, schema = @Schema(implementation = CollectionModel.class)))
    })
    public ResponseEntity<CollectionModel<FoodItemResponseDTO>> findAllMenuItems() {
        CollectionModel<FoodItemResponseDTO> collectionModel = toCollectionModel(foodItemService.findAll());
        collectionModel.add(linkTo(methodOn(MenuController.class).findAllMenuItems()).withSelfRel());

        return ResponseEntity.ok(collectionModel);
    }

    /**
     * Retrieves a menu item by its ID.
     *
     * @param menuItemId The ID of the menu item.
     * @return A {@link ResponseEntity} containing the {@link FoodItemResponseDTO}
     *         with a self link.
     */
    @GetMapping(value = "/{menuItemId}", produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Get a Menu Item by ID", description = "Retrieves a menu item by its ID.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Menu item retrieved successfully", content = @Content(mediaType = MediaTypes.HAL_JSON_VALUE, schema = @Schema(implementation = FoodItemResponseDTO.class))),
            @ApiResponse(responseCode = "400", description = "Invalid ID", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Menu item not found for the given ID", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<FoodItemResponseDTO> findMenuItem(@PathVariable Long menuItemId) {
        return ResponseEntity.ok(toResponse(foodItemService.findById(menuItemId)));
    }

    /**
     * Retrieves the menu items of one category.
     *
     * @param category The category wire value, e.g. {@code main_course}.
     * @return A {@link ResponseEntity} containing a {@link CollectionModel} of
     *         the matching {@link FoodItemResponseDTO}s.
     */
    @GetMapping(value = "/category/{category}", produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Get Menu Items by Category", description = "Retrieves the menu items of one category.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Menu items retrieved successfully", content = @Content(mediaType = MediaTypes.HAL_JSON_VALUE, schema = @Schema(implementation = CollectionModel.class))),
            @ApiResponse(responseCode = "400", description = "Unknown category", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<CollectionModel<FoodItemResponseDTO>> findMenuItemsByCategory(@PathVariable String category) {
        FoodCategory foodCategory = FoodCategory.fromValue(category);

        CollectionModel<FoodItemResponseDTO> collectionModel = toCollectionModel(
                foodItemService.findByCategory(foodCategory));
        collectionModel.add(linkTo(methodOn(MenuController.class).findMenuItemsByCategory(category)).withSelfRel());

        return ResponseEntity.ok(collectionModel);
    }

    /**
     * Adds a menu item.
     *
     * @param request The candidate menu item.
     * @return A {@link ResponseEntity} with status 201 and the stored item.
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Add a Menu Item", description = "Validates a menu item and adds it to the menu.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Menu item created", content = @Content(mediaType = MediaTypes.HAL_JSON_VALUE, schema = @Schema(implementation = FoodItemResponseDTO.class))),
            @ApiResponse(responseCode = "400", description = "Menu item breaks one or more rules", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<FoodItemResponseDTO> createMenuItem(@RequestBody FoodItemRequestDTO request) {
        FoodItemResponseDTO responseDTO = toResponse(foodItemService.create(request));

        return ResponseEntity.status(HttpStatus.CREATED)
                .location(linkTo(methodOn(MenuController.class).findMenuItem(responseDTO.getId())).toUri())
                .body(responseDTO);
    }

    /**
     * Replaces every field of an existing menu item.
     *
     * @param menuItemId The ID of the menu item.
     * @param request    The candidate menu item.
     * @return A {@link ResponseEntity} containing the replaced item.
     */
    @PutMapping(value = "/{menuItemId}", consumes = MediaType.APPLICATION_JSON_VALUE, produces = {
            MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Replace a Menu Item", description = "Validates a menu item and replaces the existing one.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Menu item replaced", content = @Content(mediaType = MediaTypes.HAL_JSON_VALUE, schema = @Schema(implementation = FoodItemResponseDTO.class))),
            @ApiResponse(responseCode = "400", description = "Menu item breaks one or more rules", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Menu item not found for the given ID", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<FoodItemResponseDTO> replaceMenuItem(@PathVariable Long menuItemId,
            @RequestBody FoodItemRequestDTO request) {
        return ResponseEntity.ok(toResponse(foodItemService.replace(menuItemId, request)));
    }

    /**
     * Deletes a menu item.
     *
     * @param menuItemId The ID of the menu item.
     * @return A {@link ResponseEntity} confirming the deletion.
     */
    @DeleteMapping(value = "/{menuItemId}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Delete a Menu Item", description = "Removes a menu item. Existing orders are not affected.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Menu item deleted", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = MenuItemDeletedResponseDTO.class))),
            @ApiResponse(responseCode = "404", description = "Menu item not found for the given ID", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<MenuItemDeletedResponseDTO> deleteMenuItem(@PathVariable Long menuItemId) {
        foodItemService.delete(menuItemId);

        return ResponseEntity.ok(new MenuItemDeletedResponseDTO("Menu item deleted successfully", menuItemId));
    }

    private FoodItemResponseDTO toResponse(FoodItem item) {
        FoodItemResponseDTO responseDTO = menuMapper.toFoodItemResponseDto(item);
        responseDTO.add(linkTo(methodOn(MenuController.class).findMenuItem(responseDTO.getId())).withSelfRel());
        return responseDTO;
    }

    private CollectionModel<FoodItemResponseDTO> toCollectionModel(List<FoodItem> items) {
        List<FoodItemResponseDTO> responseDTOs = menuMapper.toFoodItemResponseDtoList(items);
        responseDTOs.forEach(dto -> dto.add(
                linkTo(methodOn(MenuController.class).findMenuItem(dto.getId())).withSelfRel()));

        return CollectionModel.of(responseDTOs);
    }
}
