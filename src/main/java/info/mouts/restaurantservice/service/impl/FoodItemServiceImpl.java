package info.mouts.restaurantservice.service.impl;

import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import info.mouts.restaurantservice.domain.FoodCategory;
import info.mouts.restaurantservice.domain.FoodItem;
import info.mouts.restaurantservice.dto.FoodItemRequestDTO;
import info.mouts.restaurantservice.exception.MenuItemNotFoundException;
import info.mouts.restaurantservice.mapper.MenuMapper;
import info.mouts.restaurantservice.repository.FoodItemRepository;
import info.mouts.restaurantservice.service.FoodItemService;
import info.mouts.restaurantservice.validation.FoodItemValidator;
import lombok.extern.slf4j.Slf4j;

/**
 * Implementation of the {@link FoodItemService} interface.
 * Every write goes through {@link FoodItemValidator} before reaching the
 * repository.
 */
@Service
@Slf4j
public class FoodItemServiceImpl implements FoodItemService {

    private final FoodItemRepository foodItemRepository;
    private final FoodItemValidator foodItemValidator;
    private final MenuMapper menuMapper;

    /**
     * Constructs an instance of {@code FoodItemServiceImpl}.
     *
     * @param foodItemRepository The repository for menu item data access.
     * @param foodItemValidator  The validator applied to every candidate item.
     * @param menuMapper         The mapper for converting between DTOs and
     *                           entities.
     */
    public FoodItemServiceImpl(FoodItemRepository foodItemRepository, FoodItemValidator foodItemValidator,
            MenuMapper menuMapper) {
        this.foodItemRepository = foodItemRepository;
        this.foodItemValidator = foodItemValidator;
        this.menuMapper = menuMapper;
    }

    @Override
    @Transactional(readOnly = true)
    public List<FoodItem> findAll() {
        log.debug("Attempting to find all menu items");

        return foodItemRepository.findAllByOrderByIdAsc();
    }

    @Override
    @Transactional(readOnly = true)
    public FoodItem findById(Long menuItemId) {
        log.debug("Attempting to find menu item by ID: {}", menuItemId);

        return foodItemRepository.findById(menuItemId)
                .orElseThrow(() -> {
                    log.warn("Menu item not found for ID: {}", menuItemId);
                    return new MenuItemNotFoundException(menuItemId);
                });
    }

    @Override
    @Transactional(readOnly = true)
    public List<FoodItem> findByCategory(FoodCategory category) {
        log.debug("Attempting to find menu items in category: {}", category);

        return foodItemRepository.findByCategoryOrderByIdAsc(category);
    }

    @Override
    @Transactional
    public FoodItem create(FoodItemRequestDTO request) {
        foodItemValidator.validate(request);

        FoodItem saved = foodItemRepository.save(menuMapper.toEntity(request));
        log.info("Menu item '{}' added with ID {}", saved.getName(), saved.getId());

        return saved;
    }

    @Override
    @Transactional
    public FoodItem replace(Long menuItemId, FoodItemRequestDTO request) {
        foodItemValidator.validate(request);

        FoodItem existing = findById(menuItemId);
        menuMapper.updateEntity(request, existing);

        FoodItem saved = foodItemRepository.save(existing);
        log.info("Menu item {} replaced", menuItemId);

        return saved;
    }

    @Override
    @Transactional
    public void delete(Long menuItemId) {
        FoodItem existing = findById(menuItemId);

        foodItemRepository.delete(existing);
        log.info("Menu item {} ('{}') deleted", menuItemId, existing.getName());
    }
}
