package info.mouts.restaurantservice.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import info.mouts.restaurantservice.domain.FoodCategory;
import info.mouts.restaurantservice.domain.FoodItem;

/**
 * Repository interface for managing {@link FoodItem} entities.
 */
@Repository
public interface FoodItemRepository extends JpaRepository<FoodItem, Long> {
    /**
     * Finds all menu items in a category, ordered by ID.
     *
     * @param category the menu section to filter by
     * @return the matching items, empty if none
     */
    List<FoodItem> findByCategoryOrderByIdAsc(FoodCategory category);

    List<FoodItem> findAllByOrderByIdAsc();
}
