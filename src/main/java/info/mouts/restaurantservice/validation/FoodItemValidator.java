package info.mouts.restaurantservice.validation;

import java.math.BigDecimal;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import info.mouts.restaurantservice.domain.FoodCategory;
import info.mouts.restaurantservice.dto.FoodItemRequestDTO;
import info.mouts.restaurantservice.exception.ValidationException;
import info.mouts.restaurantservice.util.MoneyUtils;
import lombok.extern.slf4j.Slf4j;

/**
 * Validates candidate menu items. Stateless and free of side effects; it never
 * touches the store.
 */
@Component
@Slf4j
public class FoodItemValidator {
    public static final BigDecimal MIN_PRICE = new BigDecimal("1.00");
    public static final BigDecimal MAX_PRICE = new BigDecimal("100.00");
    public static final int MAX_PREPARATION_TIME = 120;
    public static final int MAX_BEVERAGE_PREPARATION_TIME = 10;
    public static final int VEGETARIAN_CALORIE_LIMIT = 800;
    public static final int MAX_INGREDIENT_LENGTH = 255;

    private static final Pattern NAME_PATTERN = Pattern.compile("^[a-zA-Z\\s]+$");
    private static final Set<FoodCategory> NEVER_SPICY = EnumSet.of(FoodCategory.DESSERT, FoodCategory.BEVERAGE);

    private final RuleSet<FoodItemRequestDTO> rules = RuleSet.of(
            ValidationRule.required("name", FoodItemRequestDTO::getName, "is required"),
            ValidationRule.forField("name", "length", FoodItemRequestDTO::getName,
                    name -> name.length() >= 3 && name.length() <= 100,
                    "must be between 3 and 100 characters"),
            ValidationRule.forField("name", "pattern", FoodItemRequestDTO::getName,
                    name -> NAME_PATTERN.matcher(name).matches(),
                    "should only contain letters and spaces"),

            ValidationRule.required("description", FoodItemRequestDTO::getDescription, "is required"),
            ValidationRule.forField("description", "length", FoodItemRequestDTO::getDescription,
                    description -> description.length() >= 10 && description.length() <= 500,
                    "must be between 10 and 500 characters"),

            ValidationRule.required("category", FoodItemRequestDTO::getCategory, "is required"),

            ValidationRule.required("price", FoodItemRequestDTO::getPrice, "is required"),
            ValidationRule.forField("price", "scale", FoodItemRequestDTO::getPrice,
                    MoneyUtils::hasMoneyScale,
                    "must have at most 2 decimal places"),
            ValidationRule.forField("price", "range", FoodItemRequestDTO::getPrice,
                    price -> price.compareTo(MIN_PRICE) >= 0 && price.compareTo(MAX_PRICE) <= 0,
                    "must be between $1.00 and $100.00"),

            ValidationRule.required("preparationTime", FoodItemRequestDTO::getPreparationTime, "is required"),
            ValidationRule.forField("preparationTime", "range", FoodItemRequestDTO::getPreparationTime,
                    minutes -> minutes >= 1 && minutes <= MAX_PREPARATION_TIME,
                    "must be between 1 and 120 minutes"),
            ValidationRule.of("preparationTime", "beverage_limit", FoodItemRequestDTO::getPreparationTime,
                    candidate -> candidate.getCategory() != FoodCategory.BEVERAGE
                            || candidate.getPreparationTime() == null
                            || candidate.getPreparationTime() <= MAX_BEVERAGE_PREPARATION_TIME,
                    "must be 10 minutes or less for beverages"),

            ValidationRule.required("ingredients", FoodItemRequestDTO::getIngredients, "is required"),
            ValidationRule.forField("ingredients", "not_empty", FoodItemRequestDTO::getIngredients,
                    ingredients -> !ingredients.isEmpty(),
                    "must contain at least one ingredient"),
            ValidationRule.forField("ingredients", "blank_entry", FoodItemRequestDTO::getIngredients,
                    FoodItemValidator::hasNoBlankEntry,
                    "must not contain blank entries"),
            ValidationRule.forField("ingredients", "ingredient_length", FoodItemRequestDTO::getIngredients,
                    FoodItemValidator::hasNoOverlongEntry,
                    "entries must be at most 255 characters"),

            ValidationRule.forField("calories", "positive", FoodItemRequestDTO::getCalories,
                    calories -> calories > 0,
                    "must be greater than 0"),
            ValidationRule.of("calories", "vegetarian_limit", FoodItemRequestDTO::getCalories,
                    candidate -> !Boolean.TRUE.equals(candidate.getVegetarian())
                            || candidate.getCalories() == null
                            || candidate.getCalories() < VEGETARIAN_CALORIE_LIMIT,
                    "must be below 800 for vegetarian items"),

            ValidationRule.of("spicy", "category", FoodItemRequestDTO::getSpicy,
                    candidate -> !Boolean.TRUE.equals(candidate.getSpicy())
                            || !NEVER_SPICY.contains(candidate.getCategory()),
                    "desserts and beverages cannot be spicy"));

    /**
     * Returns every rule the candidate breaks.
     *
     * @param candidate The candidate menu item.
     * @return The violations, empty for a valid item.
     */
    public List<FieldViolation> check(FoodItemRequestDTO candidate) {
        return rules.evaluate(candidate);
    }

    /**
     * Accepts or rejects a candidate menu item.
     *
     * @param candidate The candidate menu item.
     * @throws ValidationException listing every broken rule.
     */
    public void validate(FoodItemRequestDTO candidate) {
        List<FieldViolation> violations = check(candidate);
        if (!violations.isEmpty()) {
            log.warn("Rejected menu item '{}' with {} violation(s)", candidate.getName(), violations.size());
            throw new ValidationException("menu item", violations);
        }
    }

    private static boolean hasNoBlankEntry(List<String> ingredients) {
        return ingredients.stream().noneMatch(ingredient -> ingredient == null || ingredient.isBlank());
    }

    private static boolean hasNoOverlongEntry(List<String> ingredients) {
        return ingredients.stream()
                .noneMatch(ingredient -> ingredient != null && ingredient.length() > MAX_INGREDIENT_LENGTH);
    }
}
