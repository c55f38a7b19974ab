package info.mouts.restaurantservice.validation;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import info.mouts.restaurantservice.domain.FoodItem;
import info.mouts.restaurantservice.dto.CustomerDTO;
import info.mouts.restaurantservice.dto.OrderItemRequestDTO;
import info.mouts.restaurantservice.dto.OrderRequestDTO;
import info.mouts.restaurantservice.exception.MenuItemReferenceException;
import info.mouts.restaurantservice.exception.ValidationException;
import info.mouts.restaurantservice.util.MoneyUtils;
import lombok.extern.slf4j.Slf4j;

/**
 * Validates candidate orders in two stages: the structure of the order,
 * customer and lines first (all failures reported together), then each line
 * against the menu (first failure reported).
 */
@Component
@Slf4j
public class OrderValidator {
    public static final int MAX_QUANTITY = 10;
    public static final int MAX_MONEY_DIGITS = 6;
    public static final int MAX_TEXT_LENGTH = 200;

    private static final Pattern PHONE_PATTERN = Pattern.compile("^\\d{10}$");

    private final RuleSet<OrderRequestDTO> orderRules = RuleSet.of(
            ValidationRule.required("customer", OrderRequestDTO::getCustomer, "is required"),
            ValidationRule.required("items", OrderRequestDTO::getItems, "is required"),
            ValidationRule.forField("items", "not_empty", OrderRequestDTO::getItems,
                    items -> !items.isEmpty(),
                    "must contain at least one item"),
            ValidationRule.forField("deliveryFee", "scale", OrderRequestDTO::getDeliveryFee,
                    MoneyUtils::hasMoneyScale,
                    "must have at most 2 decimal places"),
            ValidationRule.forField("deliveryFee", "non_negative", OrderRequestDTO::getDeliveryFee,
                    fee -> fee.signum() >= 0,
                    "cannot be negative"),
            ValidationRule.forField("deliveryFee", "digits", OrderRequestDTO::getDeliveryFee,
                    OrderValidator::fitsMoneyDigits,
                    "must have at most 6 digits"),
            ValidationRule.forField("specialInstructions", "length", OrderRequestDTO::getSpecialInstructions,
                    instructions -> instructions.length() <= MAX_TEXT_LENGTH,
                    "must be at most 200 characters"));

    private final RuleSet<CustomerDTO> customerRules = RuleSet.of(
            ValidationRule.required("name", CustomerDTO::getName, "is required"),
            ValidationRule.forField("name", "length", CustomerDTO::getName,
                    name -> name.length() >= 2 && name.length() <= 50,
                    "must be between 2 and 50 characters"),
            ValidationRule.required("phone", CustomerDTO::getPhone, "is required"),
            ValidationRule.forField("phone", "pattern", CustomerDTO::getPhone,
                    phone -> PHONE_PATTERN.matcher(phone).matches(),
                    "must be exactly 10 digits"),
            ValidationRule.forField("address", "length", CustomerDTO::getAddress,
                    address -> address.length() <= MAX_TEXT_LENGTH,
                    "must be at most 200 characters"));

    private final RuleSet<OrderItemRequestDTO> itemRules = RuleSet.of(
            ValidationRule.required("menuItemId", OrderItemRequestDTO::getMenuItemId, "is required"),
            ValidationRule.forField("menuItemId", "positive", OrderItemRequestDTO::getMenuItemId,
                    id -> id > 0,
                    "must be greater than 0"),
            ValidationRule.required("menuItemName", OrderItemRequestDTO::getMenuItemName, "is required"),
            ValidationRule.forField("menuItemName", "length", OrderItemRequestDTO::getMenuItemName,
                    name -> !name.isEmpty() && name.length() <= 100,
                    "must be between 1 and 100 characters"),
            ValidationRule.required("quantity", OrderItemRequestDTO::getQuantity, "is required"),
            ValidationRule.forField("quantity", "range", OrderItemRequestDTO::getQuantity,
                    quantity -> quantity >= 1 && quantity <= MAX_QUANTITY,
                    "must be between 1 and 10"),
            ValidationRule.required("unitPrice", OrderItemRequestDTO::getUnitPrice, "is required"),
            ValidationRule.forField("unitPrice", "positive", OrderItemRequestDTO::getUnitPrice,
                    price -> price.signum() > 0,
                    "must be greater than 0"),
            ValidationRule.forField("unitPrice", "scale", OrderItemRequestDTO::getUnitPrice,
                    MoneyUtils::hasMoneyScale,
                    "must have at most 2 decimal places"),
            ValidationRule.forField("unitPrice", "digits", OrderItemRequestDTO::getUnitPrice,
                    OrderValidator::fitsMoneyDigits,
                    "must have at most 6 digits"));

    /**
     * Returns every structural rule the candidate breaks, without consulting the
     * menu.
     *
     * @param candidate The candidate order.
     * @return The violations, empty for a well-formed order.
     */
    public List<FieldViolation> check(OrderRequestDTO candidate) {
        List<FieldViolation> violations = new ArrayList<>(orderRules.evaluate(candidate));

        if (candidate.getCustomer() != null) {
            violations.addAll(customerRules.evaluate(candidate.getCustomer(), "customer."));
        }

        List<OrderItemRequestDTO> items = candidate.getItems();
        if (items != null) {
            for (int i = 0; i < items.size(); i++) {
                String prefix = "items[" + i + "].";
                OrderItemRequestDTO item = items.get(i);
                if (item == null) {
                    violations.add(new FieldViolation("items[" + i + "]", ValidationRule.REQUIRED,
                            "must not be null", null));
                } else {
                    violations.addAll(itemRules.evaluate(item, prefix));
                }
            }
        }

        return violations;
    }

    /**
     * Accepts or rejects a candidate order.
     *
     * @param candidate The candidate order.
     * @param catalog   Read-only view of the menu.
     * @throws ValidationException         if the order is malformed.
     * @throws MenuItemReferenceException if a line points at a missing or
     *                                     unavailable menu item.
     */
    public void validate(OrderRequestDTO candidate, CatalogLookup catalog) {
        Objects.requireNonNull(candidate, "candidate");
        Objects.requireNonNull(catalog, "catalog");

        List<FieldViolation> violations = check(candidate);
        if (!violations.isEmpty()) {
            log.warn("Rejected order with {} structural violation(s)", violations.size());
            throw new ValidationException("order", violations);
        }

        for (OrderItemRequestDTO line : candidate.getItems()) {
            FoodItem menuItem = catalog.findMenuItem(line.getMenuItemId())
                    .orElseThrow(() -> {
                        log.warn("Rejected order referencing unknown menu item {}", line.getMenuItemId());
                        return MenuItemReferenceException.notFound(line.getMenuItemId());
                    });

            if (!menuItem.isAvailable()) {
                log.warn("Rejected order referencing unavailable menu item {} ('{}')", menuItem.getId(),
                        menuItem.getName());
                throw MenuItemReferenceException.unavailable(menuItem);
            }
        }
    }

    // Both money columns are NUMERIC(6, 2).
    private static boolean fitsMoneyDigits(BigDecimal amount) {
        return !MoneyUtils.hasMoneyScale(amount) || MoneyUtils.totalDigits(amount) <= MAX_MONEY_DIGITS;
    }
}
