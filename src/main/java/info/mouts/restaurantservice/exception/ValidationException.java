package info.mouts.restaurantservice.exception;

import java.util.List;
import java.util.stream.Collectors;

import info.mouts.restaurantservice.validation.FieldViolation;
import lombok.Getter;

/**
 * Thrown when a candidate menu item or order breaks one or more field rules.
 * Carries every violation found, not only the first one.
 */
@Getter
public class ValidationException extends RuntimeException {
    private final String entity;
    private final List<FieldViolation> violations;

    public ValidationException(String entity, List<FieldViolation> violations) {
        super(buildMessage(entity, violations));
        this.entity = entity;
        this.violations = List.copyOf(violations);
    }

    private static String buildMessage(String entity, List<FieldViolation> violations) {
        return "Invalid " + entity + ": " + violations.stream()
                .map(violation -> violation.getField() + " " + violation.getMessage())
                .collect(Collectors.joining("; "));
    }
}
