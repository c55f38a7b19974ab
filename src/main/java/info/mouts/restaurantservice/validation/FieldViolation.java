package info.mouts.restaurantservice.validation;

import lombok.Value;

/**
 * A single broken rule: the offending field, the rule name, a readable message
 * and the value that was rejected.
 */
@Value
public class FieldViolation {
    String field;
    String rule;
    String message;
    Object rejectedValue;
}
