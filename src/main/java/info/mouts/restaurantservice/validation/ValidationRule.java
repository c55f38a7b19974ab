package info.mouts.restaurantservice.validation;

import java.util.function.Function;
import java.util.function.Predicate;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * A named predicate over a whole candidate. A rule may read any field of the
 * candidate, which is how cross-field constraints are expressed.
 *
 * @param <T> The candidate type.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ValidationRule<T> {
    public static final String REQUIRED = "required";

    private final String field;
    private final String rule;
    private final Function<T, ?> rejectedValue;
    private final Predicate<T> check;
    private final String message;

    /**
     * Rule that looks at the whole candidate.
     *
     * @param field         Field reported when the rule fails.
     * @param rule          Short rule name, e.g. {@code "range"}.
     * @param rejectedValue Extracts the value reported when the rule fails.
     * @param check         Returns {@code true} when the candidate passes.
     * @param message       Readable explanation of the rule.
     */
    public static <T> ValidationRule<T> of(String field, String rule, Function<T, ?> rejectedValue,
            Predicate<T> check, String message) {
        return new ValidationRule<>(field, rule, rejectedValue, check, message);
    }

    /**
     * Rule on a single field value. A {@code null} value passes; pair with
     * {@link #required} when the field is mandatory.
     */
    public static <T, V> ValidationRule<T> forField(String field, String rule, Function<T, V> getter,
            Predicate<V> check, String message) {
        return new ValidationRule<>(field, rule, getter, candidate -> {
            V value = getter.apply(candidate);
            return value == null || check.test(value);
        }, message);
    }

    public static <T> ValidationRule<T> required(String field, Function<T, ?> getter, String message) {
        return new ValidationRule<>(field, REQUIRED, getter, candidate -> getter.apply(candidate) != null, message);
    }

    boolean test(T candidate) {
        return check.test(candidate);
    }

    FieldViolation toViolation(T candidate, String fieldPrefix) {
        return new FieldViolation(fieldPrefix + field, rule, message, rejectedValue.apply(candidate));
    }
}
