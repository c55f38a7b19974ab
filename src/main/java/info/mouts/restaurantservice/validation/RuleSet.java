package info.mouts.restaurantservice.validation;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered collection of {@link ValidationRule}s. Every rule is evaluated and
 * every failure collected; rules are independent, so evaluation order never
 * changes the verdict.
 *
 * @param <T> The candidate type.
 */
public final class RuleSet<T> {
    private final List<ValidationRule<T>> rules;

    private RuleSet(List<ValidationRule<T>> rules) {
        this.rules = List.copyOf(rules);
    }

    @SafeVarargs
    public static <T> RuleSet<T> of(ValidationRule<T>... rules) {
        return new RuleSet<>(List.of(rules));
    }

    public List<FieldViolation> evaluate(T candidate) {
        return evaluate(candidate, "");
    }

    /**
     * Evaluates all rules against the candidate.
     *
     * @param candidate   The candidate, never {@code null}.
     * @param fieldPrefix Prepended to each reported field, e.g. {@code "items[0]."}.
     * @return The violations found, empty when the candidate passes.
     */
    public List<FieldViolation> evaluate(T candidate, String fieldPrefix) {
        List<FieldViolation> violations = new ArrayList<>();
        for (ValidationRule<T> rule : rules) {
            if (!rule.test(candidate)) {
                violations.add(rule.toViolation(candidate, fieldPrefix));
            }
        }
        return violations;
    }
}
