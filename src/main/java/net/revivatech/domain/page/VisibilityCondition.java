package net.revivatech.domain.page;

import java.util.Objects;

/**
 * One gate in a section's visibility rule.
 *
 * @param type what the condition inspects
 * @param operator comparison applied to the inspected value
 * @param value comparison operand; strings, numbers or booleans
 */
public record VisibilityCondition(ConditionType type, ConditionOperator operator, Object value) {

    public VisibilityCondition {
        Objects.requireNonNull(type, "condition type must not be null");
        Objects.requireNonNull(operator, "condition operator must not be null");
    }

    public String valueAsText() {
        return value == null ? "" : String.valueOf(value);
    }
}
