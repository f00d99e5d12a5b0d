package net.revivatech.domain.page;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of comparison operators for visibility conditions.
 */
public enum ConditionOperator {
    EQUALS("equals"),
    NOT_EQUALS("notEquals"),
    CONTAINS("contains"),
    GREATER_THAN("greaterThan"),
    LESS_THAN("lessThan");

    private final String value;

    ConditionOperator(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<ConditionOperator> fromValue(String candidate) {
        if (candidate == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(operator -> operator.value.equals(candidate.trim()))
            .findFirst();
    }
}
