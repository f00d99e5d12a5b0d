package net.revivatech.domain.validation;

import jakarta.annotation.Nullable;

/**
 * A single validation finding.
 *
 * @param field path of the offending field, for example {@code sections[2].id}
 * @param message human readable description
 * @param code stable machine code such as {@code DUPLICATE_SECTION_ID}
 * @param severity how the finding affects validity
 * @param suggestion optional remediation hint
 */
public record ValidationIssue(
    String field,
    String message,
    String code,
    IssueSeverity severity,
    @Nullable String suggestion
) {

    public static ValidationIssue error(String field, String message, String code) {
        return new ValidationIssue(field, message, code, IssueSeverity.ERROR, null);
    }

    public static ValidationIssue warning(String field, String message, String code) {
        return new ValidationIssue(field, message, code, IssueSeverity.WARNING, null);
    }

    public static ValidationIssue warning(String field, String message, String code, String suggestion) {
        return new ValidationIssue(field, message, code, IssueSeverity.WARNING, suggestion);
    }

    public static ValidationIssue suggestion(String field, String message, String code) {
        return new ValidationIssue(field, message, code, IssueSeverity.SUGGESTION, null);
    }
}
