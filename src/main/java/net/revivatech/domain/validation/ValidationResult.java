package net.revivatech.domain.validation;

import jakarta.annotation.Nullable;
import java.util.List;
import java.util.Optional;
import net.revivatech.domain.page.PageConfiguration;

/**
 * Outcome of validating a page configuration.
 *
 * <p>{@code valid} is true exactly when {@code errors} is empty. Warnings never
 * affect validity.
 */
public record ValidationResult(
    boolean valid,
    List<ValidationIssue> errors,
    List<ValidationIssue> warnings,
    @Nullable PageConfiguration config
) {

    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static ValidationResult of(List<ValidationIssue> errors, List<ValidationIssue> warnings,
                                      @Nullable PageConfiguration config) {
        return new ValidationResult(errors.isEmpty(), errors, warnings, errors.isEmpty() ? config : null);
    }

    public Optional<PageConfiguration> validatedConfig() {
        return Optional.ofNullable(config);
    }

    public boolean hasWarning(String code) {
        return warnings.stream().anyMatch(issue -> issue.code().equals(code));
    }

    public boolean hasError(String code) {
        return errors.stream().anyMatch(issue -> issue.code().equals(code));
    }

    public String errorSummary() {
        return errors.stream()
            .map(issue -> issue.field() + ": " + issue.message())
            .reduce((left, right) -> left + "; " + right)
            .orElse("");
    }
}
