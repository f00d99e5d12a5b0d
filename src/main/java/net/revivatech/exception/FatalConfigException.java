package net.revivatech.exception;

import net.revivatech.domain.validation.ValidationResult;

/**
 * Page configuration failed structural or semantic validation and cannot be rendered.
 * Carries the full validation result so callers can report every error.
 */
public class FatalConfigException extends RuntimeException {

    private final transient ValidationResult validation;

    public FatalConfigException(ValidationResult validation) {
        super("Invalid page configuration: " + validation.errorSummary());
        this.validation = validation;
    }

    public ValidationResult getValidation() {
        return validation;
    }
}
