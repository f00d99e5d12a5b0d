package net.revivatech.domain.preview;

import net.revivatech.domain.validation.ValidationResult;

/**
 * Combined configuration validation and scores for a configuration under authoring.
 *
 * @param valid configuration is valid and the performance score is at least 80
 */
public record PreviewValidation(
    boolean valid,
    ValidationResult configValidation,
    ScoreReport performance,
    ScoreReport accessibility,
    ScoreReport seo
) {
}
