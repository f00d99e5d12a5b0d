package net.revivatech.domain.seo;

import java.util.List;
import net.revivatech.domain.validation.ValidationIssue;

/**
 * Findings for a generated {@link SeoMetadata}.
 */
public record MetadataValidation(
    List<ValidationIssue> errors,
    List<ValidationIssue> warnings,
    List<ValidationIssue> suggestions
) {

    public MetadataValidation {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    public boolean valid() {
        return errors.isEmpty();
    }
}
