package net.revivatech.support.seo;

import java.util.ArrayList;
import java.util.List;
import net.revivatech.domain.seo.MetadataValidation;
import net.revivatech.domain.seo.SeoMetadata;
import net.revivatech.domain.validation.IssueSeverity;
import net.revivatech.domain.validation.ValidationIssue;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Checks generated head metadata against search engine recommendations.
 *
 * <p>Missing title or description are errors; length and image problems are
 * warnings; short titles and empty keyword lists only produce suggestions.
 */
@Component
public class MetadataValidator {

    public static final String MISSING_TITLE = "MISSING_TITLE";
    public static final String MISSING_DESCRIPTION = "MISSING_DESCRIPTION";
    public static final String LONG_TITLE = "LONG_TITLE";
    public static final String LONG_DESCRIPTION = "LONG_DESCRIPTION";
    public static final String MISSING_OG_IMAGE = "MISSING_OG_IMAGE";
    public static final String SHORT_TITLE = "SHORT_TITLE";
    public static final String MISSING_KEYWORDS = "MISSING_KEYWORDS";

    private static final int RECOMMENDED_TITLE_LENGTH = 60;
    private static final int RECOMMENDED_DESCRIPTION_LENGTH = 160;
    private static final int MIN_TITLE_LENGTH = 30;

    public MetadataValidation validate(SeoMetadata metadata) {
        List<ValidationIssue> errors = new ArrayList<>();
        List<ValidationIssue> warnings = new ArrayList<>();
        List<ValidationIssue> suggestions = new ArrayList<>();

        String title = metadata.title();
        if (!StringUtils.hasText(title)) {
            errors.add(ValidationIssue.error("title", "Title is required", MISSING_TITLE));
        } else {
            if (title.length() > RECOMMENDED_TITLE_LENGTH) {
                warnings.add(ValidationIssue.warning("title",
                    "Title is longer than recommended (" + RECOMMENDED_TITLE_LENGTH + " characters)", LONG_TITLE));
            }
            if (title.length() < MIN_TITLE_LENGTH) {
                suggestions.add(new ValidationIssue("title", "Title could be more descriptive", SHORT_TITLE,
                    IssueSeverity.SUGGESTION, "Consider adding more descriptive keywords"));
            }
        }

        String description = metadata.description();
        if (!StringUtils.hasText(description)) {
            errors.add(ValidationIssue.error("description", "Description is required", MISSING_DESCRIPTION));
        } else if (description.length() > RECOMMENDED_DESCRIPTION_LENGTH) {
            warnings.add(ValidationIssue.warning("description",
                "Description is longer than recommended (" + RECOMMENDED_DESCRIPTION_LENGTH + " characters)",
                LONG_DESCRIPTION));
        }

        if (!StringUtils.hasText(metadata.ogImage())) {
            warnings.add(ValidationIssue.warning("ogImage", "Open Graph image is recommended", MISSING_OG_IMAGE));
        }
        if (metadata.keywords().isEmpty()) {
            suggestions.add(ValidationIssue.suggestion("keywords", "Keywords help categorize the page", MISSING_KEYWORDS));
        }
        return new MetadataValidation(errors, warnings, suggestions);
    }
}
