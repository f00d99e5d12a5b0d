package net.revivatech.support.config;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import net.revivatech.config.PageEngineProperties;
import net.revivatech.domain.page.PageConfiguration;
import net.revivatech.domain.page.SectionSpec;
import net.revivatech.domain.validation.IssueSeverity;
import net.revivatech.domain.validation.ValidationIssue;
import net.revivatech.domain.validation.ValidationResult;
import net.revivatech.support.component.ComponentResolver;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Structural and semantic validation of page configurations.
 *
 * <p>Business-rule violations are reported, never thrown. Errors make a configuration
 * invalid; warnings do not.
 */
@Component
public class PageConfigValidator {

    public static final String DUPLICATE_SECTION_ID = "DUPLICATE_SECTION_ID";
    public static final String UNKNOWN_COMPONENT = "UNKNOWN_COMPONENT";
    public static final String UNKNOWN_FEATURE = "UNKNOWN_FEATURE";
    public static final String LONG_TITLE = "LONG_TITLE";
    public static final String LONG_DESCRIPTION = "LONG_DESCRIPTION";
    public static final String MISSING_ALT_TEXT = "MISSING_ALT_TEXT";

    public static final int RECOMMENDED_TITLE_LENGTH = 60;
    public static final int RECOMMENDED_DESCRIPTION_LENGTH = 160;
    public static final Set<String> KNOWN_FEATURES =
        Set.of("seo", "analytics", "performance", "accessibility", "auth", "i18n", "realtime");

    private static final String SEO_SUGGESTION = "Consider shortening for better SEO";

    private final Supplier<Set<String>> knownComponents;
    private final boolean strictComponents;

    @Autowired
    public PageConfigValidator(ComponentResolver componentResolver, PageEngineProperties properties) {
        this(componentResolver::knownComponents, properties.isStrictComponents());
    }

    public PageConfigValidator(Supplier<Set<String>> knownComponents, boolean strictComponents) {
        this.knownComponents = knownComponents;
        this.strictComponents = strictComponents;
    }

    /**
     * Validates a raw JSON document: structure first, then the semantic rules.
     */
    public ValidationResult validate(Map<String, Object> raw) {
        return validate(raw, strictComponents);
    }

    /**
     * Validates a raw JSON document.
     *
     * @param strict report unknown components as errors instead of warnings
     */
    public ValidationResult validate(Map<String, Object> raw, boolean strict) {
        PageConfigParser.Outcome outcome = PageConfigParser.parse(raw);
        if (!outcome.errors().isEmpty()) {
            return ValidationResult.of(outcome.errors(), List.of(), null);
        }
        return validate(outcome.config(), strict);
    }

    /**
     * Parses a raw JSON document without applying the semantic rules, so that callers can
     * keep configurations with duplicate ids or unknown components for later reporting.
     *
     * @return a valid result carrying the typed configuration, or the structural errors
     */
    public ValidationResult parse(Map<String, Object> raw) {
        PageConfigParser.Outcome outcome = PageConfigParser.parse(raw);
        return ValidationResult.of(outcome.errors(), List.of(), outcome.config());
    }

    public ValidationResult validate(PageConfiguration config) {
        return validate(config, strictComponents);
    }

    /**
     * Validates a typed configuration.
     *
     * @param strict report unknown components as errors instead of warnings
     */
    public ValidationResult validate(PageConfiguration config, boolean strict) {
        List<ValidationIssue> errors = new ArrayList<>();
        List<ValidationIssue> warnings = new ArrayList<>();
        checkRequiredValues(config, errors);
        checkSectionIds(config, errors);
        checkComponents(config, strict, errors, warnings);
        checkLengths(config, warnings);
        checkFeatures(config, warnings);
        checkAltText(config, warnings);
        return ValidationResult.of(errors, warnings, config);
    }

    private void checkRequiredValues(PageConfiguration config, List<ValidationIssue> errors) {
        if (config.meta() == null || !StringUtils.hasText(config.meta().title())) {
            errors.add(ValidationIssue.error("meta.title", "meta.title is required", PageConfigParser.REQUIRED));
        }
        if (config.meta() == null || !StringUtils.hasText(config.meta().description())) {
            errors.add(ValidationIssue.error("meta.description", "meta.description is required", PageConfigParser.REQUIRED));
        }
        if (!StringUtils.hasText(config.layout())) {
            errors.add(ValidationIssue.error("layout", "layout is required", PageConfigParser.REQUIRED));
        }
        if (config.sections().isEmpty()) {
            errors.add(ValidationIssue.error("sections", "At least one section is required", PageConfigParser.TOO_SMALL));
        }
        for (int index = 0; index < config.sections().size(); index++) {
            SectionSpec section = config.sections().get(index);
            if (!StringUtils.hasText(section.id())) {
                errors.add(ValidationIssue.error("sections[" + index + "].id", "Section id is required", PageConfigParser.REQUIRED));
            }
            if (!StringUtils.hasText(section.component())) {
                errors.add(ValidationIssue.error("sections[" + index + "].component", "Section component is required",
                    PageConfigParser.REQUIRED));
            }
        }
    }

    private void checkSectionIds(PageConfiguration config, List<ValidationIssue> errors) {
        Set<String> seen = new HashSet<>();
        for (int index = 0; index < config.sections().size(); index++) {
            String id = config.sections().get(index).id();
            if (StringUtils.hasText(id) && !seen.add(id)) {
                errors.add(ValidationIssue.error("sections[" + index + "].id", "Duplicate section ID: " + id,
                    DUPLICATE_SECTION_ID));
            }
        }
    }

    private void checkComponents(PageConfiguration config, boolean strict,
                                 List<ValidationIssue> errors, List<ValidationIssue> warnings) {
        Set<String> known = knownComponents.get();
        for (int index = 0; index < config.sections().size(); index++) {
            String component = config.sections().get(index).component();
            if (!StringUtils.hasText(component) || known.contains(component)) {
                continue;
            }
            ValidationIssue issue = new ValidationIssue("sections[" + index + "].component",
                "Unknown component: " + component, UNKNOWN_COMPONENT,
                strict ? IssueSeverity.ERROR : IssueSeverity.WARNING,
                "Available components: " + String.join(", ", known));
            (strict ? errors : warnings).add(issue);
        }
    }

    private void checkLengths(PageConfiguration config, List<ValidationIssue> warnings) {
        if (config.meta() == null) {
            return;
        }
        String title = config.meta().title();
        if (title != null && title.length() > RECOMMENDED_TITLE_LENGTH) {
            warnings.add(ValidationIssue.warning("meta.title",
                "Title is " + title.length() + " characters, longer than the recommended " + RECOMMENDED_TITLE_LENGTH,
                LONG_TITLE, SEO_SUGGESTION));
        }
        String description = config.meta().description();
        if (description != null && description.length() > RECOMMENDED_DESCRIPTION_LENGTH) {
            warnings.add(ValidationIssue.warning("meta.description",
                "Description is " + description.length() + " characters, longer than the recommended "
                    + RECOMMENDED_DESCRIPTION_LENGTH,
                LONG_DESCRIPTION, SEO_SUGGESTION));
        }
    }

    private void checkFeatures(PageConfiguration config, List<ValidationIssue> warnings) {
        int index = 0;
        for (String feature : config.features()) {
            if (!KNOWN_FEATURES.contains(feature)) {
                warnings.add(ValidationIssue.warning("features[" + index + "]", "Unknown feature: " + feature,
                    UNKNOWN_FEATURE, "Valid features: " + String.join(", ", KNOWN_FEATURES.stream().sorted().toList())));
            }
            index++;
        }
    }

    private void checkAltText(PageConfiguration config, List<ValidationIssue> warnings) {
        if (!config.hasFeature("accessibility")) {
            return;
        }
        for (int index = 0; index < config.sections().size(); index++) {
            SectionSpec section = config.sections().get(index);
            String field = "sections[" + index + "].props";
            if ("Image".equals(section.component()) && !StringUtils.hasText(asText(section.props().get("alt")))) {
                warnings.add(ValidationIssue.warning(field + ".alt", "Image is missing alt text", MISSING_ALT_TEXT));
            }
            if (section.props().get("media") instanceof Map<?, ?> media
                && media.get("src") != null
                && !StringUtils.hasText(asText(media.get("alt")))) {
                warnings.add(ValidationIssue.warning(field + ".media.alt",
                    "Media in section " + section.id() + " is missing alt text", MISSING_ALT_TEXT));
            }
        }
    }

    private static String asText(Object value) {
        return value == null ? null : String.valueOf(value);
    }
}
