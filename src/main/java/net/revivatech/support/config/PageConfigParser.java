package net.revivatech.support.config;

import jakarta.annotation.Nullable;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import net.revivatech.domain.page.AnalyticsSpec;
import net.revivatech.domain.page.AuthSpec;
import net.revivatech.domain.page.ConditionOperator;
import net.revivatech.domain.page.ConditionType;
import net.revivatech.domain.page.DeviceType;
import net.revivatech.domain.page.PageConfiguration;
import net.revivatech.domain.page.PageMeta;
import net.revivatech.domain.page.SectionSpec;
import net.revivatech.domain.page.VisibilityCondition;
import net.revivatech.domain.page.VisibilitySpec;
import net.revivatech.domain.validation.ValidationIssue;

/**
 * Turns a raw JSON object into a {@link PageConfiguration}, collecting every structural
 * problem instead of stopping at the first one. Length limits are not structural and
 * are left to {@link PageConfigValidator}.
 */
final class PageConfigParser {

    static final String REQUIRED = "REQUIRED";
    static final String INVALID_TYPE = "INVALID_TYPE";
    static final String INVALID_VALUE = "INVALID_VALUE";
    static final String TOO_SMALL = "TOO_SMALL";

    private final List<ValidationIssue> errors = new ArrayList<>();

    private PageConfigParser() {
    }

    /**
     * @param config parsed configuration, {@code null} when {@code errors} is not empty
     * @param errors structural errors
     */
    record Outcome(@Nullable PageConfiguration config, List<ValidationIssue> errors) {
    }

    static Outcome parse(@Nullable Map<String, Object> raw) {
        PageConfigParser parser = new PageConfigParser();
        if (raw == null) {
            parser.errors.add(ValidationIssue.error("", "Configuration must be a JSON object", INVALID_TYPE));
            return new Outcome(null, parser.errors);
        }
        PageConfiguration config = parser.configuration(raw);
        return new Outcome(parser.errors.isEmpty() ? config : null, List.copyOf(parser.errors));
    }

    private PageConfiguration configuration(Map<String, Object> raw) {
        PageMeta meta = meta(raw.get("meta"));
        String layout = requiredText(raw, "layout", "layout");
        List<SectionSpec> sections = sections(raw.get("sections"));
        Set<String> features = new LinkedHashSet<>(stringList(raw.get("features"), "features"));
        AuthSpec auth = auth(raw.get("auth"));
        AnalyticsSpec analytics = analytics(raw.get("analytics"));
        return new PageConfiguration(meta, layout, sections, features, auth, analytics);
    }

    private PageMeta meta(Object rawMeta) {
        Optional<Map<String, Object>> meta = object(rawMeta, "meta", true);
        if (meta.isEmpty()) {
            return new PageMeta("", "");
        }
        Map<String, Object> values = meta.get();
        return new PageMeta(
            requiredText(values, "title", "meta.title"),
            requiredText(values, "description", "meta.description"),
            stringList(values.get("keywords"), "meta.keywords"),
            optionalText(values, "ogImage", "meta.ogImage"),
            optionalText(values, "robots", "meta.robots")
        );
    }

    private List<SectionSpec> sections(Object rawSections) {
        if (rawSections == null) {
            errors.add(ValidationIssue.error("sections", "sections is required", REQUIRED));
            return List.of();
        }
        if (!(rawSections instanceof List<?> list)) {
            errors.add(ValidationIssue.error("sections", "sections must be an array", INVALID_TYPE));
            return List.of();
        }
        if (list.isEmpty()) {
            errors.add(ValidationIssue.error("sections", "At least one section is required", TOO_SMALL));
            return List.of();
        }
        List<SectionSpec> sections = new ArrayList<>();
        for (int index = 0; index < list.size(); index++) {
            String field = "sections[" + index + "]";
            Optional<Map<String, Object>> section = object(list.get(index), field, true);
            section.ifPresent(values -> sections.add(section(values, field)));
        }
        return sections;
    }

    private SectionSpec section(Map<String, Object> values, String field) {
        String id = requiredText(values, "id", field + ".id");
        String component = requiredText(values, "component", field + ".component");
        Map<String, Object> props = object(values.get("props"), field + ".props", false).orElse(Map.of());
        VisibilitySpec visibility = visibility(values.get("visibility"), field + ".visibility");
        List<String> variants = stringList(values.get("variants"), field + ".variants");
        return new SectionSpec(id, component, props, visibility, variants);
    }

    private VisibilitySpec visibility(Object rawVisibility, String field) {
        Optional<Map<String, Object>> visibility = object(rawVisibility, field, false);
        if (visibility.isEmpty()) {
            return VisibilitySpec.ALWAYS;
        }
        List<VisibilityCondition> conditions = new ArrayList<>();
        Object rawConditions = visibility.get().get("conditions");
        if (rawConditions != null) {
            if (rawConditions instanceof List<?> list) {
                for (int index = 0; index < list.size(); index++) {
                    String conditionField = field + ".conditions[" + index + "]";
                    object(list.get(index), conditionField, true)
                        .flatMap(condition -> condition(condition, conditionField))
                        .ifPresent(conditions::add);
                }
            } else {
                errors.add(ValidationIssue.error(field + ".conditions", "conditions must be an array", INVALID_TYPE));
            }
        }
        Map<DeviceType, Boolean> responsive = new EnumMap<>(DeviceType.class);
        object(visibility.get().get("responsive"), field + ".responsive", false).ifPresent(devices ->
            devices.forEach((device, flag) -> DeviceType.fromValue(device).ifPresent(type -> {
                if (flag instanceof Boolean enabled) {
                    responsive.put(type, enabled);
                } else {
                    errors.add(ValidationIssue.error(field + ".responsive." + device,
                        "responsive." + device + " must be a boolean", INVALID_TYPE));
                }
            })));
        return new VisibilitySpec(conditions, responsive);
    }

    private Optional<VisibilityCondition> condition(Map<String, Object> values, String field) {
        Optional<ConditionType> type = ConditionType.fromValue(asText(values.get("type")));
        Optional<ConditionOperator> operator = ConditionOperator.fromValue(asText(values.get("operator")));
        if (type.isEmpty()) {
            errors.add(ValidationIssue.error(field + ".type",
                "type must be one of feature, user, time, custom", INVALID_VALUE));
        }
        if (operator.isEmpty()) {
            errors.add(ValidationIssue.error(field + ".operator",
                "operator must be one of equals, notEquals, contains, greaterThan, lessThan", INVALID_VALUE));
        }
        if (type.isEmpty() || operator.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new VisibilityCondition(type.get(), operator.get(), values.get("value")));
    }

    private AuthSpec auth(Object rawAuth) {
        Optional<Map<String, Object>> auth = object(rawAuth, "auth", false);
        if (auth.isEmpty()) {
            return AuthSpec.PUBLIC;
        }
        Map<String, Object> values = auth.get();
        Object required = values.get("required");
        if (required != null && !(required instanceof Boolean)) {
            errors.add(ValidationIssue.error("auth.required", "auth.required must be a boolean", INVALID_TYPE));
        }
        return new AuthSpec(Boolean.TRUE.equals(required), stringList(values.get("roles"), "auth.roles"),
            optionalText(values, "redirectTo", "auth.redirectTo"));
    }

    private AnalyticsSpec analytics(Object rawAnalytics) {
        Optional<Map<String, Object>> analytics = object(rawAnalytics, "analytics", false);
        if (analytics.isEmpty()) {
            return null;
        }
        Map<String, Object> values = analytics.get();
        Map<String, String> dimensions = new LinkedHashMap<>();
        object(values.get("customDimensions"), "analytics.customDimensions", false)
            .ifPresent(raw -> raw.forEach((key, value) -> dimensions.put(key, String.valueOf(value))));
        return new AnalyticsSpec(
            requiredText(values, "pageType", "analytics.pageType"),
            requiredText(values, "category", "analytics.category"),
            dimensions);
    }

    @SuppressWarnings("unchecked")
    private Optional<Map<String, Object>> object(Object value, String field, boolean required) {
        if (value == null) {
            if (required) {
                errors.add(ValidationIssue.error(field, field + " is required", REQUIRED));
            }
            return Optional.empty();
        }
        if (value instanceof Map<?, ?> map) {
            return Optional.of((Map<String, Object>) map);
        }
        errors.add(ValidationIssue.error(field, field + " must be an object", INVALID_TYPE));
        return Optional.empty();
    }

    private String requiredText(Map<String, Object> values, String key, String field) {
        Object value = values.get(key);
        if (value == null) {
            errors.add(ValidationIssue.error(field, field + " is required", REQUIRED));
            return "";
        }
        if (!(value instanceof String text)) {
            errors.add(ValidationIssue.error(field, field + " must be a string", INVALID_TYPE));
            return "";
        }
        if (text.isBlank()) {
            errors.add(ValidationIssue.error(field, field + " must not be empty", TOO_SMALL));
        }
        return text;
    }

    private String optionalText(Map<String, Object> values, String key, String field) {
        Object value = values.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof String text) {
            return text;
        }
        errors.add(ValidationIssue.error(field, field + " must be a string", INVALID_TYPE));
        return null;
    }

    private List<String> stringList(Object value, String field) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            errors.add(ValidationIssue.error(field, field + " must be an array", INVALID_TYPE));
            return List.of();
        }
        List<String> strings = new ArrayList<>();
        for (int index = 0; index < list.size(); index++) {
            if (list.get(index) instanceof String text) {
                strings.add(text);
            } else {
                errors.add(ValidationIssue.error(field + "[" + index + "]", field + " entries must be strings", INVALID_TYPE));
            }
        }
        return strings;
    }

    private static String asText(Object value) {
        return value instanceof String text ? text : null;
    }
}
