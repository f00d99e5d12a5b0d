package net.revivatech.application.render;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import net.revivatech.domain.page.ConditionOperator;
import net.revivatech.domain.page.DeviceType;
import net.revivatech.domain.page.RenderContext;
import net.revivatech.domain.page.ResolvedVisibility;
import net.revivatech.domain.page.UserDescriptor;
import net.revivatech.domain.page.VisibilityCondition;
import net.revivatech.domain.page.VisibilitySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Evaluates section visibility rules against a render context.
 *
 * <p>Conditions are combined with AND. Operators a condition type does not define
 * evaluate to {@code true}; {@code custom} conditions always do.
 */
@Component
public class VisibilityEvaluator {

    private static final Logger log = LoggerFactory.getLogger(VisibilityEvaluator.class);

    private static final List<Function<String, Instant>> TIME_PARSERS = List.of(
        text -> OffsetDateTime.parse(text).toInstant(),
        text -> LocalDateTime.parse(text).toInstant(ZoneOffset.UTC),
        text -> LocalDate.parse(text).atStartOfDay().toInstant(ZoneOffset.UTC)
    );

    private final Clock clock;

    public VisibilityEvaluator(Clock clock) {
        this.clock = clock;
    }

    public ResolvedVisibility evaluate(VisibilitySpec visibility, RenderContext context) {
        boolean conditionsMet = visibility.conditions().stream()
            .allMatch(condition -> evaluateCondition(condition, context));
        Map<DeviceType, Boolean> devices = new EnumMap<>(DeviceType.class);
        for (DeviceType device : DeviceType.values()) {
            devices.put(device, visibility.isVisibleOn(device));
        }
        boolean visible = conditionsMet && visibility.isVisibleOn(context.deviceType());
        return new ResolvedVisibility(conditionsMet, devices, visible);
    }

    public boolean evaluateCondition(VisibilityCondition condition, RenderContext context) {
        return switch (condition.type()) {
            case FEATURE -> evaluateFeature(condition, context);
            case USER -> evaluateUser(condition, context.currentUser());
            case TIME -> evaluateTime(condition);
            case CUSTOM -> true;
        };
    }

    private boolean evaluateFeature(VisibilityCondition condition, RenderContext context) {
        String value = condition.valueAsText();
        return switch (condition.operator()) {
            case EQUALS -> context.features().contains(value);
            case NOT_EQUALS -> !context.features().contains(value);
            case CONTAINS -> context.features().stream().anyMatch(feature -> feature.contains(value));
            default -> true;
        };
    }

    private boolean evaluateUser(VisibilityCondition condition, Optional<UserDescriptor> user) {
        if (user.isEmpty()) {
            return condition.operator() == ConditionOperator.NOT_EQUALS;
        }
        String role = user.get().role();
        return switch (condition.operator()) {
            case EQUALS -> condition.valueAsText().equals(role);
            case NOT_EQUALS -> !condition.valueAsText().equals(role);
            default -> true;
        };
    }

    private boolean evaluateTime(VisibilityCondition condition) {
        Optional<Instant> threshold = parseInstant(condition.value());
        if (threshold.isEmpty()) {
            log.warn("Time condition value {} is not a date, treating condition as unmet", condition.value());
            return false;
        }
        Instant now = clock.instant();
        return switch (condition.operator()) {
            case GREATER_THAN -> now.isAfter(threshold.get());
            case LESS_THAN -> now.isBefore(threshold.get());
            default -> true;
        };
    }

    static Optional<Instant> parseInstant(Object value) {
        if (value instanceof Number epochMillis) {
            return Optional.of(Instant.ofEpochMilli(epochMillis.longValue()));
        }
        if (!(value instanceof String text) || text.isBlank()) {
            return Optional.empty();
        }
        for (Function<String, Instant> parser : TIME_PARSERS) {
            Optional<Instant> parsed = tryParse(parser, text);
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return Optional.empty();
    }

    private static Optional<Instant> tryParse(Function<String, Instant> parser, String text) {
        try {
            return Optional.of(parser.apply(text));
        } catch (DateTimeParseException unparseable) {
            return Optional.empty();
        }
    }
}
