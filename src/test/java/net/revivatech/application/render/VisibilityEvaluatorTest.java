package net.revivatech.application.render;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.revivatech.domain.page.ConditionOperator;
import net.revivatech.domain.page.ConditionType;
import net.revivatech.domain.page.DeviceContext;
import net.revivatech.domain.page.DeviceType;
import net.revivatech.domain.page.RenderContext;
import net.revivatech.domain.page.ResolvedVisibility;
import net.revivatech.domain.page.UserDescriptor;
import net.revivatech.domain.page.VisibilityCondition;
import net.revivatech.domain.page.VisibilitySpec;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class VisibilityEvaluatorTest {

    private final VisibilityEvaluator evaluator =
        new VisibilityEvaluator(Clock.fixed(Instant.parse("2026-06-15T12:00:00Z"), ZoneOffset.UTC));

    @Test
    void should_ShowSection_When_RequiredFeatureIsActive() {
        VisibilitySpec spec = conditions(new VisibilityCondition(ConditionType.FEATURE, ConditionOperator.EQUALS, "analytics"));

        assertThat(evaluator.evaluate(spec, context(Set.of("analytics"), null)).visible()).isTrue();
        assertThat(evaluator.evaluate(spec, context(Set.of(), null)).visible()).isFalse();
    }

    @Test
    void should_HideSection_When_AnonymousVisitorMeetsRoleEquality() {
        VisibilitySpec spec = conditions(new VisibilityCondition(ConditionType.USER, ConditionOperator.EQUALS, "admin"));

        assertThat(evaluator.evaluate(spec, context(Set.of(), null)).visible()).isFalse();
        assertThat(evaluator.evaluate(spec, context(Set.of(), new UserDescriptor("u-1", "admin"))).visible()).isTrue();
    }

    @Test
    void should_ShowSection_When_AnonymousVisitorMeetsRoleInequality() {
        VisibilitySpec spec = conditions(new VisibilityCondition(ConditionType.USER, ConditionOperator.NOT_EQUALS, "admin"));

        assertThat(evaluator.evaluate(spec, context(Set.of(), null)).visible()).isTrue();
    }

    @Test
    void should_CompareAgainstClock_When_ConditionIsTimeBased() {
        VisibilityCondition launched = new VisibilityCondition(ConditionType.TIME, ConditionOperator.GREATER_THAN, "2026-06-01");
        VisibilityCondition promoEnded = new VisibilityCondition(ConditionType.TIME, ConditionOperator.LESS_THAN,
            "2026-06-10T00:00:00Z");

        assertThat(evaluator.evaluateCondition(launched, RenderContext.defaults())).isTrue();
        assertThat(evaluator.evaluateCondition(promoEnded, RenderContext.defaults())).isFalse();
    }

    @Test
    void should_TreatConditionAsUnmet_When_TimeValueIsNotADate() {
        VisibilityCondition broken = new VisibilityCondition(ConditionType.TIME, ConditionOperator.GREATER_THAN, "next week");

        assertThat(evaluator.evaluateCondition(broken, RenderContext.defaults())).isFalse();
    }

    @Test
    void should_AlwaysPass_When_ConditionIsCustom() {
        VisibilityCondition custom = new VisibilityCondition(ConditionType.CUSTOM, ConditionOperator.EQUALS, "anything");

        assertThat(evaluator.evaluateCondition(custom, RenderContext.defaults())).isTrue();
    }

    @Test
    void should_HideOnlyOnDisabledDevice_When_ResponsiveMapIsPartial() {
        VisibilitySpec spec = new VisibilitySpec(List.of(), Map.of(DeviceType.MOBILE, false));

        ResolvedVisibility onMobile = evaluator.evaluate(spec,
            RenderContext.defaults().withDevice(DeviceContext.of(DeviceType.MOBILE)));
        ResolvedVisibility onDesktop = evaluator.evaluate(spec, RenderContext.defaults());

        assertThat(onMobile.visible()).isFalse();
        assertThat(onMobile.conditionsMet()).isTrue();
        assertThat(onDesktop.visible()).isTrue();
        assertThat(onDesktop.devices())
            .containsEntry(DeviceType.MOBILE, false)
            .containsEntry(DeviceType.TABLET, true)
            .containsEntry(DeviceType.DESKTOP, true);
    }

    private static VisibilitySpec conditions(VisibilityCondition... conditions) {
        return new VisibilitySpec(List.of(conditions), Map.of());
    }

    private static RenderContext context(Set<String> features, UserDescriptor user) {
        return new RenderContext("en", user, features, DeviceContext.DESKTOP, "light", false, Map.of());
    }
}
