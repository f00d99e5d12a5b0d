package net.revivatech.application.render;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.revivatech.config.CacheFactory;
import net.revivatech.domain.page.DeviceContext;
import net.revivatech.domain.page.DeviceType;
import net.revivatech.domain.page.RenderContext;
import net.revivatech.domain.page.UserDescriptor;
import net.revivatech.support.content.ContentCache;
import net.revivatech.support.content.ContentLoader;
import net.revivatech.support.content.InMemoryContentSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class PropsTransformerTest {

    private InMemoryContentSource source;
    private PropsTransformer transformer;

    @BeforeEach
    void setUp() {
        source = new InMemoryContentSource();
        ContentLoader loader = new ContentLoader(List.of(source),
            new ContentCache(new CacheFactory(), Duration.ofHours(1)), "en", "en");
        transformer = new PropsTransformer(loader, List.of("light", "dark"));
    }

    @Test
    void should_ReplaceNestedContentReferences_When_KeysResolve() {
        source.put("home.hero.title", "en", "Professional Computer Repair Services");
        source.put("home.hero.cta", "en", "Book a repair");
        Map<String, Object> props = Map.of(
            "title", "content:home.hero.title",
            "primaryAction", Map.of("label", "content:home.hero.cta", "href", "/book-repair"),
            "tags", List.of("content:home.hero.cta", "plain"));

        StepVerifier.create(transformer.substituteContent(props, RenderContext.defaults()))
            .assertNext(resolved -> {
                assertThat(resolved).containsEntry("title", "Professional Computer Repair Services");
                assertThat(resolved.get("primaryAction")).isEqualTo(Map.of("label", "Book a repair", "href", "/book-repair"));
                assertThat(resolved.get("tags")).isEqualTo(List.of("Book a repair", "plain"));
            })
            .verifyComplete();
    }

    @Test
    void should_KeepLiteralReference_When_ContentIsMissing() {
        Map<String, Object> props = Map.of("title", "content:does.not.exist");

        StepVerifier.create(transformer.transform(props, RenderContext.defaults()))
            .assertNext(resolved -> assertThat(resolved).containsEntry("title", "content:does.not.exist"))
            .verifyComplete();
    }

    @Test
    void should_PromoteThenValue_When_ConditionFeatureIsActive() {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("badge", "Standard");
        props.put("if:badge", true);
        props.put("then:badge", "Express repair available");
        RenderContext withFeature = RenderContext.defaults().withFeatures(Set.of("badge"));

        assertThat(transformer.applyConditionals(props, withFeature))
            .containsExactly(Map.entry("badge", "Express repair available"));
        assertThat(transformer.applyConditionals(props, RenderContext.defaults()))
            .containsExactly(Map.entry("badge", "Standard"));
    }

    @Test
    void should_TreatAuthenticatedAsActive_When_UserIsPresent() {
        Map<String, Object> props = Map.of("if:authenticated", true, "then:authenticated", "Welcome back");
        RenderContext signedIn = new RenderContext("en", new UserDescriptor("u-7", "customer"), Set.of(),
            DeviceContext.DESKTOP, "light", false, Map.of());

        assertThat(transformer.applyConditionals(props, signedIn)).containsEntry("authenticated", "Welcome back");
        assertThat(transformer.applyConditionals(props, RenderContext.defaults())).isEmpty();
    }

    @Test
    void should_PromotePreviewValue_When_RenderingInPreviewMode() {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("ribbon", "Live");
        props.put("if:preview", true);
        props.put("then:preview", "Draft, not yet published");
        RenderContext preview = new RenderContext("en", null, Set.of(), DeviceContext.DESKTOP, "light", true, Map.of());

        assertThat(transformer.applyConditionals(props, preview))
            .containsEntry("preview", "Draft, not yet published")
            .doesNotContainKeys("if:preview", "then:preview");
        assertThat(transformer.applyConditionals(props, RenderContext.defaults()))
            .containsExactly(Map.entry("ribbon", "Live"));
    }

    @Test
    void should_ChooseDeviceValue_When_ResponsiveKeysArePresent() {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("columns", 3);
        props.put("columns:mobile", 1);
        props.put("columns:tablet", 2);
        props.put("ratio:16:9", "wide");

        Map<String, Object> mobile = transformer.resolveResponsive(props, DeviceType.MOBILE);

        assertThat(mobile).containsEntry("columns", 1).containsEntry("ratio:16:9", "wide")
            .doesNotContainKeys("columns:mobile", "columns:tablet");
        assertThat(transformer.resolveResponsive(props, DeviceType.DESKTOP)).containsEntry("columns", 3);
    }

    @Test
    void should_BeIdempotent_When_ResponsiveResolutionRunsTwice() {
        Map<String, Object> props = Map.of("columns", 3, "columns:mobile", 1, "autoplay:tablet", false);

        Map<String, Object> once = transformer.resolveResponsive(props, DeviceType.TABLET);
        Map<String, Object> twice = transformer.resolveResponsive(once, DeviceType.TABLET);

        assertThat(twice).isEqualTo(once);
    }

    @Test
    void should_ApplyThemeOverride_When_ThemeMatches() {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("background", "white");
        props.put("background_dark", "slate");
        props.put("background_light", "ivory");
        props.put("call_to_action", "Book now");

        assertThat(transformer.applyTheme(props, "dark"))
            .containsEntry("background", "slate")
            .containsEntry("call_to_action", "Book now")
            .doesNotContainKeys("background_dark", "background_light");
    }

    @Test
    void should_UseCachedContentOnly_When_TransformingSynchronously() {
        source.put("home.hero.title", "en", "Repairs");
        Map<String, Object> props = Map.of("title", "content:home.hero.title");

        assertThat(transformer.transformSync(props, RenderContext.defaults()))
            .containsEntry("title", "content:home.hero.title");

        transformer.transform(props, RenderContext.defaults()).block();

        assertThat(transformer.transformSync(props, RenderContext.defaults())).containsEntry("title", "Repairs");
    }

    @Test
    void should_RunStagesInOrder_When_TransformingFullProps() {
        source.put("home.hero.title", "en", "Fast Mac repairs");
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("heading", "Computer repairs");
        props.put("heading:mobile", "content:home.hero.title");
        props.put("background", "white");
        props.put("background_dark:mobile", "slate");
        props.put("background_light:mobile", "ivory");
        props.put("background_dark:desktop", "charcoal");
        props.put("if:preview", true);
        props.put("then:preview", "Draft");
        RenderContext mobileDarkPreview = new RenderContext("en", null, Set.of(),
            DeviceContext.of(DeviceType.MOBILE), "dark", true, Map.of());

        StepVerifier.create(transformer.transform(props, mobileDarkPreview))
            .assertNext(resolved -> assertThat(resolved).containsOnly(
                Map.entry("heading", "Fast Mac repairs"),
                Map.entry("background", "slate"),
                Map.entry("preview", "Draft")))
            .verifyComplete();

        StepVerifier.create(transformer.transform(props, RenderContext.defaults()))
            .assertNext(resolved -> assertThat(resolved).containsOnly(
                Map.entry("heading", "Computer repairs"),
                Map.entry("background", "white")))
            .verifyComplete();
    }
}
