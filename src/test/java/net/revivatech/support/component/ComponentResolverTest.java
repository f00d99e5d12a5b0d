package net.revivatech.support.component;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import net.revivatech.support.component.builtin.DynamicForm;
import net.revivatech.support.component.builtin.TestimonialsCarousel;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class ComponentResolverTest {

    private final ComponentRegistry registry = new ComponentRegistry(Clock.systemUTC(),
        List.of(ComponentRegistryTest.named("HeroSection", "hero")));
    private final LazyComponentSource lazySource = new LazyComponentSource(Map.of(
        "TestimonialsCarousel", TestimonialsCarousel.class.getName(),
        "DynamicForm", DynamicForm.class.getName(),
        "Broken", "net.revivatech.support.component.builtin.DoesNotExist"), getClass().getClassLoader());
    private final ComponentResolver resolver = new ComponentResolver(registry, lazySource);

    @Test
    void should_PreferRegistry_When_ComponentIsRegistered() {
        StepVerifier.create(resolver.resolve("HeroSection"))
            .assertNext(component -> assertThat(component.render(Map.of())).isEqualTo("hero"))
            .verifyComplete();
    }

    @Test
    void should_RegisterLazyComponent_When_LoadedOnDemand() {
        assertThat(resolver.resolveLoaded("DynamicForm")).isEmpty();
        assertThat(resolver.canRender("DynamicForm")).isTrue();

        StepVerifier.create(resolver.resolve("DynamicForm"))
            .assertNext(component -> assertThat(component).isInstanceOf(DynamicForm.class))
            .verifyComplete();

        assertThat(resolver.resolveLoaded("DynamicForm")).isPresent();
    }

    @Test
    void should_ShareOneInstance_When_LoadedConcurrently() {
        List<Object> loaded = Flux.range(0, 8)
            .flatMap(attempt -> lazySource.resolve("TestimonialsCarousel"))
            .map(Object.class::cast)
            .distinct()
            .collectList()
            .block();

        assertThat(loaded).hasSize(1);
    }

    @Test
    void should_CompleteEmpty_When_LazyClassCannotBeLoaded() {
        StepVerifier.create(resolver.resolve("Broken")).verifyComplete();
        StepVerifier.create(resolver.resolve("Nonexistent")).verifyComplete();
        assertThat(resolver.canRender("Nonexistent")).isFalse();
    }

    @Test
    void should_ListEveryKnownName_When_Asked() {
        assertThat(resolver.knownComponents())
            .containsExactly("Broken", "DynamicForm", "HeroSection", "TestimonialsCarousel");
    }

    @Test
    void should_ReportLoadedAndMissing_When_Preloading() {
        StepVerifier.create(resolver.preload(List.of("HeroSection", "TestimonialsCarousel", "Broken", "Nonexistent")))
            .assertNext(report -> {
                assertThat(report.loaded()).containsExactly("HeroSection", "TestimonialsCarousel");
                assertThat(report.missing()).containsExactly("Broken", "Nonexistent");
            })
            .verifyComplete();
        StepVerifier.create(Mono.justOrEmpty(registry.get("TestimonialsCarousel"))).expectNextCount(1).verifyComplete();
    }
}
