package net.revivatech.support.content;

import net.revivatech.config.CacheFactory;
import net.revivatech.domain.content.ContentEntry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import reactor.test.StepVerifier;
import tools.jackson.databind.ObjectMapper;

import static org.assertj.core.api.Assertions.assertThat;

class ClasspathContentSourceTest {

    private final ClasspathContentSource source = new ClasspathContentSource(new ObjectMapper(), new CacheFactory());

    @Test
    void should_ReadNestedValue_When_KeyStartsWithFileName() {
        StepVerifier.create(source.load("home.hero.title", "en").map(ContentEntry::processed))
            .expectNext("Professional Computer Repair Services")
            .verifyComplete();
    }

    @Test
    void should_ReportMissing_When_LocaleFileLacksKey() {
        StepVerifier.create(source.exists("home.testimonials.title", "fr"))
            .expectNext(false)
            .verifyComplete();
    }

    @Test
    void should_ReturnSubtree_When_LoadingNamespace() {
        StepVerifier.create(source.loadNamespace("services.mac", "en"))
            .assertNext(values -> assertThat(values).containsKeys("title", "summary", "body"))
            .verifyComplete();
    }

    @Test
    void should_ReportMissing_When_LocaleEscapesContentFolder() {
        StepVerifier.create(source.exists("index.meta.title", "../pages"))
            .expectNext(false)
            .verifyComplete();
        StepVerifier.create(source.load("home.hero.title", "en/../en"))
            .verifyComplete();
    }

    @ParameterizedTest
    @CsvSource({"en, true", "pt-br, true", "fil, true", "../pages, false", "EN, false", "'', false", "en_*, false"})
    void should_AcceptOnlyPlainLanguageTags_When_CheckingLocale(String locale, boolean expected) {
        assertThat(ClasspathContentSource.isLocaleTag(locale)).isEqualTo(expected);
    }
}
