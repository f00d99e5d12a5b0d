package net.revivatech.support.seo;

import java.util.List;
import net.revivatech.domain.seo.MetadataValidation;
import net.revivatech.domain.seo.SeoMetadata;
import net.revivatech.domain.validation.ValidationIssue;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MetadataValidatorTest {

    private final MetadataValidator validator = new MetadataValidator();

    @Test
    void should_ReportErrors_When_TitleAndDescriptionAreMissing() {
        MetadataValidation validation = validator.validate(metadata("", " ", List.of("repair"), "https://revivatech.co.uk/og.png"));

        assertThat(validation.valid()).isFalse();
        assertThat(validation.errors()).extracting(ValidationIssue::code)
            .containsExactly(MetadataValidator.MISSING_TITLE, MetadataValidator.MISSING_DESCRIPTION);
    }

    @Test
    void should_WarnOnLengthAndImage_When_MetadataIsVerbose() {
        MetadataValidation validation = validator.validate(metadata(
            "Professional Apple Mac and Windows PC Repair Services in Central London",
            "x".repeat(161), List.of("repair"), null));

        assertThat(validation.valid()).isTrue();
        assertThat(validation.warnings()).extracting(ValidationIssue::code)
            .containsExactly(MetadataValidator.LONG_TITLE, MetadataValidator.LONG_DESCRIPTION,
                MetadataValidator.MISSING_OG_IMAGE);
        assertThat(validation.suggestions()).isEmpty();
    }

    @Test
    void should_OnlySuggest_When_TitleIsShortAndKeywordsAreEmpty() {
        MetadataValidation validation = validator.validate(metadata("Mac Repair", "Fast Mac repairs in London.",
            List.of(), "https://revivatech.co.uk/og.png"));

        assertThat(validation.valid()).isTrue();
        assertThat(validation.warnings()).isEmpty();
        assertThat(validation.suggestions()).extracting(ValidationIssue::code)
            .containsExactly(MetadataValidator.SHORT_TITLE, MetadataValidator.MISSING_KEYWORDS);
    }

    private static SeoMetadata metadata(String title, String description, List<String> keywords, String ogImage) {
        return new SeoMetadata(title, description, "https://revivatech.co.uk/", keywords, ogImage,
            "index,follow", null, null, null);
    }
}
