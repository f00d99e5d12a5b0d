package net.revivatech.application.preview;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.revivatech.domain.page.PageConfiguration;
import net.revivatech.domain.page.SectionSpec;
import net.revivatech.domain.preview.PreviewIssue;
import net.revivatech.domain.preview.ScoreReport;
import net.revivatech.support.config.PageConfigValidator;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Performance, accessibility and SEO scores for a configuration under authoring.
 *
 * <p>Each scorer starts at 100 and subtracts a fixed penalty per issue:
 * 10 for performance and SEO, 5 for accessibility.
 */
@Component
public class PreviewScoringPolicy {

    static final int SECTION_LIMIT = 10;
    static final Set<String> HEAVY_COMPONENTS = Set.of("TestimonialsCarousel", "DynamicForm");

    private static final int PERFORMANCE_PENALTY = 10;
    private static final int ACCESSIBILITY_PENALTY = 5;
    private static final int SEO_PENALTY = 10;
    private static final int MISSING_KEYWORDS_PENALTY = 5;

    public ScoreReport performance(PageConfiguration config) {
        List<PreviewIssue> issues = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();
        if (config.sections().size() > SECTION_LIMIT) {
            issues.add(new PreviewIssue("render", PreviewIssue.Impact.MEDIUM,
                "Page has " + config.sections().size() + " sections which may slow rendering", null));
            recommendations.add("Combine related sections or load sections below the fold lazily");
        }
        for (SectionSpec section : config.sections()) {
            if (HEAVY_COMPONENTS.contains(section.component())) {
                issues.add(new PreviewIssue("bundle", PreviewIssue.Impact.LOW,
                    section.component() + " adds a large bundle", section.id()));
            }
        }
        if (config.sections().stream().anyMatch(section -> HEAVY_COMPONENTS.contains(section.component()))) {
            recommendations.add("Load heavy components on demand with code splitting");
        }
        return new ScoreReport(100 - issues.size() * PERFORMANCE_PENALTY, issues, recommendations);
    }

    public ScoreReport accessibility(PageConfiguration config) {
        List<PreviewIssue> issues = new ArrayList<>();
        for (SectionSpec section : config.sections()) {
            if (missingAltText(section)) {
                issues.add(new PreviewIssue("alt-text", PreviewIssue.Impact.HIGH,
                    "Image in section " + section.id() + " is missing alt text", section.id()));
            }
        }
        int score = 100 - issues.size() * ACCESSIBILITY_PENALTY;
        List<String> recommendations = issues.isEmpty()
            ? List.of()
            : List.of("Describe every image with an alt property");
        return new ScoreReport(score, issues, recommendations, conformanceLevel(score));
    }

    public ScoreReport seo(PageConfiguration config) {
        List<PreviewIssue> issues = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();
        if (config.meta().title().length() > PageConfigValidator.RECOMMENDED_TITLE_LENGTH) {
            issues.add(new PreviewIssue("title", PreviewIssue.Impact.MEDIUM,
                "Title is longer than " + PageConfigValidator.RECOMMENDED_TITLE_LENGTH + " characters", null));
        }
        if (config.meta().description().length() > PageConfigValidator.RECOMMENDED_DESCRIPTION_LENGTH) {
            issues.add(new PreviewIssue("description", PreviewIssue.Impact.MEDIUM,
                "Description is longer than " + PageConfigValidator.RECOMMENDED_DESCRIPTION_LENGTH + " characters", null));
        }
        int score = 100 - issues.size() * SEO_PENALTY;
        if (config.meta().keywords().isEmpty()) {
            score -= MISSING_KEYWORDS_PENALTY;
            recommendations.add("Add relevant keywords to meta.keywords");
        }
        return new ScoreReport(score, issues, recommendations);
    }

    static String conformanceLevel(int score) {
        if (score >= 95) {
            return "AAA";
        }
        return score >= 80 ? "AA" : "A";
    }

    private static boolean missingAltText(SectionSpec section) {
        if ("Image".equals(section.component()) && !StringUtils.hasText(text(section.props().get("alt")))) {
            return true;
        }
        return section.props().get("media") instanceof Map<?, ?> media
            && media.get("src") != null
            && !StringUtils.hasText(text(media.get("alt")));
    }

    private static String text(Object value) {
        return value == null ? null : String.valueOf(value);
    }
}
