package net.revivatech.domain.preview;

import jakarta.annotation.Nullable;
import java.util.List;

/**
 * Score produced by one preview scorer.
 *
 * @param score value between 0 and 100
 * @param issues findings that lowered the score
 * @param recommendations non-scoring advice
 * @param level accessibility conformance level, {@code null} for other scorers
 */
public record ScoreReport(int score, List<PreviewIssue> issues, List<String> recommendations, @Nullable String level) {

    public ScoreReport {
        score = Math.max(0, Math.min(100, score));
        issues = issues == null ? List.of() : List.copyOf(issues);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }

    public ScoreReport(int score, List<PreviewIssue> issues, List<String> recommendations) {
        this(score, issues, recommendations, null);
    }

    public boolean hasIssueOfType(String type) {
        return issues.stream().anyMatch(issue -> issue.type().equals(type));
    }
}
