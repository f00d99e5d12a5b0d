package net.revivatech.domain.preview;

import jakarta.annotation.Nullable;

/**
 * A scorer finding.
 *
 * @param type issue category, for example {@code render}, {@code bundle}, {@code alt-text} or {@code title}
 * @param impact how much the issue matters
 * @param message description
 * @param sectionId affected section, {@code null} for page-wide issues
 */
public record PreviewIssue(String type, Impact impact, String message, @Nullable String sectionId) {

    public enum Impact {
        LOW,
        MEDIUM,
        HIGH
    }
}
