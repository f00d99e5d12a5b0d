package net.revivatech.domain.preview;

import java.util.List;
import java.util.Set;

/**
 * Summary and scores attached to a generated preview.
 */
public record PreviewMetadata(
    String title,
    String description,
    int sectionCount,
    List<String> componentsUsed,
    Set<String> features,
    ScoreReport performance,
    ScoreReport accessibility,
    ScoreReport seo
) {

    public PreviewMetadata {
        componentsUsed = componentsUsed == null ? List.of() : List.copyOf(componentsUsed);
        features = features == null ? Set.of() : Set.copyOf(features);
    }
}
