package net.revivatech.domain.page;

import jakarta.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Declarative description of a page: metadata, layout and ordered sections.
 *
 * @param meta page metadata
 * @param layout layout name
 * @param sections ordered section descriptors
 * @param features enabled feature flags in declaration order
 * @param auth access rule, {@link AuthSpec#PUBLIC} when omitted
 * @param analytics analytics classification, may be {@code null}
 */
public record PageConfiguration(
    PageMeta meta,
    String layout,
    List<SectionSpec> sections,
    Set<String> features,
    AuthSpec auth,
    @Nullable AnalyticsSpec analytics
) {

    public PageConfiguration {
        sections = sections == null ? List.of() : List.copyOf(sections);
        features = features == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(features));
        auth = auth == null ? AuthSpec.PUBLIC : auth;
    }

    public PageConfiguration(PageMeta meta, String layout, List<SectionSpec> sections) {
        this(meta, layout, sections, Set.of(), AuthSpec.PUBLIC, null);
    }

    public boolean hasFeature(String feature) {
        return features.contains(feature);
    }

    public boolean requiresAuth() {
        return auth.required();
    }

    public String pageType() {
        return analytics == null ? null : analytics.pageType();
    }

    public PageConfiguration withMeta(PageMeta newMeta) {
        return new PageConfiguration(newMeta, layout, sections, features, auth, analytics);
    }
}
