package net.revivatech.support.html;

import java.util.Locale;
import net.revivatech.config.SiteProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Canonicalizes route-relative and absolute URLs to stable public URL values.
 */
@Component
public class CanonicalUrlResolver {

    private static final String HTTP_SCHEME_PREFIX = "http";

    private final SiteProperties siteProperties;

    public CanonicalUrlResolver(SiteProperties siteProperties) {
        this.siteProperties = siteProperties;
    }

    /**
     * Returns an absolute URL for a route-relative or already absolute candidate.
     *
     * @param candidate route-relative path (for example {@code /services/mac-repair}) or absolute URL
     * @return absolute URL anchored to the configured site base URL
     */
    public String normalizePublicUrl(String candidate) {
        String baseUrl = trimTrailingSlash(siteProperties.getBaseUrl());
        String raw = StringUtils.hasText(candidate) ? candidate.trim() : "/";
        if (raw.toLowerCase(Locale.ROOT).startsWith(HTTP_SCHEME_PREFIX)) {
            return raw;
        }
        if (!raw.startsWith("/")) {
            raw = "/" + raw;
        }
        return baseUrl + raw;
    }

    public String baseUrl() {
        return trimTrailingSlash(siteProperties.getBaseUrl());
    }

    private static String trimTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
