package net.revivatech.config;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

/**
 * Strongly typed configuration for page loading, rendering and previews.
 */
@Component
@ConfigurationProperties(prefix = "pages")
public class PageEngineProperties {

    /**
     * Locale used when a request does not specify one.
     */
    private String defaultLocale = "en";

    /**
     * Locale retried when content is missing in the requested locale.
     */
    private String fallbackLocale = "en";

    /**
     * Locales a visitor may select through {@code Accept-Language}.
     */
    private List<String> supportedLocales = new ArrayList<>(List.of("en", "fr"));

    /**
     * Classpath folder holding page configuration documents.
     */
    private String configLocation = "pages";

    /**
     * Optional file system folder checked before the classpath folder.
     */
    private String configDirectory = "";

    /**
     * Validated configuration cache lifetime.
     */
    private Duration configCacheTtl = Duration.ofSeconds(60);

    /**
     * Validated configuration cache lifetime when the dev profile is active.
     */
    private Duration configCacheDevTtl = Duration.ofSeconds(1);

    /**
     * Lifetime of route-resolved configurations held by the dynamic route handler.
     */
    private Duration resolvedPageCacheTtl = Duration.ofHours(1);

    /**
     * Default lifetime of cached content entries.
     */
    private Duration contentTtl = Duration.ofHours(1);

    /**
     * Time a section may spend resolving its component and content before a loading
     * placeholder is emitted instead.
     */
    private Duration renderTimeout = Duration.ofSeconds(2);

    /**
     * Treat unknown components as validation errors when creating pages.
     */
    private boolean strictComponents = false;

    /**
     * Theme names recognized by the theme props stage.
     */
    private List<String> themes = new ArrayList<>(List.of("light", "dark"));

    /**
     * Dynamic route patterns in match priority order.
     */
    private List<RoutePattern> routes = new ArrayList<>();

    /**
     * Permanent path redirects.
     */
    private List<Redirect> redirects = new ArrayList<>();

    /**
     * Components loaded on first use, keyed by registry name with the implementing class as value.
     */
    private Map<String, String> lazyComponents = new LinkedHashMap<>();

    private final RemoteContent remoteContent = new RemoteContent();

    private final Preview preview = new Preview();

    @PostConstruct
    void validate() {
        Assert.hasText(defaultLocale, "pages.default-locale must not be blank");
        Assert.hasText(fallbackLocale, "pages.fallback-locale must not be blank");
        Assert.isTrue(supportedLocales.contains(defaultLocale),
            "pages.supported-locales must include the default locale " + defaultLocale);
        Assert.isTrue(!configCacheTtl.isNegative(), "pages.config-cache-ttl must be non-negative");
        Assert.isTrue(!contentTtl.isNegative(), "pages.content-ttl must be non-negative");
        Assert.isTrue(!renderTimeout.isNegative() && !renderTimeout.isZero(), "pages.render-timeout must be positive");
        for (RoutePattern route : routes) {
            Assert.hasText(route.getPattern(), "pages.routes[].pattern must not be blank");
            Assert.hasText(route.getConfig(), "pages.routes[].config must not be blank");
        }
        if (remoteContent.isEnabled()) {
            Assert.isTrue(StringUtils.hasText(remoteContent.getBaseUrl()),
                "pages.remote-content.base-url is required when remote content is enabled");
        }
    }

    public String getDefaultLocale() {
        return defaultLocale;
    }

    public void setDefaultLocale(String defaultLocale) {
        this.defaultLocale = defaultLocale;
    }

    public String getFallbackLocale() {
        return fallbackLocale;
    }

    public void setFallbackLocale(String fallbackLocale) {
        this.fallbackLocale = fallbackLocale;
    }

    public List<String> getSupportedLocales() {
        return supportedLocales;
    }

    public void setSupportedLocales(List<String> supportedLocales) {
        this.supportedLocales = supportedLocales;
    }

    public String getConfigLocation() {
        return configLocation;
    }

    public void setConfigLocation(String configLocation) {
        this.configLocation = configLocation;
    }

    public String getConfigDirectory() {
        return configDirectory;
    }

    public void setConfigDirectory(String configDirectory) {
        this.configDirectory = configDirectory;
    }

    public Duration getConfigCacheTtl() {
        return configCacheTtl;
    }

    public void setConfigCacheTtl(Duration configCacheTtl) {
        this.configCacheTtl = configCacheTtl;
    }

    public Duration getConfigCacheDevTtl() {
        return configCacheDevTtl;
    }

    public void setConfigCacheDevTtl(Duration configCacheDevTtl) {
        this.configCacheDevTtl = configCacheDevTtl;
    }

    public Duration getResolvedPageCacheTtl() {
        return resolvedPageCacheTtl;
    }

    public void setResolvedPageCacheTtl(Duration resolvedPageCacheTtl) {
        this.resolvedPageCacheTtl = resolvedPageCacheTtl;
    }

    public Duration getContentTtl() {
        return contentTtl;
    }

    public void setContentTtl(Duration contentTtl) {
        this.contentTtl = contentTtl;
    }

    public Duration getRenderTimeout() {
        return renderTimeout;
    }

    public void setRenderTimeout(Duration renderTimeout) {
        this.renderTimeout = renderTimeout;
    }

    public boolean isStrictComponents() {
        return strictComponents;
    }

    public void setStrictComponents(boolean strictComponents) {
        this.strictComponents = strictComponents;
    }

    public List<String> getThemes() {
        return themes;
    }

    public void setThemes(List<String> themes) {
        this.themes = themes;
    }

    public List<RoutePattern> getRoutes() {
        return routes;
    }

    public void setRoutes(List<RoutePattern> routes) {
        this.routes = routes;
    }

    public List<Redirect> getRedirects() {
        return redirects;
    }

    public void setRedirects(List<Redirect> redirects) {
        this.redirects = redirects;
    }

    public Map<String, String> getLazyComponents() {
        return lazyComponents;
    }

    public void setLazyComponents(Map<String, String> lazyComponents) {
        this.lazyComponents = lazyComponents;
    }

    public RemoteContent getRemoteContent() {
        return remoteContent;
    }

    public Preview getPreview() {
        return preview;
    }

    public static class RoutePattern {

        private String pattern;
        private String config;

        public RoutePattern() {
        }

        public RoutePattern(String pattern, String config) {
            this.pattern = pattern;
            this.config = config;
        }

        public String getPattern() {
            return pattern;
        }

        public void setPattern(String pattern) {
            this.pattern = pattern;
        }

        public String getConfig() {
            return config;
        }

        public void setConfig(String config) {
            this.config = config;
        }
    }

    public static class Redirect {

        private String from;
        private String to;

        public Redirect() {
        }

        public Redirect(String from, String to) {
            this.from = from;
            this.to = to;
        }

        public String getFrom() {
            return from;
        }

        public void setFrom(String from) {
            this.from = from;
        }

        public String getTo() {
            return to;
        }

        public void setTo(String to) {
            this.to = to;
        }
    }

    /**
     * Headless CMS style content API queried after the bundled content files.
     */
    public static class RemoteContent {

        private boolean enabled = false;
        private String baseUrl = "";
        private String apiKey = "";
        private Duration timeout = Duration.ofSeconds(3);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public static class Preview {

        /**
         * How long a preview stays retrievable.
         */
        private Duration ttl = Duration.ofHours(24);

        /**
         * Cron expression for the expired preview sweep.
         */
        private String purgeCron = "0 */15 * * * *";

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        public String getPurgeCron() {
            return purgeCron;
        }

        public void setPurgeCron(String purgeCron) {
            this.purgeCron = purgeCron;
        }
    }
}
