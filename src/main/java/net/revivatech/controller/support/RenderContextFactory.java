package net.revivatech.controller.support;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import net.revivatech.config.PageEngineProperties;
import net.revivatech.domain.page.DeviceContext;
import net.revivatech.domain.page.DeviceType;
import net.revivatech.domain.page.RenderContext;
import net.revivatech.domain.page.UserDescriptor;
import org.springframework.http.HttpCookie;
import org.springframework.http.HttpHeaders;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Builds the per-request {@link RenderContext} from headers, cookies and query flags.
 *
 * <p>Visitor identity is read from {@code X-User-Id} and {@code X-User-Role}, which the
 * upstream authentication gateway sets after verifying the session.</p>
 */
@Component
public class RenderContextFactory {

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String USER_ROLE_HEADER = "X-User-Role";
    public static final String THEME_COOKIE = "theme";
    public static final String PREVIEW_PARAM = "preview";

    static final String DEFAULT_ROLE = "customer";

    private final String defaultLocale;
    private final Set<String> supportedLocales;

    public RenderContextFactory(PageEngineProperties properties) {
        this.defaultLocale = properties.getDefaultLocale();
        this.supportedLocales = properties.getSupportedLocales().stream()
            .map(locale -> locale.toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
    }

    public RenderContext fromRequest(ServerHttpRequest request) {
        HttpHeaders headers = request.getHeaders();
        String userAgent = headers.getFirst(HttpHeaders.USER_AGENT);
        DeviceType deviceType = inferDevice(userAgent);
        DeviceContext base = DeviceContext.of(deviceType);
        DeviceContext device = new DeviceContext(deviceType, base.width(), base.height(), userAgent);

        HttpCookie themeCookie = request.getCookies().getFirst(THEME_COOKIE);
        String theme = themeCookie == null ? null : themeCookie.getValue();
        boolean preview = "true".equalsIgnoreCase(request.getQueryParams().getFirst(PREVIEW_PARAM));

        return new RenderContext(
            primaryLanguage(headers.getFirst(HttpHeaders.ACCEPT_LANGUAGE), defaultLocale, supportedLocales),
            user(headers),
            Set.of(),
            device,
            theme,
            preview,
            null);
    }

    /**
     * Primary language subtag of the first {@code Accept-Language} entry that names a
     * supported locale, lowercased. Anything else resolves to {@code fallback}.
     */
    static String primaryLanguage(String acceptLanguage, String fallback, Set<String> supported) {
        if (!StringUtils.hasText(acceptLanguage)) {
            return fallback;
        }
        for (String entry : acceptLanguage.split(",")) {
            String range = entry.split(";")[0].trim();
            String language = range.split("-")[0].trim().toLowerCase(Locale.ROOT);
            if (supported.contains(language)) {
                return language;
            }
        }
        return fallback;
    }

    static DeviceType inferDevice(String userAgent) {
        if (!StringUtils.hasText(userAgent)) {
            return DeviceType.DESKTOP;
        }
        String agent = userAgent.toLowerCase(Locale.ROOT);
        if (agent.contains("ipad") || agent.contains("tablet")
            || (agent.contains("android") && !agent.contains("mobile"))) {
            return DeviceType.TABLET;
        }
        if (agent.contains("mobi") || agent.contains("iphone") || agent.contains("android")) {
            return DeviceType.MOBILE;
        }
        return DeviceType.DESKTOP;
    }

    private static UserDescriptor user(HttpHeaders headers) {
        String userId = headers.getFirst(USER_ID_HEADER);
        if (!StringUtils.hasText(userId)) {
            return null;
        }
        String role = headers.getFirst(USER_ROLE_HEADER);
        return new UserDescriptor(userId.trim(), StringUtils.hasText(role) ? role.trim() : DEFAULT_ROLE);
    }
}
