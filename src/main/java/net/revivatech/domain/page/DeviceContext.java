package net.revivatech.domain.page;

/**
 * Device the page is rendered for.
 */
public record DeviceContext(DeviceType type, int width, int height, String userAgent) {

    public static final DeviceContext DESKTOP = new DeviceContext(DeviceType.DESKTOP, 1200, 800, "");

    public DeviceContext {
        type = type == null ? DeviceType.DESKTOP : type;
        userAgent = userAgent == null ? "" : userAgent;
    }

    public static DeviceContext of(DeviceType type) {
        return switch (type) {
            case MOBILE -> new DeviceContext(type, 375, 667, "");
            case TABLET -> new DeviceContext(type, 768, 1024, "");
            case DESKTOP -> DESKTOP;
        };
    }
}
