package net.revivatech.support.component;

/**
 * Introspection category inferred from a component name. Has no effect on rendering.
 */
public enum ComponentCategory {
    SECTION("Section"),
    LAYOUT("Layout"),
    FORM("Form"),
    CARD("Card"),
    NAVIGATION("Nav"),
    UI(null);

    private final String nameMarker;

    ComponentCategory(String nameMarker) {
        this.nameMarker = nameMarker;
    }

    public static ComponentCategory infer(String componentName) {
        for (ComponentCategory category : values()) {
            if (category.nameMarker != null && componentName.contains(category.nameMarker)) {
                return category;
            }
        }
        return UI;
    }

    public String describe(String componentName) {
        return switch (this) {
            case SECTION -> componentName + " page section";
            case LAYOUT -> componentName + " layout";
            case FORM -> componentName + " form component";
            case CARD -> componentName + " card component";
            case NAVIGATION -> componentName + " navigation component";
            case UI -> componentName + " UI component";
        };
    }
}
