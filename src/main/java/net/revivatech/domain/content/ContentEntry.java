package net.revivatech.domain.content;

import java.util.Locale;
import java.util.Map;

/**
 * A localized content value as stored by a content source.
 *
 * <p>Rendering only ever sees the {@link #processed()} form: plain text, the raw
 * rich-text body, or the most descriptive text of a media item.
 */
public sealed interface ContentEntry
    permits ContentEntry.Text, ContentEntry.RichText, ContentEntry.Media {

    String processed();

    /**
     * Interprets a raw JSON value. Objects carrying {@code type} of {@code richtext},
     * {@code image} or {@code video} become typed entries; anything else is text.
     */
    static ContentEntry fromRaw(Object raw) {
        if (raw instanceof Map<?, ?> map && map.get("type") instanceof String type) {
            switch (type.toLowerCase(Locale.ROOT)) {
                case "richtext":
                    return new RichText(stringValue(map, "format", "markdown"), stringValue(map, "content", ""));
                case "image":
                    return new Media(MediaType.IMAGE, stringValue(map, "src", ""),
                        stringValue(map, "alt", null), stringValue(map, "caption", null));
                case "video":
                    return new Media(MediaType.VIDEO, stringValue(map, "src", ""),
                        stringValue(map, "alt", null), stringValue(map, "caption", null));
                default:
                    break;
            }
        }
        return new Text(raw == null ? "" : String.valueOf(raw));
    }

    private static String stringValue(Map<?, ?> map, String key, String fallback) {
        Object value = map.get(key);
        return value == null ? fallback : String.valueOf(value);
    }

    record Text(String value) implements ContentEntry {
        @Override
        public String processed() {
            return value;
        }
    }

    /**
     * @param format body format, usually {@code markdown} or {@code html}
     * @param content raw body
     */
    record RichText(String format, String content) implements ContentEntry {
        @Override
        public String processed() {
            return content;
        }
    }

    record Media(MediaType type, String src, String alt, String caption) implements ContentEntry {
        @Override
        public String processed() {
            if (type == MediaType.IMAGE) {
                if (alt != null) {
                    return alt;
                }
                return caption != null ? caption : src;
            }
            return caption != null ? caption : src;
        }
    }

    enum MediaType {
        IMAGE,
        VIDEO
    }
}
