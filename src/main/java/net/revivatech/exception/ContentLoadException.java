package net.revivatech.exception;

/**
 * Every configured content source failed for a key. A plain miss is not an error
 * and never raises this exception.
 */
public class ContentLoadException extends RuntimeException {

    private final String contentKey;
    private final String locale;

    public ContentLoadException(String contentKey, String locale, Throwable cause) {
        super("All content sources failed for key " + contentKey + " (locale " + locale + ")", cause);
        this.contentKey = contentKey;
        this.locale = locale;
    }

    public String getContentKey() {
        return contentKey;
    }

    public String getLocale() {
        return locale;
    }
}
