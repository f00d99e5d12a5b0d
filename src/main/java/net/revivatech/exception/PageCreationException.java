package net.revivatech.exception;

/**
 * Page creation failed for a reason other than an invalid configuration,
 * such as a content system failure surfacing from a section.
 */
public class PageCreationException extends RuntimeException {

    public PageCreationException(String pageTitle, Throwable cause) {
        super("Failed to create page \"" + pageTitle + "\": " + cause.getMessage(), cause);
    }
}
