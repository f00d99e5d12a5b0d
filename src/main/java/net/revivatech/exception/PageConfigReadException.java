package net.revivatech.exception;

/**
 * A page configuration document exists but could not be read or parsed.
 */
public class PageConfigReadException extends RuntimeException {

    public PageConfigReadException(String configPath, Throwable cause) {
        super("Failed to read page configuration " + configPath, cause);
    }
}
