package net.revivatech.exception;

public class PreviewNotFoundException extends RuntimeException {

    public PreviewNotFoundException(String previewId) {
        super("Preview not found or expired: " + previewId);
    }
}
