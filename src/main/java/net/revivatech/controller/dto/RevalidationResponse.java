package net.revivatech.controller.dto;

/** Result of an on-demand revalidation. */
public record RevalidationResponse(String path, boolean revalidated) {
}
