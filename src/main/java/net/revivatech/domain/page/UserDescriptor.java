package net.revivatech.domain.page;

/**
 * Signed-in visitor as reported by the upstream authentication gateway.
 */
public record UserDescriptor(String id, String role) {
}
