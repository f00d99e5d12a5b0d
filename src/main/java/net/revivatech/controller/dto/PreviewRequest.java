package net.revivatech.controller.dto;

import jakarta.annotation.Nullable;
import java.util.Map;

/** Body of a preview creation request: a raw page configuration and optional rendering options. */
public record PreviewRequest(Map<String, Object> config, @Nullable PreviewOptionsPayload options) {
}
