package net.revivatech.controller.support;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.revivatech.domain.validation.ValidationIssue;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * JSON error bodies for the page and preview APIs: {@code {"error": ..., "details": [...]}}.
 */
public final class ErrorResponseUtils {

    private ErrorResponseUtils() {
    }

    /**
     * 400 carrying the structural problems that stopped a configuration from parsing.
     */
    public static ResponseEntity<Map<String, Object>> invalidConfiguration(List<ValidationIssue> errors) {
        return error(HttpStatus.BAD_REQUEST, "Invalid configuration", errors);
    }

    public static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message, List<?> details) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        body.put("status", status.value());
        if (details != null && !details.isEmpty()) {
            body.put("details", details);
        }
        return ResponseEntity.status(status).body(body);
    }
}
