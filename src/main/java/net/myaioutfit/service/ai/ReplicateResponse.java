package net.myaioutfit.service.ai;

import jakarta.annotation.Nullable;
import org.springframework.http.HttpHeaders;
import tools.jackson.databind.JsonNode;

/**
 * Raw Replicate HTTP response; non-2xx statuses are returned rather than thrown so callers can
 * apply their own retry classification.
 */
record ReplicateResponse(int statusCode, HttpHeaders headers, @Nullable JsonNode body) {

    boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    /**
     * Best-effort error text from {@code detail}, {@code error} or {@code title}.
     */
    String errorDetail() {
        if (body == null) {
            return "HTTP " + statusCode;
        }
        for (String field : new String[] {"detail", "error", "title"}) {
            JsonNode node = body.get(field);
            if (node != null && node.isString() && !node.asString().isBlank()) {
                return "HTTP " + statusCode + ": " + node.asString();
            }
        }
        return "HTTP " + statusCode;
    }
}
