package net.myaioutfit.service.ai;

import jakarta.annotation.Nullable;
import java.util.Locale;
import tools.jackson.databind.JsonNode;

/**
 * The fields of a Replicate prediction the pipeline reads.
 *
 * @param id prediction id
 * @param status lower-cased status ({@code starting}, {@code processing}, {@code succeeded}, ...)
 * @param outputUrl first output URL, when the output is a string or an array of strings
 * @param error service-provided error message
 * @param pollUrl {@code urls.get}
 */
record ReplicatePrediction(String id,
                           String status,
                           @Nullable String outputUrl,
                           @Nullable String error,
                           @Nullable String pollUrl) {

    static final String SUCCEEDED = "succeeded";
    static final String FAILED = "failed";
    static final String CANCELED = "canceled";

    boolean isTerminal() {
        return SUCCEEDED.equals(status) || FAILED.equals(status) || CANCELED.equals(status);
    }

    static ReplicatePrediction fromJson(@Nullable JsonNode node) {
        if (node == null || !node.isObject()) {
            return new ReplicatePrediction("unknown", "unknown", null, null, null);
        }
        String status = text(node.get("status"));
        return new ReplicatePrediction(
            textOr(node.get("id"), "unknown"),
            status == null ? "unknown" : status.toLowerCase(Locale.ROOT),
            firstOutput(node.get("output")),
            text(node.get("error")),
            node.has("urls") ? text(node.get("urls").get("get")) : null
        );
    }

    private static String firstOutput(@Nullable JsonNode output) {
        if (output == null || output.isNull()) {
            return null;
        }
        if (output.isArray()) {
            return output.isEmpty() ? null : text(output.get(0));
        }
        return text(output);
    }

    private static String textOr(@Nullable JsonNode node, String fallback) {
        String value = text(node);
        return value == null ? fallback : value;
    }

    @Nullable
    private static String text(@Nullable JsonNode node) {
        if (node == null || !node.isString()) {
            return null;
        }
        String value = node.asString();
        return value.isBlank() ? null : value;
    }
}
