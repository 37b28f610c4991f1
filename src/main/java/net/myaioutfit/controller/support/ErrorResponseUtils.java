package net.myaioutfit.controller.support;

import java.util.LinkedHashMap;
import java.util.Map;
import net.myaioutfit.exception.PipelineErrorCode;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Small helper for producing the {@code {success:false, error, error_code}} payload across controllers.
 */
public final class ErrorResponseUtils {

    private ErrorResponseUtils() {
        // Utility class
    }

    public static Map<String, Object> errorBody(String message, PipelineErrorCode errorCode) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", message == null || message.isBlank() ? errorCode.name() : message);
        body.put("error_code", errorCode.name());
        return body;
    }

    public static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message, PipelineErrorCode errorCode) {
        return ResponseEntity.status(status).body(errorBody(message, errorCode));
    }

    public static ResponseEntity<Map<String, Object>> error(String message, PipelineErrorCode errorCode) {
        return error(errorCode.defaultStatus(), message, errorCode);
    }
}
