package net.myaioutfit.exception;

import org.springframework.http.HttpStatus;

/**
 * Error codes returned in the {@code error_code} field of failed pipeline responses.
 */
public enum PipelineErrorCode {
    AUTH_FAILED(HttpStatus.UNAUTHORIZED),
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    REPLICATE_ERROR(HttpStatus.BAD_GATEWAY),
    BACKGROUND_REMOVAL_FAILED(HttpStatus.BAD_GATEWAY),
    STORAGE_ERROR(HttpStatus.INTERNAL_SERVER_ERROR),
    METHOD_NOT_ALLOWED(HttpStatus.METHOD_NOT_ALLOWED),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus defaultStatus;

    PipelineErrorCode(HttpStatus defaultStatus) {
        this.defaultStatus = defaultStatus;
    }

    public HttpStatus defaultStatus() {
        return defaultStatus;
    }
}
