package net.myaioutfit.exception;

import jakarta.annotation.Nullable;
import org.springframework.http.HttpStatus;

/**
 * Base exception for classified wardrobe image pipeline failures.
 * Subclasses mark the stage that failed; the error code drives the HTTP mapping.
 */
public abstract class ImagePipelineException extends RuntimeException {
    private final PipelineErrorCode errorCode;
    private final HttpStatus httpStatus;
    @Nullable
    private final String assetId;
    private final boolean retryable;

    protected ImagePipelineException(String message, PipelineErrorCode errorCode, @Nullable String assetId,
                                     boolean retryable, @Nullable Throwable cause) {
        this(message, errorCode, errorCode.defaultStatus(), assetId, retryable, cause);
    }

    protected ImagePipelineException(String message, PipelineErrorCode errorCode, HttpStatus httpStatus,
                                     @Nullable String assetId, boolean retryable, @Nullable Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.httpStatus = httpStatus;
        this.assetId = assetId;
        this.retryable = retryable;
    }

    public PipelineErrorCode getErrorCode() {
        return errorCode;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    @Nullable
    public String getAssetId() {
        return assetId;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
