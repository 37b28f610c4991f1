package net.myaioutfit.exception;

/**
 * Input rejected before any external call (size, type, magic bytes, missing field).
 * RETRYABLE: No
 */
public class ImageValidationException extends ImagePipelineException {
    public ImageValidationException(String message) {
        super(message, PipelineErrorCode.VALIDATION_ERROR, null, false, null);
    }

    public ImageValidationException(String assetId, String message) {
        super(message, PipelineErrorCode.VALIDATION_ERROR, assetId, false, null);
    }
}
