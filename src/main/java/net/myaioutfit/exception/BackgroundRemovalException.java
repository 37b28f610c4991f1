package net.myaioutfit.exception;

/**
 * Background removal failed: model lookup, prediction, or an unusable result download.
 * RETRYABLE: Yes unless the client is misconfigured (the removal client retries the whole call)
 */
public class BackgroundRemovalException extends ImagePipelineException {
    public BackgroundRemovalException(String message) {
        super(message, PipelineErrorCode.BACKGROUND_REMOVAL_FAILED, null, true, null);
    }

    public BackgroundRemovalException(String message, boolean retryable) {
        super(message, PipelineErrorCode.BACKGROUND_REMOVAL_FAILED, null, retryable, null);
    }

    public BackgroundRemovalException(String message, Throwable cause) {
        super(message, PipelineErrorCode.BACKGROUND_REMOVAL_FAILED, null, true, cause);
    }
}
