package net.myaioutfit.exception;

/**
 * Bucket or object operation failed, or the object violated the bucket policy.
 * RETRYABLE: Yes for transport errors, No for policy violations and collisions
 */
public class ImageStorageException extends ImagePipelineException {
    public ImageStorageException(String message, boolean retryable) {
        super(message, PipelineErrorCode.STORAGE_ERROR, null, retryable, null);
    }

    public ImageStorageException(String message, boolean retryable, Throwable cause) {
        super(message, PipelineErrorCode.STORAGE_ERROR, null, retryable, cause);
    }
}
