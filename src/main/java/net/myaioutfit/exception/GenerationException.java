package net.myaioutfit.exception;

/**
 * Text-to-image generation failed on every candidate model, timed out, or returned no output.
 * RETRYABLE: Yes for rate limits and timeouts, No for terminal job failures
 */
public class GenerationException extends ImagePipelineException {
    public GenerationException(String message, boolean retryable) {
        super(message, PipelineErrorCode.REPLICATE_ERROR, null, retryable, null);
    }

    public GenerationException(String message, boolean retryable, Throwable cause) {
        super(message, PipelineErrorCode.REPLICATE_ERROR, null, retryable, cause);
    }
}
