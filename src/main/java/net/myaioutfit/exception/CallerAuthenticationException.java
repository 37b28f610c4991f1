package net.myaioutfit.exception;

import org.springframework.http.HttpStatus;

/**
 * Missing or unresolvable caller identity (401), or a caller acting for another owner (403).
 * RETRYABLE: No
 */
public class CallerAuthenticationException extends ImagePipelineException {

    private CallerAuthenticationException(String message, HttpStatus status, Throwable cause) {
        super(message, PipelineErrorCode.AUTH_FAILED, status, null, false, cause);
    }

    public static CallerAuthenticationException unauthenticated(String message) {
        return new CallerAuthenticationException(message, HttpStatus.UNAUTHORIZED, null);
    }

    public static CallerAuthenticationException unauthenticated(String message, Throwable cause) {
        return new CallerAuthenticationException(message, HttpStatus.UNAUTHORIZED, cause);
    }

    public static CallerAuthenticationException ownerMismatch() {
        return new CallerAuthenticationException("User ID mismatch", HttpStatus.FORBIDDEN, null);
    }
}
