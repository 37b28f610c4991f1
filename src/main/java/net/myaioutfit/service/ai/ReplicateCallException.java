package net.myaioutfit.service.ai;

/**
 * Transport-level Replicate failure (connection refused, timeout, unparseable body).
 * Clients translate it into their stage-specific pipeline exception.
 */
class ReplicateCallException extends RuntimeException {
    ReplicateCallException(String message, Throwable cause) {
        super(message, cause);
    }
}
