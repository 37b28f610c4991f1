package net.myaioutfit.service.status;

/**
 * Result of the final "completed" write.
 */
public enum CompletionOutcome {
    COMPLETED,
    /** The item was deleted mid-pipeline; the uploaded object has been removed. */
    ASSET_GONE,
    /** The item store rejected the write; the stale-processing sweeper will close the record. */
    WRITE_FAILED
}
