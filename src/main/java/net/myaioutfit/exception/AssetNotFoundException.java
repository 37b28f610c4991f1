package net.myaioutfit.exception;

/**
 * Wardrobe item absent, or not owned by the caller.
 * RETRYABLE: No
 */
public class AssetNotFoundException extends ImagePipelineException {
    public AssetNotFoundException(String assetId) {
        super("Wardrobe item not found: " + assetId, PipelineErrorCode.NOT_FOUND, assetId, false, null);
    }
}
