package net.myaioutfit.application.pipeline;

import java.util.UUID;

/**
 * Flow A input: bytes uploaded by the owner for an existing wardrobe item.
 */
public record DirectUploadCommand(UUID assetId,
                                  String ownerId,
                                  byte[] imageBytes,
                                  String declaredMimeType,
                                  boolean removeBackground) {
}
