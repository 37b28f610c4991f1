package net.myaioutfit.application.pipeline;

import java.util.UUID;

/**
 * Flow B input: a prompt to render for an existing wardrobe item.
 */
public record GenerateImageCommand(UUID assetId, String ownerId, String prompt) {
}
