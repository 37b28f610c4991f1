package net.myaioutfit.support.s3;

import java.util.UUID;
import net.myaioutfit.model.image.ImageFormat;
import net.myaioutfit.model.image.StoragePurpose;

/**
 * Deterministic object keys for wardrobe assets.
 *
 * <ul>
 *   <li>{@code original/{owner}/{asset}-{epochMillis}.{ext}}</li>
 *   <li>{@code processed/{owner}/{asset}.{ext}}</li>
 * </ul>
 */
public final class StorageObjectPaths {

    private StorageObjectPaths() {
    }

    public static String original(String ownerId, UUID assetId, long epochMillis, ImageFormat format) {
        return StoragePurpose.ORIGINAL.prefix() + "/" + ownerSegment(ownerId) + "/"
            + assetId + "-" + epochMillis + "." + format.extension();
    }

    public static String processed(String ownerId, UUID assetId, ImageFormat format) {
        return StoragePurpose.PROCESSED.prefix() + "/" + ownerSegment(ownerId) + "/"
            + assetId + "." + format.extension();
    }

    public static String forPurpose(StoragePurpose purpose, String ownerId, UUID assetId,
                                    long epochMillis, ImageFormat format) {
        return purpose == StoragePurpose.ORIGINAL
            ? original(ownerId, assetId, epochMillis, format)
            : processed(ownerId, assetId, format);
    }

    // Owner ids come from the identity service; anything path-like must not escape the owner prefix
    private static String ownerSegment(String ownerId) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("ownerId is required for storage paths");
        }
        return ownerId.trim().replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
