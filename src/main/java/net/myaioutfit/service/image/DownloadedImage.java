package net.myaioutfit.service.image;

import jakarta.annotation.Nullable;

/**
 * Bytes fetched from a result URL along with the server-declared content type, if any.
 */
public record DownloadedImage(byte[] bytes, @Nullable String contentType) {
}
