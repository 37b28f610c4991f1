package net.myaioutfit.model.image;

import java.util.Locale;
import java.util.Optional;

/**
 * Image formats the pipeline can recognise from their leading bytes.
 */
public enum ImageFormat {
    JPEG("image/jpeg", "jpg"),
    PNG("image/png", "png"),
    WEBP("image/webp", "webp"),
    GIF("image/gif", "gif");

    private final String mimeType;
    private final String extension;

    ImageFormat(String mimeType, String extension) {
        this.mimeType = mimeType;
        this.extension = extension;
    }

    public String mimeType() {
        return mimeType;
    }

    /** File extension used for storage paths, without the dot. */
    public String extension() {
        return extension;
    }

    /**
     * Resolves a declared content type, ignoring case and any {@code ;charset=...} style parameters.
     * {@code image/jpg} is accepted as a JPEG alias.
     */
    public static Optional<ImageFormat> fromMimeType(String contentType) {
        if (contentType == null) {
            return Optional.empty();
        }
        String normalized = contentType.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
        if ("image/jpg".equals(normalized)) {
            return Optional.of(JPEG);
        }
        for (ImageFormat format : values()) {
            if (format.mimeType.equals(normalized)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}
