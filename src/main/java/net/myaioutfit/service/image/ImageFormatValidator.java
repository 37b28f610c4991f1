package net.myaioutfit.service.image;

import java.util.Optional;
import net.myaioutfit.model.image.ImageFormat;
import org.springframework.stereotype.Component;

/**
 * Byte-level sniffing of image data against a declared content type.
 *
 * <p>Every method answers with a value; a mismatch is an expected outcome and never throws.</p>
 */
@Component
public class ImageFormatValidator {

    private static final byte[] JPEG_MAGIC = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF};
    private static final byte[] PNG_MAGIC = {(byte) 0x89, 0x50, 0x4E, 0x47};
    private static final byte[] RIFF_MAGIC = {'R', 'I', 'F', 'F'};
    private static final byte[] WEBP_MAGIC = {'W', 'E', 'B', 'P'};
    private static final byte[] GIF_MAGIC = {'G', 'I', 'F', '8'};

    private static final int PNG_COLOR_TYPE_OFFSET = 25;
    private static final int PNG_COLOR_TYPE_GRAYSCALE_ALPHA = 4;
    private static final int PNG_COLOR_TYPE_RGBA = 6;

    /**
     * Whether the bytes carry the signature of the declared MIME type.
     * Unsupported declared types never match.
     */
    public boolean matches(byte[] bytes, String declaredMimeType) {
        return ImageFormat.fromMimeType(declaredMimeType)
            .map(format -> hasSignature(bytes, format))
            .orElse(false);
    }

    /**
     * Detects the format from the leading bytes alone.
     */
    public Optional<ImageFormat> detect(byte[] bytes) {
        for (ImageFormat format : ImageFormat.values()) {
            if (hasSignature(bytes, format)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }

    /**
     * True only for a PNG whose IHDR colour type is grayscale+alpha (4) or RGBA (6).
     */
    public boolean hasAlphaChannel(byte[] bytes) {
        if (bytes == null || bytes.length <= PNG_COLOR_TYPE_OFFSET || !startsWith(bytes, 0, PNG_MAGIC)) {
            return false;
        }
        int colorType = bytes[PNG_COLOR_TYPE_OFFSET] & 0xFF;
        return colorType == PNG_COLOR_TYPE_GRAYSCALE_ALPHA || colorType == PNG_COLOR_TYPE_RGBA;
    }

    private boolean hasSignature(byte[] bytes, ImageFormat format) {
        if (bytes == null) {
            return false;
        }
        return switch (format) {
            case JPEG -> startsWith(bytes, 0, JPEG_MAGIC);
            case PNG -> startsWith(bytes, 0, PNG_MAGIC);
            case WEBP -> startsWith(bytes, 0, RIFF_MAGIC) && startsWith(bytes, 8, WEBP_MAGIC);
            case GIF -> startsWith(bytes, 0, GIF_MAGIC);
        };
    }

    private static boolean startsWith(byte[] bytes, int offset, byte[] signature) {
        if (bytes.length < offset + signature.length) {
            return false;
        }
        for (int i = 0; i < signature.length; i++) {
            if (bytes[offset + i] != signature[i]) {
                return false;
            }
        }
        return true;
    }
}
