package net.myaioutfit.service.image;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import javax.imageio.ImageIO;
import net.myaioutfit.model.image.ImageFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Downscales wardrobe images to fit a square bounding box.
 *
 * Features:
 * - Never upscales; images that already fit are returned byte-for-byte
 * - Preserves aspect ratio with scale = min(max/width, max/height)
 * - Re-encodes as PNG so transparency from background removal survives
 */
@Service
public class ImageResizeService {

    private static final Logger logger = LoggerFactory.getLogger(ImageResizeService.class);

    /**
     * Resizes {@code imageBytes} so both dimensions are at most {@code maxDimension}.
     *
     * @param imageBytes encoded image
     * @param format format of the input, reported back when no resize happens
     * @param maxDimension bounding box edge in pixels
     * @return resized image, or the input unchanged when it already fits
     * @throws IOException when the bytes cannot be decoded or re-encoded; callers fall back to the input
     */
    public ResizedImage resize(byte[] imageBytes, ImageFormat format, int maxDimension) throws IOException {
        if (maxDimension < 1) {
            throw new IllegalArgumentException("maxDimension must be positive but was " + maxDimension);
        }
        BufferedImage source;
        try (ByteArrayInputStream input = new ByteArrayInputStream(imageBytes)) {
            source = ImageIO.read(input);
        }
        if (source == null) {
            throw new IOException("No ImageIO reader could decode " + format.mimeType() + " input");
        }

        int width = source.getWidth();
        int height = source.getHeight();
        if (width <= maxDimension && height <= maxDimension) {
            return new ResizedImage(imageBytes, format, width, height, false);
        }

        double scale = Math.min((double) maxDimension / width, (double) maxDimension / height);
        int targetWidth = Math.max(1, (int) Math.round(width * scale));
        int targetHeight = Math.max(1, (int) Math.round(height * scale));

        BufferedImage output = new BufferedImage(targetWidth, targetHeight, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g2d = output.createGraphics();
        try {
            g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g2d.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g2d.drawImage(source, 0, 0, targetWidth, targetHeight, null);
        } finally {
            g2d.dispose();
        }

        ByteArrayOutputStream encoded = new ByteArrayOutputStream();
        if (!ImageIO.write(output, "png", encoded)) {
            throw new IOException("No PNG writer available");
        }
        logger.debug("Resized image from {}x{} to {}x{} ({} -> {} bytes)",
            width, height, targetWidth, targetHeight, imageBytes.length, encoded.size());
        return new ResizedImage(encoded.toByteArray(), ImageFormat.PNG, targetWidth, targetHeight, true);
    }
}
