package net.myaioutfit.service.image;

import net.myaioutfit.model.image.ImageFormat;

/**
 * Output of {@link ImageResizeService}. {@code resized} is false when the input already fit
 * and {@code bytes} is the untouched input.
 */
public record ResizedImage(byte[] bytes, ImageFormat format, int width, int height, boolean resized) {
}
