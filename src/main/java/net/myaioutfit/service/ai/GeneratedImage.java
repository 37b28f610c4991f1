package net.myaioutfit.service.ai;

import java.time.Duration;

/**
 * A generated image, still hosted by the generation service.
 */
public record GeneratedImage(String imageUrl, Duration elapsed) {
}
