package net.myaioutfit.service.ai;

/**
 * Text-to-image generation port.
 */
public interface ImageGenerationClient {

    /**
     * Generates one image for {@code prompt}.
     *
     * @return public URL of the generated image and how long generation took
     * @throws net.myaioutfit.exception.GenerationException when every candidate model fails,
     *         the job fails or is canceled, or the polling deadline passes
     */
    GeneratedImage generate(String prompt);
}
