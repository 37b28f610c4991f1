package net.myaioutfit.service.ai;

/**
 * Background removal port.
 */
public interface BackgroundRemovalClient {

    /**
     * Removes the background from the image at {@code imageUrl}.
     *
     * @param imageUrl publicly reachable source image
     * @return URL of the background-free result
     * @throws net.myaioutfit.exception.BackgroundRemovalException after the bounded retries are exhausted
     */
    String removeBackground(String imageUrl);
}
