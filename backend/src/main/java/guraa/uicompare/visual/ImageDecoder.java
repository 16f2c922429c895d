package guraa.uicompare.visual;

import java.awt.image.BufferedImage;

/**
 * Turns encoded image bytes into a pixel-addressable image.
 */
public interface ImageDecoder {

    /**
     * Decode an image.
     *
     * @param imageBytes The encoded image
     * @return The decoded image, never null and never zero-area
     * @throws ImageDecodeException If the bytes are missing, unreadable or describe an empty image
     */
    BufferedImage decode(byte[] imageBytes) throws ImageDecodeException;
}
