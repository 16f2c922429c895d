package guraa.uicompare.visual;

/**
 * Thrown when an image buffer cannot be interpreted as a usable raster.
 */
public class ImageDecodeException extends Exception {

    public ImageDecodeException(String message) {
        super(message);
    }

    public ImageDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
