package guraa.uicompare.visual;

import lombok.Getter;

import java.awt.image.BufferedImage;

/**
 * An image resampled to the canonical comparison size, with its pixels and luminance
 * extracted once so the metrics can index them directly.
 */
@Getter
public class NormalizedImage {

    public static final int CANONICAL_SIZE = 512;

    private final BufferedImage image;
    private final int width;
    private final int height;
    private final int[] rgb;
    private final int[] luminance;

    private NormalizedImage(BufferedImage image) {
        this.image = image;
        this.width = image.getWidth();
        this.height = image.getHeight();
        this.rgb = ImageUtils.rgbPixels(image);
        this.luminance = ImageUtils.luminance(rgb);
    }

    /**
     * Resample an image to {@link #CANONICAL_SIZE} x {@link #CANONICAL_SIZE}.
     *
     * @param source The decoded image
     * @return The normalized image
     */
    public static NormalizedImage of(BufferedImage source) {
        return new NormalizedImage(ImageUtils.resize(source, CANONICAL_SIZE, CANONICAL_SIZE));
    }

    /**
     * Wrap an image without resampling it.
     *
     * @param image The image
     * @return The wrapped image
     */
    static NormalizedImage wrap(BufferedImage image) {
        return new NormalizedImage(image);
    }

    public int luminanceAt(int x, int y) {
        return luminance[y * width + x];
    }

    public int rgbAt(int x, int y) {
        return rgb[y * width + x];
    }
}
