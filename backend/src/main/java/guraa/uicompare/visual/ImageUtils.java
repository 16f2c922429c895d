package guraa.uicompare.visual;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 * Resampling and pixel conversion helpers shared by the visual metrics.
 */
public final class ImageUtils {

    private ImageUtils() {
    }

    /**
     * Resize an image to the specified dimensions using bilinear interpolation.
     *
     * @param img The image to resize
     * @param width The target width
     * @param height The target height
     * @return The resized RGB image
     */
    public static BufferedImage resize(BufferedImage img, int width, int height) {
        BufferedImage resized = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = resized.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.drawImage(img, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return resized;
    }

    /**
     * Read all pixels of an image as packed RGB values, row by row.
     *
     * @param img The image
     * @return width * height packed pixels
     */
    public static int[] rgbPixels(BufferedImage img) {
        int width = img.getWidth();
        int height = img.getHeight();
        return img.getRGB(0, 0, width, height, null, 0, width);
    }

    /**
     * Luminance of a packed RGB pixel, 0.299R + 0.587G + 0.114B rounded to the nearest integer.
     *
     * @param rgb The packed pixel
     * @return Luminance in 0..255
     */
    public static int luminance(int rgb) {
        int r = (rgb >> 16) & 0xFF;
        int g = (rgb >> 8) & 0xFF;
        int b = rgb & 0xFF;
        int value = (int) Math.round(r * 0.299 + g * 0.587 + b * 0.114);
        return Math.min(255, Math.max(0, value));
    }

    /**
     * Convert packed RGB pixels to luminance values.
     *
     * @param rgbPixels Packed RGB pixels
     * @return One luminance value per pixel
     */
    public static int[] luminance(int[] rgbPixels) {
        int[] result = new int[rgbPixels.length];
        for (int i = 0; i < rgbPixels.length; i++) {
            result[i] = luminance(rgbPixels[i]);
        }
        return result;
    }

    /**
     * Euclidean distance between two packed RGB pixels.
     */
    public static double colorDistance(int rgb1, int rgb2) {
        int dr = ((rgb1 >> 16) & 0xFF) - ((rgb2 >> 16) & 0xFF);
        int dg = ((rgb1 >> 8) & 0xFF) - ((rgb2 >> 8) & 0xFF);
        int db = (rgb1 & 0xFF) - (rgb2 & 0xFF);
        return Math.sqrt(dr * dr + dg * dg + db * db);
    }

    /**
     * Clamp a score into [0, 1].
     */
    public static double clamp01(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
