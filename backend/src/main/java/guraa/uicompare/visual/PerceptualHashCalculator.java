package guraa.uicompare.visual;

import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;

/**
 * Average-hash based perceptual similarity.
 * The image is reduced to 8x8 grayscale and each cell becomes one bit of a 64-bit signature,
 * set when the cell is brighter than the image's mean luminance.
 */
@Component
public class PerceptualHashCalculator {

    private static final int HASH_SIZE = 8;
    private static final int HASH_BITS = HASH_SIZE * HASH_SIZE;

    /**
     * Compare the perceptual hashes of two images.
     *
     * @param image1 The first normalized image
     * @param image2 The second normalized image
     * @return 1 - hamming / 64
     */
    public double calculate(NormalizedImage image1, NormalizedImage image2) {
        long hash1 = hash(image1.getImage());
        long hash2 = hash(image2.getImage());
        return 1.0 - (double) hammingDistance(hash1, hash2) / HASH_BITS;
    }

    /**
     * Compute the 64-bit average hash of an image. Bit {@code y * 8 + x} is set
     * when cell (x, y) exceeds the mean.
     *
     * @param image The image
     * @return The signature
     */
    public long hash(BufferedImage image) {
        BufferedImage reduced = ImageUtils.resize(image, HASH_SIZE, HASH_SIZE);
        int[] luma = ImageUtils.luminance(ImageUtils.rgbPixels(reduced));

        long sum = 0;
        for (int value : luma) {
            sum += value;
        }
        double mean = (double) sum / HASH_BITS;

        long hash = 0L;
        for (int y = 0; y < HASH_SIZE; y++) {
            for (int x = 0; x < HASH_SIZE; x++) {
                if (luma[y * HASH_SIZE + x] > mean) {
                    hash |= 1L << (y * HASH_SIZE + x);
                }
            }
        }
        return hash;
    }

    public static int hammingDistance(long hash1, long hash2) {
        return Long.bitCount(hash1 ^ hash2);
    }
}
