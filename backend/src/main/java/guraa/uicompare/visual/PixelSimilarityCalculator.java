package guraa.uicompare.visual;

import org.springframework.stereotype.Component;

/**
 * Fraction of pixel positions whose colors are within a Euclidean RGB distance of 30.
 */
@Component
public class PixelSimilarityCalculator {

    static final double MATCH_DISTANCE = 30.0;

    public double calculate(NormalizedImage image1, NormalizedImage image2) {
        int[] rgb1 = image1.getRgb();
        int[] rgb2 = image2.getRgb();
        int total = Math.min(rgb1.length, rgb2.length);
        if (total == 0) {
            return 0.0;
        }

        int matches = 0;
        for (int i = 0; i < total; i++) {
            if (ImageUtils.colorDistance(rgb1[i], rgb2[i]) < MATCH_DISTANCE) {
                matches++;
            }
        }
        return (double) matches / total;
    }
}
