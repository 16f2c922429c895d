package guraa.uicompare.visual;

import org.springframework.stereotype.Component;

/**
 * Compares the luminance distributions of two images using the Pearson correlation
 * of their 256-bin histograms, rescaled from [-1, 1] to [0, 1].
 */
@Component
public class ColorHistogramCalculator {

    private static final int BINS = 256;

    public double calculate(NormalizedImage image1, NormalizedImage image2) {
        double correlation = correlation(histogram(image1.getLuminance()), histogram(image2.getLuminance()));
        return ImageUtils.clamp01((correlation + 1.0) / 2.0);
    }

    /**
     * Build a luminance histogram.
     *
     * @param luminance Luminance values in 0..255
     * @return Counts per luminance level
     */
    public static int[] histogram(int[] luminance) {
        int[] histogram = new int[BINS];
        for (int value : luminance) {
            histogram[value]++;
        }
        return histogram;
    }

    /**
     * Pearson correlation coefficient of two histograms. Defined as 0 when either
     * histogram has no variance.
     *
     * @param hist1 First histogram
     * @param hist2 Second histogram
     * @return Correlation in [-1, 1]
     */
    public static double correlation(int[] hist1, int[] hist2) {
        int n = hist1.length;
        double sum1 = 0, sum2 = 0;
        double sum1Sq = 0, sum2Sq = 0;
        double pSum = 0;

        for (int i = 0; i < n; i++) {
            double v1 = hist1[i];
            double v2 = hist2[i];
            sum1 += v1;
            sum2 += v2;
            sum1Sq += v1 * v1;
            sum2Sq += v2 * v2;
            pSum += v1 * v2;
        }

        double num = pSum - (sum1 * sum2 / n);
        double den = Math.sqrt((sum1Sq - sum1 * sum1 / n) * (sum2Sq - sum2 * sum2 / n));

        if (den == 0.0 || Double.isNaN(den)) {
            return 0.0;
        }
        return Math.max(-1.0, Math.min(1.0, num / den));
    }
}
