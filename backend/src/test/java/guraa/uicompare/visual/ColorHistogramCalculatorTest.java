package guraa.uicompare.visual;

import guraa.uicompare.TestImages;
import org.junit.jupiter.api.Test;

import java.awt.Color;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ColorHistogramCalculatorTest {

    private final ColorHistogramCalculator calculator = new ColorHistogramCalculator();

    @Test
    void histogramCountsRoundedLuminance() {
        // 0.299 * 255 = 76.245
        int[] luma = ImageUtils.luminance(new int[]{0xFF0000, 0xFF0000, 0x000000, 0xFFFFFF});

        int[] histogram = ColorHistogramCalculator.histogram(luma);

        assertThat(histogram[76]).isEqualTo(2);
        assertThat(histogram[0]).isEqualTo(1);
        assertThat(histogram[255]).isEqualTo(1);
    }

    @Test
    void identicalImagesCorrelatePerfectly() {
        NormalizedImage image = NormalizedImage.of(TestImages.card(300, 200, Color.ORANGE));

        assertThat(calculator.calculate(image, image)).isCloseTo(1.0, within(1e-12));
    }

    @Test
    void disjointSingleBinHistogramsAreSlightlyNegativelyCorrelated() {
        NormalizedImage black = NormalizedImage.wrap(TestImages.solid(16, 16, Color.BLACK));
        NormalizedImage white = NormalizedImage.wrap(TestImages.solid(16, 16, Color.WHITE));

        double expected = (1.0 - 1.0 / 255) / 2.0;
        assertThat(calculator.calculate(black, white)).isCloseTo(expected, within(1e-12));
    }

    @Test
    void zeroVarianceMeansZeroCorrelation() {
        assertThat(ColorHistogramCalculator.correlation(new int[256], new int[256])).isEqualTo(0.0);
    }

    @Test
    void correlationIsSymmetric() {
        NormalizedImage a = NormalizedImage.of(TestImages.card(120, 80, Color.GREEN));
        NormalizedImage b = NormalizedImage.of(TestImages.split(90, 90, Color.GRAY, Color.PINK));

        assertThat(calculator.calculate(a, b)).isEqualTo(calculator.calculate(b, a));
    }
}
