package guraa.uicompare.visual;

import guraa.uicompare.TestImages;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.awt.image.BufferedImage;

import static org.assertj.core.api.Assertions.assertThat;

class PerceptualHashCalculatorTest {

    private final PerceptualHashCalculator calculator = new PerceptualHashCalculator();

    @Test
    void solidImageHasNoBitsSet() {
        assertThat(calculator.hash(TestImages.solid(64, 64, Color.RED))).isZero();
    }

    @Test
    void brightHalfSetsHalfTheBits() {
        long hash = calculator.hash(TestImages.split(64, 64, Color.BLACK, Color.WHITE));

        assertThat(Long.bitCount(hash)).isEqualTo(32);
        assertThat(hash & 1L).isZero();
        assertThat(hash & (1L << 7)).isNotZero();
        assertThat(hash & (1L << 63)).isNotZero();
    }

    @Test
    void identicalImagesScoreExactlyOne() {
        BufferedImage card = TestImages.card(200, 120, Color.BLUE);

        double similarity = calculator.calculate(NormalizedImage.of(card), NormalizedImage.of(card));

        assertThat(similarity).isEqualTo(1.0);
    }

    @Test
    void invertedPatternScoresZero() {
        NormalizedImage blackWhite = NormalizedImage.of(TestImages.split(64, 64, Color.BLACK, Color.WHITE));
        NormalizedImage whiteBlack = NormalizedImage.of(TestImages.split(64, 64, Color.WHITE, Color.BLACK));

        assertThat(calculator.calculate(blackWhite, whiteBlack)).isEqualTo(0.0);
    }

    @Test
    void hammingDistanceCountsDifferingBits() {
        assertThat(PerceptualHashCalculator.hammingDistance(0L, 0L)).isZero();
        assertThat(PerceptualHashCalculator.hammingDistance(0b1011L, 0b0001L)).isEqualTo(2);
        assertThat(PerceptualHashCalculator.hammingDistance(0L, -1L)).isEqualTo(64);
    }
}
