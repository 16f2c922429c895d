package guraa.uicompare.visual;

import guraa.uicompare.model.VisualComparisonResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;

/**
 * Visual comparison of a rendered component image against a reference design image.
 *
 * Both images are normalized to 512x512 and compared with four independent metrics:
 * perceptual hashing for coarse structure, luminance histogram correlation for tonal
 * balance, Sobel edge maps for layout precision and per-pixel color distance for exact
 * matches. The weighted sum of the four is checked against the threshold.
 *
 * This engine never throws; failures are reported through {@link VisualComparisonResult#getError()}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VisualComparisonEngine {

    static final double PERCEPTUAL_HASH_WEIGHT = 0.30;
    static final double COLOR_HISTOGRAM_WEIGHT = 0.25;
    static final double EDGE_WEIGHT = 0.25;
    static final double PIXEL_WEIGHT = 0.20;

    private final ImageDecoder imageDecoder;
    private final PerceptualHashCalculator perceptualHashCalculator;
    private final ColorHistogramCalculator colorHistogramCalculator;
    private final EdgeSimilarityCalculator edgeSimilarityCalculator;
    private final PixelSimilarityCalculator pixelSimilarityCalculator;

    /**
     * Engine wired with the ImageIO decoder and the standard metrics.
     *
     * @return A ready to use engine
     */
    public static VisualComparisonEngine createDefault() {
        return new VisualComparisonEngine(
                new ImageIODecoder(),
                new PerceptualHashCalculator(),
                new ColorHistogramCalculator(),
                new EdgeSimilarityCalculator(),
                new PixelSimilarityCalculator());
    }

    /**
     * Compare two encoded images.
     *
     * @param renderedImageBytes The rendered component image
     * @param referenceImageBytes The reference design image
     * @param threshold Minimum similarity to pass
     * @return The comparison result
     */
    public VisualComparisonResult compare(byte[] renderedImageBytes, byte[] referenceImageBytes, double threshold) {
        BufferedImage rendered;
        BufferedImage reference;
        try {
            rendered = imageDecoder.decode(renderedImageBytes);
            reference = imageDecoder.decode(referenceImageBytes);
        } catch (ImageDecodeException e) {
            log.warn("Failed to load one or both images: {}", e.getMessage());
            return VisualComparisonResult.failed("Failed to load one or both images: " + e.getMessage());
        }

        try {
            return compareNormalized(NormalizedImage.of(rendered), NormalizedImage.of(reference), threshold);
        } catch (RuntimeException e) {
            log.error("Error during visual comparison", e);
            return VisualComparisonResult.failed("Comparison failed: " + e.getMessage());
        }
    }

    /**
     * Compare two images that are already normalized to the same size.
     *
     * @param rendered The rendered image
     * @param reference The reference image
     * @param threshold Minimum similarity to pass
     * @return The comparison result
     */
    VisualComparisonResult compareNormalized(NormalizedImage rendered, NormalizedImage reference, double threshold) {
        double hashSimilarity = perceptualHashCalculator.calculate(rendered, reference);
        double histogramSimilarity = colorHistogramCalculator.calculate(rendered, reference);
        double edgeSimilarity = edgeSimilarityCalculator.calculate(rendered, reference);
        double pixelSimilarity = pixelSimilarityCalculator.calculate(rendered, reference);

        double similarity = ImageUtils.clamp01(
                hashSimilarity * PERCEPTUAL_HASH_WEIGHT
                        + histogramSimilarity * COLOR_HISTOGRAM_WEIGHT
                        + edgeSimilarity * EDGE_WEIGHT
                        + pixelSimilarity * PIXEL_WEIGHT);
        boolean passed = similarity >= threshold;

        log.info("Visual comparison completed: similarity={}, passed={}", similarity, passed);

        return VisualComparisonResult.builder()
                .similarity(similarity)
                .passed(passed)
                .perceptualHashSimilarity(hashSimilarity)
                .colorHistogramSimilarity(histogramSimilarity)
                .edgeSimilarity(edgeSimilarity)
                .pixelSimilarity(pixelSimilarity)
                .threshold(threshold)
                .build();
    }
}
