package guraa.uicompare.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Result of comparing a rendered image against a reference image.
 */
@Value
@Builder
@Jacksonized
public class VisualComparisonResult {

    double similarity;
    boolean passed;

    Double perceptualHashSimilarity;
    Double colorHistogramSimilarity;
    Double edgeSimilarity;
    Double pixelSimilarity;

    Double threshold;

    /**
     * Set when the comparison could not run; similarity is then forced to 0.
     */
    String error;

    /**
     * Create a result for a comparison that could not run.
     *
     * @param error The failure message
     * @return A failed result with zero similarity
     */
    public static VisualComparisonResult failed(String error) {
        return VisualComparisonResult.builder()
                .similarity(0.0)
                .passed(false)
                .error(error)
                .build();
    }

    public boolean hasError() {
        return error != null;
    }

    @JsonIgnore
    public String getDetailedReport() {
        StringBuilder sb = new StringBuilder();
        sb.append("Visual Comparison Report:\n");
        sb.append("Overall Similarity: ").append(ReportFormat.percent(similarity)).append("\n");
        sb.append("Passed: ").append(passed).append("\n");
        if (threshold != null) sb.append("Threshold: ").append(ReportFormat.percent(threshold)).append("\n");
        if (perceptualHashSimilarity != null) {
            sb.append("Perceptual Hash: ").append(ReportFormat.percent(perceptualHashSimilarity)).append("\n");
        }
        if (colorHistogramSimilarity != null) {
            sb.append("Color Histogram: ").append(ReportFormat.percent(colorHistogramSimilarity)).append("\n");
        }
        if (edgeSimilarity != null) {
            sb.append("Edge Detection: ").append(ReportFormat.percent(edgeSimilarity)).append("\n");
        }
        if (pixelSimilarity != null) {
            sb.append("Pixel-level: ").append(ReportFormat.percent(pixelSimilarity)).append("\n");
        }
        if (error != null) {
            sb.append("Error: ").append(error).append("\n");
        }
        return sb.toString();
    }
}
