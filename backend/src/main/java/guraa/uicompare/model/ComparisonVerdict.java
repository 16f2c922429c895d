package guraa.uicompare.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Aggregate verdict combining the visual and structural comparisons of one component.
 * Two verdicts computed from the same inputs are equal regardless of when they were produced.
 */
@Value
@Builder
@Jacksonized
public class ComparisonVerdict {

    public static final double VISUAL_WEIGHT = 0.6;
    public static final double STRUCTURAL_WEIGHT = 0.4;

    boolean overallPassed;

    VisualComparisonResult visualComparison;
    StructuralComparisonResult structuralComparison;

    double visualSimilarity;
    double structuralSimilarity;
    double overallSimilarity;

    @EqualsAndHashCode.Exclude
    long timestamp;

    ComparisonFingerprint fingerprint;

    String error;

    /**
     * Combine the two engine results into a verdict.
     *
     * @param visual The visual comparison result
     * @param structural The structural comparison result
     * @param fingerprint The fingerprint of the inputs, may be null
     * @param timestamp Creation time in epoch milliseconds
     * @return The verdict
     */
    public static ComparisonVerdict of(VisualComparisonResult visual,
                                       StructuralComparisonResult structural,
                                       ComparisonFingerprint fingerprint,
                                       long timestamp) {
        return ComparisonVerdict.builder()
                .overallPassed(visual.isPassed() && structural.isPassed())
                .visualComparison(visual)
                .structuralComparison(structural)
                .visualSimilarity(visual.getSimilarity())
                .structuralSimilarity(structural.getSimilarity())
                .overallSimilarity(overallSimilarity(visual.getSimilarity(), structural.getSimilarity()))
                .fingerprint(fingerprint)
                .timestamp(timestamp)
                .build();
    }

    /**
     * Verdict for a comparison that could not run at all.
     *
     * @param error The failure message
     * @param timestamp Creation time in epoch milliseconds
     * @return A failed verdict with all similarities at zero
     */
    public static ComparisonVerdict failed(String error, long timestamp) {
        return ComparisonVerdict.builder()
                .overallPassed(false)
                .visualComparison(VisualComparisonResult.failed("Visual comparison failed: " + error))
                .structuralComparison(StructuralComparisonResult.failed("Structural comparison failed: " + error))
                .visualSimilarity(0.0)
                .structuralSimilarity(0.0)
                .overallSimilarity(0.0)
                .timestamp(timestamp)
                .error("Comparison failed: " + error)
                .build();
    }

    public static double overallSimilarity(double visualSimilarity, double structuralSimilarity) {
        return VISUAL_WEIGHT * visualSimilarity + STRUCTURAL_WEIGHT * structuralSimilarity;
    }

    @JsonIgnore
    public boolean hasError() {
        return error != null;
    }
}
