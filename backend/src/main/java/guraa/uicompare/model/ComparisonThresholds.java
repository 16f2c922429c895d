package guraa.uicompare.model;

import lombok.Value;

/**
 * Pass/fail cutoffs for the two comparison dimensions. Values are used as given.
 */
@Value
public class ComparisonThresholds {

    public static final double DEFAULT_VISUAL_THRESHOLD = 0.95;
    public static final double DEFAULT_STRUCTURAL_THRESHOLD = 0.90;

    double visualThreshold;
    double structuralThreshold;

    public static ComparisonThresholds defaults() {
        return new ComparisonThresholds(DEFAULT_VISUAL_THRESHOLD, DEFAULT_STRUCTURAL_THRESHOLD);
    }
}
