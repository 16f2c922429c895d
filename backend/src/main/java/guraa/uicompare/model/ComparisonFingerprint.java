package guraa.uicompare.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Cache key derived from the content of the compared inputs and the thresholds they were judged against.
 */
@Value
public class ComparisonFingerprint {

    String renderedImageHash;
    String referenceImageHash;
    String referenceStructureHash;

    double visualThreshold;
    double structuralThreshold;

    @JsonCreator
    public ComparisonFingerprint(@JsonProperty("renderedImageHash") String renderedImageHash,
                                 @JsonProperty("referenceImageHash") String referenceImageHash,
                                 @JsonProperty("referenceStructureHash") String referenceStructureHash,
                                 @JsonProperty("visualThreshold") double visualThreshold,
                                 @JsonProperty("structuralThreshold") double structuralThreshold) {
        this.renderedImageHash = renderedImageHash;
        this.referenceImageHash = referenceImageHash;
        this.referenceStructureHash = referenceStructureHash;
        this.visualThreshold = visualThreshold;
        this.structuralThreshold = structuralThreshold;
    }

    @Override
    public String toString() {
        return renderedImageHash + "_" + referenceImageHash + "_" + referenceStructureHash
                + "@" + visualThreshold + "/" + structuralThreshold;
    }
}
