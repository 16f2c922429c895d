package guraa.uicompare.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Result of comparing a rendered layout tree against a reference node tree.
 */
@Value
@Builder
@Jacksonized
public class StructuralComparisonResult {

    double similarity;
    boolean passed;

    Double treeStructureSimilarity;
    Double nodeTypeSimilarity;
    Double propertySimilarity;
    Double layoutSimilarity;
    Double constraintSimilarity;

    Double threshold;

    String error;

    public static StructuralComparisonResult failed(String error) {
        return StructuralComparisonResult.builder()
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
        sb.append("Structural Comparison Report:\n");
        sb.append("Overall Similarity: ").append(ReportFormat.percent(similarity)).append("\n");
        sb.append("Passed: ").append(passed).append("\n");
        if (threshold != null) sb.append("Threshold: ").append(ReportFormat.percent(threshold)).append("\n");
        if (treeStructureSimilarity != null) {
            sb.append("Tree Structure: ").append(ReportFormat.percent(treeStructureSimilarity)).append("\n");
        }
        if (nodeTypeSimilarity != null) {
            sb.append("Node Types: ").append(ReportFormat.percent(nodeTypeSimilarity)).append("\n");
        }
        if (propertySimilarity != null) {
            sb.append("Properties: ").append(ReportFormat.percent(propertySimilarity)).append("\n");
        }
        if (layoutSimilarity != null) {
            sb.append("Layout: ").append(ReportFormat.percent(layoutSimilarity)).append("\n");
        }
        if (constraintSimilarity != null) {
            sb.append("Constraints: ").append(ReportFormat.percent(constraintSimilarity)).append("\n");
        }
        if (error != null) {
            sb.append("Error: ").append(error).append("\n");
        }
        return sb.toString();
    }
}
