package guraa.uicompare.service;

import guraa.uicompare.model.ComparisonVerdict;
import guraa.uicompare.model.ReportFormat;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Renders comparison verdicts as human readable text.
 * A verdict whose comparison could not run is reported as an error, not as a low score.
 */
@Service
public class ReportGenerationService {

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneId.systemDefault());

    /**
     * One line summary of a verdict.
     *
     * @param verdict The verdict
     * @return The summary
     */
    public String generateSummary(ComparisonVerdict verdict) {
        if (verdict.hasError()) {
            return "ERROR | Error: " + verdict.getError();
        }
        return (verdict.isOverallPassed() ? "PASSED" : "FAILED") + " | "
                + "Visual: " + ReportFormat.percent(verdict.getVisualSimilarity()) + " | "
                + "Structural: " + ReportFormat.percent(verdict.getStructuralSimilarity()) + " | "
                + "Overall: " + ReportFormat.percent(verdict.getOverallSimilarity());
    }

    /**
     * Multi-section report with the per-metric breakdown of both engines.
     *
     * @param verdict The verdict
     * @return The report
     */
    public String generateDetailedReport(ComparisonVerdict verdict) {
        StringBuilder sb = new StringBuilder();
        sb.append("=== UI Comparison Report ===\n");
        sb.append("Timestamp: ").append(TIMESTAMP_FORMAT.format(Instant.ofEpochMilli(verdict.getTimestamp()))).append("\n");
        sb.append("Overall Result: ").append(verdict.isOverallPassed() ? "PASSED" : "FAILED").append("\n");
        sb.append("Overall Similarity: ").append(ReportFormat.percent(verdict.getOverallSimilarity())).append("\n");
        sb.append("\n");

        sb.append("--- Visual Comparison ---\n");
        sb.append(verdict.getVisualComparison().getDetailedReport()).append("\n");

        sb.append("--- Structural Comparison ---\n");
        sb.append(verdict.getStructuralComparison().getDetailedReport()).append("\n");

        if (verdict.hasError()) {
            sb.append("--- Error ---\n");
            sb.append("Error: ").append(verdict.getError()).append("\n");
        }
        return sb.toString();
    }
}
