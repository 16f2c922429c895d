package guraa.uicompare.service;

import guraa.uicompare.model.ComparisonVerdict;
import guraa.uicompare.model.ReportFormat;
import guraa.uicompare.model.StructuralComparisonResult;
import guraa.uicompare.model.VisualComparisonResult;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ReportGenerationServiceTest {

    private final ReportGenerationService reportService = new ReportGenerationService();

    @Test
    void summaryOfPassingVerdict() {
        ComparisonVerdict verdict = ComparisonVerdict.of(visual(0.75, true), structural(0.875, true), null, 0L);

        assertThat(reportService.generateSummary(verdict))
                .isEqualTo("PASSED | Visual: 75% | Structural: 87% | Overall: "
                        + ReportFormat.percent(verdict.getOverallSimilarity()));
    }

    @Test
    void summaryOfFailingVerdict() {
        ComparisonVerdict verdict = ComparisonVerdict.of(visual(0.5, false), structural(0.875, true), null, 0L);

        assertThat(reportService.generateSummary(verdict)).startsWith("FAILED | Visual: 50%");
    }

    @Test
    void summaryOfErrorIsNotAScore() {
        ComparisonVerdict verdict = ComparisonVerdict.failed("Rendered image bytes are missing", 0L);

        assertThat(reportService.generateSummary(verdict))
                .isEqualTo("ERROR | Error: Comparison failed: Rendered image bytes are missing");
    }

    @Test
    void detailedReportContainsBothEngines() {
        ComparisonVerdict verdict = ComparisonVerdict.of(visual(0.75, true), structural(0.875, true), null, 0L);

        String report = reportService.generateDetailedReport(verdict);

        assertThat(report)
                .startsWith("=== UI Comparison Report ===")
                .contains("Overall Result: PASSED")
                .contains("--- Visual Comparison ---")
                .contains("Perceptual Hash: 100%")
                .contains("--- Structural Comparison ---")
                .contains("Node Types: 80%")
                .doesNotContain("--- Error ---");
    }

    @Test
    void detailedReportOfFailedComparisonHasErrorSection() {
        String report = reportService.generateDetailedReport(ComparisonVerdict.failed("boom", 0L));

        assertThat(report)
                .contains("Overall Result: FAILED")
                .contains("--- Error ---")
                .contains("Error: Comparison failed: boom");
    }

    private static VisualComparisonResult visual(double similarity, boolean passed) {
        return VisualComparisonResult.builder()
                .similarity(similarity)
                .passed(passed)
                .perceptualHashSimilarity(1.0)
                .colorHistogramSimilarity(0.9)
                .edgeSimilarity(0.95)
                .pixelSimilarity(0.99)
                .threshold(0.95)
                .build();
    }

    private static StructuralComparisonResult structural(double similarity, boolean passed) {
        return StructuralComparisonResult.builder()
                .similarity(similarity)
                .passed(passed)
                .treeStructureSimilarity(1.0)
                .nodeTypeSimilarity(0.8)
                .propertySimilarity(1.0)
                .layoutSimilarity(0.9)
                .constraintSimilarity(0.8)
                .threshold(0.9)
                .build();
    }
}
