package guraa.uicompare.controller;

import guraa.uicompare.config.AppProperties;
import guraa.uicompare.model.CacheStatistics;
import guraa.uicompare.model.ComparisonThresholds;
import guraa.uicompare.model.ComparisonVerdict;
import guraa.uicompare.service.ComparisonService;
import guraa.uicompare.service.ReportGenerationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Controller for comparing rendered components with reference designs.
 */
@Slf4j
@RestController
@RequestMapping("/api/comparisons")
@RequiredArgsConstructor
public class ComparisonController {

    private final ComparisonService comparisonService;
    private final ReportGenerationService reportGenerationService;
    private final AppProperties appProperties;

    /**
     * Compare a rendered component with a reference design.
     *
     * @param request The comparison request
     * @return The verdict
     */
    @PostMapping
    public ResponseEntity<ComparisonVerdict> compare(@RequestBody CompareRequest request) {
        log.info("Received comparison request (forceRefresh={})", request.isForceRefresh());
        return ResponseEntity.ok(runComparison(request));
    }

    /**
     * Compare and render the verdict as text as well.
     *
     * @param request The comparison request
     * @return Summary, detailed report and verdict
     */
    @PostMapping("/report")
    public ResponseEntity<Map<String, Object>> compareWithReport(@RequestBody CompareRequest request) {
        ComparisonVerdict verdict = runComparison(request);

        Map<String, Object> response = new HashMap<>();
        response.put("summary", reportGenerationService.generateSummary(verdict));
        response.put("report", reportGenerationService.generateDetailedReport(verdict));
        response.put("verdict", verdict);
        return ResponseEntity.ok(response);
    }

    @GetMapping("/history")
    public ResponseEntity<List<ComparisonVerdict>> getHistory() {
        return ResponseEntity.ok(comparisonService.getComparisonHistory());
    }

    @GetMapping("/cache/stats")
    public ResponseEntity<CacheStatistics> getCacheStatistics() {
        return ResponseEntity.ok(comparisonService.getCacheStatistics());
    }

    @DeleteMapping("/cache")
    public ResponseEntity<Void> clearCache() {
        comparisonService.clearCache();
        return ResponseEntity.noContent().build();
    }

    private ComparisonVerdict runComparison(CompareRequest request) {
        AppProperties.Comparison config = appProperties.getComparison();
        ComparisonThresholds defaults = new ComparisonThresholds(
                config.getVisualThreshold(), config.getStructuralThreshold());

        return comparisonService.compare(
                request.toRenderedArtifact(),
                request.toReferenceArtifact(),
                request.toThresholds(defaults),
                request.isForceRefresh());
    }
}
