package guraa.uicompare.service;

import guraa.uicompare.config.AppProperties;
import guraa.uicompare.model.CacheStatistics;
import guraa.uicompare.model.ComparisonFingerprint;
import guraa.uicompare.model.ComparisonThresholds;
import guraa.uicompare.model.ComparisonVerdict;
import guraa.uicompare.model.LayoutNode;
import guraa.uicompare.model.ReferenceArtifact;
import guraa.uicompare.model.RenderedArtifact;
import guraa.uicompare.model.StructuralComparisonResult;
import guraa.uicompare.model.VisualComparisonResult;
import guraa.uicompare.structural.StructuralComparisonEngine;
import guraa.uicompare.visual.VisualComparisonEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;

/**
 * Orchestrates the comparison of a rendered component against a reference design.
 *
 * The visual and structural engines run concurrently on the comparison executor and are
 * joined before their results are aggregated into a {@link ComparisonVerdict}. Verdicts are
 * cached by the fingerprint of the images, the reference document and the effective thresholds.
 * The rendered layout tree is not part of the key: a changed tree with unchanged images and
 * document is served the cached verdict unless {@code forceRefresh} is set.
 * This service never throws; failures surface through the verdict's error field.
 */
@Slf4j
@Service
public class ComparisonService {

    // Rough per-verdict footprint of the result objects and their boxed metrics
    private static final long VERDICT_OVERHEAD_BYTES = 512;

    private final VisualComparisonEngine visualEngine;
    private final StructuralComparisonEngine structuralEngine;
    private final FingerprintGenerator fingerprintGenerator;
    private final ComparisonCache comparisonCache;
    private final ExecutorService executorService;
    private final AppProperties appProperties;

    public ComparisonService(
            VisualComparisonEngine visualEngine,
            StructuralComparisonEngine structuralEngine,
            FingerprintGenerator fingerprintGenerator,
            ComparisonCache comparisonCache,
            @Qualifier("comparisonExecutor") ExecutorService executorService,
            AppProperties appProperties) {
        this.visualEngine = visualEngine;
        this.structuralEngine = structuralEngine;
        this.fingerprintGenerator = fingerprintGenerator;
        this.comparisonCache = comparisonCache;
        this.executorService = executorService;
        this.appProperties = appProperties;
    }

    /**
     * Compare using the configured thresholds.
     *
     * @param rendered The rendered artifact
     * @param reference The reference artifact
     * @param forceRefresh If true, bypasses the cache and recomputes
     * @return The verdict
     */
    public ComparisonVerdict compare(RenderedArtifact rendered, ReferenceArtifact reference, boolean forceRefresh) {
        return compare(rendered, reference, defaultThresholds(), forceRefresh);
    }

    /**
     * Compare a rendered component with its reference design.
     *
     * @param rendered The rendered artifact
     * @param reference The reference artifact
     * @param thresholds Pass/fail thresholds; null means the configured defaults
     * @param forceRefresh If true, bypasses the cache and recomputes
     * @return The verdict, never null
     */
    public ComparisonVerdict compare(RenderedArtifact rendered, ReferenceArtifact reference,
                                     ComparisonThresholds thresholds, boolean forceRefresh) {
        try {
            validate(rendered, reference);
            ComparisonThresholds effective = thresholds != null ? thresholds : defaultThresholds();

            ComparisonFingerprint fingerprint = fingerprintGenerator.fingerprint(
                    rendered.getImageBytes(), reference.getImageBytes(), reference.getStructuralDocument(), effective);

            if (!forceRefresh) {
                ComparisonVerdict cached = comparisonCache.get(fingerprint);
                if (cached != null) {
                    log.info("Returning cached comparison verdict for key: {}", fingerprint);
                    return cached;
                }
            }

            log.info("Starting comparison with reference design (visualThreshold={}, structuralThreshold={})",
                    effective.getVisualThreshold(), effective.getStructuralThreshold());

            LayoutNode layoutTree = rendered.getLayoutTree() != null ? rendered.getLayoutTree() : LayoutNode.empty();

            CompletableFuture<VisualComparisonResult> visualTask = CompletableFuture
                    .supplyAsync(() -> visualEngine.compare(
                            rendered.getImageBytes(), reference.getImageBytes(), effective.getVisualThreshold()),
                            executorService)
                    .exceptionally(e -> {
                        log.error("Visual comparison task failed: {}", e.getMessage(), e);
                        return VisualComparisonResult.failed("Visual comparison failed: " + e.getMessage());
                    });

            CompletableFuture<StructuralComparisonResult> structuralTask = CompletableFuture
                    .supplyAsync(() -> structuralEngine.compare(
                            layoutTree, reference.getStructuralDocument(), effective.getStructuralThreshold()),
                            executorService)
                    .exceptionally(e -> {
                        log.error("Structural comparison task failed: {}", e.getMessage(), e);
                        return StructuralComparisonResult.failed("Structural comparison failed: " + e.getMessage());
                    });

            VisualComparisonResult visualResult = visualTask.join();
            StructuralComparisonResult structuralResult = structuralTask.join();

            ComparisonVerdict verdict = ComparisonVerdict.of(
                    visualResult, structuralResult, fingerprint, System.currentTimeMillis());

            comparisonCache.put(fingerprint, verdict);

            log.info("Comparison completed: overall={}, visual={}, structural={}",
                    verdict.isOverallPassed(), visualResult.getSimilarity(), structuralResult.getSimilarity());
            return verdict;
        } catch (Exception e) {
            log.error("Error during comparison: {}", e.getMessage(), e);
            return ComparisonVerdict.failed(e.getMessage(), System.currentTimeMillis());
        }
    }

    /**
     * Cached verdicts, newest first.
     *
     * @return The comparison history
     */
    public List<ComparisonVerdict> getComparisonHistory() {
        return comparisonCache.values().stream()
                .sorted(Comparator.comparingLong(ComparisonVerdict::getTimestamp).reversed())
                .collect(Collectors.toList());
    }

    public void clearCache() {
        comparisonCache.clear();
        log.info("Comparison cache cleared");
    }

    public CacheStatistics getCacheStatistics() {
        long memory = 0;
        for (ComparisonVerdict verdict : comparisonCache.values()) {
            memory += estimateSize(verdict);
        }
        return CacheStatistics.builder()
                .cachedVerdicts(comparisonCache.size())
                .maxEntries(comparisonCache.maxEntries())
                .estimatedMemoryBytes(memory)
                .build();
    }

    private ComparisonThresholds defaultThresholds() {
        AppProperties.Comparison comparison = appProperties.getComparison();
        return new ComparisonThresholds(comparison.getVisualThreshold(), comparison.getStructuralThreshold());
    }

    private static void validate(RenderedArtifact rendered, ReferenceArtifact reference) {
        if (rendered == null) {
            throw new IllegalArgumentException("Rendered artifact is missing");
        }
        if (reference == null) {
            throw new IllegalArgumentException("Reference artifact is missing");
        }
        if (rendered.getImageBytes() == null || rendered.getImageBytes().length == 0) {
            throw new IllegalArgumentException("Rendered image bytes are missing");
        }
    }

    private static long estimateSize(ComparisonVerdict verdict) {
        long size = VERDICT_OVERHEAD_BYTES;
        if (verdict.getFingerprint() != null) {
            size += verdict.getFingerprint().toString().length() * 2L;
        }
        size += textSize(verdict.getError());
        size += textSize(verdict.getVisualComparison().getError());
        size += textSize(verdict.getStructuralComparison().getError());
        return size;
    }

    private static long textSize(String text) {
        return text != null ? text.length() * 2L : 0L;
    }
}
