package guraa.uicompare.controller;

import com.fasterxml.jackson.databind.JsonNode;
import guraa.uicompare.model.ComparisonThresholds;
import guraa.uicompare.model.LayoutNode;
import guraa.uicompare.model.ReferenceArtifact;
import guraa.uicompare.model.RenderedArtifact;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body for a comparison. Images are base64 encoded; the reference document may be
 * sent either as a JSON object or as a string holding the JSON text.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompareRequest {
    private byte[] renderedImage;
    private LayoutNode layoutTree;

    private byte[] referenceImage;
    private JsonNode referenceDocument;

    private Double visualThreshold;
    private Double structuralThreshold;

    @Builder.Default
    private boolean forceRefresh = false;

    public RenderedArtifact toRenderedArtifact() {
        return RenderedArtifact.builder()
                .imageBytes(renderedImage)
                .layoutTree(layoutTree)
                .build();
    }

    public ReferenceArtifact toReferenceArtifact() {
        String document = null;
        if (referenceDocument != null && !referenceDocument.isNull()) {
            document = referenceDocument.isTextual() ? referenceDocument.asText() : referenceDocument.toString();
        }
        return ReferenceArtifact.builder()
                .imageBytes(referenceImage)
                .structuralDocument(document)
                .build();
    }

    /**
     * Thresholds from the request, falling back to the given defaults for any that are absent.
     */
    public ComparisonThresholds toThresholds(ComparisonThresholds defaults) {
        return new ComparisonThresholds(
                visualThreshold != null ? visualThreshold : defaults.getVisualThreshold(),
                structuralThreshold != null ? structuralThreshold : defaults.getStructuralThreshold());
    }
}
