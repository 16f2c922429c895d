package guraa.uicompare.structural;

import com.fasterxml.jackson.databind.ObjectMapper;
import guraa.uicompare.model.LayoutNode;
import guraa.uicompare.model.ReferenceNode;
import guraa.uicompare.model.StructuralComparisonResult;
import guraa.uicompare.model.TreeNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Structural comparison of a rendered layout tree against a reference node document.
 *
 * Five metrics are combined:
 * <ul>
 *     <li>tree structure: edit distance between the type-only tree signatures</li>
 *     <li>node types: overlap of the type labels used anywhere in either tree</li>
 *     <li>properties: agreement of the root nodes' properties</li>
 *     <li>layout: agreement of the root nodes' bounds</li>
 *     <li>constraints: delegated to a {@link ConstraintSimilarityStrategy}</li>
 * </ul>
 * Type labels are compared as opaque strings; no component kind gets special treatment.
 *
 * This engine never throws; failures are reported through {@link StructuralComparisonResult#getError()}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StructuralComparisonEngine {

    static final double TREE_STRUCTURE_WEIGHT = 0.30;
    static final double NODE_TYPE_WEIGHT = 0.25;
    static final double PROPERTY_WEIGHT = 0.20;
    static final double LAYOUT_WEIGHT = 0.15;
    static final double CONSTRAINT_WEIGHT = 0.10;

    private final ReferenceNodeParser referenceNodeParser;
    private final PropertySimilarityCalculator propertySimilarityCalculator;
    private final LayoutSimilarityCalculator layoutSimilarityCalculator;
    private final ConstraintSimilarityStrategy constraintSimilarityStrategy;

    /**
     * Engine wired with the default metrics and the fixed constraint score.
     *
     * @param objectMapper Mapper used to read reference documents
     * @return A ready to use engine
     */
    public static StructuralComparisonEngine createDefault(ObjectMapper objectMapper) {
        return new StructuralComparisonEngine(
                new ReferenceNodeParser(objectMapper),
                new PropertySimilarityCalculator(),
                new LayoutSimilarityCalculator(),
                new FixedConstraintSimilarity());
    }

    /**
     * Compare a rendered layout tree against a reference node document.
     *
     * @param renderedTree The rendered layout tree; null is treated as an empty tree
     * @param referenceDocument The raw reference node document
     * @param threshold Minimum similarity to pass
     * @return The comparison result
     */
    public StructuralComparisonResult compare(LayoutNode renderedTree, String referenceDocument, double threshold) {
        ReferenceNode reference;
        try {
            reference = referenceNodeParser.parse(referenceDocument);
        } catch (ReferenceParseException e) {
            log.warn("Failed to parse reference node document: {}", e.getMessage());
            return StructuralComparisonResult.failed("Failed to parse reference node document: " + e.getMessage());
        }

        try {
            return compare(renderedTree != null ? renderedTree : LayoutNode.empty(), reference, threshold);
        } catch (RuntimeException e) {
            log.error("Error during structural comparison", e);
            return StructuralComparisonResult.failed("Structural comparison failed: " + e.getMessage());
        }
    }

    /**
     * Compare two already built trees.
     *
     * @param rendered The rendered tree
     * @param reference The reference tree
     * @param threshold Minimum similarity to pass
     * @return The comparison result
     */
    public StructuralComparisonResult compare(TreeNode rendered, TreeNode reference, double threshold) {
        if (TreeSimilarityUtils.depth(rendered) > ReferenceNodeParser.MAX_DEPTH
                || TreeSimilarityUtils.depth(reference) > ReferenceNodeParser.MAX_DEPTH) {
            log.warn("Tree nested deeper than {} levels, skipping structural comparison", ReferenceNodeParser.MAX_DEPTH);
            return StructuralComparisonResult.failed(
                    "Structural comparison failed: tree is nested deeper than " + ReferenceNodeParser.MAX_DEPTH + " levels");
        }

        double treeStructureSimilarity = TreeSimilarityUtils.treeStructureSimilarity(rendered, reference);
        double nodeTypeSimilarity = TreeSimilarityUtils.nodeTypeSimilarity(rendered, reference);
        double propertySimilarity = propertySimilarityCalculator.calculate(rendered, reference);
        double layoutSimilarity = layoutSimilarityCalculator.calculate(rendered, reference);
        double constraintSimilarity = constraintSimilarityStrategy.calculate(rendered, reference);

        double similarity = treeStructureSimilarity * TREE_STRUCTURE_WEIGHT
                + nodeTypeSimilarity * NODE_TYPE_WEIGHT
                + propertySimilarity * PROPERTY_WEIGHT
                + layoutSimilarity * LAYOUT_WEIGHT
                + constraintSimilarity * CONSTRAINT_WEIGHT;
        similarity = Math.max(0.0, Math.min(1.0, similarity));
        boolean passed = similarity >= threshold;

        log.info("Structural comparison completed: similarity={}, passed={}", similarity, passed);

        return StructuralComparisonResult.builder()
                .similarity(similarity)
                .passed(passed)
                .treeStructureSimilarity(treeStructureSimilarity)
                .nodeTypeSimilarity(nodeTypeSimilarity)
                .propertySimilarity(propertySimilarity)
                .layoutSimilarity(layoutSimilarity)
                .constraintSimilarity(constraintSimilarity)
                .threshold(threshold)
                .build();
    }
}
