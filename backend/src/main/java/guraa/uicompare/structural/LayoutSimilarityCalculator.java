package guraa.uicompare.structural;

import guraa.uicompare.model.Bounds;
import guraa.uicompare.model.TreeNode;
import org.springframework.stereotype.Component;

/**
 * Compares the geometry of two root nodes: width, height and position, averaged.
 * A reference node without bounds contributes 0.
 */
@Component
public class LayoutSimilarityCalculator {

    public double calculate(TreeNode rendered, TreeNode reference) {
        Bounds renderedBounds = rendered.getBounds();
        Bounds referenceBounds = reference.getBounds();
        if (referenceBounds == null || renderedBounds == null) {
            return 0.0;
        }

        double widthSimilarity = dimensionSimilarity(renderedBounds.getWidth(), referenceBounds.getWidth());
        double heightSimilarity = dimensionSimilarity(renderedBounds.getHeight(), referenceBounds.getHeight());
        double positionSimilarity = (dimensionSimilarity(renderedBounds.getX(), referenceBounds.getX())
                + dimensionSimilarity(renderedBounds.getY(), referenceBounds.getY())) / 2.0;

        return (widthSimilarity + heightSimilarity + positionSimilarity) / 3.0;
    }

    /**
     * {@code 1 - |a - b| / max(|a|, |b|)}, 1.0 when both are zero, clamped to [0, 1].
     */
    public static double dimensionSimilarity(float dim1, float dim2) {
        double max = Math.max(Math.abs(dim1), Math.abs(dim2));
        if (max == 0.0) {
            return 1.0;
        }
        double similarity = 1.0 - Math.abs((double) dim1 - dim2) / max;
        if (Double.isNaN(similarity)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, similarity));
    }
}
