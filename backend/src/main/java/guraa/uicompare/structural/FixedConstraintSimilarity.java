package guraa.uicompare.structural;

import guraa.uicompare.model.TreeNode;
import org.springframework.stereotype.Component;

/**
 * Constraint score used until constraint data is available on both trees: a constant 0.8.
 */
@Component
public class FixedConstraintSimilarity implements ConstraintSimilarityStrategy {

    public static final double DEFAULT_SCORE = 0.8;

    @Override
    public double calculate(TreeNode rendered, TreeNode reference) {
        return DEFAULT_SCORE;
    }
}
