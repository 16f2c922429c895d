package guraa.uicompare.structural;

import guraa.uicompare.model.TreeNode;

/**
 * Scores how well the layout constraints (padding, margins, alignment) of two nodes agree.
 */
public interface ConstraintSimilarityStrategy {

    /**
     * @param rendered The rendered root node
     * @param reference The reference root node
     * @return Score between 0.0 and 1.0
     */
    double calculate(TreeNode rendered, TreeNode reference);
}
