package guraa.uicompare.model;

import java.util.List;
import java.util.Map;

/**
 * Read-only view shared by rendered and reference tree nodes, so the structural
 * metrics can treat both sides uniformly.
 */
public interface TreeNode {

    String getType();

    /**
     * @return The bounds, or null when the node carries no geometry
     */
    Bounds getBounds();

    Map<String, String> getProperties();

    List<? extends TreeNode> getChildren();
}
