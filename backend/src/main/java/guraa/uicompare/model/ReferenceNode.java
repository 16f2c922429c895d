package guraa.uicompare.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * A node of the reference design tree, parsed from the design tool's node document.
 * Bounds are optional; some reference nodes carry no geometry.
 */
@Value
@Builder
public class ReferenceNode implements TreeNode {

    String id;
    String type;
    String name;

    /**
     * Absolute bounding box, or null when the document omits it.
     */
    Bounds bounds;

    @Singular
    Map<String, String> properties;

    @Singular
    List<ReferenceNode> children;

    public boolean hasBounds() {
        return bounds != null;
    }
}
