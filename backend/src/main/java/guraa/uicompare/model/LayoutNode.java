package guraa.uicompare.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A node of the layout tree produced by the renderer for a component.
 * Instances are immutable and compared by value.
 */
@Value
@Builder
@Jacksonized
public class LayoutNode implements TreeNode {

    public static final String EMPTY_TYPE = "Empty";

    String id;

    /**
     * The component kind, e.g. "Text" or "Column".
     */
    String type;

    @Builder.Default
    Bounds bounds = Bounds.ZERO;

    @Singular
    Map<String, String> properties;

    @Singular
    List<LayoutNode> children;

    /**
     * Placeholder used when the renderer produced no layout tree.
     *
     * @return An empty node with zero bounds and no children
     */
    public static LayoutNode empty() {
        return LayoutNode.builder()
                .id("empty")
                .type(EMPTY_TYPE)
                .bounds(Bounds.ZERO)
                .build();
    }

    /**
     * Count the nodes of this subtree, including this one.
     *
     * @return The node count
     */
    public int countNodes() {
        int count = 1;
        for (LayoutNode child : children) {
            count += child.countNodes();
        }
        return count;
    }

    /**
     * Depth of this subtree; a leaf has depth 1.
     *
     * @return The maximum depth
     */
    public int maxDepth() {
        int depth = 0;
        for (LayoutNode child : children) {
            depth = Math.max(depth, child.maxDepth());
        }
        return depth + 1;
    }

    /**
     * Distinct node types of this subtree in pre-order.
     *
     * @return The set of types
     */
    @JsonIgnore
    public Set<String> getNodeTypes() {
        Set<String> types = new LinkedHashSet<>();
        collectTypes(this, types);
        return types;
    }

    private static void collectTypes(LayoutNode node, Set<String> types) {
        types.add(node.getType());
        for (LayoutNode child : node.getChildren()) {
            collectTypes(child, types);
        }
    }
}
