package guraa.uicompare.model;

import lombok.Builder;
import lombok.Value;

/**
 * What the renderer produced for a component: an encoded image and its layout tree.
 * Either part may be missing when rendering failed.
 */
@Value
@Builder
public class RenderedArtifact {
    byte[] imageBytes;
    LayoutNode layoutTree;
}
