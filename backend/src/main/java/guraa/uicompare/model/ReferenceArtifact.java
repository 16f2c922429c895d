package guraa.uicompare.model;

import lombok.Builder;
import lombok.Value;

/**
 * What the design source supplied for a reference node: an exported image and the raw node document.
 */
@Value
@Builder
public class ReferenceArtifact {
    byte[] imageBytes;
    String structuralDocument;
}
