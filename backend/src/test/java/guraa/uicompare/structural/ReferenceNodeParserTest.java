package guraa.uicompare.structural;

import com.fasterxml.jackson.databind.ObjectMapper;
import guraa.uicompare.model.Bounds;
import guraa.uicompare.model.ReferenceNode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReferenceNodeParserTest {

    private final ReferenceNodeParser parser = new ReferenceNodeParser(new ObjectMapper());

    @Test
    void parsesNestedNodesWithBoundsAndStyle() throws ReferenceParseException {
        String document = "{"
                + "\"id\":\"1:2\",\"type\":\"FRAME\",\"name\":\"Login\",\"visible\":true,\"opacity\":0.5,"
                + "\"absoluteBoundingBox\":{\"x\":10,\"y\":20,\"width\":300,\"height\":400},"
                + "\"style\":{\"fill\":\"#FF0000\",\"fontSize\":14,\"fontFamily\":\"Roboto\",\"letterSpacing\":2},"
                + "\"children\":[{\"id\":\"1:3\",\"type\":\"TEXT\"},{\"id\":\"1:4\",\"type\":\"RECTANGLE\"}]"
                + "}";

        ReferenceNode root = parser.parse(document);

        assertThat(root.getId()).isEqualTo("1:2");
        assertThat(root.getType()).isEqualTo("FRAME");
        assertThat(root.getName()).isEqualTo("Login");
        assertThat(root.getBounds()).isEqualTo(new Bounds(10f, 20f, 300f, 400f));
        assertThat(root.getProperties())
                .containsEntry("name", "Login")
                .containsEntry("visible", "true")
                .containsEntry("opacity", "0.5")
                .containsEntry("fill", "#FF0000")
                .containsEntry("fontSize", "14")
                .containsEntry("fontFamily", "Roboto")
                .doesNotContainKey("letterSpacing");
        assertThat(root.getChildren()).extracting(ReferenceNode::getType).containsExactly("TEXT", "RECTANGLE");
    }

    @Test
    void missingBoundingBoxLeavesBoundsUnset() throws ReferenceParseException {
        ReferenceNode root = parser.parse("{\"id\":\"1\",\"type\":\"FRAME\"}");

        assertThat(root.hasBounds()).isFalse();
        assertThat(root.getBounds()).isNull();
        assertThat(root.getName()).isEmpty();
        assertThat(root.getChildren()).isEmpty();
    }

    @Test
    void missingCoordinatesDefaultToZero() throws ReferenceParseException {
        ReferenceNode root = parser.parse("{\"type\":\"FRAME\",\"absoluteBoundingBox\":{\"width\":50}}");

        assertThat(root.getBounds()).isEqualTo(new Bounds(0f, 0f, 50f, 0f));
    }

    @Test
    void structuredStyleValuesKeepTheirJsonForm() throws ReferenceParseException {
        ReferenceNode root = parser.parse(
                "{\"type\":\"RECTANGLE\",\"style\":{\"stroke\":{\"r\":1,\"g\":0}}}");

        assertThat(root.getProperties()).containsEntry("stroke", "{\"r\":1,\"g\":0}");
    }

    @Test
    void scalarStyleValuesAreStoredWithoutJsonQuotes() throws ReferenceParseException {
        ReferenceNode root = parser.parse(
                "{\"type\":\"RECTANGLE\",\"style\":{\"fill\":\"#1A73E8\",\"fontFamily\":\"Inter\"}}");

        assertThat(root.getProperties().get("fill")).isEqualTo("#1A73E8").doesNotContain("\"");
        assertThat(root.getProperties().get("fontFamily")).isEqualTo("Inter");
    }

    @Test
    void acceptsNestingUpToTheLimit() throws ReferenceParseException {
        ReferenceNode root = parser.parse(nested(ReferenceNodeParser.MAX_DEPTH));

        assertThat(TreeSimilarityUtils.depth(root)).isEqualTo(ReferenceNodeParser.MAX_DEPTH);
    }

    @Test
    void rejectsNestingBeyondTheLimit() {
        assertThatThrownBy(() -> parser.parse(nested(ReferenceNodeParser.MAX_DEPTH + 1)))
                .isInstanceOf(ReferenceParseException.class)
                .hasMessageContaining("nested deeper than");
    }

    @Test
    void skipsNonObjectChildren() throws ReferenceParseException {
        ReferenceNode root = parser.parse("{\"type\":\"FRAME\",\"children\":[1,\"x\",{\"type\":\"TEXT\"}]}");

        assertThat(root.getChildren()).hasSize(1);
        assertThat(root.getChildren().get(0).getType()).isEqualTo("TEXT");
    }

    @Test
    void rejectsBlankMalformedAndNonObjectDocuments() {
        assertThatThrownBy(() -> parser.parse(null)).isInstanceOf(ReferenceParseException.class);
        assertThatThrownBy(() -> parser.parse("  ")).isInstanceOf(ReferenceParseException.class);
        assertThatThrownBy(() -> parser.parse("{\"type\":"))
                .isInstanceOf(ReferenceParseException.class)
                .hasMessageStartingWith("Malformed reference node document");
        assertThatThrownBy(() -> parser.parse("[1,2]"))
                .isInstanceOf(ReferenceParseException.class)
                .hasMessageContaining("JSON object");
    }

    static String nested(int levels) {
        StringBuilder sb = new StringBuilder();
        for (int i = 1; i < levels; i++) {
            sb.append("{\"type\":\"FRAME\",\"children\":[");
        }
        sb.append("{\"type\":\"TEXT\"}");
        for (int i = 1; i < levels; i++) {
            sb.append("]}");
        }
        return sb.toString();
    }
}
