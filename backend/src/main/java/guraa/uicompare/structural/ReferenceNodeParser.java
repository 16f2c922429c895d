package guraa.uicompare.structural;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import guraa.uicompare.model.Bounds;
import guraa.uicompare.model.ReferenceNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Parses a reference design node document into a {@link ReferenceNode} tree.
 *
 * The document is a recursive object with {@code id}, {@code type}, {@code name}, an optional
 * {@code absoluteBoundingBox}, a {@code style} object and a {@code children} array. Name,
 * visibility, opacity and the style attributes are flattened into the node properties.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReferenceNodeParser {

    static final String BOUNDING_BOX_FIELD = "absoluteBoundingBox";

    /**
     * Deepest node nesting accepted; the root is at depth 1.
     */
    static final int MAX_DEPTH = 1000;

    private static final List<String> NODE_PROPERTIES = List.of("name", "visible", "opacity");
    private static final List<String> STYLE_PROPERTIES = List.of("fill", "stroke", "fontSize", "fontFamily");

    private final ObjectMapper objectMapper;

    /**
     * Parse a node document.
     *
     * @param document The raw JSON document
     * @return The root node
     * @throws ReferenceParseException If the document is empty, malformed, not an object or nested
     *                                 deeper than {@link #MAX_DEPTH}
     */
    public ReferenceNode parse(String document) throws ReferenceParseException {
        if (document == null || document.isBlank()) {
            throw new ReferenceParseException("Reference node document is empty");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(document);
        } catch (JsonProcessingException e) {
            throw new ReferenceParseException("Malformed reference node document: " + e.getOriginalMessage(), e);
        }

        if (root == null || !root.isObject()) {
            throw new ReferenceParseException("Reference node document must be a JSON object");
        }
        return parseNode(root, 1);
    }

    private ReferenceNode parseNode(JsonNode json, int depth) throws ReferenceParseException {
        if (depth > MAX_DEPTH) {
            throw new ReferenceParseException("Reference node document is nested deeper than " + MAX_DEPTH + " levels");
        }

        ReferenceNode.ReferenceNodeBuilder builder = ReferenceNode.builder()
                .id(text(json, "id"))
                .type(text(json, "type"))
                .name(text(json, "name"))
                .bounds(parseBounds(json.get(BOUNDING_BOX_FIELD)));

        for (String property : NODE_PROPERTIES) {
            JsonNode value = json.get(property);
            if (value != null && !value.isNull()) {
                builder.property(property, valueOf(value));
            }
        }

        JsonNode style = json.get("style");
        if (style != null && style.isObject()) {
            for (String property : STYLE_PROPERTIES) {
                JsonNode value = style.get(property);
                if (value != null && !value.isNull()) {
                    builder.property(property, valueOf(value));
                }
            }
        }

        JsonNode children = json.get("children");
        if (children != null && children.isArray()) {
            for (JsonNode child : children) {
                if (child.isObject()) {
                    builder.child(parseNode(child, depth + 1));
                } else {
                    log.debug("Skipping non-object child in reference node {}", text(json, "id"));
                }
            }
        }

        return builder.build();
    }

    /**
     * Missing coordinates default to 0; a missing or non-object box means the node has no bounds.
     */
    private Bounds parseBounds(JsonNode box) {
        if (box == null || !box.isObject()) {
            return null;
        }
        return new Bounds(
                number(box, "x"),
                number(box, "y"),
                number(box, "width"),
                number(box, "height"));
    }

    private static String text(JsonNode json, String field) {
        JsonNode value = json.get(field);
        return value == null || value.isNull() ? "" : value.asText();
    }

    private static float number(JsonNode json, String field) {
        JsonNode value = json.get(field);
        if (value == null) {
            return 0f;
        }
        if (value.isNumber()) {
            return value.floatValue();
        }
        try {
            return Float.parseFloat(value.asText());
        } catch (NumberFormatException e) {
            return 0f;
        }
    }

    /**
     * Scalars keep their plain text form; objects and arrays keep their JSON form.
     */
    private static String valueOf(JsonNode value) {
        return value.isValueNode() ? value.asText() : value.toString();
    }
}
