package guraa.uicompare.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Axis-aligned bounding box of a node, in layout units.
 */
@Value
public class Bounds {

    public static final Bounds ZERO = new Bounds(0f, 0f, 0f, 0f);

    float x;
    float y;
    float width;
    float height;

    @JsonCreator
    public Bounds(@JsonProperty("x") float x,
                  @JsonProperty("y") float y,
                  @JsonProperty("width") float width,
                  @JsonProperty("height") float height) {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }
}
