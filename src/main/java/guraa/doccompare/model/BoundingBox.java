package guraa.doccompare.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;

/**
 * Axis-aligned rectangle in page space.
 * Coordinates are in points with a top-left origin and the y-axis pointing downward,
 * the same convention the display side uses.
 */
@Value
public class BoundingBox {

    /**
     * The x-coordinate of the left edge.
     */
    double x;

    /**
     * The y-coordinate of the top edge.
     */
    double y;

    /**
     * The width of the rectangle.
     */
    double width;

    /**
     * The height of the rectangle.
     */
    double height;

    public static BoundingBox of(double x, double y, double width, double height) {
        return new BoundingBox(x, y, width, height);
    }

    @JsonIgnore
    public double getRight() {
        return x + width;
    }

    @JsonIgnore
    public double getBottom() {
        return y + height;
    }

    /**
     * Scale the rectangle around the origin and then move it.
     *
     * @param scale   The uniform scale factor
     * @param offsetX The horizontal offset applied after scaling
     * @param offsetY The vertical offset applied after scaling
     * @return The transformed rectangle
     */
    public BoundingBox transform(double scale, double offsetX, double offsetY) {
        return new BoundingBox(x * scale + offsetX, y * scale + offsetY, width * scale, height * scale);
    }
}
