package guraa.doccompare.util;

import guraa.doccompare.model.BoundingBox;
import guraa.doccompare.visual.PagePlacement;
import org.springframework.stereotype.Component;

import java.awt.geom.Point2D;

/**
 * Transforms coordinates between page space and merged side-by-side space.
 *
 * Both spaces use a top-left origin with the y-axis pointing downward; a page placement
 * scales the page uniformly and then moves it to its slot in the merged page.
 */
@Component
public class CoordinateTransformer {

    /**
     * Transform a point from page space to merged space.
     *
     * @param x         X coordinate in page space
     * @param y         Y coordinate in page space
     * @param placement The placement of the page
     * @return Point in merged space
     */
    public Point2D pageToMerged(double x, double y, PagePlacement placement) {
        return new Point2D.Double(x * placement.getScale() + placement.getOffsetX(),
                y * placement.getScale() + placement.getOffsetY());
    }

    /**
     * Transform a point from merged space back to page space.
     *
     * @param x         X coordinate in merged space
     * @param y         Y coordinate in merged space
     * @param placement The placement of the page
     * @return Point in page space
     */
    public Point2D mergedToPage(double x, double y, PagePlacement placement) {
        double scale = placement.getScale();
        return new Point2D.Double((x - placement.getOffsetX()) / scale, (y - placement.getOffsetY()) / scale);
    }

    /**
     * Transform a rectangle from page space to merged space.
     *
     * @param bounds    Rectangle in page space
     * @param placement The placement of the page
     * @return Rectangle in merged space
     */
    public BoundingBox pageRectToMerged(BoundingBox bounds, PagePlacement placement) {
        return bounds.transform(placement.getScale(), placement.getOffsetX(), placement.getOffsetY());
    }
}
