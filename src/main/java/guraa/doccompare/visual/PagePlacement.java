package guraa.doccompare.visual;

import guraa.doccompare.model.BoundingBox;
import guraa.doccompare.model.difference.DocumentSide;
import lombok.Value;

/**
 * Where one source page sits inside a merged page.
 * A blank placement pads a document that has no page at this index.
 */
@Value
public class PagePlacement {

    DocumentSide side;

    /**
     * False when the document has no page at this index.
     */
    boolean present;

    double offsetX;

    double offsetY;

    /**
     * Factor applied to the source page's coordinates.
     */
    double scale;

    /**
     * Width of the page inside the merged page.
     */
    double width;

    /**
     * Height of the page inside the merged page.
     */
    double height;

    public BoundingBox getBounds() {
        return BoundingBox.of(offsetX, offsetY, width, height);
    }
}
