package guraa.doccompare.util;

import guraa.doccompare.model.BoundingBox;
import guraa.doccompare.model.difference.DocumentSide;
import guraa.doccompare.visual.PagePlacement;
import org.junit.jupiter.api.Test;

import java.awt.geom.Point2D;

import static org.junit.jupiter.api.Assertions.*;

class CoordinateTransformerTest {

    private final CoordinateTransformer transformer = new CoordinateTransformer();
    private final PagePlacement placement = new PagePlacement(DocumentSide.COMPARE, true, 612, 0, 1.5, 918, 1188);

    @Test
    void pointsAreScaledThenOffset() {
        Point2D merged = transformer.pageToMerged(100, 200, placement);

        assertEquals(762, merged.getX(), 1e-9);
        assertEquals(300, merged.getY(), 1e-9);

        Point2D back = transformer.mergedToPage(merged.getX(), merged.getY(), placement);
        assertEquals(100, back.getX(), 1e-9);
        assertEquals(200, back.getY(), 1e-9);
    }

    @Test
    void rectanglesKeepTheirTopLeftOrigin() {
        BoundingBox merged = transformer.pageRectToMerged(BoundingBox.of(10, 20, 30, 40), placement);

        assertEquals(BoundingBox.of(627, 30, 45, 60), merged);
    }
}
