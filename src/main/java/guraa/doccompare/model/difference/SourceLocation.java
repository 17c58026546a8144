package guraa.doccompare.model.difference;

import guraa.doccompare.model.BoundingBox;
import lombok.Value;

/**
 * Position of an element in one of the compared documents.
 */
@Value
public class SourceLocation {

    int pageIndex;

    BoundingBox bounds;

    public static SourceLocation of(int pageIndex, BoundingBox bounds) {
        return new SourceLocation(pageIndex, bounds);
    }
}
