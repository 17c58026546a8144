package guraa.doccompare.visual;

import guraa.doccompare.model.BoundingBox;
import guraa.doccompare.model.difference.ChangeOperation;
import guraa.doccompare.model.difference.DocumentSide;
import guraa.doccompare.model.difference.ElementKind;
import lombok.Value;

/**
 * A highlight rectangle in merged-page coordinates.
 */
@Value
public class Highlight {

    DocumentSide side;

    ChangeOperation operation;

    ElementKind kind;

    BoundingBox bounds;

    /**
     * Position of the originating record in the diff result.
     */
    int recordIndex;
}
