package guraa.doccompare.model.difference;

import lombok.Value;

/**
 * Identity of one source element, used to check that every element is reported exactly once.
 * Row and column are -1 for text blocks, images and table-level entries.
 */
@Value
public class ElementRef {

    DocumentSide side;
    int pageIndex;
    ElementKind kind;
    int elementIndex;
    int row;
    int column;

    public static ElementRef text(DocumentSide side, int pageIndex, int blockIndex) {
        return new ElementRef(side, pageIndex, ElementKind.TEXT, blockIndex, -1, -1);
    }

    public static ElementRef cell(DocumentSide side, int pageIndex, int tableIndex, int row, int column) {
        return new ElementRef(side, pageIndex, ElementKind.TABLE, tableIndex, row, column);
    }

    public static ElementRef image(DocumentSide side, int pageIndex, int imageIndex) {
        return new ElementRef(side, pageIndex, ElementKind.IMAGE, imageIndex, -1, -1);
    }
}
