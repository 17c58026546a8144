package guraa.doccompare.model.difference;

/**
 * The element families a document is made of.
 * Declaration order is the tie-break priority when records share a page position.
 */
public enum ElementKind {
    TEXT,
    TABLE,
    IMAGE
}
