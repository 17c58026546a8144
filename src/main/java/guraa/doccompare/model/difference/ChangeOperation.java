package guraa.doccompare.model.difference;

/**
 * The kind of edit a change record (or an edit run) describes.
 */
public enum ChangeOperation {
    EQUAL,
    INSERT,
    DELETE,
    REPLACE;

    public boolean isChange() {
        return this != EQUAL;
    }
}
