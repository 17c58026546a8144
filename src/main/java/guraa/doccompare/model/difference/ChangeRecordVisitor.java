package guraa.doccompare.model.difference;

/**
 * Exhaustive handling of the three change record variants.
 *
 * @param <R> The result type
 */
public interface ChangeRecordVisitor<R> {

    R visitText(TextChange change);

    R visitTable(TableChange change);

    R visitImage(ImageChange change);
}
