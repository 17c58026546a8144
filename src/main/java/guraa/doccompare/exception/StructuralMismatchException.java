package guraa.doccompare.exception;

import java.util.List;

/**
 * Thrown when the inputs have nothing meaningful to diff, e.g. a document without pages.
 */
public class StructuralMismatchException extends ComparisonException {

    public StructuralMismatchException(String message) {
        super(ComparisonStage.VALIDATION, message, List.of());
    }

    public StructuralMismatchException(String message, int pageIndex) {
        super(ComparisonStage.VALIDATION, message, List.of(pageIndex));
    }
}
