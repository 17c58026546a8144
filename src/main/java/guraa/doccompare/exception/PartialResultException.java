package guraa.doccompare.exception;

import java.util.List;

/**
 * Thrown when one or more page workers failed, timed out or were cancelled.
 * No partial result is returned alongside it.
 */
public class PartialResultException extends ComparisonException {

    public PartialResultException(String message, List<Integer> failedPages, Throwable cause) {
        super(ComparisonStage.PAGE_COMPARISON, message, failedPages, cause);
    }
}
