package guraa.doccompare.exception;

import java.util.List;

/**
 * Base class for failures that abort a comparison.
 * Carries the stage that failed and the page indices involved, if any.
 */
public class ComparisonException extends Exception {

    private final ComparisonStage stage;
    private final List<Integer> pageIndices;

    public ComparisonException(ComparisonStage stage, String message, List<Integer> pageIndices) {
        super(message);
        this.stage = stage;
        this.pageIndices = pageIndices == null ? List.of() : List.copyOf(pageIndices);
    }

    public ComparisonException(ComparisonStage stage, String message, List<Integer> pageIndices, Throwable cause) {
        super(message, cause);
        this.stage = stage;
        this.pageIndices = pageIndices == null ? List.of() : List.copyOf(pageIndices);
    }

    public ComparisonStage getStage() {
        return stage;
    }

    /**
     * The 0-based page indices affected by the failure; empty when it concerns a whole document.
     *
     * @return The page indices in ascending order
     */
    public List<Integer> getPageIndices() {
        return pageIndices;
    }
}
