package guraa.doccompare.exception;

/**
 * The stage of a comparison in which a failure happened.
 */
public enum ComparisonStage {
    VALIDATION,
    PAGE_COMPARISON,
    ASSEMBLY,
    PAGE_MERGE
}
