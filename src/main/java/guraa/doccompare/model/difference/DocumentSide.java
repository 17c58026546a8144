package guraa.doccompare.model.difference;

/**
 * Which of the two compared documents an element belongs to.
 * BASE is document A, COMPARE is document B.
 */
public enum DocumentSide {
    BASE,
    COMPARE
}
