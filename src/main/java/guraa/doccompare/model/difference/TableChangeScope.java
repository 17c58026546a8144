package guraa.doccompare.model.difference;

/**
 * Why a table cell ended up in a record.
 */
public enum TableChangeScope {
    /** Cell diffed against its counterpart in a matched row. */
    CELL,
    /** The whole row was inserted or deleted. */
    ROW,
    /** Trailing column present on one side of a matched row only. */
    COLUMN,
    /** The whole table has no counterpart. */
    TABLE
}
