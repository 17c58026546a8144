package guraa.doccompare.model.difference;

import guraa.doccompare.comparison.DiffHunk;
import guraa.doccompare.comparison.EditScript;
import guraa.doccompare.model.Table;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * Change record for one table cell, or for a whole table that has no cells.
 * Row and column indices are -1 on the side the record does not cover.
 */
@Getter
@SuperBuilder
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class TableChange extends ChangeRecord {

    private final TableChangeScope scope;

    @Builder.Default
    private final int baseTableIndex = -1;

    @Builder.Default
    private final int compareTableIndex = -1;

    @Builder.Default
    private final int baseRow = -1;

    @Builder.Default
    private final int baseColumn = -1;

    @Builder.Default
    private final int compareRow = -1;

    @Builder.Default
    private final int compareColumn = -1;

    private final String baseText;

    private final String compareText;

    @Builder.Default
    private final List<String> baseTokens = List.of();

    @Builder.Default
    private final List<String> compareTokens = List.of();

    @Builder.Default
    private final List<DiffHunk> hunks = List.of();

    public static TableChange cellDeleted(int pageIndex, int tableIndex, Table table, int row, int column,
                                          List<String> tokens, TableChangeScope scope) {
        return TableChange.builder()
                .operation(ChangeOperation.DELETE)
                .similarity(0.0)
                .scope(scope)
                .baseLocation(SourceLocation.of(pageIndex, table.getCellBounds(row, column)))
                .baseTableIndex(tableIndex)
                .baseRow(row)
                .baseColumn(column)
                .baseText(table.getCell(row, column).getText())
                .baseTokens(tokens)
                .build();
    }

    public static TableChange cellInserted(int pageIndex, int tableIndex, Table table, int row, int column,
                                           List<String> tokens, TableChangeScope scope) {
        return TableChange.builder()
                .operation(ChangeOperation.INSERT)
                .similarity(0.0)
                .scope(scope)
                .compareLocation(SourceLocation.of(pageIndex, table.getCellBounds(row, column)))
                .compareTableIndex(tableIndex)
                .compareRow(row)
                .compareColumn(column)
                .compareText(table.getCell(row, column).getText())
                .compareTokens(tokens)
                .build();
    }

    /**
     * Record for two cells at the same column of a matched row pair.
     */
    public static TableChange cellMatched(int pageIndex,
                                          int baseTableIndex, Table baseTable, int baseRow, List<String> baseTokens,
                                          int compareTableIndex, Table compareTable, int compareRow, List<String> compareTokens,
                                          int column, EditScript script, int contextSize) {
        ChangeOperation operation = script.isIdentical() ? ChangeOperation.EQUAL : ChangeOperation.REPLACE;
        return TableChange.builder()
                .operation(operation)
                .similarity(similarityFor(operation, script.similarity()))
                .scope(TableChangeScope.CELL)
                .baseLocation(SourceLocation.of(pageIndex, baseTable.getCellBounds(baseRow, column)))
                .compareLocation(SourceLocation.of(pageIndex, compareTable.getCellBounds(compareRow, column)))
                .baseTableIndex(baseTableIndex)
                .compareTableIndex(compareTableIndex)
                .baseRow(baseRow)
                .baseColumn(column)
                .compareRow(compareRow)
                .compareColumn(column)
                .baseText(baseTable.getCell(baseRow, column).getText())
                .compareText(compareTable.getCell(compareRow, column).getText())
                .baseTokens(baseTokens)
                .compareTokens(compareTokens)
                .hunks(script.hunks(contextSize))
                .build();
    }

    /**
     * Record for a table without any cells. Either side may be null.
     */
    public static TableChange emptyTable(int pageIndex, int baseTableIndex, Table baseTable,
                                         int compareTableIndex, Table compareTable) {
        ChangeOperation operation;
        if (baseTable != null && compareTable != null) {
            operation = ChangeOperation.EQUAL;
        } else if (baseTable != null) {
            operation = ChangeOperation.DELETE;
        } else {
            operation = ChangeOperation.INSERT;
        }
        return TableChange.builder()
                .operation(operation)
                .similarity(similarityFor(operation, 1.0))
                .scope(TableChangeScope.TABLE)
                .baseLocation(baseTable != null ? SourceLocation.of(pageIndex, baseTable.getBounds()) : null)
                .compareLocation(compareTable != null ? SourceLocation.of(pageIndex, compareTable.getBounds()) : null)
                .baseTableIndex(baseTable != null ? baseTableIndex : -1)
                .compareTableIndex(compareTable != null ? compareTableIndex : -1)
                .build();
    }

    @Override
    public ElementKind getKind() {
        return ElementKind.TABLE;
    }

    @Override
    public List<ElementRef> getElementRefs() {
        List<ElementRef> refs = new ArrayList<>(2);
        if (getBaseLocation() != null) {
            refs.add(ElementRef.cell(DocumentSide.BASE, getBaseLocation().getPageIndex(),
                    baseTableIndex, baseRow, baseColumn));
        }
        if (getCompareLocation() != null) {
            refs.add(ElementRef.cell(DocumentSide.COMPARE, getCompareLocation().getPageIndex(),
                    compareTableIndex, compareRow, compareColumn));
        }
        return refs;
    }

    @Override
    public <R> R accept(ChangeRecordVisitor<R> visitor) {
        return visitor.visitTable(this);
    }
}
