package guraa.doccompare.service;

import guraa.doccompare.comparison.AlignedPair;
import guraa.doccompare.config.ComparisonOptions;
import guraa.doccompare.model.Cell;
import guraa.doccompare.model.Table;
import guraa.doccompare.model.difference.TableChange;
import guraa.doccompare.model.difference.TableChangeScope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Service for comparing tables.
 * Tables are paired by position on their page, rows are aligned as units and the cells of
 * matched rows are compared column by column.
 */
@Slf4j
@Service
public class TableComparisonService {

    /**
     * Compare the tables of one page index.
     *
     * @param pageIndex     The page index
     * @param baseTables    The tables of document A
     * @param compareTables The tables of document B
     * @param options       The comparison options
     * @return The table records, one per cell (or one per empty table)
     */
    public List<TableChange> compareTables(int pageIndex, List<Table> baseTables, List<Table> compareTables,
                                           ComparisonOptions options) {
        TextNormalizer normalizer = new TextNormalizer(options.getNormalization());
        List<TableChange> changes = new ArrayList<>();

        int count = Math.max(baseTables.size(), compareTables.size());
        for (int t = 0; t < count; t++) {
            Table base = t < baseTables.size() ? baseTables.get(t) : null;
            Table compare = t < compareTables.size() ? compareTables.get(t) : null;

            if (base != null && compare != null) {
                changes.addAll(compareTable(pageIndex, t, base, t, compare, options));
            } else if (base != null) {
                changes.addAll(deleteTable(pageIndex, t, base, normalizer, TableChangeScope.TABLE));
            } else {
                changes.addAll(insertTable(pageIndex, t, compare, normalizer, TableChangeScope.TABLE));
            }
        }

        if (baseTables.size() != compareTables.size()) {
            log.debug("Page {}: table count differs ({} vs {})", pageIndex, baseTables.size(), compareTables.size());
        }
        return changes;
    }

    /**
     * Compare two tables that sit at the same position on their pages.
     *
     * @param pageIndex         The page index
     * @param baseTableIndex    The index of the table in document A's page
     * @param base              The table of document A
     * @param compareTableIndex The index of the table in document B's page
     * @param compare           The table of document B
     * @param options           The comparison options
     * @return The cell records of both tables
     */
    public List<TableChange> compareTable(int pageIndex, int baseTableIndex, Table base,
                                          int compareTableIndex, Table compare, ComparisonOptions options) {
        TextNormalizer normalizer = new TextNormalizer(options.getNormalization());

        boolean baseEmpty = base.getCellCount() == 0;
        boolean compareEmpty = compare.getCellCount() == 0;
        if (baseEmpty && compareEmpty) {
            return List.of(TableChange.emptyTable(pageIndex, baseTableIndex, base, compareTableIndex, compare));
        }
        if (baseEmpty) {
            List<TableChange> changes = new ArrayList<>();
            changes.add(TableChange.emptyTable(pageIndex, baseTableIndex, base, -1, null));
            changes.addAll(insertTable(pageIndex, compareTableIndex, compare, normalizer, TableChangeScope.ROW));
            return changes;
        }
        if (compareEmpty) {
            List<TableChange> changes = deleteTable(pageIndex, baseTableIndex, base, normalizer, TableChangeScope.ROW);
            changes.add(TableChange.emptyTable(pageIndex, -1, null, compareTableIndex, compare));
            return changes;
        }

        TextAligner aligner = new TextAligner(options.getMaxAlignmentCells(), options.getReplaceLengthRatio());
        List<List<List<String>>> baseCells = cellTokens(base, normalizer);
        List<List<List<String>>> compareCells = cellTokens(compare, normalizer);

        List<AlignedPair> rowPairs = new UnitAligner(aligner)
                .align(rowTokens(baseCells), rowTokens(compareCells), options.getRowSimilarityThreshold());

        List<TableChange> changes = new ArrayList<>();
        for (AlignedPair pair : rowPairs) {
            int baseRow = pair.getBaseIndex();
            int compareRow = pair.getCompareIndex();
            if (pair.isMatched()) {
                List<List<String>> baseRowCells = baseCells.get(baseRow);
                List<List<String>> compareRowCells = compareCells.get(compareRow);
                int common = Math.min(baseRowCells.size(), compareRowCells.size());
                for (int col = 0; col < common; col++) {
                    changes.add(TableChange.cellMatched(pageIndex,
                            baseTableIndex, base, baseRow, baseRowCells.get(col),
                            compareTableIndex, compare, compareRow, compareRowCells.get(col),
                            col, aligner.align(baseRowCells.get(col), compareRowCells.get(col)),
                            options.getContextSize()));
                }
                for (int col = common; col < baseRowCells.size(); col++) {
                    changes.add(TableChange.cellDeleted(pageIndex, baseTableIndex, base, baseRow, col,
                            baseRowCells.get(col), TableChangeScope.COLUMN));
                }
                for (int col = common; col < compareRowCells.size(); col++) {
                    changes.add(TableChange.cellInserted(pageIndex, compareTableIndex, compare, compareRow, col,
                            compareRowCells.get(col), TableChangeScope.COLUMN));
                }
            } else if (baseRow >= 0) {
                List<List<String>> rowCells = baseCells.get(baseRow);
                for (int col = 0; col < rowCells.size(); col++) {
                    changes.add(TableChange.cellDeleted(pageIndex, baseTableIndex, base, baseRow, col,
                            rowCells.get(col), TableChangeScope.ROW));
                }
            } else {
                List<List<String>> rowCells = compareCells.get(compareRow);
                for (int col = 0; col < rowCells.size(); col++) {
                    changes.add(TableChange.cellInserted(pageIndex, compareTableIndex, compare, compareRow, col,
                            rowCells.get(col), TableChangeScope.ROW));
                }
            }
        }
        return changes;
    }

    private List<TableChange> deleteTable(int pageIndex, int tableIndex, Table table, TextNormalizer normalizer,
                                          TableChangeScope scope) {
        List<TableChange> changes = new ArrayList<>();
        if (table.getCellCount() == 0) {
            changes.add(TableChange.emptyTable(pageIndex, tableIndex, table, -1, null));
            return changes;
        }
        for (int row = 0; row < table.getRowCount(); row++) {
            for (int col = 0; col < table.getRows().get(row).size(); col++) {
                changes.add(TableChange.cellDeleted(pageIndex, tableIndex, table, row, col,
                        normalizer.tokenize(table.getCell(row, col)), scope));
            }
        }
        return changes;
    }

    private List<TableChange> insertTable(int pageIndex, int tableIndex, Table table, TextNormalizer normalizer,
                                          TableChangeScope scope) {
        List<TableChange> changes = new ArrayList<>();
        if (table.getCellCount() == 0) {
            changes.add(TableChange.emptyTable(pageIndex, -1, null, tableIndex, table));
            return changes;
        }
        for (int row = 0; row < table.getRowCount(); row++) {
            for (int col = 0; col < table.getRows().get(row).size(); col++) {
                changes.add(TableChange.cellInserted(pageIndex, tableIndex, table, row, col,
                        normalizer.tokenize(table.getCell(row, col)), scope));
            }
        }
        return changes;
    }

    private static List<List<List<String>>> cellTokens(Table table, TextNormalizer normalizer) {
        List<List<List<String>>> rows = new ArrayList<>(table.getRowCount());
        for (List<Cell> row : table.getRows()) {
            rows.add(row.stream().map(normalizer::tokenize).collect(Collectors.toList()));
        }
        return rows;
    }

    /**
     * A row's tokens: its cells' tokens in column order.
     */
    private static List<List<String>> rowTokens(List<List<List<String>>> cells) {
        List<List<String>> rows = new ArrayList<>(cells.size());
        for (List<List<String>> row : cells) {
            List<String> tokens = new ArrayList<>();
            row.forEach(tokens::addAll);
            rows.add(tokens);
        }
        return rows;
    }
}
