package guraa.doccompare.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A table grid extracted from a page.
 * Rows may have different numbers of cells.
 */
@Value
public class Table {

    /**
     * The rows of the table, top to bottom.
     */
    List<List<Cell>> rows;

    /**
     * The bounding box of the whole table.
     */
    BoundingBox bounds;

    @Builder
    public Table(@Singular List<List<Cell>> rows, BoundingBox bounds) {
        List<List<Cell>> copy = new ArrayList<>();
        if (rows != null) {
            for (List<Cell> row : rows) {
                copy.add(row == null ? List.of() : List.copyOf(row));
            }
        }
        this.rows = List.copyOf(copy);
        this.bounds = bounds;
    }

    /**
     * Build a table from plain cell texts.
     *
     * @param bounds The bounding box of the table
     * @param rows   The rows, each an array of cell texts
     * @return The table
     */
    public static Table of(BoundingBox bounds, String[]... rows) {
        List<List<Cell>> cells = new ArrayList<>();
        for (String[] row : rows) {
            List<Cell> cellRow = new ArrayList<>();
            Arrays.stream(row).map(Cell::of).forEach(cellRow::add);
            cells.add(cellRow);
        }
        return new Table(cells, bounds);
    }

    public int getRowCount() {
        return rows.size();
    }

    public int getCellCount() {
        return rows.stream().mapToInt(List::size).sum();
    }

    public Cell getCell(int row, int column) {
        return rows.get(row).get(column);
    }

    /**
     * Get the box to report for a cell, falling back to the table box.
     *
     * @param row    The row index
     * @param column The column index
     * @return The cell box, or the table box when the cell has none
     */
    public BoundingBox getCellBounds(int row, int column) {
        BoundingBox cellBounds = getCell(row, column).getBounds();
        return cellBounds != null ? cellBounds : bounds;
    }
}
