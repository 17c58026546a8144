package guraa.doccompare.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A single table cell.
 */
@Value
public class Cell {

    /**
     * The raw tokens of the cell.
     */
    List<String> tokens;

    /**
     * Whether the extractor reported this cell as part of a merged span.
     */
    boolean mergedSpan;

    /**
     * The cell's own bounding box, or null when the extractor only knows the table's box.
     */
    BoundingBox bounds;

    @Builder
    public Cell(List<String> tokens, boolean mergedSpan, BoundingBox bounds) {
        this.tokens = tokens == null ? List.of() : List.copyOf(tokens);
        this.mergedSpan = mergedSpan;
        this.bounds = bounds;
    }

    public static Cell of(String text) {
        return new Cell(TextBlock.splitWords(text), false, null);
    }

    public static Cell of(String text, BoundingBox bounds) {
        return new Cell(TextBlock.splitWords(text), false, bounds);
    }

    public String getText() {
        return String.join(" ", tokens);
    }
}
