package guraa.doccompare.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One page of an extracted document.
 * Blocks, tables and images keep the order in which the extractor produced them.
 */
@Value
@Builder
public class Page {

    /**
     * The 0-based page index.
     */
    int index;

    /**
     * The page width in points.
     */
    double width;

    /**
     * The page height in points.
     */
    double height;

    @Singular
    List<TextBlock> textBlocks;

    @Singular
    List<Table> tables;

    @Singular
    List<EmbeddedImage> images;

    public BoundingBox getBounds() {
        return BoundingBox.of(0, 0, width, height);
    }

    public int getElementCount() {
        return textBlocks.size()
                + tables.stream().mapToInt(Table::getCellCount).sum()
                + images.size();
    }
}
