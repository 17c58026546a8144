package guraa.doccompare.model;

import lombok.Builder;
import lombok.Value;

import java.util.Arrays;
import java.util.List;

/**
 * A block of text (paragraph or line) on a page, as produced by the extractor.
 */
@Value
public class TextBlock {

    /**
     * The raw tokens of the block in reading order.
     */
    List<String> tokens;

    /**
     * Where the block sits on its page.
     */
    BoundingBox bounds;

    /**
     * The 0-based index of the page owning this block.
     */
    int pageIndex;

    @Builder
    public TextBlock(List<String> tokens, BoundingBox bounds, int pageIndex) {
        this.tokens = tokens == null ? List.of() : List.copyOf(tokens);
        this.bounds = bounds;
        this.pageIndex = pageIndex;
    }

    /**
     * Create a block from raw text, splitting it on whitespace.
     *
     * @param text      The raw text
     * @param bounds    The bounding box of the block
     * @param pageIndex The page index
     * @return The text block
     */
    public static TextBlock of(String text, BoundingBox bounds, int pageIndex) {
        return new TextBlock(splitWords(text), bounds, pageIndex);
    }

    /**
     * Get the block text with tokens joined by single spaces.
     *
     * @return The text
     */
    public String getText() {
        return String.join(" ", tokens);
    }

    static List<String> splitWords(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return Arrays.asList(text.trim().split("\\s+"));
    }
}
