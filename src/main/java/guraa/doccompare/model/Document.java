package guraa.doccompare.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A fully extracted document: an ordered list of pages identified by a label.
 */
@Value
@Builder
public class Document {

    /**
     * The source path or label of the document.
     */
    String label;

    @Singular
    List<Page> pages;

    public int getPageCount() {
        return pages.size();
    }

    /**
     * Get a page by index.
     *
     * @param index The 0-based page index
     * @return The page, or null when the document has no such page
     */
    public Page getPage(int index) {
        return index >= 0 && index < pages.size() ? pages.get(index) : null;
    }
}
