package guraa.doccompare.visual;

import lombok.Value;

import java.util.List;

/**
 * The side-by-side geometry of a comparison, one merged page per page index.
 */
@Value
public class MergedDocument {

    String baseLabel;

    String compareLabel;

    List<MergedPage> pages;

    public MergedDocument(String baseLabel, String compareLabel, List<MergedPage> pages) {
        this.baseLabel = baseLabel;
        this.compareLabel = compareLabel;
        this.pages = List.copyOf(pages);
    }

    public int getPageCount() {
        return pages.size();
    }

    public int getHighlightCount() {
        return pages.stream().mapToInt(page -> page.getHighlights().size()).sum();
    }
}
