package guraa.doccompare.visual;

import lombok.Value;

import java.util.List;

/**
 * One side-by-side page: document A on the left, document B on the right.
 */
@Value
public class MergedPage {

    int pageIndex;

    double width;

    double height;

    PagePlacement base;

    PagePlacement compare;

    List<Highlight> highlights;

    public MergedPage(int pageIndex, double width, double height, PagePlacement base, PagePlacement compare,
                      List<Highlight> highlights) {
        this.pageIndex = pageIndex;
        this.width = width;
        this.height = height;
        this.base = base;
        this.compare = compare;
        this.highlights = List.copyOf(highlights);
    }
}
