package guraa.doccompare.visual;

import guraa.doccompare.model.Document;
import guraa.doccompare.model.Page;
import guraa.doccompare.model.difference.ChangeOperation;
import guraa.doccompare.model.difference.ChangeRecord;
import guraa.doccompare.model.difference.DiffResult;
import guraa.doccompare.model.difference.DocumentSide;
import guraa.doccompare.model.difference.SourceLocation;
import guraa.doccompare.util.CoordinateTransformer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the side-by-side geometry of two documents.
 *
 * <p>For every page index the two pages are scaled to the height of the taller one, keeping
 * their aspect ratio, and placed next to each other: document A on the left, document B on the
 * right. A document without a page at an index gets a blank placement the size of its
 * counterpart.
 */
@Slf4j
@Component
public class PageMerger {

    private final CoordinateTransformer coordinateTransformer;

    public PageMerger(CoordinateTransformer coordinateTransformer) {
        this.coordinateTransformer = coordinateTransformer;
    }

    /**
     * Merge two documents page by page.
     *
     * @param base      Document A
     * @param compare   Document B
     * @param result    The diff result of the two documents
     * @param highlight Whether to project the changes onto the merged pages
     * @return The merged document
     */
    public MergedDocument merge(Document base, Document compare, DiffResult result, boolean highlight) {
        int pageCount = Math.max(base.getPageCount(), compare.getPageCount());

        List<List<Highlight>> highlights = new ArrayList<>(pageCount);
        for (int i = 0; i < pageCount; i++) {
            highlights.add(new ArrayList<>());
        }

        List<MergedPage> pages = new ArrayList<>(pageCount);
        List<PagePlacement[]> placements = new ArrayList<>(pageCount);
        for (int i = 0; i < pageCount; i++) {
            placements.add(place(base.getPage(i), compare.getPage(i)));
        }

        if (highlight) {
            List<ChangeRecord> records = result.getRecords();
            for (int k = 0; k < records.size(); k++) {
                ChangeRecord record = records.get(k);
                if (!record.isChange()) {
                    continue;
                }
                if (record.getOperation() != ChangeOperation.INSERT) {
                    addHighlight(highlights, placements, record, k, DocumentSide.BASE, record.getBaseLocation());
                }
                if (record.getOperation() != ChangeOperation.DELETE) {
                    addHighlight(highlights, placements, record, k, DocumentSide.COMPARE, record.getCompareLocation());
                }
            }
        }

        for (int i = 0; i < pageCount; i++) {
            PagePlacement[] pair = placements.get(i);
            double width = pair[0].getWidth() + pair[1].getWidth();
            double height = Math.max(pair[0].getHeight(), pair[1].getHeight());
            pages.add(new MergedPage(i, width, height, pair[0], pair[1], highlights.get(i)));
        }

        MergedDocument merged = new MergedDocument(base.getLabel(), compare.getLabel(), pages);
        log.debug("Merged {} pages with {} highlights", merged.getPageCount(), merged.getHighlightCount());
        return merged;
    }

    /**
     * Place a page pair; at least one of the pages is present.
     */
    private PagePlacement[] place(Page basePage, Page comparePage) {
        double baseWidth = basePage != null ? basePage.getWidth() : comparePage.getWidth();
        double baseHeight = basePage != null ? basePage.getHeight() : comparePage.getHeight();
        double compareWidth = comparePage != null ? comparePage.getWidth() : basePage.getWidth();
        double compareHeight = comparePage != null ? comparePage.getHeight() : basePage.getHeight();

        double height = Math.max(baseHeight, compareHeight);
        double baseScale = scaleTo(height, baseHeight);
        double compareScale = scaleTo(height, compareHeight);

        PagePlacement left = new PagePlacement(DocumentSide.BASE, basePage != null,
                0, 0, baseScale, baseWidth * baseScale, baseHeight * baseScale);
        PagePlacement right = new PagePlacement(DocumentSide.COMPARE, comparePage != null,
                left.getWidth(), 0, compareScale, compareWidth * compareScale, compareHeight * compareScale);
        return new PagePlacement[]{left, right};
    }

    private static double scaleTo(double target, double height) {
        return height > 0 ? target / height : 1.0;
    }

    private void addHighlight(List<List<Highlight>> highlights, List<PagePlacement[]> placements,
                              ChangeRecord record, int recordIndex, DocumentSide side, SourceLocation location) {
        if (location == null || location.getBounds() == null) {
            return;
        }
        int pageIndex = location.getPageIndex();
        if (pageIndex < 0 || pageIndex >= placements.size()) {
            log.warn("Record {} points at page {} outside the merged document", recordIndex, pageIndex);
            return;
        }
        PagePlacement placement = placements.get(pageIndex)[side == DocumentSide.BASE ? 0 : 1];
        highlights.get(pageIndex).add(new Highlight(side, record.getOperation(), record.getKind(),
                coordinateTransformer.pageRectToMerged(location.getBounds(), placement), recordIndex));
    }
}
