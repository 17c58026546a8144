package guraa.doccompare.service;

import guraa.doccompare.comparison.PageDiff;
import guraa.doccompare.model.Document;
import guraa.doccompare.model.difference.ChangeRecord;
import guraa.doccompare.model.difference.DiffResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Merges the per-page record streams into one {@link DiffResult}.
 * Records are ordered by page, then by the top edge of their primary location, then
 * text before tables before images. The sort is stable, so ties keep extraction order.
 */
@Component
public class DiffAssembler {

    static final Comparator<ChangeRecord> READING_ORDER = Comparator
            .comparingInt(ChangeRecord::getPageIndex)
            .thenComparingDouble(ChangeRecord::getTop)
            .thenComparing(ChangeRecord::getKind);

    public DiffResult assemble(Document base, Document compare, Collection<PageDiff> pageDiffs) {
        List<PageDiff> pages = new ArrayList<>(pageDiffs);
        pages.sort(Comparator.comparingInt(PageDiff::getPageIndex));

        List<ChangeRecord> records = new ArrayList<>();
        for (PageDiff page : pages) {
            records.addAll(page.getTextChanges());
            records.addAll(page.getTableChanges());
            records.addAll(page.getImageChanges());
        }
        records.sort(READING_ORDER);

        return new DiffResult(base.getLabel(), compare.getLabel(),
                base.getPageCount(), compare.getPageCount(), records);
    }
}
