package guraa.doccompare.service;

import guraa.doccompare.model.Document;
import guraa.doccompare.model.Page;
import guraa.doccompare.model.Table;
import guraa.doccompare.model.difference.ChangeRecord;
import guraa.doccompare.model.difference.DiffResult;
import guraa.doccompare.model.difference.DocumentSide;
import guraa.doccompare.model.difference.ElementRef;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Checks that every text block, table cell and image of both documents is covered by exactly
 * one change record, and that no record points at an element that does not exist.
 */
@Component
public class CoverageVerifier {

    /**
     * Verify a result against its source documents.
     *
     * @param base    Document A
     * @param compare Document B
     * @param result  The assembled result
     * @throws IllegalStateException If an element is missing, duplicated or unknown
     */
    public void verify(Document base, Document compare, DiffResult result) {
        Set<ElementRef> expected = new LinkedHashSet<>();
        collect(base, DocumentSide.BASE, expected);
        collect(compare, DocumentSide.COMPARE, expected);

        Set<ElementRef> seen = new HashSet<>();
        for (ChangeRecord record : result.getRecords()) {
            for (ElementRef ref : record.getElementRefs()) {
                if (!expected.contains(ref)) {
                    throw new IllegalStateException("Record references unknown element " + ref);
                }
                if (!seen.add(ref)) {
                    throw new IllegalStateException("Element reported more than once: " + ref);
                }
            }
        }

        if (seen.size() != expected.size()) {
            expected.removeAll(seen);
            throw new IllegalStateException(expected.size() + " element(s) not reported, first: "
                    + expected.iterator().next());
        }
    }

    private static void collect(Document document, DocumentSide side, Set<ElementRef> refs) {
        for (Page page : document.getPages()) {
            int pageIndex = page.getIndex();
            for (int i = 0; i < page.getTextBlocks().size(); i++) {
                refs.add(ElementRef.text(side, pageIndex, i));
            }
            for (int t = 0; t < page.getTables().size(); t++) {
                Table table = page.getTables().get(t);
                if (table.getCellCount() == 0) {
                    refs.add(ElementRef.cell(side, pageIndex, t, -1, -1));
                    continue;
                }
                for (int row = 0; row < table.getRowCount(); row++) {
                    for (int col = 0; col < table.getRows().get(row).size(); col++) {
                        refs.add(ElementRef.cell(side, pageIndex, t, row, col));
                    }
                }
            }
            for (int i = 0; i < page.getImages().size(); i++) {
                refs.add(ElementRef.image(side, pageIndex, i));
            }
        }
    }
}
