package guraa.doccompare.visual;

import guraa.doccompare.model.BoundingBox;
import guraa.doccompare.model.Document;
import guraa.doccompare.model.Page;
import guraa.doccompare.model.TextBlock;
import guraa.doccompare.model.difference.ChangeOperation;
import guraa.doccompare.model.difference.ChangeRecord;
import guraa.doccompare.model.difference.DiffResult;
import guraa.doccompare.model.difference.DocumentSide;
import guraa.doccompare.model.difference.SourceLocation;
import guraa.doccompare.model.difference.TextChange;
import guraa.doccompare.util.CoordinateTransformer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static guraa.doccompare.DocumentFixtures.textDocument;
import static org.junit.jupiter.api.Assertions.*;

class PageMergerTest {

    private final PageMerger merger = new PageMerger(new CoordinateTransformer());

    private static DiffResult result(Document base, Document compare, List<ChangeRecord> records) {
        return new DiffResult(base.getLabel(), compare.getLabel(), base.getPageCount(), compare.getPageCount(), records);
    }

    @Test
    void shorterDocumentIsPaddedWithBlankPages() {
        Document base = textDocument("a.pdf", "one", "two", "three");
        Document compare = textDocument("b.pdf", "one", "two");

        MergedDocument merged = merger.merge(base, compare, result(base, compare, List.of()), true);

        assertEquals(3, merged.getPageCount());
        MergedPage last = merged.getPages().get(2);
        assertTrue(last.getBase().isPresent());
        assertFalse(last.getCompare().isPresent());
        assertEquals(612, last.getCompare().getWidth(), 1e-9);
        assertEquals(792, last.getCompare().getHeight(), 1e-9);
        assertEquals(1224, last.getWidth(), 1e-9);
        assertEquals(792, last.getHeight(), 1e-9);
    }

    @Test
    void pagesAreScaledToTheTallerHeight() {
        Document base = Document.builder().label("a")
                .page(Page.builder().index(0).width(300).height(400).build()).build();
        Document compare = Document.builder().label("b")
                .page(Page.builder().index(0).width(600).height(800).build()).build();

        MergedPage page = merger.merge(base, compare, result(base, compare, List.of()), true).getPages().get(0);

        assertEquals(2.0, page.getBase().getScale(), 1e-9);
        assertEquals(600, page.getBase().getWidth(), 1e-9);
        assertEquals(1.0, page.getCompare().getScale(), 1e-9);
        assertEquals(600, page.getCompare().getOffsetX(), 1e-9);
        assertEquals(1200, page.getWidth(), 1e-9);
        assertEquals(800, page.getHeight(), 1e-9);
    }

    @Test
    void highlightsFollowTheOperation() {
        Document base = textDocument("a", "x");
        Document compare = textDocument("b", "x");
        TextBlock block = TextBlock.of("gone", BoundingBox.of(10, 20, 30, 40), 0);
        TextBlock added = TextBlock.of("new", BoundingBox.of(10, 100, 30, 40), 0);
        List<ChangeRecord> records = List.of(
                TextChange.deleted(0, 0, block, block.getTokens()),
                TextChange.inserted(0, 0, added, added.getTokens()));

        MergedPage page = merger.merge(base, compare, result(base, compare, records), true).getPages().get(0);

        assertEquals(2, page.getHighlights().size());
        Highlight deleted = page.getHighlights().get(0);
        assertEquals(DocumentSide.BASE, deleted.getSide());
        assertEquals(ChangeOperation.DELETE, deleted.getOperation());
        assertEquals(BoundingBox.of(10, 20, 30, 40), deleted.getBounds());

        Highlight inserted = page.getHighlights().get(1);
        assertEquals(DocumentSide.COMPARE, inserted.getSide());
        assertEquals(BoundingBox.of(622, 100, 30, 40), inserted.getBounds());
        assertEquals(1, inserted.getRecordIndex());
    }

    @Test
    void replaceHighlightsBothSidesAndEqualNothing() {
        Document base = textDocument("a", "width 10mm\nsame");
        Document compare = textDocument("b", "width 12mm\nsame");
        TextBlock a = base.getPage(0).getTextBlocks().get(0);
        TextBlock b = compare.getPage(0).getTextBlocks().get(0);
        TextBlock same = base.getPage(0).getTextBlocks().get(1);
        List<ChangeRecord> records = List.of(
                TextChange.builder().operation(ChangeOperation.REPLACE).similarity(0.5)
                        .baseLocation(SourceLocation.of(0, a.getBounds()))
                        .compareLocation(SourceLocation.of(0, b.getBounds()))
                        .baseBlockIndex(0).compareBlockIndex(0).build(),
                TextChange.builder().operation(ChangeOperation.EQUAL).similarity(1.0)
                        .baseLocation(SourceLocation.of(0, same.getBounds()))
                        .compareLocation(SourceLocation.of(0, same.getBounds()))
                        .baseBlockIndex(1).compareBlockIndex(1).build());

        MergedDocument merged = merger.merge(base, compare, result(base, compare, records), true);

        assertEquals(2, merged.getHighlightCount());
        assertEquals(DocumentSide.BASE, merged.getPages().get(0).getHighlights().get(0).getSide());
        assertEquals(DocumentSide.COMPARE, merged.getPages().get(0).getHighlights().get(1).getSide());

        MergedDocument plain = merger.merge(base, compare, result(base, compare, records), false);
        assertEquals(0, plain.getHighlightCount());
    }
}
