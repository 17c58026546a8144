package guraa.doccompare.service;

import guraa.doccompare.comparison.PageDiff;
import guraa.doccompare.model.BoundingBox;
import guraa.doccompare.model.Document;
import guraa.doccompare.model.EmbeddedImage;
import guraa.doccompare.model.Fingerprint;
import guraa.doccompare.model.Page;
import guraa.doccompare.model.Table;
import guraa.doccompare.model.TextBlock;
import guraa.doccompare.model.difference.ChangeRecord;
import guraa.doccompare.model.difference.DiffResult;
import guraa.doccompare.model.difference.ElementKind;
import guraa.doccompare.model.difference.ImageChange;
import guraa.doccompare.model.difference.TableChange;
import guraa.doccompare.model.difference.TableChangeScope;
import guraa.doccompare.model.difference.TextChange;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class DiffAssemblerTest {

    private final DiffAssembler assembler = new DiffAssembler();

    private static Document document(String label, int pages) {
        Document.DocumentBuilder builder = Document.builder().label(label);
        for (int i = 0; i < pages; i++) {
            builder.page(Page.builder().index(i).width(612).height(792).build());
        }
        return builder.build();
    }

    @Test
    void recordsAreOrderedByPageThenPositionThenKind() {
        TextBlock lower = TextBlock.of("second", BoundingBox.of(0, 50, 100, 10), 0);
        TextBlock upper = TextBlock.of("first", BoundingBox.of(0, 10, 100, 10), 0);
        TextBlock nextPage = TextBlock.of("next", BoundingBox.of(0, 5, 100, 10), 1);
        Table table = Table.of(BoundingBox.of(0, 20, 100, 10), new String[]{"cell"});

        PageDiff page0 = new PageDiff(0,
                List.of(TextChange.deleted(0, 0, lower, lower.getTokens()),
                        TextChange.deleted(0, 1, upper, upper.getTokens())),
                List.of(TableChange.cellDeleted(0, 0, table, 0, 0, List.of("cell"), TableChangeScope.TABLE)),
                List.of(ImageChange.deleted(0, 0, EmbeddedImage.withFingerprint("img", Fingerprint.fromLong(0L), BoundingBox.of(0, 50, 20, 20)))));
        PageDiff page1 = new PageDiff(1, List.of(TextChange.inserted(1, 0, nextPage, nextPage.getTokens())),
                List.of(), List.of());

        DiffResult result = assembler.assemble(document("a", 2), document("b", 2), List.of(page1, page0));

        List<String> order = result.getRecords().stream()
                .map(record -> record.getPageIndex() + ":" + record.getKind() + "@" + (int) record.getTop())
                .collect(Collectors.toList());
        assertEquals(List.of("0:TEXT@10", "0:TABLE@20", "0:TEXT@50", "0:IMAGE@50", "1:TEXT@5"), order);
        assertEquals("a", result.getBaseLabel());
        assertEquals(2, result.getComparePageCount());
    }

    @Test
    void tiesKeepExtractionOrder() {
        TextBlock first = TextBlock.of("one", BoundingBox.of(0, 30, 50, 10), 0);
        TextBlock second = TextBlock.of("two", BoundingBox.of(60, 30, 50, 10), 0);
        PageDiff page = new PageDiff(0,
                List.of(TextChange.deleted(0, 0, first, first.getTokens()),
                        TextChange.deleted(0, 1, second, second.getTokens())),
                List.of(), List.of());

        DiffResult result = assembler.assemble(document("a", 1), document("b", 1), List.of(page));

        List<ChangeRecord> records = result.recordsOfKind(ElementKind.TEXT);
        assertEquals("one", ((TextChange) records.get(0)).getBaseText());
        assertEquals("two", ((TextChange) records.get(1)).getBaseText());
    }
}
