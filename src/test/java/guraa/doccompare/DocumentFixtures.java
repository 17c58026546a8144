package guraa.doccompare;

import guraa.doccompare.model.BoundingBox;
import guraa.doccompare.model.Document;
import guraa.doccompare.model.EmbeddedImage;
import guraa.doccompare.model.Fingerprint;
import guraa.doccompare.model.Page;
import guraa.doccompare.model.Table;
import guraa.doccompare.model.TextBlock;

/**
 * Small documents shared by the tests.
 */
public final class DocumentFixtures {

    public static final double PAGE_WIDTH = 612;
    public static final double PAGE_HEIGHT = 792;

    private DocumentFixtures() {
    }

    public static BoundingBox line(int lineNumber) {
        return BoundingBox.of(72, 72 + lineNumber * 20, 400, 14);
    }

    public static TextBlock block(String text, int pageIndex, int lineNumber) {
        return TextBlock.of(text, line(lineNumber), pageIndex);
    }

    /**
     * A document with one page per entry, each page holding one block per line of its entry.
     */
    public static Document textDocument(String label, String... pageTexts) {
        Document.DocumentBuilder builder = Document.builder().label(label);
        for (int p = 0; p < pageTexts.length; p++) {
            Page.PageBuilder page = Page.builder().index(p).width(PAGE_WIDTH).height(PAGE_HEIGHT);
            String[] lines = pageTexts[p].split("\n");
            for (int l = 0; l < lines.length; l++) {
                if (!lines[l].isBlank()) {
                    page.textBlock(block(lines[l], p, l));
                }
            }
            builder.page(page.build());
        }
        return builder.build();
    }

    public static Document tableDocument(String label, Table table) {
        return Document.builder()
                .label(label)
                .page(Page.builder().index(0).width(PAGE_WIDTH).height(PAGE_HEIGHT).table(table).build())
                .build();
    }

    public static EmbeddedImage image(String name, long fingerprint, int slot) {
        return EmbeddedImage.withFingerprint(name, Fingerprint.fromLong(fingerprint),
                BoundingBox.of(72 + slot * 150, 400, 120, 90));
    }
}
