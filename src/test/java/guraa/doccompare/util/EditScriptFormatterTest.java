package guraa.doccompare.util;

import guraa.doccompare.model.BoundingBox;
import guraa.doccompare.model.TextBlock;
import guraa.doccompare.model.difference.DiffResult;
import guraa.doccompare.model.difference.TextChange;
import guraa.doccompare.service.TextAligner;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EditScriptFormatterTest {

    private static final BoundingBox BOX = BoundingBox.of(0, 0, 100, 10);

    private static TextChange matched(String base, String compare) {
        TextBlock a = TextBlock.of(base, BOX, 0);
        TextBlock b = TextBlock.of(compare, BOX, 0);
        return TextChange.matched(0, 0, a, a.getTokens(), 0, b, b.getTokens(),
                new TextAligner().align(a.getTokens(), b.getTokens()), 3);
    }

    @Test
    void replaceIsShownAsRemovedAndAddedLines() {
        String snippet = EditScriptFormatter.format(matched("the quick brown fox", "the slow brown fox"), 60);

        assertEquals(String.join("\n",
                "@@ -1,4 +1,4 @@",
                " the",
                "-quick",
                "+slow",
                " brown",
                " fox"), snippet);
    }

    @Test
    void deletedBlockListsAllItsTokens() {
        TextBlock block = TextBlock.of("old text", BOX, 0);

        String snippet = EditScriptFormatter.format(TextChange.deleted(0, 0, block, block.getTokens()), 60);

        assertEquals("@@ -1,2 +0,0 @@\n-old\n-text", snippet);
    }

    @Test
    void equalRecordHasNoSnippet() {
        assertEquals("", EditScriptFormatter.format(matched("same", "same"), 60));
    }

    @Test
    void longSnippetKeepsHeadAndTail() {
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            lines.add("l" + i);
        }

        List<String> limited = EditScriptFormatter.limit(lines, 4);

        assertEquals(List.of("l0", "l1", EditScriptFormatter.TRUNCATION_MARKER, "l8", "l9"), limited);
        assertSame(lines, EditScriptFormatter.limit(lines, 10));
    }

    @Test
    void changedRecordsAreKeyedByTheirIndex() {
        TextBlock removed = TextBlock.of("old text", BOX, 0);
        DiffResult result = new DiffResult("a", "b", 1, 1, List.of(
                matched("same", "same"),
                TextChange.deleted(0, 1, removed, removed.getTokens()),
                matched("the quick brown fox", "the slow brown fox")));

        Map<Integer, String> snippets = EditScriptFormatter.formatChanges(result, 3);

        assertEquals(List.of(1, 2), List.copyOf(snippets.keySet()));
        assertEquals("@@ -1,2 +0,0 @@\n-old\n-text", snippets.get(1));
        assertTrue(snippets.get(2).contains(EditScriptFormatter.TRUNCATION_MARKER));
        assertEquals(4, snippets.get(2).split("\n").length);
    }
}
