package guraa.doccompare.comparison;

import guraa.doccompare.model.difference.ChangeOperation;
import guraa.doccompare.service.TextAligner;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EditScriptTest {

    private final TextAligner aligner = new TextAligner();

    private static List<String> numbered(int count) {
        List<String> tokens = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            tokens.add("t" + i);
        }
        return tokens;
    }

    private static List<String> replaced(List<String> tokens, int... positions) {
        List<String> copy = new ArrayList<>(tokens);
        for (int position : positions) {
            copy.set(position, "x" + position);
        }
        return copy;
    }

    @Test
    void hunkKeepsContextAroundChange() {
        List<String> base = numbered(20);
        EditScript script = aligner.align(base, replaced(base, 10));

        List<DiffHunk> hunks = script.hunks(3);

        assertEquals(1, hunks.size());
        DiffHunk hunk = hunks.get(0);
        assertEquals(7, hunk.getBaseStart());
        assertEquals(14, hunk.getBaseEnd());
        assertEquals(7, hunk.getCompareStart());
        assertEquals(14, hunk.getCompareEnd());
        assertEquals(ChangeOperation.REPLACE, hunk.getRuns().get(1).getOperation());
    }

    @Test
    void distantChangesGiveSeparateHunks() {
        List<String> base = numbered(20);
        EditScript script = aligner.align(base, replaced(base, 5, 15));

        List<DiffHunk> hunks = script.hunks(3);

        assertEquals(2, hunks.size());
        assertEquals(2, hunks.get(0).getBaseStart());
        assertEquals(9, hunks.get(0).getBaseEnd());
        assertEquals(12, hunks.get(1).getBaseStart());
        assertEquals(19, hunks.get(1).getBaseEnd());
    }

    @Test
    void closeChangesShareOneHunk() {
        List<String> base = numbered(20);
        EditScript script = aligner.align(base, replaced(base, 5, 9));

        List<DiffHunk> hunks = script.hunks(3);

        assertEquals(1, hunks.size());
        assertEquals(2, hunks.get(0).getBaseStart());
        assertEquals(13, hunks.get(0).getBaseEnd());
    }

    @Test
    void zeroContextHunksHoldOnlyChanges() {
        List<String> base = numbered(6);
        EditScript script = aligner.align(base, replaced(base, 2));

        List<DiffHunk> hunks = script.hunks(0);

        assertEquals(1, hunks.size());
        assertEquals(1, hunks.get(0).getRuns().size());
        assertEquals(2, hunks.get(0).getBaseStart());
        assertEquals(3, hunks.get(0).getBaseEnd());
    }

    @Test
    void matchedTokensCountEqualRunsOnly() {
        List<String> base = numbered(10);
        EditScript script = aligner.align(base, replaced(base, 0, 9));

        assertEquals(8, script.getMatchedTokens());
        assertEquals(0.8, script.similarity(), 1e-9);
        assertFalse(script.isIdentical());
    }
}
