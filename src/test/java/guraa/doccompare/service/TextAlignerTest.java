package guraa.doccompare.service;

import guraa.doccompare.comparison.EditRun;
import guraa.doccompare.comparison.EditScript;
import guraa.doccompare.model.difference.ChangeOperation;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class TextAlignerTest {

    private final TextAligner aligner = new TextAligner();

    private static List<String> tokens(String text) {
        return text.isEmpty() ? List.of() : List.of(text.split(" "));
    }

    private static List<ChangeOperation> operations(EditScript script) {
        return script.getRuns().stream().map(EditRun::getOperation).collect(Collectors.toList());
    }

    @Test
    void identicalSequencesGiveOneEqualRun() {
        EditScript script = aligner.align(tokens("width 10mm"), tokens("width 10mm"));

        assertEquals(List.of(ChangeOperation.EQUAL), operations(script));
        assertTrue(script.isIdentical());
        assertFalse(script.isDegraded());
        assertEquals(1.0, script.similarity());
        assertTrue(script.hunks(3).isEmpty());
    }

    @Test
    void emptySequences() {
        EditScript both = aligner.align(List.of(), List.of());
        assertTrue(both.getRuns().isEmpty());
        assertEquals(1.0, both.similarity());

        EditScript inserted = aligner.align(List.of(), tokens("a b"));
        assertEquals(List.of(ChangeOperation.INSERT), operations(inserted));
        assertFalse(inserted.isDegraded());
        assertEquals(0.0, inserted.similarity());
    }

    @Test
    void comparableDeleteAndInsertCoalesceIntoReplace() {
        EditScript script = aligner.align(tokens("the quick brown fox"), tokens("the slow brown fox"));

        assertEquals(List.of(ChangeOperation.EQUAL, ChangeOperation.REPLACE, ChangeOperation.EQUAL),
                operations(script));
        EditRun replace = script.getRuns().get(1);
        assertEquals(1, replace.getBaseStart());
        assertEquals(2, replace.getBaseEnd());
        assertEquals(1, replace.getCompareStart());
        assertEquals(2, replace.getCompareEnd());
        assertEquals(0.75, script.similarity(), 1e-9);
    }

    @Test
    void unbalancedChangeStaysDeleteThenInsert() {
        EditScript script = aligner.align(tokens("a b c"), tokens("a x y z c"));

        assertEquals(List.of(ChangeOperation.EQUAL, ChangeOperation.DELETE, ChangeOperation.INSERT,
                ChangeOperation.EQUAL), operations(script));
        assertEquals(0.4, script.similarity(), 1e-9);
    }

    @Test
    void longestEqualRunWinsOverEarlierShortMatch() {
        EditScript script = aligner.align(tokens("a b c"), tokens("a x a b c"));

        assertEquals(List.of(ChangeOperation.INSERT, ChangeOperation.EQUAL), operations(script));
        EditRun equal = script.getRuns().get(1);
        assertEquals(0, equal.getBaseStart());
        assertEquals(3, equal.getBaseEnd());
        assertEquals(2, equal.getCompareStart());
        assertEquals(5, equal.getCompareEnd());
        assertEquals(3.0 / 5.0, script.similarity(), 1e-9);
    }

    @Test
    void longestRunIsSkippedWhenItCostsMatches() {
        // "r s t" is the longest common run, but "a b c d" keeps one token more
        EditScript script = aligner.align(tokens("r s t a b c d"), tokens("a q b q c q d q r s t"));

        assertEquals(4.0 / 11.0, script.similarity(), 1e-9);
        assertEquals(ChangeOperation.DELETE, script.getRuns().get(0).getOperation());
        assertEquals(3, script.getRuns().get(0).getBaseLength());
        assertTrue(script.getRuns().stream()
                .filter(run -> run.getOperation() == ChangeOperation.EQUAL)
                .allMatch(run -> run.getBaseLength() == 1));
    }

    @Test
    void equalRunsOfTheSameLengthGoToTheEarliestPosition() {
        EditScript script = aligner.align(tokens("x"), tokens("x x"));

        assertEquals(List.of(ChangeOperation.EQUAL, ChangeOperation.INSERT), operations(script));
        assertEquals(0, script.getRuns().get(0).getCompareStart());
        assertEquals(1, script.getRuns().get(1).getCompareStart());
    }

    @Test
    void disjointSequencesGiveOneDegradedReplace() {
        EditScript script = aligner.align(tokens("alpha beta"), tokens("gamma"));

        assertEquals(List.of(ChangeOperation.REPLACE), operations(script));
        assertTrue(script.isDegraded());
        assertEquals(0.0, script.similarity());
    }

    @Test
    void oversizedInputFallsBackToPrefixAndSuffix() {
        TextAligner small = new TextAligner(4, TextAligner.DEFAULT_REPLACE_LENGTH_RATIO);

        EditScript script = small.align(tokens("p x s"), tokens("p y z s"));

        assertTrue(script.isDegraded());
        assertEquals(List.of(ChangeOperation.EQUAL, ChangeOperation.REPLACE, ChangeOperation.EQUAL),
                operations(script));
        EditRun replace = script.getRuns().get(1);
        assertEquals(1, replace.getBaseStart());
        assertEquals(2, replace.getBaseEnd());
        assertEquals(1, replace.getCompareStart());
        assertEquals(3, replace.getCompareEnd());
    }

    @Test
    void similarityIsSymmetric() {
        List<String> a = tokens("net weight 250 g per pack");
        List<String> b = tokens("weight 300 g per box");

        assertEquals(aligner.similarity(a, b), aligner.similarity(b, a), 1e-12);
        assertEquals(3.0 / 6.0, aligner.similarity(a, b), 1e-9);
    }

    @Test
    void nullInputIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> aligner.align(null, List.of()));
    }
}
