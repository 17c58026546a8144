package guraa.doccompare.service;

import guraa.doccompare.comparison.AlignedPair;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UnitAlignerTest {

    private final UnitAligner aligner = new UnitAligner(new TextAligner());

    @Test
    void identicalUnitsAreAnchored() {
        List<List<String>> units = List.of(List.of("a", "b"), List.of("c"), List.of());

        List<AlignedPair> pairs = aligner.align(units, units, 0.5);

        assertEquals(List.of(
                AlignedPair.matched(0, 0, 1.0),
                AlignedPair.matched(1, 1, 1.0),
                AlignedPair.matched(2, 2, 1.0)), pairs);
    }

    @Test
    void insertedUnitBetweenAnchors() {
        List<List<String>> base = List.of(List.of("a", "b"), List.of("c", "d"));
        List<List<String>> compare = List.of(List.of("a", "b"), List.of("x", "y"), List.of("c", "d"));

        List<AlignedPair> pairs = aligner.align(base, compare, 0.5);

        assertEquals(List.of(
                AlignedPair.matched(0, 0, 1.0),
                AlignedPair.compareOnly(1),
                AlignedPair.matched(1, 2, 1.0)), pairs);
    }

    @Test
    void similarUnitIsMatchedAboveThreshold() {
        List<List<String>> base = List.of(List.of("brand", "acme"));
        List<List<String>> compare = List.of(List.of("brand", "acme", "pro"));

        List<AlignedPair> matched = aligner.align(base, compare, 0.6);
        assertEquals(1, matched.size());
        assertTrue(matched.get(0).isMatched());
        assertEquals(2.0 / 3.0, matched.get(0).getSimilarity(), 1e-9);

        List<AlignedPair> split = aligner.align(base, compare, 0.7);
        assertEquals(List.of(AlignedPair.baseOnly(0), AlignedPair.compareOnly(0)), split);
    }

    @Test
    void gapPairsUnitsWithTheMostInCommon() {
        List<List<String>> base = List.of(List.of("x", "y", "z"));
        List<List<String>> compare = List.of(List.of("q"), List.of("x", "y", "w"));

        List<AlignedPair> pairs = aligner.align(base, compare, 0.5);

        assertEquals(2, pairs.size());
        assertEquals(AlignedPair.compareOnly(0), pairs.get(0));
        assertEquals(0, pairs.get(1).getBaseIndex());
        assertEquals(1, pairs.get(1).getCompareIndex());
    }

    @Test
    void raisingTheThresholdNeverAddsMatches() {
        List<List<String>> base = List.of(
                List.of("item", "price", "qty"),
                List.of("bolt", "m6", "0.10", "100"),
                List.of("nut", "m6", "0.05", "200"),
                List.of("washer", "0.02", "500"));
        List<List<String>> compare = List.of(
                List.of("item", "price", "qty"),
                List.of("bolt", "m6", "0.12", "100"),
                List.of("nut", "m8", "0.07", "150"),
                List.of("spring", "washer", "0.03", "500"),
                List.of("rivet", "0.20", "50"));

        long previous = Long.MAX_VALUE;
        for (double threshold = 0.0; threshold <= 1.0; threshold += 0.1) {
            List<AlignedPair> pairs = aligner.align(base, compare, threshold);
            long matched = pairs.stream().filter(AlignedPair::isMatched).count();
            assertTrue(matched <= previous, "threshold " + threshold);
            previous = matched;

            assertEquals(base.size(), pairs.stream().filter(pair -> pair.getBaseIndex() >= 0).count());
            assertEquals(compare.size(), pairs.stream().filter(pair -> pair.getCompareIndex() >= 0).count());
        }
    }
}
