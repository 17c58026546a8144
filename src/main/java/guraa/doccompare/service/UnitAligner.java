package guraa.doccompare.service;

import guraa.doccompare.comparison.AlignedPair;
import guraa.doccompare.comparison.EditRun;
import guraa.doccompare.comparison.EditScript;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Aligns sequences of units (text blocks, table rows), each unit being a list of normalized tokens.
 *
 * <p>Units with identical tokens are anchored by an LCS over unit signatures. Units left between
 * two anchors are paired in order so that the total token similarity is maximal. The pairing does
 * not depend on the acceptance threshold; the threshold only decides whether a pair is reported
 * as matched or split into a deletion and an insertion.
 */
@Slf4j
public class UnitAligner {

    /**
     * Largest gap (base units times compare units) paired by dynamic programming.
     */
    static final long MAX_GAP_PAIRS = 10_000L;

    private static final String SIGNATURE_SEPARATOR = "\u001f";

    private final TextAligner textAligner;

    public UnitAligner(TextAligner textAligner) {
        this.textAligner = textAligner;
    }

    /**
     * Align two unit sequences.
     *
     * @param base      The units of document A
     * @param compare   The units of document B
     * @param threshold Minimum similarity for a pair to be reported as matched
     * @return The aligned pairs; every unit of both sides appears exactly once
     */
    public List<AlignedPair> align(List<List<String>> base, List<List<String>> compare, double threshold) {
        List<String> baseSignatures = signatures(base);
        List<String> compareSignatures = signatures(compare);
        EditScript script = textAligner.align(baseSignatures, compareSignatures);

        List<AlignedPair> result = new ArrayList<>(Math.max(base.size(), compare.size()));
        List<EditRun> runs = script.getRuns();
        int i = 0;
        while (i < runs.size()) {
            EditRun run = runs.get(i);
            if (!run.isChange()) {
                for (int k = 0; k < run.getBaseLength(); k++) {
                    result.add(AlignedPair.matched(run.getBaseStart() + k, run.getCompareStart() + k, 1.0));
                }
                i++;
                continue;
            }

            int baseStart = run.getBaseStart();
            int compareStart = run.getCompareStart();
            int baseEnd = run.getBaseEnd();
            int compareEnd = run.getCompareEnd();
            while (i < runs.size() && runs.get(i).isChange()) {
                baseEnd = runs.get(i).getBaseEnd();
                compareEnd = runs.get(i).getCompareEnd();
                i++;
            }
            for (AlignedPair pair : pairGap(base, baseStart, baseEnd, compare, compareStart, compareEnd)) {
                if (!pair.isMatched() || pair.getSimilarity() >= threshold) {
                    result.add(pair);
                } else {
                    result.add(AlignedPair.baseOnly(pair.getBaseIndex()));
                    result.add(AlignedPair.compareOnly(pair.getCompareIndex()));
                }
            }
        }
        return result;
    }

    private static List<String> signatures(List<List<String>> units) {
        return units.stream()
                .map(tokens -> String.join(SIGNATURE_SEPARATOR, tokens))
                .collect(Collectors.toList());
    }

    /**
     * Order-preserving pairing of the units in [baseStart, baseEnd) and [compareStart, compareEnd)
     * that maximises the summed similarity of the pairs.
     */
    private List<AlignedPair> pairGap(List<List<String>> base, int baseStart, int baseEnd,
                                      List<List<String>> compare, int compareStart, int compareEnd) {
        int n = baseEnd - baseStart;
        int m = compareEnd - compareStart;
        List<AlignedPair> pairs = new ArrayList<>(n + m);
        if (n == 0 || m == 0) {
            for (int i = baseStart; i < baseEnd; i++) {
                pairs.add(AlignedPair.baseOnly(i));
            }
            for (int j = compareStart; j < compareEnd; j++) {
                pairs.add(AlignedPair.compareOnly(j));
            }
            return pairs;
        }

        if ((long) n * m > MAX_GAP_PAIRS) {
            log.warn("Gap of {} x {} units is too large to pair optimally, pairing by position", n, m);
            return pairByPosition(base, baseStart, baseEnd, compare, compareStart, compareEnd);
        }

        double[][] similarity = new double[n][m];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < m; j++) {
                similarity[i][j] = textAligner.similarity(base.get(baseStart + i), compare.get(compareStart + j));
            }
        }

        double[][] best = new double[n + 1][m + 1];
        for (int i = n - 1; i >= 0; i--) {
            for (int j = m - 1; j >= 0; j--) {
                double value = Math.max(best[i + 1][j], best[i][j + 1]);
                if (similarity[i][j] > 0) {
                    value = Math.max(value, best[i + 1][j + 1] + similarity[i][j]);
                }
                best[i][j] = value;
            }
        }

        int i = 0;
        int j = 0;
        while (i < n && j < m) {
            if (similarity[i][j] > 0 && best[i][j] == best[i + 1][j + 1] + similarity[i][j]) {
                pairs.add(AlignedPair.matched(baseStart + i, compareStart + j, similarity[i][j]));
                i++;
                j++;
            } else if (best[i][j] == best[i + 1][j]) {
                pairs.add(AlignedPair.baseOnly(baseStart + i));
                i++;
            } else {
                pairs.add(AlignedPair.compareOnly(compareStart + j));
                j++;
            }
        }
        while (i < n) {
            pairs.add(AlignedPair.baseOnly(baseStart + i++));
        }
        while (j < m) {
            pairs.add(AlignedPair.compareOnly(compareStart + j++));
        }
        return pairs;
    }

    private List<AlignedPair> pairByPosition(List<List<String>> base, int baseStart, int baseEnd,
                                             List<List<String>> compare, int compareStart, int compareEnd) {
        List<AlignedPair> pairs = new ArrayList<>();
        int common = Math.min(baseEnd - baseStart, compareEnd - compareStart);
        for (int k = 0; k < common; k++) {
            double score = textAligner.similarity(base.get(baseStart + k), compare.get(compareStart + k));
            if (score > 0) {
                pairs.add(AlignedPair.matched(baseStart + k, compareStart + k, score));
            } else {
                pairs.add(AlignedPair.baseOnly(baseStart + k));
                pairs.add(AlignedPair.compareOnly(compareStart + k));
            }
        }
        for (int i = baseStart + common; i < baseEnd; i++) {
            pairs.add(AlignedPair.baseOnly(i));
        }
        for (int j = compareStart + common; j < compareEnd; j++) {
            pairs.add(AlignedPair.compareOnly(j));
        }
        return pairs;
    }
}
