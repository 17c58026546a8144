package guraa.doccompare.service;

import guraa.doccompare.comparison.EditRun;
import guraa.doccompare.comparison.EditScript;
import guraa.doccompare.model.difference.ChangeOperation;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * LCS-based aligner for token sequences.
 *
 * <p>Among all minimal scripts the one whose longest equal run is longest is returned, the
 * run nearest the start winning ties; the remaining pieces are resolved the same way.
 * Delete and insert runs that sit between the same two equal runs are coalesced into a single
 * REPLACE when their lengths are comparable.
 */
@Slf4j
public class TextAligner {

    public static final long DEFAULT_MAX_ALIGNMENT_CELLS = 4_000_000L;
    public static final double DEFAULT_REPLACE_LENGTH_RATIO = 0.5;

    private final long maxAlignmentCells;
    private final double replaceLengthRatio;

    public TextAligner() {
        this(DEFAULT_MAX_ALIGNMENT_CELLS, DEFAULT_REPLACE_LENGTH_RATIO);
    }

    public TextAligner(long maxAlignmentCells, double replaceLengthRatio) {
        this.maxAlignmentCells = maxAlignmentCells;
        this.replaceLengthRatio = replaceLengthRatio;
    }

    /**
     * Compute the edit script turning {@code base} into {@code compare}.
     *
     * @param base    The tokens of the base (A) side
     * @param compare The tokens of the compare (B) side
     * @return The edit script; never null
     */
    public EditScript align(List<String> base, List<String> compare) {
        if (base == null || compare == null) {
            throw new IllegalArgumentException("Token sequences must not be null");
        }

        int n = base.size();
        int m = compare.size();
        if (n == 0 && m == 0) {
            return new EditScript(List.of(), 0, 0, false);
        }

        Map<String, Integer> ids = new HashMap<>();
        int[] a = intern(base, ids);
        int[] b = intern(compare, ids);

        if ((long) n * m > maxAlignmentCells) {
            log.warn("Alignment of {} x {} tokens exceeds {} cells, falling back to prefix/suffix matching",
                    n, m, maxAlignmentCells);
            return new EditScript(prefixSuffixRuns(a, b), n, m, true);
        }

        List<EditRun> runs = coalesce(lcsRuns(a, b), a, b);
        boolean disjoint = n > 0 && m > 0 && runs.stream().noneMatch(run -> run.getOperation() == ChangeOperation.EQUAL);
        if (disjoint) {
            log.debug("Token sequences of length {} and {} share no tokens", n, m);
        }
        return new EditScript(runs, n, m, disjoint);
    }

    /**
     * Matched tokens over the longer sequence.
     *
     * @param base    The base tokens
     * @param compare The compare tokens
     * @return The similarity in [0,1], symmetric in its arguments
     */
    public double similarity(List<String> base, List<String> compare) {
        return align(base, compare).similarity();
    }

    private static int[] intern(List<String> tokens, Map<String, Integer> ids) {
        int[] result = new int[tokens.size()];
        for (int i = 0; i < result.length; i++) {
            Integer id = ids.get(tokens.get(i));
            if (id == null) {
                id = ids.size();
                ids.put(tokens.get(i), id);
            }
            result[i] = id;
        }
        return result;
    }

    /**
     * Plain EQUAL / DELETE / INSERT runs of a minimal script. Ranges are split on their longest
     * equal run that some minimal alignment contains, earliest position first, and the pieces on
     * either side are split the same way. Anchors never overlap, so sorting them by base
     * position gives the script.
     */
    private List<EditRun> lcsRuns(int[] a, int[] b) {
        List<int[]> anchors = new ArrayList<>();
        Deque<int[]> pending = new ArrayDeque<>();
        pending.push(new int[]{0, a.length, 0, b.length});
        while (!pending.isEmpty()) {
            splitOnLongestRun(a, b, pending.pop(), pending, anchors);
        }
        anchors.sort(Comparator.comparingInt(anchor -> anchor[0]));

        RunBuilder builder = new RunBuilder();
        int i = 0;
        int j = 0;
        for (int[] anchor : anchors) {
            while (i < anchor[0]) {
                builder.step(ChangeOperation.DELETE, i++, j);
            }
            while (j < anchor[1]) {
                builder.step(ChangeOperation.INSERT, i, j++);
            }
            for (int k = 0; k < anchor[2]; k++) {
                builder.step(ChangeOperation.EQUAL, i++, j++);
            }
        }
        while (i < a.length) {
            builder.step(ChangeOperation.DELETE, i++, j);
        }
        while (j < b.length) {
            builder.step(ChangeOperation.INSERT, i, j++);
        }
        return builder.build();
    }

    /**
     * Find the anchors of one range {baseStart, baseEnd, compareStart, compareEnd}. Anchors are
     * {basePosition, comparePosition, length}.
     */
    private static void splitOnLongestRun(int[] a, int[] b, int[] range, Deque<int[]> pending, List<int[]> anchors) {
        int baseOffset = range[0];
        int compareOffset = range[2];
        int h = range[1] - baseOffset;
        int w = range[3] - compareOffset;
        if (h == 0 || w == 0) {
            return;
        }

        // prefix[x][y]: LCS of the first x and y tokens of the range
        int[][] prefix = new int[h + 1][w + 1];
        for (int x = 1; x <= h; x++) {
            for (int y = 1; y <= w; y++) {
                if (a[baseOffset + x - 1] == b[compareOffset + y - 1]) {
                    prefix[x][y] = prefix[x - 1][y - 1] + 1;
                } else {
                    prefix[x][y] = Math.max(prefix[x - 1][y], prefix[x][y - 1]);
                }
            }
        }
        int total = prefix[h][w];
        if (total == 0) {
            return;
        }

        // suffix[x][y]: LCS of the range from x and y on; run[x][y]: common run starting there
        int[][] suffix = new int[h + 1][w + 1];
        int[][] run = new int[h + 1][w + 1];
        for (int x = h - 1; x >= 0; x--) {
            for (int y = w - 1; y >= 0; y--) {
                if (a[baseOffset + x] == b[compareOffset + y]) {
                    suffix[x][y] = suffix[x + 1][y + 1] + 1;
                    run[x][y] = run[x + 1][y + 1] + 1;
                } else {
                    suffix[x][y] = Math.max(suffix[x + 1][y], suffix[x][y + 1]);
                }
            }
        }

        int bestX = -1;
        int bestY = -1;
        int bestLength = 0;
        for (int x = 0; x < h; x++) {
            for (int y = 0; y < w; y++) {
                if (run[x][y] <= bestLength || prefix[x][y] + suffix[x][y] != total) {
                    continue;
                }
                int length = longestMinimalRun(prefix[x][y], run[x][y], suffix, x, y, total);
                if (length > bestLength) {
                    bestX = x;
                    bestY = y;
                    bestLength = length;
                }
            }
        }

        if (bestLength == 1) {
            forwardWalk(suffix, a, b, baseOffset, compareOffset, h, w, anchors);
            return;
        }
        anchors.add(new int[]{baseOffset + bestX, compareOffset + bestY, bestLength});
        pending.push(new int[]{baseOffset, baseOffset + bestX, compareOffset, compareOffset + bestY});
        pending.push(new int[]{baseOffset + bestX + bestLength, range[1],
                compareOffset + bestY + bestLength, range[3]});
    }

    /**
     * Longest k in [1, maxRun] such that taking k equal steps from (x, y) keeps the alignment
     * minimal. The valid lengths form a prefix of that interval.
     */
    private static int longestMinimalRun(int before, int maxRun, int[][] suffix, int x, int y, int total) {
        int low = 1;
        int high = maxRun;
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (before + mid + suffix[x + mid][y + mid] == total) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return low;
    }

    /**
     * Every minimal alignment of the range has single-token equal runs only: take each equal
     * step as early as possible, deleting before inserting.
     */
    private static void forwardWalk(int[][] suffix, int[] a, int[] b, int baseOffset, int compareOffset,
                                    int h, int w, List<int[]> anchors) {
        int x = 0;
        int y = 0;
        while (x < h && y < w) {
            if (a[baseOffset + x] == b[compareOffset + y]) {
                anchors.add(new int[]{baseOffset + x, compareOffset + y, 1});
                x++;
                y++;
            } else if (suffix[x + 1][y] >= suffix[x][y + 1]) {
                x++;
            } else {
                y++;
            }
        }
    }

    /**
     * Merge every non-equal stretch between two equal runs into either one REPLACE
     * or one DELETE followed by one INSERT.
     */
    private List<EditRun> coalesce(List<EditRun> raw, int[] a, int[] b) {
        boolean hasEqual = raw.stream().anyMatch(run -> run.getOperation() == ChangeOperation.EQUAL);
        List<EditRun> result = new ArrayList<>();

        int i = 0;
        while (i < raw.size()) {
            EditRun run = raw.get(i);
            if (!run.isChange()) {
                result.add(run);
                i++;
                continue;
            }

            int baseStart = run.getBaseStart();
            int compareStart = run.getCompareStart();
            int baseEnd = run.getBaseEnd();
            int compareEnd = run.getCompareEnd();
            while (i < raw.size() && raw.get(i).isChange()) {
                baseEnd = raw.get(i).getBaseEnd();
                compareEnd = raw.get(i).getCompareEnd();
                i++;
            }

            int deleted = baseEnd - baseStart;
            int inserted = compareEnd - compareStart;
            if (deleted > 0 && inserted > 0
                    && (!hasEqual || comparableLengths(deleted, inserted))) {
                double score = (double) sharedTokens(a, baseStart, baseEnd, b, compareStart, compareEnd)
                        / Math.max(deleted, inserted);
                result.add(EditRun.replace(baseStart, baseEnd, compareStart, compareEnd, score));
            } else {
                if (deleted > 0) {
                    result.add(EditRun.delete(baseStart, baseEnd, compareStart));
                }
                if (inserted > 0) {
                    result.add(EditRun.insert(baseEnd, compareStart, compareEnd));
                }
            }
        }
        return result;
    }

    private boolean comparableLengths(int deleted, int inserted) {
        return (double) Math.min(deleted, inserted) / Math.max(deleted, inserted) >= replaceLengthRatio;
    }

    private static int sharedTokens(int[] a, int aStart, int aEnd, int[] b, int bStart, int bEnd) {
        Map<Integer, Integer> counts = new HashMap<>();
        for (int i = aStart; i < aEnd; i++) {
            counts.merge(a[i], 1, Integer::sum);
        }
        int shared = 0;
        for (int j = bStart; j < bEnd; j++) {
            Integer remaining = counts.get(b[j]);
            if (remaining != null && remaining > 0) {
                counts.put(b[j], remaining - 1);
                shared++;
            }
        }
        return shared;
    }

    /**
     * Fallback for inputs too large for the LCS table: common prefix and suffix stay equal,
     * everything in between is one REPLACE.
     */
    private static List<EditRun> prefixSuffixRuns(int[] a, int[] b) {
        int n = a.length;
        int m = b.length;
        int prefix = 0;
        while (prefix < n && prefix < m && a[prefix] == b[prefix]) {
            prefix++;
        }
        int suffix = 0;
        while (suffix < n - prefix && suffix < m - prefix && a[n - 1 - suffix] == b[m - 1 - suffix]) {
            suffix++;
        }

        List<EditRun> runs = new ArrayList<>();
        if (prefix > 0) {
            runs.add(EditRun.equal(0, prefix, 0, prefix));
        }
        int baseEnd = n - suffix;
        int compareEnd = m - suffix;
        if (baseEnd > prefix && compareEnd > prefix) {
            double score = (double) sharedTokens(a, prefix, baseEnd, b, prefix, compareEnd)
                    / Math.max(baseEnd - prefix, compareEnd - prefix);
            runs.add(EditRun.replace(prefix, baseEnd, prefix, compareEnd, score));
        } else if (baseEnd > prefix) {
            runs.add(EditRun.delete(prefix, baseEnd, prefix));
        } else if (compareEnd > prefix) {
            runs.add(EditRun.insert(prefix, prefix, compareEnd));
        }
        if (suffix > 0) {
            runs.add(EditRun.equal(baseEnd, n, compareEnd, m));
        }
        return runs;
    }

    /**
     * Accumulates single-token steps into maximal runs.
     */
    private static class RunBuilder {
        private final List<EditRun> runs = new ArrayList<>();
        private ChangeOperation current;
        private int baseStart;
        private int compareStart;
        private int baseEnd;
        private int compareEnd;

        void step(ChangeOperation operation, int basePosition, int comparePosition) {
            if (operation != current) {
                flush();
                current = operation;
                baseStart = basePosition;
                compareStart = comparePosition;
                baseEnd = basePosition;
                compareEnd = comparePosition;
            }
            if (operation != ChangeOperation.INSERT) {
                baseEnd = basePosition + 1;
            }
            if (operation != ChangeOperation.DELETE) {
                compareEnd = comparePosition + 1;
            }
        }

        List<EditRun> build() {
            flush();
            return runs;
        }

        private void flush() {
            if (current == null) {
                return;
            }
            switch (current) {
                case EQUAL:
                    runs.add(EditRun.equal(baseStart, baseEnd, compareStart, compareEnd));
                    break;
                case DELETE:
                    runs.add(EditRun.delete(baseStart, baseEnd, compareStart));
                    break;
                default:
                    runs.add(EditRun.insert(baseStart, compareStart, compareEnd));
                    break;
            }
            current = null;
        }
    }
}
