package guraa.doccompare.comparison;

import com.fasterxml.jackson.annotation.JsonIgnore;
import guraa.doccompare.model.difference.ChangeOperation;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered runs of EQUAL / INSERT / DELETE / REPLACE that turn one token sequence into another.
 */
@Value
public class EditScript {

    List<EditRun> runs;

    int baseLength;

    int compareLength;

    /**
     * True when the aligner had to fall back (input too large) or found nothing in common.
     */
    boolean degraded;

    public EditScript(List<EditRun> runs, int baseLength, int compareLength, boolean degraded) {
        this.runs = List.copyOf(runs);
        this.baseLength = baseLength;
        this.compareLength = compareLength;
        this.degraded = degraded;
    }

    /**
     * Number of tokens covered by EQUAL runs.
     *
     * @return The matched token count
     */
    @JsonIgnore
    public int getMatchedTokens() {
        return runs.stream()
                .filter(run -> run.getOperation() == ChangeOperation.EQUAL)
                .mapToInt(EditRun::getBaseLength)
                .sum();
    }

    /**
     * Matched tokens over the longer sequence; 1.0 when both sequences are empty.
     *
     * @return The similarity in [0,1]
     */
    public double similarity() {
        int longest = Math.max(baseLength, compareLength);
        if (longest == 0) {
            return 1.0;
        }
        return (double) getMatchedTokens() / longest;
    }

    @JsonIgnore
    public boolean isIdentical() {
        return runs.stream().noneMatch(EditRun::isChange);
    }

    /**
     * Group the non-equal runs into hunks with the given number of context tokens on each side.
     * Hunks whose context would overlap are merged.
     *
     * @param context The number of equal tokens to keep around each change
     * @return The hunks, empty when the sequences are identical
     */
    public List<DiffHunk> hunks(int context) {
        int ctx = Math.max(0, context);
        List<DiffHunk> hunks = new ArrayList<>();
        int n = runs.size();
        int i = 0;

        while (i < n) {
            if (!runs.get(i).isChange()) {
                i++;
                continue;
            }

            List<EditRun> hunkRuns = new ArrayList<>();
            if (i > 0) {
                EditRun lead = runs.get(i - 1).tail(ctx);
                if (lead != null) {
                    hunkRuns.add(lead);
                }
            }

            int k = i;
            while (k < n) {
                EditRun run = runs.get(k);
                if (run.isChange()) {
                    hunkRuns.add(run);
                    k++;
                    continue;
                }
                boolean changeFollows = k + 1 < n;
                if (changeFollows && run.getBaseLength() <= 2 * ctx) {
                    hunkRuns.add(run);
                    k++;
                    continue;
                }
                EditRun trail = run.head(ctx);
                if (trail != null) {
                    hunkRuns.add(trail);
                }
                k++;
                break;
            }

            hunks.add(DiffHunk.of(hunkRuns));
            i = k;
        }
        return hunks;
    }
}
