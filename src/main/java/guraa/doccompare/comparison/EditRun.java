package guraa.doccompare.comparison;

import com.fasterxml.jackson.annotation.JsonIgnore;
import guraa.doccompare.model.difference.ChangeOperation;
import lombok.Value;

/**
 * A maximal run of one edit operation over half-open token ranges of both sequences.
 */
@Value
public class EditRun {

    ChangeOperation operation;

    int baseStart;

    int baseEnd;

    int compareStart;

    int compareEnd;

    /**
     * 1 for EQUAL runs, 0 for INSERT and DELETE, shared tokens over the longer side for REPLACE.
     */
    double similarity;

    public static EditRun equal(int baseStart, int baseEnd, int compareStart, int compareEnd) {
        return new EditRun(ChangeOperation.EQUAL, baseStart, baseEnd, compareStart, compareEnd, 1.0);
    }

    public static EditRun delete(int baseStart, int baseEnd, int comparePosition) {
        return new EditRun(ChangeOperation.DELETE, baseStart, baseEnd, comparePosition, comparePosition, 0.0);
    }

    public static EditRun insert(int basePosition, int compareStart, int compareEnd) {
        return new EditRun(ChangeOperation.INSERT, basePosition, basePosition, compareStart, compareEnd, 0.0);
    }

    public static EditRun replace(int baseStart, int baseEnd, int compareStart, int compareEnd, double similarity) {
        return new EditRun(ChangeOperation.REPLACE, baseStart, baseEnd, compareStart, compareEnd, similarity);
    }

    @JsonIgnore
    public int getBaseLength() {
        return baseEnd - baseStart;
    }

    @JsonIgnore
    public int getCompareLength() {
        return compareEnd - compareStart;
    }

    @JsonIgnore
    public boolean isChange() {
        return operation.isChange();
    }

    /**
     * First tokens of an EQUAL run, used as trailing context.
     *
     * @param count The number of tokens to keep
     * @return The shortened run, or null when count is 0
     */
    EditRun head(int count) {
        int kept = Math.min(count, getBaseLength());
        if (kept <= 0) {
            return null;
        }
        return equal(baseStart, baseStart + kept, compareStart, compareStart + kept);
    }

    /**
     * Last tokens of an EQUAL run, used as leading context.
     *
     * @param count The number of tokens to keep
     * @return The shortened run, or null when count is 0
     */
    EditRun tail(int count) {
        int kept = Math.min(count, getBaseLength());
        if (kept <= 0) {
            return null;
        }
        return equal(baseEnd - kept, baseEnd, compareEnd - kept, compareEnd);
    }
}
