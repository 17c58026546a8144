package guraa.doccompare.comparison;

import lombok.Value;

/**
 * One step of a unit alignment (text blocks or table rows).
 * An index of -1 means the unit exists on the other side only.
 */
@Value
public class AlignedPair {

    int baseIndex;

    int compareIndex;

    double similarity;

    public static AlignedPair matched(int baseIndex, int compareIndex, double similarity) {
        return new AlignedPair(baseIndex, compareIndex, similarity);
    }

    public static AlignedPair baseOnly(int baseIndex) {
        return new AlignedPair(baseIndex, -1, 0.0);
    }

    public static AlignedPair compareOnly(int compareIndex) {
        return new AlignedPair(-1, compareIndex, 0.0);
    }

    public boolean isMatched() {
        return baseIndex >= 0 && compareIndex >= 0;
    }
}
