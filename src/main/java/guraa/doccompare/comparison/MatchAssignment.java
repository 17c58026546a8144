package guraa.doccompare.comparison;

import lombok.Value;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Partial bijection between the images of one page in A and the same page in B.
 * Matches are ordered by base index; unmatched indices are ascending.
 */
@Value
public class MatchAssignment {

    List<ImageMatch> matches;

    List<Integer> unmatchedBase;

    List<Integer> unmatchedCompare;

    public MatchAssignment(List<ImageMatch> matches, List<Integer> unmatchedBase, List<Integer> unmatchedCompare) {
        this.matches = matches.stream()
                .sorted(Comparator.comparingInt(ImageMatch::getBaseIndex))
                .collect(Collectors.toUnmodifiableList());
        this.unmatchedBase = unmatchedBase.stream().sorted().collect(Collectors.toUnmodifiableList());
        this.unmatchedCompare = unmatchedCompare.stream().sorted().collect(Collectors.toUnmodifiableList());
    }

    /**
     * The same assignment seen from the other document.
     *
     * @return The assignment with base and compare roles swapped
     */
    public MatchAssignment inverse() {
        List<ImageMatch> swapped = matches.stream()
                .map(match -> new ImageMatch(match.getCompareIndex(), match.getBaseIndex(),
                        match.getHammingDistance(), match.getBitWidth()))
                .collect(Collectors.toList());
        return new MatchAssignment(swapped, unmatchedCompare, unmatchedBase);
    }
}
