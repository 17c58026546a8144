package guraa.doccompare.service;

import guraa.doccompare.comparison.ImageMatch;
import guraa.doccompare.comparison.MatchAssignment;
import guraa.doccompare.model.EmbeddedImage;
import guraa.doccompare.model.Fingerprint;
import guraa.doccompare.model.difference.ImageChange;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Service for matching the embedded images of a page pair by perceptual fingerprint.
 *
 * <p>Candidate pairs are accepted when their Hamming distance is at most
 * {@code floor(threshold * bitWidth)}. Pairs are then assigned greedily in ascending
 * (distance, base index, compare index) order.
 */
@Slf4j
@Service
public class ImageMatchingService {

    /**
     * Match two lists of images.
     *
     * @param baseImages    The images of document A's page
     * @param compareImages The images of document B's page
     * @param threshold     The largest accepted distance as a fraction of the fingerprint width
     * @return The assignment; every image is either matched once or listed as unmatched
     */
    public MatchAssignment match(List<EmbeddedImage> baseImages, List<EmbeddedImage> compareImages, double threshold) {
        List<ImageMatch> candidates = new ArrayList<>();
        for (int i = 0; i < baseImages.size(); i++) {
            Fingerprint base = baseImages.get(i).getFingerprint();
            if (base == null) {
                log.debug("Base image {} has no fingerprint and cannot be matched", baseImages.get(i).getName());
                continue;
            }
            for (int j = 0; j < compareImages.size(); j++) {
                Fingerprint compare = compareImages.get(j).getFingerprint();
                if (compare == null) {
                    continue;
                }
                if (compare.getBitWidth() != base.getBitWidth()) {
                    log.warn("Fingerprint widths differ ({} vs {}) for images {} and {}, not comparing",
                            base.getBitWidth(), compare.getBitWidth(),
                            baseImages.get(i).getName(), compareImages.get(j).getName());
                    continue;
                }
                int distance = base.hammingDistance(compare);
                int limit = (int) Math.floor(threshold * base.getBitWidth());
                if (distance <= limit) {
                    candidates.add(new ImageMatch(i, j, distance, base.getBitWidth()));
                }
            }
        }

        candidates.sort(Comparator.comparingInt(ImageMatch::getHammingDistance)
                .thenComparingInt(ImageMatch::getBaseIndex)
                .thenComparingInt(ImageMatch::getCompareIndex));

        boolean[] baseUsed = new boolean[baseImages.size()];
        boolean[] compareUsed = new boolean[compareImages.size()];
        List<ImageMatch> matches = new ArrayList<>();
        for (ImageMatch candidate : candidates) {
            if (baseUsed[candidate.getBaseIndex()] || compareUsed[candidate.getCompareIndex()]) {
                continue;
            }
            baseUsed[candidate.getBaseIndex()] = true;
            compareUsed[candidate.getCompareIndex()] = true;
            matches.add(candidate);
        }

        return new MatchAssignment(matches, unused(baseUsed), unused(compareUsed));
    }

    /**
     * Compare the images of one page index and turn the assignment into change records.
     *
     * @param pageIndex     The page index
     * @param baseImages    The images of document A's page
     * @param compareImages The images of document B's page
     * @param threshold     The largest accepted distance as a fraction of the fingerprint width
     * @return One record per match and per unmatched image
     */
    public List<ImageChange> compareImages(int pageIndex, List<EmbeddedImage> baseImages,
                                           List<EmbeddedImage> compareImages, double threshold) {
        MatchAssignment assignment = match(baseImages, compareImages, threshold);

        List<ImageChange> changes = new ArrayList<>();
        for (ImageMatch match : assignment.getMatches()) {
            changes.add(ImageChange.matched(pageIndex,
                    match.getBaseIndex(), baseImages.get(match.getBaseIndex()),
                    match.getCompareIndex(), compareImages.get(match.getCompareIndex()),
                    match.getHammingDistance(), match.getBitWidth()));
        }
        for (int index : assignment.getUnmatchedBase()) {
            changes.add(ImageChange.deleted(pageIndex, index, baseImages.get(index)));
        }
        for (int index : assignment.getUnmatchedCompare()) {
            changes.add(ImageChange.inserted(pageIndex, index, compareImages.get(index)));
        }

        log.debug("Page {}: {} images matched, {} removed, {} added", pageIndex,
                assignment.getMatches().size(), assignment.getUnmatchedBase().size(),
                assignment.getUnmatchedCompare().size());
        return changes;
    }

    private static List<Integer> unused(boolean[] used) {
        List<Integer> indices = new ArrayList<>();
        for (int i = 0; i < used.length; i++) {
            if (!used[i]) {
                indices.add(i);
            }
        }
        return indices;
    }
}
