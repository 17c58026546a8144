package guraa.doccompare.service;

import guraa.doccompare.comparison.ImageMatch;
import guraa.doccompare.comparison.MatchAssignment;
import guraa.doccompare.model.BoundingBox;
import guraa.doccompare.model.EmbeddedImage;
import guraa.doccompare.model.Fingerprint;
import guraa.doccompare.model.difference.ChangeOperation;
import guraa.doccompare.model.difference.ImageChange;
import org.junit.jupiter.api.Test;

import java.util.List;

import static guraa.doccompare.DocumentFixtures.image;
import static org.junit.jupiter.api.Assertions.*;

class ImageMatchingServiceTest {

    private static final double THRESHOLD = 0.10;

    private final ImageMatchingService service = new ImageMatchingService();

    /**
     * A 64-bit fingerprint value with the lowest {@code count} bits set.
     */
    private static long bits(int count) {
        return count == 64 ? -1L : (1L << count) - 1;
    }

    @Test
    void identicalImageIsEqualAndExtraImageIsInserted() {
        List<EmbeddedImage> base = List.of(image("p1_img1.png", 0x0f0f0f0f0f0f0f0fL, 0));
        List<EmbeddedImage> compare = List.of(
                image("p1_img1.png", 0x0f0f0f0f0f0f0f0fL, 0),
                image("p1_img2.png", 0xf0f0f0f0f0f0f0f0L, 1));

        List<ImageChange> changes = service.compareImages(0, base, compare, THRESHOLD);

        assertEquals(2, changes.size());
        assertEquals(ChangeOperation.EQUAL, changes.get(0).getOperation());
        assertEquals(0, changes.get(0).getHammingDistance());
        assertEquals(ChangeOperation.INSERT, changes.get(1).getOperation());
        assertEquals(1, changes.get(1).getCompareImageIndex());
        assertNull(changes.get(1).getBaseLocation());
    }

    @Test
    void thresholdIsInclusiveOfFlooredDistance() {
        List<EmbeddedImage> base = List.of(image("a", 0L, 0), image("b", 0L, 1));
        List<EmbeddedImage> compare = List.of(image("c", bits(6), 0), image("d", -1L, 1));

        MatchAssignment assignment = service.match(base, compare, THRESHOLD);

        assertEquals(1, assignment.getMatches().size());
        assertEquals(6, assignment.getMatches().get(0).getHammingDistance());
        assertEquals(List.of(1), assignment.getUnmatchedBase());
        assertEquals(List.of(1), assignment.getUnmatchedCompare());

        MatchAssignment strict = service.match(List.of(image("a", 0L, 0)), List.of(image("c", bits(7), 0)), THRESHOLD);
        assertTrue(strict.getMatches().isEmpty());
    }

    @Test
    void cheapestPairsAreAssignedFirst() {
        List<EmbeddedImage> base = List.of(image("a0", 0L, 0), image("a1", bits(1), 1));
        List<EmbeddedImage> compare = List.of(image("b0", bits(3), 0), image("b1", bits(1), 1));

        MatchAssignment assignment = service.match(base, compare, THRESHOLD);

        assertEquals(List.of(new ImageMatch(0, 0, 3, 64), new ImageMatch(1, 1, 0, 64)), assignment.getMatches());
    }

    @Test
    void tiesGoToTheLowestIndices() {
        List<EmbeddedImage> base = List.of(image("a0", bits(1), 0), image("a1", bits(1), 1));
        List<EmbeddedImage> compare = List.of(image("b0", 0L, 0));

        MatchAssignment assignment = service.match(base, compare, THRESHOLD);

        assertEquals(List.of(new ImageMatch(0, 0, 1, 64)), assignment.getMatches());
        assertEquals(List.of(1), assignment.getUnmatchedBase());
    }

    @Test
    void matchingIsSymmetric() {
        List<EmbeddedImage> base = List.of(image("a0", 0L, 0), image("a1", bits(5), 1), image("a2", -1L, 2));
        List<EmbeddedImage> compare = List.of(image("b0", bits(4), 0), image("b1", bits(1), 1));

        MatchAssignment forward = service.match(base, compare, THRESHOLD);
        MatchAssignment backward = service.match(compare, base, THRESHOLD);

        assertEquals(backward, forward.inverse());
    }

    @Test
    void imagesWithoutComparableFingerprintsAreNeverMatched() {
        EmbeddedImage narrow = EmbeddedImage.withFingerprint("narrow", Fingerprint.fromHex("00"),
                BoundingBox.of(0, 0, 10, 10));
        EmbeddedImage missing = EmbeddedImage.builder().name("missing").bounds(BoundingBox.of(0, 0, 10, 10)).build();

        List<ImageChange> changes = service.compareImages(0, List.of(narrow, missing),
                List.of(image("wide", 0L, 0)), THRESHOLD);

        assertEquals(2, changes.stream().filter(change -> change.getOperation() == ChangeOperation.DELETE).count());
        assertEquals(1, changes.stream().filter(change -> change.getOperation() == ChangeOperation.INSERT).count());
    }

    @Test
    void nearDuplicateIsReplaceWithScaledSimilarity() {
        List<ImageChange> changes = service.compareImages(0, List.of(image("a", 0L, 0)),
                List.of(image("b", bits(4), 0)), THRESHOLD);

        assertEquals(1, changes.size());
        assertEquals(ChangeOperation.REPLACE, changes.get(0).getOperation());
        assertEquals(1.0 - 4.0 / 64.0, changes.get(0).getSimilarity(), 1e-9);
    }
}
