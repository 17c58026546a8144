package guraa.doccompare.comparison;

import lombok.Value;

/**
 * A matched pair of images and the Hamming distance between their fingerprints.
 */
@Value
public class ImageMatch {

    int baseIndex;

    int compareIndex;

    int hammingDistance;

    int bitWidth;
}
