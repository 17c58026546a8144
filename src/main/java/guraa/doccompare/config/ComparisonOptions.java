package guraa.doccompare.config;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable settings for one comparison request.
 * Application-wide defaults come from {@link ComparisonProperties}.
 */
@Value
@Builder(toBuilder = true)
public class ComparisonOptions {

    @Builder.Default
    NormalizationPolicy normalization = NormalizationPolicy.defaults();

    /**
     * Equal tokens kept around each change in the reported hunks.
     */
    @Builder.Default
    int contextSize = 3;

    /**
     * Minimum similarity for two table rows to count as matched-but-modified.
     */
    @Builder.Default
    double rowSimilarityThreshold = 0.6;

    /**
     * Minimum similarity for two text blocks to count as matched-but-modified.
     */
    @Builder.Default
    double blockSimilarityThreshold = 0.5;

    /**
     * Largest accepted Hamming distance, as a fraction of the fingerprint width.
     */
    @Builder.Default
    double imageSimilarityThreshold = 0.10;

    /**
     * Shorter over longer length required to report adjacent delete and insert runs as one replace.
     */
    @Builder.Default
    double replaceLengthRatio = 0.5;

    /**
     * Largest LCS table (base tokens times compare tokens) before the aligner falls back.
     */
    @Builder.Default
    long maxAlignmentCells = 4_000_000L;

    /**
     * Maximum number of pages compared at the same time.
     */
    @Builder.Default
    int parallelism = 4;

    @Builder.Default
    long pageTimeoutSeconds = 120;

    @Builder.Default
    boolean highlightEnabled = true;

    /**
     * Lines kept per change snippet; 0 keeps snippets whole.
     */
    @Builder.Default
    int maxSnippetLines = 60;

    public static ComparisonOptions defaults() {
        return ComparisonOptions.builder().build();
    }
}
