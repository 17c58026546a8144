package guraa.doccompare.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the comparison engine (prefix {@code app.comparison}).
 */
@Component
@ConfigurationProperties(prefix = "app.comparison")
public class ComparisonProperties {

    private final Normalization normalization = new Normalization();
    private int contextSize = 3;
    private double rowSimilarityThreshold = 0.6;
    private double blockSimilarityThreshold = 0.5;
    private double imageSimilarityThreshold = 0.10;
    private double replaceLengthRatio = 0.5;
    private long maxAlignmentCells = 4_000_000L;
    private int parallelism = 4;
    private long pageTimeoutSeconds = 120;
    private boolean highlightEnabled = true;
    private int maxSnippetLines = 60;

    /**
     * Build the per-request options from the configured defaults.
     *
     * @return The comparison options
     */
    public ComparisonOptions toOptions() {
        return ComparisonOptions.builder()
                .normalization(NormalizationPolicy.builder()
                        .caseFolding(normalization.isCaseFolding())
                        .collapseWhitespace(normalization.isCollapseWhitespace())
                        .stripPunctuation(normalization.isStripPunctuation())
                        .build())
                .contextSize(contextSize)
                .rowSimilarityThreshold(rowSimilarityThreshold)
                .blockSimilarityThreshold(blockSimilarityThreshold)
                .imageSimilarityThreshold(imageSimilarityThreshold)
                .replaceLengthRatio(replaceLengthRatio)
                .maxAlignmentCells(maxAlignmentCells)
                .parallelism(parallelism)
                .pageTimeoutSeconds(pageTimeoutSeconds)
                .highlightEnabled(highlightEnabled)
                .maxSnippetLines(maxSnippetLines)
                .build();
    }

    public Normalization getNormalization() {
        return normalization;
    }

    public int getContextSize() {
        return contextSize;
    }

    public void setContextSize(int contextSize) {
        this.contextSize = contextSize;
    }

    public double getRowSimilarityThreshold() {
        return rowSimilarityThreshold;
    }

    public void setRowSimilarityThreshold(double rowSimilarityThreshold) {
        this.rowSimilarityThreshold = rowSimilarityThreshold;
    }

    public double getBlockSimilarityThreshold() {
        return blockSimilarityThreshold;
    }

    public void setBlockSimilarityThreshold(double blockSimilarityThreshold) {
        this.blockSimilarityThreshold = blockSimilarityThreshold;
    }

    public double getImageSimilarityThreshold() {
        return imageSimilarityThreshold;
    }

    public void setImageSimilarityThreshold(double imageSimilarityThreshold) {
        this.imageSimilarityThreshold = imageSimilarityThreshold;
    }

    public double getReplaceLengthRatio() {
        return replaceLengthRatio;
    }

    public void setReplaceLengthRatio(double replaceLengthRatio) {
        this.replaceLengthRatio = replaceLengthRatio;
    }

    public long getMaxAlignmentCells() {
        return maxAlignmentCells;
    }

    public void setMaxAlignmentCells(long maxAlignmentCells) {
        this.maxAlignmentCells = maxAlignmentCells;
    }

    public int getParallelism() {
        return parallelism;
    }

    public void setParallelism(int parallelism) {
        this.parallelism = parallelism;
    }

    public long getPageTimeoutSeconds() {
        return pageTimeoutSeconds;
    }

    public void setPageTimeoutSeconds(long pageTimeoutSeconds) {
        this.pageTimeoutSeconds = pageTimeoutSeconds;
    }

    public boolean isHighlightEnabled() {
        return highlightEnabled;
    }

    public void setHighlightEnabled(boolean highlightEnabled) {
        this.highlightEnabled = highlightEnabled;
    }

    public int getMaxSnippetLines() {
        return maxSnippetLines;
    }

    public void setMaxSnippetLines(int maxSnippetLines) {
        this.maxSnippetLines = maxSnippetLines;
    }

    /**
     * Token normalization properties
     */
    public static class Normalization {
        private boolean caseFolding = true;
        private boolean collapseWhitespace = true;
        private boolean stripPunctuation = false;

        public boolean isCaseFolding() {
            return caseFolding;
        }

        public void setCaseFolding(boolean caseFolding) {
            this.caseFolding = caseFolding;
        }

        public boolean isCollapseWhitespace() {
            return collapseWhitespace;
        }

        public void setCollapseWhitespace(boolean collapseWhitespace) {
            this.collapseWhitespace = collapseWhitespace;
        }

        public boolean isStripPunctuation() {
            return stripPunctuation;
        }

        public void setStripPunctuation(boolean stripPunctuation) {
            this.stripPunctuation = stripPunctuation;
        }
    }
}
