package guraa.doccompare.comparison;

import guraa.doccompare.model.difference.DiffResult;
import guraa.doccompare.visual.MergedDocument;
import lombok.Value;

import java.util.Map;

/**
 * Result of a side-by-side comparison: the diff, its merged page geometry, its summary and
 * the diff snippet of every changed record.
 */
@Value
public class ComparisonResult {

    DiffResult diffResult;

    MergedDocument mergedDocument;

    DiffSummary summary;

    /**
     * Unified-diff snippets keyed by record index; EQUAL records have none.
     */
    Map<Integer, String> snippets;

    public String getSnippet(int recordIndex) {
        return snippets.getOrDefault(recordIndex, "");
    }
}
