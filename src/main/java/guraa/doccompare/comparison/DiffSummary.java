package guraa.doccompare.comparison;

import guraa.doccompare.model.difference.ChangeOperation;
import guraa.doccompare.model.difference.ChangeRecord;
import guraa.doccompare.model.difference.DiffResult;
import guraa.doccompare.model.difference.ElementKind;
import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Statistics of a diff result, plus a short rule-based description of it.
 */
@Value
public class DiffSummary {

    String baseLabel;

    String compareLabel;

    int totalRecords;

    int changedRecords;

    /**
     * Record counts per element kind and operation.
     */
    Map<ElementKind, Map<ChangeOperation, Integer>> counts;

    /**
     * Page indices with at least one non-EQUAL record, ascending.
     */
    List<Integer> changedPages;

    /**
     * Mean record similarity; 1.0 for a result without records.
     */
    double overallSimilarity;

    public static DiffSummary of(DiffResult result) {
        Map<ElementKind, Map<ChangeOperation, Integer>> counts = new EnumMap<>(ElementKind.class);
        for (ElementKind kind : ElementKind.values()) {
            Map<ChangeOperation, Integer> perOperation = new EnumMap<>(ChangeOperation.class);
            for (ChangeOperation operation : ChangeOperation.values()) {
                perOperation.put(operation, (int) result.count(kind, operation));
            }
            counts.put(kind, Collections.unmodifiableMap(perOperation));
        }

        List<ChangeRecord> changes = result.getChanges();
        List<Integer> changedPages = changes.stream()
                .map(ChangeRecord::getPageIndex)
                .distinct()
                .sorted()
                .collect(Collectors.toUnmodifiableList());

        double similarity = result.getRecords().stream()
                .mapToDouble(ChangeRecord::getSimilarity)
                .average()
                .orElse(1.0);

        return new DiffSummary(result.getBaseLabel(), result.getCompareLabel(),
                result.getRecords().size(), changes.size(),
                Collections.unmodifiableMap(counts), changedPages, similarity);
    }

    public int count(ElementKind kind, ChangeOperation operation) {
        return counts.get(kind).get(operation);
    }

    public int count(ChangeOperation operation) {
        return counts.values().stream().mapToInt(perOperation -> perOperation.get(operation)).sum();
    }

    public int changes(ElementKind kind) {
        return counts.get(kind).entrySet().stream()
                .filter(entry -> entry.getKey().isChange())
                .mapToInt(Map.Entry::getValue)
                .sum();
    }

    /**
     * One or two sentences describing the result, used when no summarizer is available.
     *
     * @return The description
     */
    public String describe() {
        if (changedRecords == 0) {
            return String.format(Locale.ROOT, "No differences found between %s and %s.", baseLabel, compareLabel);
        }
        return String.format(Locale.ROOT,
                "Found %d change(s) on %d page(s) between %s and %s: %d text, %d table, %d image. "
                        + "%d inserted, %d deleted, %d replaced; overall similarity %.2f.",
                changedRecords, changedPages.size(), baseLabel, compareLabel,
                changes(ElementKind.TEXT), changes(ElementKind.TABLE), changes(ElementKind.IMAGE),
                count(ChangeOperation.INSERT), count(ChangeOperation.DELETE), count(ChangeOperation.REPLACE),
                overallSimilarity);
    }
}
