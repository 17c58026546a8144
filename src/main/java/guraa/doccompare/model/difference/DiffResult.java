package guraa.doccompare.model.difference;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The engine's output: every change record of a comparison, in page and reading order.
 */
@Value
public class DiffResult {

    String baseLabel;

    String compareLabel;

    int basePageCount;

    int comparePageCount;

    List<ChangeRecord> records;

    public DiffResult(String baseLabel, String compareLabel, int basePageCount, int comparePageCount,
                      List<ChangeRecord> records) {
        this.baseLabel = baseLabel;
        this.compareLabel = compareLabel;
        this.basePageCount = basePageCount;
        this.comparePageCount = comparePageCount;
        this.records = List.copyOf(records);
    }

    public long count(ChangeOperation operation) {
        return records.stream().filter(record -> record.getOperation() == operation).count();
    }

    public long count(ElementKind kind, ChangeOperation operation) {
        return records.stream()
                .filter(record -> record.getKind() == kind && record.getOperation() == operation)
                .count();
    }

    public List<ChangeRecord> recordsOfKind(ElementKind kind) {
        return records.stream().filter(record -> record.getKind() == kind).collect(Collectors.toList());
    }

    public List<ChangeRecord> recordsOnPage(int pageIndex) {
        return records.stream().filter(record -> record.getPageIndex() == pageIndex).collect(Collectors.toList());
    }

    @JsonIgnore
    public List<ChangeRecord> getChanges() {
        return records.stream().filter(ChangeRecord::isChange).collect(Collectors.toList());
    }

    /**
     * Check if the two documents were found to be identical.
     *
     * @return true when every record is EQUAL
     */
    @JsonIgnore
    public boolean isIdentical() {
        return records.stream().noneMatch(ChangeRecord::isChange);
    }
}
