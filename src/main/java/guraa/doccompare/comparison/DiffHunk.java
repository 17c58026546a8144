package guraa.doccompare.comparison;

import lombok.Value;

import java.util.List;

/**
 * A group of non-equal runs plus the equal context around them, like a unified-diff hunk.
 */
@Value
public class DiffHunk {

    int baseStart;

    int baseEnd;

    int compareStart;

    int compareEnd;

    List<EditRun> runs;

    static DiffHunk of(List<EditRun> runs) {
        EditRun first = runs.get(0);
        EditRun last = runs.get(runs.size() - 1);
        return new DiffHunk(first.getBaseStart(), last.getBaseEnd(),
                first.getCompareStart(), last.getCompareEnd(), List.copyOf(runs));
    }
}
