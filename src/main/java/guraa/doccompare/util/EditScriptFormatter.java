package guraa.doccompare.util;

import guraa.doccompare.comparison.DiffHunk;
import guraa.doccompare.comparison.EditRun;
import guraa.doccompare.model.difference.ChangeRecord;
import guraa.doccompare.model.difference.ChangeRecordVisitor;
import guraa.doccompare.model.difference.DiffResult;
import guraa.doccompare.model.difference.ImageChange;
import guraa.doccompare.model.difference.TableChange;
import guraa.doccompare.model.difference.TextChange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Formats change records as unified-diff style snippets, one token per line.
 */
public final class EditScriptFormatter {

    public static final String TRUNCATION_MARKER = "... (diff truncated) ...";

    private EditScriptFormatter() {
    }

    /**
     * Format a record as a snippet.
     *
     * @param record   The record
     * @param maxLines The maximum number of lines before the snippet is truncated
     * @return The snippet lines joined by newlines; empty for EQUAL records
     */
    public static String format(ChangeRecord record, int maxLines) {
        if (!record.isChange()) {
            return "";
        }
        List<String> lines = record.accept(new ChangeRecordVisitor<List<String>>() {
            @Override
            public List<String> visitText(TextChange change) {
                return lines(change.getBaseTokens(), change.getCompareTokens(), change.getHunks());
            }

            @Override
            public List<String> visitTable(TableChange change) {
                return lines(change.getBaseTokens(), change.getCompareTokens(), change.getHunks());
            }

            @Override
            public List<String> visitImage(ImageChange change) {
                return imageLines(change);
            }
        });
        return String.join("\n", limit(lines, maxLines));
    }

    /**
     * Snippets of every changed record of a result, keyed by the record's index in the result.
     *
     * @param result   The diff result
     * @param maxLines The maximum number of lines per snippet
     * @return The snippets in record order
     */
    public static Map<Integer, String> formatChanges(DiffResult result, int maxLines) {
        Map<Integer, String> snippets = new TreeMap<>();
        List<ChangeRecord> records = result.getRecords();
        for (int i = 0; i < records.size(); i++) {
            if (records.get(i).isChange()) {
                snippets.put(i, format(records.get(i), maxLines));
            }
        }
        return Collections.unmodifiableMap(snippets);
    }

    /**
     * Diff lines for two token sequences. Without hunks the whole of each side is emitted,
     * which is the case for pure insertions and deletions.
     */
    static List<String> lines(List<String> baseTokens, List<String> compareTokens, List<DiffHunk> hunks) {
        List<String> lines = new ArrayList<>();
        if (hunks.isEmpty()) {
            lines.add(header(0, baseTokens.size(), 0, compareTokens.size()));
            baseTokens.forEach(token -> lines.add("-" + token));
            compareTokens.forEach(token -> lines.add("+" + token));
            return lines;
        }

        for (DiffHunk hunk : hunks) {
            lines.add(header(hunk.getBaseStart(), hunk.getBaseEnd() - hunk.getBaseStart(),
                    hunk.getCompareStart(), hunk.getCompareEnd() - hunk.getCompareStart()));
            for (EditRun run : hunk.getRuns()) {
                switch (run.getOperation()) {
                    case EQUAL:
                        for (int i = run.getBaseStart(); i < run.getBaseEnd(); i++) {
                            lines.add(" " + baseTokens.get(i));
                        }
                        break;
                    case DELETE:
                        for (int i = run.getBaseStart(); i < run.getBaseEnd(); i++) {
                            lines.add("-" + baseTokens.get(i));
                        }
                        break;
                    case INSERT:
                        for (int j = run.getCompareStart(); j < run.getCompareEnd(); j++) {
                            lines.add("+" + compareTokens.get(j));
                        }
                        break;
                    default:
                        for (int i = run.getBaseStart(); i < run.getBaseEnd(); i++) {
                            lines.add("-" + baseTokens.get(i));
                        }
                        for (int j = run.getCompareStart(); j < run.getCompareEnd(); j++) {
                            lines.add("+" + compareTokens.get(j));
                        }
                        break;
                }
            }
        }
        return lines;
    }

    /**
     * Unified-diff hunk header; starts are 1-based, or 0 for an empty range.
     */
    static String header(int baseStart, int baseLength, int compareStart, int compareLength) {
        return String.format(Locale.ROOT, "@@ -%d,%d +%d,%d @@",
                baseLength > 0 ? baseStart + 1 : baseStart, baseLength,
                compareLength > 0 ? compareStart + 1 : compareStart, compareLength);
    }

    /**
     * Keep the first and last halves of an over-long snippet around a truncation marker.
     */
    static List<String> limit(List<String> lines, int maxLines) {
        if (maxLines <= 0 || lines.size() <= maxLines) {
            return lines;
        }
        int head = maxLines / 2;
        int tail = maxLines - head;
        List<String> limited = new ArrayList<>(maxLines + 1);
        limited.addAll(lines.subList(0, head));
        limited.add(TRUNCATION_MARKER);
        limited.addAll(lines.subList(lines.size() - tail, lines.size()));
        return limited;
    }

    private static List<String> imageLines(ImageChange change) {
        List<String> lines = new ArrayList<>();
        if (change.getBaseName() != null) {
            lines.add("-" + change.getBaseName());
        }
        if (change.getCompareName() != null) {
            lines.add("+" + change.getCompareName());
        }
        if (change.getHammingDistance() >= 0) {
            lines.add(String.format(Locale.ROOT, " distance %d/%d", change.getHammingDistance(), change.getBitWidth()));
        }
        return lines;
    }
}
