package guraa.doccompare.util;

import guraa.doccompare.comparison.DiffSummary;
import guraa.doccompare.model.difference.ChangeOperation;
import guraa.doccompare.model.difference.ChangeRecord;
import guraa.doccompare.model.difference.DiffResult;
import guraa.doccompare.model.difference.ElementKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utility class for logging comparison results
 */
public final class DiffResultLogger {
    private static final Logger logger = LoggerFactory.getLogger(DiffResultLogger.class);

    private static final int MAX_LOGGED_PAGES = 5;

    private DiffResultLogger() {
    }

    /**
     * Log the statistics of a diff result
     * @param result The diff result
     */
    public static void logDifferenceStatistics(DiffResult result) {
        if (result == null) {
            logger.warn("Cannot log statistics for null result");
            return;
        }

        DiffSummary summary = DiffSummary.of(result);
        logger.info("==== Document Comparison Statistics ====");
        logger.info("Total records: {}, changes: {}", summary.getTotalRecords(), summary.getChangedRecords());
        for (ElementKind kind : ElementKind.values()) {
            logger.info("{}: {} equal, {} inserted, {} deleted, {} replaced", kind,
                    summary.count(kind, ChangeOperation.EQUAL), summary.count(kind, ChangeOperation.INSERT),
                    summary.count(kind, ChangeOperation.DELETE), summary.count(kind, ChangeOperation.REPLACE));
        }
        logger.info("Base page count: {}, Compare page count: {}",
                result.getBasePageCount(), result.getComparePageCount());
        logger.info("Overall similarity: {}", String.format("%.3f", summary.getOverallSimilarity()));

        int logged = 0;
        for (int pageIndex : summary.getChangedPages()) {
            if (logged++ >= MAX_LOGGED_PAGES) {
                break;
            }
            long pageChanges = result.recordsOnPage(pageIndex).stream().filter(ChangeRecord::isChange).count();
            logger.info("Page {}: {} changes", pageIndex, pageChanges);
        }
        logger.info("========================================");
    }
}
