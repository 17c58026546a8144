package guraa.doccompare.service;

import guraa.doccompare.comparison.PageDiff;
import guraa.doccompare.config.ComparisonOptions;
import guraa.doccompare.model.Page;
import guraa.doccompare.model.difference.ImageChange;
import guraa.doccompare.model.difference.TableChange;
import guraa.doccompare.model.difference.TextChange;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Service for comparing one page index of two documents.
 * Runs the text, table and image comparisons of the page and bundles their records.
 */
@Slf4j
@Service
public class PageComparisonService {

    private final TextComparisonService textComparisonService;
    private final TableComparisonService tableComparisonService;
    private final ImageMatchingService imageMatchingService;

    public PageComparisonService(TextComparisonService textComparisonService,
                                 TableComparisonService tableComparisonService,
                                 ImageMatchingService imageMatchingService) {
        this.textComparisonService = textComparisonService;
        this.tableComparisonService = tableComparisonService;
        this.imageMatchingService = imageMatchingService;
    }

    /**
     * Compare a page pair. Either page may be null when one document is shorter; its
     * counterpart's elements are then all reported as deleted or inserted.
     *
     * @param pageIndex   The page index
     * @param basePage    The page of document A, or null
     * @param comparePage The page of document B, or null
     * @param options     The comparison options
     * @return The records of the page
     */
    public PageDiff comparePage(int pageIndex, Page basePage, Page comparePage, ComparisonOptions options) {
        List<TextChange> textChanges = textComparisonService.compareBlocks(pageIndex,
                basePage != null ? basePage.getTextBlocks() : List.of(),
                comparePage != null ? comparePage.getTextBlocks() : List.of(),
                options);

        List<TableChange> tableChanges = tableComparisonService.compareTables(pageIndex,
                basePage != null ? basePage.getTables() : List.of(),
                comparePage != null ? comparePage.getTables() : List.of(),
                options);

        List<ImageChange> imageChanges = imageMatchingService.compareImages(pageIndex,
                basePage != null ? basePage.getImages() : List.of(),
                comparePage != null ? comparePage.getImages() : List.of(),
                options.getImageSimilarityThreshold());

        PageDiff pageDiff = new PageDiff(pageIndex, textChanges, tableChanges, imageChanges);
        log.debug("Page {} compared: {} records", pageIndex, pageDiff.getRecordCount());
        return pageDiff;
    }
}
