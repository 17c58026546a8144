package guraa.doccompare;

import guraa.doccompare.comparison.ComparisonResult;
import guraa.doccompare.comparison.DiffSummary;
import guraa.doccompare.comparison.PageDiff;
import guraa.doccompare.config.ComparisonOptions;
import guraa.doccompare.config.ComparisonProperties;
import guraa.doccompare.exception.PartialResultException;
import guraa.doccompare.exception.StructuralMismatchException;
import guraa.doccompare.model.Document;
import guraa.doccompare.model.EmbeddedImage;
import guraa.doccompare.model.Page;
import guraa.doccompare.model.TextBlock;
import guraa.doccompare.model.difference.DiffResult;
import guraa.doccompare.service.CoverageVerifier;
import guraa.doccompare.service.DiffAssembler;
import guraa.doccompare.service.ImageMatchingService;
import guraa.doccompare.service.PageComparisonService;
import guraa.doccompare.service.TableComparisonService;
import guraa.doccompare.service.TextComparisonService;
import guraa.doccompare.util.CoordinateTransformer;
import guraa.doccompare.util.DiffResultLogger;
import guraa.doccompare.util.EditScriptFormatter;
import guraa.doccompare.visual.MergedDocument;
import guraa.doccompare.visual.PageMerger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Main entry point for comparing two extracted documents.
 *
 * <p>Every page index is compared by its own task on the page comparison executor, with at most
 * {@code parallelism} tasks in flight. The engine waits for all of them before assembling the
 * result; if any page fails, times out or is cancelled the whole comparison fails with a
 * {@link PartialResultException} naming the pages.
 */
@Slf4j
@Component
public class DocumentComparisonEngine {

    private final PageComparisonService pageComparisonService;
    private final DiffAssembler diffAssembler;
    private final CoverageVerifier coverageVerifier;
    private final PageMerger pageMerger;
    private final ComparisonOptions defaultOptions;
    private final ExecutorService executorService;

    public DocumentComparisonEngine(PageComparisonService pageComparisonService,
                                    DiffAssembler diffAssembler,
                                    CoverageVerifier coverageVerifier,
                                    PageMerger pageMerger,
                                    ComparisonOptions defaultOptions,
                                    ExecutorService executorService) {
        this.pageComparisonService = pageComparisonService;
        this.diffAssembler = diffAssembler;
        this.coverageVerifier = coverageVerifier;
        this.pageMerger = pageMerger;
        this.defaultOptions = defaultOptions;
        this.executorService = executorService;
    }

    /**
     * Constructor used by Spring, with defaults taken from the application properties.
     *
     * @param pageComparisonService The per-page comparison service
     * @param diffAssembler         The assembler merging per-page records
     * @param coverageVerifier      The verifier for the exactly-once coverage of elements
     * @param pageMerger            The side-by-side page merger
     * @param properties            The comparison properties
     * @param executorService       The executor running page comparisons
     */
    @Autowired
    public DocumentComparisonEngine(PageComparisonService pageComparisonService,
                                    DiffAssembler diffAssembler,
                                    CoverageVerifier coverageVerifier,
                                    PageMerger pageMerger,
                                    ComparisonProperties properties,
                                    @Qualifier("pageComparisonExecutor") ExecutorService executorService) {
        this(pageComparisonService, diffAssembler, coverageVerifier, pageMerger, properties.toOptions(),
                executorService);
    }

    /**
     * Engine with the default services and options running on the given executor.
     *
     * @param executorService The executor running page comparisons
     */
    public DocumentComparisonEngine(ExecutorService executorService) {
        this(new PageComparisonService(new TextComparisonService(), new TableComparisonService(),
                        new ImageMatchingService()),
                new DiffAssembler(), new CoverageVerifier(), new PageMerger(new CoordinateTransformer()),
                ComparisonOptions.defaults(), executorService);
    }

    public ComparisonOptions getDefaultOptions() {
        return defaultOptions;
    }

    public DiffResult compare(Document base, Document compare)
            throws StructuralMismatchException, PartialResultException {
        return compare(base, compare, defaultOptions);
    }

    /**
     * Compare two documents.
     *
     * @param base    Document A
     * @param compare Document B
     * @param options The options for this comparison
     * @return The diff result, records in page and reading order
     * @throws StructuralMismatchException If a document has no pages or is inconsistent, or the options are invalid
     * @throws PartialResultException      If one or more pages could not be compared
     */
    public DiffResult compare(Document base, Document compare, ComparisonOptions options)
            throws StructuralMismatchException, PartialResultException {
        validate(base, compare, options);

        String logPrefix = "[" + base.getLabel() + " vs " + compare.getLabel() + "] ";
        long startTime = System.currentTimeMillis();
        log.info(logPrefix + "Starting comparison: {} vs {} pages", base.getPageCount(), compare.getPageCount());

        List<PageDiff> pageDiffs = comparePages(base, compare, options, logPrefix);

        DiffResult result = diffAssembler.assemble(base, compare, pageDiffs);
        coverageVerifier.verify(base, compare, result);

        log.info(logPrefix + "Completed comparison in {}ms: {} records, {} changes",
                System.currentTimeMillis() - startTime, result.getRecords().size(), result.getChanges().size());
        if (log.isDebugEnabled()) {
            DiffResultLogger.logDifferenceStatistics(result);
        }
        return result;
    }

    public ComparisonResult compareSideBySide(Document base, Document compare)
            throws StructuralMismatchException, PartialResultException {
        return compareSideBySide(base, compare, defaultOptions);
    }

    /**
     * Compare two documents and build their side-by-side geometry.
     *
     * @param base    Document A
     * @param compare Document B
     * @param options The options for this comparison
     * @return The diff result with its merged pages, summary and change snippets
     * @throws StructuralMismatchException If a document has no pages or is inconsistent, or the options are invalid
     * @throws PartialResultException      If one or more pages could not be compared
     */
    public ComparisonResult compareSideBySide(Document base, Document compare, ComparisonOptions options)
            throws StructuralMismatchException, PartialResultException {
        DiffResult result = compare(base, compare, options);
        MergedDocument merged = pageMerger.merge(base, compare, result, options.isHighlightEnabled());
        return new ComparisonResult(result, merged, DiffSummary.of(result),
                EditScriptFormatter.formatChanges(result, options.getMaxSnippetLines()));
    }

    /**
     * Fan out one task per page index and wait for all of them.
     */
    private List<PageDiff> comparePages(Document base, Document compare, ComparisonOptions options,
                                        String logPrefix) throws PartialResultException {
        int pageCount = Math.max(base.getPageCount(), compare.getPageCount());
        Semaphore semaphore = new Semaphore(options.getParallelism());
        Map<Integer, CompletableFuture<PageDiff>> futures = new TreeMap<>();
        Map<Integer, Throwable> failures = new TreeMap<>();

        try {
            for (int i = 0; i < pageCount; i++) {
                final int pageIndex = i;
                if (!semaphore.tryAcquire(options.getPageTimeoutSeconds(), TimeUnit.SECONDS)) {
                    failures.put(pageIndex, new TimeoutException("No worker became free for page " + pageIndex));
                    break;
                }
                try {
                    futures.put(pageIndex, CompletableFuture.supplyAsync(() -> {
                        try {
                            PageDiff pageDiff = pageComparisonService.comparePage(pageIndex,
                                    base.getPage(pageIndex), compare.getPage(pageIndex), options);
                            log.debug(logPrefix + "Completed page {}/{}", pageIndex + 1, pageCount);
                            return pageDiff;
                        } finally {
                            semaphore.release();
                        }
                    }, executorService));
                } catch (RejectedExecutionException e) {
                    semaphore.release();
                    failures.put(pageIndex, e);
                    break;
                }
            }

            List<PageDiff> pageDiffs = new ArrayList<>(pageCount);
            for (Map.Entry<Integer, CompletableFuture<PageDiff>> entry : futures.entrySet()) {
                if (!failures.isEmpty()) {
                    break;
                }
                try {
                    pageDiffs.add(entry.getValue().get(options.getPageTimeoutSeconds(), TimeUnit.SECONDS));
                } catch (ExecutionException e) {
                    failures.put(entry.getKey(), e.getCause());
                } catch (TimeoutException | CancellationException e) {
                    failures.put(entry.getKey(), e);
                }
            }

            if (failures.isEmpty()) {
                return pageDiffs;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error(logPrefix + "Interrupted while waiting for page comparisons");
            for (Map.Entry<Integer, CompletableFuture<PageDiff>> entry : futures.entrySet()) {
                if (!entry.getValue().isDone() || entry.getValue().isCompletedExceptionally()) {
                    failures.put(entry.getKey(), e);
                }
            }
            if (failures.isEmpty()) {
                // every submitted page finished; blame the page the caller was about to submit
                failures.put(Math.min(futures.size(), pageCount - 1), e);
            }
        }

        // Cancel what is still running and report every page without a result.
        for (Map.Entry<Integer, CompletableFuture<PageDiff>> entry : futures.entrySet()) {
            CompletableFuture<PageDiff> future = entry.getValue();
            if (!future.isDone()) {
                future.cancel(true);
                failures.putIfAbsent(entry.getKey(), new CancellationException("Cancelled after another page failed"));
            } else if (future.isCompletedExceptionally()) {
                failures.putIfAbsent(entry.getKey(), causeOf(future));
            }
        }
        for (int i = futures.size(); i < pageCount; i++) {
            failures.putIfAbsent(i, new CancellationException("Page was not submitted"));
        }

        List<Integer> failedPages = new ArrayList<>(failures.keySet());
        Throwable firstCause = failures.values().iterator().next();
        log.error(logPrefix + "Comparison failed for pages {}: {}", failedPages, firstCause.getMessage(), firstCause);
        PartialResultException exception = new PartialResultException(
                "Comparison failed for " + failedPages.size() + " page(s): " + failedPages, failedPages, firstCause);
        failures.values().stream()
                .filter(cause -> cause != firstCause)
                .distinct()
                .forEach(exception::addSuppressed);
        throw exception;
    }

    private static Throwable causeOf(CompletableFuture<PageDiff> future) {
        try {
            future.join();
            return new IllegalStateException("Page future completed normally");
        } catch (CancellationException e) {
            return e;
        } catch (RuntimeException e) {
            return e.getCause() != null ? e.getCause() : e;
        }
    }

    private static void validate(Document base, Document compare, ComparisonOptions options)
            throws StructuralMismatchException {
        if (base == null || compare == null) {
            throw new IllegalArgumentException("Documents must not be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("Options must not be null");
        }
        validateOptions(options);
        validateDocument(base);
        validateDocument(compare);
    }

    private static void validateDocument(Document document) throws StructuralMismatchException {
        if (document.getPageCount() == 0) {
            throw new StructuralMismatchException("Document " + document.getLabel() + " has no pages");
        }
        for (int i = 0; i < document.getPageCount(); i++) {
            Page page = document.getPages().get(i);
            if (page.getIndex() != i) {
                throw new StructuralMismatchException("Document " + document.getLabel() + ": page at position "
                        + i + " has index " + page.getIndex(), i);
            }
            for (TextBlock block : page.getTextBlocks()) {
                if (block.getPageIndex() != i) {
                    throw new StructuralMismatchException("Document " + document.getLabel() + ": text block on page "
                            + i + " claims page " + block.getPageIndex(), i);
                }
            }
            for (EmbeddedImage image : page.getImages()) {
                if (!image.isFingerprintable()) {
                    throw new StructuralMismatchException("Document " + document.getLabel() + ": image "
                            + image.getName() + " on page " + i + " has neither pixels nor a fingerprint", i);
                }
            }
        }
    }

    private static void validateOptions(ComparisonOptions options) throws StructuralMismatchException {
        if (options.getNormalization() == null) {
            throw new StructuralMismatchException("Normalization policy must be set");
        }
        checkFraction("rowSimilarityThreshold", options.getRowSimilarityThreshold());
        checkFraction("blockSimilarityThreshold", options.getBlockSimilarityThreshold());
        checkFraction("imageSimilarityThreshold", options.getImageSimilarityThreshold());
        checkFraction("replaceLengthRatio", options.getReplaceLengthRatio());
        if (options.getContextSize() < 0) {
            throw new StructuralMismatchException("contextSize must not be negative: " + options.getContextSize());
        }
        if (options.getParallelism() < 1) {
            throw new StructuralMismatchException("parallelism must be at least 1: " + options.getParallelism());
        }
        if (options.getPageTimeoutSeconds() < 1) {
            throw new StructuralMismatchException("pageTimeoutSeconds must be positive: "
                    + options.getPageTimeoutSeconds());
        }
        if (options.getMaxSnippetLines() < 0) {
            throw new StructuralMismatchException("maxSnippetLines must not be negative: "
                    + options.getMaxSnippetLines());
        }
        if (options.getMaxAlignmentCells() < 1) {
            throw new StructuralMismatchException("maxAlignmentCells must be positive: "
                    + options.getMaxAlignmentCells());
        }
    }

    private static void checkFraction(String name, double value) throws StructuralMismatchException {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new StructuralMismatchException(name + " must be between 0 and 1: " + value);
        }
    }
}
