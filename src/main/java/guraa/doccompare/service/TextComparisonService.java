package guraa.doccompare.service;

import guraa.doccompare.comparison.AlignedPair;
import guraa.doccompare.config.ComparisonOptions;
import guraa.doccompare.model.TextBlock;
import guraa.doccompare.model.difference.TextChange;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Service for comparing the text blocks of a page pair.
 */
@Slf4j
@Service
public class TextComparisonService {

    /**
     * Compare the text blocks of one page index.
     * Blocks are aligned as units; each matched pair is diffed token by token.
     *
     * @param pageIndex     The page index
     * @param baseBlocks    The blocks of document A, empty when A has no such page
     * @param compareBlocks The blocks of document B, empty when B has no such page
     * @param options       The comparison options
     * @return One record per block pair or unmatched block
     */
    public List<TextChange> compareBlocks(int pageIndex, List<TextBlock> baseBlocks, List<TextBlock> compareBlocks,
                                          ComparisonOptions options) {
        TextNormalizer normalizer = new TextNormalizer(options.getNormalization());
        TextAligner aligner = new TextAligner(options.getMaxAlignmentCells(), options.getReplaceLengthRatio());

        List<List<String>> baseTokens = baseBlocks.stream().map(normalizer::tokenize).collect(Collectors.toList());
        List<List<String>> compareTokens = compareBlocks.stream().map(normalizer::tokenize).collect(Collectors.toList());

        List<AlignedPair> pairs = new UnitAligner(aligner)
                .align(baseTokens, compareTokens, options.getBlockSimilarityThreshold());

        List<TextChange> changes = new ArrayList<>(pairs.size());
        for (AlignedPair pair : pairs) {
            int b = pair.getBaseIndex();
            int c = pair.getCompareIndex();
            if (pair.isMatched()) {
                changes.add(TextChange.matched(pageIndex,
                        b, baseBlocks.get(b), baseTokens.get(b),
                        c, compareBlocks.get(c), compareTokens.get(c),
                        aligner.align(baseTokens.get(b), compareTokens.get(c)), options.getContextSize()));
            } else if (b >= 0) {
                changes.add(TextChange.deleted(pageIndex, b, baseBlocks.get(b), baseTokens.get(b)));
            } else {
                changes.add(TextChange.inserted(pageIndex, c, compareBlocks.get(c), compareTokens.get(c)));
            }
        }

        log.debug("Page {}: {} base blocks, {} compare blocks, {} text records",
                pageIndex, baseBlocks.size(), compareBlocks.size(), changes.size());
        return changes;
    }
}
