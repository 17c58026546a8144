package guraa.doccompare.model.difference;

import guraa.doccompare.comparison.DiffHunk;
import guraa.doccompare.comparison.EditScript;
import guraa.doccompare.model.TextBlock;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * Change record for a text block.
 * Token lists hold the normalized tokens the hunks index into.
 */
@Getter
@SuperBuilder
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class TextChange extends ChangeRecord {

    @Builder.Default
    private final int baseBlockIndex = -1;

    @Builder.Default
    private final int compareBlockIndex = -1;

    private final String baseText;

    private final String compareText;

    @Builder.Default
    private final List<String> baseTokens = List.of();

    @Builder.Default
    private final List<String> compareTokens = List.of();

    @Builder.Default
    private final List<DiffHunk> hunks = List.of();

    /**
     * True when the token alignment fell back or found nothing in common.
     */
    private final boolean degraded;

    public static TextChange deleted(int pageIndex, int blockIndex, TextBlock block, List<String> tokens) {
        return TextChange.builder()
                .operation(ChangeOperation.DELETE)
                .similarity(0.0)
                .baseLocation(SourceLocation.of(pageIndex, block.getBounds()))
                .baseBlockIndex(blockIndex)
                .baseText(block.getText())
                .baseTokens(tokens)
                .build();
    }

    public static TextChange inserted(int pageIndex, int blockIndex, TextBlock block, List<String> tokens) {
        return TextChange.builder()
                .operation(ChangeOperation.INSERT)
                .similarity(0.0)
                .compareLocation(SourceLocation.of(pageIndex, block.getBounds()))
                .compareBlockIndex(blockIndex)
                .compareText(block.getText())
                .compareTokens(tokens)
                .build();
    }

    /**
     * Record for two blocks aligned with each other: EQUAL when the script has no edits,
     * REPLACE otherwise.
     */
    public static TextChange matched(int pageIndex,
                                     int baseIndex, TextBlock base, List<String> baseTokens,
                                     int compareIndex, TextBlock compare, List<String> compareTokens,
                                     EditScript script, int contextSize) {
        ChangeOperation operation = script.isIdentical() ? ChangeOperation.EQUAL : ChangeOperation.REPLACE;
        return TextChange.builder()
                .operation(operation)
                .similarity(similarityFor(operation, script.similarity()))
                .baseLocation(SourceLocation.of(pageIndex, base.getBounds()))
                .compareLocation(SourceLocation.of(pageIndex, compare.getBounds()))
                .baseBlockIndex(baseIndex)
                .compareBlockIndex(compareIndex)
                .baseText(base.getText())
                .compareText(compare.getText())
                .baseTokens(baseTokens)
                .compareTokens(compareTokens)
                .hunks(script.hunks(contextSize))
                .degraded(script.isDegraded())
                .build();
    }

    @Override
    public ElementKind getKind() {
        return ElementKind.TEXT;
    }

    @Override
    public List<ElementRef> getElementRefs() {
        List<ElementRef> refs = new ArrayList<>(2);
        if (getBaseLocation() != null) {
            refs.add(ElementRef.text(DocumentSide.BASE, getBaseLocation().getPageIndex(), baseBlockIndex));
        }
        if (getCompareLocation() != null) {
            refs.add(ElementRef.text(DocumentSide.COMPARE, getCompareLocation().getPageIndex(), compareBlockIndex));
        }
        return refs;
    }

    @Override
    public <R> R accept(ChangeRecordVisitor<R> visitor) {
        return visitor.visitText(this);
    }
}
