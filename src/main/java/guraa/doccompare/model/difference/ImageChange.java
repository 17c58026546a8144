package guraa.doccompare.model.difference;

import guraa.doccompare.model.EmbeddedImage;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * Change record for an embedded image.
 */
@Getter
@SuperBuilder
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class ImageChange extends ChangeRecord {

    @Builder.Default
    private final int baseImageIndex = -1;

    @Builder.Default
    private final int compareImageIndex = -1;

    private final String baseName;

    private final String compareName;

    /**
     * Hamming distance between the fingerprints, -1 when the image was not matched.
     */
    @Builder.Default
    private final int hammingDistance = -1;

    /**
     * Width of the compared fingerprints in bits, 0 when the image was not matched.
     */
    private final int bitWidth;

    public static ImageChange deleted(int pageIndex, int imageIndex, EmbeddedImage image) {
        return ImageChange.builder()
                .operation(ChangeOperation.DELETE)
                .similarity(0.0)
                .baseLocation(SourceLocation.of(pageIndex, image.getBounds()))
                .baseImageIndex(imageIndex)
                .baseName(image.getName())
                .build();
    }

    public static ImageChange inserted(int pageIndex, int imageIndex, EmbeddedImage image) {
        return ImageChange.builder()
                .operation(ChangeOperation.INSERT)
                .similarity(0.0)
                .compareLocation(SourceLocation.of(pageIndex, image.getBounds()))
                .compareImageIndex(imageIndex)
                .compareName(image.getName())
                .build();
    }

    /**
     * Record for a matched pair: EQUAL at distance 0, otherwise REPLACE with
     * similarity 1 - distance / bitWidth.
     */
    public static ImageChange matched(int pageIndex,
                                      int baseIndex, EmbeddedImage base,
                                      int compareIndex, EmbeddedImage compare,
                                      int hammingDistance, int bitWidth) {
        ChangeOperation operation = hammingDistance == 0 ? ChangeOperation.EQUAL : ChangeOperation.REPLACE;
        return ImageChange.builder()
                .operation(operation)
                .similarity(similarityFor(operation, 1.0 - (double) hammingDistance / bitWidth))
                .baseLocation(SourceLocation.of(pageIndex, base.getBounds()))
                .compareLocation(SourceLocation.of(pageIndex, compare.getBounds()))
                .baseImageIndex(baseIndex)
                .compareImageIndex(compareIndex)
                .baseName(base.getName())
                .compareName(compare.getName())
                .hammingDistance(hammingDistance)
                .bitWidth(bitWidth)
                .build();
    }

    @Override
    public ElementKind getKind() {
        return ElementKind.IMAGE;
    }

    @Override
    public List<ElementRef> getElementRefs() {
        List<ElementRef> refs = new ArrayList<>(2);
        if (getBaseLocation() != null) {
            refs.add(ElementRef.image(DocumentSide.BASE, getBaseLocation().getPageIndex(), baseImageIndex));
        }
        if (getCompareLocation() != null) {
            refs.add(ElementRef.image(DocumentSide.COMPARE, getCompareLocation().getPageIndex(), compareImageIndex));
        }
        return refs;
    }

    @Override
    public <R> R accept(ChangeRecordVisitor<R> visitor) {
        return visitor.visitImage(this);
    }
}
