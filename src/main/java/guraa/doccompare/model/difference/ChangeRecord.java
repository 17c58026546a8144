package guraa.doccompare.model.difference;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.List;

/**
 * A single reported difference, or confirmed equality, between elements of two documents.
 * The set of variants is closed: {@link TextChange}, {@link TableChange} and {@link ImageChange}.
 * Use {@link #accept(ChangeRecordVisitor)} to handle all of them.
 */
@Getter
@SuperBuilder
@EqualsAndHashCode
@ToString
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "recordType")
@JsonSubTypes({
        @JsonSubTypes.Type(value = TextChange.class, name = "text"),
        @JsonSubTypes.Type(value = TableChange.class, name = "table"),
        @JsonSubTypes.Type(value = ImageChange.class, name = "image")
})
public abstract class ChangeRecord {

    /**
     * The edit this record describes.
     */
    private final ChangeOperation operation;

    /**
     * Location in document A, null for pure insertions.
     */
    private final SourceLocation baseLocation;

    /**
     * Location in document B, null for pure deletions.
     */
    private final SourceLocation compareLocation;

    /**
     * Similarity between the two sides (1 for EQUAL, 0 for INSERT and DELETE).
     */
    private final double similarity;

    public abstract ElementKind getKind();

    /**
     * The source elements this record accounts for.
     *
     * @return The element references, one or two per record
     */
    @JsonIgnore
    public abstract List<ElementRef> getElementRefs();

    public abstract <R> R accept(ChangeRecordVisitor<R> visitor);

    /**
     * The location used for ordering: the base side when present, otherwise the compare side.
     *
     * @return The primary location
     */
    @JsonIgnore
    public SourceLocation getPrimaryLocation() {
        return baseLocation != null ? baseLocation : compareLocation;
    }

    @JsonIgnore
    public int getPageIndex() {
        return getPrimaryLocation().getPageIndex();
    }

    @JsonIgnore
    public double getTop() {
        SourceLocation location = getPrimaryLocation();
        return location.getBounds() != null ? location.getBounds().getY() : 0.0;
    }

    @JsonIgnore
    public boolean isChange() {
        return operation.isChange();
    }

    static double similarityFor(ChangeOperation operation, double score) {
        switch (operation) {
            case EQUAL:
                return 1.0;
            case INSERT:
            case DELETE:
                return 0.0;
            default:
                return Math.max(0.0, Math.min(1.0, score));
        }
    }
}
