package guraa.doccompare.comparison;

import guraa.doccompare.model.difference.ImageChange;
import guraa.doccompare.model.difference.TableChange;
import guraa.doccompare.model.difference.TextChange;
import lombok.Value;

import java.util.List;

/**
 * The three change streams produced for one page index.
 */
@Value
public class PageDiff {

    int pageIndex;

    List<TextChange> textChanges;

    List<TableChange> tableChanges;

    List<ImageChange> imageChanges;

    public PageDiff(int pageIndex, List<TextChange> textChanges, List<TableChange> tableChanges,
                    List<ImageChange> imageChanges) {
        this.pageIndex = pageIndex;
        this.textChanges = List.copyOf(textChanges);
        this.tableChanges = List.copyOf(tableChanges);
        this.imageChanges = List.copyOf(imageChanges);
    }

    public int getRecordCount() {
        return textChanges.size() + tableChanges.size() + imageChanges.size();
    }
}
