package im.arun.controltree.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * A table recovered from one PDF page. The first row is the header row.
 * Cells are never null; a cell spanning several text lines keeps them separated by {@code \n}.
 */
@Data
@AllArgsConstructor
public class PdfTable {
    private int pageNumber;
    private List<List<String>> rows;
}
