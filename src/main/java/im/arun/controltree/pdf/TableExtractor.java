package im.arun.controltree.pdf;

import im.arun.controltree.model.PdfTable;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Turns a source document into tables of cell text, in page order.
 */
public interface TableExtractor {

    /**
     * @param pdfPath Path to the source document
     * @return Tables in page and row order; empty if the document has none
     * @throws IOException If the document cannot be opened or read
     */
    List<PdfTable> extractTables(Path pdfPath) throws IOException;
}
