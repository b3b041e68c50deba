package im.arun.controltree.parse;

import im.arun.controltree.config.ControlTreeConfig;
import im.arun.controltree.model.PdfTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Reassembles requirement blobs from the cells of the requirements column.
 *
 * <p>A cell that starts with an identifier opens a new blob; any other cell continues the blob
 * that is currently open. Cells must arrive in page and row order.
 */
public class BlobAssembler {
    private static final Logger logger = LoggerFactory.getLogger(BlobAssembler.class);
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    private final String headerLabel;
    private final Pattern ignoredCellPattern;
    private final List<String> blobs = new ArrayList<>();
    private int currentIndex = -1;
    private int discardedCells;

    public BlobAssembler(ControlTreeConfig config) {
        this.headerLabel = normalizeHeader(config.getRequirementsHeader());
        this.ignoredCellPattern = buildIgnorePattern(config.getIgnoredCellPrefixes());
    }

    private static Pattern buildIgnorePattern(List<String> prefixes) {
        if (prefixes == null || prefixes.isEmpty()) {
            return null;
        }
        String alternatives = prefixes.stream()
            .map(Pattern::quote)
            .collect(Collectors.joining("|"));
        return Pattern.compile("^(?:" + alternatives + ")\\b", Pattern.CASE_INSENSITIVE);
    }

    /**
     * Feed every table's requirements column to the assembler.
     * Tables without the column are skipped; the header row is never treated as data.
     *
     * @return Number of tables that carried the requirements column
     */
    public int acceptTables(List<PdfTable> tables) {
        int matchedTables = 0;
        for (PdfTable table : tables) {
            Integer columnIndex = findRequirementsColumn(table);
            if (columnIndex == null) {
                logger.debug("Page {}: no requirements column, table skipped", table.getPageNumber());
                continue;
            }
            matchedTables++;

            List<List<String>> rows = table.getRows();
            for (List<String> row : rows.subList(1, rows.size())) {
                String cell = columnIndex < row.size() ? row.get(columnIndex) : "";
                accept(cell);
            }
        }
        return matchedTables;
    }

    /**
     * Locate the requirements column by scanning the table's first row.
     *
     * @return Column index, or null if the header row has no matching cell
     */
    public Integer findRequirementsColumn(PdfTable table) {
        if (table == null || table.getRows() == null || table.getRows().isEmpty()) {
            return null;
        }

        List<String> headerRow = table.getRows().get(0);
        for (int i = 0; i < headerRow.size(); i++) {
            String cell = headerRow.get(i);
            // Header cells may carry suffixes such as "(continued)".
            if (cell != null && normalizeHeader(cell).contains(headerLabel)) {
                return i;
            }
        }
        return null;
    }

    /**
     * Route one cell into the blob list.
     */
    public void accept(String cell) {
        if (cell == null) {
            return;
        }

        String text = cell.strip();
        if (text.isEmpty()) {
            return;
        }

        if (isIgnoredHeader(text)) {
            logger.debug("Ignoring header cell: {}", text);
            return;
        }

        if (IdentifierMatcher.startsWithIdentifier(text)) {
            blobs.add(text);
            currentIndex = blobs.size() - 1;
        } else if (currentIndex >= 0) {
            blobs.set(currentIndex, blobs.get(currentIndex) + " " + text);
        } else {
            discardedCells++;
            logger.debug("Discarding cell before first requirement: {}", text);
        }
    }

    boolean isIgnoredHeader(String text) {
        return ignoredCellPattern != null && ignoredCellPattern.matcher(text).find();
    }

    public List<String> getBlobs() {
        return Collections.unmodifiableList(blobs);
    }

    public int getDiscardedCells() {
        return discardedCells;
    }

    private static String normalizeHeader(String text) {
        return WHITESPACE_RUN.matcher(text.strip()).replaceAll(" ").toLowerCase(Locale.ROOT);
    }
}
