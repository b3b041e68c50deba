package im.arun.controltree.pdf;

import im.arun.controltree.config.ControlTreeConfig;
import im.arun.controltree.model.PdfTable;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Table extractor using Apache PDFBox.
 *
 * <p>Each page is read as positioned glyphs which are grouped into text lines by baseline, split
 * into segments at wide horizontal gaps and grouped into rows at wide vertical gaps. The header
 * row (the first row mentioning the requirements header, else the first row) defines the columns;
 * column boundaries sit midway between neighbouring header spans and every later segment is
 * assigned to the column whose boundaries enclose its start.
 */
public class PdfTableExtractor implements TableExtractor {
    private static final Logger logger = LoggerFactory.getLogger(PdfTableExtractor.class);

    private static final double BASELINE_TOLERANCE = 0.5;
    private static final double SPACE_THRESHOLD = 0.3;
    private static final double SPAN_OVERLAP_TOLERANCE = 1.0;

    private final String headerLabel;
    private final double columnGapPt;
    private final double rowGapFactor;

    public PdfTableExtractor(ControlTreeConfig config) {
        this.headerLabel = normalize(config.getRequirementsHeader());
        this.columnGapPt = config.getColumnGapPt();
        this.rowGapFactor = config.getRowGapFactor();
    }

    /**
     * Extract tables from a PDF file.
     *
     * @param pdfPath Path to the PDF file
     * @return Tables in page order
     * @throws IOException If PDF cannot be read
     */
    @Override
    public List<PdfTable> extractTables(Path pdfPath) throws IOException {
        try (PDDocument document = Loader.loadPDF(pdfPath.toFile())) {
            return extractTablesFromDocument(document);
        }
    }

    /**
     * Extract tables from a PDF held in memory.
     */
    public List<PdfTable> extractTables(byte[] pdfBytes) throws IOException {
        try (PDDocument document = Loader.loadPDF(pdfBytes)) {
            return extractTablesFromDocument(document);
        }
    }

    private List<PdfTable> extractTablesFromDocument(PDDocument document) throws IOException {
        int totalPages = document.getNumberOfPages();
        List<PdfTable> tables = new ArrayList<>();

        for (int pageNumber = 1; pageNumber <= totalPages; pageNumber++) {
            GlyphCollector collector = new GlyphCollector();
            collector.setSortByPosition(true);
            collector.setStartPage(pageNumber);
            collector.setEndPage(pageNumber);
            collector.getText(document);

            PdfTable table = buildTable(pageNumber, collector.glyphs);
            if (table != null) {
                tables.add(table);
            }
        }

        logger.info("Extracted {} tables from {} pages", tables.size(), totalPages);
        return tables;
    }

    PdfTable buildTable(int pageNumber, List<Glyph> glyphs) {
        List<Line> lines = groupLines(glyphs);
        List<List<Line>> rows = groupRows(lines);
        if (rows.isEmpty()) {
            return null;
        }

        int headerIndex = findHeaderRow(rows);
        List<Span> columns = columnSpans(rows.get(headerIndex));
        if (columns.size() < 2 || headerIndex == rows.size() - 1) {
            logger.debug("Page {}: no table ({} columns, {} rows)", pageNumber, columns.size(), rows.size() - headerIndex);
            return null;
        }

        List<List<String>> cells = new ArrayList<>();
        for (List<Line> row : rows.subList(headerIndex, rows.size())) {
            cells.add(rowCells(row, columns));
        }
        return new PdfTable(pageNumber, cells);
    }

    private List<Line> groupLines(List<Glyph> glyphs) {
        List<Glyph> sorted = new ArrayList<>(glyphs);
        sorted.sort(Comparator.comparingDouble((Glyph g) -> g.y).thenComparingDouble(g -> g.x));

        List<Line> lines = new ArrayList<>();
        Line current = null;
        for (Glyph glyph : sorted) {
            double tolerance = Math.max(glyph.fontSize, current == null ? 0 : current.fontSize) * BASELINE_TOLERANCE;
            if (current == null || Math.abs(glyph.y - current.y) > tolerance) {
                current = new Line(glyph.y);
                lines.add(current);
            }
            current.add(glyph);
        }

        for (Line line : lines) {
            line.glyphs.sort(Comparator.comparingDouble(g -> g.x));
            line.segments = splitSegments(line.glyphs);
        }
        lines.removeIf(line -> line.segments.isEmpty());
        return lines;
    }

    private List<Segment> splitSegments(List<Glyph> glyphs) {
        List<Segment> segments = new ArrayList<>();
        Segment current = null;
        double previousEnd = 0;

        for (Glyph glyph : glyphs) {
            double gap = glyph.x - previousEnd;
            if (current == null || gap > columnGapPt) {
                current = new Segment();
                segments.add(current);
            } else if (gap > glyph.spaceWidth() * SPACE_THRESHOLD) {
                current.appendSpace();
            }
            current.append(glyph);
            previousEnd = Math.max(previousEnd, glyph.x + glyph.width);
        }

        segments.removeIf(segment -> segment.text().isEmpty());
        return segments;
    }

    private List<List<Line>> groupRows(List<Line> lines) {
        List<List<Line>> rows = new ArrayList<>();
        Line previous = null;
        for (Line line : lines) {
            if (previous == null || line.y - previous.y > rowGapFactor * Math.max(line.fontSize, previous.fontSize)) {
                rows.add(new ArrayList<>());
            }
            rows.get(rows.size() - 1).add(line);
            previous = line;
        }
        return rows;
    }

    private int findHeaderRow(List<List<Line>> rows) {
        for (int i = 0; i < rows.size(); i++) {
            StringBuilder text = new StringBuilder();
            for (Line line : rows.get(i)) {
                for (Segment segment : line.segments) {
                    text.append(segment.text()).append(' ');
                }
            }
            if (normalize(text.toString()).contains(headerLabel)) {
                return i;
            }
        }
        return 0;
    }

    private List<Span> columnSpans(List<Line> headerRow) {
        List<Segment> segments = new ArrayList<>();
        for (Line line : headerRow) {
            segments.addAll(line.segments);
        }
        segments.sort(Comparator.comparingDouble(s -> s.x0));

        List<Span> spans = new ArrayList<>();
        for (Segment segment : segments) {
            Span last = spans.isEmpty() ? null : spans.get(spans.size() - 1);
            if (last != null && segment.x0 <= last.x1 + SPAN_OVERLAP_TOLERANCE) {
                last.x1 = Math.max(last.x1, segment.x1);
            } else {
                spans.add(new Span(segment.x0, segment.x1));
            }
        }
        return spans;
    }

    private List<String> rowCells(List<Line> row, List<Span> columns) {
        List<StringBuilder> cells = new ArrayList<>();
        for (int i = 0; i < columns.size(); i++) {
            cells.add(new StringBuilder());
        }

        for (Line line : row) {
            List<StringBuilder> lineCells = new ArrayList<>();
            for (int i = 0; i < columns.size(); i++) {
                lineCells.add(new StringBuilder());
            }
            for (Segment segment : line.segments) {
                StringBuilder cell = lineCells.get(columnOf(segment.x0, columns));
                if (cell.length() > 0) {
                    cell.append(' ');
                }
                cell.append(segment.text());
            }
            for (int i = 0; i < columns.size(); i++) {
                if (lineCells.get(i).length() == 0) {
                    continue;
                }
                if (cells.get(i).length() > 0) {
                    cells.get(i).append('\n');
                }
                cells.get(i).append(lineCells.get(i));
            }
        }

        List<String> values = new ArrayList<>(cells.size());
        for (StringBuilder cell : cells) {
            values.add(cell.toString());
        }
        return values;
    }

    /**
     * Column boundaries sit in the middle of the gutter between two header spans.
     */
    static int columnOf(double x, List<Span> columns) {
        int column = 0;
        for (int i = 0; i < columns.size() - 1; i++) {
            double boundary = (columns.get(i).x1 + columns.get(i + 1).x0) / 2;
            if (x >= boundary) {
                column = i + 1;
            }
        }
        return column;
    }

    private static String normalize(String text) {
        return text.strip().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    private static class GlyphCollector extends PDFTextStripper {
        private final List<Glyph> glyphs = new ArrayList<>();

        GlyphCollector() throws IOException {
            super();
        }

        @Override
        protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
            for (TextPosition position : textPositions) {
                glyphs.add(new Glyph(
                    position.getXDirAdj(),
                    position.getYDirAdj(),
                    position.getWidthDirAdj(),
                    position.getFontSizeInPt(),
                    position.getWidthOfSpace(),
                    position.getUnicode()));
            }
        }
    }

    static final class Glyph {
        final double x;
        final double y;
        final double width;
        final double fontSize;
        final double rawSpaceWidth;
        final String text;

        Glyph(double x, double y, double width, double fontSize, double rawSpaceWidth, String text) {
            this.x = x;
            this.y = y;
            this.width = width;
            this.fontSize = fontSize;
            this.rawSpaceWidth = rawSpaceWidth;
            this.text = text == null ? "" : text;
        }

        double spaceWidth() {
            // Some fonts report no usable space width.
            if (Double.isNaN(rawSpaceWidth) || rawSpaceWidth <= 0) {
                return fontSize * 0.25;
            }
            return rawSpaceWidth;
        }

        boolean isBlank() {
            return text.isBlank();
        }
    }

    private static final class Line {
        final double y;
        double fontSize;
        final List<Glyph> glyphs = new ArrayList<>();
        List<Segment> segments = new ArrayList<>();

        Line(double y) {
            this.y = y;
        }

        void add(Glyph glyph) {
            glyphs.add(glyph);
            fontSize = Math.max(fontSize, glyph.fontSize);
        }
    }

    private static final class Segment {
        double x0 = Double.NaN;
        double x1;
        final StringBuilder text = new StringBuilder();

        void append(Glyph glyph) {
            if (glyph.isBlank()) {
                appendSpace();
                return;
            }
            if (Double.isNaN(x0)) {
                x0 = glyph.x;
            }
            x1 = Math.max(x1, glyph.x + glyph.width);
            text.append(glyph.text);
        }

        void appendSpace() {
            if (text.length() > 0 && text.charAt(text.length() - 1) != ' ') {
                text.append(' ');
            }
        }

        String text() {
            return text.toString().strip();
        }
    }

    static final class Span {
        final double x0;
        double x1;

        Span(double x0, double x1) {
            this.x0 = x0;
            this.x1 = x1;
        }
    }
}
