package im.arun.controltree.service;

import im.arun.controltree.config.ControlTreeConfig;
import im.arun.controltree.error.ControlTreeException;
import im.arun.controltree.error.ErrorKind;
import im.arun.controltree.model.BuildDiagnostics;
import im.arun.controltree.model.ControlTree;
import im.arun.controltree.model.PdfTable;
import im.arun.controltree.output.ControlTreeFormatter;
import im.arun.controltree.output.JsonControlFormatter;
import im.arun.controltree.output.OutputFormat;
import im.arun.controltree.output.YamlControlFormatter;
import im.arun.controltree.parse.BlobAssembler;
import im.arun.controltree.pdf.PdfTableExtractor;
import im.arun.controltree.pdf.TableExtractor;
import im.arun.controltree.tree.ControlTreeBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Main pipeline: PDF tables -> requirement blobs -> control tree -> rendered text.
 */
public class ControlTreeService {
    private static final Logger logger = LoggerFactory.getLogger(ControlTreeService.class);

    private final ControlTreeConfig config;
    private final TableExtractor tableExtractor;

    public ControlTreeService(ControlTreeConfig config) {
        this(config, new PdfTableExtractor(config));
    }

    public ControlTreeService(ControlTreeConfig config, TableExtractor tableExtractor) {
        this.config = config;
        this.tableExtractor = tableExtractor;
    }

    /**
     * Extract the requirement tables of a PDF and build the control tree.
     */
    public ControlTree processDocument(Path pdfPath) throws ControlTreeException {
        if (pdfPath == null || !Files.isRegularFile(pdfPath)) {
            throw new ControlTreeException(ErrorKind.SOURCE_UNAVAILABLE, "PDF not found at path: " + pdfPath);
        }

        List<PdfTable> tables;
        try {
            tables = tableExtractor.extractTables(pdfPath);
        } catch (IOException e) {
            throw new ControlTreeException(ErrorKind.SOURCE_UNAVAILABLE,
                "Error opening PDF: " + e.getMessage(), e);
        }
        return buildTree(tables);
    }

    /**
     * Build the control tree from already extracted tables.
     */
    public ControlTree buildTree(List<PdfTable> tables) throws ControlTreeException {
        if (tables == null || tables.isEmpty()) {
            throw new ControlTreeException(ErrorKind.NO_TABLES_FOUND, "No tables found in the PDF. Cannot proceed.");
        }

        BlobAssembler assembler = new BlobAssembler(config);
        int matchedTables = assembler.acceptTables(tables);
        List<String> blobs = assembler.getBlobs();
        logger.info("Found requirements column in {} of {} tables, assembled {} blobs",
            matchedTables, tables.size(), blobs.size());

        if (blobs.isEmpty()) {
            throw new ControlTreeException(ErrorKind.NO_CONTENT_EXTRACTED,
                "No requirement blobs extracted. Check PDF structure and table headers.");
        }

        ControlTree tree = ControlTreeBuilder.fromBlobs(blobs);
        logDiagnostics(tree);
        return tree;
    }

    private void logDiagnostics(ControlTree tree) {
        BuildDiagnostics diagnostics = tree.getDiagnostics();
        logger.info("Built control tree with {} nodes ({} top-level)", tree.size(), tree.getTopLevel().size());
        if (diagnostics.unparseableCount() > 0) {
            logger.warn("Skipped {} blobs without a requirement identifier", diagnostics.unparseableCount());
        }
        if (diagnostics.duplicateCount() > 0) {
            logger.warn("{} duplicate requirement identifiers attached as siblings: {}",
                diagnostics.duplicateCount(), diagnostics.getDuplicateIdentifiers());
        }
    }

    public String render(ControlTree tree, OutputFormat format) {
        return formatterFor(format).format(tree);
    }

    ControlTreeFormatter formatterFor(OutputFormat format) {
        switch (format) {
            case JSON:
                return new JsonControlFormatter();
            case YAML:
            default:
                return new YamlControlFormatter(config);
        }
    }

    /**
     * Write rendered output as UTF-8.
     */
    public void writeOutput(String text, Path outputPath) throws ControlTreeException {
        try {
            Files.writeString(outputPath, text, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ControlTreeException(ErrorKind.OUTPUT_WRITE_FAILURE,
                "Error writing to output file: " + e.getMessage(), e);
        }
        logger.info("Output written to {}", outputPath);
    }
}
