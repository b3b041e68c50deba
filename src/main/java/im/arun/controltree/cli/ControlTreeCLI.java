package im.arun.controltree.cli;

import im.arun.controltree.config.ConfigLoader;
import im.arun.controltree.config.ControlTreeConfig;
import im.arun.controltree.error.ControlTreeException;
import im.arun.controltree.model.ControlTree;
import im.arun.controltree.output.OutputFormat;
import im.arun.controltree.service.ControlTreeService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line interface for ControlTree using Picocli.
 * The rendered tree goes to stdout unless an output file is given; progress goes to the log on stderr.
 */
@Command(
    name = "controltree",
    description = "Extract requirements from a compliance-standard PDF into a hierarchical control tree",
    mixinStandardHelpOptions = true,
    version = "ControlTree 1.0"
)
public class ControlTreeCLI implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(ControlTreeCLI.class);

    @Parameters(index = "0", paramLabel = "PDF", description = "Path to the PDF file (e.g., PCI-DSS-v4_0_1.pdf)")
    private String pdfPath;

    @Option(names = {"-f", "--format"}, description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
        defaultValue = "yaml")
    private OutputFormat format;

    @Option(names = {"-o", "--output"}, description = "Output file path (if omitted, prints to stdout)")
    private String outputPath;

    @Option(names = {"--config"}, description = "YAML configuration file")
    private String configPath;

    @Option(names = {"--wrap-width"}, description = "Line width for wrapped YAML titles")
    private Integer wrapWidth;

    @Option(names = {"--header-label"}, description = "Header text of the requirements column")
    private String headerLabel;

    private PrintStream out = System.out;
    private PrintStream err = System.err;

    @Override
    public Integer call() {
        Map<String, Object> overrides = new HashMap<>();
        overrides.put("wrap_width", wrapWidth);
        overrides.put("requirements_header", headerLabel);
        ControlTreeConfig config = new ConfigLoader(configPath).load(overrides);

        Path pdfFilePath = Paths.get(pdfPath).toAbsolutePath().normalize();
        logger.info("Parsing {} as {}", pdfFilePath, format);

        ControlTreeService service = new ControlTreeService(config);
        try {
            ControlTree tree = service.processDocument(pdfFilePath);
            String outputText = service.render(tree, format);

            if (outputPath != null) {
                service.writeOutput(outputText, Paths.get(outputPath));
            } else {
                out.println(outputText);
                out.flush();
            }
        } catch (ControlTreeException e) {
            logger.debug("Run failed with {}", e.getKind(), e);
            err.println("Error: " + e.getMessage());
            return 1;
        }
        return 0;
    }

    void redirect(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    static CommandLine commandLine(ControlTreeCLI cli) {
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        return commandLine;
    }

    public static void main(String[] args) {
        System.setOut(new PrintStream(System.out, true, StandardCharsets.UTF_8));
        int exitCode = commandLine(new ControlTreeCLI()).execute(args);
        System.exit(exitCode);
    }
}
