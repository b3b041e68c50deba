package im.arun.controltree.cli;

import im.arun.controltree.config.ConfigLoader;
import im.arun.controltree.config.ControlTreeConfig;
import im.arun.controltree.error.ControlTreeException;
import im.arun.controltree.export.NotionExporter;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Converts the JSON output of {@link ControlTreeCLI} into a Notion-import-ready block structure.
 * All outputs are draft artifacts requiring human review.
 */
@Command(
    name = "notion-export",
    description = "Convert a control tree JSON file into Notion import blocks",
    mixinStandardHelpOptions = true,
    version = "ControlTree 1.0"
)
public class NotionExportCLI implements Callable<Integer> {

    @Parameters(index = "0", paramLabel = "CONTROLS_JSON", description = "JSON produced by controltree -f json")
    private String inputJson;

    @Parameters(index = "1", paramLabel = "NOTION_JSON", description = "Destination for the Notion import JSON")
    private String outputJson;

    @Option(names = {"--config"}, description = "YAML configuration file")
    private String configPath;

    private PrintStream err = System.err;

    @Override
    public Integer call() {
        ControlTreeConfig config = new ConfigLoader(configPath).load();
        NotionExporter exporter = new NotionExporter(config.getNotionNote());
        try {
            exporter.export(Paths.get(inputJson), Paths.get(outputJson));
        } catch (ControlTreeException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
        return 0;
    }

    void redirectErrors(PrintStream err) {
        this.err = err;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new NotionExportCLI()).execute(args);
        System.exit(exitCode);
    }
}
