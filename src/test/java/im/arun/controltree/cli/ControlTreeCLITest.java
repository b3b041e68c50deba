package im.arun.controltree.cli;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import im.arun.controltree.pdf.RequirementsPdfFixture;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ControlTreeCLITest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private Path pdf;

    @BeforeEach
    void setUp() throws Exception {
        pdf = RequirementsPdfFixture.writeRequirementsPdf(tempDir.resolve("PCI-DSS.pdf"));
    }

    private int run(String... args) {
        ControlTreeCLI cli = new ControlTreeCLI();
        cli.redirect(new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8));
        return ControlTreeCLI.commandLine(cli).execute(args);
    }

    @Test
    void writesYamlToOutputFile() throws Exception {
        Path output = tempDir.resolve("pcidss_4.yml");

        int exitCode = run(pdf.toString(), "-o", output.toString());

        assertEquals(0, exitCode);
        String yaml = Files.readString(output);
        assertTrue(yaml.startsWith("policy: PCI-DSS\n"));
        assertTrue(yaml.contains("  - id: Req-1\n"));
        assertEquals("", out.toString(StandardCharsets.UTF_8));
    }

    @Test
    void printsJsonToStdoutWithCaseInsensitiveFormat() throws Exception {
        int exitCode = run(pdf.toString(), "-f", "JSON");

        assertEquals(0, exitCode);
        JsonNode json = new ObjectMapper().readTree(out.toString(StandardCharsets.UTF_8));
        assertEquals("1", json.get(0).get("id").asText());
        assertEquals(2, json.get(0).get("children").size());
    }

    @Test
    void wrapWidthOptionNarrowsTitles() {
        int exitCode = run(pdf.toString(), "--wrap-width", "40");

        assertEquals(0, exitCode);
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("    title: 'Install and maintain network\n"));
    }

    @Test
    void missingPdfFailsWithoutWritingOutput() {
        Path output = tempDir.resolve("never.yml");

        int exitCode = run(tempDir.resolve("absent.pdf").toString(), "-o", output.toString());

        assertEquals(1, exitCode);
        assertTrue(err.toString(StandardCharsets.UTF_8).startsWith("Error: PDF not found at path: "));
        assertFalse(Files.exists(output));
    }

    @Test
    void unknownHeaderLabelReportsNoContent() {
        int exitCode = run(pdf.toString(), "--header-label", "Testing Procedures Only");

        assertEquals(1, exitCode);
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("No requirement blobs extracted"));
    }

    @Test
    void unknownFormatIsAUsageError() {
        assertEquals(2, run(pdf.toString(), "-f", "xml"));
    }
}
