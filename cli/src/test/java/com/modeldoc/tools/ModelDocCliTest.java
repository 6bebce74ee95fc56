package com.modeldoc.tools;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ModelDocCliTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-01T08:00:00Z"), ZoneOffset.UTC);

    private static final String MODEL =
            "ADDEQ TOP,\n"
                    + "--region Supply\n"
                    + "y: Y = a*K + L,\n"
                    + "k: K = 0.9*K(-1) + I,\n"
                    + "--endregion\n"
                    + ";\n";

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();

    private int run(String... args) {
        return ModelDocCli.run(
                args,
                new PrintStream(stdout, true, StandardCharsets.UTF_8),
                new PrintStream(stderr, true, StandardCharsets.UTF_8),
                CLOCK);
    }

    private String out() {
        return stdout.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return stderr.toString(StandardCharsets.UTF_8);
    }

    @Test
    void writesDocumentation() throws Exception {
        Path input = Files.writeString(tempDir.resolve("model.inp"), MODEL, StandardCharsets.ISO_8859_1);
        Path params = Files.writeString(tempDir.resolve("params.csv"), "a;0.3\n");
        Path legends = Files.writeString(tempDir.resolve("legends.csv"), "y;Output\nk;Capital\n");
        Path output = tempDir.resolve("doc.html");

        int code =
                run(
                        "-i", input.toString(),
                        "-o", output.toString(),
                        "--paramfile=" + params,
                        "-l", legends.toString());

        assertEquals(ModelDocCli.EXIT_OK, code, err());
        assertTrue(out().contains("2 equations found in 1 regions."), out());
        assertTrue(out().contains("Done. Output in file " + output.toAbsolutePath().normalize() + "."), out());
        String html = Files.readString(output, StandardCharsets.UTF_8);
        assertTrue(html.contains("<h2>Supply</h2>"));
        assertTrue(html.contains("= 0.3*<a href=\"#k\">k</a> + l"), html);
        assertTrue(html.contains("<p class=\"legend\">Capital</p>"));
        assertTrue(html.contains("Generated on 01/06/2024 - 08h00."));
    }

    @Test
    void reportsModelWithoutEquations() throws Exception {
        Path input = Files.writeString(tempDir.resolve("empty.inp"), "DO PRTMOD;\n");
        Path output = tempDir.resolve("empty.html");

        int code = run("-i", input.toString(), "-o", output.toString());

        assertEquals(ModelDocCli.EXIT_FAILURE, code);
        assertTrue(err().contains("No equation found in file: " + input), err());
        assertFalse(Files.exists(output));
    }

    @Test
    void explainsSkippedBlocksWhenNothingParses() throws Exception {
        Path input = Files.writeString(tempDir.resolve("broken.inp"), "ADDEQ, a: a b;\n");

        int code = run("-i", input.toString(), "-o", tempDir.resolve("broken.html").toString());

        assertEquals(ModelDocCli.EXIT_FAILURE, code);
        assertTrue(err().contains("No equation found in file: " + input), err());
        assertTrue(err().contains("  Skipping malformed ADDEQ block"), err());
    }

    @Test
    void documentsBlocksAroundMalformedOne() throws Exception {
        Path input =
                Files.writeString(
                        tempDir.resolve("mixed.inp"), "ADDEQ, x: x = max(a, b);\nADDEQ, y: y = 2;\n");
        Path output = tempDir.resolve("mixed.html");

        int code = run("-i", input.toString(), "-o", output.toString());

        assertEquals(ModelDocCli.EXIT_OK, code, err());
        assertTrue(out().contains("1 equations found in 1 regions."), out());
        assertTrue(err().contains("WARNING Skipping malformed ADDEQ block"), err());
        assertTrue(Files.readString(output, StandardCharsets.UTF_8).contains("id=\"y\""));
    }

    @Test
    void reportsMissingTable() throws Exception {
        Path input = Files.writeString(tempDir.resolve("model.inp"), MODEL);
        Path output = tempDir.resolve("doc.html");

        int code = run("-i", input.toString(), "-o", output.toString(), "-p", tempDir.resolve("nope.csv").toString());

        assertEquals(ModelDocCli.EXIT_FAILURE, code);
        assertTrue(err().contains("Cannot read parameter table"), err());
        assertFalse(Files.exists(output));
    }

    @Test
    void printsTableWarnings() throws Exception {
        Path input = Files.writeString(tempDir.resolve("model.inp"), MODEL);
        Path params = Files.writeString(tempDir.resolve("params.csv"), "a;0.3\nno delimiter here\n");

        int code = run("-i", input.toString(), "-o", tempDir.resolve("doc.html").toString(), "-p", params.toString());

        assertEquals(ModelDocCli.EXIT_OK, code);
        assertTrue(err().contains("WARNING Skipping malformed parameter table row"), err());
    }

    @Test
    void missingMandatoryOptionIsUsageError() {
        assertEquals(ModelDocCli.EXIT_USAGE, run("-i", "model.inp"));
        assertTrue(err().contains("Missing argument"));
        assertTrue(err().contains("Usage:"));
    }

    @Test
    void unknownOptionIsUsageError() {
        assertEquals(ModelDocCli.EXIT_USAGE, run("-x"));
        assertTrue(err().contains("option -x not recognized"));
    }

    @Test
    void optionWithoutValueIsUsageError() {
        assertEquals(ModelDocCli.EXIT_USAGE, run("-i", "model.inp", "-o"));
        assertTrue(err().contains("option -o requires argument"));
    }

    @Test
    void helpPrintsUsage() {
        assertEquals(ModelDocCli.EXIT_OK, run("--help"));
        assertTrue(out().contains("-i, --input"));
    }
}
