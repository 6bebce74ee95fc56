package com.modeldoc.loader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.modeldoc.loader.ast.RegionNode;
import com.modeldoc.testing.TestResources;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ModelLoaderTest {

    @TempDir Path tempDir;

    private final ModelLoader loader = new ModelLoader(new ModelAstBuilder());

    @Test
    void loadsExampleModel() throws Exception {
        Path model = TestResources.copyTo(tempDir, "models/macro.inp");

        LoaderResult result = loader.load(model);

        List<RegionNode> regions = result.getModelFile().getRegions();
        assertEquals(
                List.of("Demande intérieure", "Production", ""),
                regions.stream().map(RegionNode::getName).collect(Collectors.toList()));
        assertEquals(5, result.getModelFile().getEquationCount());
        assertTrue(result.getMessages().isEmpty());
    }

    @Test
    void readsModelFilesAsLatin1() throws Exception {
        Path model = tempDir.resolve("latin1.inp");
        Files.write(model, "ADDEQ, --region Île-de-France\nidf: idf = 1;".getBytes(StandardCharsets.ISO_8859_1));

        LoaderResult result = loader.load(model);

        assertEquals("Île-de-France", result.getModelFile().getRegions().get(0).getName());
    }

    @Test
    void rejectsMissingFile() {
        LoaderException ex = assertThrows(LoaderException.class, () -> loader.load(tempDir.resolve("absent.inp")));
        assertFalse(ex instanceof ModelParseException);
        assertTrue(ex.getMessage().contains("absent.inp"));
    }

    @Test
    void propagatesGrammarMismatch() throws Exception {
        Path model = tempDir.resolve("empty.inp");
        Files.writeString(model, "USEMOD demo;\nDO PRTMOD;\n");

        assertThrows(GrammarMismatchException.class, () -> loader.load(model));
    }

    @Test
    void surfacesTokenDumpWhenRequested() throws Exception {
        String previous = System.getProperty(DebugFlags.TOKENS_PROPERTY);
        System.setProperty(DebugFlags.TOKENS_PROPERTY, "true");
        try {
            LoaderResult result = loader.load("debug.inp", "ADDEQ, a: a = 1;");
            List<String> tokens =
                    result.getMessages().stream()
                            .map(LoaderMessage::getMessage)
                            .filter(message -> message.startsWith("[tokens] "))
                            .collect(Collectors.toList());
            assertFalse(tokens.isEmpty());
            assertTrue(tokens.get(0).contains("ADDEQ"), tokens.get(0));
            assertTrue(tokens.stream().anyMatch(line -> line.contains("EQUATION_HEAD")));
        } finally {
            if (previous == null) {
                System.clearProperty(DebugFlags.TOKENS_PROPERTY);
            } else {
                System.setProperty(DebugFlags.TOKENS_PROPERTY, previous);
            }
        }
    }

    @Test
    void explainsMismatchWhenEveryBlockIsMalformed() {
        System.setProperty(DebugFlags.TOKENS_PROPERTY, "true");
        try {
            GrammarMismatchException ex =
                    assertThrows(GrammarMismatchException.class, () -> loader.load("bad.inp", "ADDEQ, a: a b;"));
            assertTrue(ex.getMessage().startsWith("No equation found in file: bad.inp"), ex.getMessage());
            assertTrue(ex.getDiagnostics().get(0).startsWith("Skipping malformed ADDEQ block"), ex.getMessage());
            assertTrue(ex.getDiagnostics().stream().anyMatch(line -> line.startsWith("[tokens] ")));
        } finally {
            System.clearProperty(DebugFlags.TOKENS_PROPERTY);
        }
    }

    @Test
    void reportsSkippedBlockAsWarning() throws Exception {
        LoaderResult result = loader.load("mixed.inp", "ADDEQ, x: x = max(a, b);\nADDEQ, y: y = 2;");

        assertEquals(1, result.getModelFile().getEquationCount());
        assertEquals(1, result.getMessages().size());
        assertEquals(LoaderMessage.Level.WARNING, result.getMessages().get(0).getLevel());
    }
}
