package com.modeldoc.loader;

import com.modeldoc.loader.ast.EquationNode;
import com.modeldoc.loader.ast.ModelFileNode;
import com.modeldoc.loader.ast.RegionNode;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/** Reads a TROLL model file and parses its {@code ADDEQ} blocks. */
public final class ModelLoader {
    private static final Logger LOGGER = Logger.getLogger(ModelLoader.class.getName());

    /** Model files are single-byte legacy text. */
    public static final Charset MODEL_CHARSET = StandardCharsets.ISO_8859_1;

    private static final int RECENT_DEBUG_LINES = 10;

    private final ModelAstBuilder astBuilder;

    public ModelLoader(ModelAstBuilder astBuilder) {
        this.astBuilder = Objects.requireNonNull(astBuilder, "astBuilder");
    }

    public LoaderResult load(Path modelPath) throws LoaderException {
        Objects.requireNonNull(modelPath, "modelPath");
        Path file = modelPath.toAbsolutePath().normalize();
        if (!Files.isRegularFile(file)) {
            throw new LoaderException("Model file not found: " + file);
        }
        String contents;
        try {
            contents = Files.readString(file, MODEL_CHARSET);
        } catch (IOException ex) {
            throw new LoaderException("Failed to read model file: " + file, ex);
        }
        return load(file.toString(), contents);
    }

    public LoaderResult load(String sourceName, String contents) throws LoaderException {
        LOGGER.info("Parsing input file for equations: " + sourceName + " ...");
        List<LoaderMessage> messages = new ArrayList<>();
        ModelFileNode modelFile;
        try {
            modelFile = astBuilder.parse(sourceName, contents, messages);
        } catch (GrammarMismatchException ex) {
            drainDebugOutput(sourceName, messages);
            if (messages.isEmpty()) {
                throw ex;
            }
            throw new GrammarMismatchException(sourceName, diagnostics(messages), ex);
        } catch (ModelParseException ex) {
            drainDebugOutput(sourceName, messages);
            StringBuilder message = new StringBuilder(ex.getMessage());
            List<String> recent = diagnostics(messages);
            if (!recent.isEmpty()) {
                message.append("\nRecent debug output:");
                for (String line : recent) {
                    message.append("\n  ").append(line);
                }
            }
            throw new ModelParseException(message.toString(), ex);
        }
        drainDebugOutput(sourceName, messages);
        if (LOGGER.isLoggable(Level.FINE)) {
            for (RegionNode region : modelFile.getRegions()) {
                for (EquationNode equation : region.getEquations()) {
                    LOGGER.fine("Equation: " + equation.getName());
                    LOGGER.fine("Left side of equation: " + equation.getLeftSide());
                    LOGGER.fine("Right side of equation: " + equation.getRightSide());
                }
            }
        }
        LOGGER.info(modelFile.getEquationCount() + " equations found.");
        return new LoaderResult(modelFile, messages);
    }

    /** Every warning, then the tail of the debug output. */
    private static List<String> diagnostics(List<LoaderMessage> messages) {
        List<String> details = new ArrayList<>();
        List<String> debug = new ArrayList<>();
        for (LoaderMessage message : messages) {
            if (message.getLevel() == LoaderMessage.Level.INFO) {
                debug.add(message.getMessage());
            } else {
                details.add(message.getMessage());
            }
        }
        details.addAll(debug.subList(Math.max(0, debug.size() - RECENT_DEBUG_LINES), debug.size()));
        return details;
    }

    private static void drainDebugOutput(String sourceName, List<LoaderMessage> messages) {
        for (String tokenLine : DebugFlags.drainCapturedTokens()) {
            messages.add(new LoaderMessage(LoaderMessage.Level.INFO, "[tokens] " + tokenLine, sourceName, 0));
        }
        for (String diagnostic : DebugFlags.drainCapturedDiagnostics()) {
            messages.add(
                    new LoaderMessage(LoaderMessage.Level.INFO, "[diagnostic] " + diagnostic, sourceName, 0));
        }
    }
}
