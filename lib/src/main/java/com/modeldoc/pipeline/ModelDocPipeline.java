package com.modeldoc.pipeline;

import com.modeldoc.loader.LoaderException;
import com.modeldoc.loader.LoaderMessage;
import com.modeldoc.loader.LoaderResult;
import com.modeldoc.loader.ModelAstBuilder;
import com.modeldoc.loader.ModelLoader;
import com.modeldoc.model.DocumentModel;
import com.modeldoc.model.Model;
import com.modeldoc.model.ModelAssembler;
import com.modeldoc.model.Region;
import com.modeldoc.render.ModelRenderer;
import com.modeldoc.semantic.CrossReferenceLinker;
import com.modeldoc.semantic.EquationNormalizer;
import com.modeldoc.semantic.LegendAnnotator;
import com.modeldoc.semantic.ParameterSubstituter;
import com.modeldoc.table.KeyValueTable;
import com.modeldoc.table.KeyValueTableReader;
import com.modeldoc.validation.ValidationRunner;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * parse, normalize, validate, link, substitute parameters, attach legends, assemble, render.
 * Each stage takes the complete output of the previous one. Any {@link LoaderException} aborts the
 * run before the output file is created.
 */
public final class ModelDocPipeline {
    private static final Logger LOGGER = Logger.getLogger(ModelDocPipeline.class.getName());

    private final ModelLoader loader;
    private final ModelRenderer renderer;
    private final ModelAssembler assembler;
    private final EquationNormalizer normalizer = new EquationNormalizer();
    private final CrossReferenceLinker linker = new CrossReferenceLinker();
    private final ValidationRunner validation = ValidationRunner.defaultRules();

    public ModelDocPipeline(ModelAstBuilder grammar, ModelRenderer renderer, Clock clock) {
        this.loader = new ModelLoader(grammar);
        this.renderer = Objects.requireNonNull(renderer, "renderer");
        this.assembler = new ModelAssembler(clock);
    }

    public PipelineResult run(PipelineOptions options) throws LoaderException {
        List<LoaderMessage> messages = new ArrayList<>();
        DocumentModel document = build(options, messages);
        Path output = write(document, options.getOutput());
        return new PipelineResult(document, messages, output);
    }

    /** Everything up to and including assembly; nothing is written. */
    public DocumentModel build(PipelineOptions options, List<LoaderMessage> messages) throws LoaderException {
        // Tables are read up front so a missing file fails the run before any work is done.
        KeyValueTableReader tableReader = new KeyValueTableReader(options.getTableCharset());
        Optional<KeyValueTable> parameters =
                readTable(tableReader, options.getParameterTable(), "parameter table", messages);
        Optional<KeyValueTable> legends =
                readTable(tableReader, options.getLegendTable(), "legend table", messages);

        LoaderResult loaded = loader.load(options.getInput());
        messages.addAll(loaded.getMessages());

        Model model = normalizer.normalize(loaded.getModelFile());
        messages.addAll(validation.run(model));
        model = linker.link(model);
        if (parameters.isPresent()) {
            model = new ParameterSubstituter(parameters.get()).substitute(model);
        }
        if (legends.isPresent()) {
            model = new LegendAnnotator(legends.get()).annotate(model);
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            for (Region region : model.getRegions()) {
                LOGGER.fine("Region: " + (region.isNamed() ? region.getName() : "<unnamed>"));
            }
        }
        return assembler.assemble(model);
    }

    private static Optional<KeyValueTable> readTable(
            KeyValueTableReader reader, Optional<Path> path, String description, List<LoaderMessage> messages)
            throws LoaderException {
        if (path.isEmpty()) {
            LOGGER.info("No " + description + " given, skipping.");
            return Optional.empty();
        }
        return Optional.of(reader.read(path.get(), description, messages));
    }

    private Path write(DocumentModel document, Path output) throws LoaderException {
        LOGGER.info("Generating output...");
        Path target = output.toAbsolutePath().normalize();
        Path directory = target.getParent();
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, ".modeldoc", ".tmp");
            try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                renderer.render(document, writer);
            }
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            return target;
        } catch (IOException ex) {
            deleteQuietly(temp);
            throw new LoaderException("Failed to write output: " + target, ex);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException ex) {
            LOGGER.log(Level.WARNING, "Could not delete temporary output " + temp, ex);
        }
    }
}
