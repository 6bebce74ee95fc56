package com.modeldoc.loader;

import com.modeldoc.loader.ast.BlockNode;
import com.modeldoc.loader.ast.EquationNode;
import com.modeldoc.loader.ast.ModelFileNode;
import com.modeldoc.loader.ast.Placement;
import com.modeldoc.loader.ast.RegionNode;
import com.modeldoc.loader.ast.SourceLocation;
import com.modeldoc.loader.grammar.ModelLexer;
import com.modeldoc.loader.grammar.ModelParser;
import com.modeldoc.loader.grammar.ModelParserBaseVisitor;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.ParseCancellationException;

/**
 * Parses model file text into {@link ModelFileNode}s. Instances hold no per-parse state and can be
 * shared; every call builds its own lexer and parser.
 */
public final class ModelAstBuilder {
    private static final Logger LOGGER = Logger.getLogger(ModelAstBuilder.class.getName());

    private final SourcePreprocessor preprocessor;

    public ModelAstBuilder() {
        this(new SourcePreprocessor());
    }

    public ModelAstBuilder(SourcePreprocessor preprocessor) {
        this.preprocessor = Objects.requireNonNull(preprocessor, "preprocessor");
    }

    /** Parse raw model file text; warnings about skipped blocks are only logged. */
    public ModelFileNode parse(String sourceName, String input) throws ModelParseException {
        return parse(sourceName, input, new ArrayList<>());
    }

    /**
     * Parse raw model file text. An {@code ADDEQ} whose block does not follow the equation grammar
     * is treated as ordinary text: a warning goes to {@code messages} and the scan resumes right
     * after the keyword.
     *
     * @throws GrammarMismatchException when no {@code ADDEQ} block parses
     */
    public ModelFileNode parse(String sourceName, String input, List<LoaderMessage> messages)
            throws ModelParseException {
        Objects.requireNonNull(sourceName, "sourceName");
        Objects.requireNonNull(input, "input");
        CharStream stream = CharStreams.fromString(preprocessor.process(input), sourceName);
        AstBuildingVisitor visitor = new AstBuildingVisitor(sourceName);

        ScanPosition position = ScanPosition.START;
        while (position != null) {
            ModelLexer lexer = lexerAt(stream, position);
            CommonTokenStream tokens = new CommonTokenStream(lexer);
            ModelParser parser = new ModelParser(tokens);
            parser.removeErrorListeners();
            parser.addErrorListener(ThrowingErrorListener.INSTANCE);
            if (DebugFlags.isParserTraceEnabled()) {
                parser.addErrorListener(DebugFlags.diagnosticListener());
            }

            ModelParser.NextBlockContext step;
            try {
                step = parser.nextBlock();
            } catch (ParseCancellationException ex) {
                Token keyword = blockKeyword(tokens);
                if (keyword == null) {
                    throw new ModelParseException(ex.getMessage(), ex);
                }
                captureTokens(tokens, lexer, tokens.size() - 1);
                String warning = "Skipping malformed ADDEQ block: " + ex.getMessage();
                LOGGER.fine(warning);
                messages.add(
                        new LoaderMessage(LoaderMessage.Level.WARNING, warning, sourceName, keyword.getLine()));
                position = ScanPosition.after(keyword);
                continue;
            }
            if (step.block() == null) {
                captureTokens(tokens, lexer, tokens.size() - 1);
                position = null;
            } else {
                Token terminator = step.block().getStop();
                captureTokens(tokens, lexer, terminator.getTokenIndex());
                visitor.visitBlock(step.block());
                position = ScanPosition.after(terminator);
            }
        }

        ModelFileNode modelFile = visitor.build();
        if (modelFile.getBlocks().isEmpty()) {
            throw new GrammarMismatchException(sourceName);
        }
        return modelFile;
    }

    private static ModelLexer lexerAt(CharStream stream, ScanPosition position) {
        stream.seek(position.offset);
        ModelLexer lexer = new ModelLexer(stream);
        lexer.setLine(position.line);
        lexer.setCharPositionInLine(position.column);
        lexer.removeErrorListeners();
        lexer.addErrorListener(ThrowingErrorListener.INSTANCE);
        return lexer;
    }

    /**
     * The ADDEQ that opened the failed block: the first one followed by an optional placement and a
     * comma. Stray keywords before it are skipped with it.
     */
    private static Token blockKeyword(CommonTokenStream tokens) {
        List<Token> buffered = tokens.getTokens();
        for (int i = 0; i < buffered.size(); i++) {
            if (buffered.get(i).getType() != ModelLexer.ADDEQ) {
                continue;
            }
            int next = i + 1;
            if (next < buffered.size()
                    && (buffered.get(next).getType() == ModelLexer.TOP
                            || buffered.get(next).getType() == ModelLexer.BOTTOM)) {
                next++;
            }
            if (next < buffered.size() && buffered.get(next).getType() == ModelLexer.COMMA) {
                return buffered.get(i);
            }
        }
        return null;
    }

    private static void captureTokens(CommonTokenStream tokens, ModelLexer lexer, int lastIndex) {
        if (DebugFlags.isTokenDebugEnabled() && lastIndex >= 0) {
            DebugFlags.captureTokens(tokens.getTokens(0, lastIndex), lexer);
        }
    }

    /** Where the next lexer starts: code point offset, 1-based line, 0-based column. */
    private static final class ScanPosition {
        static final ScanPosition START = new ScanPosition(0, 1, 0);

        final int offset;
        final int line;
        final int column;

        ScanPosition(int offset, int line, int column) {
            this.offset = offset;
            this.line = line;
            this.column = column;
        }

        /** Just past a single-line token. */
        static ScanPosition after(Token token) {
            int length = token.getStopIndex() - token.getStartIndex() + 1;
            return new ScanPosition(
                    token.getStopIndex() + 1, token.getLine(), token.getCharPositionInLine() + length);
        }
    }

    private static final class AstBuildingVisitor extends ModelParserBaseVisitor<Void> {
        private final String sourceName;
        private final List<BlockNode> blocks = new ArrayList<>();
        private List<RegionNode> regions;

        AstBuildingVisitor(String sourceName) {
            this.sourceName = sourceName;
        }

        ModelFileNode build() {
            return new ModelFileNode(sourceName, blocks);
        }

        @Override
        public Void visitBlock(ModelParser.BlockContext ctx) {
            regions = new ArrayList<>();
            for (ModelParser.BlockItemContext item : ctx.blockItem()) {
                if (item.region() != null) {
                    visit(item.region());
                }
            }
            blocks.add(new BlockNode(placement(ctx.placement()), regions, location(ctx.ADDEQ().getSymbol())));
            return null;
        }

        @Override
        public Void visitMarkedRegion(ModelParser.MarkedRegionContext ctx) {
            List<EquationNode> equations = equations(ctx.equation());
            if (equations.isEmpty()) {
                // --region ... --endregion around nothing is a comment, not a region.
                return null;
            }
            String name = ctx.regionLabel() == null ? "" : ctx.regionLabel().getText().trim();
            regions.add(new RegionNode(name, equations, location(ctx.REGION().getSymbol())));
            return null;
        }

        @Override
        public Void visitUnmarkedRegion(ModelParser.UnmarkedRegionContext ctx) {
            List<EquationNode> equations = equations(ctx.equation());
            regions.add(new RegionNode("", equations, equations.get(0).getLocation()));
            return null;
        }

        private List<EquationNode> equations(List<ModelParser.EquationContext> contexts) {
            List<EquationNode> equations = new ArrayList<>(contexts.size());
            for (ModelParser.EquationContext ctx : contexts) {
                Token head = ctx.EQUATION_HEAD().getSymbol();
                String headText = head.getText();
                String name = headText.substring(0, headText.length() - 1).trim();
                equations.add(
                        new EquationNode(
                                name,
                                ctx.leftText().getText(),
                                ctx.rightText().getText(),
                                location(head)));
            }
            return equations;
        }

        private Placement placement(ModelParser.PlacementContext ctx) {
            if (ctx == null) {
                return Placement.DEFAULT;
            }
            return ctx.TOP() != null ? Placement.TOP : Placement.BOTTOM;
        }

        private SourceLocation location(Token token) {
            return new SourceLocation(sourceName, token.getLine(), token.getCharPositionInLine() + 1);
        }
    }
}
