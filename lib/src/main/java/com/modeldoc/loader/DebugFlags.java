package com.modeldoc.loader;

import com.modeldoc.loader.grammar.ModelLexer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.antlr.v4.runtime.Token;

/**
 * Grammar debugging switches. Both read a system property first and fall back to an environment
 * variable; captured lines are drained by {@link ModelLoader} into INFO messages.
 */
public final class DebugFlags {
    public static final String TOKENS_PROPERTY = "modeldoc.debugTokens";
    public static final String PARSER_PROPERTY = "modeldoc.debugParser";
    private static final String TOKENS_ENV = "MODELDOC_DEBUG_TOKENS";
    private static final String PARSER_ENV = "MODELDOC_DEBUG_PARSER";
    private static final ThreadLocal<List<String>> CAPTURED_TOKENS =
            ThreadLocal.withInitial(ArrayList::new);
    private static final ThreadLocal<List<String>> CAPTURED_DIAGNOSTICS =
            ThreadLocal.withInitial(ArrayList::new);

    private DebugFlags() {}

    public static boolean isTokenDebugEnabled() {
        return flag(TOKENS_PROPERTY, TOKENS_ENV);
    }

    public static boolean isParserTraceEnabled() {
        return flag(PARSER_PROPERTY, PARSER_ENV);
    }

    private static boolean flag(String property, String env) {
        String value = System.getProperty(property);
        if (value != null) {
            return Boolean.parseBoolean(value);
        }
        return Boolean.parseBoolean(System.getenv(env));
    }

    static void captureTokens(List<Token> tokens, ModelLexer lexer) {
        for (Token token : tokens) {
            String symbolic = lexer.getVocabulary().getSymbolicName(token.getType());
            if (symbolic == null) {
                symbolic = token.getType() == Token.EOF ? "EOF" : "#" + token.getType();
            }
            String line =
                    String.format(
                            Locale.ROOT,
                            "%-15s @ %4d:%-3d -> %s",
                            symbolic,
                            token.getLine(),
                            token.getCharPositionInLine() + 1,
                            token.getText().replace("\n", "\\n"));
            CAPTURED_TOKENS.get().add(line);
        }
    }

    static DebugDiagnosticErrorListener diagnosticListener() {
        return new DebugDiagnosticErrorListener();
    }

    static void captureDiagnostic(String message) {
        CAPTURED_DIAGNOSTICS.get().add(message);
    }

    public static List<String> drainCapturedTokens() {
        List<String> captured = new ArrayList<>(CAPTURED_TOKENS.get());
        CAPTURED_TOKENS.get().clear();
        return captured;
    }

    public static List<String> drainCapturedDiagnostics() {
        List<String> captured = new ArrayList<>(CAPTURED_DIAGNOSTICS.get());
        CAPTURED_DIAGNOSTICS.get().clear();
        return captured;
    }
}
