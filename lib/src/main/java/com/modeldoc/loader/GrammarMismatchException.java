package com.modeldoc.loader;

import java.util.List;

/**
 * No {@code ADDEQ ... ;} block parsed anywhere in the model file. Diagnostics, when present, explain
 * why candidate blocks were skipped.
 */
public final class GrammarMismatchException extends ModelParseException {
    private final String sourceName;
    private final List<String> diagnostics;

    public GrammarMismatchException(String sourceName) {
        super(message(sourceName, List.of()));
        this.sourceName = sourceName;
        this.diagnostics = List.of();
    }

    public GrammarMismatchException(String sourceName, List<String> diagnostics, Throwable cause) {
        super(message(sourceName, diagnostics), cause);
        this.sourceName = sourceName;
        this.diagnostics = List.copyOf(diagnostics);
    }

    private static String message(String sourceName, List<String> diagnostics) {
        StringBuilder message = new StringBuilder("No equation found in file: ").append(sourceName);
        for (String line : diagnostics) {
            message.append("\n  ").append(line);
        }
        return message.toString();
    }

    public String getSourceName() {
        return sourceName;
    }

    public List<String> getDiagnostics() {
        return diagnostics;
    }
}
