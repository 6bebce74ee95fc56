package com.modeldoc.loader;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.IntStream;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.misc.ParseCancellationException;

/** Turns the first lexer or parser error into a {@link ParseCancellationException}. */
final class ThrowingErrorListener extends BaseErrorListener {
    static final ThrowingErrorListener INSTANCE = new ThrowingErrorListener();

    private ThrowingErrorListener() {}

    @Override
    public void syntaxError(
            Recognizer<?, ?> recognizer,
            Object offendingSymbol,
            int line,
            int charPositionInLine,
            String msg,
            RecognitionException e) {
        IntStream input = recognizer.getInputStream();
        String source = input == null ? IntStream.UNKNOWN_SOURCE_NAME : input.getSourceName();
        throw new ParseCancellationException(
                source + ":" + line + ":" + (charPositionInLine + 1) + " " + msg, e);
    }
}
