package com.modeldoc.loader;

import java.util.BitSet;
import org.antlr.v4.runtime.DiagnosticErrorListener;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.atn.ATNConfigSet;
import org.antlr.v4.runtime.dfa.DFA;
import org.antlr.v4.runtime.misc.Interval;

/**
 * Records ANTLR ambiguity reports instead of routing them through
 * {@link Parser#notifyErrorListeners(String)}, which would reach {@link ThrowingErrorListener}
 * and abort an otherwise valid parse. The greedy region rules report on most inputs.
 */
final class DebugDiagnosticErrorListener extends DiagnosticErrorListener {

    DebugDiagnosticErrorListener() {
        super(false);
    }

    @Override
    public void reportAmbiguity(
            Parser recognizer,
            DFA dfa,
            int startIndex,
            int stopIndex,
            boolean exact,
            BitSet ambigAlts,
            ATNConfigSet configs) {
        String decision = getDecisionDescription(recognizer, dfa);
        BitSet conflicting = getConflictingAlts(ambigAlts, configs);
        DebugFlags.captureDiagnostic(
                String.format(
                        "ambiguity d=%s: alts=%s exact=%s, input='%s'",
                        decision, conflicting, exact, text(recognizer, startIndex, stopIndex)));
    }

    @Override
    public void reportAttemptingFullContext(
            Parser recognizer,
            DFA dfa,
            int startIndex,
            int stopIndex,
            BitSet conflictingAlts,
            ATNConfigSet configs) {
        DebugFlags.captureDiagnostic(
                String.format(
                        "full-context d=%s, input='%s'",
                        getDecisionDescription(recognizer, dfa),
                        text(recognizer, startIndex, stopIndex)));
    }

    @Override
    public void reportContextSensitivity(
            Parser recognizer,
            DFA dfa,
            int startIndex,
            int stopIndex,
            int prediction,
            ATNConfigSet configs) {
        DebugFlags.captureDiagnostic(
                String.format(
                        "context-sensitivity d=%s, input='%s'",
                        getDecisionDescription(recognizer, dfa),
                        text(recognizer, startIndex, stopIndex)));
    }

    private static String text(Parser recognizer, int startIndex, int stopIndex) {
        return recognizer.getTokenStream().getText(Interval.of(startIndex, stopIndex)).replace("\n", "\\n");
    }
}
