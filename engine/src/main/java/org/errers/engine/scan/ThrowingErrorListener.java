package org.errers.engine.scan;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.misc.ParseCancellationException;

/**
 * Aborts the parse of a document rule at the first syntax error, naming the document line it is on. The
 * parsed text starts at the line of the {@code Rule(} keyword.
 */
final class ThrowingErrorListener extends BaseErrorListener {
    private final int firstLine;

    ThrowingErrorListener(int firstLine) {
        this.firstLine = firstLine;
    }

    @Override
    public void syntaxError(
            Recognizer<?, ?> recognizer,
            Object offendingSymbol,
            int line,
            int charPositionInLine,
            String msg,
            RecognitionException e) {
        String source = recognizer.getInputStream().getSourceName();
        throw new ParseCancellationException(source + ":" + (firstLine + line - 1) + ": " + msg, e);
    }
}
