package org.errers.engine;

import java.util.List;
import org.errers.engine.source.SourceLocation;

/**
 * A rule declared in a document comment could not be parsed or compiled. Detected before any phase runs.
 */
public final class DocumentRuleError extends ExtractionException {
    public DocumentRuleError(String message, SourceLocation location, Throwable cause) {
        super(message, location, List.of(), cause);
    }

    public DocumentRuleError(DocumentRuleError error, List<ExtractionMessage> messages) {
        super(error.getRawMessage(), error.getLocation(), messages, error.getCause());
    }

    private String getRawMessage() {
        String message = getMessage();
        String suffix = " (" + getLocation() + ")";
        return getLocation() != null && message.endsWith(suffix)
                ? message.substring(0, message.length() - suffix.length())
                : message;
    }
}
