package org.errers.engine;

import java.util.List;
import org.errers.engine.source.SourceLocation;

/**
 * Checked exception signalling that an extraction run could not complete. Carries the location of the
 * problem, when known, and the diagnostics collected before the run was aborted.
 */
public class ExtractionException extends Exception {
    private final SourceLocation location;
    private final List<ExtractionMessage> messages;

    public ExtractionException(String message) {
        this(message, null, List.of(), null);
    }

    public ExtractionException(String message, Throwable cause) {
        this(message, null, List.of(), cause);
    }

    public ExtractionException(
            String message, SourceLocation location, List<ExtractionMessage> messages, Throwable cause) {
        super(location == null ? message : message + " (" + location + ")", cause);
        this.location = location;
        this.messages = List.copyOf(messages);
    }

    public SourceLocation getLocation() {
        return location;
    }

    /** Diagnostics recorded before the failure. */
    public List<ExtractionMessage> getMessages() {
        return messages;
    }
}
