package org.errers.engine;

import java.util.Objects;
import org.errers.engine.source.SourceLocation;

/**
 * A diagnostic produced during an extraction run. Messages are collected in order and returned with the
 * result; only fatal problems are raised as {@link ExtractionException}.
 */
public final class ExtractionMessage {

    public enum Level {
        INFO,
        WARNING,
        ERROR
    }

    public enum Kind {
        PATTERN_ERROR(Level.ERROR),
        TIMEOUT_ERROR(Level.ERROR),
        MISSING_FILE_WARNING(Level.WARNING),
        SCAN_WARNING(Level.WARNING),
        RULE_RUNTIME_ERROR(Level.ERROR),
        DOCUMENT_RULE_WARNING(Level.WARNING),
        INFO(Level.INFO);

        private final Level level;

        Kind(Level level) {
            this.level = level;
        }

        public Level getLevel() {
            return level;
        }
    }

    private final Kind kind;
    private final String message;
    private final SourceLocation location;
    private final String rule;

    public ExtractionMessage(Kind kind, String message, SourceLocation location, String rule) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.message = Objects.requireNonNull(message, "message");
        this.location = location;
        this.rule = rule;
    }

    public static ExtractionMessage of(Kind kind, String message, SourceLocation location) {
        return new ExtractionMessage(kind, message, location, null);
    }

    public Kind getKind() {
        return kind;
    }

    public Level getLevel() {
        return kind.getLevel();
    }

    public String getMessage() {
        return message;
    }

    /** Document location the message refers to; {@code null} for run-wide messages. */
    public SourceLocation getLocation() {
        return location;
    }

    /** Identity of the rule involved, or {@code null}. */
    public String getRule() {
        return rule;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append(kind.getLevel()).append(' ').append(kind).append(": ").append(message);
        if (location != null) {
            builder.append(" (").append(location).append(')');
        }
        return builder.toString();
    }
}
