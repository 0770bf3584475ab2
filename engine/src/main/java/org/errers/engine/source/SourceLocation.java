package org.errers.engine.source;

import java.util.Objects;

/**
 * A line in a named source, as reported in diagnostics and timing tables.
 */
public final class SourceLocation {
    private final String sourceName;
    private final int line;

    public SourceLocation(String sourceName, int line) {
        this.sourceName = Objects.requireNonNull(sourceName, "sourceName");
        this.line = line;
    }

    public String getSourceName() {
        return sourceName;
    }

    public int getLine() {
        return line;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof SourceLocation)) {
            return false;
        }
        SourceLocation other = (SourceLocation) obj;
        return line == other.line && sourceName.equals(other.sourceName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceName, line);
    }

    @Override
    public String toString() {
        return sourceName + ":" + line;
    }
}
