package org.errers.engine.source;

import java.util.Objects;

/**
 * Origin of one span in a {@link LocationMap}.
 */
public record SourceLine(SourceFile file, int line) {
    public SourceLine {
        Objects.requireNonNull(file, "file");
    }

    public SourceLocation toLocation() {
        return file.at(line);
    }
}
