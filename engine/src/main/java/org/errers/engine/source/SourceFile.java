package org.errers.engine.source;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * A file whose text ended up in the document buffer, together with the file that pulled it in.
 */
public final class SourceFile {
    private final String name;
    private final Path path;
    private final SourceFile includer;

    private SourceFile(String name, Path path, SourceFile includer) {
        this.name = Objects.requireNonNull(name, "name");
        this.path = path;
        this.includer = includer;
    }

    public static SourceFile primary(Path path) {
        Path normalized = path.toAbsolutePath().normalize();
        return new SourceFile(path.toString(), normalized, null);
    }

    public static SourceFile anonymous(String name) {
        return new SourceFile(name, null, null);
    }

    public SourceFile include(String displayName, Path includedPath) {
        return new SourceFile(displayName, includedPath.toAbsolutePath().normalize(), this);
    }

    public String getName() {
        return name;
    }

    public Optional<Path> getPath() {
        return Optional.ofNullable(path);
    }

    public Optional<SourceFile> getIncluder() {
        return Optional.ofNullable(includer);
    }

    /**
     * Returns true when {@code candidate} is this file or one of the files that (transitively) included it.
     */
    public boolean isOnIncludeChain(Path candidate) {
        Path normalized = candidate.toAbsolutePath().normalize();
        for (SourceFile current = this; current != null; current = current.includer) {
            if (normalized.equals(current.path)) {
                return true;
            }
        }
        return false;
    }

    public SourceLocation at(int line) {
        return new SourceLocation(name, line);
    }

    @Override
    public String toString() {
        return name;
    }
}
