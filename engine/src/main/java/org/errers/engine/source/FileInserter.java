package org.errers.engine.source;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Reads files named by include-style commands so their text can be spliced into the buffer.
 *
 * <p>Missing and recursively included files are not errors: the insertion comes back empty with a
 * problem description. Read failures on existing files are unrecoverable and surface as
 * {@link UncheckedIOException}.
 */
public final class FileInserter {
    private static final Logger LOGGER = Logger.getLogger(FileInserter.class.getName());

    private final Path baseDirectory;
    private final Charset charset;

    public FileInserter(Path baseDirectory, Charset charset) {
        this.baseDirectory = baseDirectory;
        this.charset = Objects.requireNonNull(charset, "charset");
    }

    public Charset getCharset() {
        return charset;
    }

    public Insertion insert(String name, String defaultExtension, SourceFile includer) {
        String fileName = name.strip();
        if (defaultExtension != null && !fileName.endsWith(defaultExtension)) {
            fileName = fileName + defaultExtension;
        }
        Path path = baseDirectory == null ? Path.of(fileName) : baseDirectory.resolve(fileName);
        if (!Files.isRegularFile(path)) {
            return Insertion.problem("File not found: " + path);
        }
        if (includer.isOnIncludeChain(path)) {
            return Insertion.problem("Recursive inclusion of " + path);
        }
        String text;
        try {
            text = new String(Files.readAllBytes(path), charset);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
        LOGGER.fine(() -> "Inserting " + path + " (" + text.length() + " characters)");
        SourceFile inserted = includer.include(fileName, path);
        return new Insertion(text, LocationMap.of(text, inserted), null);
    }

    /** Text of an inserted file, or an empty insertion with the reason nothing was read. */
    public record Insertion(String text, LocationMap locationMap, String problem) {
        static Insertion problem(String problem) {
            return new Insertion("", null, problem);
        }

        public boolean isMissing() {
            return problem != null;
        }
    }
}
