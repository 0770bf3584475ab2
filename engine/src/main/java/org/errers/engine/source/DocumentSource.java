package org.errers.engine.source;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The primary document handed to the engine: either a file on disk or in-memory text.
 */
public final class DocumentSource {
    private static final Logger LOGGER = Logger.getLogger(DocumentSource.class.getName());

    private final SourceFile file;
    private final byte[] content;

    private DocumentSource(SourceFile file, byte[] content) {
        this.file = file;
        this.content = content;
    }

    public static DocumentSource of(Path path) {
        return new DocumentSource(SourceFile.primary(Objects.requireNonNull(path, "path")), null);
    }

    public static DocumentSource ofText(String name, String text) {
        Objects.requireNonNull(text, "text");
        return new DocumentSource(SourceFile.anonymous(name), text.getBytes(StandardCharsets.UTF_8));
    }

    public SourceFile getFile() {
        return file;
    }

    public String getName() {
        return file.getName();
    }

    /** File name without directory and without the last extension. */
    public String getStem() {
        String name = file.getPath().map(p -> p.getFileName().toString()).orElse(file.getName());
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    public Optional<Path> getDirectory() {
        return file.getPath().map(Path::getParent);
    }

    public byte[] readBytes() throws IOException {
        if (content != null) {
            return content.clone();
        }
        return Files.readAllBytes(file.getPath().orElseThrow());
    }

    /**
     * The LaTeX log written next to the document, if there is one. Logs are read as ISO-8859-1 since only
     * ASCII keywords are looked up in them.
     */
    public Optional<String> findCompilerLog() {
        Optional<Path> directory = getDirectory();
        if (directory.isEmpty()) {
            return Optional.empty();
        }
        Path log = directory.get().resolve(getStem() + ".log");
        if (!Files.isRegularFile(log)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(log, StandardCharsets.ISO_8859_1));
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Could not read compiler log " + log, e);
            return Optional.empty();
        }
    }
}
