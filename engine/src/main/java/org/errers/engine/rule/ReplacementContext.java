package org.errers.engine.rule;

import org.errers.engine.source.SourceLocation;

/**
 * Services the running engine offers to replacement functions.
 */
public interface ReplacementContext {

    /** Document location of the match being replaced. */
    SourceLocation location();

    /**
     * Reads a file relative to the document root and registers its text so that the spliced text keeps its
     * own locations. Returns the empty string, after recording a warning, when the file is missing or
     * already being inserted.
     *
     * @param defaultExtension appended unless the name already ends with it; may be {@code null}
     */
    String insertFile(String name, String defaultExtension);

    /** Stem of the primary document, used for files like {@code <stem>.bbl}. */
    String documentStem();
}
