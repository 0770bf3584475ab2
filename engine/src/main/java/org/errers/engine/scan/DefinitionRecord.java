package org.errers.engine.scan;

import java.util.Objects;
import org.errers.engine.source.SourceLocation;

/**
 * A macro, environment or counter declared in the document.
 *
 * @param name the command including its backslash, or the bare environment or counter name
 * @param optionalDefault default of the optional first argument; {@code null} when there is none
 * @param endBody code run at {@code \end}, environments only
 */
public record DefinitionRecord(
        DeclarationKind kind,
        String name,
        int arity,
        String optionalDefault,
        String body,
        String endBody,
        SourceLocation location) {

    public DefinitionRecord {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(name, "name");
        if (arity < 0 || arity > 9) {
            throw new IllegalArgumentException("Arity out of range: " + arity);
        }
        if (optionalDefault != null && arity == 0) {
            throw new IllegalArgumentException("Optional argument without arguments for " + name);
        }
    }

    public boolean hasOptional() {
        return optionalDefault != null;
    }
}
