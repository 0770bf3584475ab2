package org.errers.engine.pattern;

import java.util.EnumSet;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.errers.engine.source.SourceLocation;

/**
 * Turns rule templates into {@link CompiledPattern}s: placeholder expansion, guards and
 * compilation with the flags every rule shares.
 */
public final class PatternCompiler {
    private static final Logger LOGGER = Logger.getLogger(PatternCompiler.class.getName());

    public static final int FLAGS =
            Pattern.MULTILINE | Pattern.COMMENTS | Pattern.UNIX_LINES | Pattern.UNICODE_CHARACTER_CLASS;

    private final PlaceholderExpander expander = new PlaceholderExpander();

    public CompiledPattern compile(String template, String scope, SourceLocation location, Guard... guards)
            throws PatternError {
        Set<Guard> guardSet = guards.length == 0 ? EnumSet.noneOf(Guard.class) : EnumSet.of(guards[0], guards);
        long started = System.nanoTime();
        PlaceholderExpander.Expansion expansion;
        try {
            expansion = expander.expand(template);
        } catch (IllegalArgumentException e) {
            throw new PatternError(e.getMessage() + " in '" + template + "'", template, scope, location, e);
        }
        String regex = expansion.regex();
        Pattern pattern;
        try {
            pattern = Pattern.compile(regex, FLAGS);
        } catch (PatternSyntaxException e) {
            throw new PatternError(
                    "Invalid pattern '" + template + "': " + e.getDescription() + " near index " + e.getIndex(),
                    template,
                    scope,
                    location,
                    e);
        }
        long elapsed = System.nanoTime() - started;
        LOGGER.finest(() -> "Compiled '" + template + "' to '" + regex + "'");
        return new CompiledPattern(
                template, regex, pattern, expansion.groups(), guardSet, scope, location, elapsed);
    }

    /** Compiles a pattern the engine itself relies on; failures are programming errors. */
    public static CompiledPattern internal(String template, Guard... guards) {
        try {
            return new PatternCompiler().compile(template, "internal", null, guards);
        } catch (PatternError e) {
            throw new IllegalStateException(e.getMessage(), e);
        }
    }
}
