package org.errers.engine.rule;

import java.util.Objects;
import java.util.regex.Matcher;
import org.errers.engine.pattern.CompiledPattern;

/**
 * A single match handed to a {@link Replacement}.
 */
public final class RuleMatch {
    private final Matcher matcher;
    private final CompiledPattern pattern;
    private final ReplacementContext context;

    public RuleMatch(Matcher matcher, CompiledPattern pattern, ReplacementContext context) {
        this.matcher = Objects.requireNonNull(matcher, "matcher");
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        this.context = context;
    }

    /** The whole match. */
    public String group() {
        return matcher.group();
    }

    /**
     * Text of a named group, or {@code null} when the group did not take part in the match.
     *
     * @throws IllegalArgumentException if the pattern has no such group
     */
    public String group(String name) {
        if (!pattern.hasGroup(name)) {
            throw new IllegalArgumentException("No group named '" + name + "' in '" + pattern.getTemplate() + "'");
        }
        return matcher.group(name);
    }

    /** Like {@link #group(String)} but never {@code null}. */
    public String value(String name) {
        String value = group(name);
        return value == null ? "" : value;
    }

    public boolean isPresent(String name) {
        return group(name) != null;
    }

    public int start() {
        return matcher.start();
    }

    public int end() {
        return matcher.end();
    }

    public ReplacementContext context() {
        if (context == null) {
            throw new IllegalStateException("No replacement context available");
        }
        return context;
    }
}
