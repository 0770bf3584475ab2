package org.errers.engine.pattern;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.errers.engine.source.SourceLocation;

/**
 * A rule template together with its expanded regex, capture groups and guards.
 */
public final class CompiledPattern {
    private final String template;
    private final String regex;
    private final Pattern pattern;
    private final List<CaptureGroup> groups;
    private final Set<Guard> guards;
    private final String scope;
    private final SourceLocation location;
    private final long compileNanos;

    CompiledPattern(
            String template,
            String regex,
            Pattern pattern,
            List<CaptureGroup> groups,
            Set<Guard> guards,
            String scope,
            SourceLocation location,
            long compileNanos) {
        this.template = Objects.requireNonNull(template, "template");
        this.regex = regex;
        this.pattern = pattern;
        this.groups = List.copyOf(groups);
        this.guards = Set.copyOf(guards);
        this.scope = scope;
        this.location = location;
        this.compileNanos = compileNanos;
    }

    public String getTemplate() {
        return template;
    }

    public String getRegex() {
        return regex;
    }

    public Pattern getPattern() {
        return pattern;
    }

    public List<CaptureGroup> getGroups() {
        return groups;
    }

    public boolean hasGroup(String name) {
        for (CaptureGroup group : groups) {
            if (group.name().equals(name)) {
                return true;
            }
        }
        return false;
    }

    public Set<Guard> getGuards() {
        return guards;
    }

    public String getScope() {
        return scope;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public long getCompileNanos() {
        return compileNanos;
    }

    public Matcher matcher(CharSequence input) {
        return pattern.matcher(input);
    }

    /**
     * Advances {@code matcher} to the next match whose start satisfies every guard.
     *
     * @param text the text the guards inspect; the matcher input or the string behind it
     */
    public boolean find(Matcher matcher, CharSequence text) {
        if (!matcher.find()) {
            return false;
        }
        while (!acceptsStart(text, matcher.start())) {
            int next = matcher.start() + 1;
            if (next > text.length() || !matcher.find(next)) {
                return false;
            }
        }
        return true;
    }

    private boolean acceptsStart(CharSequence text, int start) {
        for (Guard guard : guards) {
            if (!guard.accepts(text, start)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return template;
    }
}
