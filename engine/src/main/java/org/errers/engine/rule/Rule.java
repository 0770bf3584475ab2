package org.errers.engine.rule;

import java.util.Locale;
import java.util.Objects;
import org.errers.engine.pattern.CompiledPattern;
import org.errers.engine.source.SourceLocation;

/**
 * A substitution: pattern, replacement and the phase it runs in.
 */
public final class Rule {
    private final CompiledPattern pattern;
    private final Replacement replacement;
    private final Phase phase;
    private final boolean iterative;
    private final boolean generic;
    private final Provenance provenance;

    public Rule(
            CompiledPattern pattern,
            Replacement replacement,
            Phase phase,
            boolean iterative,
            boolean generic,
            Provenance provenance) {
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        this.replacement = Objects.requireNonNull(replacement, "replacement");
        this.phase = Objects.requireNonNull(phase, "phase");
        this.iterative = iterative;
        this.generic = generic;
        this.provenance = Objects.requireNonNull(provenance, "provenance");
    }

    public CompiledPattern getPattern() {
        return pattern;
    }

    public Replacement getReplacement() {
        return replacement;
    }

    public Phase getPhase() {
        return phase;
    }

    public boolean isIterative() {
        return iterative;
    }

    /** Generic rules handle commands no specific rule knows about; they can be switched off as a group. */
    public boolean isGeneric() {
        return generic;
    }

    public Provenance getProvenance() {
        return provenance;
    }

    public String getScope() {
        return pattern.getScope();
    }

    public SourceLocation getLocation() {
        return pattern.getLocation();
    }

    /** Human-readable identity used in diagnostics and the trace. */
    public String describe() {
        StringBuilder builder = new StringBuilder();
        builder.append(provenance.name().toLowerCase(Locale.ROOT)).append(' ').append(getScope());
        if (getLocation() != null) {
            builder.append(" (").append(getLocation()).append(')');
        }
        builder.append(": ").append(pattern.getTemplate());
        return builder.toString();
    }

    public String describeReplacement() {
        return replacement instanceof ReplacementTemplate ? replacement.toString() : "<function>";
    }

    @Override
    public String toString() {
        return describe();
    }
}
