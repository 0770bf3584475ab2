package org.errers.engine.rule;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import org.errers.engine.pattern.CompiledPattern;
import org.errers.engine.pattern.Guard;
import org.errers.engine.pattern.PatternCompiler;
import org.errers.engine.pattern.PatternError;

/**
 * A fixed sequence of substitutions applied to a fragment of text, typically a captured argument, from
 * inside a replacement function. Each substitution replaces all its matches once, or until the fragment
 * stops changing when it is iterative. Fragments are short and never carry locations, so no time budget
 * applies.
 */
public final class TextRules {
    private static final int MAX_PASSES = 1000;

    private final List<Entry> entries;

    private record Entry(CompiledPattern pattern, Replacement replacement, boolean iterative) {}

    private TextRules(List<Entry> entries) {
        this.entries = List.copyOf(entries);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Shorthand for a single substitution. */
    public static TextRules of(String template, String replacement) {
        return builder().add(template, replacement).build();
    }

    public String apply(String text) {
        String current = Objects.requireNonNull(text, "text");
        for (Entry entry : entries) {
            int passes = 0;
            String next = substitute(entry, current);
            while (entry.iterative() && !next.equals(current) && ++passes < MAX_PASSES) {
                current = next;
                next = substitute(entry, current);
            }
            current = next;
        }
        return current;
    }

    public int size() {
        return entries.size();
    }

    private static String substitute(Entry entry, String text) {
        CompiledPattern pattern = entry.pattern();
        Matcher matcher = pattern.matcher(text);
        StringBuilder out = null;
        int last = 0;
        while (pattern.find(matcher, text)) {
            if (out == null) {
                out = new StringBuilder(text.length());
            }
            out.append(text, last, matcher.start())
                    .append(entry.replacement().apply(new RuleMatch(matcher, pattern, null)));
            last = matcher.end();
        }
        if (out == null) {
            return text;
        }
        return out.append(text, last, text.length()).toString();
    }

    /** Collects substitutions; templates are fixed at build time so compilation failures are bugs. */
    public static final class Builder {
        private final List<Entry> entries = new ArrayList<>();

        private Builder() {}

        public Builder add(String template, String replacement) {
            CompiledPattern pattern = PatternCompiler.internal(template);
            try {
                entries.add(new Entry(pattern, ReplacementTemplate.parse(replacement, pattern), false));
            } catch (PatternError e) {
                throw new IllegalStateException(e.getMessage(), e);
            }
            return this;
        }

        public Builder add(String template, Replacement replacement) {
            entries.add(new Entry(PatternCompiler.internal(template), replacement, false));
            return this;
        }

        public Builder addIterative(String template, Replacement replacement) {
            entries.add(new Entry(PatternCompiler.internal(template), replacement, true));
            return this;
        }

        public Builder add(String template, Guard guard, String replacement) {
            CompiledPattern pattern = PatternCompiler.internal(template, guard);
            try {
                entries.add(new Entry(pattern, ReplacementTemplate.parse(replacement, pattern), false));
            } catch (PatternError e) {
                throw new IllegalStateException(e.getMessage(), e);
            }
            return this;
        }

        public TextRules build() {
            return new TextRules(entries);
        }
    }
}
