package org.errers.engine.rule;

import java.util.ArrayList;
import java.util.List;
import org.errers.engine.pattern.CompiledPattern;
import org.errers.engine.pattern.PatternError;

/**
 * A replacement string with {@code \g<name>} group references, parsed once against its pattern.
 */
public final class ReplacementTemplate implements Replacement {
    private static final String WHOLE_MATCH = "0";

    private final String source;
    private final List<Part> parts;

    private record Part(String literal, String group) {}

    private ReplacementTemplate(String source, List<Part> parts) {
        this.source = source;
        this.parts = List.copyOf(parts);
    }

    public static ReplacementTemplate parse(String source, CompiledPattern pattern) throws PatternError {
        List<Part> parts = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        int i = 0;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c != '\\') {
                literal.append(c);
                i++;
                continue;
            }
            if (i + 1 >= source.length()) {
                throw error("Dangling backslash at the end of replacement '" + source + "'", pattern);
            }
            char d = source.charAt(i + 1);
            if (d == 'g') {
                int close = source.indexOf('>', i);
                if (i + 2 >= source.length() || source.charAt(i + 2) != '<' || close < 0) {
                    throw error("Malformed group reference in replacement '" + source + "'", pattern);
                }
                String name = source.substring(i + 3, close);
                if (!name.equals(WHOLE_MATCH) && !name.isEmpty() && Character.isDigit(name.charAt(0))) {
                    throw error("Positional reference \\g<" + name + "> is not supported, use group names", pattern);
                }
                if (!name.equals(WHOLE_MATCH) && !pattern.hasGroup(name)) {
                    throw error("Unknown group '" + name + "' in replacement '" + source + "'", pattern);
                }
                flush(literal, parts);
                parts.add(new Part(null, name));
                i = close + 1;
                continue;
            }
            if (Character.isDigit(d)) {
                throw error("Positional reference \\" + d + " is not supported, use \\g<name>", pattern);
            }
            switch (d) {
                case 'n' -> literal.append('\n');
                case 't' -> literal.append('\t');
                case 'r' -> literal.append('\r');
                case 'f' -> literal.append('\f');
                case 'v' -> literal.append('\u000B');
                case 'a' -> literal.append('\u0007');
                case 'b' -> literal.append('\b');
                case '\\' -> literal.append('\\');
                default -> {
                    if ((d >= 'a' && d <= 'z') || (d >= 'A' && d <= 'Z')) {
                        throw error("Bad escape \\" + d + " in replacement '" + source + "'", pattern);
                    }
                    literal.append('\\').append(d);
                }
            }
            i += 2;
        }
        flush(literal, parts);
        return new ReplacementTemplate(source, parts);
    }

    @Override
    public String apply(RuleMatch match) {
        StringBuilder builder = new StringBuilder();
        for (Part part : parts) {
            if (part.literal() != null) {
                builder.append(part.literal());
            } else if (part.group().equals(WHOLE_MATCH)) {
                builder.append(match.group());
            } else {
                builder.append(match.value(part.group()));
            }
        }
        return builder.toString();
    }

    public String getSource() {
        return source;
    }

    @Override
    public String toString() {
        return source;
    }

    private static void flush(StringBuilder literal, List<Part> parts) {
        if (literal.length() > 0) {
            parts.add(new Part(literal.toString(), null));
            literal.setLength(0);
        }
    }

    private static PatternError error(String message, CompiledPattern pattern) {
        return new PatternError(message, pattern.getTemplate(), pattern.getScope(), pattern.getLocation());
    }
}
