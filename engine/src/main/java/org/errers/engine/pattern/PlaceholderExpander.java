package org.errers.engine.pattern;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands the {@code %}-placeholders of a rule template into a regex for {@link Pattern#COMMENTS} mode.
 *
 * <p>Placeholders:
 * <ul>
 *   <li>{@code %c}, {@code %r}, {@code %s}: an argument in curly, round or square brackets with at most one
 *       nested level; the content is captured as {@code c1}, {@code r1}, {@code s1}, ...</li>
 *   <li>{@code %C}: like {@code %c}, or a single command token or character when no bracket follows.</li>
 *   <li>{@code %h}: horizontal space; {@code %n}: space with at most one line break plus comment lines;
 *       {@code %w}: any white space and comment lines; {@code %m}: a command token.</li>
 * </ul>
 * An empty named group right after an argument placeholder, {@code %c(?P<name>)} or {@code %c(?<name>)},
 * names the capture instead of the running number.
 *
 * <p>Template syntax that differs from {@link Pattern} ({@code (?P<name>)}, {@code (?P=name)},
 * {@code \Z}, literal braces, {@code #} and blanks inside character classes) is rewritten, so expanding
 * an expanded pattern returns it unchanged.
 */
public final class PlaceholderExpander {
    static final String HSPACE = "[\\ \\t]*+";
    static final String NEWLINE = HSPACE + "\\n?+" + HSPACE + "(?:%.*+\\n" + HSPACE + ")*+";
    static final String WHITESPACE = "(?:[\\ \\t\\n]++|%.*+\\n)*+";
    static final String MACRO = "\\\\(?:[a-zA-Z]++|\\s|.)";

    private static final String NAME = "\\\\\\\\(?:(?:[a-zA-Z]++|\\[[a-zA-Z]++\\]|\\((?:\\?:)?[a-zA-Z|]++\\))"
            + "(?:\\?\\+?+)?+)++";
    private static final String ASTERISK = "(?:\\\\\\*\\?\\+?+)?+";
    private static final String COMMAND_PREFIX = "(?<!(?<!\\\\)\\\\)(?<!\\\\newcommand\\{)(?<!\\\\def\\{)";
    private static final Pattern TRAILING_COMMAND = Pattern.compile("(" + NAME + ASTERISK + ")\\z");
    private static final Pattern COMMAND_BEFORE_TOKEN =
            Pattern.compile("(" + NAME + ASTERISK + "(?:%[rs]\\?)*+)(?=%C)");
    private static final Pattern QUANTIFIER = Pattern.compile("\\{(\\d*)(,(\\d*))?\\}");
    private static final Pattern GROUP_NAME = Pattern.compile("[a-zA-Z][a-zA-Z0-9]*");

    private enum Bracket {
        CURLY('c', "\\{", "\\}"),
        ROUND('r', "\\(", "\\)"),
        SQUARE('s', "\\[", "\\]");

        final char prefix;
        final String open;
        final String close;
        final String nonBracket;
        final String content;

        Bracket(char prefix, String open, String close) {
            this.prefix = prefix;
            this.open = "(?<!\\\\)" + open;
            this.close = "(?<!\\\\)" + close;
            this.nonBracket = "(?>(?!" + this.open + ")(?!" + this.close + ")(?s:.))";
            this.content = "(?:" + nonBracket + "++|" + this.open + nonBracket + "*+" + this.close + ")*+";
        }

        static Bracket of(char placeholder) {
            return switch (placeholder) {
                case 'c', 'C' -> CURLY;
                case 'r' -> ROUND;
                case 's' -> SQUARE;
                default -> throw new IllegalArgumentException("Not an argument placeholder: %" + placeholder);
            };
        }
    }

    /** Result of an expansion: the regex and its capture groups in pattern order. */
    public record Expansion(String regex, List<CaptureGroup> groups) {}

    public Expansion expand(String template) {
        Objects.requireNonNull(template, "template");
        String text = adjustCommandBoundaries(template);
        StringBuilder out = new StringBuilder(text.length() * 4);
        List<CaptureGroup> groups = new ArrayList<>();
        int[] counters = new int[Bracket.values().length];
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            i = switch (c) {
                case '\\' -> copyEscape(text, i, out);
                case '[' -> copyClass(text, i, out);
                case '#' -> copyComment(text, i, out);
                case '(' -> copyGroupOpening(text, i, out, groups);
                case '{' -> copyBrace(text, i, out);
                case '}' -> {
                    out.append("\\}");
                    yield i + 1;
                }
                case '%' -> expandPlaceholder(text, i, out, groups, counters);
                default -> {
                    out.append(c);
                    yield i + 1;
                }
            };
        }
        return new Expansion(out.toString(), List.copyOf(groups));
    }

    /**
     * Keeps command templates from matching inside longer command names or after an escaping backslash.
     */
    static String adjustCommandBoundaries(String template) {
        String adjusted = template;
        if (adjusted.startsWith("\\\\") && adjusted.length() > 2) {
            adjusted = COMMAND_PREFIX + adjusted;
        }
        Matcher trailing = TRAILING_COMMAND.matcher(adjusted);
        if (trailing.find()) {
            adjusted = adjusted.substring(0, trailing.end(1)) + "(?![a-zA-Z])(?:%n(?!\\n)|%h)";
        }
        return COMMAND_BEFORE_TOKEN.matcher(adjusted)
                .replaceAll(result -> Matcher.quoteReplacement(result.group(1)) + "(?![a-zA-Z])");
    }

    private static int copyEscape(String text, int i, StringBuilder out) {
        if (i + 1 >= text.length()) {
            out.append('\\');
            return i + 1;
        }
        char d = text.charAt(i + 1);
        if (d == 'Z') {
            out.append("\\z");
            return i + 2;
        }
        if ((d == 'p' || d == 'P' || d == 'x' || d == 'N') && i + 2 < text.length() && text.charAt(i + 2) == '{') {
            int close = text.indexOf('}', i + 2);
            int end = close < 0 ? text.length() : close + 1;
            out.append(text, i, end);
            return end;
        }
        out.append('\\').append(d);
        return i + 2;
    }

    private static int copyClass(String text, int i, StringBuilder out) {
        out.append('[');
        int j = i + 1;
        if (j < text.length() && text.charAt(j) == '^') {
            out.append('^');
            j++;
        }
        if (j < text.length() && text.charAt(j) == ']') {
            out.append("\\]");
            j++;
        }
        while (j < text.length()) {
            char ch = text.charAt(j);
            if (ch == '\\' && j + 1 < text.length()) {
                out.append(ch).append(text.charAt(j + 1));
                j += 2;
                continue;
            }
            if (ch == ']') {
                out.append(']');
                return j + 1;
            }
            switch (ch) {
                case ' ' -> out.append("\\ ");
                case '#' -> out.append("\\#");
                case '[' -> out.append("\\[");
                case '&' -> out.append("\\&");
                case '\n' -> out.append("\\n");
                case '\t' -> out.append("\\t");
                default -> out.append(ch);
            }
            j++;
        }
        return j;
    }

    private static int copyComment(String text, int i, StringBuilder out) {
        int end = text.indexOf('\n', i);
        end = end < 0 ? text.length() : end + 1;
        out.append(text, i, end);
        return end;
    }

    private static int copyGroupOpening(String text, int i, StringBuilder out, List<CaptureGroup> groups) {
        if (text.startsWith("(?P<", i)) {
            int close = requireIndex(text, '>', i);
            String name = validName(text.substring(i + 4, close));
            groups.add(new CaptureGroup(name, GroupFamily.EXPLICIT));
            out.append("(?<").append(name).append('>');
            return close + 1;
        }
        if (text.startsWith("(?P=", i)) {
            int close = requireIndex(text, ')', i);
            out.append("\\k<").append(validName(text.substring(i + 4, close))).append('>');
            return close + 1;
        }
        if (text.startsWith("(?#", i)) {
            return requireIndex(text, ')', i) + 1;
        }
        if (isNamedGroup(text, i)) {
            int close = requireIndex(text, '>', i);
            String name = validName(text.substring(i + 3, close));
            groups.add(new CaptureGroup(name, GroupFamily.EXPLICIT));
            out.append(text, i, close + 1);
            return close + 1;
        }
        out.append('(');
        return i + 1;
    }

    private static int copyBrace(String text, int i, StringBuilder out) {
        Matcher quantifier = QUANTIFIER.matcher(text).region(i, text.length());
        if (quantifier.lookingAt()) {
            String min = quantifier.group(1);
            String max = quantifier.group(3);
            boolean comma = quantifier.group(2) != null;
            if (!min.isEmpty() && !comma) {
                out.append('{').append(min).append('}');
                return quantifier.end();
            }
            if (comma && (!min.isEmpty() || (max != null && !max.isEmpty()))) {
                out.append('{').append(min.isEmpty() ? "0" : min).append(',').append(max).append('}');
                return quantifier.end();
            }
        }
        out.append("\\{");
        return i + 1;
    }

    private static int expandPlaceholder(
            String text, int i, StringBuilder out, List<CaptureGroup> groups, int[] counters) {
        if (i + 1 >= text.length()) {
            out.append('%');
            return i + 1;
        }
        char placeholder = text.charAt(i + 1);
        switch (placeholder) {
            case 'h' -> out.append(HSPACE);
            case 'n' -> out.append(NEWLINE);
            case 'w' -> out.append(WHITESPACE);
            case 'm' -> out.append(MACRO);
            case 'c', 'C', 'r', 's' -> {
                Bracket bracket = Bracket.of(placeholder);
                int next = i + 2;
                String name;
                int overrideEnd = overrideEnd(text, next, placeholder);
                if (overrideEnd > 0) {
                    int nameStart = text.startsWith("(?P<", next) ? next + 4 : next + 3;
                    name = validName(text.substring(nameStart, overrideEnd - 2));
                    next = overrideEnd;
                } else {
                    name = String.valueOf(bracket.prefix) + (++counters[bracket.ordinal()]);
                }
                if (placeholder == 'C') {
                    groups.add(new CaptureGroup(name, GroupFamily.CURLY_OR_TOKEN));
                    out.append(argumentOrToken(bracket, name));
                } else {
                    groups.add(new CaptureGroup(name, familyOf(bracket)));
                    out.append(argument(bracket, name));
                }
                return next;
            }
            default -> {
                out.append('%');
                return i + 1;
            }
        }
        return i + 2;
    }

    /** End of an empty naming group at {@code at}, or -1 when there is none. */
    private static int overrideEnd(String text, int at, char placeholder) {
        if (text.startsWith("(?P<", at)) {
            int close = text.indexOf('>', at);
            if (close < 0 || close + 1 >= text.length() || text.charAt(close + 1) != ')') {
                throw new IllegalArgumentException("Malformed group name after %" + placeholder + " at index " + at);
            }
            return close + 2;
        }
        if (isNamedGroup(text, at)) {
            int close = text.indexOf('>', at);
            if (close > 0 && close + 1 < text.length() && text.charAt(close + 1) == ')') {
                return close + 2;
            }
        }
        return -1;
    }

    private static String argument(Bracket bracket, String name) {
        return "(?:" + NEWLINE + bracket.open + "(?<" + name + ">" + bracket.content + ")" + bracket.close + ")";
    }

    /**
     * {@code %C}: an empty marker group records whether an opening bracket was consumed, and back-references
     * to it select the bracketed content and the closing bracket.
     */
    private static String argumentOrToken(Bracket bracket, String name) {
        String marker = name + "ob";
        String present = "\\k<" + marker + ">";
        return "(?:" + NEWLINE
                + "(?:" + bracket.open + "(?<" + marker + ">))?"
                + "(?<" + name + ">" + present + bracket.content
                + "|(?!" + present + ")(?:" + MACRO + "|(?![\\ \\t\\n])" + bracket.nonBracket + "))"
                + "(?:" + present + bracket.close + "|(?!" + present + ")))";
    }

    private static GroupFamily familyOf(Bracket bracket) {
        return switch (bracket) {
            case CURLY -> GroupFamily.CURLY;
            case ROUND -> GroupFamily.ROUND;
            case SQUARE -> GroupFamily.SQUARE;
        };
    }

    private static boolean isNamedGroup(String text, int i) {
        return text.startsWith("(?<", i)
                && i + 3 < text.length()
                && text.charAt(i + 3) != '='
                && text.charAt(i + 3) != '!';
    }

    private static int requireIndex(String text, char c, int from) {
        int index = text.indexOf(c, from);
        if (index < 0) {
            throw new IllegalArgumentException("Unterminated group at index " + from);
        }
        return index;
    }

    private static String validName(String name) {
        if (!GROUP_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid group name '" + name + "'");
        }
        return name;
    }
}
