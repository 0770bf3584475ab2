package org.errers.engine.pattern;

/**
 * Zero-width conditions on the start of a match, checked on each candidate start.
 *
 * <p>{@link #getRegexPrefix()} gives a lookbehind for use inside templates where the condition applies
 * in the middle of a pattern. Java needs a bounded lookbehind, so that form only sees runs of up to 15
 * backslashes.
 */
public enum Guard {
    /** The match does not start inside a {@code %} comment. */
    NOT_COMMENTED(""),
    /** The match is not preceded by an odd number of backslashes. */
    NOT_ESCAPED("(?<!(?<!\\\\)\\\\(?:\\\\\\\\){0,7})");

    private final String regexPrefix;

    Guard(String regexPrefix) {
        this.regexPrefix = regexPrefix;
    }

    public String getRegexPrefix() {
        return regexPrefix;
    }

    /**
     * Returns true when a match may start at {@code start}. For {@link #NOT_COMMENTED} the line prefix must
     * consist of characters other than {@code %} and backslash pairs.
     */
    public boolean accepts(CharSequence text, int start) {
        if (this == NOT_ESCAPED) {
            return precedingBackslashes(text, start) % 2 == 0;
        }
        int lineStart = start;
        while (lineStart > 0 && text.charAt(lineStart - 1) != '\n') {
            lineStart--;
        }
        int i = lineStart;
        while (i < start) {
            char c = text.charAt(i);
            if (c == '%') {
                return false;
            }
            if (c == '\\') {
                if (i + 1 >= start) {
                    return false;
                }
                i += 2;
            } else {
                i++;
            }
        }
        return true;
    }

    private static int precedingBackslashes(CharSequence text, int start) {
        int count = 0;
        while (start - count > 0 && text.charAt(start - count - 1) == '\\') {
            count++;
        }
        return count;
    }
}
