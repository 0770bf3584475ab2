package org.errers.engine.pattern;

/**
 * Helpers for embedding literal text in rule templates.
 */
public final class RegexText {
    private RegexText() {}

    /** Escapes every character that is not an ASCII letter or digit. */
    public static String escape(String literal) {
        StringBuilder builder = new StringBuilder(literal.length() * 2);
        for (int i = 0; i < literal.length(); i++) {
            char c = literal.charAt(i);
            if (c == '\n') {
                builder.append("\\n");
            } else if (c == '\t') {
                builder.append("\\t");
            } else if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')) {
                builder.append(c);
            } else if (Character.isLetterOrDigit(c)) {
                builder.append(c);
            } else {
                builder.append('\\').append(c);
            }
        }
        return builder.toString();
    }
}
