package org.errers.engine.pattern;

/**
 * Where a named capture group of an expanded pattern came from.
 */
public enum GroupFamily {
    /** {@code %c}: content of a curly-bracketed argument. */
    CURLY('c'),
    /** {@code %C}: a bracketed argument or a single token; shares the {@code c} numbering. */
    CURLY_OR_TOKEN('c'),
    /** {@code %r}: content of a round-bracketed argument. */
    ROUND('r'),
    /** {@code %s}: content of a square-bracketed argument. */
    SQUARE('s'),
    /** A group named by the template author. */
    EXPLICIT('\0');

    private final char prefix;

    GroupFamily(char prefix) {
        this.prefix = prefix;
    }

    public char getPrefix() {
        return prefix;
    }
}
