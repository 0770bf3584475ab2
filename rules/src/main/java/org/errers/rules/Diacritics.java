package org.errers.rules;

import java.text.Normalizer;

/**
 * Combining marks used by the accent commands.
 */
final class Diacritics {
    static final char GRAVE = '\u0300';
    static final char ACUTE = '\u0301';
    static final char CIRCUMFLEX = '\u0302';
    static final char TILDE = '\u0303';
    static final char MACRON = '\u0304';
    static final char BREVE = '\u0306';
    static final char DOT_ABOVE = '\u0307';
    static final char DIAERESIS = '\u0308';
    static final char RING_ABOVE = '\u030A';
    static final char DOUBLE_ACUTE = '\u030B';
    static final char CARON = '\u030C';
    static final char DOT_BELOW = '\u0323';
    static final char CEDILLA = '\u0327';
    static final char OGONEK = '\u0328';

    private Diacritics() {}

    /** Puts {@code mark} on the first character of {@code text}, composed when Unicode has a precomposed form. */
    static String accentFirst(String text, char mark) {
        if (text.isEmpty()) {
            return "";
        }
        int first = text.offsetByCodePoints(0, 1);
        return Normalizer.normalize(text.substring(0, first) + mark, Normalizer.Form.NFKC);
    }

    /** Like {@link #accentFirst} but keeps the rest of {@code text}. */
    static String accentFirstKeepRest(String text, char mark) {
        if (text.isEmpty()) {
            return "";
        }
        int first = text.offsetByCodePoints(0, 1);
        return accentFirst(text, mark) + text.substring(first);
    }
}
