package org.errers.engine.source;

/**
 * One replacement applied to the buffer: {@code [start, end)} of the old text became
 * {@code replacementLength} characters. When the replacement embeds the text of another file,
 * {@code inserted} maps that text and {@code insertedOffset} is its position inside the replacement.
 */
public record TextEdit(int start, int end, int replacementLength, LocationMap inserted, int insertedOffset) {
    public TextEdit {
        if (start < 0 || end < start || replacementLength < 0) {
            throw new IllegalArgumentException("Invalid edit [" + start + ", " + end + ") -> " + replacementLength);
        }
    }

    public static TextEdit replace(int start, int end, int replacementLength) {
        return new TextEdit(start, end, replacementLength, null, 0);
    }
}
