package org.errers.engine.scan;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import org.errers.engine.pattern.CompiledPattern;
import org.errers.engine.pattern.Guard;
import org.errers.engine.pattern.PatternCompiler;

/**
 * Character set of a document as declared with {@code inputenc} package options; UTF-8 otherwise.
 */
public final class InputEncoding {
    private static final Logger LOGGER = Logger.getLogger(InputEncoding.class.getName());

    private static final CompiledPattern DECLARATION =
            PatternCompiler.internal("\\\\usepackage%s\\{inputenc\\}", Guard.NOT_COMMENTED);

    private static final Map<String, String> CHARSETS = Map.of(
            "utf8", "UTF-8",
            "utf8x", "UTF-8",
            "ascii", "US-ASCII",
            "latin1", "ISO-8859-1",
            "latin2", "ISO-8859-2",
            "latin9", "ISO-8859-15",
            "ansinew", "windows-1252",
            "cp1252", "windows-1252",
            "applemac", "x-MacRoman",
            "cp850", "IBM850");

    private InputEncoding() {}

    /** Decoded document text and the character set it was read with. */
    public record DecodedText(String text, Charset charset) {}

    public static DecodedText decode(byte[] content) {
        String probe = new String(content, StandardCharsets.ISO_8859_1);
        Charset charset = detect(probe);
        return new DecodedText(new String(content, charset), charset);
    }

    static Charset detect(String text) {
        Matcher matcher = DECLARATION.matcher(text);
        if (!DECLARATION.find(matcher, text)) {
            return StandardCharsets.UTF_8;
        }
        String declared = matcher.group("s1").strip().toLowerCase(Locale.ROOT);
        String name = CHARSETS.get(declared);
        if (name == null || !Charset.isSupported(name)) {
            LOGGER.warning(() -> "Unknown input encoding '" + declared + "', reading as UTF-8");
            return StandardCharsets.UTF_8;
        }
        LOGGER.fine(() -> "Input encoding " + declared + " -> " + name);
        return Charset.forName(name);
    }
}
