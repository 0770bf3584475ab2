package org.errers.rules;

import java.util.regex.Matcher;
import org.errers.engine.pattern.CompiledPattern;
import org.errers.engine.pattern.PatternCompiler;

/**
 * Reads one key from a {@code key=value, key={value}} option list, as taken by {@code \hypersetup} and
 * similar commands.
 */
final class KeyValues {
    private final CompiledPattern pattern;

    private KeyValues(String keys) {
        this.pattern = PatternCompiler.internal("(?s)(?<![a-zA-Z])(?:" + keys + ")%n=%n"
                + "(?:(?<bracketed>(?=\\{).*+)|(?<unbracketed>(?:(?![\\ \\t\\n]*+(?:,|\\z)).)*+))");
    }

    /** @param keys a key or an alternation of keys, as a regex */
    static KeyValues of(String keys) {
        return new KeyValues(keys);
    }

    /** Value of the first occurrence of the key, without its braces, or the empty string. */
    String extract(String options) {
        Matcher matcher = pattern.matcher(options);
        if (!pattern.find(matcher, options)) {
            return "";
        }
        String bracketed = matcher.group("bracketed");
        if (bracketed != null) {
            return balancedContent(bracketed);
        }
        return matcher.group("unbracketed").strip();
    }

    private static String balancedContent(String raw) {
        int level = 0;
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '{') {
                level++;
            } else if (c == '}' && --level == 0) {
                return raw.substring(1, i);
            }
        }
        return "";
    }
}
