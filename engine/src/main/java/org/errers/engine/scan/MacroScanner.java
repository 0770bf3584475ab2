package org.errers.engine.scan;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.errers.engine.ExtractionMessage;
import org.errers.engine.pattern.CompiledPattern;
import org.errers.engine.pattern.Guard;
import org.errers.engine.pattern.PatternCompiler;
import org.errers.engine.source.DocumentBuffer;
import org.errers.engine.source.SourceLocation;

/**
 * Finds macro, environment and counter declarations outside comments. Declarations whose signature cannot
 * be understood are reported as scan warnings and skipped.
 */
public final class MacroScanner {
    private static final Logger LOGGER = Logger.getLogger(MacroScanner.class.getName());

    private static final CompiledPattern COMMAND = PatternCompiler.internal(
            "\\\\(?<kind>(?:re)?newcommand|providecommand|DeclareRobustCommand|(?:re)?newrobustcmd|providerobustcmd)"
                    + "(?<star>\\*?)%C%s?%s?%c",
            Guard.NOT_COMMENTED);
    private static final CompiledPattern ENVIRONMENT = PatternCompiler.internal(
            "\\\\(?<kind>(?:re)?newenvironment)(?<star>\\*?)%c%s?%s?%c%c", Guard.NOT_COMMENTED);
    private static final CompiledPattern DEF = PatternCompiler.internal(
            "\\\\(?<kind>[gex]?def)%n(?<name>\\\\(?:[a-zA-Z@]++|.))(?<params>[^{}%\\n]*+)%c", Guard.NOT_COMMENTED);
    private static final CompiledPattern COUNTER =
            PatternCompiler.internal("\\\\newcounter%C%s?", Guard.NOT_COMMENTED);
    private static final CompiledPattern KEYWORD = PatternCompiler.internal(
            "\\\\(?<keyword>(?:re)?newcommand|providecommand|DeclareRobustCommand|(?:re)?newrobustcmd"
                    + "|providerobustcmd|(?:re)?newenvironment|[gex]?def|newcounter)(?![a-zA-Z@])",
            Guard.NOT_COMMENTED);

    private static final Pattern COMMAND_NAME = Pattern.compile("\\\\(?:[a-zA-Z@]+|[^a-zA-Z@\\s])");
    private static final Pattern ENVIRONMENT_NAME = Pattern.compile("[^\\s{}\\\\%]+");
    private static final Pattern COUNTER_NAME = Pattern.compile("[a-zA-Z@]+");
    private static final Pattern ARITY = Pattern.compile("[0-9]");
    private static final Pattern PARAMETER = Pattern.compile("#([1-9])");

    /** Declarations in document order. */
    public List<DefinitionRecord> scan(DocumentBuffer buffer, List<ExtractionMessage> messages) {
        String text = buffer.getText();
        Map<Integer, DefinitionRecord> records = new TreeMap<>();
        Set<Integer> understood = new HashSet<>();
        List<ExtractionMessage> warnings = new ArrayList<>();

        Matcher matcher = COMMAND.matcher(text);
        while (COMMAND.find(matcher, text)) {
            understood.add(matcher.start());
            SourceLocation location = buffer.locate(matcher.start());
            String name = matcher.group("c1").strip();
            if (!COMMAND_NAME.matcher(name).matches()) {
                warnings.add(warning("Invalid command name '" + name + "'", location));
                continue;
            }
            Signature signature = signature(matcher.group("s1"), matcher.group("s2"), name, location, warnings);
            if (signature != null) {
                records.put(matcher.start(), new DefinitionRecord(DeclarationKind.COMMAND, name, signature.arity(),
                        signature.optionalDefault(), matcher.group("c2"), null, location));
            }
        }

        matcher = ENVIRONMENT.matcher(text);
        while (ENVIRONMENT.find(matcher, text)) {
            understood.add(matcher.start());
            SourceLocation location = buffer.locate(matcher.start());
            String name = matcher.group("c1").strip();
            if (!ENVIRONMENT_NAME.matcher(name).matches()) {
                warnings.add(warning("Invalid environment name '" + name + "'", location));
                continue;
            }
            Signature signature = signature(matcher.group("s1"), matcher.group("s2"), name, location, warnings);
            if (signature != null) {
                records.put(matcher.start(), new DefinitionRecord(DeclarationKind.ENVIRONMENT, name,
                        signature.arity(), signature.optionalDefault(), matcher.group("c2"), matcher.group("c3"),
                        location));
            }
        }

        matcher = DEF.matcher(text);
        while (DEF.find(matcher, text)) {
            understood.add(matcher.start());
            SourceLocation location = buffer.locate(matcher.start());
            String name = matcher.group("name");
            int arity = parameterCount(matcher.group("params"));
            if (arity < 0) {
                warnings.add(warning("Unsupported parameter text '" + matcher.group("params").strip() + "' of "
                        + name, location));
                continue;
            }
            records.put(matcher.start(), new DefinitionRecord(DeclarationKind.DEF, name, arity, null,
                    matcher.group("c1"), null, location));
        }

        matcher = COUNTER.matcher(text);
        while (COUNTER.find(matcher, text)) {
            understood.add(matcher.start());
            SourceLocation location = buffer.locate(matcher.start());
            String name = matcher.group("c1").strip();
            if (!COUNTER_NAME.matcher(name).matches()) {
                warnings.add(warning("Invalid counter name '" + name + "'", location));
                continue;
            }
            records.put(matcher.start(), new DefinitionRecord(DeclarationKind.COUNTER, name, 0, null, null, null,
                    location));
        }

        matcher = KEYWORD.matcher(text);
        while (KEYWORD.find(matcher, text)) {
            if (!understood.contains(matcher.start())) {
                warnings.add(warning("Cannot parse declaration \\" + matcher.group("keyword"),
                        buffer.locate(matcher.start())));
            }
        }

        for (ExtractionMessage message : warnings) {
            LOGGER.warning(message::toString);
        }
        messages.addAll(warnings);
        LOGGER.fine(() -> "Found " + records.size() + " declaration(s)");
        return List.copyOf(records.values());
    }

    private record Signature(int arity, String optionalDefault) {}

    private static Signature signature(
            String count, String optional, String name, SourceLocation location, List<ExtractionMessage> warnings) {
        int arity = 0;
        if (count != null) {
            String stripped = count.strip();
            if (!ARITY.matcher(stripped).matches()) {
                warnings.add(warning("Invalid argument count '" + stripped + "' for " + name, location));
                return null;
            }
            arity = Integer.parseInt(stripped);
        }
        if (optional != null && arity == 0) {
            warnings.add(warning("Optional argument without arguments for " + name, location));
            return null;
        }
        return new Signature(arity, optional);
    }

    /** Number of {@code #1#2...} parameters, or -1 for delimited or out-of-order parameters. */
    static int parameterCount(String params) {
        String stripped = params.replaceAll("\\s", "");
        Matcher parameter = PARAMETER.matcher(stripped);
        int count = 0;
        int position = 0;
        while (parameter.find()) {
            if (parameter.start() != position || Integer.parseInt(parameter.group(1)) != count + 1) {
                return -1;
            }
            count++;
            position = parameter.end();
        }
        return position == stripped.length() ? count : -1;
    }

    private static ExtractionMessage warning(String message, SourceLocation location) {
        return ExtractionMessage.of(ExtractionMessage.Kind.SCAN_WARNING, message, location);
    }
}
