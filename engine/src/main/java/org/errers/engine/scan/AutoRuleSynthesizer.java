package org.errers.engine.scan;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.IntFunction;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.errers.engine.ExtractionMessage;
import org.errers.engine.pattern.CompiledPattern;
import org.errers.engine.pattern.PatternCompiler;
import org.errers.engine.pattern.PatternError;
import org.errers.engine.pattern.RegexText;
import org.errers.engine.rule.Provenance;
import org.errers.engine.rule.ReplacementTemplate;
import org.errers.engine.rule.Rule;

/**
 * Turns declarations found by {@link MacroScanner} into rules that expand each use of the macro into its
 * body, with {@code #k} parameters bound to the captured arguments.
 *
 * <p>An optional first argument with a non-empty default yields two rules: one for uses that give the
 * optional argument and one that substitutes the default.
 */
public final class AutoRuleSynthesizer {
    private static final Logger LOGGER = Logger.getLogger(AutoRuleSynthesizer.class.getName());
    private static final String SCOPE = "auto";

    private final PatternCompiler compiler;
    private final AutoRulePolicy policy;

    public AutoRuleSynthesizer(PatternCompiler compiler, AutoRulePolicy policy) {
        this.compiler = Objects.requireNonNull(compiler, "compiler");
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public List<Rule> synthesize(List<DefinitionRecord> records, List<ExtractionMessage> messages) {
        List<Rule> rules = new ArrayList<>();
        for (DefinitionRecord record : records) {
            switch (record.kind()) {
                case COMMAND, DEF -> addInvocation(rules, record, commandHead(record.name()), record.body(), messages);
                case ENVIRONMENT -> {
                    String name = RegexText.escape(record.name());
                    addInvocation(rules, record, "\\\\begin\\{" + name + "\\}", record.body(), messages);
                    add(rules, record, "\\\\end\\{" + name + "\\}", translate(record.endBody(), k -> "c" + k),
                            messages);
                }
                case COUNTER -> add(rules, record, "\\\\the" + RegexText.escape(record.name()), "X", messages);
            }
        }
        LOGGER.fine(() -> "Generated " + rules.size() + " rule(s) from " + records.size() + " declaration(s)");
        return rules;
    }

    private void addInvocation(
            List<Rule> rules, DefinitionRecord record, String head, String body, List<ExtractionMessage> messages) {
        int arity = record.arity();
        String boundary = arity > 0 && isControlWord(record) ? "(?![a-zA-Z])" : "";
        if (!record.hasOptional()) {
            add(rules, record, head + boundary + "%C".repeat(arity), translate(body, k -> "c" + k), messages);
            return;
        }
        String rest = "%C".repeat(arity - 1);
        IntFunction<String> withOptional = k -> k == 1 ? "s1" : "c" + (k - 1);
        if (record.optionalDefault().isEmpty()) {
            add(rules, record, head + boundary + "%s?" + rest, translate(body, withOptional), messages);
            return;
        }
        add(rules, record, head + boundary + "%s" + rest, translate(body, withOptional), messages);
        String defaulted = body.replace("#1", record.optionalDefault());
        add(rules, record, head + boundary + rest, translate(defaulted, k -> "c" + (k - 1)), messages);
    }

    private void add(
            List<Rule> rules, DefinitionRecord record, String template, String replacement,
            List<ExtractionMessage> messages) {
        try {
            CompiledPattern pattern = compiler.compile(template, SCOPE, record.location());
            rules.add(new Rule(pattern, ReplacementTemplate.parse(replacement, pattern),
                    policy.phaseOf(record.kind()), false, false, Provenance.AUTO_GENERATED));
            LOGGER.fine(() -> "Auto rule for " + record.name() + ": " + template);
        } catch (PatternError e) {
            LOGGER.log(Level.WARNING, e.getMessage(), e);
            messages.add(new ExtractionMessage(ExtractionMessage.Kind.PATTERN_ERROR, e.getMessage(),
                    record.location(), SCOPE + ": " + template));
        }
    }

    private static boolean isControlWord(DefinitionRecord record) {
        if (record.kind() == DeclarationKind.ENVIRONMENT) {
            return false;
        }
        String name = record.name();
        return name.length() > 1 && name.substring(1).chars().allMatch(c -> c < 128 && Character.isLetter(c));
    }

    static String commandHead(String name) {
        return "\\\\" + RegexText.escape(name.substring(1));
    }

    /** Escapes the body for use as a replacement template and binds {@code #k} to group names. */
    static String translate(String body, IntFunction<String> group) {
        if (body == null) {
            return "";
        }
        StringBuilder builder = new StringBuilder(body.length() + 16);
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '\\') {
                builder.append("\\\\");
            } else if (c == '#' && i + 1 < body.length() && body.charAt(i + 1) >= '1' && body.charAt(i + 1) <= '9') {
                builder.append("\\g<").append(group.apply(body.charAt(i + 1) - '0')).append('>');
                i++;
            } else {
                builder.append(c);
            }
        }
        return builder.toString();
    }
}
