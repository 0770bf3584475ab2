package org.errers.engine.scan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import org.errers.engine.ExtractionMessage;
import org.errers.engine.pattern.CompiledPattern;
import org.errers.engine.pattern.PatternCompiler;
import org.errers.engine.rule.Phase;
import org.errers.engine.rule.Provenance;
import org.errers.engine.rule.Rule;
import org.errers.engine.rule.RuleMatch;
import org.errers.engine.source.SourceLocation;
import org.junit.jupiter.api.Test;

class AutoRuleSynthesizerTest {

    private static final SourceLocation HERE = new SourceLocation("doc.tex", 1);

    private final AutoRuleSynthesizer synthesizer =
            new AutoRuleSynthesizer(new PatternCompiler(), AutoRulePolicy.defaults());

    @Test
    void expandsCommandWithArguments() {
        List<Rule> rules = synthesize(new DefinitionRecord(DeclarationKind.COMMAND, "\\foo", 1, null, "[#1]", null,
                HERE));

        assertEquals(1, rules.size());
        Rule rule = rules.get(0);
        assertEquals(Provenance.AUTO_GENERATED, rule.getProvenance());
        assertEquals(Phase.MAIN, rule.getPhase());
        assertEquals(HERE, rule.getLocation());
        assertEquals("x [bar] y", apply(rules, "x \\foo{bar} y"));
        assertEquals("\\foobar{x}", apply(rules, "\\foobar{x}"), "longer command names are left alone");
    }

    @Test
    void optionalArgumentWithDefaultYieldsTwoRules() {
        List<Rule> rules = synthesize(new DefinitionRecord(DeclarationKind.COMMAND, "\\opt", 2, "x", "#1-#2", null,
                HERE));

        assertEquals(2, rules.size());
        assertEquals("a-b", apply(rules, "\\opt[a]{b}"));
        assertEquals("x-b", apply(rules, "\\opt{b}"));
    }

    @Test
    void optionalArgumentWithEmptyDefaultIsOptionalInPattern() {
        List<Rule> rules = synthesize(new DefinitionRecord(DeclarationKind.COMMAND, "\\opt", 2, "", "(#1)#2", null,
                HERE));

        assertEquals(1, rules.size());
        assertEquals("(a)b", apply(rules, "\\opt[a]{b}"));
        assertEquals("()b", apply(rules, "\\opt{b}"));
    }

    @Test
    void environmentReplacesBeginAndEnd() {
        List<Rule> rules = synthesize(new DefinitionRecord(DeclarationKind.ENVIRONMENT, "box", 1, null, "<#1>",
                "</>", HERE));

        assertEquals(2, rules.size());
        assertEquals("<T>body</>", apply(rules, "\\begin{box}{T}body\\end{box}"));
    }

    @Test
    void defAndCounter() {
        List<Rule> rules = synthesize(
                new DefinitionRecord(DeclarationKind.DEF, "\\swap", 2, null, "#2#1", null, HERE),
                new DefinitionRecord(DeclarationKind.COUNTER, "thm", 0, null, null, null, HERE));

        assertEquals(Phase.SETUP, rules.get(1).getPhase());
        assertEquals("ba, see X.", apply(rules, "\\swap{a}{b}, see \\thethm."));
    }

    @Test
    void bodyBackslashesSurviveAsText() {
        List<Rule> rules = synthesize(new DefinitionRecord(DeclarationKind.COMMAND, "\\strong", 1, null,
                "\\textbf{#1}", null, HERE));

        assertEquals("\\textbf{x}", apply(rules, "\\strong{x}"));
        assertEquals("a\\\\b\\g<c1>", AutoRuleSynthesizer.translate("a\\b#1", k -> "c" + k));
        assertEquals("\\\\foo", AutoRuleSynthesizer.commandHead("\\foo"));
    }

    @Test
    void brokenDeclarationIsReportedNotThrown() {
        List<ExtractionMessage> messages = new ArrayList<>();
        List<Rule> rules = synthesizer.synthesize(
                List.of(new DefinitionRecord(DeclarationKind.COMMAND, "\\odd", 1, null, "#3", null, HERE)),
                messages);

        assertTrue(rules.isEmpty());
        assertEquals(1, messages.size());
        assertEquals(ExtractionMessage.Kind.PATTERN_ERROR, messages.get(0).getKind());
        assertEquals(HERE, messages.get(0).getLocation());
    }

    private List<Rule> synthesize(DefinitionRecord... records) {
        List<ExtractionMessage> messages = new ArrayList<>();
        List<Rule> rules = synthesizer.synthesize(List.of(records), messages);
        assertTrue(messages.isEmpty(), messages.toString());
        return rules;
    }

    private static String apply(List<Rule> rules, String text) {
        String current = text;
        for (Rule rule : rules) {
            CompiledPattern pattern = rule.getPattern();
            Matcher matcher = pattern.matcher(current);
            StringBuilder out = new StringBuilder();
            int last = 0;
            while (pattern.find(matcher, current)) {
                out.append(current, last, matcher.start())
                        .append(rule.getReplacement().apply(new RuleMatch(matcher, pattern, null)));
                last = matcher.end();
            }
            current = out.append(current, last, current.length()).toString();
        }
        return current;
    }
}
