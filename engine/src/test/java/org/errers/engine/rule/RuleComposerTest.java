package org.errers.engine.rule;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.errers.engine.ExtractionMessage;
import org.errers.engine.pattern.PatternCompiler;
import org.errers.engine.source.SourceLocation;
import org.junit.jupiter.api.Test;

class RuleComposerTest {

    private static final RuleSetKey FOO = RuleSetKey.usePackage("foo");

    private final RuleCatalog catalog = RuleCatalog.builder()
            .include(sets -> {
                sets.ruleSet(RuleSetKey.core(), Phase.MAIN)
                        .add("core", "C")
                        .rule("generic").generic().to("G");
                sets.ruleSet(FOO, Phase.MAIN).add("package", "P");
                sets.ruleSet(FOO, Phase.REMOVAL).add("early", "E");
                sets.braceCleanup().rule("braces").generic().to("B");
                sets.alias(RuleSetKey.usePackage("foo-alias"), FOO);
            })
            .includeLocal(sets -> sets.ruleSet(RuleSetKey.core(), Phase.MAIN).add("local", "L"))
            .build();

    private final List<Rule> documentRules = List.of(rule("document", Provenance.DOCUMENT_LOCAL));
    private final List<Rule> generatedRules = List.of(rule("generated", Provenance.AUTO_GENERATED));

    @Test
    void ordersRulesByPrecedence() {
        RuleList rules = new RuleComposer(true, true, true)
                .compose(catalog, List.of(FOO, RuleSetKey.usePackage("unknown")), documentRules, generatedRules);

        assertEquals(
                List.of("document", "generated", "local", "package", "core", "generic"),
                templates(rules.getRules(Phase.MAIN)));
        assertEquals(List.of("early"), templates(rules.getRules(Phase.REMOVAL)));
        assertEquals(List.of("braces"), templates(rules.getBraceCleanupRules()));
        assertEquals(8, rules.size());
    }

    @Test
    void switchesOffRuleGroups() {
        RuleList rules = new RuleComposer(false, false, false)
                .compose(catalog, List.of(FOO), documentRules, generatedRules);

        assertEquals(List.of("document", "package", "core"), templates(rules.getRules(Phase.MAIN)));
        assertTrue(rules.getBraceCleanupRules().isEmpty(), "brace cleanup is generic");
    }

    @Test
    void inactiveSetsAreLeftOut() {
        RuleList rules = new RuleComposer(true, true, true).compose(catalog, List.of(), List.of(), List.of());

        assertEquals(List.of("local", "core", "generic"), templates(rules.getRules(Phase.MAIN)));
        assertTrue(rules.getRules(Phase.REMOVAL).isEmpty());
    }

    @Test
    void aliasResolvesToTargetSet() {
        RuleList rules = new RuleComposer(true, true, false)
                .compose(catalog, List.of(RuleSetKey.usePackage("foo.alias")), List.of(), List.of());

        assertEquals(List.of("package", "core", "generic"), templates(rules.getRules(Phase.MAIN)));
    }

    @Test
    void builtInRulesAreNumberedPerSetAndPhase() {
        List<Rule> core = catalog.getStandardRules(RuleSetKey.core(), Phase.MAIN);

        assertEquals(new SourceLocation("core/main", 2), core.get(1).getLocation());
        assertEquals("local core", catalog.getLocalRules(RuleSetKey.core(), Phase.MAIN).get(0).getScope());
        assertEquals(Provenance.BUILT_IN, core.get(0).getProvenance());
        assertEquals("built_in core (core/main:1): core", core.get(0).describe());
    }

    @Test
    void brokenTemplatesAreCollectedNotThrown() {
        RuleCatalog broken = RuleCatalog.builder()
                .include(sets -> sets.ruleSet(RuleSetKey.core(), Phase.SETUP)
                        .add("(unclosed", "x")
                        .add("fine", "\\g<missing>")
                        .add("ok", "y"))
                .build();

        assertEquals(2, broken.getCompilationErrors().size());
        for (ExtractionMessage message : broken.getCompilationErrors()) {
            assertEquals(ExtractionMessage.Kind.PATTERN_ERROR, message.getKind());
        }
        assertEquals(1, broken.getStandardRules(RuleSetKey.core(), Phase.SETUP).size());
    }

    private static Rule rule(String template, Provenance provenance) {
        return new Rule(PatternCompiler.internal(template), match -> "", Phase.MAIN, false, false, provenance);
    }

    private static List<String> templates(List<Rule> rules) {
        List<String> templates = new ArrayList<>();
        for (Rule rule : rules) {
            templates.add(rule.getPattern().getTemplate());
        }
        return templates;
    }
}
