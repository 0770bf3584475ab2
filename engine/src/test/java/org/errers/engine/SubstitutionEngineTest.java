package org.errers.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.errers.engine.rule.Phase;
import org.errers.engine.rule.Provenance;
import org.errers.engine.rule.RuleCatalog;
import org.errers.engine.rule.RuleSetKey;
import org.errers.engine.rule.RuleSetProvider;
import org.errers.engine.source.DocumentSource;
import org.errers.engine.source.SourceLocation;
import org.junit.jupiter.api.Test;

final class SubstitutionEngineTest {

    private static final RuleSetKey CORE = RuleSetKey.core();

    @Test
    void expandsDeclaredMacros() throws Exception {
        String text = "\\newcommand{\\foo}[1]{[#1]}\n\\foo{bar}";

        ExtractionResult result = run(RuleCatalog.empty(), text, ExtractionConfig.defaults());
        ExtractionResult withoutAuto =
                run(RuleCatalog.empty(), text, ExtractionConfig.builder().autoRules(false).build());

        assertEquals("\\newcommand{\\foo}[1]{[#1]}\n[bar]", result.getText());
        assertEquals(text, withoutAuto.getText());
    }

    @Test
    void documentRulesComeFirst() throws Exception {
        RuleCatalog catalog = catalog(rules -> rules.ruleSet(CORE, Phase.MAIN).add("\\\\baz%C%C", "\\g<c2>"));
        String text = "% Rule(r'\\\\baz%C%C', r'\\g<c1>')\n\\baz{X}{Y}\n";

        ExtractionResult result = run(catalog, text, ExtractionConfig.defaults());

        assertTrue(result.getText().endsWith("\nX\n"), result.getText());
    }

    @Test
    void malformedDocumentRuleAbortsRun() {
        DocumentRuleError error = assertThrows(DocumentRuleError.class,
                () -> run(RuleCatalog.empty(), "text\n% Rule(r'x')\n", ExtractionConfig.defaults()));

        assertEquals(new SourceLocation("main.tex", 2), error.getLocation());
    }

    @Test
    void phasesRunInOrder() throws Exception {
        RuleCatalog catalog = catalog(rules -> {
            rules.ruleSet(CORE, Phase.CLEANUP).add("e", "f");
            rules.ruleSet(CORE, Phase.MAIN).add("d", "e");
            rules.ruleSet(CORE, Phase.SETUP).add("c", "d");
            rules.ruleSet(CORE, Phase.REMOVAL).add("b", "c");
            rules.ruleSet(CORE, Phase.INSERTION).add("a", "b");
        });

        assertEquals("f", run(catalog, "a", ExtractionConfig.defaults()).getText());
    }

    @Test
    void iterativeRulePeelsNestedBraces() throws Exception {
        RuleCatalog once = catalog(rules -> rules.ruleSet(CORE, Phase.SETUP).add("%c", "\\g<c1>"));
        RuleCatalog iterative = catalog(rules -> rules.ruleSet(CORE, Phase.SETUP).addIterative("%c", "\\g<c1>"));

        assertEquals("{{deep}}", run(once, "{{{deep}}}", ExtractionConfig.defaults()).getText());
        assertEquals("deep", run(iterative, "{{{deep}}}", ExtractionConfig.defaults()).getText());
    }

    @Test
    void mainPhaseSweepsUntilStable() throws Exception {
        RuleCatalog catalog = catalog(rules -> rules.ruleSet(CORE, Phase.MAIN).add("%c", "\\g<c1>"));

        assertEquals("deep", run(catalog, "{{{deep}}}", ExtractionConfig.defaults()).getText());
        assertEquals("{{deep}}",
                run(catalog, "{{{deep}}}", ExtractionConfig.builder().singlePass(true).build()).getText());
    }

    @Test
    void braceCleanupRunsAfterMainRules() throws Exception {
        RuleCatalog catalog = catalog(rules -> {
            rules.ruleSet(CORE, Phase.MAIN).add("\\\\known%C", "K(\\g<c1>)");
            rules.braceCleanup().rule("\\\\[a-z]+%c").generic().to("\\g<c1>");
        });

        assertEquals("K(inner)", run(catalog, "\\unknown{\\known{inner}}", ExtractionConfig.defaults()).getText());
        assertEquals("\\unknown{K(inner)}", run(catalog, "\\unknown{\\known{inner}}",
                ExtractionConfig.builder().defaultRules(false).build()).getText());
    }

    @Test
    void runawayRuleTimesOutAndRunContinues() throws Exception {
        RuleCatalog catalog = catalog(rules -> rules.ruleSet(CORE, Phase.SETUP)
                .add("x*x*x*x*x*x*y", "Z")
                .add("x", "w"));
        ExtractionConfig config = ExtractionConfig.builder().ruleTimeout(Duration.ofMillis(200)).build();

        ExtractionResult result = run(catalog, "x".repeat(3000), config);

        assertEquals("w".repeat(3000), result.getText());
        List<ExtractionMessage> timeouts = result.getMessages(ExtractionMessage.Kind.TIMEOUT_ERROR);
        assertEquals(1, timeouts.size(), result.getMessages().toString());
        assertTrue(timeouts.get(0).getMessage().contains("aborted"), timeouts.get(0).getMessage());
        assertEquals(new SourceLocation("core/setup", 1), timeouts.get(0).getLocation());
    }

    @Test
    void mainPhaseRuleTimesOutOnlyOnce() throws Exception {
        RuleCatalog catalog = catalog(rules -> rules.ruleSet(CORE, Phase.MAIN)
                .add("x*x*x*x*x*x*y", "Z")
                .add("b", "c")
                .add("a", "b"));
        ExtractionConfig config = ExtractionConfig.builder().ruleTimeout(Duration.ofMillis(200)).build();

        ExtractionResult result = run(catalog, "x".repeat(3000) + "a", config);

        assertEquals("x".repeat(3000) + "c", result.getText(), "later sweeps still run the other rules");
        List<ExtractionMessage> timeouts = result.getMessages(ExtractionMessage.Kind.TIMEOUT_ERROR);
        assertEquals(1, timeouts.size(), result.getMessages().toString());
        assertEquals(new SourceLocation("core/main", 1), timeouts.get(0).getLocation());
    }

    @Test
    void documentRuleTimesOutOnlyOnce() throws Exception {
        RuleCatalog catalog = catalog(rules -> rules.ruleSet(CORE, Phase.MAIN)
                .add("b", "c")
                .add("a", "b"));
        ExtractionConfig config = ExtractionConfig.builder().ruleTimeout(Duration.ofMillis(200)).build();
        String comment = "% Rule(r'x*x*x*x*x*x*y', r'Z')\n";

        ExtractionResult result = run(catalog, comment + "x".repeat(3000) + "a", config);

        assertEquals(comment + "x".repeat(3000) + "c", result.getText());
        List<ExtractionMessage> timeouts = result.getMessages(ExtractionMessage.Kind.TIMEOUT_ERROR);
        assertEquals(1, timeouts.size(), result.getMessages().toString());
        assertEquals(new SourceLocation("main.tex", 1), timeouts.get(0).getLocation());
    }

    @Test
    void enforcedTimeoutUndoesEarlierIterations() throws Exception {
        RuleCatalog catalog = catalog(rules -> rules.ruleSet(CORE, Phase.SETUP).addIterative("a|bx*x*x*x*x*x*y", "b"));
        ExtractionConfig config = ExtractionConfig.builder().ruleTimeout(Duration.ofMillis(200)).build();

        ExtractionResult result = run(catalog, "a" + "x".repeat(3000), config);

        assertEquals("a" + "x".repeat(3000), result.getText(), "the first iteration is rolled back too");
        assertEquals(1, result.getMessages(ExtractionMessage.Kind.TIMEOUT_ERROR).size());
    }

    @Test
    void advisoryTimeoutIsReportedOncePerRule() throws Exception {
        RuleCatalog catalog = catalog(rules -> rules.ruleSet(CORE, Phase.MAIN)
                .add("b", "c")
                .add("a", "b"));
        ExtractionConfig config = ExtractionConfig.builder()
                .ruleTimeout(Duration.ofNanos(1))
                .timeoutMode(TimeoutMode.ADVISORY)
                .build();

        ExtractionResult result = run(catalog, "aa", config);

        assertEquals("cc", result.getText(), "advisory timeouts keep the rules running");
        assertEquals(2, result.getMessages(ExtractionMessage.Kind.TIMEOUT_ERROR).size(),
                result.getMessages().toString());
    }

    @Test
    void advisoryTimeoutKeepsResult() throws Exception {
        RuleCatalog catalog = catalog(rules -> rules.ruleSet(CORE, Phase.SETUP).add("a", "b"));
        ExtractionConfig config = ExtractionConfig.builder()
                .ruleTimeout(Duration.ofNanos(1))
                .timeoutMode(TimeoutMode.ADVISORY)
                .build();

        ExtractionResult result = run(catalog, "aaa", config);

        assertEquals("bbb", result.getText());
        assertEquals(TimeoutMode.ADVISORY, result.getTimeoutMode());
        assertTrue(result.getMessages(ExtractionMessage.Kind.TIMEOUT_ERROR).get(0).getMessage()
                .contains("result kept"));
    }

    @Test
    void iterationLimitsAreReported() throws Exception {
        RuleCatalog iterative = catalog(rules -> rules.ruleSet(CORE, Phase.SETUP).addIterative("x", "xx"));
        RuleCatalog sweeping = catalog(rules -> rules.ruleSet(CORE, Phase.MAIN).add("x", "xx"));
        ExtractionConfig config = ExtractionConfig.builder().maxIterations(3).build();

        ExtractionResult limited = run(iterative, "x", config);
        ExtractionResult swept = run(sweeping, "x", config);

        assertEquals("x".repeat(8), limited.getText());
        assertTrue(limited.getMessages(ExtractionMessage.Kind.TIMEOUT_ERROR).get(0).getMessage()
                .startsWith("Iterative rule stopped after 3 iterations"));
        assertEquals("x".repeat(8), swept.getText());
        assertTrue(swept.getMessages(ExtractionMessage.Kind.TIMEOUT_ERROR).get(0).getMessage()
                .startsWith("Main phase stopped after 3 sweeps"));
    }

    @Test
    void failingReplacementIsLocatedInIncludedFile() throws Exception {
        Path dir = Files.createTempDirectory("engine");
        Files.writeString(dir.resolve("sub.tex"), "alpha\nboom here\n");
        RuleCatalog catalog = catalog(rules -> {
            rules.ruleSet(CORE, Phase.INSERTION).add("\\\\input%C",
                    match -> "\n" + match.context().insertFile(match.value("c1"), ".tex"));
            rules.ruleSet(CORE, Phase.MAIN).add("boom", match -> {
                throw new IllegalStateException("kaboom");
            });
        });
        ExtractionConfig config = ExtractionConfig.builder().rootDirectory(dir).build();

        ExtractionResult result = run(catalog, "first\n\\input{sub}\nlast\n", config);

        assertEquals("first\n\nalpha\nboom here\n\nlast\n", result.getText(), "failed replacement is discarded");
        List<ExtractionMessage> errors = result.getMessages(ExtractionMessage.Kind.RULE_RUNTIME_ERROR);
        assertEquals(1, errors.size());
        assertEquals(new SourceLocation("sub.tex", 2), errors.get(0).getLocation());
        assertTrue(errors.get(0).getMessage().contains("kaboom"), errors.get(0).getMessage());
    }

    @Test
    void missingIncludedFileIsAWarning() throws Exception {
        Path dir = Files.createTempDirectory("engine");
        RuleCatalog catalog = catalog(rules -> rules.ruleSet(CORE, Phase.INSERTION).add("\\\\input%C",
                match -> match.context().insertFile(match.value("c1"), ".tex")));
        ExtractionConfig config = ExtractionConfig.builder().rootDirectory(dir).build();

        ExtractionResult result = run(catalog, "first\n\\input{absent}\nlast\n", config);

        assertEquals("first\n\nlast\n", result.getText());
        List<ExtractionMessage> warnings = result.getMessages(ExtractionMessage.Kind.MISSING_FILE_WARNING);
        assertEquals(1, warnings.size());
        assertEquals(new SourceLocation("main.tex", 2), warnings.get(0).getLocation());
    }

    @Test
    void macrosDeclaredInIncludedFilesAreExpanded() throws Exception {
        Path dir = Files.createTempDirectory("engine");
        Files.writeString(dir.resolve("macros.tex"), "\\newcommand{\\hi}{Hello}\n");
        RuleCatalog catalog = catalog(rules -> {
            rules.ruleSet(CORE, Phase.INSERTION).add("\\\\input%C",
                    match -> match.context().insertFile(match.value("c1"), ".tex"));
            rules.ruleSet(CORE, Phase.REMOVAL).add("\\\\newcommand%C%c\\n", "");
        });
        ExtractionConfig config = ExtractionConfig.builder().rootDirectory(dir).build();

        ExtractionResult result = run(catalog, "\\input{macros}\n\\hi{} world", config);

        assertEquals("\nHello{} world", result.getText());
    }

    @Test
    void statisticsListOnlyRulesOfTheRecomposedRun() throws Exception {
        Path dir = Files.createTempDirectory("engine-statistics");
        Files.writeString(dir.resolve("more.tex"), "\\newcommand{\\b}{B}\n");
        RuleCatalog catalog = catalog(rules -> rules.ruleSet(CORE, Phase.INSERTION).add("\\\\input%C",
                match -> match.context().insertFile(match.value("c1"), ".tex")));
        ExtractionConfig config = ExtractionConfig.builder().rootDirectory(dir).build();

        ExtractionResult result = run(catalog, "\\newcommand{\\a}{A}\n\\input{more}\n\\a \\b", config);

        long generated = result.getStatistics().getEntries().stream()
                .filter(entry -> entry.rule().getProvenance() == Provenance.AUTO_GENERATED)
                .count();
        assertEquals(2, generated, result.getStatistics().toCsv());
    }

    @Test
    void reportsRemainingCommandsAndStatistics() throws Exception {
        RuleCatalog catalog = catalog(rules -> rules.ruleSet(CORE, Phase.MAIN).add("\\\\drop%C", ""));

        ExtractionResult result = run(catalog, "\\unknown \\drop{x} \\other{y} \\unknown", ExtractionConfig.defaults());

        assertEquals(Map.of("\\other", 1, "\\unknown", 2), result.getRemainingCommands());
        String csv = result.getStatistics().toCsv();
        assertTrue(csv.startsWith(RuleStatistics.CSV_HEADER + "\n"), csv);
        assertTrue(csv.contains("core/main,1,core,"), csv);
        assertEquals(1, result.getStatistics().getTotalMatches());
    }

    @Test
    void listingAndTraceOnRequest() throws Exception {
        RuleCatalog catalog = catalog(rules -> rules.ruleSet(CORE, Phase.SETUP).add("a", "b"));
        ExtractionConfig config = ExtractionConfig.builder().patternListing(true).executionTrace(true).build();

        ExtractionResult result = run(catalog, "a", config);
        ExtractionResult quiet = run(catalog, "a", ExtractionConfig.defaults());

        assertTrue(result.getPatternListing().orElseThrow().contains("template: a"));
        String trace = result.getExecutionTrace().orElseThrow();
        assertTrue(trace.contains("phase setup\n  built_in core (core/setup:1): a -> 1 match(es)"), trace);
        assertFalse(quiet.getPatternListing().isPresent());
        assertFalse(quiet.getExecutionTrace().isPresent());
    }

    @Test
    void cancelledRunThrows() {
        ExtractionCancellation cancellation = new ExtractionCancellation();
        cancellation.cancel();
        SubstitutionEngine engine = new SubstitutionEngine(RuleCatalog.empty());

        ExtractionException error = assertThrows(ExtractionException.class, () -> engine.extract(
                DocumentSource.ofText("main.tex", "text"), Optional.empty(), ExtractionConfig.defaults(),
                cancellation));
        assertEquals("Extraction cancelled", error.getMessage());
    }

    @Test
    void compilerLogNextToDocumentSelectsRuleSets() throws Exception {
        Path dir = Files.createTempDirectory("engine");
        Path document = dir.resolve("paper.tex");
        Files.writeString(document, "\\documentclass{article}\nHi \\name{Ann}");
        Files.writeString(dir.resolve("paper.log"), "Document Class: interact 2016/11/15\n");
        RuleCatalog catalog = catalog(rules -> rules.ruleSet(RuleSetKey.documentClass("interact"), Phase.MAIN)
                .add("\\\\name%C", "\\g<c1>"));

        ExtractionResult result = new SubstitutionEngine(catalog)
                .extract(DocumentSource.of(document), Optional.empty(), ExtractionConfig.defaults());

        assertEquals(List.of("interact"), result.getProfile().getDocumentClasses());
        assertTrue(result.getText().endsWith("Hi Ann"), result.getText());
    }

    @Test
    void catalogCompilationErrorsAreReportedByEveryRun() throws Exception {
        RuleCatalog catalog = catalog(rules -> rules.ruleSet(CORE, Phase.MAIN).add("(broken", "x"));

        ExtractionResult result = run(catalog, "text", ExtractionConfig.defaults());

        assertEquals("text", result.getText());
        assertEquals(1, result.getMessages(ExtractionMessage.Kind.PATTERN_ERROR).size());
    }

    private static RuleCatalog catalog(RuleSetProvider provider) {
        return RuleCatalog.builder().include(provider).build();
    }

    private static ExtractionResult run(RuleCatalog catalog, String text, ExtractionConfig config)
            throws ExtractionException {
        return new SubstitutionEngine(catalog)
                .extract(DocumentSource.ofText("main.tex", text), Optional.of(""), config);
    }
}
