package org.errers.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.Duration;
import org.errers.engine.rule.Phase;
import org.errers.engine.scan.AutoRulePolicy;
import org.errers.engine.scan.DeclarationKind;
import org.errers.engine.source.DocumentSource;
import org.junit.jupiter.api.Test;

class ExtractionConfigTest {

    @Test
    void defaults() {
        ExtractionConfig config = ExtractionConfig.defaults();

        assertEquals(Duration.ofSeconds(5), config.getRuleTimeout());
        assertEquals(TimeoutMode.ENFORCED, config.getTimeoutMode());
        assertEquals(1000, config.getMaxIterations());
        assertEquals("{stem}.txt", config.getOutputPattern());
        assertTrue(config.isAutoRules());
        assertTrue(config.isDefaultRules());
        assertTrue(config.isLocalRules());
        assertFalse(config.isSinglePass());
        assertFalse(config.getRootDirectory().isPresent());
        assertEquals(Phase.SETUP, config.getAutoRulePolicy().phaseOf(DeclarationKind.COUNTER));
    }

    @Test
    void rejectsInvalidLimits() {
        assertThrows(IllegalArgumentException.class, () -> ExtractionConfig.builder().ruleTimeout(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> ExtractionConfig.builder().maxIterations(0));
    }

    @Test
    void toBuilderKeepsSettings() {
        AutoRulePolicy policy = AutoRulePolicy.builder().phase(DeclarationKind.COMMAND, Phase.SETUP).build();
        ExtractionConfig config = ExtractionConfig.builder()
                .maxIterations(7)
                .singlePass(true)
                .autoRulePolicy(policy)
                .build();

        ExtractionConfig copy = config.toBuilder().defaultRules(false).build();

        assertEquals(7, copy.getMaxIterations());
        assertTrue(copy.isSinglePass());
        assertFalse(copy.isDefaultRules());
        assertEquals(Phase.SETUP, copy.getAutoRulePolicy().phaseOf(DeclarationKind.COMMAND));
        assertEquals(Phase.MAIN, copy.getAutoRulePolicy().phaseOf(DeclarationKind.DEF), "unlisted kinds run in main");
    }

    @Test
    void resolvesOutputNextToDocument() {
        Path document = Path.of("papers", "paper.tex").toAbsolutePath();
        DocumentSource source = DocumentSource.of(document);

        assertEquals(document.resolveSibling("paper.txt"), ExtractionConfig.defaults().resolveOutputPath(source));
        ExtractionConfig named = ExtractionConfig.builder().outputPattern("out/{name}.plain").build();
        assertEquals(Path.of("out", "paper.tex.plain"), named.resolveOutputPath(DocumentSource.ofText("paper.tex", "")),
                "in-memory documents have no directory");
    }

    @Test
    void readsSystemProperties() {
        System.setProperty("errers.timeout", "0.5");
        System.setProperty("errers.maxIterations", " 12 ");
        System.setProperty("errers.timeoutMode", "advisory");
        System.setProperty("errers.trace", "true");
        try {
            ExtractionConfig config = ExtractionConfig.fromSystemProperties();

            assertEquals(Duration.ofMillis(500), config.getRuleTimeout());
            assertEquals(12, config.getMaxIterations());
            assertEquals(TimeoutMode.ADVISORY, config.getTimeoutMode());
            assertTrue(config.isExecutionTrace());
        } finally {
            System.clearProperty("errers.timeout");
            System.clearProperty("errers.maxIterations");
            System.clearProperty("errers.timeoutMode");
            System.clearProperty("errers.trace");
        }
    }
}
