package org.errers.engine.rule;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.errers.engine.pattern.Guard;
import org.junit.jupiter.api.Test;

class TextRulesTest {

    @Test
    void appliesSubstitutionsInOrder() {
        TextRules rules = TextRules.builder()
                .add("a", "b")
                .add("b", "c")
                .build();

        assertEquals("ccc", rules.apply("aba"));
        assertEquals(2, rules.size());
    }

    @Test
    void iterativeSubstitutionRunsUntilStable() {
        TextRules once = TextRules.of("%c", "\\g<c1>");
        TextRules repeated = TextRules.builder().addIterative("%c", match -> match.value("c1")).build();

        assertEquals("{{deep}}", once.apply("{{{deep}}}"), "only one nested level per pass");
        assertEquals("deep", repeated.apply("{{{deep}}}"));
    }

    @Test
    void guardedSubstitution() {
        TextRules escape = TextRules.builder().add("%", Guard.NOT_ESCAPED, "\\\\%").build();

        assertEquals("50\\% and 50\\%", escape.apply("50% and 50\\%"));
    }

    @Test
    void unchangedTextIsReturnedAsIs() {
        String text = "nothing to do";

        assertSame(text, TextRules.of("absent", "x").apply(text));
    }

    @Test
    void replacementFunctionsHaveNoContext() {
        TextRules rules = TextRules.builder().add("x", match -> match.context().documentStem()).build();

        assertThrows(IllegalStateException.class, () -> rules.apply("x"));
    }

    @Test
    void brokenTemplatesFailAtBuildTime() {
        assertThrows(IllegalStateException.class, () -> TextRules.of("(open", "x"));
        assertThrows(IllegalStateException.class, () -> TextRules.of("%c", "\\g<c2>"));
    }
}
