package org.errers.engine.rule;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.regex.Matcher;
import org.errers.engine.pattern.CompiledPattern;
import org.errers.engine.pattern.PatternCompiler;
import org.errers.engine.pattern.PatternError;
import org.junit.jupiter.api.Test;

class ReplacementTemplateTest {

    private static final CompiledPattern PATTERN = PatternCompiler.internal("\\\\x%s?%c");

    @Test
    void expandsGroupsAndEscapes() throws Exception {
        ReplacementTemplate template = ReplacementTemplate.parse("\\g<c1>-\\g<0>\\n\\t\\\\", PATTERN);

        assertEquals("a-\\x{a}\n\t\\", template.apply(matchIn("\\x{a}")));
        assertEquals("\\g<c1>-\\g<0>\\n\\t\\\\", template.getSource());
    }

    @Test
    void absentGroupIsEmpty() throws Exception {
        ReplacementTemplate template = ReplacementTemplate.parse("[\\g<s1>]", PATTERN);

        assertEquals("[]", template.apply(matchIn("\\x{a}")));
        assertEquals("[opt]", template.apply(matchIn("\\x[opt]{a}")));
    }

    @Test
    void keepsNonLetterEscapes() throws Exception {
        ReplacementTemplate template = ReplacementTemplate.parse("\\ \\{\\%", PATTERN);

        assertEquals("\\ \\{\\%", template.apply(matchIn("\\x{a}")));
    }

    @Test
    void rejectsUnknownGroups() {
        PatternError error = assertThrows(PatternError.class, () -> ReplacementTemplate.parse("\\g<c9>", PATTERN));

        assertTrue(error.getMessage().contains("Unknown group 'c9'"), error.getMessage());
        assertEquals("internal", error.getScope());
    }

    @Test
    void rejectsPositionalReferences() {
        assertThrows(PatternError.class, () -> ReplacementTemplate.parse("\\1", PATTERN));
        assertThrows(PatternError.class, () -> ReplacementTemplate.parse("\\g<1>", PATTERN));
    }

    @Test
    void rejectsMalformedTemplates() {
        assertThrows(PatternError.class, () -> ReplacementTemplate.parse("\\q", PATTERN), "unknown letter escape");
        assertThrows(PatternError.class, () -> ReplacementTemplate.parse("trailing\\", PATTERN));
        assertThrows(PatternError.class, () -> ReplacementTemplate.parse("\\g<c1", PATTERN));
    }

    @Test
    void ruleMatchChecksGroupNames() {
        RuleMatch match = matchIn("\\x{a}");

        assertTrue(match.isPresent("c1"));
        assertFalse(match.isPresent("s1"));
        assertThrows(IllegalArgumentException.class, () -> match.group("nope"));
        assertThrows(IllegalStateException.class, match::context);
    }

    private static RuleMatch matchIn(String text) {
        Matcher matcher = PATTERN.matcher(text);
        assertTrue(matcher.find(), text);
        return new RuleMatch(matcher, PATTERN, null);
    }
}
