package org.errers.rules;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class PackageRuleSetsTest {

    private final StandardExtractor extractor = new StandardExtractor(List.of());

    @Test
    void numberList() {
        assertEquals("7", PackageRuleSets.numberList("7"));
        assertEquals("1 and 2", PackageRuleSets.numberList("1;2"));
        assertEquals("1, 2 and 3", PackageRuleSets.numberList("1;2;3"));
    }

    @Test
    void angle() {
        assertEquals("12.5°", PackageRuleSets.angle("12.5"));
        assertEquals("1°2'3\"", PackageRuleSets.angle("1; 2; 3"));
        assertEquals("2'", PackageRuleSets.angle(";2;"));
        assertThrows(IllegalArgumentException.class, () -> PackageRuleSets.angle("1;2"));
    }

    @Test
    void packageRulesRunOnlyWhenLoaded() throws Exception {
        assertEquals("See the site and X.",
                extract("\\usepackage{hyperref}\nSee \\href{http://x.org}{the site} and \\autoref{sec}.\n"));
        assertEquals("See sec.", extract("See \\autoref{sec}.\n"), "unknown commands give way to their argument");
    }

    @Test
    void cleverefReferences() throws Exception {
        assertEquals("references X and X and Reference X.",
                extract("\\usepackage{cleveref}\n\\cref{a,b} and \\Cref{c}.\n"));
    }

    @Test
    void siunitxNumbers() throws Exception {
        assertEquals("Values 1, 2 and 3 at 5°.",
                extract("\\usepackage{siunitx}\nValues \\numlist{1;2;3} at \\ang{5}.\n"));
    }

    private String extract(String latex) throws Exception {
        return extractor.extract(latex).getText().strip();
    }
}
