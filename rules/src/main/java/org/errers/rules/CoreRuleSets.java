package org.errers.rules;

import org.errers.engine.pattern.Guard;
import org.errers.engine.rule.Phase;
import org.errers.engine.rule.RuleCatalog;
import org.errers.engine.rule.RuleMatch;
import org.errers.engine.rule.RuleSetKey;
import org.errers.engine.rule.RuleSetProvider;
import org.errers.engine.rule.TextRules;

/**
 * Rules for LaTeX without any package: file insertion, removal of verbatim text, comments and math,
 * symbol setup, the main document commands, brace cleanup and the final white-space cleanup.
 */
final class CoreRuleSets implements RuleSetProvider {
    private static final String NOT_ESCAPED = Guard.NOT_ESCAPED.getRegexPrefix();

    // Applied to the body of a tabbing environment.
    private static final TextRules TABBING = TextRules.builder()
            .add("(?s)(?:\\A|(?<!\\\\\\\\))(?:(?!\\\\kill).)*+\\\\kill", "")
            .add("\\\\\\\\", "\\n\\n")
            .add("\\\\=", "")
            .add("\\\\>", "\\n\\n")
            .add("\\\\<", "")
            .add("\\\\\\+", "")
            .add("\\\\-", "")
            .add("\\\\'", "\\n\\n")
            .add("\\\\`", "\\n\\n")
            .add("\\\\(?:push|pop)tabs", "")
            .build();

    // Drops the colon added after an item label that already ends with punctuation.
    private static final TextRules ITEM_COLON = TextRules.of("(?<mark>[.,:;!?]):$", "\\g<mark>");

    @Override
    public void register(RuleCatalog.Builder catalog) {
        insertion(catalog);
        removal(catalog);
        setup(catalog);
        main(catalog);
        braceCleanup(catalog);
        cleanup(catalog);
    }

    private static void insertion(RuleCatalog.Builder catalog) {
        catalog.ruleSet(RuleSetKey.core(), Phase.INSERTION)
                .rule("\\\\input%C").guard(Guard.NOT_COMMENTED).iterative().to(CoreRuleSets::insertTex)
                .rule("\\\\include%C").guard(Guard.NOT_COMMENTED).to(CoreRuleSets::insertTex)
                .rule("\\\\bibliography%C").guard(Guard.NOT_COMMENTED)
                .to(m -> "\n" + m.context().insertFile(m.context().documentStem(), ".bbl"));
    }

    private static String insertTex(RuleMatch match) {
        return "\n" + match.context().insertFile(match.value("c1"), ".tex");
    }

    private static void removal(RuleCatalog.Builder catalog) {
        catalog.ruleSet(RuleSetKey.core(), Phase.REMOVAL)
                // The environment name moves to an optional argument so that verbatim-like environments of
                // packages can be renamed to verbatim and removed by the next rule.
                .add("\\\\begin{verbatim}", "\\\\begin[verbatim]{verbatim}")
                .rule("(?:(?<comment>%.*+)"
                        + "|(?<verb>\\\\verb(?![a-zA-Z])%h(?<delim>.)(?:(?!\\k<delim>).)*+\\k<delim>)"
                        + "|(?<verbatim>\\\\begin%s{verbatim}(?s:(?:(?!\\\\end{\\k<s1>}).)*+)\\\\end{\\k<s1>}))")
                .guard(Guard.NOT_ESCAPED)
                .to(m -> m.value("comment") + (m.isPresent("verb") ? "||" : ""))
                // Comment lines go away; a blank line after an end-of-line comment is kept.
                .add("^%h" + NOT_ESCAPED + "%.*\\n", "")
                .add(NOT_ESCAPED + "%.*\\n%h\\n", "\\n\\n")
                .add(NOT_ESCAPED + "%.*%n", "")
                .add("(?s)\\\\makeatletter.*?\\\\makeatother", "")
                // Declarations were scanned before this phase; their uses are expanded by generated rules.
                .add("\\\\(?:(?:re)?newcommand|providecommand|DeclareRobustCommand"
                        + "|(?:re)?newrobustcmd|providerobustcmd)\\*?%C%s?%s?%c", "")
                .add("\\\\(?:re)?newenvironment\\*?%c%s?%s?%c%c", "")
                .add("\\\\[gex]?def%n\\\\(?:[a-zA-Z@]++|.)[^{}%\\n]*+%c", "")
                .add("\\\\newcounter%C%s?", "")
                // Math becomes $$ before later rules can add dollar signs of their own.
                .add("\\$\\$", "$")
                .add("\\\\[()]", "$")
                .add("\\\\(?:begin|end){math}", "$")
                .add("\\\\\\[", "\\\\begin{equation}")
                .add("\\\\]", "\\\\end{equation}")
                .add("\\\\begin{eqnarray}", "\\\\begin{equation}")
                .add("\\\\end{eqnarray}", "\\\\end{equation}")
                .add("(?s)" + NOT_ESCAPED + "(?<!\\$)\\$(?:\\\\\\$|[^\\$])++" + NOT_ESCAPED + "\\$", "$$")
                // Punctuation ending a displayed equation stays after the $$.
                .add("(?s)\\\\begin{(?<env>equation\\*?)}"
                        + "(?:(?!\\\\end{\\k<env>})"
                        + "(?:}|\\\\end%c|\\\\label%c|\\\\[,.:;!?]|%w|(?<last>.)))*"
                        + "\\\\end{\\k<env>}",
                        m -> {
                            String last = m.group("last");
                            return last != null && ",.:;!?".contains(last) ? "$$" + last : "$$";
                        })
                .add("\\\\ensuremath%C", "$$")
                .add("\\$\\$(?=\\\\?[^\\W\\d])", "124");
    }

    private static void setup(RuleCatalog.Builder catalog) {
        catalog.ruleSet(RuleSetKey.core(), Phase.SETUP)
                .add("(?s)\\\\begin{tabbing}(?<body>(?:(?!\\\\end{tabbing}).)*+)\\\\end{tabbing}",
                        m -> "\n" + TABBING.apply(m.value("body")) + "\n")
                // Accents. \a is the tabbing-safe form of the accent commands.
                .add("\\\\a%C%C", "\\\\\\g<c1>{\\g<c2>}")
                .add("\\\\o", "ø")
                .add("\\\\i", "i")
                .add("\\\\l", "ł")
                .add("\\\\`%C", m -> Diacritics.accentFirst(m.value("c1"), Diacritics.GRAVE))
                .add("\\\\'%C", m -> Diacritics.accentFirst(m.value("c1"), Diacritics.ACUTE))
                .add("\\\\\"%C", m -> Diacritics.accentFirst(m.value("c1"), Diacritics.DIAERESIS))
                .add("\\\\H%C", m -> Diacritics.accentFirst(m.value("c1"), Diacritics.DOUBLE_ACUTE))
                .add("\\\\c%C", m -> Diacritics.accentFirst(m.value("c1"), Diacritics.CEDILLA))
                .add("\\\\k%C", m -> Diacritics.accentFirst(m.value("c1"), Diacritics.OGONEK))
                .add("\\\\v%C", m -> Diacritics.accentFirst(m.value("c1"), Diacritics.CARON))
                .add("\\\\r%C", m -> Diacritics.accentFirst(m.value("c1"), Diacritics.RING_ABOVE))
                .add("\\\\aa", m -> Diacritics.accentFirst("a", Diacritics.RING_ABOVE))
                .add("\\\\=%C", m -> Diacritics.accentFirstKeepRest(m.value("c1"), Diacritics.MACRON))
                .add("\\\\\\.%C", m -> Diacritics.accentFirstKeepRest(m.value("c1"), Diacritics.DOT_ABOVE))
                .add("\\\\u%C", m -> Diacritics.accentFirstKeepRest(m.value("c1"), Diacritics.BREVE))
                .add("\\\\d%C", m -> Diacritics.accentFirstKeepRest(m.value("c1"), Diacritics.DOT_BELOW))
                // Line breaks and spaces
                .add("\\\\\\\\", "\\n")
                .add("\\\\tabularnewline", "\\n")
                .add("\\t", " ")
                .add("\\\\newblock", " ")
                // Symbols and punctuation
                .add("\\\\LaTeX", "LaTeX")
                .add("\\\\ldots", "…")
                .add("``", "\"")
                .add("''", "\"")
                .add("`", "'")
                .add("---", "—")
                .add("--", "–")
                .add("\\\\textemdash", "—")
                .add("\\\\textendash", "–")
                .add("\\\\textcopyright", "©")
                .add("\\\\textregistered", "®")
                .add("\\\\texttrademark", "™")
                .add("\\\\-", "")
                // Explicit spaces become "\ ", negative spaces disappear.
                .add("\\\\[,>:;]", "\\\\ ")
                .add("\\\\(?:thin|med|thick)space", "\\\\ ")
                .add("\\\\q?quad", "\\\\ ")
                .add("\\\\!", "")
                .add("\\\\neg(?:thin|med|thick)space", "")
                // Font size and alignment
                .add("\\\\(?:Huge|huge|LARGE|Large|large|normalsize)", "")
                .add("\\\\(?:small|footnotesize|scriptsize|tiny)", "")
                .add("\\\\centering", "")
                .add("\\\\ragged(?:left|right)", "")
                .add("\\\\(?:no)?indent", "")
                // Counters
                .add("\\\\the(?:part|chapter|section|subsection|subsubsection)", "X")
                .add("\\\\the(?:paragraph|subparagraph|figure|table)", "X")
                .add("\\\\the(?:footnote|mpfootnote|enumi|enumii|enumiii|enumiv)", "X")
                .add("\\\\the(?:page|equation)", "X")
                // Ligatures
                .add("ﬀ", "ff")
                .add("ﬁ", "fi")
                .add("ﬂ", "fl")
                .add("ﬃ", "ffi")
                .add("ﬄ", "ffl");
    }

    private static void main(RuleCatalog.Builder catalog) {
        catalog.ruleSet(RuleSetKey.core(), Phase.MAIN)
                // Preamble
                .add("\\\\documentclass%s?%c", "")
                .add("\\\\usepackage%s?%c%s?", "")
                .add("\\\\RequirePackage%s?%c%s?", "")
                .add("\\\\PassOptionsToPackage%C%C", "")
                .add("\\\\title%C", "\\n\\g<c1>\\n")
                .add("\\\\author%C", "\\n\\g<c1>\\n")
                .add("\\\\hyphenation%C", "")
                // Sections
                .add("\\\\(?:part|chapter|section|subsection|subsubsection|paragraph|subparagraph)\\*?%s?%c",
                        "\\n\\g<s1>\\n\\n\\g<c1>\\n")
                .add("\\\\addtocontents%C%C", "\\n\\g<c2>\\n")
                // A float moves after the end of its paragraph, one float at a time.
                .rule("(?s)\\\\begin{(?<kind>figure|table)}%s?"
                        + "(?<float>(?:(?!\\\\end{\\k<kind>}).)*+)"
                        + "\\\\end{\\k<kind>}%h\\n?"
                        + "(?<para>(?:(?!(?<=\\n)%h\\n)(?!\\\\begin{(?:figure|table)}).)*+)"
                        + "(?<=\\n)%h\\n")
                .iterative()
                .to("\\g<para>\\n\\g<float>\\n\\n")
                // Captions
                .add("\\\\caption%s?%c", "\\n\\g<s1>\\n\\n\\g<c1>\\n")
                // Footnotes, margin notes and thanks go in parentheses at the end of the paragraph.
                .add("(?s)\\\\marginpar%s%C", "\\\\marginpar{\\g<s1>}\\\\marginpar{\\g<c1>}")
                .add("(?s)\\\\marginpar%C", "\\\\footnote{\\g<c1>}")
                .add("(?s)\\\\thanks%C", "\\\\footnote{\\g<c1>}")
                .rule("(?s)\\\\footnote(?:text)?%s?%c(?<rest>.*?)\\n%h\\n")
                .iterative()
                .to(m -> m.value("rest") + " (" + m.value("c1").strip() + ")\n\n")
                .add("\\\\footnotemark%s?", "")
                // Lists
                .add("\\\\item\\[\\]%w", "-")
                .add("\\\\item%s", m -> ITEM_COLON.apply("-" + m.value("s1") + ":") + " ")
                .add("\\\\item(?![a-zA-Z])%w", "-")
                // Tabular
                .add("\\\\multicolumn%C%C%C", "\\g<c3>")
                // References
                .add("\\\\bibliographystyle%C", "")
                .add("\\\\bibitem%s?%c", "\\n[X]: ")
                .add("\\\\cite%s%C", "[X, \\g<s1>]")
                .add("\\\\cite%C", "[X]")
                .add("\\\\label%C", "")
                .add("\\\\ref%C", "X")
                .add("\\\\pageref%C", "X")
                // Boxes
                .add("\\\\newsavebox%C", "")
                .add("\\\\usebox%C", "")
                .add("\\\\rule%s?%c%c", "")
                .add("\\\\mbox%C", "\\g<c1>")
                .add("\\\\makebox%s?%s?%c", "\\g<c1>")
                .add("\\\\parbox%s?%s?%s?%c%c", "\\g<c2>")
                .add("\\\\raisebox%C%s?%s?%c", "\\g<c2>")
                // Lengths and spaces
                .add("\\\\setlength%C%C", "")
                .add("\\\\addtolength%C%C", "")
                .add("\\\\settoheight%C%C", "")
                .add("\\\\settodepth%C%C", "")
                .add("\\\\settowidth%C%C", "")
                .add("\\\\hspace\\*?%C", "")
                .add("\\\\vspace\\*?%C", "")
                // Counters
                .add("\\\\refstepcounter%C", "")
                .add("\\\\stepcounter%C", "")
                .add("\\\\value%C", "X")
                .add("\\\\setcounter%C%C", "")
                .add("\\\\addtocounter%C%C", "")
                .add("\\\\alph%C", "x")
                .add("\\\\arabic%C", "X")
                .add("\\\\roman%C", "X")
                .add("\\\\fnsymbol%C", "X")
                .add("\\\\numberwithin%C%C", "")
                // \newtheorem{name}[counter]{Title} or \newtheorem{name}{Title}[within]
                .add("\\\\newtheorem%C%s%c", "\\n\\g<c2>\\n")
                .add("\\\\newtheorem%C%c%s?", "\\n\\g<c2>\\n")
                // Page breaks
                .add("\\\\(?:clearpage|cleardoublepage|newpage)", "\\n\\n")
                .add("\\\\enlargethispage\\*?%C", "")
                .add("\\\\(?:pagebreak|nopagebreak)%s?", "")
                // Fonts
                .add("\\\\(?:textnormal|emph|lowercase|uppercase|underline)%C", "\\g<c1>")
                .add("\\\\(?:MakeLowercase|MakeUppercase)%C", "\\g<c1>")
                .add("\\\\text(?:up|it|sl|sc)%C", "\\g<c1>")
                .add("\\\\text(?:rm|sf|tt)%C", "\\g<c1>")
                .add("\\\\text(?:bf|md)%C", "\\g<c1>")
                .add("\\\\shortstack%s?%c", "\\g<c1>")
                // Headers and footers
                .add("\\\\pagestyle%C", "")
                .add("\\\\thispagestyle%C", "")
                // Plain TeX
                .add("\\\\noalign%C", "");
    }

    private static void braceCleanup(RuleCatalog.Builder catalog) {
        catalog.braceCleanup()
                // Unknown one-argument commands give way to their argument, \begin and \end excepted.
                .rule("\\\\(?!begin|end)[a-zA-Z]++\\*?+%c(?!%n[{\\[\\(])").generic().to("\\g<c1>")
                // Braces that do not belong to a command are dropped, white space is kept.
                .add("(?s)(?<command>\\\\(?:[a-zA-Z]++\\*?+|\\S)(?:%c|%r|%s)*+)"
                        + "|(?<space>[\\ \\t\\n]++)"
                        + "|%c"
                        + "|(?<other>.[^\\\\{]*+)",
                        "\\g<command>\\g<space>\\g<c2>\\g<other>");
    }

    private static void cleanup(RuleCatalog.Builder catalog) {
        catalog.ruleSet(RuleSetKey.core(), Phase.CLEANUP)
                // Commands without arguments, with the space that follows up to the end of the line.
                .rule("\\\\[a-zA-Z]++(?![a-zA-Z])\\*?+%h(?![{\\[\\(])%h").generic().to("")
                .rule("\\\\begin%C(?:%c|%r|%s)*+%n").generic().to("")
                .rule("\\\\end%C%n").generic().to("")
                // Explicit spaces
                .add("(?<!\\\\)~", " ")
                .add("\\\\[\\ \\n]", " ")
                // Reserved characters
                .add("\\\\\\#", "#")
                .add("\\\\\\$", "$")
                .add("\\\\%", "%")
                .add("\\\\&", "&")
                .add("\\\\{", "{")
                .add("\\\\}", "}")
                .add("\\\\_", "_")
                .add("\\\\~%C", m -> Diacritics.accentFirst(m.value("c1"), Diacritics.TILDE))
                .add("\\\\\\^%C", m -> Diacritics.accentFirst(m.value("c1"), Diacritics.CIRCUMFLEX))
                // White space
                .add("[\\ ]{2,}", " ")
                .add("^\\ ", "")
                .add("\\ $", "")
                .add("\\A\\n++", "")
                .add("\\n\\n++\\Z", "\\n")
                .add("\\n{3,}", "\\n\\n")
                // Lines of a paragraph are joined.
                .add("(?<=.)\\n(?=.)", " ");
    }
}
