package org.errers.rules;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.errers.engine.pattern.Guard;
import org.errers.engine.rule.Phase;
import org.errers.engine.rule.RuleCatalog;
import org.errers.engine.rule.RuleMatch;
import org.errers.engine.rule.RuleSetKey;
import org.errers.engine.rule.RuleSetProvider;
import org.errers.engine.rule.TextRules;

/**
 * Rules for the packages loaded with <code>&#92;usepackage</code>. A set is only composed into a run when the
 * document, or its compiler log, names the package.
 */
final class PackageRuleSets implements RuleSetProvider {
    private static final String CITATION = "Paper X";

    private static final TextRules ESCAPE_PERCENT =
            TextRules.builder().add("%", Guard.NOT_ESCAPED, "\\\\%").build();

    private static final List<KeyValues> PDF_INFO = List.of(
            KeyValues.of("pdftitle"),
            KeyValues.of("pdfauthor"),
            KeyValues.of("pdfsubject"),
            KeyValues.of("pdfkeywords"),
            KeyValues.of("pdfproducer"),
            KeyValues.of("pdfcopyright"),
            KeyValues.of("pdflicenseurl"));

    @Override
    public void register(RuleCatalog.Builder catalog) {
        amsmath(catalog);
        amsthm(catalog);
        array(catalog);
        babel(catalog);
        booktabs(catalog);
        caption(catalog);
        cleveref(catalog);
        dtkLogos(catalog);
        endfloat(catalog);
        enumitem(catalog);
        etoolbox(catalog);
        fancyvrb(catalog);
        fixme(catalog);
        floatrow(catalog);
        graphics(catalog);
        harpoon(catalog);
        hyperref(catalog);
        ifthen(catalog);
        listings(catalog);
        multirow(catalog);
        natbib(catalog);
        pdfpages(catalog);
        pgfplots(catalog);
        scalerel(catalog);
        siunitx(catalog);
        soul(catalog);
        subcaption(catalog);
        subfig(catalog);
        ulem(catalog);
        url(catalog);
        xcolor(catalog);
    }

    private static RuleCatalog.RuleSetBuilder main(RuleCatalog.Builder catalog, String name) {
        return catalog.ruleSet(RuleSetKey.usePackage(name), Phase.MAIN);
    }

    private static void amsmath(RuleCatalog.Builder catalog) {
        // Equations are removed in the removal phase, so the environments are renamed there.
        catalog.ruleSet(RuleSetKey.usePackage("amsmath"), Phase.REMOVAL)
                .add("\\\\(?<command>begin|end){(?:align|alignat|flalign|gather|multline)\\*?}",
                        "\\\\\\g<command>{equation}");
        main(catalog, "amsmath")
                .add("\\\\eqref%C", "(\\\\ref{\\g<c1>})")
                .add("\\\\DeclareMathOperator\\*?%C%C", "")
                .add("\\\\allowdisplaybreaks%s?", "");
    }

    private static void amsthm(RuleCatalog.Builder catalog) {
        main(catalog, "amsthm")
                .add("\\\\theoremstyle%C", "")
                .add("\\\\newtheoremstyle%C%C%C%C%C%C%C%C%C", "");
    }

    private static void array(RuleCatalog.Builder catalog) {
        main(catalog, "array").add("\\\\newcolumntype%C%s?%c", "");
    }

    private static void babel(RuleCatalog.Builder catalog) {
        main(catalog, "babel")
                .add("\\\\shorthandon%C", "")
                .add("\\\\shorthandoff%C", "")
                .add("\\\\up%C", "\\g<c1>");
    }

    private static void booktabs(RuleCatalog.Builder catalog) {
        main(catalog, "booktabs")
                .add("\\\\cmidrule%s?%r?%C", "")
                .add("\\\\(?:top|mid|bottom)rule%s?", "");
    }

    private static void caption(RuleCatalog.Builder catalog) {
        main(catalog, "caption")
                .add("\\\\captionof", "\\\\caption")
                .add("\\\\caption\\*", "\\\\caption")
                .add("\\\\captionlistentry%s?%c", "")
                .add("\\\\captionsetup%s?%c", "")
                .add("\\\\clearcaptionsetup%s?%c", "")
                .add("\\\\showcaptionsetup%C", "");
    }

    private static void cleveref(RuleCatalog.Builder catalog) {
        main(catalog, "cleveref")
                .add("\\\\cref\\*?%C", m -> references(m, "reference", "references", "ref"))
                .add("\\\\Cref\\*?%C", m -> references(m, "Reference", "References", "ref"))
                .add("\\\\crefrange\\*?%C%C", "references \\\\ref{\\g<c1>} to \\\\ref{\\g<c2>}")
                .add("\\\\Crefrange\\*?%C%C", "References \\\\ref{\\g<c1>} to \\\\ref{\\g<c2>}")
                .add("\\\\cpageref\\*?%C", m -> references(m, "page", "pages", "pageref"))
                .add("\\\\Cpageref\\*?%C", m -> references(m, "Page", "Pages", "pageref"))
                .add("\\\\cpagerefrange\\*?%C%C", "pages \\\\pageref{\\g<c1>} to \\\\pageref{\\g<c2>}")
                .add("\\\\Cpagerefrange\\*?%C%C", "Pages \\\\pageref{\\g<c1>} to \\\\pageref{\\g<c2>}")
                .add("\\\\(?:lc)?namecref%C", "reference")
                .add("\\\\nameCref%C", "Reference")
                .add("\\\\(?:lc)?namecrefs%C", "references")
                .add("\\\\nameCrefs%C", "References")
                .add("\\\\labelc(?<page>page|)ref\\*?%C", m -> references(m, "", "", m.value("page") + "ref").strip())
                .add("\\\\crefalias%C%C", "")
                .add("\\\\crefname%C%C%C", "")
                .add("\\\\label%s%c", "\\\\label{\\g<c1>}");
    }

    /** A list of labels reads as two references, a single label as one. */
    private static String references(RuleMatch match, String singular, String plural, String command) {
        String labels = match.value("c1");
        String reference = "\\" + command + "{" + labels + "}";
        if (labels.contains(",")) {
            return plural + " " + reference + " and " + reference;
        }
        return singular + " " + reference;
    }

    private static void dtkLogos(RuleCatalog.Builder catalog) {
        main(catalog, "dtk-logos")
                .add("\\\\BibTeX", "BibTeX")
                .add("\\\\TikZ", "TikZ");
    }

    private static void endfloat(RuleCatalog.Builder catalog) {
        main(catalog, "endfloat").add("\\\\AtBegin(?:Figures|Tables|DelayedFloats)%C", "");
    }

    private static void enumitem(RuleCatalog.Builder catalog) {
        main(catalog, "enumitem").add("\\\\setlist%s?%c", "");
    }

    private static void etoolbox(RuleCatalog.Builder catalog) {
        main(catalog, "etoolbox")
                .add("\\\\robustify%C", "")
                .add("\\\\protecting%C", "")
                .add("\\\\defcounter%C%C", "")
                .add("\\\\deflength%C%C", "")
                .add("\\\\(?:After|AtEnd|AfterEnd)Preamble%C", "")
                .add("\\\\AfterEndDocument%C", "")
                .add("\\\\(?:AtBegin|AtEnd|BeforeBegin|AfterEnd)Environment%C%C", "");
    }

    private static void fancyvrb(RuleCatalog.Builder catalog) {
        // Verbatim-like environments are renamed so the core removal rule drops them.
        catalog.ruleSet(RuleSetKey.usePackage("fancyvrb"), Phase.REMOVAL)
                .add("\\\\DefineVerbatimEnvironment%C%C%C", "")
                .add("\\\\CustomVerbatimCommand%C%C%C", "")
                .add("\\\\RecustomVerbatim(?:Environment|Command)%C%C%C", "")
                .add("\\\\begin{(?<env>[BL]?Verbatim\\*?)}", "\\\\begin[\\g<env>]{verbatim}")
                .add("\\\\begin{(?<env>SaveVerbatim\\*?)}", "\\\\begin[\\g<env>]{verbatim}")
                .add("\\\\SaveVerb%s?%c", "\\\\verb")
                .add("\\\\UseVerb%C", "||")
                .add("\\\\fvset%C", "")
                .add("\\\\[BL]?UseVerbatim%s?%c", "||")
                .add("\\\\[BL]?VerbatimInput%s?%c", "");
    }

    private static void fixme(RuleCatalog.Builder catalog) {
        main(catalog, "fixme")
                .add("\\\\fx(?:note|warning|error|fatal)\\*%s?%c%c", "\\g<c2>\\\\fixme{\\g<c1>}")
                .add("\\\\fx(?:note|warning|error|fatal)%s?%c", "\\\\fixme{\\g<c1>}")
                .add("\\\\fixme%s?%c", "\\\\footnote{Fix me: \\g<c1>}")
                .add("\\\\fxsetup%C", "")
                .add("\\\\FXRegisterAuthor%C%C%C", "")
                .add("\\\\fxloadtargetlayouts%C", "")
                .add("\\\\fxusetargetlayout%C", "");
    }

    private static void floatrow(RuleCatalog.Builder catalog) {
        main(catalog, "floatrow")
                .add("\\\\floatsetup%s?%c", "")
                .add("\\\\(?:re)?newfloatcommand%C%C%s?%s?", "")
                .add("\\\\floatbox%s?%c%s?%s?%s?%c%c", "\\g<c2>\\n\\g<c3>")
                .add("\\\\(?:ffigbox|fcapside|ttabbox)%s?%s?%s?%c%c", "\\g<c1>\\n\\g<c2>");
    }

    private static void graphics(RuleCatalog.Builder catalog) {
        main(catalog, "graphics")
                .add("\\\\DeclareGraphicsExtensions%C", "")
                .add("\\\\DeclareGraphicsRule%C%C%C%C", "")
                .add("\\\\graphicspath%C", "")
                .add("\\\\includegraphics%s?%s?%c", "")
                .add("\\\\rotatebox%s?%c%c", "\\g<c2>")
                .add("\\\\scalebox%c%s?%c", "\\g<c2>")
                .add("\\\\resizebox\\*?%c%c%c", "\\g<c3>");
        catalog.alias(RuleSetKey.usePackage("graphicx"), RuleSetKey.usePackage("graphics"));
    }

    private static void harpoon(RuleCatalog.Builder catalog) {
        main(catalog, "harpoon").add("\\\\(?:over|under)(?:left|right)harp(?:down)?%C", "\\g<c1>");
    }

    private static void hyperref(RuleCatalog.Builder catalog) {
        main(catalog, "hyperref")
                .add("\\\\pdfbookmark%s?%c%c", "\\g<c1>")
                .add("\\\\hypersetup%C", m -> hypersetup(m.value("c1")))
                .add("\\\\texorpdfstring%C%C", "\\n\\g<c1>\\n\\n\\g<c2>\\n")
                .add("\\\\ref\\*%C", "\\\\ref{\\g<c1>}")
                .add("\\\\pageref\\*%C", "\\\\pageref{\\g<c1>}")
                .add("\\\\href%s?%c%c", "\\g<c2>")
                .add("\\\\autoref\\*?%C", "X")
                .add("\\\\autopageref\\*?%C", "X");
    }

    /** The document information set with {@code \hypersetup}, one value per paragraph. */
    private static String hypersetup(String options) {
        List<String> values = new ArrayList<>();
        for (KeyValues key : PDF_INFO) {
            String value = key.extract(options);
            if (!value.isEmpty()) {
                values.add(value);
            }
        }
        return "\n" + String.join("\n\n", values) + "\n";
    }

    private static void ifthen(RuleCatalog.Builder catalog) {
        main(catalog, "ifthen")
                .add("\\\\newboolean%C", "")
                .add("\\\\setboolean%C%C", "")
                .add("\\\\equal%C%C", "")
                .add("\\\\ifthenelse%C%C%C", "\\g<c2> \\g<c3>");
    }

    private static void listings(RuleCatalog.Builder catalog) {
        catalog.ruleSet(RuleSetKey.usePackage("listings"), Phase.REMOVAL)
                .add("\\\\lstinline%s?{", "\\\\verb}")
                .add("\\\\lstinline%s?(?<delim>.)", "\\\\verb\\g<delim>")
                .add("\\\\begin{lstlisting}", "\\\\begin[lstlisting]{verbatim}");
        main(catalog, "listings")
                .add("\\\\lstloadlanguages%C", "")
                .add("\\\\lstset%C", "")
                .add("\\\\lstdefinestyle%C%C", "")
                .add("\\\\lstinputlisting%s?%c", "");
    }

    private static void multirow(RuleCatalog.Builder catalog) {
        main(catalog, "multirow").add("\\\\multirow%s?%c%s?%c%s?%c", "\\g<c3>");
    }

    private static void natbib(RuleCatalog.Builder catalog) {
        main(catalog, "natbib")
                .add("\\\\[Cc]itet\\*?%s%C", CITATION + " (\\g<s1>)")
                .add("\\\\[Cc]itet\\*?%C", CITATION)
                .add("\\\\[Cc]itep\\*?%s\\[\\]%C", "(\\g<s1> " + CITATION + ")")
                .add("\\\\[Cc]itep\\*?%s%s%C", "(\\g<s1> " + CITATION + ", \\g<s2>)")
                .add("\\\\[Cc]itep\\*?%s%C", "(" + CITATION + ", \\g<s1>)")
                .add("\\\\[Cc]itep\\*?%C", "(" + CITATION + ")")
                .add("\\\\[Cc]iteal[tp]\\*?%s\\[\\]%C", "\\g<s1> " + CITATION)
                .add("\\\\[Cc]iteal[tp]\\*?%s%s%C", "\\g<s1> " + CITATION + ", \\g<s2>")
                .add("\\\\[Cc]iteal[tp]\\*?%s%C", CITATION + ", \\g<s1>")
                .add("\\\\[Cc]iteal[tp]\\*?%C", CITATION)
                .add("\\\\defcitealias%C%C", "")
                .add("\\\\citetalias%C", CITATION)
                .add("\\\\citepalias%C", "(" + CITATION + ")")
                .add("\\\\citenum%C", "X")
                .add("\\\\citetext%C", "(\\g<c1>)")
                .add("\\\\[Cc]iteauthor\\*?%C", "Authors")
                .add("\\\\[Cc]itefullauthor%C", "Authors")
                .add("\\\\citeyearpar%C", "(\\\\citeyear\\g<c1>)")
                .add("\\\\citeyear%C", "2020");
    }

    private static void pdfpages(RuleCatalog.Builder catalog) {
        main(catalog, "pdfpages")
                .add("\\\\includepdf%s?%c", "")
                .add("\\\\includepdfmerge%s?%c", "")
                .add("\\\\includepdfset%C", "");
    }

    private static void pgfplots(RuleCatalog.Builder catalog) {
        main(catalog, "pgfplots")
                .add("\\\\usepgfplotslibrary%C", "")
                .add("\\\\pgfplotsset%C", "");
    }

    private static void scalerel(RuleCatalog.Builder catalog) {
        main(catalog, "scalerel")
                .add("\\\\(?:scale|stretch)rel\\*%s?%c%c", "\\g<c1>")
                .add("\\\\(?:scale|stretch)rel%s?%c%c", "\\g<c1>\\g<c2>")
                .add("\\\\(?:scale|stretch)to%s?%c%c", "\\g<c1>");
    }

    private static void siunitx(RuleCatalog.Builder catalog) {
        main(catalog, "siunitx")
                .add("\\\\sisetup%C", "")
                .add("\\\\ang%s?%c", m -> angle(m.value("c1")))
                .add("\\\\(?:complex)?num%s?%c", "\\g<c1>")
                .add("\\\\numlist%s?%c", m -> numberList(m.value("c1")))
                .add("\\\\numproduct%s?%c", "\\g<c1>")
                .add("\\\\numrange%s?%c%c", "\\g<c1> to \\g<c2>")
                .add("\\\\(?:unit|si)%s?%c", "")
                .add("\\\\(?:qty|complexqty|SI)%s?%c%c", "\\g<c1>")
                .add("\\\\(?:qty|SI)list%s?%c%c", m -> numberList(m.value("c1")))
                .add("\\\\(?:qty|SI)product%s?%c%c", "\\g<c1>")
                .add("\\\\(?:qty|SI)range%s?%c%c%c", "\\g<c1> to \\g<c2>")
                .add("\\\\DeclareSIUnit%s?%C%c", "")
                .add("\\\\DeclareSI(?:Prefix|Power)%C%c%c", "")
                .add("\\\\DeclareSIQualifier%C%c", "")
                .add("\\\\tablenum%s?%c", "\\g<c1>");
    }

    /** {@code 1;2;3} reads {@code 1, 2 and 3}. */
    static String numberList(String raw) {
        List<String> values = Arrays.asList(raw.split(";", -1));
        if (values.size() == 1) {
            return values.get(0);
        }
        return String.join(", ", values.subList(0, values.size() - 1)) + " and " + values.get(values.size() - 1);
    }

    /** Decimal degrees, or degree;minute;second with any part left empty. */
    static String angle(String raw) {
        if (!raw.contains(";")) {
            return raw + "°";
        }
        String[] parts = raw.replace(" ", "").split(";", -1);
        if (parts.length != 3) {
            throw new IllegalArgumentException("Angle needs degrees, minutes and seconds: " + raw);
        }
        StringBuilder angle = new StringBuilder();
        if (!parts[0].isEmpty()) {
            angle.append(parts[0]).append('°');
        }
        if (!parts[1].isEmpty()) {
            angle.append(parts[1]).append('\'');
        }
        if (!parts[2].isEmpty()) {
            angle.append(parts[2]).append('"');
        }
        return angle.toString();
    }

    private static void soul(RuleCatalog.Builder catalog) {
        main(catalog, "soul")
                .add("\\\\soulregister%C%C", "")
                .add("\\\\soulfont%C%C", "")
                .add("\\\\soulaccent%C", "");
    }

    private static void subcaption(RuleCatalog.Builder catalog) {
        main(catalog, "subcaption").add("\\\\subcaption%s?%c", "\\\\caption[\\g<s1>]{\\g<c1>}");
    }

    private static void subfig(RuleCatalog.Builder catalog) {
        main(catalog, "subfig")
                .add("\\\\subfloat%s?%s?%c", "\\\\caption[\\g<s1>]{\\g<s2>}\\n\\g<c1>\\n")
                .add("\\\\subref\\*?%C", "\\\\ref{\\g<c1>}");
    }

    private static void ulem(RuleCatalog.Builder catalog) {
        // \markoverwith leaves a space so the following text does not join the preceding \bgroup.
        main(catalog, "ulem")
                .add("\\\\markoverwith%C", " ")
                .add("\\\\uline%C", "\\g<c1>")
                .add("\\\\uuline%C", "\\g<c1>")
                .add("\\\\uwave%C", "\\g<c1>")
                .add("\\\\sout%C", "\\g<c1>")
                .add("\\\\xout%C", "\\g<c1>")
                .add("\\\\dashuline%C", "\\g<c1>")
                .add("\\\\dotuline%C", "\\g<c1>");
    }

    private static void url(RuleCatalog.Builder catalog) {
        // URLs may contain % and are handled before comments are removed.
        catalog.ruleSet(RuleSetKey.usePackage("url"), Phase.REMOVAL)
                .add("\\\\url%c", m -> ESCAPE_PERCENT.apply(m.value("c1")))
                .add("\\\\url(?![a-zA-Z])\\s*+(?<delim>.)(?<address>(?s:.)*?)\\k<delim>",
                        m -> ESCAPE_PERCENT.apply(m.value("address")));
        main(catalog, "url").add("\\\\urlstyle%C", "");
    }

    private static void xcolor(RuleCatalog.Builder catalog) {
        main(catalog, "xcolor")
                .add("\\\\(?:define|provide)color%s?%c%c%c", "")
                .add("\\\\(?:define|provide)colors%c", "")
                .add("\\\\(?:define|provide)colorset%s?%c%c%c%c", "")
                .add("\\\\colorlet%s?%c%s?%c", "")
                .add("\\\\(?:page)?color%s?%c", "")
                .add("\\\\(?:text|math)color%s?%c%c", "\\g<c2>")
                .add("\\\\colorbox%s?%c%c", "\\g<c2>")
                .add("\\\\fcolorbox%s?%c%s?%c%c", "\\g<c3>")
                .add("\\\\boxframe%c%c%c", "");
    }
}
