package org.errers.engine.scan;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.errers.engine.pattern.CompiledPattern;
import org.errers.engine.pattern.Guard;
import org.errers.engine.pattern.PatternCompiler;
import org.errers.engine.rule.RuleSetKey;

/**
 * Document classes, packages and bibliography style of a document. The compiler log is authoritative when
 * present since it also lists packages loaded indirectly; otherwise the preamble is read.
 */
public final class DocumentProfile {
    private static final Logger LOGGER = Logger.getLogger(DocumentProfile.class.getName());

    private static final Pattern LOG_CLASS = Pattern.compile("Document Class: ([a-zA-Z0-9_.-]++)");
    private static final Pattern LOG_PACKAGE = Pattern.compile("Package: ([a-zA-Z0-9_.-]++)");
    private static final CompiledPattern DOCUMENT_CLASS =
            PatternCompiler.internal("\\\\documentclass%s?%C", Guard.NOT_COMMENTED);
    private static final CompiledPattern USE_PACKAGE =
            PatternCompiler.internal("\\\\usepackage%s?%C", Guard.NOT_COMMENTED);
    private static final CompiledPattern BIBLIOGRAPHY_STYLE =
            PatternCompiler.internal("\\\\bibliographystyle%C", Guard.NOT_COMMENTED);

    private final List<String> documentClasses;
    private final List<String> packages;
    private final String bibliographyStyle;

    public DocumentProfile(List<String> documentClasses, List<String> packages, String bibliographyStyle) {
        this.documentClasses = List.copyOf(documentClasses);
        this.packages = List.copyOf(packages);
        this.bibliographyStyle = bibliographyStyle;
    }

    public static DocumentProfile detect(String text, Optional<String> compilerLog) {
        Set<String> classes = new LinkedHashSet<>();
        Set<String> packages = new LinkedHashSet<>();
        if (compilerLog.isPresent()) {
            collect(LOG_CLASS.matcher(compilerLog.get()), classes);
            collect(LOG_PACKAGE.matcher(compilerLog.get()), packages);
        } else {
            LOGGER.warning("No compiler log found, reading document class and packages from the preamble");
            collect(DOCUMENT_CLASS, text, classes);
            collect(USE_PACKAGE, text, packages);
        }
        String style = null;
        Matcher matcher = BIBLIOGRAPHY_STYLE.matcher(text);
        if (BIBLIOGRAPHY_STYLE.find(matcher, text)) {
            style = RuleSetKey.sanitize(matcher.group("c1"));
        }
        DocumentProfile profile = new DocumentProfile(new ArrayList<>(classes), new ArrayList<>(packages), style);
        LOGGER.info(() -> "Document profile: " + profile);
        return profile;
    }

    private static void collect(Matcher matcher, Set<String> names) {
        while (matcher.find()) {
            names.add(RuleSetKey.sanitize(matcher.group(1)));
        }
    }

    private static void collect(CompiledPattern pattern, String text, Set<String> names) {
        Matcher matcher = pattern.matcher(text);
        while (pattern.find(matcher, text)) {
            for (String name : matcher.group("c1").split(",")) {
                if (!name.isBlank()) {
                    names.add(RuleSetKey.sanitize(name));
                }
            }
        }
    }

    public List<String> getDocumentClasses() {
        return documentClasses;
    }

    public List<String> getPackages() {
        return packages;
    }

    public Optional<String> getBibliographyStyle() {
        return Optional.ofNullable(bibliographyStyle);
    }

    /** Rule sets to activate, classes first, then packages, then the style. */
    public List<RuleSetKey> ruleSetKeys() {
        List<RuleSetKey> keys = new ArrayList<>();
        documentClasses.forEach(name -> keys.add(RuleSetKey.documentClass(name)));
        packages.forEach(name -> keys.add(RuleSetKey.usePackage(name)));
        if (bibliographyStyle != null) {
            keys.add(RuleSetKey.bibliographyStyle(bibliographyStyle));
        }
        return keys;
    }

    @Override
    public String toString() {
        return "classes=" + documentClasses + ", packages=" + packages + ", style=" + bibliographyStyle;
    }
}
