package org.errers.engine.rule;

import java.util.Objects;

/**
 * Identifies a built-in rule set: the core set or the set tied to a document class, package or
 * bibliography style.
 */
public record RuleSetKey(Kind kind, String name) {

    public enum Kind {
        CORE,
        DOCUMENT_CLASS,
        PACKAGE,
        BIBLIOGRAPHY_STYLE
    }

    private static final RuleSetKey CORE = new RuleSetKey(Kind.CORE, "core");

    public RuleSetKey {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(name, "name");
    }

    public static RuleSetKey core() {
        return CORE;
    }

    public static RuleSetKey documentClass(String name) {
        return new RuleSetKey(Kind.DOCUMENT_CLASS, sanitize(name));
    }

    public static RuleSetKey usePackage(String name) {
        return new RuleSetKey(Kind.PACKAGE, sanitize(name));
    }

    public static RuleSetKey bibliographyStyle(String name) {
        return new RuleSetKey(Kind.BIBLIOGRAPHY_STYLE, sanitize(name));
    }

    /** Names are compared with {@code -} and {@code .} folded to {@code _}. */
    public static String sanitize(String name) {
        return name.strip().replace('-', '_').replace('.', '_');
    }

    public String scope() {
        return switch (kind) {
            case CORE -> "core";
            case DOCUMENT_CLASS -> "class " + name;
            case PACKAGE -> "package " + name;
            case BIBLIOGRAPHY_STYLE -> "style " + name;
        };
    }
}
