package org.errers.engine.rule;

/**
 * Computes the text that replaces a match. Template strings are represented by {@link ReplacementTemplate};
 * built-in rule sets also use functions.
 */
@FunctionalInterface
public interface Replacement {
    String apply(RuleMatch match);
}
