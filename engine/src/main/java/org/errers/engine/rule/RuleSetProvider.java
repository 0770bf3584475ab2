package org.errers.engine.rule;

/**
 * Contributes rule sets to a {@link RuleCatalog}. Implementations registered through
 * {@link java.util.ServiceLoader} are loaded as local rule sets and take precedence over the built-in ones.
 */
public interface RuleSetProvider {
    void register(RuleCatalog.Builder catalog);
}
