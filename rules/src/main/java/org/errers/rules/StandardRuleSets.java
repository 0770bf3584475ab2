package org.errers.rules;

import org.errers.engine.rule.RuleCatalog;
import org.errers.engine.rule.RuleSetProvider;

/**
 * All built-in rule sets: the core set, document classes and packages.
 */
public final class StandardRuleSets implements RuleSetProvider {

    @Override
    public void register(RuleCatalog.Builder catalog) {
        catalog.include(new CoreRuleSets())
                .include(new ClassRuleSets())
                .include(new PackageRuleSets());
    }
}
