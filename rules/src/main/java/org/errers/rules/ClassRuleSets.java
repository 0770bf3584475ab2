package org.errers.rules;

import org.errers.engine.rule.Phase;
import org.errers.engine.rule.RuleCatalog;
import org.errers.engine.rule.RuleSetKey;
import org.errers.engine.rule.RuleSetProvider;

/**
 * Rules for document classes.
 */
final class ClassRuleSets implements RuleSetProvider {

    @Override
    public void register(RuleCatalog.Builder catalog) {
        // Taylor & Francis Interact
        catalog.ruleSet(RuleSetKey.documentClass("interact"), Phase.MAIN)
                .add("\\\\name%C", "\\n\\g<c1>\\n")
                .add("\\\\affil%C", "\\n\\g<c1>\\n")
                .add("\\\\tbl%C%C", "\\\\caption{\\g<c1>}\\n\\g<c2>");
    }
}
