package org.errers.engine.rule;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Builds the {@link RuleList} of a run. Within a phase, document-local rules come first, then
 * auto-generated rules, then local rule sets, the class, package and style sets of the document and
 * finally the core set.
 */
public final class RuleComposer {
    private static final Logger LOGGER = Logger.getLogger(RuleComposer.class.getName());

    private final boolean autoRules;
    private final boolean defaultRules;
    private final boolean localRules;

    public RuleComposer(boolean autoRules, boolean defaultRules, boolean localRules) {
        this.autoRules = autoRules;
        this.defaultRules = defaultRules;
        this.localRules = localRules;
    }

    /**
     * @param activeSets class, package and style sets detected for the document, in detection order
     */
    public RuleList compose(
            RuleCatalog catalog, List<RuleSetKey> activeSets, List<Rule> documentRules, List<Rule> generatedRules) {
        List<RuleSetKey> builtIn = new ArrayList<>();
        for (RuleSetKey key : activeSets) {
            if (catalog.contains(key)) {
                builtIn.add(key);
            } else {
                LOGGER.fine(() -> "No built-in rules for " + key.scope());
            }
        }
        Map<Phase, List<Rule>> phases = new EnumMap<>(Phase.class);
        for (Phase phase : Phase.values()) {
            List<Rule> rules = new ArrayList<>();
            addPhase(rules, documentRules, phase);
            if (autoRules) {
                addPhase(rules, generatedRules, phase);
            }
            if (localRules) {
                for (RuleSetKey key : builtIn) {
                    addBuiltIn(rules, catalog.getLocalRules(key, phase));
                }
                addBuiltIn(rules, catalog.getLocalRules(RuleSetKey.core(), phase));
            }
            for (RuleSetKey key : builtIn) {
                addBuiltIn(rules, catalog.getStandardRules(key, phase));
            }
            addBuiltIn(rules, catalog.getStandardRules(RuleSetKey.core(), phase));
            phases.put(phase, rules);
        }
        List<Rule> braceCleanup = new ArrayList<>();
        addBuiltIn(braceCleanup, catalog.getBraceCleanupRules());
        RuleList list = new RuleList(phases, braceCleanup);
        LOGGER.fine(() -> "Composed " + list.size() + " rules from " + builtIn.size() + " rule set(s)");
        return list;
    }

    private static void addPhase(List<Rule> target, List<Rule> source, Phase phase) {
        for (Rule rule : source) {
            if (rule.getPhase() == phase) {
                target.add(rule);
            }
        }
    }

    private void addBuiltIn(List<Rule> target, List<Rule> source) {
        for (Rule rule : source) {
            if (defaultRules || !rule.isGeneric()) {
                target.add(rule);
            }
        }
    }
}
