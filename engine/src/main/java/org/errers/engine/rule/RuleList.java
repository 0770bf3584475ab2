package org.errers.engine.rule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * The composed rules of one run, partitioned by phase, plus the brace-cleanup rules of the main phase.
 */
public final class RuleList {
    private final Map<Phase, List<Rule>> rules;
    private final List<Rule> braceCleanup;

    RuleList(Map<Phase, List<Rule>> rules, List<Rule> braceCleanup) {
        EnumMap<Phase, List<Rule>> copy = new EnumMap<>(Phase.class);
        for (Phase phase : Phase.values()) {
            copy.put(phase, List.copyOf(rules.getOrDefault(phase, List.of())));
        }
        this.rules = Collections.unmodifiableMap(copy);
        this.braceCleanup = List.copyOf(braceCleanup);
    }

    public List<Rule> getRules(Phase phase) {
        return rules.get(phase);
    }

    public List<Rule> getBraceCleanupRules() {
        return braceCleanup;
    }

    /** Every rule in execution order. */
    public List<Rule> all() {
        List<Rule> all = new ArrayList<>();
        for (Phase phase : Phase.values()) {
            all.addAll(rules.get(phase));
            if (phase == Phase.MAIN) {
                all.addAll(braceCleanup);
            }
        }
        return all;
    }

    public int size() {
        return all().size();
    }
}
