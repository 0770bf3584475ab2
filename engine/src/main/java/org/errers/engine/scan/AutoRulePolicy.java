package org.errers.engine.scan;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import org.errers.engine.rule.Phase;

/**
 * Phase assigned to the rules generated for each kind of declaration.
 */
public final class AutoRulePolicy {
    private static final AutoRulePolicy DEFAULT = builder()
            .phase(DeclarationKind.COMMAND, Phase.MAIN)
            .phase(DeclarationKind.ENVIRONMENT, Phase.MAIN)
            .phase(DeclarationKind.DEF, Phase.MAIN)
            .phase(DeclarationKind.COUNTER, Phase.SETUP)
            .build();

    private final Map<DeclarationKind, Phase> phases;

    private AutoRulePolicy(Map<DeclarationKind, Phase> phases) {
        this.phases = Collections.unmodifiableMap(new EnumMap<>(phases));
    }

    public static AutoRulePolicy defaults() {
        return DEFAULT;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Phase phaseOf(DeclarationKind kind) {
        return phases.getOrDefault(kind, Phase.MAIN);
    }

    public Map<DeclarationKind, Phase> asMap() {
        return phases;
    }

    public static final class Builder {
        private final Map<DeclarationKind, Phase> phases = new EnumMap<>(DeclarationKind.class);

        private Builder() {}

        public Builder phase(DeclarationKind kind, Phase phase) {
            phases.put(Objects.requireNonNull(kind, "kind"), Objects.requireNonNull(phase, "phase"));
            return this;
        }

        public AutoRulePolicy build() {
            return new AutoRulePolicy(phases);
        }
    }
}
