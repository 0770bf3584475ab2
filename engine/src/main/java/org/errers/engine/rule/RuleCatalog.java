package org.errers.engine.rule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.errers.engine.ExtractionMessage;
import org.errers.engine.pattern.CompiledPattern;
import org.errers.engine.pattern.Guard;
import org.errers.engine.pattern.PatternCompiler;
import org.errers.engine.pattern.PatternError;
import org.errers.engine.source.SourceLocation;

/**
 * Immutable registry of built-in rules, keyed by {@link RuleSetKey} and phase. Rules contributed by local
 * providers are kept apart so the composer can order them first or leave them out.
 *
 * <p>Templates that fail to compile do not prevent the catalog from being built; the failures are kept as
 * {@link ExtractionMessage.Kind#PATTERN_ERROR} messages and reported by every run.
 */
public final class RuleCatalog {
    private final Map<RuleSetKey, Map<Phase, List<Rule>>> localSets;
    private final Map<RuleSetKey, Map<Phase, List<Rule>>> standardSets;
    private final List<Rule> braceCleanup;
    private final List<ExtractionMessage> compilationErrors;

    private RuleCatalog(Builder builder) {
        this.localSets = freeze(builder.localSets, builder.aliases);
        this.standardSets = freeze(builder.standardSets, builder.aliases);
        this.braceCleanup = List.copyOf(builder.braceCleanup);
        this.compilationErrors = List.copyOf(builder.compilationErrors);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RuleCatalog empty() {
        return builder().build();
    }

    public List<Rule> getLocalRules(RuleSetKey key, Phase phase) {
        return lookup(localSets, key, phase);
    }

    public List<Rule> getStandardRules(RuleSetKey key, Phase phase) {
        return lookup(standardSets, key, phase);
    }

    public boolean contains(RuleSetKey key) {
        return localSets.containsKey(key) || standardSets.containsKey(key);
    }

    public Set<RuleSetKey> getStandardKeys() {
        return standardSets.keySet();
    }

    public List<Rule> getBraceCleanupRules() {
        return braceCleanup;
    }

    public List<ExtractionMessage> getCompilationErrors() {
        return compilationErrors;
    }

    private static List<Rule> lookup(Map<RuleSetKey, Map<Phase, List<Rule>>> sets, RuleSetKey key, Phase phase) {
        Map<Phase, List<Rule>> phases = sets.get(key);
        if (phases == null) {
            return List.of();
        }
        return phases.getOrDefault(phase, List.of());
    }

    private static Map<RuleSetKey, Map<Phase, List<Rule>>> freeze(
            Map<RuleSetKey, Map<Phase, List<Rule>>> sets, Map<RuleSetKey, RuleSetKey> aliases) {
        Map<RuleSetKey, Map<Phase, List<Rule>>> frozen = new LinkedHashMap<>();
        sets.forEach((key, phases) -> {
            EnumMap<Phase, List<Rule>> copy = new EnumMap<>(Phase.class);
            phases.forEach((phase, rules) -> copy.put(phase, List.copyOf(rules)));
            frozen.put(key, Collections.unmodifiableMap(copy));
        });
        aliases.forEach((alias, target) -> {
            Map<Phase, List<Rule>> phases = frozen.get(target);
            if (phases != null) {
                frozen.putIfAbsent(alias, phases);
            }
        });
        return Collections.unmodifiableMap(frozen);
    }

    /** Collects rule sets; providers register through it. */
    public static final class Builder {
        private static final Logger LOGGER = Logger.getLogger(RuleCatalog.class.getName());

        private final PatternCompiler compiler = new PatternCompiler();
        private final Map<RuleSetKey, Map<Phase, List<Rule>>> localSets = new LinkedHashMap<>();
        private final Map<RuleSetKey, Map<Phase, List<Rule>>> standardSets = new LinkedHashMap<>();
        private final Map<RuleSetKey, RuleSetKey> aliases = new LinkedHashMap<>();
        private final List<Rule> braceCleanup = new ArrayList<>();
        private final List<ExtractionMessage> compilationErrors = new ArrayList<>();
        private final Map<String, Integer> ordinals = new HashMap<>();
        private boolean local;

        private Builder() {}

        public RuleSetBuilder ruleSet(RuleSetKey key, Phase phase) {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(phase, "phase");
            Map<RuleSetKey, Map<Phase, List<Rule>>> sets = local ? localSets : standardSets;
            List<Rule> target = sets.computeIfAbsent(key, k -> new EnumMap<>(Phase.class))
                    .computeIfAbsent(phase, p -> new ArrayList<>());
            String scope = (local ? "local " : "") + key.scope();
            return new RuleSetBuilder(this, target, scope, phase);
        }

        /** Rules run after each main-phase sweep to strip braces of unknown commands. */
        public RuleSetBuilder braceCleanup() {
            return new RuleSetBuilder(this, braceCleanup, "core braces", Phase.MAIN);
        }

        /** Makes {@code alias} resolve to the rules of {@code target}, e.g. a package loaded under two names. */
        public Builder alias(RuleSetKey alias, RuleSetKey target) {
            aliases.put(alias, target);
            return this;
        }

        public Builder include(RuleSetProvider provider) {
            provider.register(this);
            return this;
        }

        public Builder includeLocal(RuleSetProvider provider) {
            boolean previous = local;
            local = true;
            try {
                provider.register(this);
            } finally {
                local = previous;
            }
            return this;
        }

        public RuleCatalog build() {
            if (!compilationErrors.isEmpty()) {
                LOGGER.warning(() -> compilationErrors.size() + " built-in rule(s) failed to compile");
            }
            return new RuleCatalog(this);
        }

        private void addRule(
                List<Rule> target,
                String scope,
                Phase phase,
                String template,
                Object replacement,
                boolean iterative,
                boolean generic,
                Guard[] guards) {
            String ordinalKey = scope + "/" + phase.getName();
            int ordinal = ordinals.merge(ordinalKey, 1, Integer::sum);
            SourceLocation location = new SourceLocation(ordinalKey, ordinal);
            try {
                CompiledPattern pattern = compiler.compile(template, scope, location, guards);
                Replacement resolved = replacement instanceof String
                        ? ReplacementTemplate.parse((String) replacement, pattern)
                        : (Replacement) replacement;
                target.add(new Rule(pattern, resolved, phase, iterative, generic, Provenance.BUILT_IN));
                LOGGER.finest(() -> "Registered " + scope + " rule " + location);
            } catch (PatternError e) {
                LOGGER.log(Level.SEVERE, e.getMessage(), e);
                compilationErrors.add(new ExtractionMessage(
                        ExtractionMessage.Kind.PATTERN_ERROR, e.getMessage(), location, scope + ": " + template));
            }
        }
    }

    /** Adds rules to one set and phase. */
    public static final class RuleSetBuilder {
        private final Builder owner;
        private final List<Rule> target;
        private final String scope;
        private final Phase phase;

        private RuleSetBuilder(Builder owner, List<Rule> target, String scope, Phase phase) {
            this.owner = owner;
            this.target = target;
            this.scope = scope;
            this.phase = phase;
        }

        public RuleSetBuilder add(String template, String replacement) {
            return rule(template).to(replacement);
        }

        public RuleSetBuilder add(String template, Replacement replacement) {
            return rule(template).to(replacement);
        }

        public RuleSetBuilder addIterative(String template, String replacement) {
            return rule(template).iterative().to(replacement);
        }

        public RuleDefinition rule(String template) {
            return new RuleDefinition(this, template);
        }

        private RuleSetBuilder add(RuleDefinition definition, Object replacement) {
            owner.addRule(
                    target,
                    scope,
                    phase,
                    definition.template,
                    Objects.requireNonNull(replacement, "replacement"),
                    definition.iterative,
                    definition.generic,
                    definition.guards.toArray(new Guard[0]));
            return this;
        }
    }

    /** A rule being declared; finished by one of the {@code to} methods. */
    public static final class RuleDefinition {
        private final RuleSetBuilder set;
        private final String template;
        private final List<Guard> guards = new ArrayList<>();
        private boolean iterative;
        private boolean generic;

        private RuleDefinition(RuleSetBuilder set, String template) {
            this.set = set;
            this.template = Objects.requireNonNull(template, "template");
        }

        public RuleDefinition iterative() {
            return iterative(true);
        }

        public RuleDefinition iterative(boolean value) {
            this.iterative = value;
            return this;
        }

        public RuleDefinition generic() {
            this.generic = true;
            return this;
        }

        public RuleDefinition guard(Guard guard) {
            guards.add(guard);
            return this;
        }

        public RuleSetBuilder to(String replacement) {
            return set.add(this, replacement);
        }

        public RuleSetBuilder to(Replacement replacement) {
            return set.add(this, replacement);
        }
    }
}
