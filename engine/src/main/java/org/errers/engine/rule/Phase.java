package org.errers.engine.rule;

import java.util.Locale;

/**
 * Processing phases, run in declaration order.
 */
public enum Phase {
    INSERTION,
    REMOVAL,
    SETUP,
    MAIN,
    CLEANUP;

    public String getName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Looks a phase up by its lower-case name, as written in document-local rules. */
    public static Phase fromName(String name) {
        for (Phase phase : values()) {
            if (phase.getName().equals(name)) {
                return phase;
            }
        }
        throw new IllegalArgumentException("Unknown phase '" + name + "'");
    }
}
