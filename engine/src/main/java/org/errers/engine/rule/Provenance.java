package org.errers.engine.rule;

public enum Provenance {
    DOCUMENT_LOCAL,
    AUTO_GENERATED,
    BUILT_IN
}
