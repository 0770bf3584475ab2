package org.errers.engine.scan;

public enum DeclarationKind {
    /** {@code \newcommand} and its variants. */
    COMMAND,
    /** {@code \newenvironment} and {@code \renewenvironment}. */
    ENVIRONMENT,
    /** {@code \def}, {@code \gdef}, {@code \edef}, {@code \xdef}. */
    DEF,
    /** {@code \newcounter}. */
    COUNTER
}
