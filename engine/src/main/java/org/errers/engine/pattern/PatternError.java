package org.errers.engine.pattern;

import org.errers.engine.source.SourceLocation;

/**
 * Raised when a rule template cannot be expanded or compiled, or when its replacement template
 * refers to groups the pattern does not define.
 */
public final class PatternError extends Exception {
    private final String template;
    private final String scope;
    private final SourceLocation location;

    public PatternError(String message, String template, String scope, SourceLocation location) {
        this(message, template, scope, location, null);
    }

    public PatternError(String message, String template, String scope, SourceLocation location, Throwable cause) {
        super(describe(message, scope, location), cause);
        this.template = template;
        this.scope = scope;
        this.location = location;
    }

    public String getTemplate() {
        return template;
    }

    public String getScope() {
        return scope;
    }

    public SourceLocation getLocation() {
        return location;
    }

    private static String describe(String message, String scope, SourceLocation location) {
        StringBuilder builder = new StringBuilder(message);
        if (scope != null || location != null) {
            builder.append(" (");
            if (scope != null) {
                builder.append(scope);
            }
            if (location != null) {
                builder.append(scope != null ? " " : "").append(location);
            }
            builder.append(')');
        }
        return builder.toString();
    }
}
