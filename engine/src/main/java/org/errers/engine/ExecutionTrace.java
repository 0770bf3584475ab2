package org.errers.engine;

/**
 * Indented record of phases and rule applications, kept only when requested.
 */
final class ExecutionTrace {
    private final StringBuilder text;
    private int depth;

    ExecutionTrace(boolean enabled) {
        this.text = enabled ? new StringBuilder() : null;
    }

    boolean isEnabled() {
        return text != null;
    }

    void enter(String label) {
        line(label);
        depth++;
    }

    void exit() {
        depth = Math.max(0, depth - 1);
    }

    void line(String line) {
        if (text == null) {
            return;
        }
        text.append("  ".repeat(depth)).append(line).append('\n');
    }

    String getText() {
        return text == null ? null : text.toString();
    }
}
