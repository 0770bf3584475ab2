package org.errers.engine.pattern;

import java.util.Objects;

public record CaptureGroup(String name, GroupFamily family) {
    public CaptureGroup {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(family, "family");
    }
}
