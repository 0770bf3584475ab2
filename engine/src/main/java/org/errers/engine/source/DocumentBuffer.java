package org.errers.engine.source;

import java.util.List;
import java.util.Objects;

/**
 * The text being transformed plus the location map that keeps its offsets attributable.
 */
public final class DocumentBuffer {
    /** Text and location map at one point of the run. */
    public record Snapshot(String text, LocationMap locationMap) {}

    private String text;
    private LocationMap locationMap;

    public DocumentBuffer(String text, LocationMap locationMap) {
        this.text = Objects.requireNonNull(text, "text");
        this.locationMap = Objects.requireNonNull(locationMap, "locationMap");
    }

    public String getText() {
        return text;
    }

    public LocationMap getLocationMap() {
        return locationMap;
    }

    public SourceLocation locate(int offset) {
        return locationMap.locate(offset);
    }

    public SourceFile fileAt(int offset) {
        return locationMap.lineAt(offset).file();
    }

    public void apply(String newText, List<TextEdit> edits) {
        this.locationMap = locationMap.applyEdits(edits);
        this.text = Objects.requireNonNull(newText, "newText");
    }

    public Snapshot snapshot() {
        return new Snapshot(text, locationMap);
    }

    public void restore(Snapshot snapshot) {
        this.text = snapshot.text();
        this.locationMap = snapshot.locationMap();
    }
}
