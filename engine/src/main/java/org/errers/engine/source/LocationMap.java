package org.errers.engine.source;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Maps buffer offsets back to the file and line they came from.
 *
 * <p>The map is a sorted list of span starts; every span carries the origin of the text starting there.
 * Instances are immutable, {@link #applyEdits(List)} produces the map for the edited buffer.
 */
public final class LocationMap {
    private final int[] starts;
    private final SourceLine[] origins;

    private LocationMap(int[] starts, SourceLine[] origins) {
        this.starts = starts;
        this.origins = origins;
    }

    /** One span per line of {@code text}, numbered from 1. */
    public static LocationMap of(String text, SourceFile file) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(file, "file");
        List<Integer> positions = new ArrayList<>();
        positions.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n' && i + 1 < text.length()) {
                positions.add(i + 1);
            }
        }
        int[] starts = new int[positions.size()];
        SourceLine[] origins = new SourceLine[positions.size()];
        for (int i = 0; i < starts.length; i++) {
            starts[i] = positions.get(i);
            origins[i] = new SourceLine(file, i + 1);
        }
        return new LocationMap(starts, origins);
    }

    public SourceLine lineAt(int offset) {
        int index = Arrays.binarySearch(starts, offset);
        if (index < 0) {
            index = -index - 2;
        }
        return origins[Math.max(index, 0)];
    }

    public SourceLocation locate(int offset) {
        return lineAt(offset).toLocation();
    }

    public int spanCount() {
        return starts.length;
    }

    /**
     * Rebuilds the map after {@code edits} (sorted, non-overlapping, in old-buffer coordinates) were applied.
     * Spans strictly inside a replaced range disappear; text after an edit keeps the origin it had before.
     */
    public LocationMap applyEdits(List<TextEdit> edits) {
        if (edits.isEmpty()) {
            return this;
        }
        Builder builder = new Builder(starts.length + edits.size());
        int delta = 0;
        int index = 0;
        for (TextEdit edit : edits) {
            while (index < starts.length && starts[index] <= edit.start()) {
                builder.add(starts[index] + delta, origins[index]);
                index++;
            }
            int newStart = edit.start() + delta;
            int newEnd = newStart + edit.replacementLength();
            boolean dropped = false;
            while (index < starts.length && starts[index] < edit.end()) {
                dropped = true;
                index++;
            }
            LocationMap inserted = edit.inserted();
            if (inserted != null) {
                for (int i = 0; i < inserted.starts.length; i++) {
                    builder.add(newStart + edit.insertedOffset() + inserted.starts[i], inserted.origins[i]);
                }
            }
            if ((dropped || inserted != null) && newEnd > newStart) {
                builder.add(newEnd, lineAt(edit.end()));
            }
            delta += edit.replacementLength() - (edit.end() - edit.start());
        }
        while (index < starts.length) {
            builder.add(starts[index] + delta, origins[index]);
            index++;
        }
        return builder.build();
    }

    private static final class Builder {
        private int[] starts;
        private SourceLine[] origins;
        private int size;

        Builder(int capacity) {
            this.starts = new int[Math.max(capacity, 1)];
            this.origins = new SourceLine[starts.length];
        }

        void add(int position, SourceLine origin) {
            if (size > 0 && starts[size - 1] >= position) {
                if (starts[size - 1] > position) {
                    return;
                }
                origins[size - 1] = origin;
                return;
            }
            if (size == starts.length) {
                starts = Arrays.copyOf(starts, size * 2);
                origins = Arrays.copyOf(origins, size * 2);
            }
            starts[size] = position;
            origins[size] = origin;
            size++;
        }

        LocationMap build() {
            return new LocationMap(Arrays.copyOf(starts, size), Arrays.copyOf(origins, size));
        }
    }
}
