package org.errers.engine;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.errers.engine.rule.Rule;
import org.errers.engine.source.SourceLocation;

/**
 * Per-rule timing and match counts of one run, in rule order.
 */
public final class RuleStatistics {
    public static final String CSV_HEADER = "File,Line,Scope,Compilation Time,Run Time,Run Count,Matches,Object";

    /** One row of the table. Times are in nanoseconds. */
    public record Entry(Rule rule, long compileNanos, long runNanos, int runCount, int matches) {}

    private static final class Counter {
        long runNanos;
        int runCount;
        int matches;
    }

    private final Map<Rule, Counter> counters = new LinkedHashMap<>();
    private boolean frozen;

    void register(Rule rule) {
        checkMutable();
        counters.computeIfAbsent(rule, r -> new Counter());
    }

    /** Drops rules that never ran and are no longer part of the run, such as superseded generated rules. */
    void pruneUnused(Collection<Rule> current) {
        checkMutable();
        Set<Rule> kept = new HashSet<>(current);
        counters.entrySet().removeIf(entry -> entry.getValue().runCount == 0 && !kept.contains(entry.getKey()));
    }

    void record(Rule rule, long runNanos, int matches) {
        checkMutable();
        Counter counter = counters.computeIfAbsent(rule, r -> new Counter());
        counter.runNanos += runNanos;
        counter.runCount++;
        counter.matches += matches;
    }

    RuleStatistics freeze() {
        frozen = true;
        return this;
    }

    private void checkMutable() {
        if (frozen) {
            throw new IllegalStateException("Statistics of a finished run cannot change");
        }
    }

    public List<Entry> getEntries() {
        List<Entry> entries = new ArrayList<>(counters.size());
        counters.forEach((rule, counter) -> entries.add(new Entry(rule, rule.getPattern().getCompileNanos(),
                counter.runNanos, counter.runCount, counter.matches)));
        return entries;
    }

    public int getMatches(Rule rule) {
        Counter counter = counters.get(rule);
        return counter == null ? 0 : counter.matches;
    }

    public int getTotalMatches() {
        int total = 0;
        for (Counter counter : counters.values()) {
            total += counter.matches;
        }
        return total;
    }

    public void writeCsv(Writer writer) throws IOException {
        writer.write(CSV_HEADER);
        writer.write('\n');
        for (Entry entry : getEntries()) {
            SourceLocation location = entry.rule().getLocation();
            writer.write(String.join(",",
                    csv(location == null ? "" : location.getSourceName()),
                    location == null ? "" : Integer.toString(location.getLine()),
                    csv(entry.rule().getScope()),
                    seconds(entry.compileNanos()),
                    seconds(entry.runNanos()),
                    Integer.toString(entry.runCount()),
                    Integer.toString(entry.matches()),
                    csv(entry.rule().getPattern().getTemplate())));
            writer.write('\n');
        }
    }

    public String toCsv() {
        StringWriter writer = new StringWriter();
        try {
            writeCsv(writer);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return writer.toString();
    }

    private static String seconds(long nanos) {
        return String.format(Locale.ROOT, "%.6f", nanos / 1e9);
    }

    private static String csv(String value) {
        if (value == null) {
            return "";
        }
        if (value.indexOf(',') < 0 && value.indexOf('"') < 0 && value.indexOf('\n') < 0) {
            return value;
        }
        return '"' + value.replace("\"", "\"\"") + '"';
    }
}
