package org.errers.engine;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.errers.engine.scan.DocumentProfile;

/**
 * Outcome of an extraction run: the plain text plus everything recorded while producing it.
 */
public final class ExtractionResult {
    private final String text;
    private final RuleStatistics statistics;
    private final SortedMap<String, Integer> remainingCommands;
    private final List<ExtractionMessage> messages;
    private final Duration elapsed;
    private final TimeoutMode timeoutMode;
    private final DocumentProfile profile;
    private final String patternListing;
    private final String executionTrace;

    ExtractionResult(
            String text,
            RuleStatistics statistics,
            SortedMap<String, Integer> remainingCommands,
            List<ExtractionMessage> messages,
            Duration elapsed,
            TimeoutMode timeoutMode,
            DocumentProfile profile,
            String patternListing,
            String executionTrace) {
        this.text = text;
        this.statistics = statistics.freeze();
        this.remainingCommands = Collections.unmodifiableSortedMap(new TreeMap<>(remainingCommands));
        this.messages = List.copyOf(messages);
        this.elapsed = elapsed;
        this.timeoutMode = timeoutMode;
        this.profile = profile;
        this.patternListing = patternListing;
        this.executionTrace = executionTrace;
    }

    public String getText() {
        return text;
    }

    public RuleStatistics getStatistics() {
        return statistics;
    }

    /** Command tokens left in the text and how often each occurs, sorted by command. */
    public SortedMap<String, Integer> getRemainingCommands() {
        return remainingCommands;
    }

    public List<ExtractionMessage> getMessages() {
        return messages;
    }

    public List<ExtractionMessage> getMessages(ExtractionMessage.Kind kind) {
        return messages.stream().filter(message -> message.getKind() == kind).collect(Collectors.toList());
    }

    public Duration getElapsed() {
        return elapsed;
    }

    public TimeoutMode getTimeoutMode() {
        return timeoutMode;
    }

    public DocumentProfile getProfile() {
        return profile;
    }

    public Optional<String> getPatternListing() {
        return Optional.ofNullable(patternListing);
    }

    public Optional<String> getExecutionTrace() {
        return Optional.ofNullable(executionTrace);
    }
}
