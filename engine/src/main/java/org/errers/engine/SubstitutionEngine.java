package org.errers.engine;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.errers.engine.pattern.CompiledPattern;
import org.errers.engine.pattern.DeadlineCharSequence;
import org.errers.engine.pattern.MatchTimeoutException;
import org.errers.engine.pattern.PatternCompiler;
import org.errers.engine.rule.Phase;
import org.errers.engine.rule.ReplacementContext;
import org.errers.engine.rule.Rule;
import org.errers.engine.rule.RuleCatalog;
import org.errers.engine.rule.RuleComposer;
import org.errers.engine.rule.RuleList;
import org.errers.engine.rule.RuleMatch;
import org.errers.engine.rule.RuleOutcome;
import org.errers.engine.scan.AutoRuleSynthesizer;
import org.errers.engine.scan.DefinitionRecord;
import org.errers.engine.scan.DocumentProfile;
import org.errers.engine.scan.DocumentRuleReader;
import org.errers.engine.scan.InputEncoding;
import org.errers.engine.scan.MacroScanner;
import org.errers.engine.source.DocumentBuffer;
import org.errers.engine.source.DocumentSource;
import org.errers.engine.source.FileInserter;
import org.errers.engine.source.LocationMap;
import org.errers.engine.source.SourceLocation;
import org.errers.engine.source.TextEdit;

/**
 * Runs the phases insertion, removal, setup, main and cleanup over a document and returns the plain text.
 *
 * <p>The engine itself is stateless and may be shared; every call to {@link #extract} owns its buffer,
 * statistics and diagnostics.
 */
public final class SubstitutionEngine {
    private static final Logger LOGGER = Logger.getLogger(SubstitutionEngine.class.getName());
    private static final Pattern REMAINING_COMMAND = Pattern.compile("\\\\(?:[a-zA-Z]++|.)");

    private final RuleCatalog catalog;
    private final PatternCompiler compiler = new PatternCompiler();
    private final MacroScanner scanner = new MacroScanner();

    public SubstitutionEngine(RuleCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    public RuleCatalog getCatalog() {
        return catalog;
    }

    public ExtractionResult extract(DocumentSource source, Optional<String> compilerLog, ExtractionConfig config)
            throws ExtractionException {
        return extract(source, compilerLog, config, new ExtractionCancellation());
    }

    public ExtractionResult extract(
            DocumentSource source,
            Optional<String> compilerLog,
            ExtractionConfig config,
            ExtractionCancellation cancellation)
            throws ExtractionException {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(compilerLog, "compilerLog");
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(cancellation, "cancellation");
        long started = System.nanoTime();
        byte[] content;
        try {
            content = source.readBytes();
        } catch (IOException e) {
            throw new ExtractionException("Failed to read document " + source.getName(), e);
        }
        InputEncoding.DecodedText decoded = InputEncoding.decode(content);
        LOGGER.info(() -> "Extracting " + source.getName() + " (" + decoded.charset().name() + ")");
        Optional<String> log = compilerLog.isPresent() ? compilerLog : source.findCompilerLog();
        Run run = new Run(source, decoded, config, cancellation);
        return run.execute(log, started);
    }

    private record Splice(String text, LocationMap locationMap) {}

    private record Application(int matches, boolean changed) {}

    /** State of one extraction. */
    private final class Run implements ReplacementContext {
        private final DocumentSource source;
        private final ExtractionConfig config;
        private final ExtractionCancellation cancellation;
        private final DocumentBuffer buffer;
        private final FileInserter inserter;
        private final List<ExtractionMessage> messages = new ArrayList<>();
        private final RuleStatistics statistics = new RuleStatistics();
        private final Set<Rule> timedOut = new HashSet<>();
        private final ExecutionTrace trace;
        private final AutoRuleSynthesizer synthesizer;
        private final RuleComposer composer;
        private int matchStart;
        private Splice splice;

        Run(DocumentSource source,
                InputEncoding.DecodedText decoded,
                ExtractionConfig config,
                ExtractionCancellation cancellation) {
            this.source = source;
            this.config = config;
            this.cancellation = cancellation;
            this.buffer = new DocumentBuffer(decoded.text(), LocationMap.of(decoded.text(), source.getFile()));
            Path base = config.getRootDirectory().or(source::getDirectory).orElse(null);
            this.inserter = new FileInserter(base, decoded.charset());
            this.trace = new ExecutionTrace(config.isExecutionTrace());
            this.synthesizer = new AutoRuleSynthesizer(compiler, config.getAutoRulePolicy());
            this.composer = new RuleComposer(config.isAutoRules(), config.isDefaultRules(), config.isLocalRules());
        }

        ExtractionResult execute(Optional<String> log, long started) throws ExtractionException {
            messages.addAll(catalog.getCompilationErrors());
            DocumentProfile profile = DocumentProfile.detect(buffer.getText(), log);
            List<Rule> documentRules;
            try {
                documentRules = new DocumentRuleReader(compiler).read(buffer.getText(), source.getFile(), messages);
            } catch (DocumentRuleError e) {
                LOGGER.severe(e.getMessage());
                throw new DocumentRuleError(e, messages);
            }

            List<ExtractionMessage> scanMessages = new ArrayList<>();
            List<DefinitionRecord> definitions = scanner.scan(buffer, scanMessages);
            RuleList rules = compose(profile, documentRules, definitions, scanMessages);

            for (Phase phase : Phase.values()) {
                checkCancelled();
                LOGGER.fine(() -> "Phase " + phase.getName());
                trace.enter("phase " + phase.getName());
                if (phase == Phase.MAIN) {
                    runMain(rules);
                } else {
                    runRules(rules.getRules(phase));
                }
                trace.exit();
                if (phase == Phase.INSERTION) {
                    List<ExtractionMessage> rescanMessages = new ArrayList<>();
                    List<DefinitionRecord> rescanned = scanner.scan(buffer, rescanMessages);
                    if (!rescanned.equals(definitions)) {
                        LOGGER.fine("Inserted files declare macros, recomposing rules");
                        definitions = rescanned;
                        scanMessages = rescanMessages;
                        rules = compose(profile, documentRules, definitions, scanMessages);
                    }
                    messages.addAll(scanMessages);
                }
            }

            SortedMap<String, Integer> remaining = remainingCommands(buffer.getText());
            if (!remaining.isEmpty()) {
                LOGGER.warning(() -> "Commands left in the output: " + remaining);
            }
            Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
            LOGGER.info(() -> "Extracted " + source.getName() + " in " + elapsed.toMillis() + " ms");
            return new ExtractionResult(
                    buffer.getText(),
                    statistics,
                    remaining,
                    messages,
                    elapsed,
                    config.getTimeoutMode(),
                    profile,
                    config.isPatternListing() ? listing(rules) : null,
                    trace.getText());
        }

        private RuleList compose(
                DocumentProfile profile,
                List<Rule> documentRules,
                List<DefinitionRecord> definitions,
                List<ExtractionMessage> scanMessages) {
            List<Rule> generated = config.isAutoRules() ? synthesizer.synthesize(definitions, scanMessages) : List.of();
            RuleList rules = composer.compose(catalog, profile.ruleSetKeys(), documentRules, generated);
            statistics.pruneUnused(rules.all());
            rules.all().forEach(statistics::register);
            return rules;
        }

        private void runMain(RuleList rules) throws ExtractionException {
            List<Rule> main = rules.getRules(Phase.MAIN);
            List<Rule> braces = rules.getBraceCleanupRules();
            if (config.isSinglePass()) {
                runRules(main);
                runRules(braces);
                return;
            }
            int sweeps = 0;
            boolean bracesChanged;
            do {
                boolean changed;
                do {
                    changed = runRules(main);
                    sweeps++;
                } while (changed && sweeps < config.getMaxIterations());
                bracesChanged = runRules(braces);
            } while (bracesChanged && sweeps < config.getMaxIterations());
            if (sweeps >= config.getMaxIterations()) {
                String message = "Main phase stopped after " + sweeps + " sweeps without reaching a fixpoint";
                LOGGER.severe(message);
                messages.add(ExtractionMessage.of(ExtractionMessage.Kind.TIMEOUT_ERROR, message, null));
            }
        }

        /** Applies each rule once in order; returns whether the buffer changed. */
        private boolean runRules(List<Rule> rules) throws ExtractionException {
            boolean changed = false;
            for (Rule rule : rules) {
                checkCancelled();
                if (config.getTimeoutMode() == TimeoutMode.ENFORCED && timedOut.contains(rule)) {
                    continue;
                }
                RuleOutcome outcome = apply(rule);
                statistics.record(rule, outcome.getElapsedNanos(), outcome.getMatches());
                report(rule, outcome);
                changed |= outcome.isChanged();
            }
            return changed;
        }

        private RuleOutcome apply(Rule rule) throws ExtractionException {
            long startedAt = System.nanoTime();
            long deadline = startedAt + config.getRuleTimeout().toNanos();
            DocumentBuffer.Snapshot before = buffer.snapshot();
            int matches = 0;
            boolean changed = false;
            int iterations = 0;
            try {
                while (true) {
                    Application application = applyOnce(rule, deadline);
                    matches += application.matches();
                    if (!application.changed()) {
                        break;
                    }
                    changed = true;
                    iterations++;
                    if (!rule.isIterative()) {
                        break;
                    }
                    if (iterations >= config.getMaxIterations()) {
                        return RuleOutcome.iterationLimit(matches, System.nanoTime() - startedAt);
                    }
                }
            } catch (MatchTimeoutException e) {
                splice = null;
                if (e.isCancelled()) {
                    throw new ExtractionException("Extraction cancelled", buffer.locate(matchStart), messages, e);
                }
                // Earlier iterations of an iterative rule are undone as well.
                buffer.restore(before);
                return RuleOutcome.timedOut(matches, false, System.nanoTime() - startedAt);
            } catch (UncheckedIOException e) {
                throw new ExtractionException(
                        "Failed to read inserted file: " + e.getMessage(), buffer.locate(matchStart), messages, e);
            } catch (RuntimeException e) {
                splice = null;
                return RuleOutcome.failed(
                        matches, changed, System.nanoTime() - startedAt, e, buffer.locate(matchStart));
            }
            long elapsed = System.nanoTime() - startedAt;
            if (config.getTimeoutMode() == TimeoutMode.ADVISORY && elapsed > config.getRuleTimeout().toNanos()) {
                return RuleOutcome.timedOut(matches, changed, elapsed);
            }
            return RuleOutcome.applied(matches, changed, elapsed);
        }

        private Application applyOnce(Rule rule, long deadline) {
            String text = buffer.getText();
            CharSequence input = config.getTimeoutMode() == TimeoutMode.ENFORCED
                    ? new DeadlineCharSequence(text, deadline, cancellation::isCancelled)
                    : text;
            CompiledPattern pattern = rule.getPattern();
            Matcher matcher = pattern.matcher(input);
            StringBuilder output = null;
            List<TextEdit> edits = new ArrayList<>();
            int last = 0;
            int count = 0;
            while (pattern.find(matcher, text)) {
                count++;
                int start = matcher.start();
                int end = matcher.end();
                matchStart = start;
                String replacement = rule.getReplacement().apply(new RuleMatch(matcher, pattern, this));
                Splice inserted = splice;
                splice = null;
                if (inserted == null && text.regionMatches(start, replacement, 0, replacement.length())
                        && replacement.length() == end - start) {
                    continue;
                }
                if (output == null) {
                    output = new StringBuilder(text.length() + 64);
                }
                output.append(text, last, start).append(replacement);
                last = end;
                int offset = inserted == null || inserted.text().isEmpty() ? -1 : replacement.lastIndexOf(inserted.text());
                edits.add(offset < 0
                        ? TextEdit.replace(start, end, replacement.length())
                        : new TextEdit(start, end, replacement.length(), inserted.locationMap(), offset));
            }
            if (output == null) {
                return new Application(count, false);
            }
            output.append(text, last, text.length());
            buffer.apply(output.toString(), edits);
            return new Application(count, true);
        }

        private void report(Rule rule, RuleOutcome outcome) {
            switch (outcome.getStatus()) {
                case APPLIED -> {
                    if (outcome.getMatches() > 0) {
                        trace.line(rule.describe() + " -> " + outcome.getMatches() + " match(es)");
                    }
                }
                case TIMED_OUT -> {
                    trace.line(rule.describe() + " -> timeout");
                    // Reported once; an enforced timeout also takes the rule out of the rest of the run.
                    if (timedOut.add(rule)) {
                        String message = String.format(Locale.ROOT, "Rule exceeded its time budget of %.3f s (%s)",
                                config.getRuleTimeout().toNanos() / 1e9,
                                config.getTimeoutMode() == TimeoutMode.ENFORCED ? "aborted" : "result kept");
                        LOGGER.severe(() -> message + ": " + rule.describe());
                        messages.add(new ExtractionMessage(
                                ExtractionMessage.Kind.TIMEOUT_ERROR, message, rule.getLocation(), rule.describe()));
                    }
                }
                case ITERATION_LIMIT -> {
                    String message = "Iterative rule stopped after " + config.getMaxIterations() + " iterations";
                    LOGGER.severe(() -> message + ": " + rule.describe());
                    trace.line(rule.describe() + " -> iteration limit");
                    messages.add(new ExtractionMessage(
                            ExtractionMessage.Kind.TIMEOUT_ERROR, message, rule.getLocation(), rule.describe()));
                }
                case FAILED -> {
                    String message = "Replacement failed: " + outcome.getFailure();
                    LOGGER.log(Level.SEVERE, message + " (" + outcome.getFailureLocation() + ") in "
                            + rule.describe(), outcome.getFailure());
                    trace.line(rule.describe() + " -> failed");
                    messages.add(new ExtractionMessage(ExtractionMessage.Kind.RULE_RUNTIME_ERROR, message,
                            outcome.getFailureLocation(), rule.describe()));
                }
            }
        }

        private void checkCancelled() throws ExtractionException {
            if (cancellation.isCancelled()) {
                throw new ExtractionException("Extraction cancelled", null, messages, null);
            }
        }

        @Override
        public SourceLocation location() {
            return buffer.locate(matchStart);
        }

        @Override
        public String insertFile(String name, String defaultExtension) {
            FileInserter.Insertion insertion = inserter.insert(name, defaultExtension, buffer.fileAt(matchStart));
            if (insertion.isMissing()) {
                SourceLocation location = location();
                LOGGER.warning(() -> insertion.problem() + " (" + location + ")");
                messages.add(ExtractionMessage.of(
                        ExtractionMessage.Kind.MISSING_FILE_WARNING, insertion.problem(), location));
                return "";
            }
            LOGGER.info(() -> "Inserted " + name + " at " + location());
            splice = new Splice(insertion.text(), insertion.locationMap());
            return insertion.text();
        }

        @Override
        public String documentStem() {
            return source.getStem();
        }
    }

    private static SortedMap<String, Integer> remainingCommands(String text) {
        SortedMap<String, Integer> tally = new TreeMap<>();
        Matcher matcher = REMAINING_COMMAND.matcher(text);
        while (matcher.find()) {
            tally.merge(matcher.group(), 1, Integer::sum);
        }
        return tally;
    }

    private static String listing(RuleList rules) {
        StringBuilder builder = new StringBuilder();
        for (Rule rule : rules.all()) {
            builder.append(rule.getScope());
            if (rule.getLocation() != null) {
                builder.append(' ').append(rule.getLocation());
            }
            builder.append('\n')
                    .append("  template: ").append(rule.getPattern().getTemplate()).append('\n')
                    .append("  regex:    ").append(rule.getPattern().getRegex()).append('\n')
                    .append("  replace:  ").append(rule.describeReplacement()).append('\n');
        }
        return builder.toString();
    }
}
