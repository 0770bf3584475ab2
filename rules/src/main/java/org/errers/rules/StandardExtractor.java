package org.errers.rules;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.logging.Logger;
import org.errers.engine.ExtractionConfig;
import org.errers.engine.ExtractionException;
import org.errers.engine.ExtractionResult;
import org.errers.engine.SubstitutionEngine;
import org.errers.engine.rule.RuleCatalog;
import org.errers.engine.rule.RuleSetProvider;
import org.errers.engine.source.DocumentSource;

/**
 * Runs the engine with the built-in rule sets, plus the local rule sets of every {@link RuleSetProvider}
 * registered through {@link ServiceLoader}.
 *
 * <p>The catalog is built once; instances are safe to share between threads.
 */
public final class StandardExtractor {
    private static final Logger LOGGER = Logger.getLogger(StandardExtractor.class.getName());

    private final SubstitutionEngine engine;

    public StandardExtractor() {
        this(ServiceLoader.load(RuleSetProvider.class));
    }

    public StandardExtractor(Iterable<? extends RuleSetProvider> localProviders) {
        RuleCatalog.Builder builder = RuleCatalog.builder().include(new StandardRuleSets());
        for (RuleSetProvider provider : localProviders) {
            LOGGER.info(() -> "Loading local rules from " + provider.getClass().getName());
            builder.includeLocal(provider);
        }
        this.engine = new SubstitutionEngine(builder.build());
    }

    public RuleCatalog getCatalog() {
        return engine.getCatalog();
    }

    public ExtractionResult extract(Path document, ExtractionConfig config) throws ExtractionException {
        return engine.extract(DocumentSource.of(document), Optional.empty(), config);
    }

    public ExtractionResult extract(Path document) throws ExtractionException {
        return extract(document, ExtractionConfig.fromSystemProperties());
    }

    /** Extracts in-memory LaTeX text; file insertion is relative to the configured root directory. */
    public ExtractionResult extract(String name, String latex, ExtractionConfig config) throws ExtractionException {
        return engine.extract(DocumentSource.ofText(name, latex), Optional.empty(), config);
    }

    public ExtractionResult extract(String latex) throws ExtractionException {
        return extract("document.tex", latex, ExtractionConfig.defaults());
    }

    /**
     * Writes the extracted text, UTF-8 encoded, to the output path of {@code config}.
     *
     * @return the file written
     */
    public static Path writeOutput(ExtractionResult result, ExtractionConfig config, DocumentSource source)
            throws ExtractionException {
        Objects.requireNonNull(result, "result");
        Path output = config.resolveOutputPath(source);
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(output, result.getText(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ExtractionException("Failed to write " + output, e);
        }
        LOGGER.info(() -> "Wrote " + output);
        return output;
    }
}
