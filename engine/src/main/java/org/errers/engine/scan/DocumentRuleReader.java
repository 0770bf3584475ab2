package org.errers.engine.scan;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.errers.engine.DocumentRuleError;
import org.errers.engine.ExtractionMessage;
import org.errers.engine.pattern.CompiledPattern;
import org.errers.engine.pattern.PatternCompiler;
import org.errers.engine.pattern.PatternError;
import org.errers.engine.rule.Phase;
import org.errers.engine.rule.Provenance;
import org.errers.engine.rule.ReplacementTemplate;
import org.errers.engine.rule.Rule;
import org.errers.engine.scan.grammar.DocumentRuleBaseVisitor;
import org.errers.engine.scan.grammar.DocumentRuleLexer;
import org.errers.engine.scan.grammar.DocumentRuleParser;
import org.errers.engine.source.SourceFile;
import org.errers.engine.source.SourceLocation;

/**
 * Reads rules declared in document comments, e.g.
 * <pre>
 * % Rule(r'\\foo%C', r'\g&lt;c1&gt;', iterative=True, phase='main')
 * </pre>
 * Declarations may continue on the following comment lines. A malformed declaration fails the whole run.
 */
public final class DocumentRuleReader {
    private static final Logger LOGGER = Logger.getLogger(DocumentRuleReader.class.getName());
    private static final Pattern COMMENT_LINE = Pattern.compile("^[ \\t]*%(.*)$");
    private static final Pattern CANDIDATE = Pattern.compile("^[ \\t]*Rule\\(", Pattern.MULTILINE);

    private final PatternCompiler compiler;

    public DocumentRuleReader(PatternCompiler compiler) {
        this.compiler = Objects.requireNonNull(compiler, "compiler");
    }

    public List<Rule> read(String text, SourceFile file, List<ExtractionMessage> messages) throws DocumentRuleError {
        String comments = commentText(text);
        List<Rule> rules = new ArrayList<>();
        Matcher candidate = CANDIDATE.matcher(comments);
        while (candidate.find()) {
            int line = lineOf(comments, candidate.start());
            Declaration declaration = parse(comments.substring(candidate.start()), file, line);
            rules.add(toRule(declaration, file, messages));
        }
        if (!rules.isEmpty()) {
            LOGGER.info(() -> "Read " + rules.size() + " document rule(s) from " + file.getName());
        }
        return rules;
    }

    /** The document with non-comment lines blanked and the comment marker removed from comment lines. */
    static String commentText(String text) {
        String[] lines = text.split("\n", -1);
        StringBuilder builder = new StringBuilder(text.length());
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                builder.append('\n');
            }
            Matcher comment = COMMENT_LINE.matcher(lines[i]);
            if (comment.matches()) {
                builder.append(comment.group(1));
            }
        }
        return builder.toString();
    }

    private static int lineOf(String text, int offset) {
        int line = 1;
        for (int i = 0; i < offset; i++) {
            if (text.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }

    private static Declaration parse(String input, SourceFile file, int firstLine) throws DocumentRuleError {
        DocumentRuleLexer lexer = new DocumentRuleLexer(CharStreams.fromString(input, file.getName()));
        ThrowingErrorListener errorListener = new ThrowingErrorListener(firstLine);
        lexer.removeErrorListeners();
        lexer.addErrorListener(errorListener);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        DocumentRuleParser parser = new DocumentRuleParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(errorListener);

        try {
            DocumentRuleParser.RuleDeclarationContext context = parser.ruleDeclaration();
            return new DeclarationVisitor(firstLine).build(context);
        } catch (ParseCancellationException ex) {
            throw new DocumentRuleError("Malformed document rule: " + ex.getMessage(), file.at(firstLine), ex);
        }
    }

    private Rule toRule(Declaration declaration, SourceFile file, List<ExtractionMessage> messages)
            throws DocumentRuleError {
        SourceLocation location = file.at(declaration.line());
        Phase phase = Phase.MAIN;
        if (declaration.phase() != null) {
            String name = declaration.phase().content();
            try {
                phase = Phase.fromName(name);
            } catch (IllegalArgumentException e) {
                throw new DocumentRuleError("Unknown phase '" + name + "' in document rule", location, e);
            }
        }
        for (StringLiteral literal : List.of(declaration.pattern(), declaration.replacement())) {
            if (!literal.raw() && literal.content().indexOf('\\') >= 0) {
                String warning = "String " + literal.text() + " of document rule should carry the 'r' prefix";
                LOGGER.warning(() -> warning + " (" + location + ")");
                messages.add(ExtractionMessage.of(ExtractionMessage.Kind.DOCUMENT_RULE_WARNING, warning, location));
            }
        }
        try {
            CompiledPattern pattern = compiler.compile(declaration.pattern().content(), "document", location);
            ReplacementTemplate replacement = ReplacementTemplate.parse(declaration.replacement().content(), pattern);
            LOGGER.fine(() -> "Document rule " + location + ": " + pattern.getTemplate());
            return new Rule(pattern, replacement, phase, declaration.iterative(), false, Provenance.DOCUMENT_LOCAL);
        } catch (PatternError e) {
            throw new DocumentRuleError("Invalid document rule: " + e.getMessage(), location, e);
        }
    }

    private record StringLiteral(String text, String content, boolean raw) {
        static StringLiteral of(Token token) {
            String text = token.getText();
            boolean raw = text.startsWith("r");
            String quoted = raw ? text.substring(1) : text;
            int quote = quoted.startsWith("'''") || quoted.startsWith("\"\"\"") ? 3 : 1;
            return new StringLiteral(text, quoted.substring(quote, quoted.length() - quote), raw);
        }
    }

    private record Declaration(
            StringLiteral pattern, StringLiteral replacement, boolean iterative, StringLiteral phase, int line) {}

    private static final class DeclarationVisitor extends DocumentRuleBaseVisitor<Void> {
        private final int firstLine;
        private boolean iterative;
        private StringLiteral phase;

        DeclarationVisitor(int firstLine) {
            this.firstLine = firstLine;
        }

        Declaration build(DocumentRuleParser.RuleDeclarationContext context) {
            for (DocumentRuleParser.RuleOptionContext option : context.ruleOption()) {
                visit(option);
            }
            return new Declaration(
                    StringLiteral.of(context.pattern),
                    StringLiteral.of(context.replacement),
                    iterative,
                    phase,
                    firstLine + context.getStart().getLine() - 1);
        }

        @Override
        public Void visitIterativeOption(DocumentRuleParser.IterativeOptionContext ctx) {
            iterative = ctx.value.getType() == DocumentRuleLexer.TRUE;
            return null;
        }

        @Override
        public Void visitPhaseOption(DocumentRuleParser.PhaseOptionContext ctx) {
            phase = StringLiteral.of(ctx.value);
            return null;
        }
    }
}
