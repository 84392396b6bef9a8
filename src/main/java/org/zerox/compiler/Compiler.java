package org.zerox.compiler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zerox.compiler.api.CompilationException;
import org.zerox.compiler.api.CompilationResult;
import org.zerox.compiler.api.CompilerErrorCode;
import org.zerox.compiler.api.ICompiler;
import org.zerox.compiler.diagnostics.Diagnostic;
import org.zerox.compiler.diagnostics.DiagnosticsEngine;
import org.zerox.compiler.frontend.CompilerFrontendException;
import org.zerox.compiler.frontend.keyword.KeywordHandlerRegistry;
import org.zerox.compiler.frontend.lexer.Lexer;
import org.zerox.compiler.frontend.lexer.Token;
import org.zerox.compiler.frontend.parser.Parser;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.semantics.ValidationResult;
import org.zerox.compiler.frontend.semantics.Validator;
import org.zerox.compiler.frontend.suggest.KeywordSuggester;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The main compiler implementation. This class orchestrates the front-end pipeline
 * (lexical analysis, parsing and validation) and enforces the go/no-go rule for code
 * generation: errors fail the compilation, warnings do not.
 * <p>
 * Every call creates its own lexer, parser and diagnostics, so one instance may be shared
 * between threads.
 */
public class Compiler implements ICompiler {

    private static final Logger LOG = LoggerFactory.getLogger(Compiler.class);

    private final CompilerOptions options;
    private final KeywordHandlerRegistry registry;
    private final KeywordSuggester suggester;
    private final Validator validator;

    /**
     * Creates a compiler with the default options.
     */
    public Compiler() {
        this(CompilerOptions.defaults());
    }

    /**
     * Creates a compiler with the given options and the built-in keyword handlers.
     * @param options The front-end settings.
     */
    public Compiler(CompilerOptions options) {
        this(options, Parser.defaultRegistry(), new Validator());
    }

    /**
     * Creates a compiler with custom collaborators.
     * @param options   The front-end settings.
     * @param registry  The keyword handlers used by the parser.
     * @param validator The validator run on the parsed AST.
     */
    public Compiler(CompilerOptions options, KeywordHandlerRegistry registry, Validator validator) {
        this.options = options;
        this.registry = registry;
        this.suggester = new KeywordSuggester(options.maxSuggestionDistance());
        this.validator = validator;
    }

    @Override
    public CompilationResult compile(String source, String sourceName) throws CompilationException {
        String name = sourceName != null ? sourceName : DiagnosticsEngine.ANONYMOUS_SOURCE;

        List<AstNode> ast;
        try {
            ast = parse(source);
        } catch (CompilerFrontendException e) {
            throw new CompilationException(e.getMessage(), List.of(toDiagnostic(e, name)), e);
        } catch (RuntimeException e) {
            LOG.error("Unexpected failure while compiling {}", name, e);
            throw new CompilationException("Unexpected error: " + e.getMessage(), List.of(unknownError(e, name)), e);
        }

        ValidationResult validation = validator.validate(ast, name);
        List<Diagnostic> blocking = new ArrayList<>(validation.errors());
        if (options.warningsAsErrors()) {
            blocking.addAll(validation.warnings());
        }
        if (!blocking.isEmpty()) {
            String message = blocking.stream()
                    .map(Diagnostic::formatted)
                    .collect(Collectors.joining("\n", "Validation errors:\n", ""));
            throw new CompilationException(message, blocking, null);
        }

        LOG.debug("Compiled {}: {} top-level nodes, {} warnings", name, ast.size(), validation.warnings().size());
        return new CompilationResult(ast, validation.warnings());
    }

    @Override
    public List<Diagnostic> check(String source, String sourceName) {
        String name = sourceName != null ? sourceName : DiagnosticsEngine.ANONYMOUS_SOURCE;
        try {
            ValidationResult validation = validator.validate(parse(source), name);
            List<Diagnostic> diagnostics = new ArrayList<>(validation.errors());
            diagnostics.addAll(validation.warnings());
            return diagnostics;
        } catch (CompilerFrontendException e) {
            return List.of(toDiagnostic(e, name));
        } catch (RuntimeException e) {
            LOG.error("Unexpected failure while checking {}", name, e);
            return List.of(unknownError(e, name));
        }
    }

    /**
     * Tokenizes the given source with the configured tab width.
     * @param source The source text.
     * @return The tokens, ending with EOF.
     * @throws org.zerox.compiler.frontend.lexer.LexerException on input that cannot be tokenized.
     */
    public List<Token> tokenize(String source) {
        return new Lexer(source, options.tabWidth()).scanTokens();
    }

    private List<AstNode> parse(String source) {
        return new Parser(tokenize(source), registry, suggester).parse();
    }

    private static Diagnostic toDiagnostic(CompilerFrontendException e, String sourceName) {
        return new Diagnostic(Diagnostic.Type.ERROR, e.getCode(), e.getDetail(), sourceName, e.getLine(), e.getColumn());
    }

    private static Diagnostic unknownError(RuntimeException e, String sourceName) {
        return new Diagnostic(Diagnostic.Type.ERROR, CompilerErrorCode.UNKNOWN_ERROR,
                String.valueOf(e.getMessage()), sourceName, 0, 0);
    }

    /**
     * @return The options this compiler was created with.
     */
    public CompilerOptions getOptions() {
        return options;
    }
}
