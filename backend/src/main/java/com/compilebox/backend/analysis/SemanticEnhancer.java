package com.compilebox.backend.analysis;

import com.compilebox.backend.config.CompilerProperties;
import com.compilebox.backend.model.SourceUnit;
import com.compilebox.backend.model.SymbolKind;
import com.compilebox.backend.model.Token;
import com.compilebox.backend.model.TokenKind;
import com.compilebox.backend.process.ProcessException;
import com.compilebox.backend.process.ProcessResult;
import com.compilebox.backend.process.ProcessRunner;
import com.compilebox.backend.workspace.Workspace;
import com.compilebox.backend.workspace.WorkspaceManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Refines static tokens with what the compiler knows about the snippet.
 *
 * The snippet is written to a scratch workspace and the compiler is asked
 * for an AST dump; names mined from the dump override the static kind of
 * every matching identifier. Any failure on the way (spawn error, timeout,
 * non-zero exit, I/O) returns the static tokens unchanged.
 */
@Component
public class SemanticEnhancer {

    private static final Logger log = LoggerFactory.getLogger(SemanticEnhancer.class);

    static final String SOURCE_FILE = "main.tri";

    private final WorkspaceManager   workspaces;
    private final ProcessRunner      runner;
    private final CompilerProperties properties;

    public SemanticEnhancer(WorkspaceManager workspaces, ProcessRunner runner, CompilerProperties properties) {
        this.workspaces = workspaces;
        this.runner     = runner;
        this.properties = properties;
    }

    public List<Token> enhance(SourceUnit source, List<Token> staticTokens) {
        return collectSymbols(source)
                .map(symbols -> merge(staticTokens, symbols))
                .orElse(staticTokens);
    }

    /**
     * Run the AST dump for {@code source} and mine it.
     *
     * @return empty when the dump could not be produced
     */
    public Optional<Map<String, SymbolKind>> collectSymbols(SourceUnit source) {
        try (Workspace workspace = workspaces.create("analysis")) {
            Path file = workspace.writeFile(SOURCE_FILE, source.withModulePreamble());

            List<String> command = new ArrayList<>();
            command.add(properties.compilerPath());
            command.addAll(properties.astFlags());
            command.add(file.toAbsolutePath().toString());

            ProcessResult result = runner.run("ast", command, workspace.directory(), properties.compilationTimeout());
            if (!result.success()) {
                log.warn("AST dump exited with code {}, using static tokens only", result.exitCode());
                return Optional.empty();
            }
            return Optional.of(AstSymbolExtractor.extract(result.output()));

        } catch (ProcessException e) {
            log.warn("AST dump failed ({}): {}", e.getKind(), e.getMessage());
            return Optional.empty();
        } catch (IOException e) {
            log.warn("Could not prepare AST dump workspace: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Tokens whose text is a mined symbol take its kind and tag; the rest get
     * the static keyword and type refinements. Literals are never touched.
     */
    static List<Token> merge(List<Token> tokens, Map<String, SymbolKind> symbols) {
        return tokens.stream()
                .map(token -> {
                    if (token.kind().isLiteral()) {
                        return token;
                    }
                    SymbolKind symbol = symbols.get(token.text());
                    return symbol == null ? refine(token) : token.withSymbol(symbol);
                })
                .toList();
    }

    static Token refine(Token token) {
        if (LanguageVocabulary.isKeyword(token.text()) && token.kind() != TokenKind.KEYWORD) {
            return token.withKind(TokenKind.KEYWORD);
        }
        if (LanguageVocabulary.REFINED_TYPE_NAMES.contains(token.text())
                && token.kind() != TokenKind.BUILT_IN_TYPE) {
            return token.withKind(TokenKind.BUILT_IN_TYPE);
        }
        return token;
    }
}
