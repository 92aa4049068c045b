package com.compilebox.backend.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A classified span of one source line. Lines and columns are zero-based;
 * {@code endColumn} is exclusive.
 *
 * @param semanticTag set only when AST mining classified the token's text,
 *                    one of the {@link SymbolKind#tag()} values
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Token(
        int       startLine,
        int       startColumn,
        int       endLine,
        int       endColumn,
        TokenKind kind,
        String    text,
        String    semanticTag
) {
    /** Static-pass token on a single line, without a semantic tag. */
    public static Token of(int line, int startColumn, int endColumn, TokenKind kind, String text) {
        return new Token(line, startColumn, line, endColumn, kind, text, null);
    }

    public Token withSymbol(SymbolKind symbol) {
        return new Token(startLine, startColumn, endLine, endColumn, symbol.tokenKind(), text, symbol.tag());
    }

    public Token withKind(TokenKind newKind) {
        return new Token(startLine, startColumn, endLine, endColumn, newKind, text, semanticTag);
    }
}
