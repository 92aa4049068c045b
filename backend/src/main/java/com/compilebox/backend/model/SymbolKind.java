package com.compilebox.backend.model;

/**
 * What AST mining decided a name refers to. {@link #tag()} is the value put
 * into {@link Token#semanticTag()}.
 */
public enum SymbolKind {
    USER_FUNCTION("userFunction", TokenKind.USER_FUNCTION),
    USER_VARIABLE("userVariable", TokenKind.USER_VARIABLE),
    FUNCTION_PARAMETER("functionParameter", TokenKind.FUNCTION_PARAMETER),
    IMPORTED_CLASS("importedClass", TokenKind.IMPORTED_CLASS),
    IMPORTED_FUNCTION("importedFunction", TokenKind.IMPORTED_FUNCTION);

    private final String    tag;
    private final TokenKind tokenKind;

    SymbolKind(String tag, TokenKind tokenKind) {
        this.tag       = tag;
        this.tokenKind = tokenKind;
    }

    public String tag()          { return tag; }
    public TokenKind tokenKind() { return tokenKind; }
}
